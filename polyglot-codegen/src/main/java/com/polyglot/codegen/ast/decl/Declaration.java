package com.polyglot.codegen.ast.decl;

import com.polyglot.codegen.ast.Modifier;
import com.polyglot.codegen.ast.SourceSpan;
import com.polyglot.codegen.ast.stmt.Statement;

import java.util.List;

/**
 * 声明基类。声明可以出现在任何语句位置。
 */
public abstract class Declaration extends Statement {
    protected final List<Modifier> modifiers;
    protected final String name;

    protected Declaration(SourceSpan span, List<Modifier> modifiers, String name) {
        super(span);
        this.modifiers = modifiers;
        this.name = name;
    }

    public List<Modifier> getModifiers() {
        return modifiers;
    }

    public String getName() {
        return name;
    }

    public boolean hasModifier(Modifier modifier) {
        return modifiers.contains(modifier);
    }

    public boolean isExported() {
        return hasModifier(Modifier.EXPORT);
    }
}
