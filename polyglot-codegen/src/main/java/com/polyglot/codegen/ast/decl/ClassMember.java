package com.polyglot.codegen.ast.decl;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.Modifier;
import com.polyglot.codegen.ast.SourceSpan;

import java.util.List;

/**
 * 类与接口成员基类
 */
public abstract class ClassMember extends AstNode {
    protected final List<Modifier> modifiers;
    protected final String name;

    protected ClassMember(SourceSpan span, List<Modifier> modifiers, String name) {
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

    public boolean isStatic() {
        return hasModifier(Modifier.STATIC);
    }
}
