package com.polyglot.codegen.ast.decl;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.Modifier;
import com.polyglot.codegen.ast.SourceSpan;
import com.polyglot.codegen.ast.expr.Expression;
import com.polyglot.codegen.ast.type.TypeNode;

import java.util.List;

/**
 * 属性声明（类字段或接口属性签名）
 */
public class PropertyDecl extends ClassMember {
    private final TypeNode type;
    private final Expression initializer;
    private final boolean optional;

    public PropertyDecl(SourceSpan span, List<Modifier> modifiers, String name,
                        TypeNode type, Expression initializer, boolean optional) {
        super(span, modifiers, name);
        this.type = type;
        this.initializer = initializer;
        this.optional = optional;
    }

    public TypeNode getType() {
        return type;
    }

    public Expression getInitializer() {
        return initializer;
    }

    public boolean isOptional() {
        return optional;
    }

    public boolean isReadonly() {
        return hasModifier(Modifier.READONLY);
    }

    @Override
    public String getKind() {
        return "PropertyDeclaration";
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(type, initializer);
    }
}
