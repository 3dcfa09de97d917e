package com.polyglot.codegen.ast.expr;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.ExpressionVisitor;
import com.polyglot.codegen.ast.SourceSpan;

import java.util.List;

/**
 * 属性访问 {@code target.name}，optional 表示 {@code target?.name}
 */
public class PropertyAccessExpr extends Expression {
    private final Expression target;
    private final String name;
    private final boolean optional;

    public PropertyAccessExpr(SourceSpan span, Expression target, String name, boolean optional) {
        super(span);
        this.target = target;
        this.name = name;
        this.optional = optional;
    }

    public Expression getTarget() {
        return target;
    }

    public String getName() {
        return name;
    }

    public boolean isOptional() {
        return optional;
    }

    /** 是否为 {@code this.xxx} */
    public boolean isOnThis() {
        return target instanceof ThisExpr;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitPropertyAccessExpr(this, context);
    }

    @Override
    public String getKind() {
        return "PropertyAccessExpression";
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(target);
    }
}
