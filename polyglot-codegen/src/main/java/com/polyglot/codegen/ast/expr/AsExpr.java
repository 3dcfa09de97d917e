package com.polyglot.codegen.ast.expr;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.ExpressionVisitor;
import com.polyglot.codegen.ast.SourceSpan;
import com.polyglot.codegen.ast.type.TypeNode;

import java.util.List;

/**
 * 类型断言 {@code expr as Type}
 */
public class AsExpr extends Expression {
    private final Expression expression;
    private final TypeNode type;

    public AsExpr(SourceSpan span, Expression expression, TypeNode type) {
        super(span);
        this.expression = expression;
        this.type = type;
    }

    public Expression getExpression() {
        return expression;
    }

    public TypeNode getType() {
        return type;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitAsExpr(this, context);
    }

    @Override
    public String getKind() {
        return "AsExpression";
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(expression, type);
    }
}
