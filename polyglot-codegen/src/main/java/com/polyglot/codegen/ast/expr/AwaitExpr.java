package com.polyglot.codegen.ast.expr;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.ExpressionVisitor;
import com.polyglot.codegen.ast.SourceSpan;

import java.util.List;

/**
 * await 表达式
 */
public class AwaitExpr extends Expression {
    private final Expression expression;

    public AwaitExpr(SourceSpan span, Expression expression) {
        super(span);
        this.expression = expression;
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitAwaitExpr(this, context);
    }

    @Override
    public String getKind() {
        return "AwaitExpression";
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(expression);
    }
}
