package com.polyglot.codegen.ast.expr;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.ExpressionVisitor;
import com.polyglot.codegen.ast.SourceSpan;

import java.util.List;

/**
 * 括号表达式
 */
public class ParenthesizedExpr extends Expression {
    private final Expression expression;

    public ParenthesizedExpr(SourceSpan span, Expression expression) {
        super(span);
        this.expression = expression;
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitParenthesizedExpr(this, context);
    }

    @Override
    public String getKind() {
        return "ParenthesizedExpression";
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(expression);
    }
}
