package com.polyglot.codegen.ast.expr;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.ExpressionVisitor;
import com.polyglot.codegen.ast.SourceSpan;

import java.util.List;

/**
 * 三元表达式 {@code cond ? a : b}
 */
public class ConditionalExpr extends Expression {
    private final Expression condition;
    private final Expression whenTrue;
    private final Expression whenFalse;

    public ConditionalExpr(SourceSpan span, Expression condition, Expression whenTrue, Expression whenFalse) {
        super(span);
        this.condition = condition;
        this.whenTrue = whenTrue;
        this.whenFalse = whenFalse;
    }

    public Expression getCondition() {
        return condition;
    }

    public Expression getWhenTrue() {
        return whenTrue;
    }

    public Expression getWhenFalse() {
        return whenFalse;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitConditionalExpr(this, context);
    }

    @Override
    public String getKind() {
        return "ConditionalExpression";
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(condition, whenTrue, whenFalse);
    }
}
