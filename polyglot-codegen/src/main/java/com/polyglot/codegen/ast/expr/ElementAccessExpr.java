package com.polyglot.codegen.ast.expr;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.ExpressionVisitor;
import com.polyglot.codegen.ast.SourceSpan;

import java.util.List;

/**
 * 下标访问 {@code target[index]}
 */
public class ElementAccessExpr extends Expression {
    private final Expression target;
    private final Expression index;

    public ElementAccessExpr(SourceSpan span, Expression target, Expression index) {
        super(span);
        this.target = target;
        this.index = index;
    }

    public Expression getTarget() {
        return target;
    }

    public Expression getIndex() {
        return index;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitElementAccessExpr(this, context);
    }

    @Override
    public String getKind() {
        return "ElementAccessExpression";
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(target, index);
    }
}
