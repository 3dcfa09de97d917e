package com.polyglot.codegen.ast.expr;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.ExpressionVisitor;
import com.polyglot.codegen.ast.SourceSpan;

import java.util.Collections;
import java.util.List;

/**
 * this
 */
public class ThisExpr extends Expression {

    public ThisExpr(SourceSpan span) {
        super(span);
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitThisExpr(this, context);
    }

    @Override
    public String getKind() {
        return "ThisKeyword";
    }

    @Override
    public List<AstNode> getChildren() {
        return Collections.emptyList();
    }
}
