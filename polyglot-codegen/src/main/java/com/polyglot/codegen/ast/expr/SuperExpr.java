package com.polyglot.codegen.ast.expr;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.ExpressionVisitor;
import com.polyglot.codegen.ast.SourceSpan;

import java.util.Collections;
import java.util.List;

/**
 * super
 */
public class SuperExpr extends Expression {

    public SuperExpr(SourceSpan span) {
        super(span);
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitSuperExpr(this, context);
    }

    @Override
    public String getKind() {
        return "SuperKeyword";
    }

    @Override
    public List<AstNode> getChildren() {
        return Collections.emptyList();
    }
}
