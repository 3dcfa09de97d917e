package com.polyglot.codegen.ast.expr;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.ExpressionVisitor;
import com.polyglot.codegen.ast.SourceSpan;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceSpan span) {
        super(span);
    }

    public abstract <R, C> R accept(ExpressionVisitor<R, C> visitor, C context);
}
