package com.polyglot.codegen.ast.stmt;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.SourceSpan;
import com.polyglot.codegen.ast.StatementVisitor;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceSpan span) {
        super(span);
    }

    public abstract <R, C> R accept(StatementVisitor<R, C> visitor, C context);
}
