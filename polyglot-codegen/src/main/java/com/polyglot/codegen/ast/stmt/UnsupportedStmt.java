package com.polyglot.codegen.ast.stmt;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.SourceSpan;
import com.polyglot.codegen.ast.StatementVisitor;

import java.util.Collections;
import java.util.List;

/**
 * 模型未覆盖的语句或声明（for-in、标签语句等），保留种类名与源码区间
 */
public class UnsupportedStmt extends Statement {
    private final String kind;

    public UnsupportedStmt(SourceSpan span, String kind) {
        super(span);
        this.kind = kind;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitUnsupportedStmt(this, context);
    }

    @Override
    public String getKind() {
        return kind;
    }

    @Override
    public List<AstNode> getChildren() {
        return Collections.emptyList();
    }
}
