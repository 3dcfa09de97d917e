package com.polyglot.codegen.ast.stmt;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.SourceSpan;
import com.polyglot.codegen.ast.StatementVisitor;

import java.util.Collections;
import java.util.List;

/**
 * continue 语句
 */
public class ContinueStmt extends Statement {
    private final String label;

    public ContinueStmt(SourceSpan span, String label) {
        super(span);
        this.label = label;
    }

    /** 目标标签，无标签时为 null */
    public String getLabel() {
        return label;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitContinueStmt(this, context);
    }

    @Override
    public String getKind() {
        return "ContinueStatement";
    }

    @Override
    public List<AstNode> getChildren() {
        return Collections.emptyList();
    }
}
