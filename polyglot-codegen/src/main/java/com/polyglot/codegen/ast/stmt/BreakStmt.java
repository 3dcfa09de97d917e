package com.polyglot.codegen.ast.stmt;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.SourceSpan;
import com.polyglot.codegen.ast.StatementVisitor;

import java.util.Collections;
import java.util.List;

/**
 * break 语句
 */
public class BreakStmt extends Statement {
    private final String label;

    public BreakStmt(SourceSpan span, String label) {
        super(span);
        this.label = label;
    }

    /** 目标标签，无标签时为 null */
    public String getLabel() {
        return label;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitBreakStmt(this, context);
    }

    @Override
    public String getKind() {
        return "BreakStatement";
    }

    @Override
    public List<AstNode> getChildren() {
        return Collections.emptyList();
    }
}
