package com.polyglot.codegen.ast.stmt;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.SourceSpan;
import com.polyglot.codegen.ast.StatementVisitor;
import com.polyglot.codegen.ast.expr.Expression;

import java.util.List;

/**
 * switch 语句
 */
public class SwitchStmt extends Statement {
    private final Expression subject;
    private final List<SwitchClause> clauses;

    public SwitchStmt(SourceSpan span, Expression subject, List<SwitchClause> clauses) {
        super(span);
        this.subject = subject;
        this.clauses = clauses;
    }

    public Expression getSubject() {
        return subject;
    }

    public List<SwitchClause> getClauses() {
        return clauses;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitSwitchStmt(this, context);
    }

    @Override
    public String getKind() {
        return "SwitchStatement";
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(subject, clauses);
    }
}
