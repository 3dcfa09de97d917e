package com.polyglot.codegen.ast.stmt;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.SourceSpan;
import com.polyglot.codegen.ast.expr.Expression;

import java.util.List;

/**
 * case / default 子句
 */
public class SwitchClause extends AstNode {
    private final Expression label;
    private final List<Statement> statements;

    /**
     * @param label case 值，default 子句为 null
     */
    public SwitchClause(SourceSpan span, Expression label, List<Statement> statements) {
        super(span);
        this.label = label;
        this.statements = statements;
    }

    public Expression getLabel() {
        return label;
    }

    public boolean isDefault() {
        return label == null;
    }

    public List<Statement> getStatements() {
        return statements;
    }

    @Override
    public String getKind() {
        return isDefault() ? "DefaultClause" : "CaseClause";
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(label, statements);
    }
}
