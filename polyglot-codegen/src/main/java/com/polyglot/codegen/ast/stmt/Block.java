package com.polyglot.codegen.ast.stmt;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.SourceSpan;
import com.polyglot.codegen.ast.StatementVisitor;

import java.util.List;

/**
 * 代码块
 */
public class Block extends Statement {
    private final List<Statement> statements;

    public Block(SourceSpan span, List<Statement> statements) {
        super(span);
        this.statements = statements;
    }

    public List<Statement> getStatements() {
        return statements;
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitBlock(this, context);
    }

    @Override
    public String getKind() {
        return "Block";
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(statements);
    }
}
