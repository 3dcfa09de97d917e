package com.polyglot.codegen.ast.stmt;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.SourceSpan;
import com.polyglot.codegen.ast.StatementVisitor;
import com.polyglot.codegen.ast.expr.Expression;

import java.util.List;

/**
 * if 语句。else if 链表示为 elseBranch 为另一个 IfStmt。
 */
public class IfStmt extends Statement {
    private final Expression condition;
    private final Statement thenBranch;
    private final Statement elseBranch;

    public IfStmt(SourceSpan span, Expression condition, Statement thenBranch, Statement elseBranch) {
        super(span);
        this.condition = condition;
        this.thenBranch = thenBranch;
        this.elseBranch = elseBranch;
    }

    public Expression getCondition() {
        return condition;
    }

    public Statement getThenBranch() {
        return thenBranch;
    }

    public Statement getElseBranch() {
        return elseBranch;
    }

    public boolean hasElse() {
        return elseBranch != null;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitIfStmt(this, context);
    }

    @Override
    public String getKind() {
        return "IfStatement";
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(condition, thenBranch, elseBranch);
    }
}
