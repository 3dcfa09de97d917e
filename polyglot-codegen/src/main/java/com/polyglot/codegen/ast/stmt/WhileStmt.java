package com.polyglot.codegen.ast.stmt;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.SourceSpan;
import com.polyglot.codegen.ast.StatementVisitor;
import com.polyglot.codegen.ast.expr.Expression;

import java.util.List;

/**
 * while 循环
 */
public class WhileStmt extends Statement {
    private final Expression condition;
    private final Statement body;

    public WhileStmt(SourceSpan span, Expression condition, Statement body) {
        super(span);
        this.condition = condition;
        this.body = body;
    }

    public Expression getCondition() {
        return condition;
    }

    public Statement getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitWhileStmt(this, context);
    }

    @Override
    public String getKind() {
        return "WhileStatement";
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(condition, body);
    }
}
