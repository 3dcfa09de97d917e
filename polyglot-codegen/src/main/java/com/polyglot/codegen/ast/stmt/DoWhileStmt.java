package com.polyglot.codegen.ast.stmt;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.SourceSpan;
import com.polyglot.codegen.ast.StatementVisitor;
import com.polyglot.codegen.ast.expr.Expression;

import java.util.List;

/**
 * do-while 循环
 */
public class DoWhileStmt extends Statement {
    private final Statement body;
    private final Expression condition;

    public DoWhileStmt(SourceSpan span, Statement body, Expression condition) {
        super(span);
        this.body = body;
        this.condition = condition;
    }

    public Statement getBody() {
        return body;
    }

    public Expression getCondition() {
        return condition;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitDoWhileStmt(this, context);
    }

    @Override
    public String getKind() {
        return "DoStatement";
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(body, condition);
    }
}
