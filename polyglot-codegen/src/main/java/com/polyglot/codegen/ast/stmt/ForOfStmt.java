package com.polyglot.codegen.ast.stmt;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.SourceSpan;
import com.polyglot.codegen.ast.StatementVisitor;
import com.polyglot.codegen.ast.expr.Expression;

import java.util.List;

/**
 * for-of 循环。数组解构 {@code for (const [k, v] of entries)} 时有多个变量名。
 */
public class ForOfStmt extends Statement {
    private final List<String> variableNames;
    private final Expression iterable;
    private final Statement body;

    public ForOfStmt(SourceSpan span, List<String> variableNames, Expression iterable, Statement body) {
        super(span);
        this.variableNames = variableNames;
        this.iterable = iterable;
        this.body = body;
    }

    public List<String> getVariableNames() {
        return variableNames;
    }

    public boolean isDestructuring() {
        return variableNames.size() > 1;
    }

    public Expression getIterable() {
        return iterable;
    }

    public Statement getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitForOfStmt(this, context);
    }

    @Override
    public String getKind() {
        return "ForOfStatement";
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(iterable, body);
    }
}
