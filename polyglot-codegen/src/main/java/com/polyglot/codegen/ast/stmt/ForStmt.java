package com.polyglot.codegen.ast.stmt;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.SourceSpan;
import com.polyglot.codegen.ast.StatementVisitor;
import com.polyglot.codegen.ast.expr.Expression;

import java.util.List;

/**
 * 计数 for 循环 {@code for (init; condition; incrementor) body}
 */
public class ForStmt extends Statement {
    private final Statement initializer;
    private final Expression condition;
    private final Expression incrementor;
    private final Statement body;

    /**
     * @param initializer {@link com.polyglot.codegen.ast.decl.VariableDecl} 或 {@link ExpressionStmt}，可为 null
     */
    public ForStmt(SourceSpan span, Statement initializer, Expression condition,
                   Expression incrementor, Statement body) {
        super(span);
        this.initializer = initializer;
        this.condition = condition;
        this.incrementor = incrementor;
        this.body = body;
    }

    public Statement getInitializer() {
        return initializer;
    }

    public Expression getCondition() {
        return condition;
    }

    public Expression getIncrementor() {
        return incrementor;
    }

    public Statement getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitForStmt(this, context);
    }

    @Override
    public String getKind() {
        return "ForStatement";
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(initializer, condition, incrementor, body);
    }
}
