package com.polyglot.codegen.ast.stmt;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.SourceSpan;
import com.polyglot.codegen.ast.StatementVisitor;
import com.polyglot.codegen.ast.expr.Expression;

import java.util.List;

/**
 * throw 语句
 */
public class ThrowStmt extends Statement {
    private final Expression expression;

    public ThrowStmt(SourceSpan span, Expression expression) {
        super(span);
        this.expression = expression;
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitThrowStmt(this, context);
    }

    @Override
    public String getKind() {
        return "ThrowStatement";
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(expression);
    }
}
