package com.polyglot.codegen.ast.stmt;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.SourceSpan;
import com.polyglot.codegen.ast.StatementVisitor;
import com.polyglot.codegen.ast.expr.Expression;

import java.util.List;

/**
 * 表达式语句
 */
public class ExpressionStmt extends Statement {
    private final Expression expression;

    public ExpressionStmt(SourceSpan span, Expression expression) {
        super(span);
        this.expression = expression;
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitExpressionStmt(this, context);
    }

    @Override
    public String getKind() {
        return "ExpressionStatement";
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(expression);
    }
}
