package com.polyglot.codegen.ast.expr;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.ExpressionVisitor;
import com.polyglot.codegen.ast.SourceSpan;

import java.util.List;

/**
 * 函数调用 {@code callee(args)}
 */
public class CallExpr extends Expression {
    private final Expression callee;
    private final List<Expression> arguments;

    public CallExpr(SourceSpan span, Expression callee, List<Expression> arguments) {
        super(span);
        this.callee = callee;
        this.arguments = arguments;
    }

    public Expression getCallee() {
        return callee;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitCallExpr(this, context);
    }

    @Override
    public String getKind() {
        return "CallExpression";
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(callee, arguments);
    }
}
