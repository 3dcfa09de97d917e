package com.polyglot.codegen.ast.expr;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.ExpressionVisitor;
import com.polyglot.codegen.ast.SourceSpan;

import java.util.List;

/**
 * 对象创建 {@code new Callee(args)}
 */
public class NewExpr extends Expression {
    private final Expression callee;
    private final List<Expression> arguments;

    public NewExpr(SourceSpan span, Expression callee, List<Expression> arguments) {
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
        return visitor.visitNewExpr(this, context);
    }

    @Override
    public String getKind() {
        return "NewExpression";
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(callee, arguments);
    }
}
