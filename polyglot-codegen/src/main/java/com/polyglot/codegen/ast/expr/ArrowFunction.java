package com.polyglot.codegen.ast.expr;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.ExpressionVisitor;
import com.polyglot.codegen.ast.SourceSpan;
import com.polyglot.codegen.ast.decl.FunctionLike;
import com.polyglot.codegen.ast.decl.Parameter;
import com.polyglot.codegen.ast.stmt.Block;
import com.polyglot.codegen.ast.type.TypeNode;

import java.util.List;

/**
 * 箭头函数与函数表达式。函数体二选一：代码块或单个表达式。
 */
public class ArrowFunction extends Expression implements FunctionLike {
    private final List<Parameter> parameters;
    private final TypeNode returnType;
    private final Block blockBody;
    private final Expression expressionBody;
    private final boolean async;
    private final boolean functionExpression;

    public ArrowFunction(SourceSpan span, List<Parameter> parameters, TypeNode returnType,
                         Block blockBody, Expression expressionBody,
                         boolean async, boolean functionExpression) {
        super(span);
        this.parameters = parameters;
        this.returnType = returnType;
        this.blockBody = blockBody;
        this.expressionBody = expressionBody;
        this.async = async;
        this.functionExpression = functionExpression;
    }

    @Override
    public List<Parameter> getParameters() {
        return parameters;
    }

    @Override
    public TypeNode getReturnType() {
        return returnType;
    }

    @Override
    public Block getBody() {
        return blockBody;
    }

    public Expression getExpressionBody() {
        return expressionBody;
    }

    public boolean hasExpressionBody() {
        return expressionBody != null;
    }

    /** 源码写作 function 表达式而非箭头函数 */
    public boolean isFunctionExpression() {
        return functionExpression;
    }

    @Override
    public boolean isAsync() {
        return async;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitArrowFunction(this, context);
    }

    @Override
    public String getKind() {
        return functionExpression ? "FunctionExpression" : "ArrowFunction";
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(parameters, returnType, blockBody, expressionBody);
    }
}
