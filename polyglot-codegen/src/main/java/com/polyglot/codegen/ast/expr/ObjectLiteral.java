package com.polyglot.codegen.ast.expr;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.ExpressionVisitor;
import com.polyglot.codegen.ast.SourceSpan;

import java.util.List;

/**
 * 对象字面量，属性保持源码顺序
 */
public class ObjectLiteral extends Expression {
    private final List<PropertyAssignment> properties;

    public ObjectLiteral(SourceSpan span, List<PropertyAssignment> properties) {
        super(span);
        this.properties = properties;
    }

    public List<PropertyAssignment> getProperties() {
        return properties;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitObjectLiteral(this, context);
    }

    @Override
    public String getKind() {
        return "ObjectLiteralExpression";
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(properties);
    }
}
