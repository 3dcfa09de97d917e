package com.polyglot.codegen.ast.expr;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.ExpressionVisitor;
import com.polyglot.codegen.ast.SourceSpan;

import java.util.List;

/**
 * 数组字面量
 */
public class ArrayLiteral extends Expression {
    private final List<Expression> elements;

    public ArrayLiteral(SourceSpan span, List<Expression> elements) {
        super(span);
        this.elements = elements;
    }

    public List<Expression> getElements() {
        return elements;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitArrayLiteral(this, context);
    }

    @Override
    public String getKind() {
        return "ArrayLiteralExpression";
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(elements);
    }
}
