package com.polyglot.codegen.ast.type;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.SourceSpan;

import java.util.List;

/**
 * 数组类型 {@code T[]}
 */
public class ArrayType extends TypeNode {
    private final TypeNode elementType;

    public ArrayType(SourceSpan span, TypeNode elementType) {
        super(span);
        this.elementType = elementType;
    }

    public TypeNode getElementType() {
        return elementType;
    }

    @Override
    public <R> R accept(TypeNodeVisitor<R> visitor) {
        return visitor.visitArray(this);
    }

    @Override
    public String getKind() {
        return "ArrayType";
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(elementType);
    }
}
