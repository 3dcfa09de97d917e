package com.polyglot.codegen.ast.type;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.SourceSpan;

import java.util.List;

/**
 * 元组类型 {@code [A, B]}
 */
public class TupleType extends TypeNode {
    private final List<TypeNode> elements;

    public TupleType(SourceSpan span, List<TypeNode> elements) {
        super(span);
        this.elements = elements;
    }

    public List<TypeNode> getElements() {
        return elements;
    }

    @Override
    public <R> R accept(TypeNodeVisitor<R> visitor) {
        return visitor.visitTuple(this);
    }

    @Override
    public String getKind() {
        return "TupleType";
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(elements);
    }
}
