package com.polyglot.codegen.ast.type;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.SourceSpan;

import java.util.List;

/**
 * 命名类型引用 {@code Name<A, B>}，也用于 extends / implements 子句
 */
public class TypeReference extends TypeNode {
    private final String name;
    private final List<TypeNode> typeArguments;

    public TypeReference(SourceSpan span, String name, List<TypeNode> typeArguments) {
        super(span);
        this.name = name;
        this.typeArguments = typeArguments;
    }

    public String getName() {
        return name;
    }

    public List<TypeNode> getTypeArguments() {
        return typeArguments;
    }

    public boolean hasTypeArguments() {
        return !typeArguments.isEmpty();
    }

    @Override
    public <R> R accept(TypeNodeVisitor<R> visitor) {
        return visitor.visitReference(this);
    }

    @Override
    public String getKind() {
        return "TypeReference";
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(typeArguments);
    }
}
