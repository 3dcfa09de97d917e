package com.polyglot.codegen.ast.decl;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.SourceSpan;
import com.polyglot.codegen.ast.type.TypeNode;

import java.util.List;

/**
 * 泛型参数 {@code <T extends Bound>}
 */
public class TypeParameter extends AstNode {
    private final String name;
    private final TypeNode constraint;

    public TypeParameter(SourceSpan span, String name, TypeNode constraint) {
        super(span);
        this.name = name;
        this.constraint = constraint;
    }

    public String getName() {
        return name;
    }

    public TypeNode getConstraint() {
        return constraint;
    }

    @Override
    public String getKind() {
        return "TypeParameter";
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(constraint);
    }
}
