package com.polyglot.codegen.ast.type;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.SourceSpan;
import com.polyglot.codegen.ast.expr.Literal;

import java.util.List;

/**
 * 字面量类型：{@code 'open'}、{@code 42}、{@code true}
 */
public class LiteralType extends TypeNode {
    private final Literal literal;

    public LiteralType(SourceSpan span, Literal literal) {
        super(span);
        this.literal = literal;
    }

    public Literal getLiteral() {
        return literal;
    }

    @Override
    public <R> R accept(TypeNodeVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public String getKind() {
        return "LiteralType";
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(literal);
    }
}
