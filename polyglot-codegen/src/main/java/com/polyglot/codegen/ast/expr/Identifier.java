package com.polyglot.codegen.ast.expr;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.ExpressionVisitor;
import com.polyglot.codegen.ast.SourceSpan;

import java.util.Collections;
import java.util.List;

/**
 * 标识符
 */
public class Identifier extends Expression {
    private final String name;

    public Identifier(SourceSpan span, String name) {
        super(span);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitIdentifier(this, context);
    }

    @Override
    public String getKind() {
        return "Identifier";
    }

    @Override
    public List<AstNode> getChildren() {
        return Collections.emptyList();
    }
}
