package com.polyglot.codegen.ast.expr;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.ExpressionVisitor;
import com.polyglot.codegen.ast.SourceSpan;

import java.util.Collections;
import java.util.List;

/**
 * 模型未覆盖的表达式，生成时按源码区间原样输出
 */
public class UnsupportedExpr extends Expression {
    private final String kind;

    public UnsupportedExpr(SourceSpan span, String kind) {
        super(span);
        this.kind = kind;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitUnsupportedExpr(this, context);
    }

    @Override
    public String getKind() {
        return kind;
    }

    @Override
    public List<AstNode> getChildren() {
        return Collections.emptyList();
    }
}
