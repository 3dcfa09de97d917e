package com.polyglot.codegen.ast.expr;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.ExpressionVisitor;
import com.polyglot.codegen.ast.SourceSpan;

import java.util.List;

/**
 * 模板字符串 {@code `head${expr}literal...`}
 */
public class TemplateExpr extends Expression {
    private final String head;
    private final List<TemplateSpan> spans;

    public TemplateExpr(SourceSpan span, String head, List<TemplateSpan> spans) {
        super(span);
        this.head = head;
        this.spans = spans;
    }

    /** 第一个插值之前的文本（已解码） */
    public String getHead() {
        return head;
    }

    public List<TemplateSpan> getSpans() {
        return spans;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitTemplateExpr(this, context);
    }

    @Override
    public String getKind() {
        return "TemplateExpression";
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(spans);
    }

    /**
     * 一段插值及其后的文本
     */
    public static final class TemplateSpan extends AstNode {
        private final Expression expression;
        private final String literal;

        public TemplateSpan(SourceSpan span, Expression expression, String literal) {
            super(span);
            this.expression = expression;
            this.literal = literal;
        }

        public Expression getExpression() {
            return expression;
        }

        public String getLiteral() {
            return literal;
        }

        @Override
        public String getKind() {
            return "TemplateSpan";
        }

        @Override
        public List<AstNode> getChildren() {
            return childrenOf(expression);
        }
    }
}
