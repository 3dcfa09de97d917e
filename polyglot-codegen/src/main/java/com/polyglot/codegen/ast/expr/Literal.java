package com.polyglot.codegen.ast.expr;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.ExpressionVisitor;
import com.polyglot.codegen.ast.SourceSpan;

import java.util.Collections;
import java.util.List;

/**
 * 字面量。数字保留源码写法，字符串保存解码后的内容。
 */
public class Literal extends Expression {
    private final LiteralKind literalKind;
    private final String value;

    public Literal(SourceSpan span, LiteralKind literalKind, String value) {
        super(span);
        this.literalKind = literalKind;
        this.value = value;
    }

    public LiteralKind getLiteralKind() {
        return literalKind;
    }

    public String getValue() {
        return value;
    }

    public boolean isString() {
        return literalKind == LiteralKind.STRING;
    }

    public boolean isNumber() {
        return literalKind == LiteralKind.NUMBER;
    }

    /** 是否为十进制整数字面量（常量折叠的结果可带负号） */
    public boolean isIntegral() {
        if (literalKind != LiteralKind.NUMBER || value.isEmpty()) {
            return false;
        }
        int start = value.charAt(0) == '-' && value.length() > 1 ? 1 : 0;
        for (int i = start; i < value.length(); i++) {
            char c = value.charAt(i);
            if ((c < '0' || c > '9') && c != '_') {
                return false;
            }
        }
        return true;
    }

    /** 空值字面量：null 或 undefined */
    public boolean isNullish() {
        return literalKind == LiteralKind.NULL || literalKind == LiteralKind.UNDEFINED;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }

    @Override
    public String getKind() {
        switch (literalKind) {
            case STRING:    return "StringLiteral";
            case NUMBER:    return "NumericLiteral";
            case BOOLEAN:   return "true".equals(value) ? "TrueKeyword" : "FalseKeyword";
            case NULL:      return "NullKeyword";
            default:        return "UndefinedKeyword";
        }
    }

    @Override
    public List<AstNode> getChildren() {
        return Collections.emptyList();
    }

    /**
     * 字面量种类
     */
    public enum LiteralKind {
        STRING,
        NUMBER,
        BOOLEAN,
        NULL,
        UNDEFINED
    }
}
