package com.polyglot.codegen.ast.expr;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.SourceSpan;

import java.util.List;

/**
 * 对象字面量中的一项。
 *
 * <p>key 为 null 表示无法按键值对表达的成员（展开、计算属性名、方法），
 * 此时 value 是一个 {@link UnsupportedExpr}。</p>
 */
public class PropertyAssignment extends AstNode {
    private final String key;
    private final Expression value;
    private final boolean shorthand;

    public PropertyAssignment(SourceSpan span, String key, Expression value, boolean shorthand) {
        super(span);
        this.key = key;
        this.value = value;
        this.shorthand = shorthand;
    }

    public String getKey() {
        return key;
    }

    public Expression getValue() {
        return value;
    }

    /** {@code { name }} 简写形式 */
    public boolean isShorthand() {
        return shorthand;
    }

    @Override
    public String getKind() {
        return shorthand ? "ShorthandPropertyAssignment" : "PropertyAssignment";
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(value);
    }
}
