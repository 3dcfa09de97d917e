package com.polyglot.codegen.generator;

/**
 * 已解析的枚举成员：目标常量名与值文本。
 * 没有初始化器的成员取位置值（上一个数值成员加一）。
 */
public final class EnumConstant {
    private final String name;
    private final String value;
    private final boolean explicit;
    private final ValueKind valueKind;

    public EnumConstant(String name, String value, boolean explicit, ValueKind valueKind) {
        this.name = name;
        this.value = value;
        this.explicit = explicit;
        this.valueKind = valueKind;
    }

    public String getName() {
        return name;
    }

    /** 已渲染的值文本 */
    public String getValue() {
        return value;
    }

    /** 源码是否写了初始化器 */
    public boolean isExplicit() {
        return explicit;
    }

    public ValueKind getValueKind() {
        return valueKind;
    }

    public enum ValueKind {
        INTEGER, NUMBER, STRING, OTHER
    }
}
