package com.polyglot.codegen.ast;

/**
 * 修饰符枚举
 */
public enum Modifier {
    // 可见性
    PUBLIC,
    PRIVATE,
    PROTECTED,

    // 模块
    EXPORT,
    DEFAULT,
    DECLARE,

    // 其他
    ABSTRACT,
    STATIC,
    READONLY,
    ASYNC,
    OVERRIDE;

    /** 返回源码中对应的关键字 */
    public String toSourceString() {
        return name().toLowerCase();
    }

    /**
     * 按关键字查找修饰符，未知关键字返回 null
     */
    public static Modifier fromKeyword(String keyword) {
        for (Modifier m : values()) {
            if (m.toSourceString().equals(keyword)) {
                return m;
            }
        }
        return null;
    }
}
