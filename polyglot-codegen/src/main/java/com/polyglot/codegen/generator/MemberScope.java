package com.polyglot.codegen.generator;

/**
 * 当前生成位置所处的作用域
 */
public enum MemberScope {
    /** 文件顶层 */
    TOP_LEVEL,
    /** 命名空间或 Java 顶层容器类 */
    NAMESPACE,
    /** 类体 */
    CLASS,
    /** 接口体 */
    INTERFACE,
    /** 函数体或初始化块 */
    FUNCTION
}
