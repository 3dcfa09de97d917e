package com.polyglot.codegen.generator;

import com.polyglot.codegen.ast.type.TypeNode;

/**
 * 类型映射策略：把源语言类型注解翻译成目标语言类型表达式。
 *
 * <p>实现不得抛出异常，无法映射的类型返回 {@link #untypedType()}；
 * 映射过程中用到的导入写入传入的 {@link ImportSet}。</p>
 */
public interface TypeMapper {

    /**
     * 映射类型注解
     *
     * @param type    类型节点，null 表示未注解
     * @param imports 导入集合
     */
    String mapType(TypeNode type, ImportSet imports);

    /** 目标语言的“任意类型”占位 */
    String untypedType();

    /**
     * 异步返回值包装：{@code T} → {@code Future<T>}
     *
     * @param valueType 未包装的返回类型节点（已去掉 Promise），null 表示未注解
     */
    String futureOf(TypeNode valueType, ImportSet imports);
}
