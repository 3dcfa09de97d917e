package com.polyglot.codegen.ast.decl;

import com.polyglot.codegen.ast.stmt.Block;
import com.polyglot.codegen.ast.type.TypeNode;

import java.util.List;

/**
 * 可调用声明的公共视图：函数、方法、构造器
 */
public interface FunctionLike {

    List<Parameter> getParameters();

    /** 声明的返回类型，未注解时为 null */
    TypeNode getReturnType();

    /** 函数体，抽象方法与签名为 null */
    Block getBody();

    boolean isAsync();
}
