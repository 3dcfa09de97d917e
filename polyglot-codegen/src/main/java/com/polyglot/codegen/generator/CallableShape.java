package com.polyglot.codegen.generator;

/**
 * 可调用值的形状：参数个数与是否无返回值。
 * 决定闭包类型（Supplier / Consumer / Function / BiFunction）及其调用方式。
 */
public final class CallableShape {
    private final int arity;
    private final boolean returnsVoid;

    public CallableShape(int arity, boolean returnsVoid) {
        this.arity = arity;
        this.returnsVoid = returnsVoid;
    }

    public int getArity() {
        return arity;
    }

    public boolean returnsVoid() {
        return returnsVoid;
    }

    @Override
    public String toString() {
        return "CallableShape(" + arity + (returnsVoid ? ", void)" : ")");
    }
}
