package com.polyglot.codegen.generator;

import com.polyglot.codegen.ast.expr.Expression;
import com.polyglot.codegen.ast.expr.Literal;

/**
 * 识别出的计数循环：变量在 [start, bound) 上递增
 */
public final class CountingLoop {
    private final String variable;
    private final Literal start;
    private final Expression bound;
    private final boolean captured;

    public CountingLoop(String variable, Literal start, Expression bound, boolean captured) {
        this.variable = variable;
        this.start = start;
        this.bound = bound;
        this.captured = captured;
    }

    public String getVariable() {
        return variable;
    }

    public Literal getStart() {
        return start;
    }

    public Expression getBound() {
        return bound;
    }

    /** 循环体内的闭包是否引用了循环变量 */
    public boolean isCaptured() {
        return captured;
    }
}
