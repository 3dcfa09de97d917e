package com.polyglot.codegen.ast;

/**
 * 源码区间 [pos, end)，偏移量相对于编译单元全文
 */
public final class SourceSpan {
    private final int pos;
    private final int end;

    public static final SourceSpan UNKNOWN = new SourceSpan(-1, -1);

    public SourceSpan(int pos, int end) {
        this.pos = pos;
        this.end = end;
    }

    public int getPos() {
        return pos;
    }

    public int getEnd() {
        return end;
    }

    public boolean isKnown() {
        return pos >= 0 && end >= pos;
    }

    @Override
    public String toString() {
        return "[" + pos + ", " + end + ")";
    }
}
