package com.polyglot.codegen.ast;

/**
 * 前导注释区间
 */
public final class CommentRange {
    private final int pos;
    private final int end;
    private final boolean multiLine;

    public CommentRange(int pos, int end, boolean multiLine) {
        this.pos = pos;
        this.end = end;
        this.multiLine = multiLine;
    }

    public int getPos() {
        return pos;
    }

    public int getEnd() {
        return end;
    }

    /** true 表示块注释（含文档注释），false 表示行注释 */
    public boolean isMultiLine() {
        return multiLine;
    }
}
