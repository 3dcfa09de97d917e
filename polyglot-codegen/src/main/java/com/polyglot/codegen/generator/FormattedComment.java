package com.polyglot.codegen.generator;

import java.util.List;

/**
 * 去掉注释标记后的注释内容
 */
public final class FormattedComment {
    private final boolean doc;
    private final List<String> lines;

    public FormattedComment(boolean doc, List<String> lines) {
        this.doc = doc;
        this.lines = lines;
    }

    /** 是否为 {@code /** ... *}{@code /} 文档注释 */
    public boolean isDoc() {
        return doc;
    }

    public List<String> getLines() {
        return lines;
    }
}
