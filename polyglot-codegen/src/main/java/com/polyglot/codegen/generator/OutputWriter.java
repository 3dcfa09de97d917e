package com.polyglot.codegen.generator;

import java.util.ArrayList;
import java.util.List;

/**
 * 输出缓冲区，按行记录并跟踪缩进层级
 */
public class OutputWriter {
    private final List<String> lines = new ArrayList<>();
    private final String indentUnit;
    private int indentLevel = 0;
    /** 最近一次缩进时的行数，块首不写空行 */
    private int blockStart = -1;

    public OutputWriter(String indentUnit) {
        this.indentUnit = indentUnit;
    }

    public void indent() {
        indentLevel++;
        blockStart = lines.size();
    }

    public void dedent() {
        if (indentLevel > 0) {
            indentLevel--;
        }
    }

    public int getIndentLevel() {
        return indentLevel;
    }

    /**
     * 写入一行（自动加当前缩进）。含换行符的文本逐行写入，各行保持相对缩进。
     */
    public void writeLine(String text) {
        if (text == null || text.isEmpty()) {
            lines.add("");
            return;
        }
        String prefix = indentString();
        for (String line : text.split("\n", -1)) {
            lines.add(line.isEmpty() ? "" : prefix + line);
        }
    }

    /**
     * 追加空行（避免连续多个空行，缓冲区开头与代码块开头不写空行）
     */
    public void blankLine() {
        if (lines.isEmpty() || lines.size() == blockStart || lines.get(lines.size() - 1).isEmpty()) {
            return;
        }
        lines.add("");
    }

    /**
     * 去掉末尾的空行，用于闭合代码块前
     */
    public void trimTrailingBlankLines() {
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    public List<String> getLines() {
        return lines;
    }

    /**
     * 获取输出：行以 \n 连接，末尾恰好一个换行
     */
    public String getOutput() {
        trimTrailingBlankLines();
        StringBuilder sb = new StringBuilder();
        for (String line : lines) {
            sb.append(line).append('\n');
        }
        return sb.toString();
    }

    private String indentString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < indentLevel; i++) {
            sb.append(indentUnit);
        }
        return sb.toString();
    }
}
