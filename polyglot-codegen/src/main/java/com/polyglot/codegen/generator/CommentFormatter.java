package com.polyglot.codegen.generator;

import java.util.ArrayList;
import java.util.List;

/**
 * 解析原始注释文本：去掉 {@code //}、{@code /*}、{@code *}{@code /} 与行首星号，保留正文行
 */
public final class CommentFormatter {

    private CommentFormatter() {}

    public static FormattedComment parse(String raw) {
        String text = raw.trim();
        if (text.startsWith("//")) {
            List<String> lines = new ArrayList<>();
            lines.add(stripLeadingSpace(text.substring(2)).trim());
            return new FormattedComment(false, lines);
        }
        boolean doc = text.startsWith("/**") && !text.equals("/**/");
        if (text.startsWith("/*")) {
            text = text.substring(doc ? 3 : 2);
        }
        if (text.endsWith("*/")) {
            text = text.substring(0, text.length() - 2);
        }
        List<String> lines = new ArrayList<>();
        for (String line : text.split("\r?\n", -1)) {
            String trimmed = line.trim();
            if (trimmed.startsWith("*")) {
                trimmed = stripLeadingSpace(trimmed.substring(1));
            }
            lines.add(trimRight(trimmed));
        }
        // 去掉首尾空行
        while (!lines.isEmpty() && lines.get(0).isEmpty()) {
            lines.remove(0);
        }
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return new FormattedComment(doc, lines);
    }

    private static String stripLeadingSpace(String s) {
        return s.startsWith(" ") ? s.substring(1) : s;
    }

    private static String trimRight(String s) {
        int end = s.length();
        while (end > 0 && Character.isWhitespace(s.charAt(end - 1))) {
            end--;
        }
        return s.substring(0, end);
    }
}
