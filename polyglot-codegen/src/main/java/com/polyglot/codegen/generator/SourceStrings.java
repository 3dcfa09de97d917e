package com.polyglot.codegen.generator;

/**
 * 目标语言字符串字面量转义
 */
public final class SourceStrings {

    private SourceStrings() {}

    /** 转义字符串内容（Java 双引号字符串） */
    public static String escapeJava(String s) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\': sb.append("\\\\"); break;
                case '"': sb.append("\\\""); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                case '\b': sb.append("\\b"); break;
                case '\f': sb.append("\\f"); break;
                default: sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * 转义字符串内容（Ruby 双引号字符串），井号加左花括号不能被当作插值
     */
    public static String escapeRuby(String s) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\': sb.append("\\\\"); break;
                case '"': sb.append("\\\""); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                case '#':
                    if (i + 1 < s.length() && (s.charAt(i + 1) == '{' || s.charAt(i + 1) == '@'
                            || s.charAt(i + 1) == '$')) {
                        sb.append("\\#");
                    } else {
                        sb.append('#');
                    }
                    break;
                default: sb.append(c);
            }
        }
        return sb.toString();
    }

    public static String javaQuoted(String s) {
        return "\"" + escapeJava(s) + "\"";
    }

    public static String rubyQuoted(String s) {
        return "\"" + escapeRuby(s) + "\"";
    }
}
