package com.polyglot.codegen.generator;

/**
 * 标识符大小写转换
 */
public final class NamingConventions {

    private NamingConventions() {}

    /**
     * camelCase / PascalCase 转 snake_case。连续大写视为缩写：
     * {@code parseHTTPResponse} → {@code parse_http_response}
     */
    public static String toSnakeCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        StringBuilder sb = new StringBuilder(name.length() + 4);
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isUpperCase(c)) {
                if (i > 0 && sb.length() > 0 && sb.charAt(sb.length() - 1) != '_') {
                    char prev = name.charAt(i - 1);
                    boolean nextIsLower = i + 1 < name.length() && Character.isLowerCase(name.charAt(i + 1));
                    if (Character.isLowerCase(prev) || Character.isDigit(prev)
                            || (Character.isUpperCase(prev) && nextIsLower)) {
                        sb.append('_');
                    }
                }
                sb.append(Character.toLowerCase(c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * 常量命名 SCREAMING_SNAKE_CASE；已是常量写法的名称原样返回
     */
    public static String toConstantCase(String name) {
        if (name == null || name.isEmpty() || isConstantCase(name)) {
            return name;
        }
        return toSnakeCase(name).toUpperCase();
    }

    /** 全部由大写字母、数字、下划线组成 */
    public static boolean isConstantCase(String name) {
        boolean hasLetter = false;
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isLowerCase(c)) {
                return false;
            }
            if (Character.isUpperCase(c)) {
                hasLetter = true;
            } else if (c != '_' && !Character.isDigit(c)) {
                return false;
            }
        }
        return hasLetter;
    }

    /**
     * 以分隔符（- _ . 空格）切分后首字母大写拼接：{@code user-service} → {@code UserService}
     */
    public static String toPascalCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        StringBuilder sb = new StringBuilder();
        boolean upperNext = true;
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '-' || c == '_' || c == '.' || c == ' ') {
                upperNext = true;
            } else if (Character.isLetterOrDigit(c)) {
                sb.append(upperNext ? Character.toUpperCase(c) : c);
                upperNext = false;
            }
        }
        if (sb.length() > 0 && Character.isDigit(sb.charAt(0))) {
            sb.insert(0, '_');
        }
        return sb.toString();
    }

    public static String capitalize(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }

    public static boolean startsWithUpperCase(String name) {
        return name != null && !name.isEmpty() && Character.isUpperCase(name.charAt(0));
    }

    /**
     * 是否可以写成 Ruby 符号字面量 {@code key:}
     */
    public static boolean isRubySymbolName(String name) {
        if (name == null || name.isEmpty()) {
            return false;
        }
        char first = name.charAt(0);
        if (!Character.isLetter(first) && first != '_') {
            return false;
        }
        for (int i = 1; i < name.length(); i++) {
            char c = name.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '_') {
                return false;
            }
        }
        return true;
    }
}
