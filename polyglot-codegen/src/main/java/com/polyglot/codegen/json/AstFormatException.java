package com.polyglot.codegen.json;

/**
 * AST 交换格式错误：JSON 非法、缺少必需属性或属性类型不符
 */
public class AstFormatException extends RuntimeException {

    public AstFormatException(String message) {
        super(message);
    }

    public AstFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
