package com.polyglot.codegen.ast.decl;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.Modifier;
import com.polyglot.codegen.ast.SourceSpan;
import com.polyglot.codegen.ast.expr.Expression;
import com.polyglot.codegen.ast.type.TypeNode;

import java.util.List;

/**
 * 参数（函数、方法、构造器、箭头函数、函数类型）
 */
public class Parameter extends AstNode {
    private final List<Modifier> modifiers;
    private final String name;
    private final TypeNode type;
    private final Expression defaultValue;
    private final boolean optional;
    private final boolean rest;

    public Parameter(SourceSpan span, List<Modifier> modifiers, String name, TypeNode type,
                     Expression defaultValue, boolean optional, boolean rest) {
        super(span);
        this.modifiers = modifiers;
        this.name = name;
        this.type = type;
        this.defaultValue = defaultValue;
        this.optional = optional;
        this.rest = rest;
    }

    public List<Modifier> getModifiers() {
        return modifiers;
    }

    public String getName() {
        return name;
    }

    public TypeNode getType() {
        return type;
    }

    public Expression getDefaultValue() {
        return defaultValue;
    }

    public boolean hasDefaultValue() {
        return defaultValue != null;
    }

    public boolean isOptional() {
        return optional;
    }

    public boolean isRest() {
        return rest;
    }

    public boolean hasModifier(Modifier modifier) {
        return modifiers.contains(modifier);
    }

    /**
     * 构造器参数属性：{@code constructor(private readonly x: number)} 同时声明字段
     */
    public boolean isParameterProperty() {
        return hasModifier(Modifier.PUBLIC) || hasModifier(Modifier.PRIVATE)
                || hasModifier(Modifier.PROTECTED) || hasModifier(Modifier.READONLY);
    }

    @Override
    public String getKind() {
        return "Parameter";
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(type, defaultValue);
    }
}
