package com.polyglot.codegen.ast.decl;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.Modifier;
import com.polyglot.codegen.ast.SourceSpan;
import com.polyglot.codegen.ast.stmt.Block;
import com.polyglot.codegen.ast.type.TypeNode;

import java.util.ArrayList;
import java.util.List;

/**
 * 构造器声明
 */
public class ConstructorDecl extends ClassMember implements FunctionLike {
    private final List<Parameter> parameters;
    private final Block body;

    public ConstructorDecl(SourceSpan span, List<Modifier> modifiers,
                           List<Parameter> parameters, Block body) {
        super(span, modifiers, "constructor");
        this.parameters = parameters;
        this.body = body;
    }

    @Override
    public List<Parameter> getParameters() {
        return parameters;
    }

    @Override
    public TypeNode getReturnType() {
        return null;
    }

    @Override
    public Block getBody() {
        return body;
    }

    @Override
    public boolean isAsync() {
        return false;
    }

    /**
     * 带可见性或 readonly 修饰的参数，它们同时是字段
     */
    public List<Parameter> getParameterProperties() {
        List<Parameter> result = new ArrayList<>();
        for (Parameter p : parameters) {
            if (p.isParameterProperty()) {
                result.add(p);
            }
        }
        return result;
    }

    @Override
    public String getKind() {
        return "Constructor";
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(parameters, body);
    }
}
