package com.polyglot.codegen.ast.decl;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.Modifier;
import com.polyglot.codegen.ast.SourceSpan;
import com.polyglot.codegen.ast.stmt.Block;
import com.polyglot.codegen.ast.type.TypeNode;

import java.util.List;

/**
 * 方法声明（含 get/set 访问器与接口方法签名）
 */
public class MethodDecl extends ClassMember implements FunctionLike {
    private final List<TypeParameter> typeParameters;
    private final List<Parameter> parameters;
    private final TypeNode returnType;
    private final Block body;
    private final AccessorKind accessorKind;

    public MethodDecl(SourceSpan span, List<Modifier> modifiers, String name,
                      List<TypeParameter> typeParameters, List<Parameter> parameters,
                      TypeNode returnType, Block body, AccessorKind accessorKind) {
        super(span, modifiers, name);
        this.typeParameters = typeParameters;
        this.parameters = parameters;
        this.returnType = returnType;
        this.body = body;
        this.accessorKind = accessorKind;
    }

    public List<TypeParameter> getTypeParameters() {
        return typeParameters;
    }

    @Override
    public List<Parameter> getParameters() {
        return parameters;
    }

    @Override
    public TypeNode getReturnType() {
        return returnType;
    }

    @Override
    public Block getBody() {
        return body;
    }

    @Override
    public boolean isAsync() {
        return hasModifier(Modifier.ASYNC);
    }

    public boolean isAbstract() {
        return hasModifier(Modifier.ABSTRACT);
    }

    public AccessorKind getAccessorKind() {
        return accessorKind;
    }

    @Override
    public String getKind() {
        switch (accessorKind) {
            case GETTER: return "GetAccessor";
            case SETTER: return "SetAccessor";
            default:     return "MethodDeclaration";
        }
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(typeParameters, parameters, returnType, body);
    }

    /**
     * 访问器种类
     */
    public enum AccessorKind {
        NONE,
        GETTER,
        SETTER
    }
}
