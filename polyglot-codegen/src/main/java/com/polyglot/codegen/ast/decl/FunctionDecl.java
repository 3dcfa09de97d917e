package com.polyglot.codegen.ast.decl;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.Modifier;
import com.polyglot.codegen.ast.SourceSpan;
import com.polyglot.codegen.ast.StatementVisitor;
import com.polyglot.codegen.ast.stmt.Block;
import com.polyglot.codegen.ast.type.TypeNode;

import java.util.List;

/**
 * 函数声明
 */
public class FunctionDecl extends Declaration implements FunctionLike {
    private final List<TypeParameter> typeParameters;
    private final List<Parameter> parameters;
    private final TypeNode returnType;
    private final Block body;

    public FunctionDecl(SourceSpan span, List<Modifier> modifiers, String name,
                        List<TypeParameter> typeParameters, List<Parameter> parameters,
                        TypeNode returnType, Block body) {
        super(span, modifiers, name);
        this.typeParameters = typeParameters;
        this.parameters = parameters;
        this.returnType = returnType;
        this.body = body;
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

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionDecl(this, context);
    }

    @Override
    public String getKind() {
        return "FunctionDeclaration";
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(typeParameters, parameters, returnType, body);
    }
}
