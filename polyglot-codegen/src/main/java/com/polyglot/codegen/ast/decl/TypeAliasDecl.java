package com.polyglot.codegen.ast.decl;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.Modifier;
import com.polyglot.codegen.ast.SourceSpan;
import com.polyglot.codegen.ast.StatementVisitor;
import com.polyglot.codegen.ast.type.TypeNode;

import java.util.List;

/**
 * 类型别名声明
 */
public class TypeAliasDecl extends Declaration {
    private final List<TypeParameter> typeParameters;
    private final TypeNode type;

    public TypeAliasDecl(SourceSpan span, List<Modifier> modifiers, String name,
                         List<TypeParameter> typeParameters, TypeNode type) {
        super(span, modifiers, name);
        this.typeParameters = typeParameters;
        this.type = type;
    }

    public List<TypeParameter> getTypeParameters() {
        return typeParameters;
    }

    public TypeNode getType() {
        return type;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitTypeAliasDecl(this, context);
    }

    @Override
    public String getKind() {
        return "TypeAliasDeclaration";
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(typeParameters, type);
    }
}
