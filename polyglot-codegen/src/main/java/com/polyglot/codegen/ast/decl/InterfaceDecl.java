package com.polyglot.codegen.ast.decl;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.Modifier;
import com.polyglot.codegen.ast.SourceSpan;
import com.polyglot.codegen.ast.StatementVisitor;
import com.polyglot.codegen.ast.type.TypeNode;

import java.util.List;

/**
 * 接口声明。成员为属性签名（{@link PropertyDecl}）与方法签名（无方法体的 {@link MethodDecl}）。
 */
public class InterfaceDecl extends Declaration {
    private final List<TypeParameter> typeParameters;
    private final List<TypeNode> superInterfaces;
    private final List<ClassMember> members;

    public InterfaceDecl(SourceSpan span, List<Modifier> modifiers, String name,
                         List<TypeParameter> typeParameters, List<TypeNode> superInterfaces,
                         List<ClassMember> members) {
        super(span, modifiers, name);
        this.typeParameters = typeParameters;
        this.superInterfaces = superInterfaces;
        this.members = members;
    }

    public List<TypeParameter> getTypeParameters() {
        return typeParameters;
    }

    public List<TypeNode> getSuperInterfaces() {
        return superInterfaces;
    }

    public List<ClassMember> getMembers() {
        return members;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitInterfaceDecl(this, context);
    }

    @Override
    public String getKind() {
        return "InterfaceDeclaration";
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(typeParameters, superInterfaces, members);
    }
}
