package com.polyglot.codegen.ast.decl;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.Modifier;
import com.polyglot.codegen.ast.SourceSpan;
import com.polyglot.codegen.ast.StatementVisitor;
import com.polyglot.codegen.ast.type.TypeNode;

import java.util.List;

/**
 * 类声明
 */
public class ClassDecl extends Declaration {
    private final List<TypeParameter> typeParameters;
    private final TypeNode superClass;
    private final List<TypeNode> interfaces;
    private final List<ClassMember> members;

    public ClassDecl(SourceSpan span, List<Modifier> modifiers, String name,
                     List<TypeParameter> typeParameters, TypeNode superClass,
                     List<TypeNode> interfaces, List<ClassMember> members) {
        super(span, modifiers, name);
        this.typeParameters = typeParameters;
        this.superClass = superClass;
        this.interfaces = interfaces;
        this.members = members;
    }

    public List<TypeParameter> getTypeParameters() {
        return typeParameters;
    }

    /** extends 子句中的类型，没有时为 null */
    public TypeNode getSuperClass() {
        return superClass;
    }

    public List<TypeNode> getInterfaces() {
        return interfaces;
    }

    public List<ClassMember> getMembers() {
        return members;
    }

    public boolean isAbstract() {
        return hasModifier(Modifier.ABSTRACT);
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitClassDecl(this, context);
    }

    @Override
    public String getKind() {
        return "ClassDeclaration";
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(typeParameters, superClass, interfaces, members);
    }
}
