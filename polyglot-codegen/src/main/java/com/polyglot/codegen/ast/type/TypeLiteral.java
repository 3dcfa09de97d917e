package com.polyglot.codegen.ast.type;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.SourceSpan;
import com.polyglot.codegen.ast.decl.ClassMember;

import java.util.List;

/**
 * 对象类型字面量 {@code { x: number; y: number }}
 */
public class TypeLiteral extends TypeNode {
    private final List<ClassMember> members;

    public TypeLiteral(SourceSpan span, List<ClassMember> members) {
        super(span);
        this.members = members;
    }

    public List<ClassMember> getMembers() {
        return members;
    }

    @Override
    public <R> R accept(TypeNodeVisitor<R> visitor) {
        return visitor.visitTypeLiteral(this);
    }

    @Override
    public String getKind() {
        return "TypeLiteral";
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(members);
    }
}
