package com.polyglot.codegen.ast.decl;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.Modifier;
import com.polyglot.codegen.ast.SourceSpan;
import com.polyglot.codegen.ast.StatementVisitor;
import com.polyglot.codegen.ast.expr.Expression;

import java.util.List;

/**
 * 枚举声明
 */
public class EnumDecl extends Declaration {
    private final List<EnumMember> members;

    public EnumDecl(SourceSpan span, List<Modifier> modifiers, String name, List<EnumMember> members) {
        super(span, modifiers, name);
        this.members = members;
    }

    public List<EnumMember> getMembers() {
        return members;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitEnumDecl(this, context);
    }

    @Override
    public String getKind() {
        return "EnumDeclaration";
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(members);
    }

    /**
     * 枚举成员
     */
    public static final class EnumMember extends AstNode {
        private final String name;
        private final Expression initializer;

        public EnumMember(SourceSpan span, String name, Expression initializer) {
            super(span);
            this.name = name;
            this.initializer = initializer;
        }

        public String getName() {
            return name;
        }

        /** 显式初始值，未声明时为 null */
        public Expression getInitializer() {
            return initializer;
        }

        @Override
        public String getKind() {
            return "EnumMember";
        }

        @Override
        public List<AstNode> getChildren() {
            return childrenOf(initializer);
        }
    }
}
