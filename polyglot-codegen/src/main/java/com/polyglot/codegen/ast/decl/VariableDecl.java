package com.polyglot.codegen.ast.decl;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.Modifier;
import com.polyglot.codegen.ast.SourceSpan;
import com.polyglot.codegen.ast.StatementVisitor;
import com.polyglot.codegen.ast.expr.Expression;
import com.polyglot.codegen.ast.type.TypeNode;

import java.util.List;

/**
 * 变量声明语句 {@code const a = 1, b = 2;}，也用作 for 循环的初始化部分
 */
public class VariableDecl extends Declaration {
    private final VariableKind variableKind;
    private final List<Declarator> declarators;

    public VariableDecl(SourceSpan span, List<Modifier> modifiers, VariableKind variableKind,
                        List<Declarator> declarators) {
        super(span, modifiers, declarators.isEmpty() ? null : declarators.get(0).getName());
        this.variableKind = variableKind;
        this.declarators = declarators;
    }

    public VariableKind getVariableKind() {
        return variableKind;
    }

    public List<Declarator> getDeclarators() {
        return declarators;
    }

    public boolean isConst() {
        return variableKind == VariableKind.CONST;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitVariableDecl(this, context);
    }

    @Override
    public String getKind() {
        return "VariableStatement";
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(declarators);
    }

    /**
     * 声明关键字
     */
    public enum VariableKind {
        CONST,
        LET,
        VAR
    }

    /**
     * 单个变量声明项
     */
    public static final class Declarator extends AstNode {
        private final String name;
        private final TypeNode type;
        private final Expression initializer;

        public Declarator(SourceSpan span, String name, TypeNode type, Expression initializer) {
            super(span);
            this.name = name;
            this.type = type;
            this.initializer = initializer;
        }

        public String getName() {
            return name;
        }

        public TypeNode getType() {
            return type;
        }

        public Expression getInitializer() {
            return initializer;
        }

        @Override
        public String getKind() {
            return "VariableDeclaration";
        }

        @Override
        public List<AstNode> getChildren() {
            return childrenOf(type, initializer);
        }
    }
}
