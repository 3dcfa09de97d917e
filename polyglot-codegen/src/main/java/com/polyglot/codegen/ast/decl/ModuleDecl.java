package com.polyglot.codegen.ast.decl;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.Modifier;
import com.polyglot.codegen.ast.SourceSpan;
import com.polyglot.codegen.ast.StatementVisitor;
import com.polyglot.codegen.ast.stmt.Statement;

import java.util.List;

/**
 * 命名空间声明 {@code namespace Geometry { ... }}
 */
public class ModuleDecl extends Declaration {
    private final List<Statement> statements;

    public ModuleDecl(SourceSpan span, List<Modifier> modifiers, String name, List<Statement> statements) {
        super(span, modifiers, name);
        this.statements = statements;
    }

    public List<Statement> getStatements() {
        return statements;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitModuleDecl(this, context);
    }

    @Override
    public String getKind() {
        return "ModuleDeclaration";
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(statements);
    }
}
