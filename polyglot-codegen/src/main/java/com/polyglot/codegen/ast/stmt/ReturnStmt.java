package com.polyglot.codegen.ast.stmt;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.SourceSpan;
import com.polyglot.codegen.ast.StatementVisitor;
import com.polyglot.codegen.ast.expr.Expression;

import java.util.List;

/**
 * return 语句，value 可为 null
 */
public class ReturnStmt extends Statement {
    private final Expression value;

    public ReturnStmt(SourceSpan span, Expression value) {
        super(span);
        this.value = value;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitReturnStmt(this, context);
    }

    @Override
    public String getKind() {
        return "ReturnStatement";
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(value);
    }
}
