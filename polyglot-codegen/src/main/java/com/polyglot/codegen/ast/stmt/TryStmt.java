package com.polyglot.codegen.ast.stmt;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.SourceSpan;
import com.polyglot.codegen.ast.StatementVisitor;

import java.util.List;

/**
 * try / catch / finally
 */
public class TryStmt extends Statement {
    private final Block tryBlock;
    private final CatchClause catchClause;
    private final Block finallyBlock;

    public TryStmt(SourceSpan span, Block tryBlock, CatchClause catchClause, Block finallyBlock) {
        super(span);
        this.tryBlock = tryBlock;
        this.catchClause = catchClause;
        this.finallyBlock = finallyBlock;
    }

    public Block getTryBlock() {
        return tryBlock;
    }

    public CatchClause getCatchClause() {
        return catchClause;
    }

    public Block getFinallyBlock() {
        return finallyBlock;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitTryStmt(this, context);
    }

    @Override
    public String getKind() {
        return "TryStatement";
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(tryBlock, catchClause, finallyBlock);
    }
}
