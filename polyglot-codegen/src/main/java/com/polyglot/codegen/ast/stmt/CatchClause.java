package com.polyglot.codegen.ast.stmt;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.SourceSpan;

import java.util.List;

/**
 * catch 子句，{@code catch { }} 形式没有变量名
 */
public class CatchClause extends AstNode {
    private final String variableName;
    private final Block body;

    public CatchClause(SourceSpan span, String variableName, Block body) {
        super(span);
        this.variableName = variableName;
        this.body = body;
    }

    public String getVariableName() {
        return variableName;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public String getKind() {
        return "CatchClause";
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(body);
    }
}
