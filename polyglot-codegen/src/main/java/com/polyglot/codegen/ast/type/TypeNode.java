package com.polyglot.codegen.ast.type;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.SourceSpan;

/**
 * 类型注解节点基类
 */
public abstract class TypeNode extends AstNode {

    protected TypeNode(SourceSpan span) {
        super(span);
    }

    /** 接受 TypeNodeVisitor 进行类型分派 */
    public abstract <R> R accept(TypeNodeVisitor<R> visitor);
}
