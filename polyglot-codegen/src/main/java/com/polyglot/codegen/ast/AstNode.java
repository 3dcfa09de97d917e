package com.polyglot.codegen.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * AST 节点基类
 *
 * <p>节点由外部解析器构建，生成器只读不写。种类标签沿用 TypeScript 的 SyntaxKind 名称。</p>
 */
public abstract class AstNode {
    protected final SourceSpan span;
    private List<CommentRange> leadingComments = Collections.emptyList();

    protected AstNode(SourceSpan span) {
        this.span = span != null ? span : SourceSpan.UNKNOWN;
    }

    public SourceSpan getSpan() {
        return span;
    }

    public List<CommentRange> getLeadingComments() {
        return leadingComments;
    }

    /** 由 AST 构建方在建树时设置 */
    public void setLeadingComments(List<CommentRange> comments) {
        this.leadingComments = comments != null ? comments : Collections.<CommentRange>emptyList();
    }

    /** 种类标签（SyntaxKind 名称） */
    public abstract String getKind();

    /** 直接子节点，按源码顺序 */
    public abstract List<AstNode> getChildren();

    /**
     * 拼接子节点列表，忽略 null，展开 List
     */
    protected static List<AstNode> childrenOf(Object... parts) {
        List<AstNode> result = new ArrayList<>();
        for (Object part : parts) {
            if (part instanceof AstNode) {
                result.add((AstNode) part);
            } else if (part instanceof List) {
                for (Object item : (List<?>) part) {
                    if (item instanceof AstNode) {
                        result.add((AstNode) item);
                    }
                }
            }
        }
        return result;
    }
}
