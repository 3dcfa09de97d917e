package com.polyglot.codegen.ast.type;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.SourceSpan;

import java.util.Collections;
import java.util.List;

/**
 * 模型未覆盖的类型（交叉类型、映射类型、条件类型等）
 */
public class UnsupportedType extends TypeNode {
    private final String kind;

    public UnsupportedType(SourceSpan span, String kind) {
        super(span);
        this.kind = kind;
    }

    @Override
    public <R> R accept(TypeNodeVisitor<R> visitor) {
        return visitor.visitUnsupported(this);
    }

    @Override
    public String getKind() {
        return kind;
    }

    @Override
    public List<AstNode> getChildren() {
        return Collections.emptyList();
    }
}
