package com.polyglot.codegen.ast.decl;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.SourceSpan;

import java.util.Collections;
import java.util.List;

/**
 * 模型未覆盖的类成员（索引签名、静态块等）
 */
public class UnsupportedMember extends ClassMember {
    private final String kind;

    public UnsupportedMember(SourceSpan span, String kind) {
        super(span, Collections.emptyList(), null);
        this.kind = kind;
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
