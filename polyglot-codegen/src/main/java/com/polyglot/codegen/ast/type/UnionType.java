package com.polyglot.codegen.ast.type;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * 联合类型 {@code A | B}
 */
public class UnionType extends TypeNode {
    private final List<TypeNode> types;

    public UnionType(SourceSpan span, List<TypeNode> types) {
        super(span);
        this.types = types;
    }

    public List<TypeNode> getTypes() {
        return types;
    }

    /** 去掉 null / undefined 之后的成员 */
    public List<TypeNode> getNonNullishTypes() {
        List<TypeNode> result = new ArrayList<>();
        for (TypeNode t : types) {
            if (!(t instanceof KeywordType && ((KeywordType) t).isNullish())) {
                result.add(t);
            }
        }
        return result;
    }

    /**
     * 恰好是 {@code T | null | undefined} 形式：一个非空成员加至少一个空值成员
     */
    public boolean isNullableOfSingle() {
        List<TypeNode> rest = getNonNullishTypes();
        return rest.size() == 1 && types.size() > 1;
    }

    @Override
    public <R> R accept(TypeNodeVisitor<R> visitor) {
        return visitor.visitUnion(this);
    }

    @Override
    public String getKind() {
        return "UnionType";
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(types);
    }
}
