package com.polyglot.codegen.ast.type;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.SourceSpan;

import java.util.Collections;
import java.util.List;

/**
 * 关键字类型：number、string、void 等
 */
public class KeywordType extends TypeNode {
    private final Keyword keyword;

    public KeywordType(SourceSpan span, Keyword keyword) {
        super(span);
        this.keyword = keyword;
    }

    public Keyword getKeyword() {
        return keyword;
    }

    public boolean isNullish() {
        return keyword == Keyword.NULL || keyword == Keyword.UNDEFINED;
    }

    @Override
    public <R> R accept(TypeNodeVisitor<R> visitor) {
        return visitor.visitKeyword(this);
    }

    @Override
    public String getKind() {
        return keyword.getSyntaxKind();
    }

    @Override
    public List<AstNode> getChildren() {
        return Collections.emptyList();
    }

    /**
     * 类型关键字
     */
    public enum Keyword {
        NUMBER("NumberKeyword"),
        STRING("StringKeyword"),
        BOOLEAN("BooleanKeyword"),
        VOID("VoidKeyword"),
        ANY("AnyKeyword"),
        UNKNOWN("UnknownKeyword"),
        NEVER("NeverKeyword"),
        NULL("NullKeyword"),
        UNDEFINED("UndefinedKeyword"),
        OBJECT("ObjectKeyword"),
        BIGINT("BigIntKeyword"),
        SYMBOL("SymbolKeyword");

        private final String syntaxKind;

        Keyword(String syntaxKind) {
            this.syntaxKind = syntaxKind;
        }

        public String getSyntaxKind() {
            return syntaxKind;
        }

        /**
         * 按 SyntaxKind 名称查找，未知名称返回 null
         */
        public static Keyword fromSyntaxKind(String kind) {
            for (Keyword k : values()) {
                if (k.syntaxKind.equals(kind)) {
                    return k;
                }
            }
            return null;
        }
    }
}
