package com.polyglot.codegen.generator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class CommentFormatterTest {

    @Test
    @DisplayName("单行注释")
    void testLineComment() {
        FormattedComment c = CommentFormatter.parse("// hello world  ");
        assertThat(c.isDoc()).isFalse();
        assertThat(c.getLines()).containsExactly("hello world");
    }

    @Test
    @DisplayName("文档注释去掉行首星号")
    void testDocComment() {
        FormattedComment c = CommentFormatter.parse("/**\n * 计算总价\n *\n * @param items 商品\n */");
        assertThat(c.isDoc()).isTrue();
        assertThat(c.getLines()).containsExactly("计算总价", "", "@param items 商品");
    }

    @Test
    @DisplayName("普通块注释")
    void testBlockComment() {
        FormattedComment c = CommentFormatter.parse("/* inline */");
        assertThat(c.isDoc()).isFalse();
        assertThat(c.getLines()).containsExactly("inline");
    }

    @Test
    @DisplayName("空块注释")
    void testEmptyBlock() {
        FormattedComment c = CommentFormatter.parse("/**/");
        assertThat(c.isDoc()).isFalse();
        assertThat(c.getLines()).isEmpty();
    }
}
