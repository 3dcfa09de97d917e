package com.polyglot.codegen;

import com.polyglot.codegen.generator.CodeGenerator;
import com.polyglot.codegen.generator.GeneratorConfig;
import com.polyglot.codegen.generator.java.JavaGenerator;
import com.polyglot.codegen.generator.ruby.RubyGenerator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class TargetLanguageTest {

    @Test
    @DisplayName("按名称查找，不区分大小写")
    void testFromName() {
        assertThat(TargetLanguage.fromName("ruby")).isSameAs(TargetLanguage.RUBY);
        assertThat(TargetLanguage.fromName("JAVA")).isSameAs(TargetLanguage.JAVA);
    }

    @Test
    @DisplayName("未知目标抛出异常")
    void testUnknown() {
        assertThatThrownBy(() -> TargetLanguage.fromName("python"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("python");
    }

    @Test
    @DisplayName("默认配置")
    void testDefaultConfig() {
        GeneratorConfig ruby = TargetLanguage.RUBY.defaultConfig();
        assertThat(ruby.getTargetVersion()).isEqualTo("3.0");
        assertThat(ruby.getIndentWidth()).isEqualTo(2);
        assertThat(ruby.isEmitTypedSignatures()).isFalse();

        GeneratorConfig java = TargetLanguage.JAVA.defaultConfig();
        assertThat(java.getTargetVersion()).isEqualTo("17");
        assertThat(java.getNamespacePrefix()).isEqualTo("com.example");
        assertThat(java.getIndentWidth()).isEqualTo(4);
        assertThat(java.isEmitTypedSignatures()).isTrue();
    }

    @Test
    @DisplayName("创建对应的生成器")
    void testCreateGenerator() {
        CodeGenerator ruby = TargetLanguage.RUBY.createGenerator();
        assertThat(ruby).isInstanceOf(RubyGenerator.class);
        assertThat(ruby.getDialect().getName()).isEqualTo("ruby");
        assertThat(TargetLanguage.JAVA.createGenerator()).isInstanceOf(JavaGenerator.class);
        assertThat(TargetLanguage.RUBY.getFileExtension()).isEqualTo(".rb");
        assertThat(TargetLanguage.JAVA.getId()).isEqualTo("java");
    }
}
