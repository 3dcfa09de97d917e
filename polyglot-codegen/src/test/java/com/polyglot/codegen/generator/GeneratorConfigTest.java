package com.polyglot.codegen.generator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GeneratorConfigTest {

    @Test
    @DisplayName("默认值")
    void testDefaults() {
        GeneratorConfig config = GeneratorConfig.builder().targetVersion("3.0").build();
        assertTrue(config.isPreserveComments());
        assertTrue(config.isUseIdiomaticValueObjects());
        assertFalse(config.hasNamespacePrefix());
        assertFalse(config.isOptimize());
    }

    @Test
    @DisplayName("版本比较")
    void testVersionComparison() {
        GeneratorConfig ruby = GeneratorConfig.builder().targetVersion("3.2").build();
        assertEquals(3, ruby.getMajorVersion());
        assertEquals(2, ruby.getMinorVersion());
        assertTrue(ruby.isVersionAtLeast(3, 2));
        assertTrue(ruby.isVersionAtLeast(2, 7));
        assertFalse(ruby.isVersionAtLeast(3, 3));

        GeneratorConfig java = GeneratorConfig.builder().targetVersion(" 17 ").build();
        assertEquals("17", java.getTargetVersion());
        assertTrue(java.isVersionAtLeast(16, 0));
        assertEquals(0, GeneratorConfig.builder().targetVersion("latest").build().getMajorVersion());
    }

    @Test
    @DisplayName("缩进字符串")
    void testIndentString() {
        assertEquals("    ", GeneratorConfig.builder().targetVersion("17").indentWidth(4).build().getIndentString());
    }

    @Test
    @DisplayName("toBuilder 复制后修改不影响原配置")
    void testToBuilder() {
        GeneratorConfig base = GeneratorConfig.builder().targetVersion("17").namespacePrefix("com.acme").build();
        GeneratorConfig changed = base.toBuilder().emitTypedSignatures(false).optimize(true).build();
        assertEquals("com.acme", changed.getNamespacePrefix());
        assertTrue(changed.isOptimize());
        assertFalse(base.isOptimize());
        assertFalse(changed.isEmitTypedSignatures());
        assertEquals("17", base.getTargetVersion());
    }

    @Test
    @DisplayName("非法配置")
    void testInvalid() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> GeneratorConfig.builder().targetVersion("17").indentWidth(0).build());
        assertTrue(e.getMessage().contains("indentWidth"));
        assertThrows(IllegalArgumentException.class, () -> GeneratorConfig.builder().targetVersion(" ").build());
    }
}
