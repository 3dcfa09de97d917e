package com.polyglot.codegen.generator.ruby;

import com.polyglot.codegen.ast.type.KeywordType;
import com.polyglot.codegen.generator.ImportSet;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.polyglot.codegen.TestAst.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Sorbet 类型映射测试
 */
class RubyTypeMapperTest {

    private RubyTypeMapper mapper;
    private ImportSet imports;

    @BeforeEach
    void setUp() {
        mapper = new RubyTypeMapper();
        imports = new ImportSet();
    }

    @Test
    @DisplayName("基本类型")
    void testKeywords() {
        assertThat(mapper.mapType(numberType(), imports)).isEqualTo("Numeric");
        assertThat(mapper.mapType(stringType(), imports)).isEqualTo("String");
        assertThat(mapper.mapType(booleanType(), imports)).isEqualTo("T::Boolean");
        assertThat(mapper.mapType(voidType(), imports)).isEqualTo("void");
        assertThat(mapper.mapType(keyword(KeywordType.Keyword.NEVER), imports)).isEqualTo("T.noreturn");
    }

    @Test
    @DisplayName("未注解与 any 映射为 T.untyped")
    void testUntyped() {
        assertThat(mapper.mapType(null, imports)).isEqualTo("T.untyped");
        assertThat(mapper.mapType(anyType(), imports)).isEqualTo("T.untyped");
        assertThat(mapper.mapType(unsupportedType("ConditionalType"), imports)).isEqualTo("T.untyped");
        assertThat(imports.toSortedList()).containsExactly("require 'sorbet-runtime'");
    }

    @Test
    @DisplayName("集合类型")
    void testCollections() {
        assertThat(mapper.mapType(arrayOf(stringType()), imports)).isEqualTo("T::Array[String]");
        assertThat(mapper.mapType(ref("Map", stringType(), numberType()), imports))
                .isEqualTo("T::Hash[String, Numeric]");
        assertThat(mapper.mapType(ref("Set", numberType()), imports)).isEqualTo("T::Set[Numeric]");
        assertThat(imports.toSortedList()).contains("require 'set'", "require 'sorbet-runtime'");
    }

    @Test
    @DisplayName("可空联合类型")
    void testNullableUnion() {
        assertThat(mapper.mapType(union(stringType(), keyword(KeywordType.Keyword.NULL)), imports))
                .isEqualTo("T.nilable(String)");
        assertThat(mapper.mapType(union(stringType(), numberType()), imports)).isEqualTo("T.untyped");
        assertThat(mapper.mapType(union(literalType(str("a")), literalType(str("b"))), imports))
                .isEqualTo("String");
    }

    @Test
    @DisplayName("函数类型")
    void testFunctionType() {
        assertThat(mapper.mapType(functionType(params(param("x", numberType())), stringType()), imports))
                .isEqualTo("T.proc.params(arg0: Numeric).returns(String)");
        assertThat(mapper.mapType(functionType(params(), voidType()), imports)).isEqualTo("T.proc.void");
    }

    @Test
    @DisplayName("用户类型与泛型参数")
    void testReferences() {
        assertThat(mapper.mapType(ref("User"), imports)).isEqualTo("User");
        assertThat(mapper.mapType(ref("T"), imports)).isEqualTo("T.untyped");
        assertThat(mapper.mapType(ref("Box", stringType()), imports)).isEqualTo("Box[String]");
        assertThat(mapper.mapType(ref("Error"), imports)).isEqualTo("StandardError");
    }

    @Test
    @DisplayName("future 包装引入 concurrent-ruby")
    void testFuture() {
        assertThat(mapper.futureOf(stringType(), imports)).isEqualTo("Concurrent::Promises::Future");
        assertThat(imports.contains("require 'concurrent'")).isTrue();
    }
}
