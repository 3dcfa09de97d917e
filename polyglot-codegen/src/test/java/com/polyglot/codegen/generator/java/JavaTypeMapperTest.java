package com.polyglot.codegen.generator.java;

import com.polyglot.codegen.ast.type.KeywordType;
import com.polyglot.codegen.generator.ImportSet;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.polyglot.codegen.TestAst.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Java 类型映射测试
 */
class JavaTypeMapperTest {

    private JavaTypeMapper mapper;
    private ImportSet imports;

    @BeforeEach
    void setUp() {
        mapper = new JavaTypeMapper();
        imports = new ImportSet();
    }

    @Nested
    @DisplayName("基本类型")
    class PrimitiveTests {

        @Test
        @DisplayName("顶层位置使用基本类型")
        void testPrimitives() {
            assertThat(mapper.mapType(numberType(), imports)).isEqualTo("double");
            assertThat(mapper.mapType(booleanType(), imports)).isEqualTo("boolean");
            assertThat(mapper.mapType(voidType(), imports)).isEqualTo("void");
            assertThat(mapper.mapType(stringType(), imports)).isEqualTo("String");
        }

        @Test
        @DisplayName("类型实参位置使用包装类型")
        void testBoxed() {
            assertThat(mapper.mapBoxed(numberType(), imports)).isEqualTo("Double");
            assertThat(mapper.mapType(arrayOf(numberType()), imports)).isEqualTo("List<Double>");
            assertThat(JavaTypeMapper.box("int")).isEqualTo("Integer");
            assertThat(JavaTypeMapper.isPrimitive("String")).isFalse();
        }

        @Test
        @DisplayName("无法映射的类型退回 Object")
        void testUntyped() {
            assertThat(mapper.mapType(null, imports)).isEqualTo("Object");
            assertThat(mapper.mapType(anyType(), imports)).isEqualTo("Object");
            assertThat(mapper.mapType(unsupportedType("MappedType"), imports)).isEqualTo("Object");
            assertThat(mapper.untypedType()).isEqualTo("Object");
        }
    }

    @Nested
    @DisplayName("集合与泛型")
    class CollectionTests {

        @Test
        @DisplayName("集合类型登记 java.util 导入")
        void testCollections() {
            assertThat(mapper.mapType(ref("Map", stringType(), numberType()), imports))
                    .isEqualTo("Map<String, Double>");
            assertThat(mapper.mapType(ref("Set", stringType()), imports)).isEqualTo("Set<String>");
            assertThat(mapper.mapType(ref("Array", booleanType()), imports)).isEqualTo("List<Boolean>");
            assertThat(imports.toSortedList()).containsExactly("java.util.List", "java.util.Map", "java.util.Set");
        }

        @Test
        @DisplayName("用户泛型类型")
        void testGenericReference() {
            assertThat(mapper.mapType(ref("Box", numberType()), imports)).isEqualTo("Box<Double>");
            assertThat(mapper.mapType(ref("Error"), imports)).isEqualTo("RuntimeException");
        }
    }

    @Nested
    @DisplayName("联合与函数类型")
    class CompositeTests {

        @Test
        @DisplayName("单一类型加 null 映射为 Optional")
        void testNullable() {
            assertThat(mapper.mapType(union(stringType(), keyword(KeywordType.Keyword.UNDEFINED)), imports))
                    .isEqualTo("Optional<String>");
            assertThat(imports.contains("java.util.Optional")).isTrue();
        }

        @Test
        @DisplayName("成员映射结果相同时折叠")
        void testCollapse() {
            assertThat(mapper.mapType(union(literalType(str("a")), literalType(str("b"))), imports))
                    .isEqualTo("String");
            assertThat(mapper.mapType(union(stringType(), numberType()), imports)).isEqualTo("Object");
        }

        @Test
        @DisplayName("函数类型映射为函数式接口")
        void testFunctionalInterfaces() {
            assertThat(mapper.mapType(functionType(params(), voidType()), imports)).isEqualTo("Runnable");
            assertThat(mapper.mapType(functionType(params(), stringType()), imports)).isEqualTo("Supplier<String>");
            assertThat(mapper.mapType(functionType(params(param("x", numberType())), voidType()), imports))
                    .isEqualTo("Consumer<Double>");
            assertThat(mapper.mapType(functionType(params(param("x", numberType())), stringType()), imports))
                    .isEqualTo("Function<Double, String>");
            assertThat(mapper.mapType(functionType(
                    params(param("a", numberType()), param("b", numberType())), numberType()), imports))
                    .isEqualTo("BiFunction<Double, Double, Double>");
        }

        @Test
        @DisplayName("future 包装")
        void testFuture() {
            assertThat(mapper.futureOf(numberType(), imports)).isEqualTo("CompletableFuture<Double>");
            assertThat(mapper.futureOf(null, imports)).isEqualTo("CompletableFuture<Object>");
            assertThat(imports.contains("java.util.concurrent.CompletableFuture")).isTrue();
        }
    }
}
