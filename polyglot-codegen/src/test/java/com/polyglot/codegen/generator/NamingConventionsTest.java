package com.polyglot.codegen.generator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NamingConventionsTest {

    @Nested
    @DisplayName("snake_case")
    class SnakeCaseTests {

        @Test
        @DisplayName("camelCase 转换")
        void testCamelCase() {
            assertEquals("user_id", NamingConventions.toSnakeCase("userId"));
            assertEquals("first_name", NamingConventions.toSnakeCase("firstName"));
        }

        @Test
        @DisplayName("连续大写视为缩写")
        void testAcronym() {
            assertEquals("parse_http_response", NamingConventions.toSnakeCase("parseHTTPResponse"));
            assertEquals("xml_parser", NamingConventions.toSnakeCase("XMLParser"));
        }

        @Test
        @DisplayName("数字后的大写字母")
        void testDigits() {
            assertEquals("version2_beta", NamingConventions.toSnakeCase("version2Beta"));
        }

        @Test
        @DisplayName("已是 snake_case 保持不变")
        void testAlreadySnake() {
            assertEquals("already_snake", NamingConventions.toSnakeCase("already_snake"));
            assertEquals("", NamingConventions.toSnakeCase(""));
        }
    }

    @Nested
    @DisplayName("常量命名")
    class ConstantCaseTests {

        @Test
        @DisplayName("camelCase 转 SCREAMING_SNAKE_CASE")
        void testConvert() {
            assertEquals("MAX_RETRIES", NamingConventions.toConstantCase("maxRetries"));
            assertEquals("API_URL", NamingConventions.toConstantCase("apiUrl"));
        }

        @Test
        @DisplayName("已是常量写法原样返回")
        void testIdempotent() {
            assertEquals("MAX", NamingConventions.toConstantCase("MAX"));
            assertEquals("HTTP_2", NamingConventions.toConstantCase("HTTP_2"));
            assertTrue(NamingConventions.isConstantCase("A_B"));
            assertFalse(NamingConventions.isConstantCase("Ab"));
            assertFalse(NamingConventions.isConstantCase("_1"));
        }
    }

    @Nested
    @DisplayName("PascalCase 与辅助方法")
    class PascalCaseTests {

        @Test
        @DisplayName("按分隔符切分")
        void testSeparators() {
            assertEquals("UserService", NamingConventions.toPascalCase("user-service"));
            assertEquals("ApiClient", NamingConventions.toPascalCase("api_client"));
            assertEquals("Main", NamingConventions.toPascalCase("main"));
        }

        @Test
        @DisplayName("数字开头加下划线")
        void testLeadingDigit() {
            assertEquals("_2fa", NamingConventions.toPascalCase("2fa"));
        }

        @Test
        @DisplayName("首字母处理")
        void testCapitalize() {
            assertEquals("Name", NamingConventions.capitalize("name"));
            assertTrue(NamingConventions.startsWithUpperCase("Point"));
            assertFalse(NamingConventions.startsWithUpperCase("point"));
            assertFalse(NamingConventions.startsWithUpperCase(""));
        }

        @Test
        @DisplayName("Ruby 符号名")
        void testRubySymbolName() {
            assertTrue(NamingConventions.isRubySymbolName("user_id"));
            assertTrue(NamingConventions.isRubySymbolName("_private"));
            assertFalse(NamingConventions.isRubySymbolName("content-type"));
            assertFalse(NamingConventions.isRubySymbolName("1st"));
        }
    }
}
