package com.polyglot.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("generate 子命令")
class GenerateCommandTest {

    @TempDir
    Path tempDir;

    private CommandLine cmd;
    private StringWriter out;
    private StringWriter err;
    private Path input;

    @BeforeEach
    void setUp() throws IOException {
        cmd = Main.createCommandLine();
        out = new StringWriter();
        err = new StringWriter();
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        input = tempDir.resolve("greet.json");
        try (InputStream in = getClass().getResourceAsStream("/greet.json")) {
            Files.copy(in, input, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private String read(Path path) throws IOException {
        return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("生成 Ruby 文件")
    void testGenerateRubyFile() throws IOException {
        Path output = tempDir.resolve("out/greet.rb");
        int code = cmd.execute("generate", "-t", "ruby", "-i", input.toString(), "-o", output.toString());

        assertEquals(0, code, err.toString());
        assertTrue(out.toString().contains("已生成:"));
        String ruby = read(output);
        assertTrue(ruby.contains("def greet(name)"), ruby);
        assertTrue(ruby.endsWith("end\n"), ruby);
    }

    @Test
    @DisplayName("未指定输出时写到标准输出")
    void testGenerateJavaToStdout() {
        int code = cmd.execute("generate", "--target", "JAVA", "--input", input.toString(),
                "--namespace", "org.demo");

        assertEquals(0, code, err.toString());
        String java = out.toString();
        assertTrue(java.startsWith("package org.demo;"), java);
        assertTrue(java.contains("public final class Greet {"), java);
        assertTrue(java.contains("public static String greet(String name) {"), java);
    }

    @Test
    @DisplayName("命令行选项覆盖默认配置")
    void testOptionsOverrideDefaults() {
        int code = cmd.execute("generate", "-t", "ruby", "-i", input.toString(),
                "--indent", "4", "--typed-signatures");

        assertEquals(0, code, err.toString());
        String ruby = out.toString();
        assertTrue(ruby.contains("sig { params(name: String).returns(String) }"), ruby);
        assertTrue(ruby.contains("\n    return \"Hello, \" + name\n"), ruby);
    }

    @Test
    @DisplayName("--optimize 在生成前折叠常量")
    void testOptimizeOption() throws IOException {
        Path answer = tempDir.resolve("answer.json");
        String json = "{\"kind\":\"SourceFile\",\"fileName\":\"answer.ts\",\"text\":\"\",\"statements\":["
                + "{\"kind\":\"FunctionDeclaration\",\"name\":\"answer\",\"parameters\":[],"
                + "\"body\":{\"kind\":\"Block\",\"statements\":[{\"kind\":\"ReturnStatement\",\"expression\":"
                + "{\"kind\":\"BinaryExpression\",\"left\":{\"kind\":\"NumericLiteral\",\"text\":\"6\"},"
                + "\"operatorToken\":\"*\",\"right\":{\"kind\":\"NumericLiteral\",\"text\":\"7\"}}}]}}]}";
        Files.write(answer, json.getBytes(StandardCharsets.UTF_8));

        int code = cmd.execute("generate", "-t", "ruby", "-i", answer.toString(), "--optimize");
        assertEquals(0, code, err.toString());
        assertTrue(out.toString().contains("return 42\n"), out.toString());

        out.getBuffer().setLength(0);
        code = cmd.execute("generate", "-t", "ruby", "-i", answer.toString());
        assertEquals(0, code, err.toString());
        assertTrue(out.toString().contains("return 6 * 7\n"), out.toString());
    }

    @Test
    @DisplayName("输入文件不存在")
    void testMissingInput() {
        int code = cmd.execute("generate", "-t", "ruby", "-i", tempDir.resolve("none.json").toString());

        assertEquals(1, code);
        assertTrue(err.toString().contains("错误: 文件不存在"));
    }

    @Test
    @DisplayName("未知目标语言")
    void testUnknownTarget() {
        int code = cmd.execute("generate", "-t", "python", "-i", input.toString());

        assertEquals(1, code);
        assertTrue(err.toString().contains("未知目标语言: python"));
    }

    @Test
    @DisplayName("非法缩进")
    void testInvalidIndent() {
        int code = cmd.execute("generate", "-t", "java", "-i", input.toString(), "--indent", "0");

        assertEquals(1, code);
        assertTrue(err.toString().contains("indentWidth"));
    }

    @Test
    @DisplayName("AST 格式错误")
    void testMalformedAst() throws IOException {
        Path broken = tempDir.resolve("broken.json");
        Files.write(broken, "{\"kind\":\"Block\"}".getBytes(StandardCharsets.UTF_8));

        int code = cmd.execute("generate", "-t", "ruby", "-i", broken.toString());

        assertEquals(1, code);
        assertTrue(err.toString().contains("错误: AST 格式错误"));
    }

    @Test
    @DisplayName("缺少必需选项返回用法错误")
    void testMissingRequiredOption() {
        int code = cmd.execute("generate", "-t", "ruby");

        assertEquals(CommandLine.ExitCode.USAGE, code);
    }
}
