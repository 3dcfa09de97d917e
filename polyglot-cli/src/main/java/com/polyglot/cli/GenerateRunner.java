package com.polyglot.cli;

import com.polyglot.codegen.TargetLanguage;
import com.polyglot.codegen.ast.CompilationUnit;
import com.polyglot.codegen.generator.GeneratorConfig;
import com.polyglot.codegen.json.AstFormatException;
import com.polyglot.codegen.json.AstJsonReader;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 生成执行器：读取、生成、写出，错误报告到 err 并返回退出码
 */
public class GenerateRunner {

    private final PrintWriter out;
    private final PrintWriter err;

    public GenerateRunner(PrintWriter out, PrintWriter err) {
        this.out = out;
        this.err = err;
    }

    /**
     * @param output 为 null 时写到 out
     * @return 0 成功，1 失败
     */
    public int generate(TargetLanguage language, GeneratorConfig config, Path input, Path output) {
        if (!Files.exists(input)) {
            return fail("文件不存在 - " + input);
        }
        CompilationUnit unit;
        try {
            unit = new AstJsonReader().readFile(input);
        } catch (AstFormatException e) {
            return fail("AST 格式错误: " + e.getMessage());
        } catch (IOException e) {
            return fail("读取失败: " + e.getMessage());
        }

        String code = language.createGenerator(config).generate(unit);

        if (output == null) {
            out.print(code);
            out.flush();
            return 0;
        }
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(output, code.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            return fail("写入失败: " + e.getMessage());
        }
        out.println("已生成: " + output);
        return 0;
    }

    int fail(String message) {
        err.println("错误: " + message);
        err.flush();
        return 1;
    }
}
