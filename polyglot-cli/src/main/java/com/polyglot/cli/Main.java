package com.polyglot.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.UnsupportedEncodingException;
import java.nio.charset.Charset;

/**
 * Polyglot CLI 入口点（picocli）
 */
@Command(name = "polyglot", version = "Polyglot v0.1.0",
         description = "把 TypeScript AST（JSON）转换为 Ruby 或 Java 源码",
         mixinStandardHelpOptions = true,
         subcommands = {GenerateCommand.class})
public class Main implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        // 未指定子命令时打印用法
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    public static CommandLine createCommandLine() {
        return new CommandLine(new Main());
    }

    public static void main(String[] args) {
        String charsetName = getConsoleCharsetName();
        CommandLine cmd = createCommandLine();
        try {
            PrintStream out = new PrintStream(System.out, true, charsetName);
            PrintStream err = new PrintStream(System.err, true, charsetName);
            Charset consoleCharset = Charset.forName(charsetName);
            cmd.setOut(new PrintWriter(new OutputStreamWriter(out, consoleCharset), true));
            cmd.setErr(new PrintWriter(new OutputStreamWriter(err, consoleCharset), true));
        } catch (UnsupportedEncodingException e) {
            // 保持 picocli 默认输出
        }
        System.exit(cmd.execute(args));
    }

    /**
     * 控制台编码：优先 native.encoding（Windows 控制台通常为 GBK）
     */
    private static String getConsoleCharsetName() {
        String nativeEnc = System.getProperty("native.encoding");
        if (nativeEnc != null && Charset.isSupported(nativeEnc)) {
            return nativeEnc;
        }
        return Charset.defaultCharset().name();
    }
}
