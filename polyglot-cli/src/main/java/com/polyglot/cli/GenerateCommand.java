package com.polyglot.cli;

import com.polyglot.codegen.TargetLanguage;
import com.polyglot.codegen.generator.GeneratorConfig;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * picocli generate 子命令：读取 AST JSON，生成目标语言源码
 */
@Command(name = "generate", description = "从 AST JSON 生成目标语言源码")
public class GenerateCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Option(names = {"-t", "--target"}, required = true, description = "目标语言（ruby, java）")
    String target;

    @Option(names = {"-i", "--input"}, required = true, description = "AST JSON 文件")
    Path input;

    @Option(names = {"-o", "--output"}, description = "输出文件（默认写到标准输出）")
    Path output;

    @Option(names = "--target-version", description = "目标语言版本（ruby 默认 3.0，java 默认 17）")
    String targetVersion;

    @Option(names = "--namespace", description = "命名空间前缀：Ruby 模块路径或 Java 包名")
    String namespace;

    @Option(names = "--indent", description = "缩进空格数")
    Integer indent;

    @Option(names = "--no-comments", description = "不保留源码注释")
    boolean noComments;

    @Option(names = "--value-objects", negatable = true, description = "纯数据类生成值对象（默认开启）")
    Boolean valueObjects;

    @Option(names = "--typed-signatures", negatable = true,
            description = "Ruby 生成 Sorbet 签名；Java 局部变量写显式类型")
    Boolean typedSignatures;

    @Option(names = "--optimize", description = "生成前做常量折叠与死代码消除")
    boolean optimize;

    @Override
    public Integer call() {
        GenerateRunner runner = new GenerateRunner(spec.commandLine().getOut(), spec.commandLine().getErr());
        TargetLanguage language;
        GeneratorConfig config;
        try {
            language = TargetLanguage.fromName(target);
            config = buildConfig(language);
        } catch (IllegalArgumentException e) {
            return runner.fail(e.getMessage());
        }
        return runner.generate(language, config, input, output);
    }

    /** 以目标默认配置为基础，覆盖命令行指定的选项 */
    GeneratorConfig buildConfig(TargetLanguage language) {
        GeneratorConfig.Builder builder = language.defaultConfig().toBuilder();
        if (targetVersion != null) {
            builder.targetVersion(targetVersion);
        }
        if (namespace != null) {
            builder.namespacePrefix(namespace);
        }
        if (indent != null) {
            builder.indentWidth(indent);
        }
        if (noComments) {
            builder.preserveComments(false);
        }
        if (valueObjects != null) {
            builder.useIdiomaticValueObjects(valueObjects);
        }
        if (typedSignatures != null) {
            builder.emitTypedSignatures(typedSignatures);
        }
        if (optimize) {
            builder.optimize(true);
        }
        return builder.build();
    }
}
