package com.polyglot.codegen;

import com.polyglot.codegen.generator.CodeGenerator;
import com.polyglot.codegen.generator.GeneratorConfig;
import com.polyglot.codegen.generator.java.JavaGenerator;
import com.polyglot.codegen.generator.ruby.RubyGenerator;

/**
 * 支持的目标语言及其默认配置
 */
public enum TargetLanguage {
    RUBY("ruby", ".rb") {
        @Override
        public GeneratorConfig defaultConfig() {
            return GeneratorConfig.builder()
                    .targetVersion("3.0")
                    .namespacePrefix("")
                    .indentWidth(2)
                    .emitTypedSignatures(false)
                    .build();
        }

        @Override
        public CodeGenerator createGenerator(GeneratorConfig config) {
            return new RubyGenerator(config);
        }
    },

    JAVA("java", ".java") {
        @Override
        public GeneratorConfig defaultConfig() {
            return GeneratorConfig.builder()
                    .targetVersion("17")
                    .namespacePrefix("com.example")
                    .indentWidth(4)
                    .emitTypedSignatures(true)
                    .build();
        }

        @Override
        public CodeGenerator createGenerator(GeneratorConfig config) {
            return new JavaGenerator(config);
        }
    };

    private final String id;
    private final String fileExtension;

    TargetLanguage(String id, String fileExtension) {
        this.id = id;
        this.fileExtension = fileExtension;
    }

    /** 该目标的默认配置，注释保留与值对象默认开启 */
    public abstract GeneratorConfig defaultConfig();

    public abstract CodeGenerator createGenerator(GeneratorConfig config);

    public CodeGenerator createGenerator() {
        return createGenerator(defaultConfig());
    }

    public String getId() {
        return id;
    }

    public String getFileExtension() {
        return fileExtension;
    }

    /**
     * 按名称查找目标语言（不区分大小写）
     *
     * @throws IllegalArgumentException 未知目标
     */
    public static TargetLanguage fromName(String name) {
        for (TargetLanguage language : values()) {
            if (language.id.equalsIgnoreCase(name)) {
                return language;
            }
        }
        throw new IllegalArgumentException("未知目标语言: " + name + "（可选: ruby, java）");
    }
}
