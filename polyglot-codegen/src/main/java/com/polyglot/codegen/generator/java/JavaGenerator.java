package com.polyglot.codegen.generator.java;

import com.polyglot.codegen.TargetLanguage;
import com.polyglot.codegen.generator.CodeGenerator;
import com.polyglot.codegen.generator.GeneratorConfig;

/**
 * Java 代码生成器
 */
public class JavaGenerator extends CodeGenerator {

    public JavaGenerator() {
        this(TargetLanguage.JAVA.defaultConfig());
    }

    public JavaGenerator(GeneratorConfig config) {
        super(new JavaDialect(), config);
    }
}
