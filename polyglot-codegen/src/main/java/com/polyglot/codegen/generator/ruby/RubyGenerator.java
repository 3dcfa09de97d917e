package com.polyglot.codegen.generator.ruby;

import com.polyglot.codegen.TargetLanguage;
import com.polyglot.codegen.generator.CodeGenerator;
import com.polyglot.codegen.generator.GeneratorConfig;

/**
 * Ruby 代码生成器
 */
public class RubyGenerator extends CodeGenerator {

    public RubyGenerator() {
        this(TargetLanguage.RUBY.defaultConfig());
    }

    public RubyGenerator(GeneratorConfig config) {
        super(new RubyDialect(), config);
    }
}
