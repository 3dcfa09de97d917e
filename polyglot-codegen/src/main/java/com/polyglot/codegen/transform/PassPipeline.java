package com.polyglot.codegen.transform;

import com.polyglot.codegen.ast.CompilationUnit;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * AST 优化管线，按加入顺序依次执行各 pass。
 */
public class PassPipeline {

    private static final Logger LOG = Logger.getLogger(PassPipeline.class.getName());

    private final List<AstPass> passes = new ArrayList<>();

    /**
     * 创建默认管线：常量折叠后再消除死代码（折叠出的 if(false) 由后者删除）。
     */
    public static PassPipeline createDefault() {
        PassPipeline pipeline = new PassPipeline();
        pipeline.addPass(new ConstantFolding());
        pipeline.addPass(new DeadCodeElimination());
        return pipeline;
    }

    public void addPass(AstPass pass) {
        passes.add(pass);
    }

    public List<AstPass> getPasses() { return passes; }

    public CompilationUnit run(CompilationUnit unit) {
        for (AstPass pass : passes) {
            CompilationUnit result = pass.run(unit);
            if (result != unit) {
                LOG.fine("pass " + pass.getName() + " 改写了 " + unit.getFileName());
            }
            unit = result;
        }
        return unit;
    }
}
