package com.polyglot.codegen.transform;

import com.polyglot.codegen.ast.CompilationUnit;

/**
 * 生成前的 AST 优化 pass 接口。
 */
public interface AstPass {

    /**
     * Pass 名称（用于日志/调试）。
     */
    String getName();

    /**
     * 对编译单元执行优化，无变化时返回原对象。
     */
    CompilationUnit run(CompilationUnit unit);
}
