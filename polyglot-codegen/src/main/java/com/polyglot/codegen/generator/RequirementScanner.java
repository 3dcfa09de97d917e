package com.polyglot.codegen.generator;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.CompilationUnit;
import com.polyglot.codegen.ast.decl.ClassDecl;
import com.polyglot.codegen.ast.decl.EnumDecl;
import com.polyglot.codegen.ast.decl.InterfaceDecl;
import com.polyglot.codegen.ast.decl.ModuleDecl;
import com.polyglot.codegen.ast.decl.TypeAliasDecl;
import com.polyglot.codegen.ast.decl.VariableDecl;
import com.polyglot.codegen.ast.stmt.Statement;
import com.polyglot.codegen.ast.type.TypeNode;

import java.util.List;

/**
 * 分析阶段：在写出任何代码之前遍历整棵树，
 * 收集顶层常量、类型名，以及目标代码需要的全部导入。
 */
final class RequirementScanner {
    private final TargetDialect dialect;

    RequirementScanner(TargetDialect dialect) {
        this.dialect = dialect;
    }

    void scan(CompilationUnit unit, GenerationContext ctx) {
        collectSymbols(unit.getStatements(), ctx);
        boolean mapTypes = dialect.emitsTypes(ctx.getConfig());
        for (Statement statement : unit.getStatements()) {
            walk(statement, mapTypes, ctx);
        }
    }

    /** 顶层与命名空间内的 const 名、类型声明名 */
    private void collectSymbols(List<Statement> statements, GenerationContext ctx) {
        for (Statement statement : statements) {
            if (statement instanceof VariableDecl && ((VariableDecl) statement).isConst()) {
                for (VariableDecl.Declarator d : ((VariableDecl) statement).getDeclarators()) {
                    ctx.addConstant(d.getName());
                }
            } else if (statement instanceof ModuleDecl) {
                ctx.addTypeName(((ModuleDecl) statement).getName());
                collectSymbols(((ModuleDecl) statement).getStatements(), ctx);
            } else if (statement instanceof ClassDecl) {
                ctx.addTypeName(((ClassDecl) statement).getName());
            } else if (statement instanceof InterfaceDecl) {
                ctx.addTypeName(((InterfaceDecl) statement).getName());
            } else if (statement instanceof EnumDecl) {
                ctx.addTypeName(((EnumDecl) statement).getName());
            } else if (statement instanceof TypeAliasDecl) {
                ctx.addTypeName(((TypeAliasDecl) statement).getName());
            }
        }
    }

    private void walk(AstNode node, boolean mapTypes, GenerationContext ctx) {
        if (node == null) {
            return;
        }
        dialect.scan(node, ctx);
        if (node instanceof TypeNode) {
            // 嵌套类型由映射器递归处理
            if (mapTypes) {
                ctx.mapType((TypeNode) node);
            }
            return;
        }
        for (AstNode child : node.getChildren()) {
            walk(child, mapTypes, ctx);
        }
    }
}
