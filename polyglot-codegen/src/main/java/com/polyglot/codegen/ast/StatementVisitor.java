package com.polyglot.codegen.ast;

import com.polyglot.codegen.ast.decl.*;
import com.polyglot.codegen.ast.stmt.*;

/**
 * 语句与声明访问者。
 *
 * <p>每个节点类型一个方法，新增节点时所有实现都必须跟进。</p>
 *
 * @param <R> 返回类型
 * @param <C> 上下文类型
 */
public interface StatementVisitor<R, C> {

    // ============ 声明 ============

    R visitClassDecl(ClassDecl node, C context);

    R visitInterfaceDecl(InterfaceDecl node, C context);

    R visitEnumDecl(EnumDecl node, C context);

    R visitFunctionDecl(FunctionDecl node, C context);

    R visitVariableDecl(VariableDecl node, C context);

    R visitModuleDecl(ModuleDecl node, C context);

    R visitImportDecl(ImportDecl node, C context);

    R visitTypeAliasDecl(TypeAliasDecl node, C context);

    // ============ 语句 ============

    R visitBlock(Block node, C context);

    R visitExpressionStmt(ExpressionStmt node, C context);

    R visitIfStmt(IfStmt node, C context);

    R visitForStmt(ForStmt node, C context);

    R visitForOfStmt(ForOfStmt node, C context);

    R visitWhileStmt(WhileStmt node, C context);

    R visitDoWhileStmt(DoWhileStmt node, C context);

    R visitSwitchStmt(SwitchStmt node, C context);

    R visitTryStmt(TryStmt node, C context);

    R visitThrowStmt(ThrowStmt node, C context);

    R visitReturnStmt(ReturnStmt node, C context);

    R visitBreakStmt(BreakStmt node, C context);

    R visitContinueStmt(ContinueStmt node, C context);

    R visitUnsupportedStmt(UnsupportedStmt node, C context);
}
