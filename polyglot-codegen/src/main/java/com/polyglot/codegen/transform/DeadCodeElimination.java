package com.polyglot.codegen.transform;

import com.polyglot.codegen.ast.CompilationUnit;
import com.polyglot.codegen.ast.decl.ClassDecl;
import com.polyglot.codegen.ast.decl.FunctionDecl;
import com.polyglot.codegen.ast.decl.VariableDecl;
import com.polyglot.codegen.ast.expr.Expression;
import com.polyglot.codegen.ast.expr.Literal;
import com.polyglot.codegen.ast.expr.Literal.LiteralKind;
import com.polyglot.codegen.ast.expr.ParenthesizedExpr;
import com.polyglot.codegen.ast.stmt.*;

import java.util.ArrayList;
import java.util.List;

/**
 * 死代码消除。
 * - return/throw/break/continue 后的不可达语句（函数声明会被提升，保留）
 * - if(true)/if(false) 只保留可达分支（由常量折叠先处理条件）
 * - while(false) 整体删除
 */
public class DeadCodeElimination extends AstTransformer implements AstPass {

    @Override
    public String getName() {
        return "DeadCodeElimination";
    }

    @Override
    public CompilationUnit run(CompilationUnit unit) {
        return transform(unit);
    }

    @Override
    protected List<Statement> transformStatements(List<Statement> statements) {
        List<Statement> result = new ArrayList<>(statements.size());
        boolean changed = false;
        boolean terminated = false;
        for (Statement statement : statements) {
            if (terminated && !(statement instanceof FunctionDecl)) {
                changed = true;
                continue;
            }
            Statement transformed = transformStmt(statement);
            if (transformed != statement) {
                changed = true;
            }
            if (transformed instanceof Block && !(statement instanceof Block) && splicable((Block) transformed)) {
                // 消除 if 后留下的块直接并入外层
                for (Statement inner : ((Block) transformed).getStatements()) {
                    result.add(inner);
                    terminated |= isTerminator(inner);
                }
            } else if (transformed != null) {
                result.add(transformed);
                terminated |= isTerminator(transformed);
            }
        }
        return changed ? result : statements;
    }

    @Override
    public Statement visitIfStmt(IfStmt node, Void context) {
        Statement result = super.visitIfStmt(node, context);
        if (!(result instanceof IfStmt)) {
            return result;
        }
        IfStmt ifStmt = (IfStmt) result;
        Boolean condition = constantCondition(ifStmt.getCondition());
        if (condition == null) {
            return ifStmt;
        }
        Statement branch = condition ? ifStmt.getThenBranch() : ifStmt.getElseBranch();
        return branch != null ? withComments(node, branch) : null;
    }

    @Override
    public Statement visitWhileStmt(WhileStmt node, Void context) {
        if (Boolean.FALSE.equals(constantCondition(node.getCondition()))) {
            return null;
        }
        return super.visitWhileStmt(node, context);
    }

    // ==================== 工具 ====================

    private static boolean isTerminator(Statement stmt) {
        return stmt instanceof ReturnStmt || stmt instanceof ThrowStmt
                || stmt instanceof BreakStmt || stmt instanceof ContinueStmt;
    }

    /** 块内没有声明时才能并入外层，否则会改变作用域 */
    private static boolean splicable(Block block) {
        for (Statement stmt : block.getStatements()) {
            if (stmt instanceof VariableDecl || stmt instanceof FunctionDecl || stmt instanceof ClassDecl) {
                return false;
            }
        }
        return true;
    }

    private static Boolean constantCondition(Expression condition) {
        while (condition instanceof ParenthesizedExpr) {
            condition = ((ParenthesizedExpr) condition).getExpression();
        }
        if (condition instanceof Literal && ((Literal) condition).getLiteralKind() == LiteralKind.BOOLEAN) {
            return "true".equals(((Literal) condition).getValue());
        }
        return null;
    }
}
