package com.polyglot.codegen.transform;

import com.polyglot.codegen.ast.CompilationUnit;
import com.polyglot.codegen.ast.decl.FunctionDecl;
import com.polyglot.codegen.ast.decl.VariableDecl;
import com.polyglot.codegen.ast.expr.BinaryExpr;
import com.polyglot.codegen.ast.expr.CallExpr;
import com.polyglot.codegen.ast.stmt.Block;
import com.polyglot.codegen.ast.stmt.ExpressionStmt;
import com.polyglot.codegen.ast.stmt.IfStmt;
import com.polyglot.codegen.ast.stmt.ReturnStmt;
import com.polyglot.codegen.ast.stmt.Statement;
import com.polyglot.codegen.ast.stmt.SwitchStmt;
import com.polyglot.codegen.ast.stmt.WhileStmt;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.polyglot.codegen.TestAst.*;
import static org.assertj.core.api.Assertions.*;

/**
 * 死代码消除与默认管线测试
 */
class DeadCodeEliminationTest {

    private static List<Statement> eliminate(Statement... statements) {
        return new DeadCodeElimination().run(unit(statements)).getStatements();
    }

    /** 函数体消除后的语句 */
    private static List<Statement> bodyOf(Statement function) {
        return ((FunctionDecl) function).getBody().getStatements();
    }

    // ============ 不可达语句 ============

    @Nested
    @DisplayName("不可达语句")
    class UnreachableTests {

        @Test
        @DisplayName("return 之后的语句被删除")
        void testAfterReturn() {
            List<Statement> result = eliminate(function("f", params(), null, block(
                    stmt(call("a")), ret(num("1")), stmt(call("b")), let("x", num("2")))));
            List<Statement> body = bodyOf(result.get(0));
            assertThat(body).hasSize(2);
            assertThat(body.get(1)).isInstanceOf(ReturnStmt.class);
        }

        @Test
        @DisplayName("跳转之后的函数声明因提升而保留")
        void testHoistedFunctionKept() {
            List<Statement> result = eliminate(function("outer", params(), null, block(
                    ret(call("helper")),
                    stmt(call("dead")),
                    function("helper", params(), null, block(ret(num("1")))))));
            List<Statement> body = bodyOf(result.get(0));
            assertThat(body).hasSize(2);
            assertThat(body.get(1)).isInstanceOf(FunctionDecl.class);
        }

        @Test
        @DisplayName("throw、break、continue 同样截断")
        void testOtherTerminators() {
            List<Statement> result = eliminate(
                    whileLoop(id("running"), block(breakStmt(), stmt(call("dead")))),
                    whileLoop(id("running"), block(continueStmt(), stmt(call("dead")))),
                    function("fail", params(), null, block(throwStmt(id("err")), ret(num("0")))));
            assertThat(((Block) ((WhileStmt) result.get(0)).getBody()).getStatements()).hasSize(1);
            assertThat(((Block) ((WhileStmt) result.get(1)).getBody()).getStatements()).hasSize(1);
            assertThat(bodyOf(result.get(2))).hasSize(1);
        }

        @Test
        @DisplayName("switch 分支内 break 之后的语句被删除")
        void testSwitchClause() {
            List<Statement> result = eliminate(switchStmt(id("x"),
                    caseClause(num("1"), stmt(call("a")), breakStmt(), stmt(call("dead")))));
            SwitchStmt sw = (SwitchStmt) result.get(0);
            assertThat(sw.getClauses().get(0).getStatements()).hasSize(2);
        }

        @Test
        @DisplayName("无死代码时返回原编译单元")
        void testUnchangedUnit() {
            CompilationUnit unit = unit(let("x", num("1")), ifStmt(id("ok"), block(ret(id("x"))), null));
            assertThat(new DeadCodeElimination().run(unit)).isSameAs(unit);
        }
    }

    // ============ 常量条件 ============

    @Nested
    @DisplayName("常量条件")
    class ConstantConditionTests {

        @Test
        @DisplayName("if(false) 无 else 时整句删除")
        void testIfFalseRemoved() {
            List<Statement> result = eliminate(stmt(call("a")),
                    ifStmt(bool(false), block(stmt(call("dead"))), null), stmt(call("b")));
            assertThat(result).hasSize(2);
        }

        @Test
        @DisplayName("if(true) 的块并入外层")
        void testIfTrueSpliced() {
            List<Statement> result = eliminate(
                    ifStmt(bool(true), block(stmt(call("a")), stmt(call("b"))), block(stmt(call("dead")))));
            assertThat(result).hasSize(2).allMatch(s -> s instanceof ExpressionStmt);
        }

        @Test
        @DisplayName("if(false) 保留 else 分支")
        void testElseBranchKept() {
            List<Statement> result = eliminate(
                    ifStmt(bool(false), block(stmt(call("dead"))), ifStmt(id("ok"), block(stmt(call("a"))), null)));
            assertThat(result).hasSize(1);
            assertThat(result.get(0)).isInstanceOf(IfStmt.class);
        }

        @Test
        @DisplayName("含声明的块不并入外层")
        void testScopedBlockKept() {
            List<Statement> result = eliminate(ifStmt(bool(true), block(let("x", num("1"))), null));
            assertThat(result).hasSize(1);
            assertThat(result.get(0)).isInstanceOf(Block.class);
            assertThat(((Block) result.get(0)).getStatements().get(0)).isInstanceOf(VariableDecl.class);
        }

        @Test
        @DisplayName("分支中的 return 截断外层后续语句")
        void testSplicedReturnTerminates() {
            List<Statement> result = eliminate(function("f", params(), null, block(
                    ifStmt(bool(true), block(ret(num("1"))), null),
                    stmt(call("dead")))));
            List<Statement> body = bodyOf(result.get(0));
            assertThat(body).hasSize(1);
            assertThat(body.get(0)).isInstanceOf(ReturnStmt.class);
        }

        @Test
        @DisplayName("while(false) 整体删除，循环体位置留空块")
        void testWhileFalse() {
            List<Statement> result = eliminate(
                    whileLoop(bool(false), block(stmt(call("dead")))),
                    whileLoop(id("running"), ifStmt(bool(false), stmt(call("dead")), null)));
            assertThat(result).hasSize(1);
            Block body = (Block) ((WhileStmt) result.get(0)).getBody();
            assertThat(body.isEmpty()).isTrue();
        }
    }

    // ============ 管线 ============

    @Nested
    @DisplayName("默认管线")
    class PipelineTests {

        @Test
        @DisplayName("先折叠条件再删除分支")
        void testFoldThenEliminate() {
            CompilationUnit result = PassPipeline.createDefault().run(unit(
                    ifStmt(bin(num("1"), BinaryExpr.BinaryOp.GT, num("2")),
                            block(stmt(call("never"))),
                            block(stmt(call("always"))))));
            assertThat(result.getStatements()).hasSize(1);
            ExpressionStmt only = (ExpressionStmt) result.getStatements().get(0);
            assertThat(only.getExpression()).isInstanceOf(CallExpr.class);
        }

        @Test
        @DisplayName("默认顺序为常量折叠、死代码消除")
        void testDefaultOrder() {
            assertThat(PassPipeline.createDefault().getPasses())
                    .extracting(AstPass::getName)
                    .containsExactly("ConstantFolding", "DeadCodeElimination");
        }

        @Test
        @DisplayName("无可优化内容时返回原编译单元")
        void testNoChange() {
            CompilationUnit unit = unit(let("x", id("y")));
            assertThat(PassPipeline.createDefault().run(unit)).isSameAs(unit);
        }
    }
}
