package com.polyglot.codegen.transform;

import com.polyglot.codegen.ast.CommentRange;
import com.polyglot.codegen.ast.CompilationUnit;
import com.polyglot.codegen.ast.SourceSpan;
import com.polyglot.codegen.ast.decl.ClassDecl;
import com.polyglot.codegen.ast.decl.MethodDecl;
import com.polyglot.codegen.ast.decl.VariableDecl;
import com.polyglot.codegen.ast.expr.BinaryExpr;
import com.polyglot.codegen.ast.expr.Expression;
import com.polyglot.codegen.ast.expr.Identifier;
import com.polyglot.codegen.ast.expr.Literal;
import com.polyglot.codegen.ast.expr.ParenthesizedExpr;
import com.polyglot.codegen.ast.expr.UnaryExpr;
import com.polyglot.codegen.ast.stmt.ReturnStmt;
import com.polyglot.codegen.ast.stmt.Statement;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static com.polyglot.codegen.TestAst.*;
import static com.polyglot.codegen.ast.expr.BinaryExpr.BinaryOp.*;
import static org.assertj.core.api.Assertions.*;

/**
 * 常量折叠测试
 */
class ConstantFoldingTest {

    private static CompilationUnit fold(Statement... statements) {
        return new ConstantFolding().run(unit(statements));
    }

    /** 折叠 let x = expr 后的初始化器 */
    private static Expression folded(Expression init) {
        VariableDecl decl = (VariableDecl) fold(let("x", init)).getStatements().get(0);
        return decl.getDeclarators().get(0).getInitializer();
    }

    private static void assertLiteral(Expression expr, Literal.LiteralKind kind, String value) {
        assertThat(expr).isInstanceOf(Literal.class);
        assertThat(((Literal) expr).getLiteralKind()).isEqualTo(kind);
        assertThat(((Literal) expr).getValue()).isEqualTo(value);
    }

    private static ParenthesizedExpr paren(Expression expr) {
        return new ParenthesizedExpr(SourceSpan.UNKNOWN, expr);
    }

    private static UnaryExpr unary(UnaryExpr.UnaryOp op, Expression operand) {
        return new UnaryExpr(SourceSpan.UNKNOWN, op, operand, true);
    }

    // ============ 数字 ============

    @Nested
    @DisplayName("数字运算")
    class NumberTests {

        @Test
        @DisplayName("整数运算保持整数写法")
        void testIntegerArithmetic() {
            assertLiteral(folded(bin(num("1"), ADD, num("2"))), Literal.LiteralKind.NUMBER, "3");
            assertLiteral(folded(bin(num("10"), SUB, num("15"))), Literal.LiteralKind.NUMBER, "-5");
            assertLiteral(folded(bin(num("6"), MUL, num("7"))), Literal.LiteralKind.NUMBER, "42");
            assertLiteral(folded(bin(num("17"), MOD, num("5"))), Literal.LiteralKind.NUMBER, "2");
        }

        @Test
        @DisplayName("除法按双精度计算")
        void testDivision() {
            assertLiteral(folded(bin(num("7"), DIV, num("2"))), Literal.LiteralKind.NUMBER, "3.5");
            assertLiteral(folded(bin(num("8"), DIV, num("2"))), Literal.LiteralKind.NUMBER, "4");
        }

        @Test
        @DisplayName("小数操作数的结果带小数点")
        void testDecimalOperands() {
            assertLiteral(folded(bin(num("1.5"), ADD, num("1.5"))), Literal.LiteralKind.NUMBER, "3.0");
            assertLiteral(folded(bin(num("0.5"), MUL, num("3"))), Literal.LiteralKind.NUMBER, "1.5");
        }

        @Test
        @DisplayName("十六进制与分隔符")
        void testRadixLiterals() {
            assertLiteral(folded(bin(num("0x10"), ADD, num("1"))), Literal.LiteralKind.NUMBER, "17");
            assertLiteral(folded(bin(num("1_000"), MUL, num("2"))), Literal.LiteralKind.NUMBER, "2000");
        }

        @Test
        @DisplayName("除零、BigInt 与超出 int 范围的结果不折叠")
        void testUnfoldable() {
            BinaryExpr byZero = bin(num("1"), DIV, num("0"));
            assertThat(folded(byZero)).isSameAs(byZero);
            BinaryExpr bigint = bin(num("1n"), ADD, num("2n"));
            assertThat(folded(bigint)).isSameAs(bigint);
            BinaryExpr huge = bin(num("2147483647"), ADD, num("1"));
            assertThat(folded(huge)).isSameAs(huge);
        }

        @Test
        @DisplayName("比较运算得到布尔值")
        void testComparison() {
            assertLiteral(folded(bin(num("1"), GT, num("2"))), Literal.LiteralKind.BOOLEAN, "false");
            assertLiteral(folded(bin(num("3"), LE, num("3"))), Literal.LiteralKind.BOOLEAN, "true");
            assertLiteral(folded(bin(num("1"), STRICT_EQ, num("1.0"))), Literal.LiteralKind.BOOLEAN, "true");
        }

        @Test
        @DisplayName("括号内先折叠再参与外层运算")
        void testNestedParentheses() {
            Expression expr = bin(paren(bin(num("2"), ADD, num("3"))), MUL, num("4"));
            assertLiteral(folded(expr), Literal.LiteralKind.NUMBER, "20");
        }

        @Test
        @DisplayName("一元负号")
        void testNegation() {
            assertLiteral(folded(unary(UnaryExpr.UnaryOp.NEG, paren(bin(num("1"), ADD, num("2"))))),
                    Literal.LiteralKind.NUMBER, "-3");
        }
    }

    // ============ 字符串与布尔 ============

    @Nested
    @DisplayName("字符串与布尔")
    class StringAndBooleanTests {

        @Test
        @DisplayName("字符串拼接与比较")
        void testStrings() {
            assertLiteral(folded(bin(str("foo"), ADD, str("bar"))), Literal.LiteralKind.STRING, "foobar");
            assertLiteral(folded(bin(str("a"), STRICT_NE, str("b"))), Literal.LiteralKind.BOOLEAN, "true");
        }

        @Test
        @DisplayName("字符串与数字相加不折叠")
        void testMixedConcat() {
            BinaryExpr mixed = bin(str("n="), ADD, num("1"));
            assertThat(folded(mixed)).isSameAs(mixed);
        }

        @Test
        @DisplayName("逻辑非与布尔相等")
        void testBooleans() {
            assertLiteral(folded(unary(UnaryExpr.UnaryOp.NOT, bool(true))), Literal.LiteralKind.BOOLEAN, "false");
            assertLiteral(folded(bin(bool(true), EQ, bool(false))), Literal.LiteralKind.BOOLEAN, "false");
        }

        @Test
        @DisplayName("短路逻辑按左侧常量化简")
        void testShortCircuit() {
            assertThat(folded(bin(bool(true), AND, id("ready")))).isInstanceOf(Identifier.class);
            assertThat(folded(bin(bool(false), OR, id("ready")))).isInstanceOf(Identifier.class);
            assertLiteral(folded(bin(bool(false), AND, call("sideEffect"))), Literal.LiteralKind.BOOLEAN, "false");
            assertLiteral(folded(bin(bool(true), OR, call("sideEffect"))), Literal.LiteralKind.BOOLEAN, "true");
        }

        @Test
        @DisplayName("右侧常量不化简，左侧的求值不能省略")
        void testRightConstantKept() {
            BinaryExpr expr = bin(call("check"), AND, bool(true));
            assertThat(folded(expr)).isSameAs(expr);
        }
    }

    // ============ 遍历 ============

    @Nested
    @DisplayName("遍历与结构")
    class TraversalTests {

        @Test
        @DisplayName("无可折叠内容时返回原编译单元")
        void testUnchangedUnit() {
            CompilationUnit unit = unit(let("x", bin(id("a"), ADD, num("0"))), stmt(call("run", num("1"))));
            assertThat(new ConstantFolding().run(unit)).isSameAs(unit);
        }

        @Test
        @DisplayName("方法体内的表达式同样折叠")
        void testMethodBody() {
            CompilationUnit result = fold(classDecl("Box",
                    method("size", params(), numberType(), block(ret(bin(num("4"), MUL, num("4")))))));
            MethodDecl method = (MethodDecl) ((ClassDecl) result.getStatements().get(0)).getMembers().get(0);
            ReturnStmt ret = (ReturnStmt) method.getBody().getStatements().get(0);
            assertLiteral(ret.getValue(), Literal.LiteralKind.NUMBER, "16");
            assertThat(method.getName()).isEqualTo("size");
        }

        @Test
        @DisplayName("改写后的语句保留前导注释")
        void testCommentsPreserved() {
            VariableDecl decl = let("x", bin(num("1"), ADD, num("1")));
            decl.setLeadingComments(Collections.singletonList(new CommentRange(0, 10, false)));
            Statement result = fold(decl).getStatements().get(0);
            assertThat(result).isNotSameAs(decl);
            assertThat(result.getLeadingComments()).hasSize(1);
        }
    }
}
