package com.polyglot.codegen.generator;

import com.polyglot.codegen.ast.expr.BinaryExpr;
import com.polyglot.codegen.ast.stmt.ForStmt;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.polyglot.codegen.TestAst.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 计数循环识别测试
 */
class CountingLoopMatcherTest {

    @Test
    @DisplayName("字面量上界")
    void testLiteralBound() {
        CountingLoop loop = CountingLoopMatcher.match(countingLoop("i", num("10")));
        assertNotNull(loop);
        assertEquals("i", loop.getVariable());
        assertEquals("0", loop.getStart().getValue());
    }

    @Test
    @DisplayName("属性链上界")
    void testPropertyBound() {
        assertNotNull(CountingLoopMatcher.match(countingLoop("i", prop(id("items"), "length"))));
        assertNotNull(CountingLoopMatcher.match(countingLoop("i", prop(thisProp("rows"), "length"))));
    }

    @Test
    @DisplayName("i += 1 视为单位递增")
    void testAddAssignIncrement() {
        ForStmt loop = forLoop(let("i", num("0")), bin(id("i"), BinaryExpr.BinaryOp.LT, num("5")),
                bin(id("i"), BinaryExpr.BinaryOp.ADD_ASSIGN, num("1")), block());
        assertNotNull(CountingLoopMatcher.match(loop));
    }

    @Test
    @DisplayName("循环体闭包引用循环变量时标记为被捕获")
    void testCapturedByClosure() {
        CountingLoop captured = CountingLoopMatcher.match(countingLoop("i", num("3"),
                stmt(invoke(id("fs"), "push", arrow(params(), id("i"))))));
        CountingLoop plain = CountingLoopMatcher.match(countingLoop("i", num("3"),
                stmt(invoke(id("fs"), "push", id("i"))),
                stmt(invoke(id("fs"), "push", arrow(params(), id("j"))))));
        assertNotNull(captured);
        assertTrue(captured.isCaptured());
        assertNotNull(plain);
        assertFalse(plain.isCaptured());
    }

    @Test
    @DisplayName("上界含调用时回退")
    void testCallBound() {
        assertNull(CountingLoopMatcher.match(countingLoop("i", invoke(id("arr"), "length"))));
    }

    @Test
    @DisplayName("条件不是小于时回退")
    void testNonLessThan() {
        ForStmt loop = forLoop(let("i", num("0")), bin(id("i"), BinaryExpr.BinaryOp.LE, num("5")),
                postInc(id("i")), block());
        assertNull(CountingLoopMatcher.match(loop));
    }

    @Test
    @DisplayName("步长不为一时回退")
    void testNonUnitStep() {
        ForStmt loop = forLoop(let("i", num("0")), bin(id("i"), BinaryExpr.BinaryOp.LT, num("5")),
                bin(id("i"), BinaryExpr.BinaryOp.ADD_ASSIGN, num("2")), block());
        assertNull(CountingLoopMatcher.match(loop));
    }

    @Test
    @DisplayName("初值不是整数字面量时回退")
    void testNonIntegralStart() {
        ForStmt loop = forLoop(let("i", id("start")), bin(id("i"), BinaryExpr.BinaryOp.LT, num("5")),
                postInc(id("i")), block());
        assertNull(CountingLoopMatcher.match(loop));
    }

    @Test
    @DisplayName("循环体给循环变量赋值时回退")
    void testBodyAssignsVariable() {
        ForStmt loop = countingLoop("i", num("10"), stmt(assign(id("i"), num("3"))));
        assertNull(CountingLoopMatcher.match(loop));
    }

    @Test
    @DisplayName("循环体修改上界根变量时回退")
    void testBodyAssignsBound() {
        ForStmt loop = countingLoop("i", id("n"), stmt(postInc(id("n"))));
        assertNull(CountingLoopMatcher.match(loop));
    }

    @Test
    @DisplayName("缺少初始化语句时回退")
    void testMissingInitializer() {
        ForStmt loop = forLoop(null, bin(id("i"), BinaryExpr.BinaryOp.LT, num("5")), postInc(id("i")), block());
        assertNull(CountingLoopMatcher.match(loop));
    }
}
