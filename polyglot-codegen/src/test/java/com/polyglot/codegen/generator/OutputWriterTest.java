package com.polyglot.codegen.generator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 输出缓冲区测试
 */
class OutputWriterTest {

    @Test
    @DisplayName("缩进按层级累加")
    void testIndentation() {
        OutputWriter out = new OutputWriter("  ");
        out.writeLine("class A");
        out.indent();
        out.writeLine("def b");
        out.indent();
        out.writeLine("1");
        out.dedent();
        out.writeLine("end");
        out.dedent();
        out.writeLine("end");
        assertEquals("class A\n  def b\n    1\n  end\nend\n", out.getOutput());
    }

    @Test
    @DisplayName("dedent 不会低于零")
    void testDedentFloor() {
        OutputWriter out = new OutputWriter("    ");
        out.dedent();
        assertEquals(0, out.getIndentLevel());
        out.writeLine("x");
        assertEquals("x\n", out.getOutput());
    }

    @Test
    @DisplayName("不写连续空行和开头空行")
    void testBlankLines() {
        OutputWriter out = new OutputWriter("  ");
        out.blankLine();
        out.writeLine("a");
        out.blankLine();
        out.blankLine();
        out.writeLine("b");
        assertEquals("a\n\nb\n", out.getOutput());
    }

    @Test
    @DisplayName("代码块开头不写空行")
    void testNoBlankAtBlockStart() {
        OutputWriter out = new OutputWriter("  ");
        out.writeLine("module M");
        out.indent();
        out.blankLine();
        out.writeLine("X = 1");
        assertEquals("module M\n  X = 1\n", out.getOutput());
    }

    @Test
    @DisplayName("多行文本逐行缩进，空行不带缩进")
    void testMultiLineText() {
        OutputWriter out = new OutputWriter("  ");
        out.indent();
        out.writeLine("a\n\n  b");
        assertEquals("  a\n\n    b\n", out.getOutput());
    }

    @Test
    @DisplayName("输出以单个换行结尾")
    void testSingleTrailingNewline() {
        OutputWriter out = new OutputWriter("  ");
        out.writeLine("a");
        out.writeLine("");
        out.writeLine("");
        assertEquals("a\n", out.getOutput());
        assertEquals("", new OutputWriter("  ").getOutput());
    }
}
