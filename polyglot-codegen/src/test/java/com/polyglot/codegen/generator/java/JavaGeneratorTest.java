package com.polyglot.codegen.generator.java;

import com.polyglot.codegen.TargetLanguage;
import com.polyglot.codegen.ast.CommentRange;
import com.polyglot.codegen.ast.CompilationUnit;
import com.polyglot.codegen.ast.Modifier;
import com.polyglot.codegen.ast.decl.ClassDecl;
import com.polyglot.codegen.ast.decl.FunctionDecl;
import com.polyglot.codegen.ast.decl.MethodDecl;
import com.polyglot.codegen.ast.decl.VariableDecl;
import com.polyglot.codegen.ast.expr.BinaryExpr;
import com.polyglot.codegen.ast.expr.PropertyAssignment;
import com.polyglot.codegen.ast.stmt.ExpressionStmt;
import com.polyglot.codegen.ast.stmt.ReturnStmt;
import com.polyglot.codegen.ast.stmt.Statement;
import com.polyglot.codegen.ast.type.TypeNode;
import com.polyglot.codegen.generator.GeneratorConfig;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.polyglot.codegen.TestAst.*;
import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Java 代码生成测试
 */
class JavaGeneratorTest {

    private static String generate(Statement... statements) {
        return new JavaGenerator().generate(unit(statements));
    }

    private static String generate(GeneratorConfig config, Statement... statements) {
        return new JavaGenerator(config).generate(unit(statements));
    }

    private static GeneratorConfig.Builder config() {
        return TargetLanguage.JAVA.defaultConfig().toBuilder();
    }

    private static ClassDecl point() {
        return classDecl("Point",
                field("x", numberType()),
                field("y", numberType(), Modifier.READONLY));
    }

    private static ClassDecl pair() {
        return classDecl("Pair",
                field("left", numberType(), Modifier.READONLY),
                field("right", stringType(), Modifier.READONLY));
    }

    private static FunctionDecl run(Statement... body) {
        return function("run", params(param("arr", arrayOf(numberType()))), null, block(body));
    }

    private static int occurrences(String text, String needle) {
        int count = 0;
        for (int i = text.indexOf(needle); i >= 0; i = text.indexOf(needle, i + 1)) {
            count++;
        }
        return count;
    }

    // ============ 类 ============

    @Nested
    @DisplayName("类与值对象")
    class ClassTests {

        @Test
        @DisplayName("合成构造器与 getter/setter")
        void testSynthesizedConstructor() {
            String expected = "package com.example;\n"
                    + "\n"
                    + "class Point {\n"
                    + "    private double x;\n"
                    + "    private final double y;\n"
                    + "\n"
                    + "    public Point(double x, double y) {\n"
                    + "        this.x = x;\n"
                    + "        this.y = y;\n"
                    + "    }\n"
                    + "\n"
                    + "    public double getX() {\n"
                    + "        return x;\n"
                    + "    }\n"
                    + "\n"
                    + "    public void setX(double x) {\n"
                    + "        this.x = x;\n"
                    + "    }\n"
                    + "\n"
                    + "    public double getY() {\n"
                    + "        return y;\n"
                    + "    }\n"
                    + "}\n";
            assertEquals(expected, generate(point()));
        }

        @Test
        @DisplayName("全只读字段在 16 及以上生成 record")
        void testRecord() {
            String output = generate(pair());
            assertThat(output).contains("record Pair(double left, String right) {}\n");
            assertThat(output).doesNotContain("class Pair");
        }

        @Test
        @DisplayName("16 以下生成只读类")
        void testRecordUnsupported() {
            String output = generate(config().targetVersion("11").build(), pair());
            assertThat(output).contains("class Pair {\n", "    private final double left;\n",
                    "    public Pair(double left, String right) {\n", "    public String getRight() {\n");
            assertThat(output).doesNotContain("record", "setLeft");
        }

        @Test
        @DisplayName("关闭值对象时生成普通类")
        void testValueObjectsDisabled() {
            String output = generate(config().useIdiomaticValueObjects(false).build(), pair());
            assertThat(output).contains("class Pair {\n").doesNotContain("record");
        }

        @Test
        @DisplayName("导出类为 public，布尔字段用 is 前缀")
        void testExportedClass() {
            ClassDecl flag = classDecl("Flag", mods(Modifier.EXPORT), null, Arrays.<TypeNode>asList(ref("Named")),
                    field("enabled", booleanType()),
                    method("toggle", params(), voidType(),
                            block(stmt(assign(thisProp("enabled"), bin(thisProp("enabled"),
                                    BinaryExpr.BinaryOp.NE, bool(true)))))));
            String output = generate(flag);
            assertThat(output).contains("public class Flag implements Named {\n");
            assertThat(output).contains("    public boolean isEnabled() {\n");
            assertThat(output).contains("    public void toggle() {\n");
        }

        @Test
        @DisplayName("未支持的成员写占位注释")
        void testUnsupportedMember() {
            ClassDecl cache = classDecl("Cache",
                    unsupportedMember("IndexSignature"),
                    method("clear", params(), voidType(), block()));
            String output = generate(cache);
            assertThat(output).contains("    // TODO: unsupported member IndexSignature\n");
            assertThat(output).contains("    public void clear() {\n");
        }
    }

    // ============ 语句 ============

    @Nested
    @DisplayName("语句")
    class StatementTests {

        @Test
        @DisplayName("顶层函数放入容器类，计数循环生成 for")
        void testRangeLoop() {
            String expected = "package com.example;\n"
                    + "\n"
                    + "import java.util.List;\n"
                    + "\n"
                    + "public final class Test {\n"
                    + "    private Test() {\n"
                    + "    }\n"
                    + "\n"
                    + "    public static void run(List<Double> arr) {\n"
                    + "        for (int i = 0; i < 10; i++) {\n"
                    + "            System.out.println(i);\n"
                    + "        }\n"
                    + "    }\n"
                    + "}\n";
            assertEquals(expected, generate(run(countingLoop("i", num("10"),
                    stmt(invoke(id("console"), "log", id("i")))))));
        }

        @Test
        @DisplayName("上界是调用时回退为 while")
        void testFallbackLoop() {
            String output = generate(run(countingLoop("i", invoke(id("arr"), "length"),
                    stmt(invoke(id("console"), "log", id("i"))))));
            assertThat(output).contains("        {\n"
                    + "            int i = 0;\n"
                    + "            while (i < arr.length()) {\n"
                    + "                System.out.println(i);\n"
                    + "                i++;\n"
                    + "            }\n"
                    + "        }\n");
            assertThat(output).doesNotContain("for (");
        }

        @Test
        @DisplayName("回退循环中的 continue 先执行递增")
        void testContinueInFallbackLoop() {
            String output = generate(run(countingLoop("i", invoke(id("arr"), "length"),
                    ifStmt(bin(id("i"), BinaryExpr.BinaryOp.STRICT_EQ, num("2")), block(continueStmt()), null))));
            assertThat(output).contains("i++;\n                    continue;\n");
            assertThat(occurrences(output, "i++;")).isEqualTo(2);
        }

        @Test
        @DisplayName("对象字面量生成 Map.of 并保持顺序")
        void testObjectLiteral() {
            String output = generate(run(let("point", object(entry("a", num("1")), entry("b", num("2"))))));
            assertThat(output).contains("Map<String, Object> point = Map.of(\"a\", 1, \"b\", 2);\n");
            assertThat(output).contains("import java.util.Map;\n");
        }

        @Test
        @DisplayName("超过十对键值改用 Map.ofEntries，顺序不变")
        void testLargeObjectLiteral() {
            List<PropertyAssignment> entries = new ArrayList<>();
            StringBuilder expected = new StringBuilder("Map.ofEntries(");
            for (int i = 0; i < 12; i++) {
                String key = String.valueOf((char) ('a' + i));
                entries.add(entry(key, num(String.valueOf(i + 1))));
                if (i > 0) {
                    expected.append(", ");
                }
                expected.append("Map.entry(\"").append(key).append("\", ").append(i + 1).append(')');
            }
            expected.append(");\n");
            String output = generate(run(let("settings",
                    object(entries.toArray(new PropertyAssignment[0])))));
            assertThat(output).contains(expected.toString());
            assertThat(output).doesNotContain("Map.of(");
        }

        @Test
        @DisplayName("闭包捕获的计数循环变量每轮复制为 final 局部变量")
        void testCapturedLoopVariable() {
            String output = generate(run(countingLoop("i", num("3"),
                    stmt(invoke(id("fs"), "push", arrow(params(), id("i")))))));
            assertThat(output).contains("        for (int iIndex = 0; iIndex < 3; iIndex++) {\n"
                    + "            final int i = iIndex;\n"
                    + "            fs.add(() -> i);\n"
                    + "        }\n");
        }

        @Test
        @DisplayName("无法转换的初始化器：局部变量用 Object 或包装类型")
        void testUnsupportedLocalInitializer() {
            String output = generate(run(
                    let("y", unsupportedExpr("YieldExpression")),
                    variable(VariableDecl.VariableKind.LET, "z", numberType(), unsupportedExpr("YieldExpression"))));
            assertThat(output).contains("        Object y = null;\n");
            assertThat(output).contains("        Double z = null;\n");
            assertThat(output).doesNotContain("var y", "double z");
        }

        @Test
        @DisplayName("无法转换的初始化器：字段与静态变量用包装类型")
        void testUnsupportedFieldInitializer() {
            ClassDecl holder = classDecl("Holder",
                    field("v", numberType(), unsupportedExpr("YieldExpression")),
                    method("reset", params(), voidType(), block()));
            String output = generate(holder,
                    variable(VariableDecl.VariableKind.LET, "rate", numberType(), unsupportedExpr("YieldExpression")));
            assertThat(output).contains("    private Double v = null;\n");
            assertThat(output).contains("    public static Double rate = null;\n");
            assertThat(output).contains("// TODO: unsupported expression YieldExpression\n");
        }

        @Test
        @DisplayName("分支中间的 break 保持原样")
        void testEarlyBreakInSwitch() {
            String output = generate(run(switchStmt(id("x"),
                    caseClause(num("1"), ifStmt(id("skip"), breakStmt(), null), stmt(call("work")), breakStmt()),
                    caseClause(null, stmt(call("other"))))));
            assertThat(output).contains("            case 1:\n"
                    + "                if (skip) {\n"
                    + "                    break;\n"
                    + "                }\n"
                    + "                work();\n"
                    + "                break;\n");
            assertThat(output).doesNotContain("switch_1");
        }

        @Test
        @DisplayName("关闭类型签名时局部变量用 var")
        void testVarLocals() {
            String output = generate(config().emitTypedSignatures(false).build(), run(let("count", num("0"))));
            assertThat(output).contains("        var count = 0;\n");
        }

        @Test
        @DisplayName("for-of、switch 与 try")
        void testControlFlow() {
            String output = generate(run(
                    forOf(Arrays.asList("item"), id("arr"), block(stmt(call("handle", id("item"))))),
                    switchStmt(id("arr"),
                            caseClause(num("1")),
                            caseClause(num("2"), stmt(call("handle")), breakStmt()),
                            caseClause(null, stmt(call("fallback")))),
                    tryCatch(block(stmt(call("risky"))), "err", block(throwStmt(id("err"))))));
            assertThat(output).contains("        for (var item : arr) {\n            handle(item);\n        }\n");
            assertThat(output).contains("        switch (arr) {\n"
                    + "            case 1:\n"
                    + "            case 2:\n"
                    + "                handle();\n"
                    + "                break;\n"
                    + "            default:\n"
                    + "                fallback();\n"
                    + "        }\n");
            assertThat(output).contains("        try {\n"
                    + "            risky();\n"
                    + "        } catch (Exception err) {\n"
                    + "            throw new RuntimeException(err);\n"
                    + "        }\n");
        }

        @Test
        @DisplayName("顶层语句放入静态初始化块，占位注释只写一行")
        void testUnsupportedStatement() {
            String output = generate(
                    let("before", num("1")),
                    unsupportedStmt("LabeledStatement"),
                    let("after", num("2")));
            assertThat(output).contains("    public static int before = 1;\n"
                    + "\n"
                    + "    static {\n"
                    + "        // TODO: unsupported statement LabeledStatement\n"
                    + "    }\n"
                    + "\n"
                    + "    public static int after = 2;\n");
            assertThat(occurrences(output, "TODO")).isEqualTo(1);
        }

        @Test
        @DisplayName("嵌套函数声明写占位注释")
        void testNestedFunction() {
            FunctionDecl outer = function("outer", params(), null, block(
                    function("inner", params(), null, block()),
                    stmt(call("done"))));
            String output = generate(outer);
            assertThat(output).contains("        // TODO: unsupported statement FunctionDeclaration\n"
                    + "        done();\n");
        }

        @Test
        @DisplayName("抛出内置错误")
        void testThrowError() {
            String output = generate(run(throwStmt(newExpr("Error", str("boom")))));
            assertThat(output).contains("        throw new RuntimeException(\"boom\");\n");
        }
    }

    // ============ 异步 ============

    @Nested
    @DisplayName("异步")
    class AsyncTests {

        private ClassDecl api() {
            return classDecl("Api",
                    method("fetchUser", params(), ref("Promise", stringType()), block(
                            variable(VariableDecl.VariableKind.CONST, "data", null,
                                    await(invoke(self(), "load"))),
                            ret(id("data"))), Modifier.ASYNC));
        }

        @Test
        @DisplayName("异步方法返回 CompletableFuture，await 转为 join")
        void testAsyncMethod() {
            String expected = "package com.example;\n"
                    + "\n"
                    + "import java.util.concurrent.CompletableFuture;\n"
                    + "\n"
                    + "class Api {\n"
                    + "    public CompletableFuture<String> fetchUser() {\n"
                    + "        return CompletableFuture.supplyAsync(() -> {\n"
                    + "            var data = load().join();\n"
                    + "            return data;\n"
                    + "        });\n"
                    + "    }\n"
                    + "}\n";
            assertEquals(expected, generate(api()));
        }

        @Test
        @DisplayName("循环中的 return 直接从 supplyAsync 的 lambda 返回")
        void testReturnInsideLoop() {
            FunctionDecl find = function("find", params(param("xs", arrayOf(numberType()))),
                    ref("Promise", numberType()), block(
                            whileLoop(id("running"), block(ifStmt(id("found"), block(ret(num("1"))), null))),
                            forOf(Arrays.asList("x"), id("xs"),
                                    block(ifStmt(call("ready", id("x")), block(ret(id("x"))), null))),
                            ret(num("0"))), Modifier.ASYNC);
            String output = generate(find);
            assertThat(output).contains("        return CompletableFuture.supplyAsync(() -> {\n"
                    + "            while (running) {\n"
                    + "                if (found) {\n"
                    + "                    return 1;\n"
                    + "                }\n"
                    + "            }\n"
                    + "            for (var x : xs) {\n"
                    + "                if (ready(x)) {\n"
                    + "                    return x;\n"
                    + "                }\n"
                    + "            }\n"
                    + "            return 0;\n"
                    + "        });\n");
        }

        @Test
        @DisplayName("无返回值的异步方法使用 runAsync")
        void testAsyncVoid() {
            ClassDecl job = classDecl("Job",
                    method("start", params(), ref("Promise", voidType()),
                            block(stmt(await(call("prepare")))), Modifier.ASYNC));
            String output = generate(job);
            assertThat(output).contains("    public CompletableFuture<Void> start() {\n"
                    + "        return CompletableFuture.runAsync(() -> {\n"
                    + "            prepare().join();\n"
                    + "        });\n");
        }

        @Test
        @DisplayName("生成器实例复用时状态不残留")
        void testStateResetBetweenCalls() {
            JavaGenerator generator = new JavaGenerator();
            String first = generator.generate(unit(api()));
            String second = generator.generate(unit(point()));
            assertThat(first).contains("import java.util.concurrent.CompletableFuture;");
            assertThat(second).doesNotContain("import");
            assertThat(generator.generate(unit(api()))).isEqualTo(first);
        }
    }

    // ============ 文件结构 ============

    @Nested
    @DisplayName("文件结构")
    class StructureTests {

        @Test
        @DisplayName("相对导入转为包内导入与静态导入")
        void testImports() {
            String output = generate(
                    importNamed("./user.ts", "User", "formatName"),
                    importNamed("./user.ts", "User"),
                    importNamed("lodash", "map"));
            assertThat(output).isEqualTo("package com.example;\n"
                    + "\n"
                    + "import com.example.User;\n"
                    + "import static com.example.User.formatName;\n");
        }

        @Test
        @DisplayName("文档注释转为 Javadoc，行注释与块注释按当前缩进写成 //")
        void testComments() {
            String doc = "/**\n * 计算面积\n * @return 面积\n */";
            String blockComment = "/* 多行\n   说明 */";
            String lineComment = "// 直接相乘";
            String source = doc + "\n" + blockComment + "\n" + lineComment + "\n";
            int blockStart = doc.length() + 1;
            int lineStart = blockStart + blockComment.length() + 1;

            ExpressionStmt log = stmt(call("log"));
            log.setLeadingComments(Collections.singletonList(
                    new CommentRange(blockStart, blockStart + blockComment.length(), true)));
            ReturnStmt result = ret(bin(num("2"), BinaryExpr.BinaryOp.MUL, num("3")));
            result.setLeadingComments(Collections.singletonList(
                    new CommentRange(lineStart, lineStart + lineComment.length(), false)));
            MethodDecl area = method("area", params(), numberType(), block(log, result));
            area.setLeadingComments(Collections.singletonList(new CommentRange(0, doc.length(), true)));

            CompilationUnit unit = new CompilationUnit("shape.ts", source,
                    Arrays.<Statement>asList(classDecl("Shape", area)));
            String preserved = new JavaGenerator().generate(unit);
            String stripped = new JavaGenerator(config().preserveComments(false).build()).generate(unit);
            assertThat(preserved).contains("    /**\n"
                    + "     * 计算面积\n"
                    + "     * @return 面积\n"
                    + "     */\n"
                    + "    public double area() {\n"
                    + "        // 多行\n"
                    + "        // 说明\n"
                    + "        log();\n"
                    + "        // 直接相乘\n"
                    + "        return 2 * 3;\n"
                    + "    }\n");
            assertThat(stripped).doesNotContain("计算面积", "//");
        }

        @Test
        @DisplayName("无命名空间前缀时不写 package")
        void testNoPackage() {
            String output = generate(config().namespacePrefix("").build(), point());
            assertThat(output).startsWith("class Point {\n");
        }

        @Test
        @DisplayName("顶层常量生成 static final 并改名")
        void testConstants() {
            String output = generate(
                    constant("maxRetries", num("3")),
                    function("retries", params(), numberType(), block(ret(id("maxRetries")))));
            assertThat(output).contains("    public static final int MAX_RETRIES = 3;\n");
            assertThat(output).contains("    public static double retries() {\n        return MAX_RETRIES;\n");
        }

        @Test
        @DisplayName("容器类与类型重名时加 Module 后缀")
        void testHolderNameCollision() {
            String output = new JavaGenerator().generate(unitNamed("src/point.ts", point(),
                    function("origin", params(), ref("Point"), block(ret(newExpr("Point", num("0"), num("0")))))));
            assertThat(output).contains("public final class PointModule {\n");
            assertThat(output).contains("        return new Point(0, 0);\n");
            assertThat(JavaDialect.holderNameFor("src/order-utils.ts")).isEqualTo("OrderUtils");
            assertThat(JavaDialect.holderNameFor("")).isEqualTo("Generated");
        }

        @Test
        @DisplayName("普通枚举与带值枚举")
        void testEnums() {
            String output = generate(
                    enumDecl("Color", enumMember("Red", null), enumMember("Green", null)),
                    enumDecl("Status", enumMember("Active", str("active")), enumMember("Inactive", str("inactive"))));
            assertThat(output).contains("enum Color {\n    RED,\n    GREEN\n}\n");
            assertThat(output).contains("enum Status {\n"
                    + "    ACTIVE(\"active\"),\n"
                    + "    INACTIVE(\"inactive\");\n"
                    + "\n"
                    + "    private final String value;\n"
                    + "\n"
                    + "    Status(String value) {\n"
                    + "        this.value = value;\n"
                    + "    }\n"
                    + "\n"
                    + "    public String getValue() {\n"
                    + "        return value;\n"
                    + "    }\n"
                    + "}\n");
        }

        @Test
        @DisplayName("接口生成抽象方法")
        void testInterface() {
            String output = generate(interfaceDecl("Shape",
                    field("name", stringType()),
                    method("area", params(), numberType(), null)));
            assertThat(output).contains("interface Shape {\n"
                    + "    String getName();\n"
                    + "\n"
                    + "    double area();\n"
                    + "}\n");
        }

        @Test
        @DisplayName("命名空间生成 final 类")
        void testModule() {
            String output = generate(module("Billing",
                    constant("rate", num("0.2")),
                    function("tax", params(param("amount", numberType())), numberType(),
                            block(ret(bin(id("amount"), BinaryExpr.BinaryOp.MUL, id("rate")))))));
            assertThat(output).contains("final class Billing {\n"
                    + "    private Billing() {\n"
                    + "    }\n"
                    + "\n"
                    + "    public static final double RATE = 0.2;\n"
                    + "\n"
                    + "    public static double tax(double amount) {\n"
                    + "        return amount * RATE;\n"
                    + "    }\n"
                    + "}\n");
        }
    }
}
