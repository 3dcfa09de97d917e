package com.polyglot.codegen.json;

import com.polyglot.codegen.TargetLanguage;
import com.polyglot.codegen.ast.CompilationUnit;
import com.polyglot.codegen.ast.Modifier;
import com.polyglot.codegen.ast.decl.ClassDecl;
import com.polyglot.codegen.ast.decl.ConstructorDecl;
import com.polyglot.codegen.ast.decl.ImportDecl;
import com.polyglot.codegen.ast.decl.MethodDecl;
import com.polyglot.codegen.ast.decl.VariableDecl;
import com.polyglot.codegen.ast.expr.BinaryExpr;
import com.polyglot.codegen.ast.stmt.ExpressionStmt;
import com.polyglot.codegen.ast.stmt.ForOfStmt;
import com.polyglot.codegen.ast.stmt.UnsupportedStmt;
import com.polyglot.codegen.ast.type.UnionType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AST JSON 读取")
class AstJsonReaderTest {

    private final AstJsonReader reader = new AstJsonReader();

    private CompilationUnit readResource(String name) throws Exception {
        try (Reader in = new InputStreamReader(getClass().getResourceAsStream("/ast/" + name), StandardCharsets.UTF_8)) {
            return reader.read(in);
        }
    }

    private static String file(String statements) {
        return "{\"kind\":\"SourceFile\",\"fileName\":\"t.ts\",\"text\":\"\",\"statements\":[" + statements + "]}";
    }

    // ============ 正常输入 ============

    @Nested
    @DisplayName("正常输入")
    class ValidTests {

        @Test
        @DisplayName("读取类声明与变量声明")
        void testReadFixture() throws Exception {
            CompilationUnit unit = readResource("point.json");
            assertEquals("point.ts", unit.getFileName());
            assertEquals(3, unit.getStatements().size());

            ClassDecl point = (ClassDecl) unit.getStatements().get(0);
            assertEquals("Point", point.getName());
            assertTrue(point.isExported());
            assertEquals(1, point.getLeadingComments().size());
            ConstructorDecl ctor = (ConstructorDecl) point.getMembers().get(0);
            assertEquals(2, ctor.getParameters().size());
            assertTrue(ctor.getParameters().get(0).getModifiers().contains(Modifier.READONLY));

            VariableDecl origin = (VariableDecl) unit.getStatements().get(1);
            assertTrue(origin.isConst());
            assertEquals("origin", origin.getDeclarators().get(0).getName());
        }

        @Test
        @DisplayName("读取的 AST 可直接生成代码")
        void testFixtureGenerates() throws Exception {
            CompilationUnit unit = readResource("point.json");
            String ruby = TargetLanguage.RUBY.createGenerator().generate(unit);
            assertTrue(ruby.contains("# 二维点"));
            assertTrue(ruby.contains("Point = Struct.new(:x, :y) do"), ruby);
            assertTrue(ruby.contains("TODO: unsupported statement LabeledStatement"), ruby);
        }

        @Test
        @DisplayName("运算符与 let 标志")
        void testBinaryAndLet() {
            CompilationUnit unit = reader.read(file("{\"kind\":\"VariableStatement\",\"declarationList\":"
                    + "{\"kind\":\"VariableDeclarationList\",\"flags\":\"Let\",\"declarations\":[{\"kind\":\"VariableDeclaration\","
                    + "\"name\":\"total\",\"initializer\":{\"kind\":\"BinaryExpression\",\"left\":\"a\","
                    + "\"operatorToken\":\"+\",\"right\":{\"kind\":\"NumericLiteral\",\"text\":\"1\"}}}]}}"));
            VariableDecl decl = (VariableDecl) unit.getStatements().get(0);
            assertEquals(VariableDecl.VariableKind.LET, decl.getVariableKind());
            BinaryExpr sum = (BinaryExpr) decl.getDeclarators().get(0).getInitializer();
            assertEquals(BinaryExpr.BinaryOp.ADD, sum.getOperator());
        }

        @Test
        @DisplayName("for-of 数组解构")
        void testForOfDestructuring() {
            CompilationUnit unit = reader.read(file("{\"kind\":\"ForOfStatement\",\"initializer\":"
                    + "{\"kind\":\"VariableDeclarationList\",\"flags\":\"Const\",\"declarations\":[{\"kind\":\"VariableDeclaration\","
                    + "\"name\":{\"kind\":\"ArrayBindingPattern\",\"elements\":[{\"kind\":\"BindingElement\",\"name\":\"k\"},"
                    + "{\"kind\":\"BindingElement\",\"name\":\"v\"}]}}]},\"expression\":\"entries\","
                    + "\"statement\":{\"kind\":\"Block\",\"statements\":[]}}"));
            ForOfStmt loop = (ForOfStmt) unit.getStatements().get(0);
            assertEquals(2, loop.getVariableNames().size());
            assertTrue(loop.isDestructuring());
        }

        @Test
        @DisplayName("具名导入")
        void testImport() {
            CompilationUnit unit = reader.read(file("{\"kind\":\"ImportDeclaration\",\"moduleSpecifier\":"
                    + "{\"kind\":\"StringLiteral\",\"text\":\"./models/user\"},\"importClause\":{\"kind\":\"ImportClause\","
                    + "\"namedBindings\":{\"kind\":\"NamedImports\",\"elements\":[{\"kind\":\"ImportSpecifier\",\"name\":\"User\"}]}}}"));
            ImportDecl decl = (ImportDecl) unit.getStatements().get(0);
            assertEquals("./models/user", decl.getModuleSpecifier());
            assertTrue(decl.isRelative());
            assertEquals("User", decl.getNamedBindings().get(0));
        }

        @Test
        @DisplayName("EmptyStatement 被跳过")
        void testEmptyStatement() {
            CompilationUnit unit = reader.read(file("{\"kind\":\"EmptyStatement\"}"));
            assertTrue(unit.getStatements().isEmpty());
        }
    }

    // ============ 未支持的种类 ============

    @Nested
    @DisplayName("未支持的种类")
    class UnsupportedTests {

        @Test
        @DisplayName("未知语句种类")
        void testUnknownStatement() {
            CompilationUnit unit = reader.read(file("{\"kind\":\"LabeledStatement\"}"));
            UnsupportedStmt stmt = (UnsupportedStmt) unit.getStatements().get(0);
            assertEquals("LabeledStatement", stmt.getKind());
        }

        @Test
        @DisplayName("未知表达式种类")
        void testUnknownExpression() {
            CompilationUnit unit = reader.read(file("{\"kind\":\"ExpressionStatement\",\"expression\":"
                    + "{\"kind\":\"YieldExpression\"}}"));
            ExpressionStmt stmt = (ExpressionStmt) unit.getStatements().get(0);
            assertEquals("YieldExpression", stmt.getExpression().getKind());
        }

        @Test
        @DisplayName("未知成员与类型种类")
        void testUnknownMemberAndType() {
            CompilationUnit unit = reader.read(file("{\"kind\":\"ClassDeclaration\",\"name\":\"Box\",\"members\":["
                    + "{\"kind\":\"IndexSignature\"},"
                    + "{\"kind\":\"MethodDeclaration\",\"name\":\"get\",\"parameters\":[],"
                    + "\"type\":{\"kind\":\"UnionType\",\"types\":[{\"kind\":\"StringKeyword\"},{\"kind\":\"MappedType\"}]},"
                    + "\"body\":{\"kind\":\"Block\",\"statements\":[]}}]}"));
            ClassDecl box = (ClassDecl) unit.getStatements().get(0);
            assertEquals("IndexSignature", box.getMembers().get(0).getKind());
            UnionType union = (UnionType) ((MethodDecl) box.getMembers().get(1)).getReturnType();
            assertEquals("MappedType", union.getTypes().get(1).getKind());
        }
    }

    // ============ 格式错误 ============

    @Nested
    @DisplayName("格式错误")
    class MalformedTests {

        @Test
        @DisplayName("非法 JSON")
        void testInvalidJson() {
            AstFormatException e = assertThrows(AstFormatException.class, () -> reader.read("{\"kind\": "));
            assertTrue(e.getMessage().startsWith("JSON 解析失败"));
        }

        @Test
        @DisplayName("根节点不是 SourceFile")
        void testWrongRoot() {
            assertThrows(AstFormatException.class, () -> reader.read("[]"));
            AstFormatException e = assertThrows(AstFormatException.class,
                    () -> reader.read("{\"kind\":\"Block\",\"statements\":[]}"));
            assertTrue(e.getMessage().contains("Block"));
        }

        @Test
        @DisplayName("缺少 kind")
        void testMissingKind() {
            assertThrows(AstFormatException.class, () -> reader.read(file("{\"name\":\"x\"}")));
        }

        @Test
        @DisplayName("属性类型不符")
        void testWrongPropertyType() {
            AstFormatException e = assertThrows(AstFormatException.class,
                    () -> reader.read("{\"kind\":\"SourceFile\",\"statements\":\"oops\"}"));
            assertTrue(e.getMessage().startsWith("节点属性类型不符"));
        }

        @Test
        @DisplayName("缺少必需的名称")
        void testMissingName() {
            AstFormatException e = assertThrows(AstFormatException.class,
                    () -> reader.read(file("{\"kind\":\"FunctionDeclaration\",\"parameters\":[]}")));
            assertTrue(e.getMessage().contains("name"));
        }
    }
}
