package com.polyglot.codegen;

import com.polyglot.codegen.ast.CompilationUnit;
import com.polyglot.codegen.ast.Modifier;
import com.polyglot.codegen.ast.SourceSpan;
import com.polyglot.codegen.ast.decl.*;
import com.polyglot.codegen.ast.expr.*;
import com.polyglot.codegen.ast.stmt.*;
import com.polyglot.codegen.ast.type.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 测试用 AST 构造工具
 */
public final class TestAst {
    private static final SourceSpan NO_SPAN = SourceSpan.UNKNOWN;

    private TestAst() {}

    // ============ 编译单元 ============

    public static CompilationUnit unit(Statement... statements) {
        return unitNamed("test.ts", statements);
    }

    public static CompilationUnit unitNamed(String fileName, Statement... statements) {
        return new CompilationUnit(fileName, "", Arrays.asList(statements));
    }

    // ============ 表达式 ============

    public static Identifier id(String name) {
        return new Identifier(NO_SPAN, name);
    }

    public static Literal num(String value) {
        return new Literal(NO_SPAN, Literal.LiteralKind.NUMBER, value);
    }

    public static Literal str(String value) {
        return new Literal(NO_SPAN, Literal.LiteralKind.STRING, value);
    }

    public static Literal bool(boolean value) {
        return new Literal(NO_SPAN, Literal.LiteralKind.BOOLEAN, String.valueOf(value));
    }

    public static Literal nul() {
        return new Literal(NO_SPAN, Literal.LiteralKind.NULL, "null");
    }

    public static ThisExpr self() {
        return new ThisExpr(NO_SPAN);
    }

    public static PropertyAccessExpr prop(Expression target, String name) {
        return new PropertyAccessExpr(NO_SPAN, target, name, false);
    }

    public static PropertyAccessExpr thisProp(String name) {
        return prop(self(), name);
    }

    public static CallExpr call(Expression callee, Expression... args) {
        return new CallExpr(NO_SPAN, callee, Arrays.asList(args));
    }

    public static CallExpr call(String function, Expression... args) {
        return call(id(function), args);
    }

    /** target.name(args) */
    public static CallExpr invoke(Expression target, String name, Expression... args) {
        return call(prop(target, name), args);
    }

    public static NewExpr newExpr(String className, Expression... args) {
        return new NewExpr(NO_SPAN, id(className), Arrays.asList(args));
    }

    public static BinaryExpr bin(Expression left, BinaryExpr.BinaryOp op, Expression right) {
        return new BinaryExpr(NO_SPAN, left, op, right);
    }

    public static BinaryExpr assign(Expression left, Expression right) {
        return bin(left, BinaryExpr.BinaryOp.ASSIGN, right);
    }

    public static UnaryExpr postInc(Expression operand) {
        return new UnaryExpr(NO_SPAN, UnaryExpr.UnaryOp.INC, operand, false);
    }

    public static AwaitExpr await(Expression expression) {
        return new AwaitExpr(NO_SPAN, expression);
    }

    public static ArrayLiteral array(Expression... elements) {
        return new ArrayLiteral(NO_SPAN, Arrays.asList(elements));
    }

    public static PropertyAssignment entry(String key, Expression value) {
        return new PropertyAssignment(NO_SPAN, key, value, false);
    }

    public static ObjectLiteral object(PropertyAssignment... properties) {
        return new ObjectLiteral(NO_SPAN, Arrays.asList(properties));
    }

    public static ArrowFunction arrow(List<Parameter> params, Expression body) {
        return new ArrowFunction(NO_SPAN, params, null, null, body, false, false);
    }

    public static UnsupportedExpr unsupportedExpr(String kind) {
        return new UnsupportedExpr(NO_SPAN, kind);
    }

    // ============ 类型 ============

    public static KeywordType keyword(KeywordType.Keyword keyword) {
        return new KeywordType(NO_SPAN, keyword);
    }

    public static KeywordType numberType() {
        return keyword(KeywordType.Keyword.NUMBER);
    }

    public static KeywordType stringType() {
        return keyword(KeywordType.Keyword.STRING);
    }

    public static KeywordType booleanType() {
        return keyword(KeywordType.Keyword.BOOLEAN);
    }

    public static KeywordType voidType() {
        return keyword(KeywordType.Keyword.VOID);
    }

    public static KeywordType anyType() {
        return keyword(KeywordType.Keyword.ANY);
    }

    public static TypeReference ref(String name, TypeNode... arguments) {
        return new TypeReference(NO_SPAN, name, Arrays.asList(arguments));
    }

    public static ArrayType arrayOf(TypeNode element) {
        return new ArrayType(NO_SPAN, element);
    }

    public static UnionType union(TypeNode... types) {
        return new UnionType(NO_SPAN, Arrays.asList(types));
    }

    public static TupleType tuple(TypeNode... elements) {
        return new TupleType(NO_SPAN, Arrays.asList(elements));
    }

    public static FunctionType functionType(List<Parameter> params, TypeNode returnType) {
        return new FunctionType(NO_SPAN, params, returnType);
    }

    public static LiteralType literalType(Literal literal) {
        return new LiteralType(NO_SPAN, literal);
    }

    public static UnsupportedType unsupportedType(String kind) {
        return new UnsupportedType(NO_SPAN, kind);
    }

    // ============ 语句 ============

    public static ExpressionStmt stmt(Expression expression) {
        return new ExpressionStmt(NO_SPAN, expression);
    }

    public static ReturnStmt ret(Expression value) {
        return new ReturnStmt(NO_SPAN, value);
    }

    public static Block block(Statement... statements) {
        return new Block(NO_SPAN, Arrays.asList(statements));
    }

    public static VariableDecl let(String name, Expression init) {
        return variable(VariableDecl.VariableKind.LET, name, null, init);
    }

    public static VariableDecl constant(String name, Expression init) {
        return variable(VariableDecl.VariableKind.CONST, name, null, init);
    }

    public static VariableDecl variable(VariableDecl.VariableKind kind, String name, TypeNode type,
                                        Expression init, Modifier... modifiers) {
        VariableDecl.Declarator d = new VariableDecl.Declarator(NO_SPAN, name, type, init);
        return new VariableDecl(NO_SPAN, mods(modifiers), kind, Collections.singletonList(d));
    }

    public static ForStmt forLoop(Statement init, Expression condition, Expression increment, Statement body) {
        return new ForStmt(NO_SPAN, init, condition, increment, body);
    }

    /** for (let i = 0; i < bound; i++) body */
    public static ForStmt countingLoop(String variable, Expression bound, Statement... body) {
        return forLoop(let(variable, num("0")), bin(id(variable), BinaryExpr.BinaryOp.LT, bound),
                postInc(id(variable)), block(body));
    }

    public static IfStmt ifStmt(Expression condition, Statement then, Statement otherwise) {
        return new IfStmt(NO_SPAN, condition, then, otherwise);
    }

    public static WhileStmt whileLoop(Expression condition, Statement body) {
        return new WhileStmt(NO_SPAN, condition, body);
    }

    public static ForOfStmt forOf(List<String> names, Expression iterable, Statement body) {
        return new ForOfStmt(NO_SPAN, names, iterable, body);
    }

    public static ThrowStmt throwStmt(Expression value) {
        return new ThrowStmt(NO_SPAN, value);
    }

    public static ContinueStmt continueStmt() {
        return new ContinueStmt(NO_SPAN, null);
    }

    public static BreakStmt breakStmt() {
        return new BreakStmt(NO_SPAN, null);
    }

    public static SwitchClause caseClause(Expression label, Statement... statements) {
        return new SwitchClause(NO_SPAN, label, Arrays.asList(statements));
    }

    public static SwitchStmt switchStmt(Expression subject, SwitchClause... clauses) {
        return new SwitchStmt(NO_SPAN, subject, Arrays.asList(clauses));
    }

    public static TryStmt tryCatch(Block body, String variable, Block handler) {
        return new TryStmt(NO_SPAN, body, new CatchClause(NO_SPAN, variable, handler), null);
    }

    public static UnsupportedStmt unsupportedStmt(String kind) {
        return new UnsupportedStmt(NO_SPAN, kind);
    }

    // ============ 声明 ============

    public static List<Modifier> mods(Modifier... modifiers) {
        return new ArrayList<>(Arrays.asList(modifiers));
    }

    public static Parameter param(String name, TypeNode type) {
        return new Parameter(NO_SPAN, mods(), name, type, null, false, false);
    }

    public static List<Parameter> params(Parameter... parameters) {
        return Arrays.asList(parameters);
    }

    public static PropertyDecl field(String name, TypeNode type, Modifier... modifiers) {
        return new PropertyDecl(NO_SPAN, mods(modifiers), name, type, null, false);
    }

    public static PropertyDecl field(String name, TypeNode type, Expression init, Modifier... modifiers) {
        return new PropertyDecl(NO_SPAN, mods(modifiers), name, type, init, false);
    }

    public static MethodDecl method(String name, List<Parameter> params, TypeNode returnType,
                                    Block body, Modifier... modifiers) {
        return new MethodDecl(NO_SPAN, mods(modifiers), name, Collections.<TypeParameter>emptyList(),
                params, returnType, body, MethodDecl.AccessorKind.NONE);
    }

    public static ConstructorDecl constructor(List<Parameter> params, Block body) {
        return new ConstructorDecl(NO_SPAN, mods(), params, body);
    }

    public static ClassDecl classDecl(String name, ClassMember... members) {
        return classDecl(name, mods(), null, Collections.<TypeNode>emptyList(), members);
    }

    public static ClassDecl classDecl(String name, List<Modifier> modifiers, TypeNode superClass,
                                      List<TypeNode> interfaces, ClassMember... members) {
        return new ClassDecl(NO_SPAN, modifiers, name, Collections.<TypeParameter>emptyList(),
                superClass, interfaces, Arrays.asList(members));
    }

    public static InterfaceDecl interfaceDecl(String name, ClassMember... members) {
        return new InterfaceDecl(NO_SPAN, mods(), name, Collections.<TypeParameter>emptyList(),
                Collections.<TypeNode>emptyList(), Arrays.asList(members));
    }

    public static FunctionDecl function(String name, List<Parameter> params, TypeNode returnType,
                                        Block body, Modifier... modifiers) {
        return new FunctionDecl(NO_SPAN, mods(modifiers), name, Collections.<TypeParameter>emptyList(),
                params, returnType, body);
    }

    public static EnumDecl.EnumMember enumMember(String name, Expression init) {
        return new EnumDecl.EnumMember(NO_SPAN, name, init);
    }

    public static EnumDecl enumDecl(String name, EnumDecl.EnumMember... members) {
        return new EnumDecl(NO_SPAN, mods(), name, Arrays.asList(members));
    }

    public static ModuleDecl module(String name, Statement... statements) {
        return new ModuleDecl(NO_SPAN, mods(), name, Arrays.asList(statements));
    }

    public static ImportDecl importNamed(String module, String... names) {
        return new ImportDecl(NO_SPAN, module, null, null, Arrays.asList(names));
    }

    public static UnsupportedMember unsupportedMember(String kind) {
        return new UnsupportedMember(NO_SPAN, kind);
    }
}
