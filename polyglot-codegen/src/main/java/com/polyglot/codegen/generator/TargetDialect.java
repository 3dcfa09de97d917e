package com.polyglot.codegen.generator;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.CompilationUnit;
import com.polyglot.codegen.ast.decl.ClassDecl;
import com.polyglot.codegen.ast.decl.EnumDecl;
import com.polyglot.codegen.ast.decl.InterfaceDecl;
import com.polyglot.codegen.ast.decl.ModuleDecl;
import com.polyglot.codegen.ast.decl.PropertyDecl;
import com.polyglot.codegen.ast.decl.TypeAliasDecl;
import com.polyglot.codegen.ast.decl.VariableDecl;
import com.polyglot.codegen.ast.expr.Expression;
import com.polyglot.codegen.ast.stmt.Statement;

import java.util.List;

/**
 * 目标语言方言。
 *
 * <p>{@link CodeGenerator} 负责遍历与结构决策（值对象判定、计数循环识别、异步包装的位置），
 * 方言只负责把这些决策写成具体语法。所有方法都不得抛出异常。</p>
 */
public interface TargetDialect {

    /** 目标语言名，用于日志 */
    String getName();

    TypeMapper getTypeMapper();

    ExpressionRenderer getExpressionRenderer();

    /** 分析阶段是否需要映射类型注解（动态语言仅在启用类型签名时需要） */
    boolean emitsTypes(GeneratorConfig config);

    /**
     * 分析阶段对每个节点调用一次，登记语法本身需要的导入
     */
    void scan(AstNode node, GenerationContext ctx);

    // ============ 文件结构 ============

    void writeHeader(CompilationUnit unit, GenerationContext ctx);

    void writeImports(ImportSet imports, GenerationContext ctx);

    void openNamespace(GenerationContext ctx);

    /** 按目标语言的组织方式写出顶层语句 */
    void writeTopLevel(List<Statement> statements, GenerationContext ctx);

    void closeNamespace(GenerationContext ctx);

    // ============ 注释 ============

    /** 单行注释 */
    String lineComment(String text);

    void writeComment(FormattedComment comment, GenerationContext ctx);

    // ============ 类 ============

    /** 当前配置下是否能生成值对象形式 */
    boolean supportsValueObjects(GeneratorConfig config);

    void writeValueObject(ClassDecl node, List<PropertyDecl> fields, GenerationContext ctx);

    void openClass(ClassDecl node, GenerationContext ctx);

    void writeFields(ClassDecl node, List<PropertyDecl> fields, GenerationContext ctx);

    /** 没有显式构造器时，用字段生成构造器 */
    void writeSynthesizedConstructor(ClassDecl node, List<PropertyDecl> fields, GenerationContext ctx);

    void openConstructor(Signature signature, GenerationContext ctx);

    /** 构造器参数属性的赋值语句 */
    String fieldAssignment(String fieldName, String parameterName);

    /** 显式构造器中补写带初始化器的实例字段（字段声明处不能初始化的目标语言） */
    void writeFieldInitializers(List<PropertyDecl> fields, GenerationContext ctx);

    void closeConstructor(GenerationContext ctx);

    void writeAccessors(List<PropertyDecl> fields, GenerationContext ctx);

    void closeClass(ClassDecl node, GenerationContext ctx);

    // ============ 函数与方法 ============

    /** 当前作用域内能否直接声明具名函数 */
    boolean supportsNestedFunctions();

    void writeAbstractMethod(Signature signature, GenerationContext ctx);

    void openFunction(Signature signature, GenerationContext ctx);

    void openAsyncBody(Signature signature, GenerationContext ctx);

    /**
     * @param bodyCompletes 函数体最后一条语句之后是否可能继续执行
     */
    void closeAsyncBody(Signature signature, boolean bodyCompletes, GenerationContext ctx);

    void closeFunction(Signature signature, GenerationContext ctx);

    // ============ 接口、枚举、命名空间、变量 ============

    void openInterface(InterfaceDecl node, GenerationContext ctx);

    void writePropertyStub(PropertyDecl property, GenerationContext ctx);

    void writeMethodStub(Signature signature, GenerationContext ctx);

    void closeInterface(InterfaceDecl node, GenerationContext ctx);

    void writeEnum(EnumDecl node, List<EnumConstant> constants, GenerationContext ctx);

    /** 命名空间：外壳与成员由方言组织，成员通过 {@link GenerationContext#emitDeclarations} 生成 */
    void writeModule(ModuleDecl node, GenerationContext ctx);

    /**
     * @param targetName 目标语言中的变量名，顶层常量已转为大写
     * @param constant   是否按常量生成
     */
    void writeVariable(VariableDecl node, VariableDecl.Declarator declarator, String targetName,
                       boolean constant, GenerationContext ctx);

    void writeTypeAlias(TypeAliasDecl node, GenerationContext ctx);

    // ============ 语句 ============

    String expressionStatement(String expression);

    /**
     * @param value 已渲染的返回值，null 表示无值 return
     */
    String returnStatement(String value, GenerationContext ctx);

    String throwStatement(Expression value, GenerationContext ctx);

    /**
     * @param switchTag 跳出 switch 的标签，普通 break 为 null
     */
    String breakStatement(String switchTag);

    /**
     * @param switchTag continue 需要先跳出的 switch 标签，直接位于循环内时为 null
     */
    String continueStatement(String switchTag);

    void openIf(String condition, GenerationContext ctx);

    void openElseIf(String condition, GenerationContext ctx);

    void openElse(GenerationContext ctx);

    void closeIf(GenerationContext ctx);

    void openWhile(String condition, GenerationContext ctx);

    void closeWhile(GenerationContext ctx);

    void openDoWhile(GenerationContext ctx);

    void closeDoWhile(String condition, GenerationContext ctx);

    /**
     * 半开区间 [start, bound) 上的计数循环
     *
     * @param captured 循环体内有闭包引用循环变量
     */
    void openRangeLoop(String variable, String start, String bound, boolean captured, GenerationContext ctx);

    void openForEach(List<String> variables, String iterable, GenerationContext ctx);

    void closeLoop(GenerationContext ctx);

    /** 嵌套块与回退 while 循环外层的作用域 */
    void openScope(GenerationContext ctx);

    void closeScope(GenerationContext ctx);

    /** case 分支是否保留 break（C 风格 switch） */
    boolean switchFallsThrough();

    /**
     * @param tag              分支内有提前 break 时的跳转标签，否则为 null
     * @param capturesContinue 分支内的 continue 会跳出该 switch，结束后需要在循环中补做 continue
     */
    void openSwitch(String subject, String tag, boolean capturesContinue, GenerationContext ctx);

    /**
     * @param labels       已渲染的 case 标签，可能为空
     * @param includesDefault 分组中是否含 default
     */
    void openCase(List<String> labels, boolean includesDefault, GenerationContext ctx);

    void closeCase(GenerationContext ctx);

    void closeSwitch(String tag, boolean capturesContinue, GenerationContext ctx);

    void openTry(GenerationContext ctx);

    /**
     * @param variable 已转换的异常变量名，可能为 null
     */
    void openCatch(String variable, GenerationContext ctx);

    void openFinally(GenerationContext ctx);

    void closeTry(GenerationContext ctx);
}
