package com.polyglot.codegen.generator.ruby;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.CompilationUnit;
import com.polyglot.codegen.ast.Modifier;
import com.polyglot.codegen.ast.decl.ClassDecl;
import com.polyglot.codegen.ast.decl.EnumDecl;
import com.polyglot.codegen.ast.decl.FunctionLike;
import com.polyglot.codegen.ast.decl.ImportDecl;
import com.polyglot.codegen.ast.decl.InterfaceDecl;
import com.polyglot.codegen.ast.decl.MethodDecl;
import com.polyglot.codegen.ast.decl.ModuleDecl;
import com.polyglot.codegen.ast.decl.Parameter;
import com.polyglot.codegen.ast.decl.PropertyDecl;
import com.polyglot.codegen.ast.decl.TypeAliasDecl;
import com.polyglot.codegen.ast.decl.VariableDecl;
import com.polyglot.codegen.ast.expr.ArrayLiteral;
import com.polyglot.codegen.ast.expr.CallExpr;
import com.polyglot.codegen.ast.expr.Expression;
import com.polyglot.codegen.ast.expr.Identifier;
import com.polyglot.codegen.ast.expr.NewExpr;
import com.polyglot.codegen.ast.expr.ObjectLiteral;
import com.polyglot.codegen.ast.expr.PropertyAccessExpr;
import com.polyglot.codegen.ast.stmt.Statement;
import com.polyglot.codegen.ast.type.ArrayType;
import com.polyglot.codegen.ast.type.TypeNode;
import com.polyglot.codegen.ast.type.TypeReference;
import com.polyglot.codegen.generator.EnumConstant;
import com.polyglot.codegen.generator.ExpressionRenderer;
import com.polyglot.codegen.generator.FormattedComment;
import com.polyglot.codegen.generator.GenerationContext;
import com.polyglot.codegen.generator.GeneratorConfig;
import com.polyglot.codegen.generator.ImportSet;
import com.polyglot.codegen.generator.MemberScope;
import com.polyglot.codegen.generator.NamingConventions;
import com.polyglot.codegen.generator.Signature;
import com.polyglot.codegen.generator.TargetDialect;
import com.polyglot.codegen.generator.TypeMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * Ruby 方言。
 *
 * <p>命名转为 snake_case，实例字段写成 {@code @field} 并以 {@code attr_accessor} / {@code attr_reader}
 * 声明读写器（Ruby 惯例把它们放在类体开头）。启用类型签名时输出 Sorbet {@code sig}。</p>
 */
public class RubyDialect implements TargetDialect {

    private final RubyTypeMapper typeMapper = new RubyTypeMapper();
    private final RubyExpressionRenderer renderer = new RubyExpressionRenderer();

    @Override
    public String getName() {
        return "ruby";
    }

    @Override
    public TypeMapper getTypeMapper() {
        return typeMapper;
    }

    @Override
    public ExpressionRenderer getExpressionRenderer() {
        return renderer;
    }

    @Override
    public boolean emitsTypes(GeneratorConfig config) {
        return config.isEmitTypedSignatures();
    }

    private static boolean sorbet(GenerationContext ctx) {
        return ctx.getConfig().isEmitTypedSignatures();
    }

    // ============ 分析 ============

    @Override
    public void scan(AstNode node, GenerationContext ctx) {
        if (node instanceof FunctionLike && ((FunctionLike) node).isAsync()) {
            ctx.require(RubyTypeMapper.CONCURRENT);
        }
        if (sorbet(ctx) && (node instanceof FunctionLike || node instanceof ClassDecl
                || node instanceof InterfaceDecl)) {
            ctx.require(RubyTypeMapper.SORBET_RUNTIME);
        }
        if (node instanceof NewExpr && ((NewExpr) node).getCallee() instanceof Identifier
                && "Set".equals(((Identifier) ((NewExpr) node).getCallee()).getName())
                && !ctx.isTypeName("Set")) {
            ctx.require(RubyTypeMapper.SET);
        }
        if (node instanceof CallExpr && ((CallExpr) node).getCallee() instanceof PropertyAccessExpr) {
            Expression target = ((PropertyAccessExpr) ((CallExpr) node).getCallee()).getTarget();
            if (target instanceof Identifier && "JSON".equals(((Identifier) target).getName())) {
                ctx.require("require 'json'");
            }
        }
        if (node instanceof ImportDecl) {
            ImportDecl decl = (ImportDecl) node;
            String path = stripExtension(decl.getModuleSpecifier());
            if (decl.isRelative()) {
                ctx.require("require_relative '" + (path.startsWith("./") ? path.substring(2) : path) + "'");
            } else {
                ctx.require("require '" + path + "'");
            }
        }
    }

    private static String stripExtension(String path) {
        for (String ext : new String[]{".ts", ".js", ".mjs"}) {
            if (path.endsWith(ext)) {
                return path.substring(0, path.length() - ext.length());
            }
        }
        return path;
    }

    // ============ 文件结构 ============

    @Override
    public void writeHeader(CompilationUnit unit, GenerationContext ctx) {
        if (sorbet(ctx)) {
            ctx.line("# typed: true");
        }
        ctx.line("# frozen_string_literal: true");
        ctx.blankLine();
    }

    @Override
    public void writeImports(ImportSet imports, GenerationContext ctx) {
        for (String entry : imports.toSortedList()) {
            ctx.line(entry);
        }
        ctx.blankLine();
    }

    @Override
    public void openNamespace(GenerationContext ctx) {
        for (String segment : namespaceSegments(ctx.getConfig())) {
            ctx.line("module " + segment);
            ctx.indent();
        }
    }

    @Override
    public void writeTopLevel(List<Statement> statements, GenerationContext ctx) {
        ctx.emitDeclarations(statements);
    }

    @Override
    public void closeNamespace(GenerationContext ctx) {
        ctx.trimTrailingBlankLines();
        for (int i = 0; i < namespaceSegments(ctx.getConfig()).size(); i++) {
            ctx.dedent();
            ctx.line("end");
        }
    }

    /** "acme.billing" 或 "Acme::Billing" → [Acme, Billing] */
    static List<String> namespaceSegments(GeneratorConfig config) {
        List<String> segments = new ArrayList<>();
        if (!config.hasNamespacePrefix()) {
            return segments;
        }
        for (String part : config.getNamespacePrefix().split("::|\\.")) {
            if (!part.isEmpty()) {
                segments.add(NamingConventions.toPascalCase(part));
            }
        }
        return segments;
    }

    // ============ 注释 ============

    @Override
    public String lineComment(String text) {
        return text.isEmpty() ? "#" : "# " + text;
    }

    @Override
    public void writeComment(FormattedComment comment, GenerationContext ctx) {
        for (String line : comment.getLines()) {
            ctx.line(lineComment(line));
        }
    }

    // ============ 类 ============

    @Override
    public boolean supportsValueObjects(GeneratorConfig config) {
        return true;
    }

    @Override
    public void writeValueObject(ClassDecl node, List<PropertyDecl> fields, GenerationContext ctx) {
        StringBuilder members = new StringBuilder();
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) {
                members.append(", ");
            }
            members.append(':').append(renderer.memberName(fields.get(i).getName()));
        }
        List<String> mixins = mixins(node.getInterfaces());
        if (ctx.getConfig().isVersionAtLeast(3, 2)) {
            String head = node.getName() + " = Data.define(" + members + ")";
            if (mixins.isEmpty()) {
                ctx.line(head);
                return;
            }
            ctx.line(head + " do");
            ctx.indent();
            writeMixins(mixins, ctx);
            ctx.dedent();
            ctx.line("end");
            return;
        }
        // Data 之前的版本用冻结的 Struct
        ctx.line(node.getName() + " = Struct.new(" + members + ") do");
        ctx.indent();
        writeMixins(mixins, ctx);
        if (!mixins.isEmpty()) {
            ctx.blankLine();
        }
        ctx.line("def initialize(*)");
        ctx.indent();
        ctx.line("super");
        ctx.line("freeze");
        ctx.dedent();
        ctx.line("end");
        ctx.dedent();
        ctx.line("end");
    }

    private static List<String> mixins(List<TypeNode> interfaces) {
        List<String> names = new ArrayList<>();
        for (TypeNode type : interfaces) {
            if (type instanceof TypeReference) {
                names.add(((TypeReference) type).getName());
            }
        }
        return names;
    }

    private static void writeMixins(List<String> mixins, GenerationContext ctx) {
        for (String mixin : mixins) {
            ctx.line("include " + mixin);
        }
    }

    @Override
    public void openClass(ClassDecl node, GenerationContext ctx) {
        String head = "class " + node.getName();
        if (node.getSuperClass() instanceof TypeReference) {
            String base = ((TypeReference) node.getSuperClass()).getName();
            head += " < " + ("Error".equals(base) ? "StandardError" : base);
        }
        ctx.line(head);
        ctx.indent();
        boolean wrote = false;
        if (sorbet(ctx)) {
            ctx.line("extend T::Sig");
            if (node.isAbstract()) {
                ctx.line("extend T::Helpers");
                ctx.line("abstract!");
            }
            wrote = true;
        }
        List<String> mixins = mixins(node.getInterfaces());
        if (!mixins.isEmpty()) {
            if (wrote) {
                ctx.blankLine();
            }
            writeMixins(mixins, ctx);
            wrote = true;
        }
        if (wrote) {
            ctx.blankLine();
        }
    }

    @Override
    public void writeFields(ClassDecl node, List<PropertyDecl> fields, GenerationContext ctx) {
        List<PropertyDecl> statics = new ArrayList<>();
        List<String> accessors = new ArrayList<>();
        List<String> readers = new ArrayList<>();
        for (PropertyDecl field : fields) {
            if (field.isStatic()) {
                statics.add(field);
                continue;
            }
            String symbol = ":" + renderer.memberName(field.getName());
            if (sorbet(ctx)) {
                ctx.line("sig { returns(" + ctx.mapType(field.getType()) + ") }");
                ctx.line((field.isReadonly() ? "attr_reader " : "attr_accessor ") + symbol);
            } else if (field.isReadonly()) {
                readers.add(symbol);
            } else {
                accessors.add(symbol);
            }
        }
        if (!accessors.isEmpty()) {
            ctx.line("attr_accessor " + String.join(", ", accessors));
        }
        if (!readers.isEmpty()) {
            ctx.line("attr_reader " + String.join(", ", readers));
        }
        if (!fields.isEmpty() && fields.size() > statics.size()) {
            ctx.blankLine();
        }
        if (statics.isEmpty()) {
            return;
        }
        // 类级实例变量加单例读写器
        List<String> staticAccessors = new ArrayList<>();
        List<String> staticReaders = new ArrayList<>();
        for (PropertyDecl field : statics) {
            String name = renderer.memberName(field.getName());
            String value = field.getInitializer() != null ? ctx.render(field.getInitializer()) : "nil";
            ctx.line("@" + name + " = " + value);
            (field.isReadonly() ? staticReaders : staticAccessors).add(":" + name);
        }
        ctx.blankLine();
        ctx.line("class << self");
        ctx.indent();
        if (!staticAccessors.isEmpty()) {
            ctx.line("attr_accessor " + String.join(", ", staticAccessors));
        }
        if (!staticReaders.isEmpty()) {
            ctx.line("attr_reader " + String.join(", ", staticReaders));
        }
        ctx.dedent();
        ctx.line("end");
        ctx.blankLine();
    }

    @Override
    public void writeSynthesizedConstructor(ClassDecl node, List<PropertyDecl> fields, GenerationContext ctx) {
        List<Parameter> params = new ArrayList<>();
        List<PropertyDecl> initialized = new ArrayList<>();
        for (PropertyDecl field : fields) {
            if (field.getInitializer() != null) {
                initialized.add(field);
            } else {
                params.add(new Parameter(field.getSpan(), new ArrayList<Modifier>(), field.getName(),
                        field.getType(), null, false, false));
            }
        }
        openConstructor(Signature.ofSynthesizedConstructor(node, params), ctx);
        for (Parameter p : params) {
            ctx.line(fieldAssignment(p.getName(), p.getName()));
        }
        writeFieldInitializers(initialized, ctx);
        closeConstructor(ctx);
    }

    @Override
    public void openConstructor(Signature signature, GenerationContext ctx) {
        if (sorbet(ctx)) {
            ctx.line(sig(signature, false, ctx));
        }
        ctx.line(def("initialize", signature, ctx));
        ctx.indent();
    }

    @Override
    public String fieldAssignment(String fieldName, String parameterName) {
        return "@" + renderer.memberName(fieldName) + " = " + renderer.localName(parameterName);
    }

    @Override
    public void writeFieldInitializers(List<PropertyDecl> fields, GenerationContext ctx) {
        for (PropertyDecl field : fields) {
            ctx.line("@" + renderer.memberName(field.getName()) + " = " + ctx.render(field.getInitializer()));
        }
    }

    @Override
    public void closeConstructor(GenerationContext ctx) {
        ctx.dedent();
        ctx.line("end");
    }

    @Override
    public void writeAccessors(List<PropertyDecl> fields, GenerationContext ctx) {
        // 读写器已在 writeFields 中以 attr_* 声明
    }

    @Override
    public void closeClass(ClassDecl node, GenerationContext ctx) {
        ctx.dedent();
        ctx.line("end");
    }

    // ============ 函数与方法 ============

    @Override
    public boolean supportsNestedFunctions() {
        return true;
    }

    @Override
    public void writeAbstractMethod(Signature signature, GenerationContext ctx) {
        writeMethodStub(signature, ctx);
    }

    @Override
    public void openFunction(Signature signature, GenerationContext ctx) {
        if (sorbet(ctx)) {
            ctx.line(sig(signature, false, ctx));
        }
        String def = def(methodName(signature, ctx), signature, ctx);
        if (signature.getScope() == MemberScope.CLASS && signature.getVisibility() == Modifier.PRIVATE) {
            def = "private " + def;
        } else if (signature.getScope() == MemberScope.CLASS && signature.getVisibility() == Modifier.PROTECTED) {
            def = "protected " + def;
        }
        ctx.line(def);
        ctx.indent();
    }

    /** 静态方法、命名空间函数（含包在命名空间前缀里的顶层函数）定义在单例上 */
    private String methodName(Signature signature, GenerationContext ctx) {
        String name = renderer.memberName(signature.getName());
        if (signature.getAccessorKind() == MethodDecl.AccessorKind.SETTER) {
            name += "=";
        }
        boolean singleton;
        if (signature.getScope() == MemberScope.CLASS) {
            singleton = signature.isStatic();
        } else if (signature.getScope() == MemberScope.NAMESPACE) {
            singleton = true;
        } else {
            singleton = signature.getScope() == MemberScope.TOP_LEVEL && ctx.getConfig().hasNamespacePrefix();
        }
        return singleton ? "self." + name : name;
    }

    private String def(String name, Signature signature, GenerationContext ctx) {
        String params = renderer.renderParameters(signature.getParameters(), ctx);
        return "def " + name + (params.isEmpty() ? "" : "(" + params + ")");
    }

    /**
     * Sorbet 签名：{@code sig { params(x: Numeric).returns(String) }}
     */
    private String sig(Signature signature, boolean isAbstract, GenerationContext ctx) {
        List<String> chain = new ArrayList<>();
        if (isAbstract) {
            chain.add("abstract");
        }
        List<Parameter> params = signature.getParameters();
        if (!params.isEmpty()) {
            StringBuilder sb = new StringBuilder("params(");
            for (int i = 0; i < params.size(); i++) {
                Parameter p = params.get(i);
                if (i > 0) {
                    sb.append(", ");
                }
                TypeNode type = p.getType();
                if (p.isRest() && type instanceof ArrayType) {
                    type = ((ArrayType) type).getElementType();
                }
                String mapped = ctx.mapType(type);
                if (p.isOptional() && !p.hasDefaultValue() && !mapped.startsWith("T.nilable")
                        && !mapped.equals(typeMapper.untypedType())) {
                    mapped = "T.nilable(" + mapped + ")";
                }
                sb.append(renderer.localName(p.getName())).append(": ").append(mapped);
            }
            chain.add(sb.append(')').toString());
        }
        if (signature.isConstructor() || (!signature.isAsync() && signature.returnsVoid())) {
            chain.add("void");
        } else if (signature.isAsync()) {
            chain.add("returns(" + typeMapper.futureOf(signature.getValueType(), ctx.getImports()) + ")");
        } else {
            chain.add("returns(" + ctx.mapType(signature.getValueType()) + ")");
        }
        return "sig { " + String.join(".", chain) + " }";
    }

    @Override
    public void openAsyncBody(Signature signature, GenerationContext ctx) {
        // lambda 块内 return 只结束 future 求值
        ctx.line("Concurrent::Promises.future(&-> do");
        ctx.indent();
    }

    @Override
    public void closeAsyncBody(Signature signature, boolean bodyCompletes, GenerationContext ctx) {
        ctx.dedent();
        ctx.line("end)");
    }

    @Override
    public void closeFunction(Signature signature, GenerationContext ctx) {
        ctx.dedent();
        ctx.line("end");
    }

    // ============ 接口、枚举、命名空间、变量 ============

    @Override
    public void openInterface(InterfaceDecl node, GenerationContext ctx) {
        ctx.line("module " + node.getName());
        ctx.indent();
        if (sorbet(ctx)) {
            ctx.line("extend T::Sig");
            ctx.line("extend T::Helpers");
            ctx.line("interface!");
            ctx.blankLine();
        }
        List<String> parents = mixins(node.getSuperInterfaces());
        if (!parents.isEmpty()) {
            writeMixins(parents, ctx);
            ctx.blankLine();
        }
    }

    @Override
    public void writePropertyStub(PropertyDecl property, GenerationContext ctx) {
        String name = renderer.memberName(property.getName());
        if (sorbet(ctx)) {
            ctx.line("sig { abstract.returns(" + ctx.mapType(property.getType()) + ") }");
            ctx.line("def " + name + "; end");
        } else {
            ctx.line("def " + name);
            ctx.indent();
            ctx.line("raise NotImplementedError");
            ctx.dedent();
            ctx.line("end");
        }
        ctx.blankLine();
    }

    @Override
    public void writeMethodStub(Signature signature, GenerationContext ctx) {
        String def = def(methodName(signature, ctx), signature, ctx);
        if (sorbet(ctx)) {
            ctx.line(sig(signature, true, ctx));
            ctx.line(def + "; end");
        } else {
            ctx.line(def);
            ctx.indent();
            ctx.line("raise NotImplementedError");
            ctx.dedent();
            ctx.line("end");
        }
        ctx.blankLine();
    }

    @Override
    public void closeInterface(InterfaceDecl node, GenerationContext ctx) {
        ctx.dedent();
        ctx.line("end");
    }

    @Override
    public void writeEnum(EnumDecl node, List<EnumConstant> constants, GenerationContext ctx) {
        ctx.line("module " + node.getName());
        ctx.indent();
        for (EnumConstant constant : constants) {
            ctx.line(constant.getName() + " = " + constant.getValue());
        }
        ctx.dedent();
        ctx.line("end");
    }

    @Override
    public void writeModule(ModuleDecl node, GenerationContext ctx) {
        ctx.line("module " + node.getName());
        ctx.indent();
        MemberScope previous = ctx.enterScope(MemberScope.NAMESPACE);
        ctx.emitDeclarations(node.getStatements());
        ctx.enterScope(previous);
        ctx.trimTrailingBlankLines();
        ctx.dedent();
        ctx.line("end");
    }

    @Override
    public void writeVariable(VariableDecl node, VariableDecl.Declarator declarator, String targetName,
                              boolean constant, GenerationContext ctx) {
        Expression init = declarator.getInitializer();
        String value = init != null ? ctx.render(init) : "nil";
        if (constant && (init instanceof ArrayLiteral || init instanceof ObjectLiteral)) {
            value += ".freeze";
        } else if (sorbet(ctx) && declarator.getType() != null) {
            value = "T.let(" + value + ", " + ctx.mapType(declarator.getType()) + ")";
        }
        ctx.line(targetName + " = " + value);
    }

    @Override
    public void writeTypeAlias(TypeAliasDecl node, GenerationContext ctx) {
        if (sorbet(ctx)) {
            ctx.line(node.getName() + " = T.type_alias { " + ctx.mapType(node.getType()) + " }");
            return;
        }
        String text = ctx.getUnit().textOf(node.getType().getSpan()).trim();
        ctx.line(lineComment("type " + node.getName() + (text.isEmpty() ? "" : " = " + text)));
    }

    // ============ 语句 ============

    @Override
    public String expressionStatement(String expression) {
        return expression;
    }

    @Override
    public String returnStatement(String value, GenerationContext ctx) {
        return value == null ? "return" : "return " + value;
    }

    @Override
    public String throwStatement(Expression value, GenerationContext ctx) {
        return "raise " + ctx.render(value);
    }

    @Override
    public String breakStatement(String switchTag) {
        return switchTag == null ? "break" : "throw :" + switchTag;
    }

    @Override
    public String continueStatement(String switchTag) {
        return switchTag == null ? "next" : "throw :" + switchTag + ", :next";
    }

    @Override
    public void openIf(String condition, GenerationContext ctx) {
        ctx.line("if " + condition);
        ctx.indent();
    }

    @Override
    public void openElseIf(String condition, GenerationContext ctx) {
        ctx.dedent();
        ctx.line("elsif " + condition);
        ctx.indent();
    }

    @Override
    public void openElse(GenerationContext ctx) {
        ctx.dedent();
        ctx.line("else");
        ctx.indent();
    }

    @Override
    public void closeIf(GenerationContext ctx) {
        ctx.dedent();
        ctx.line("end");
    }

    @Override
    public void openWhile(String condition, GenerationContext ctx) {
        ctx.line("while " + condition);
        ctx.indent();
    }

    @Override
    public void closeWhile(GenerationContext ctx) {
        ctx.dedent();
        ctx.line("end");
    }

    @Override
    public void openDoWhile(GenerationContext ctx) {
        ctx.line("begin");
        ctx.indent();
    }

    @Override
    public void closeDoWhile(String condition, GenerationContext ctx) {
        ctx.dedent();
        ctx.line("end while " + condition);
    }

    @Override
    public void openRangeLoop(String variable, String start, String bound, boolean captured,
                              GenerationContext ctx) {
        ctx.line("(" + start + "..." + bound + ").each do |" + variable + "|");
        ctx.indent();
    }

    @Override
    public void openForEach(List<String> variables, String iterable, GenerationContext ctx) {
        ctx.line(iterable + ".each do |" + String.join(", ", variables) + "|");
        ctx.indent();
    }

    @Override
    public void closeLoop(GenerationContext ctx) {
        ctx.dedent();
        ctx.line("end");
    }

    @Override
    public void openScope(GenerationContext ctx) {
        // Ruby 没有块级作用域
    }

    @Override
    public void closeScope(GenerationContext ctx) {
    }

    @Override
    public boolean switchFallsThrough() {
        return false;
    }

    @Override
    public void openSwitch(String subject, String tag, boolean capturesContinue, GenerationContext ctx) {
        if (tag != null) {
            // case/when 内的 break 不能跳出 case，用 catch/throw 模拟
            ctx.line((capturesContinue ? tag + "_result = " : "") + "catch(:" + tag + ") do");
            ctx.indent();
        }
        ctx.line("case " + subject);
    }

    @Override
    public void openCase(List<String> labels, boolean includesDefault, GenerationContext ctx) {
        ctx.line(includesDefault || labels.isEmpty() ? "else" : "when " + String.join(", ", labels));
        ctx.indent();
    }

    @Override
    public void closeCase(GenerationContext ctx) {
        ctx.dedent();
    }

    @Override
    public void closeSwitch(String tag, boolean capturesContinue, GenerationContext ctx) {
        ctx.line("end");
        if (tag != null) {
            ctx.dedent();
            ctx.line("end");
            if (capturesContinue) {
                ctx.line("next if " + tag + "_result == :next");
            }
        }
    }

    @Override
    public void openTry(GenerationContext ctx) {
        ctx.line("begin");
        ctx.indent();
    }

    @Override
    public void openCatch(String variable, GenerationContext ctx) {
        ctx.dedent();
        ctx.line(variable == null ? "rescue StandardError" : "rescue StandardError => " + variable);
        ctx.indent();
    }

    @Override
    public void openFinally(GenerationContext ctx) {
        ctx.dedent();
        ctx.line("ensure");
        ctx.indent();
    }

    @Override
    public void closeTry(GenerationContext ctx) {
        ctx.dedent();
        ctx.line("end");
    }
}
