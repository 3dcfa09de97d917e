package com.polyglot.codegen.generator.java;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.CompilationUnit;
import com.polyglot.codegen.ast.Modifier;
import com.polyglot.codegen.ast.SourceSpan;
import com.polyglot.codegen.ast.decl.ClassDecl;
import com.polyglot.codegen.ast.decl.Declaration;
import com.polyglot.codegen.ast.decl.EnumDecl;
import com.polyglot.codegen.ast.decl.FunctionLike;
import com.polyglot.codegen.ast.decl.ImportDecl;
import com.polyglot.codegen.ast.decl.InterfaceDecl;
import com.polyglot.codegen.ast.decl.MethodDecl;
import com.polyglot.codegen.ast.decl.ModuleDecl;
import com.polyglot.codegen.ast.decl.PropertyDecl;
import com.polyglot.codegen.ast.decl.TypeAliasDecl;
import com.polyglot.codegen.ast.decl.TypeParameter;
import com.polyglot.codegen.ast.decl.VariableDecl;
import com.polyglot.codegen.ast.expr.ArrayLiteral;
import com.polyglot.codegen.ast.expr.ArrowFunction;
import com.polyglot.codegen.ast.expr.CallExpr;
import com.polyglot.codegen.ast.expr.Expression;
import com.polyglot.codegen.ast.expr.Identifier;
import com.polyglot.codegen.ast.expr.Literal;
import com.polyglot.codegen.ast.expr.NewExpr;
import com.polyglot.codegen.ast.expr.ObjectLiteral;
import com.polyglot.codegen.ast.expr.PropertyAccessExpr;
import com.polyglot.codegen.ast.expr.TemplateExpr;
import com.polyglot.codegen.ast.expr.UnsupportedExpr;
import com.polyglot.codegen.ast.stmt.Statement;
import com.polyglot.codegen.ast.type.FunctionType;
import com.polyglot.codegen.ast.type.KeywordType;
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
import java.util.Collections;
import java.util.List;

/**
 * Java 方言。
 *
 * <p>类、接口、枚举、命名空间写在文件顶层；其余函数、变量与语句收进以文件名命名的 final 容器类，
 * 语句放进静态初始化块。字段一律私有，通过 getX / setX 访问。</p>
 */
public class JavaDialect implements TargetDialect {

    static final String DEFAULT_HOLDER = "Generated";

    private final JavaTypeMapper typeMapper = new JavaTypeMapper();
    private final JavaExpressionRenderer renderer = new JavaExpressionRenderer(typeMapper);

    @Override
    public String getName() {
        return "java";
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
        return true;
    }

    // ============ 分析 ============

    @Override
    public void scan(AstNode node, GenerationContext ctx) {
        ImportSet imports = ctx.getImports();
        if (node instanceof ArrayLiteral) {
            imports.add(((ArrayLiteral) node).getElements().isEmpty() ? "java.util.ArrayList" : "java.util.List");
        } else if (node instanceof ObjectLiteral) {
            imports.add(((ObjectLiteral) node).getProperties().isEmpty() ? "java.util.HashMap" : "java.util.Map");
        } else if (node instanceof NewExpr && ((NewExpr) node).getCallee() instanceof Identifier) {
            String name = ((Identifier) ((NewExpr) node).getCallee()).getName();
            String builtin = JavaExpressionRenderer.builtinClass(name);
            if (builtin != null && !builtin.endsWith("Exception") && !ctx.isTypeName(name)) {
                imports.add("java.util." + builtin);
            }
        } else if (node instanceof CallExpr) {
            scanCall((CallExpr) node, imports);
        } else if (node instanceof FunctionLike && ((FunctionLike) node).isAsync()) {
            imports.add("java.util.concurrent.CompletableFuture");
        } else if (node instanceof VariableDecl) {
            for (VariableDecl.Declarator d : ((VariableDecl) node).getDeclarators()) {
                if (d.getType() == null) {
                    inferType(d.getInitializer(), imports);
                }
            }
        } else if (node instanceof PropertyDecl && ((PropertyDecl) node).getType() == null) {
            inferType(((PropertyDecl) node).getInitializer(), imports);
        } else if (node instanceof ImportDecl) {
            scanImport((ImportDecl) node, ctx);
        }
    }

    private static void scanCall(CallExpr call, ImportSet imports) {
        if (!(call.getCallee() instanceof PropertyAccessExpr)) {
            return;
        }
        PropertyAccessExpr callee = (PropertyAccessExpr) call.getCallee();
        String method = callee.getName();
        if (("map".equals(method) || "filter".equals(method)) && call.getArguments().size() == 1
                && call.getArguments().get(0) instanceof ArrowFunction) {
            imports.add("java.util.stream.Collectors");
        }
        if (callee.getTarget() instanceof Identifier && "Array".equals(((Identifier) callee.getTarget()).getName())
                && "isArray".equals(method)) {
            imports.add("java.util.List");
        }
    }

    /** 相对模块的具名导入：类型名导入类，小写名静态导入容器类成员 */
    private static void scanImport(ImportDecl decl, GenerationContext ctx) {
        if (!decl.isRelative() || !ctx.getConfig().hasNamespacePrefix()) {
            return;
        }
        String prefix = ctx.getConfig().getNamespacePrefix();
        String holder = holderNameFor(decl.getModuleSpecifier());
        for (String binding : decl.getNamedBindings()) {
            if (NamingConventions.startsWithUpperCase(binding)) {
                ctx.require(prefix + "." + binding);
            } else {
                ctx.require("static " + prefix + "." + holder + "." + binding);
            }
        }
    }

    // ============ 文件结构 ============

    @Override
    public void writeHeader(CompilationUnit unit, GenerationContext ctx) {
        if (ctx.getConfig().hasNamespacePrefix()) {
            ctx.line("package " + ctx.getConfig().getNamespacePrefix().replace("::", ".") + ";");
            ctx.blankLine();
        }
    }

    @Override
    public void writeImports(ImportSet imports, GenerationContext ctx) {
        for (String entry : imports.toSortedList()) {
            ctx.line("import " + entry + ";");
        }
        ctx.blankLine();
    }

    @Override
    public void openNamespace(GenerationContext ctx) {
        // 包声明已在文件头写出
    }

    @Override
    public void writeTopLevel(List<Statement> statements, GenerationContext ctx) {
        List<Statement> types = new ArrayList<>();
        List<Statement> members = new ArrayList<>();
        for (Statement statement : statements) {
            if (isTypeDeclaration(statement)) {
                types.add(statement);
            } else {
                members.add(statement);
            }
        }
        ctx.emitDeclarations(types);
        if (members.isEmpty()) {
            return;
        }
        String holder = holderNameFor(ctx.getUnit().getFileName());
        if (ctx.isTypeName(holder)) {
            holder += "Module";
        }
        ctx.blankLine();
        ctx.line("public final class " + holder + " {");
        ctx.indent();
        writeHolderBody(holder, members, ctx);
        ctx.dedent();
        ctx.line("}");
    }

    private static boolean isTypeDeclaration(Statement statement) {
        return statement instanceof ClassDecl
                || statement instanceof InterfaceDecl
                || statement instanceof EnumDecl
                || statement instanceof ModuleDecl
                || statement instanceof TypeAliasDecl
                || statement instanceof ImportDecl;
    }

    /** "src/order-utils.ts" → "OrderUtils" */
    static String holderNameFor(String fileName) {
        if (fileName == null || fileName.isEmpty()) {
            return DEFAULT_HOLDER;
        }
        String base = fileName.replace('\\', '/');
        base = base.substring(base.lastIndexOf('/') + 1);
        int dot = base.indexOf('.');
        if (dot > 0) {
            base = base.substring(0, dot);
        }
        String name = NamingConventions.toPascalCase(base);
        if (name.isEmpty() || !Character.isJavaIdentifierStart(name.charAt(0))) {
            return DEFAULT_HOLDER;
        }
        return name;
    }

    /**
     * 容器类成员：声明成为静态成员，连续的普通语句合并进一个静态初始化块
     */
    private void writeHolderBody(String holder, List<Statement> members, GenerationContext ctx) {
        ctx.line("private " + holder + "() {");
        ctx.line("}");
        ctx.blankLine();
        MemberScope previous = ctx.enterScope(MemberScope.NAMESPACE);
        boolean inInitializer = false;
        for (Statement statement : members) {
            boolean member = statement instanceof Declaration;
            if (member && inInitializer) {
                closeInitializer(ctx);
                inInitializer = false;
            }
            if (member) {
                ctx.emitDeclarations(Collections.singletonList(statement));
                continue;
            }
            if (!inInitializer) {
                ctx.blankLine();
                ctx.line("static {");
                ctx.indent();
                ctx.enterScope(MemberScope.FUNCTION);
                inInitializer = true;
            }
            ctx.emit(statement);
        }
        if (inInitializer) {
            closeInitializer(ctx);
        }
        ctx.enterScope(previous);
        ctx.trimTrailingBlankLines();
    }

    private static void closeInitializer(GenerationContext ctx) {
        ctx.enterScope(MemberScope.NAMESPACE);
        ctx.dedent();
        ctx.line("}");
        ctx.blankLine();
    }

    @Override
    public void closeNamespace(GenerationContext ctx) {
    }

    // ============ 注释 ============

    @Override
    public String lineComment(String text) {
        return text.isEmpty() ? "//" : "// " + text;
    }

    @Override
    public void writeComment(FormattedComment comment, GenerationContext ctx) {
        if (!comment.isDoc()) {
            for (String line : comment.getLines()) {
                ctx.line(lineComment(line));
            }
            return;
        }
        ctx.line("/**");
        for (String line : comment.getLines()) {
            ctx.line(line.isEmpty() ? " *" : " * " + line);
        }
        ctx.line(" */");
    }

    // ============ 类 ============

    @Override
    public boolean supportsValueObjects(GeneratorConfig config) {
        return config.isVersionAtLeast(16, 0);
    }

    @Override
    public void writeValueObject(ClassDecl node, List<PropertyDecl> fields, GenerationContext ctx) {
        List<String> components = new ArrayList<>();
        for (PropertyDecl field : fields) {
            components.add(fieldType(field, ctx) + " " + field.getName());
        }
        ctx.line(typeModifiers(node, ctx) + "record " + node.getName()
                + typeParameters(node.getTypeParameters(), ctx)
                + "(" + String.join(", ", components) + ")"
                + heritage(" implements ", node.getInterfaces(), ctx) + " {}");
    }

    @Override
    public void openClass(ClassDecl node, GenerationContext ctx) {
        String head = typeModifiers(node, ctx) + (node.isAbstract() ? "abstract " : "") + "class "
                + node.getName() + typeParameters(node.getTypeParameters(), ctx);
        if (node.getSuperClass() != null) {
            head += " extends " + ctx.mapType(node.getSuperClass());
        }
        ctx.line(head + heritage(" implements ", node.getInterfaces(), ctx) + " {");
        ctx.indent();
    }

    private static String heritage(String keyword, List<TypeNode> types, GenerationContext ctx) {
        if (types.isEmpty()) {
            return "";
        }
        List<String> names = new ArrayList<>();
        for (TypeNode type : types) {
            names.add(ctx.mapType(type));
        }
        return keyword + String.join(", ", names);
    }

    /** 顶层导出为 public，命名空间内为 public static，局部类没有修饰符 */
    private static String typeModifiers(Declaration node, GenerationContext ctx) {
        switch (ctx.getScope()) {
            case TOP_LEVEL:
                return node.isExported() ? "public " : "";
            case FUNCTION:
                return "";
            default:
                return "public static ";
        }
    }

    private static String typeParameters(List<TypeParameter> parameters, GenerationContext ctx) {
        if (parameters.isEmpty()) {
            return "";
        }
        List<String> rendered = new ArrayList<>();
        for (TypeParameter p : parameters) {
            rendered.add(p.getConstraint() == null ? p.getName()
                    : p.getName() + " extends " + ctx.mapType(p.getConstraint()));
        }
        return "<" + String.join(", ", rendered) + ">";
    }

    @Override
    public void writeFields(ClassDecl node, List<PropertyDecl> fields, GenerationContext ctx) {
        for (PropertyDecl field : fields) {
            StringBuilder sb = new StringBuilder();
            if (field.isStatic()) {
                sb.append(visibility(field.getModifiers())).append("static ");
            } else {
                sb.append("private ");
            }
            if (field.isReadonly()) {
                sb.append("final ");
            }
            sb.append(fieldType(field, ctx)).append(' ').append(field.getName());
            if (field.getInitializer() != null) {
                sb.append(" = ").append(ctx.render(field.getInitializer()));
            }
            ctx.line(sb.append(';').toString());
        }
        if (!fields.isEmpty()) {
            ctx.blankLine();
        }
    }

    private String fieldType(PropertyDecl field, GenerationContext ctx) {
        String type;
        if (field.getType() != null) {
            type = ctx.mapType(field.getType());
        } else {
            type = inferType(field.getInitializer(), ctx.getImports());
            if (type == null) {
                type = typeMapper.untypedType();
            }
        }
        return field.isOptional() || isOpaque(field.getInitializer()) ? JavaTypeMapper.box(type) : type;
    }

    /** 无法转换的初始化器可能渲染为 null，声明类型必须能容纳它 */
    private static boolean isOpaque(Expression init) {
        return init instanceof UnsupportedExpr;
    }

    private static String visibility(List<Modifier> modifiers) {
        if (modifiers.contains(Modifier.PRIVATE)) {
            return "private ";
        }
        if (modifiers.contains(Modifier.PROTECTED)) {
            return "protected ";
        }
        return "public ";
    }

    private static String visibility(Modifier modifier) {
        return modifier == null ? "" : modifier.toSourceString() + " ";
    }

    @Override
    public void writeSynthesizedConstructor(ClassDecl node, List<PropertyDecl> fields, GenerationContext ctx) {
        List<PropertyDecl> assigned = new ArrayList<>();
        for (PropertyDecl field : fields) {
            if (field.getInitializer() == null) {
                assigned.add(field);
            }
        }
        if (assigned.isEmpty()) {
            return;
        }
        List<String> params = new ArrayList<>();
        for (PropertyDecl field : assigned) {
            params.add(fieldType(field, ctx) + " " + field.getName());
        }
        ctx.line("public " + node.getName() + "(" + String.join(", ", params) + ") {");
        ctx.indent();
        for (PropertyDecl field : assigned) {
            ctx.line(fieldAssignment(field.getName(), field.getName()));
        }
        ctx.dedent();
        ctx.line("}");
    }

    @Override
    public void openConstructor(Signature signature, GenerationContext ctx) {
        ctx.line(visibility(signature.getVisibility()) + signature.getOwnerName()
                + "(" + renderer.renderParameters(signature.getParameters(), ctx) + ") {");
        ctx.indent();
    }

    @Override
    public String fieldAssignment(String fieldName, String parameterName) {
        return "this." + fieldName + " = " + renderer.localName(parameterName) + ";";
    }

    @Override
    public void writeFieldInitializers(List<PropertyDecl> fields, GenerationContext ctx) {
        // 初始化器保留在字段声明处
    }

    @Override
    public void closeConstructor(GenerationContext ctx) {
        ctx.dedent();
        ctx.line("}");
    }

    @Override
    public void writeAccessors(List<PropertyDecl> fields, GenerationContext ctx) {
        for (PropertyDecl field : fields) {
            String type = fieldType(field, ctx);
            String suffix = NamingConventions.capitalize(field.getName());
            ctx.line("public " + type + " " + ("boolean".equals(type) ? "is" : "get") + suffix + "() {");
            ctx.indent();
            ctx.line("return " + field.getName() + ";");
            ctx.dedent();
            ctx.line("}");
            ctx.blankLine();
            if (field.isReadonly()) {
                continue;
            }
            ctx.line("public void set" + suffix + "(" + type + " " + field.getName() + ") {");
            ctx.indent();
            ctx.line(fieldAssignment(field.getName(), field.getName()));
            ctx.dedent();
            ctx.line("}");
            ctx.blankLine();
        }
    }

    @Override
    public void closeClass(ClassDecl node, GenerationContext ctx) {
        ctx.dedent();
        ctx.line("}");
    }

    // ============ 函数与方法 ============

    @Override
    public boolean supportsNestedFunctions() {
        return false;
    }

    @Override
    public void writeAbstractMethod(Signature signature, GenerationContext ctx) {
        ctx.line(methodModifiers(signature) + "abstract " + methodHead(signature, ctx) + ";");
    }

    @Override
    public void openFunction(Signature signature, GenerationContext ctx) {
        ctx.line(methodModifiers(signature) + methodHead(signature, ctx) + " {");
        ctx.indent();
    }

    private static String methodModifiers(Signature signature) {
        switch (signature.getScope()) {
            case CLASS:
                return visibility(signature.getVisibility()) + (signature.isStatic() ? "static " : "");
            case INTERFACE:
            case FUNCTION:
                return "";
            default:
                return visibility(signature.getVisibility()) + "static ";
        }
    }

    /** 泛型参数、返回类型、方法名与参数表 */
    private String methodHead(Signature signature, GenerationContext ctx) {
        String typeParams = typeParameters(signature.getTypeParameters(), ctx);
        return (typeParams.isEmpty() ? "" : typeParams + " ") + returnType(signature, ctx) + " "
                + methodName(signature) + "(" + renderer.renderParameters(signature.getParameters(), ctx) + ")";
    }

    private String returnType(Signature signature, GenerationContext ctx) {
        if (signature.getAccessorKind() == MethodDecl.AccessorKind.SETTER) {
            return "void";
        }
        if (signature.isAsync()) {
            return typeMapper.futureOf(signature.getValueType(), ctx.getImports());
        }
        if (signature.returnsVoid()) {
            return "void";
        }
        return ctx.mapType(signature.getValueType());
    }

    private static String methodName(Signature signature) {
        switch (signature.getAccessorKind()) {
            case GETTER:
                return "get" + NamingConventions.capitalize(signature.getName());
            case SETTER:
                return "set" + NamingConventions.capitalize(signature.getName());
            default:
                return signature.getName();
        }
    }

    @Override
    public void openAsyncBody(Signature signature, GenerationContext ctx) {
        ctx.line("return CompletableFuture." + (signature.returnsVoid() ? "runAsync" : "supplyAsync") + "(() -> {");
        ctx.indent();
    }

    @Override
    public void closeAsyncBody(Signature signature, boolean bodyCompletes, GenerationContext ctx) {
        if (bodyCompletes && !signature.returnsVoid()) {
            ctx.line("return null;");
        }
        ctx.dedent();
        ctx.line("});");
    }

    @Override
    public void closeFunction(Signature signature, GenerationContext ctx) {
        ctx.dedent();
        ctx.line("}");
    }

    // ============ 接口、枚举、命名空间、变量 ============

    @Override
    public void openInterface(InterfaceDecl node, GenerationContext ctx) {
        ctx.line(typeModifiers(node, ctx) + "interface " + node.getName()
                + typeParameters(node.getTypeParameters(), ctx)
                + heritage(" extends ", node.getSuperInterfaces(), ctx) + " {");
        ctx.indent();
    }

    @Override
    public void writePropertyStub(PropertyDecl property, GenerationContext ctx) {
        String type = fieldType(property, ctx);
        ctx.line(type + " " + ("boolean".equals(type) ? "is" : "get")
                + NamingConventions.capitalize(property.getName()) + "();");
        ctx.blankLine();
    }

    @Override
    public void writeMethodStub(Signature signature, GenerationContext ctx) {
        ctx.line(methodHead(signature, ctx) + ";");
        ctx.blankLine();
    }

    @Override
    public void closeInterface(InterfaceDecl node, GenerationContext ctx) {
        ctx.dedent();
        ctx.line("}");
    }

    /**
     * 全部为位置值时写成普通枚举；有显式初始化器时带 value 字段
     */
    @Override
    public void writeEnum(EnumDecl node, List<EnumConstant> constants, GenerationContext ctx) {
        ctx.line(typeModifiers(node, ctx) + "enum " + node.getName() + " {");
        ctx.indent();
        boolean valued = false;
        for (EnumConstant constant : constants) {
            valued |= constant.isExplicit();
        }
        for (int i = 0; i < constants.size(); i++) {
            EnumConstant constant = constants.get(i);
            boolean last = i == constants.size() - 1;
            String text = valued ? constant.getName() + "(" + constant.getValue() + ")" : constant.getName();
            ctx.line(text + (last ? (valued ? ";" : "") : ","));
        }
        if (valued) {
            String type = enumValueType(constants);
            ctx.blankLine();
            ctx.line("private final " + type + " value;");
            ctx.blankLine();
            ctx.line(node.getName() + "(" + type + " value) {");
            ctx.indent();
            ctx.line("this.value = value;");
            ctx.dedent();
            ctx.line("}");
            ctx.blankLine();
            ctx.line("public " + type + " getValue() {");
            ctx.indent();
            ctx.line("return value;");
            ctx.dedent();
            ctx.line("}");
        }
        ctx.dedent();
        ctx.line("}");
    }

    private static String enumValueType(List<EnumConstant> constants) {
        boolean allInteger = true;
        boolean allNumeric = true;
        boolean allString = true;
        for (EnumConstant constant : constants) {
            EnumConstant.ValueKind kind = constant.getValueKind();
            allInteger &= kind == EnumConstant.ValueKind.INTEGER;
            allNumeric &= kind == EnumConstant.ValueKind.INTEGER || kind == EnumConstant.ValueKind.NUMBER;
            allString &= kind == EnumConstant.ValueKind.STRING;
        }
        if (allInteger) {
            return "int";
        }
        if (allNumeric) {
            return "double";
        }
        return allString ? "String" : "Object";
    }

    @Override
    public void writeModule(ModuleDecl node, GenerationContext ctx) {
        ctx.line(typeModifiers(node, ctx) + "final class " + node.getName() + " {");
        ctx.indent();
        writeHolderBody(node.getName(), node.getStatements(), ctx);
        ctx.dedent();
        ctx.line("}");
    }

    @Override
    public void writeVariable(VariableDecl node, VariableDecl.Declarator declarator, String targetName,
                              boolean constant, GenerationContext ctx) {
        Expression init = declarator.getInitializer();
        String value = init != null ? " = " + ctx.render(init) : "";
        if (ctx.getScope() == MemberScope.FUNCTION) {
            ctx.line(localType(declarator, ctx) + " " + targetName + value + ";");
            return;
        }
        String type = declarator.getType() != null ? ctx.mapType(declarator.getType()) : null;
        if (type == null) {
            type = inferType(init, ctx.getImports());
        }
        if (type == null) {
            type = typeMapper.untypedType();
        }
        if (isOpaque(init)) {
            type = JavaTypeMapper.box(type);
        }
        String modifiers = (node.isExported() || ctx.getScope() == MemberScope.NAMESPACE ? "public " : "")
                + "static " + (constant ? "final " : "");
        ctx.line(modifiers + type + " " + targetName + value + ";");
    }

    /**
     * 局部变量类型：显式注解优先；启用类型签名时按初始化器推断，否则用 var。
     * 闭包、null 与无法转换的初始化器不能用 var。
     */
    private String localType(VariableDecl.Declarator declarator, GenerationContext ctx) {
        Expression init = declarator.getInitializer();
        if (declarator.getType() != null) {
            String type = ctx.mapType(declarator.getType());
            return isOpaque(init) ? JavaTypeMapper.box(type) : type;
        }
        if (init instanceof ArrowFunction) {
            return inferType(init, ctx.getImports());
        }
        if (init == null || isOpaque(init) || (init instanceof Literal && ((Literal) init).isNullish())) {
            return typeMapper.untypedType();
        }
        if (ctx.getConfig().isEmitTypedSignatures()) {
            String inferred = inferType(init, ctx.getImports());
            if (inferred != null) {
                return inferred;
            }
        }
        return "var";
    }

    /**
     * 由初始化器推断声明类型，无法推断返回 null
     */
    String inferType(Expression init, ImportSet imports) {
        if (init instanceof Literal) {
            Literal literal = (Literal) init;
            switch (literal.getLiteralKind()) {
                case STRING:  return "String";
                case NUMBER:  return literal.isIntegral() ? "int" : "double";
                case BOOLEAN: return "boolean";
                default:      return null;
            }
        }
        if (init instanceof TemplateExpr) {
            return "String";
        }
        if (init instanceof ArrayLiteral) {
            imports.add("java.util.List");
            return "List<Object>";
        }
        if (init instanceof ObjectLiteral) {
            imports.add("java.util.Map");
            return "Map<String, Object>";
        }
        if (init instanceof ArrowFunction) {
            return typeMapper.mapType(functionTypeOf((ArrowFunction) init), imports);
        }
        if (init instanceof NewExpr && ((NewExpr) init).getCallee() instanceof Identifier) {
            String name = ((Identifier) ((NewExpr) init).getCallee()).getName();
            switch (name) {
                case "Map":
                    imports.add("java.util.Map");
                    return "Map<Object, Object>";
                case "Set":
                    imports.add("java.util.Set");
                    return "Set<Object>";
                case "Array":
                    imports.add("java.util.List");
                    return "List<Object>";
                default:
                    String builtin = JavaExpressionRenderer.builtinClass(name);
                    return builtin != null ? builtin : name;
            }
        }
        return null;
    }

    /** 闭包的函数类型，用于选择函数式接口 */
    private static FunctionType functionTypeOf(ArrowFunction fn) {
        TypeNode value = Signature.resolveValueType(fn);
        if (value == null) {
            value = new KeywordType(SourceSpan.UNKNOWN, KeywordType.Keyword.ANY);
        }
        if (fn.isAsync()) {
            value = new TypeReference(SourceSpan.UNKNOWN, "Promise", Collections.singletonList(value));
        }
        return new FunctionType(SourceSpan.UNKNOWN, fn.getParameters(), value);
    }

    @Override
    public void writeTypeAlias(TypeAliasDecl node, GenerationContext ctx) {
        String text = ctx.getUnit().textOf(node.getType().getSpan()).trim();
        ctx.line(lineComment("type " + node.getName() + " = "
                + (text.isEmpty() ? ctx.mapType(node.getType()) : text)));
    }

    // ============ 语句 ============

    @Override
    public String expressionStatement(String expression) {
        return expression + ";";
    }

    @Override
    public String returnStatement(String value, GenerationContext ctx) {
        return value == null ? "return;" : "return " + value + ";";
    }

    @Override
    public String throwStatement(Expression value, GenerationContext ctx) {
        if (value instanceof NewExpr) {
            return "throw " + ctx.render(value) + ";";
        }
        return "throw new RuntimeException(" + ctx.render(value) + ");";
    }

    @Override
    public String breakStatement(String switchTag) {
        return "break;";
    }

    @Override
    public String continueStatement(String switchTag) {
        return "continue;";
    }

    @Override
    public void openIf(String condition, GenerationContext ctx) {
        ctx.line("if (" + condition + ") {");
        ctx.indent();
    }

    @Override
    public void openElseIf(String condition, GenerationContext ctx) {
        ctx.dedent();
        ctx.line("} else if (" + condition + ") {");
        ctx.indent();
    }

    @Override
    public void openElse(GenerationContext ctx) {
        ctx.dedent();
        ctx.line("} else {");
        ctx.indent();
    }

    @Override
    public void closeIf(GenerationContext ctx) {
        ctx.dedent();
        ctx.line("}");
    }

    @Override
    public void openWhile(String condition, GenerationContext ctx) {
        ctx.line("while (" + condition + ") {");
        ctx.indent();
    }

    @Override
    public void closeWhile(GenerationContext ctx) {
        ctx.dedent();
        ctx.line("}");
    }

    @Override
    public void openDoWhile(GenerationContext ctx) {
        ctx.line("do {");
        ctx.indent();
    }

    @Override
    public void closeDoWhile(String condition, GenerationContext ctx) {
        ctx.dedent();
        ctx.line("} while (" + condition + ");");
    }

    @Override
    public void openRangeLoop(String variable, String start, String bound, boolean captured,
                              GenerationContext ctx) {
        // lambda 只能捕获事实上的 final 变量，被捕获时每轮复制一份
        String counter = captured ? variable + "Index" : variable;
        ctx.line("for (int " + counter + " = " + start + "; " + counter + " < " + bound + "; " + counter + "++) {");
        ctx.indent();
        if (captured) {
            ctx.line("final int " + variable + " = " + counter + ";");
        }
    }

    @Override
    public void openForEach(List<String> variables, String iterable, GenerationContext ctx) {
        if (variables.size() == 2) {
            // for (const [k, v] of map.entries())
            ctx.line("for (var entry : " + iterable + ") {");
            ctx.indent();
            ctx.line("var " + variables.get(0) + " = entry.getKey();");
            ctx.line("var " + variables.get(1) + " = entry.getValue();");
            return;
        }
        ctx.line("for (var " + variables.get(0) + " : " + iterable + ") {");
        ctx.indent();
    }

    @Override
    public void closeLoop(GenerationContext ctx) {
        ctx.dedent();
        ctx.line("}");
    }

    @Override
    public void openScope(GenerationContext ctx) {
        ctx.line("{");
        ctx.indent();
    }

    @Override
    public void closeScope(GenerationContext ctx) {
        ctx.dedent();
        ctx.line("}");
    }

    @Override
    public boolean switchFallsThrough() {
        return true;
    }

    @Override
    public void openSwitch(String subject, String tag, boolean capturesContinue, GenerationContext ctx) {
        ctx.line("switch (" + subject + ") {");
        ctx.indent();
    }

    @Override
    public void openCase(List<String> labels, boolean includesDefault, GenerationContext ctx) {
        for (String label : labels) {
            ctx.line("case " + label + ":");
        }
        if (includesDefault) {
            ctx.line("default:");
        }
        ctx.indent();
    }

    @Override
    public void closeCase(GenerationContext ctx) {
        ctx.dedent();
    }

    @Override
    public void closeSwitch(String tag, boolean capturesContinue, GenerationContext ctx) {
        ctx.dedent();
        ctx.line("}");
    }

    @Override
    public void openTry(GenerationContext ctx) {
        ctx.line("try {");
        ctx.indent();
    }

    @Override
    public void openCatch(String variable, GenerationContext ctx) {
        ctx.dedent();
        ctx.line("} catch (Exception " + (variable == null ? "ignored" : variable) + ") {");
        ctx.indent();
    }

    @Override
    public void openFinally(GenerationContext ctx) {
        ctx.dedent();
        ctx.line("} finally {");
        ctx.indent();
    }

    @Override
    public void closeTry(GenerationContext ctx) {
        ctx.dedent();
        ctx.line("}");
    }
}
