package com.polyglot.codegen.json;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.CommentRange;
import com.polyglot.codegen.ast.CompilationUnit;
import com.polyglot.codegen.ast.Modifier;
import com.polyglot.codegen.ast.SourceSpan;
import com.polyglot.codegen.ast.decl.ClassDecl;
import com.polyglot.codegen.ast.decl.ClassMember;
import com.polyglot.codegen.ast.decl.ConstructorDecl;
import com.polyglot.codegen.ast.decl.EnumDecl;
import com.polyglot.codegen.ast.decl.FunctionDecl;
import com.polyglot.codegen.ast.decl.ImportDecl;
import com.polyglot.codegen.ast.decl.InterfaceDecl;
import com.polyglot.codegen.ast.decl.MethodDecl;
import com.polyglot.codegen.ast.decl.ModuleDecl;
import com.polyglot.codegen.ast.decl.Parameter;
import com.polyglot.codegen.ast.decl.PropertyDecl;
import com.polyglot.codegen.ast.decl.TypeAliasDecl;
import com.polyglot.codegen.ast.decl.TypeParameter;
import com.polyglot.codegen.ast.decl.UnsupportedMember;
import com.polyglot.codegen.ast.decl.VariableDecl;
import com.polyglot.codegen.ast.expr.ArrayLiteral;
import com.polyglot.codegen.ast.expr.ArrowFunction;
import com.polyglot.codegen.ast.expr.AsExpr;
import com.polyglot.codegen.ast.expr.AwaitExpr;
import com.polyglot.codegen.ast.expr.BinaryExpr;
import com.polyglot.codegen.ast.expr.CallExpr;
import com.polyglot.codegen.ast.expr.ConditionalExpr;
import com.polyglot.codegen.ast.expr.ElementAccessExpr;
import com.polyglot.codegen.ast.expr.Expression;
import com.polyglot.codegen.ast.expr.Identifier;
import com.polyglot.codegen.ast.expr.Literal;
import com.polyglot.codegen.ast.expr.NewExpr;
import com.polyglot.codegen.ast.expr.ObjectLiteral;
import com.polyglot.codegen.ast.expr.ParenthesizedExpr;
import com.polyglot.codegen.ast.expr.PropertyAccessExpr;
import com.polyglot.codegen.ast.expr.PropertyAssignment;
import com.polyglot.codegen.ast.expr.SuperExpr;
import com.polyglot.codegen.ast.expr.TemplateExpr;
import com.polyglot.codegen.ast.expr.ThisExpr;
import com.polyglot.codegen.ast.expr.UnaryExpr;
import com.polyglot.codegen.ast.expr.UnsupportedExpr;
import com.polyglot.codegen.ast.stmt.Block;
import com.polyglot.codegen.ast.stmt.BreakStmt;
import com.polyglot.codegen.ast.stmt.CatchClause;
import com.polyglot.codegen.ast.stmt.ContinueStmt;
import com.polyglot.codegen.ast.stmt.DoWhileStmt;
import com.polyglot.codegen.ast.stmt.ExpressionStmt;
import com.polyglot.codegen.ast.stmt.ForOfStmt;
import com.polyglot.codegen.ast.stmt.ForStmt;
import com.polyglot.codegen.ast.stmt.IfStmt;
import com.polyglot.codegen.ast.stmt.ReturnStmt;
import com.polyglot.codegen.ast.stmt.Statement;
import com.polyglot.codegen.ast.stmt.SwitchClause;
import com.polyglot.codegen.ast.stmt.SwitchStmt;
import com.polyglot.codegen.ast.stmt.ThrowStmt;
import com.polyglot.codegen.ast.stmt.TryStmt;
import com.polyglot.codegen.ast.stmt.UnsupportedStmt;
import com.polyglot.codegen.ast.stmt.WhileStmt;
import com.polyglot.codegen.ast.type.ArrayType;
import com.polyglot.codegen.ast.type.FunctionType;
import com.polyglot.codegen.ast.type.KeywordType;
import com.polyglot.codegen.ast.type.LiteralType;
import com.polyglot.codegen.ast.type.TupleType;
import com.polyglot.codegen.ast.type.TypeLiteral;
import com.polyglot.codegen.ast.type.TypeNode;
import com.polyglot.codegen.ast.type.TypeReference;
import com.polyglot.codegen.ast.type.UnionType;
import com.polyglot.codegen.ast.type.UnsupportedType;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * 读取 JSON 形式的 TypeScript AST。
 *
 * <p>每个节点是带 {@code "kind"}（TypeScript SyntaxKind 名称）的对象，属性名沿用 TypeScript 编译器 API。
 * 标识符类属性直接写成字符串，也接受 {@code {"kind":"Identifier","text":..}} 形式。
 * 未知种类在语句、成员、表达式、类型位置分别转为对应的 Unsupported 节点。</p>
 */
public class AstJsonReader {
    private static final Logger LOG = Logger.getLogger(AstJsonReader.class.getName());

    public CompilationUnit readFile(Path path) throws IOException {
        return read(new String(Files.readAllBytes(path), StandardCharsets.UTF_8));
    }

    public CompilationUnit read(Reader reader) {
        try {
            return readUnit(JsonParser.parseReader(reader));
        } catch (JsonParseException e) {
            throw new AstFormatException("JSON 解析失败: " + e.getMessage(), e);
        }
    }

    /**
     * @throws AstFormatException JSON 非法或结构不符
     */
    public CompilationUnit read(String json) {
        try {
            return readUnit(JsonParser.parseString(json));
        } catch (JsonParseException e) {
            throw new AstFormatException("JSON 解析失败: " + e.getMessage(), e);
        }
    }

    private CompilationUnit readUnit(JsonElement root) {
        if (root == null || !root.isJsonObject()) {
            throw new AstFormatException("根节点必须是 SourceFile 对象");
        }
        JsonObject obj = root.getAsJsonObject();
        String kind = kindOf(obj);
        if (!"SourceFile".equals(kind)) {
            throw new AstFormatException("根节点必须是 SourceFile，实际为 " + kind);
        }
        try {
            CompilationUnit unit = new CompilationUnit(optString(obj, "fileName"),
                    optString(obj, "text"), statements(obj.get("statements")));
            attachComments(unit, obj);
            return unit;
        } catch (IllegalStateException | ClassCastException | UnsupportedOperationException
                | NumberFormatException e) {
            // Gson 在属性类型不符时抛出这些异常
            throw new AstFormatException("节点属性类型不符: " + e.getMessage(), e);
        }
    }

    // ============ 语句 ============

    private List<Statement> statements(JsonElement element) {
        List<Statement> result = new ArrayList<>();
        for (JsonObject obj : objects(element)) {
            Statement statement = statement(obj);
            if (statement != null) {
                result.add(statement);
            }
        }
        return result;
    }

    /** EmptyStatement 返回 null */
    private Statement statement(JsonObject obj) {
        if (obj == null) {
            return null;
        }
        Statement statement = readStatement(obj, kindOf(obj));
        if (statement != null) {
            attachComments(statement, obj);
        }
        return statement;
    }

    private Statement readStatement(JsonObject obj, String kind) {
        SourceSpan span = span(obj);
        switch (kind) {
            case "VariableStatement":
                return variableDecl(obj.getAsJsonObject("declarationList"), modifiers(obj), span);
            case "VariableDeclarationList":
                return variableDecl(obj, Collections.<Modifier>emptyList(), span);
            case "FunctionDeclaration":
                return new FunctionDecl(span, modifiers(obj), requireName(obj), typeParameters(obj),
                        parameters(obj), type(obj.get("type")), optBlock(obj, "body"));
            case "ClassDeclaration":
                return classDecl(obj, span);
            case "InterfaceDeclaration":
                return new InterfaceDecl(span, modifiers(obj), requireName(obj), typeParameters(obj),
                        heritage(obj, "extends"), members(obj.get("members")));
            case "EnumDeclaration":
                return enumDecl(obj, span);
            case "TypeAliasDeclaration":
                return new TypeAliasDecl(span, modifiers(obj), requireName(obj), typeParameters(obj),
                        type(obj.get("type")));
            case "ModuleDeclaration":
                return moduleDecl(obj, span);
            case "ImportDeclaration":
                return importDecl(obj, span);
            case "Block":
                return block(obj);
            case "EmptyStatement":
                return null;
            case "ExpressionStatement":
                return new ExpressionStmt(span, expression(obj.get("expression")));
            case "IfStatement":
                return new IfStmt(span, expression(obj.get("expression")),
                        statement(optObject(obj, "thenStatement")), statement(optObject(obj, "elseStatement")));
            case "ForStatement":
                return new ForStmt(span, forInitializer(optObject(obj, "initializer")),
                        optExpression(obj, "condition"), optExpression(obj, "incrementor"),
                        statement(optObject(obj, "statement")));
            case "ForOfStatement":
                return forOf(obj, span);
            case "WhileStatement":
                return new WhileStmt(span, expression(obj.get("expression")), statement(optObject(obj, "statement")));
            case "DoStatement":
                return new DoWhileStmt(span, statement(optObject(obj, "statement")), expression(obj.get("expression")));
            case "SwitchStatement":
                return switchStmt(obj, span);
            case "TryStatement":
                return tryStmt(obj, span);
            case "ThrowStatement":
                return new ThrowStmt(span, expression(obj.get("expression")));
            case "ReturnStatement":
                return new ReturnStmt(span, optExpression(obj, "expression"));
            case "BreakStatement":
                return new BreakStmt(span, optName(obj, "label"));
            case "ContinueStatement":
                return new ContinueStmt(span, optName(obj, "label"));
            default:
                LOG.fine("未支持的语句种类: " + kind);
                return new UnsupportedStmt(span, kind);
        }
    }

    private Statement variableDecl(JsonObject list, List<Modifier> modifiers, SourceSpan span) {
        if (list == null) {
            throw new AstFormatException("VariableStatement 缺少 declarationList");
        }
        VariableDecl.VariableKind variableKind = variableKind(optString(list, "flags"));
        List<VariableDecl.Declarator> declarators = new ArrayList<>();
        for (JsonObject d : objects(list.get("declarations"))) {
            JsonElement name = d.get("name");
            if (name != null && name.isJsonObject() && !"Identifier".equals(kindOf(name.getAsJsonObject()))) {
                // 解构声明
                return new UnsupportedStmt(span, kindOf(name.getAsJsonObject()));
            }
            declarators.add(new VariableDecl.Declarator(span(d), requireName(d), type(d.get("type")),
                    optExpression(d, "initializer")));
        }
        return new VariableDecl(span, modifiers, variableKind, declarators);
    }

    private static VariableDecl.VariableKind variableKind(String flags) {
        if (flags == null) {
            return VariableDecl.VariableKind.VAR;
        }
        String lower = flags.toLowerCase();
        if (lower.contains("const")) {
            return VariableDecl.VariableKind.CONST;
        }
        return lower.contains("let") ? VariableDecl.VariableKind.LET : VariableDecl.VariableKind.VAR;
    }

    private Statement forInitializer(JsonObject obj) {
        if (obj == null) {
            return null;
        }
        if ("VariableDeclarationList".equals(kindOf(obj))) {
            return variableDecl(obj, Collections.<Modifier>emptyList(), span(obj));
        }
        return new ExpressionStmt(span(obj), expression(obj));
    }

    private Statement forOf(JsonObject obj, SourceSpan span) {
        JsonObject init = optObject(obj, "initializer");
        List<String> names = new ArrayList<>();
        if (init != null && "VariableDeclarationList".equals(kindOf(init))) {
            List<JsonObject> declarations = objects(init.get("declarations"));
            if (declarations.size() != 1) {
                return new UnsupportedStmt(span, "ForOfStatement");
            }
            JsonElement name = declarations.get(0).get("name");
            if (name != null && name.isJsonObject() && "ArrayBindingPattern".equals(kindOf(name.getAsJsonObject()))) {
                for (JsonObject element : objects(name.getAsJsonObject().get("elements"))) {
                    names.add(requireName(element));
                }
            } else {
                names.add(requireName(declarations.get(0)));
            }
        } else if (init != null && "Identifier".equals(kindOf(init))) {
            names.add(identifierText(init));
        }
        if (names.isEmpty()) {
            return new UnsupportedStmt(span, "ForOfStatement");
        }
        return new ForOfStmt(span, names, expression(obj.get("expression")), statement(optObject(obj, "statement")));
    }

    private Statement switchStmt(JsonObject obj, SourceSpan span) {
        JsonElement clausesElement = obj.get("clauses");
        JsonObject caseBlock = optObject(obj, "caseBlock");
        if (clausesElement == null && caseBlock != null) {
            clausesElement = caseBlock.get("clauses");
        }
        List<SwitchClause> clauses = new ArrayList<>();
        for (JsonObject clause : objects(clausesElement)) {
            Expression label = "DefaultClause".equals(kindOf(clause)) ? null : expression(clause.get("expression"));
            SwitchClause sc = new SwitchClause(span(clause), label, statements(clause.get("statements")));
            attachComments(sc, clause);
            clauses.add(sc);
        }
        return new SwitchStmt(span, expression(obj.get("expression")), clauses);
    }

    private Statement tryStmt(JsonObject obj, SourceSpan span) {
        CatchClause catchClause = null;
        JsonObject c = optObject(obj, "catchClause");
        if (c != null) {
            JsonObject variable = optObject(c, "variableDeclaration");
            catchClause = new CatchClause(span(c), variable != null ? optName(variable, "name") : null,
                    optBlock(c, "block"));
        }
        return new TryStmt(span, optBlock(obj, "tryBlock"), catchClause, optBlock(obj, "finallyBlock"));
    }

    private Block block(JsonObject obj) {
        return new Block(span(obj), statements(obj.get("statements")));
    }

    private Block optBlock(JsonObject parent, String property) {
        JsonObject obj = optObject(parent, property);
        if (obj == null) {
            return null;
        }
        Block block = block(obj);
        attachComments(block, obj);
        return block;
    }

    // ============ 声明 ============

    private Statement classDecl(JsonObject obj, SourceSpan span) {
        List<TypeNode> extended = heritage(obj, "extends");
        return new ClassDecl(span, modifiers(obj), requireName(obj), typeParameters(obj),
                extended.isEmpty() ? null : extended.get(0), heritage(obj, "implements"),
                members(obj.get("members")));
    }

    /** heritageClauses 中指定 token（extends / implements）的类型 */
    private List<TypeNode> heritage(JsonObject obj, String token) {
        List<TypeNode> result = new ArrayList<>();
        for (JsonObject clause : objects(obj.get("heritageClauses"))) {
            String clauseToken = optString(clause, "token");
            if (clauseToken != null && clauseToken.toLowerCase().startsWith(token)) {
                for (JsonObject t : objects(clause.get("types"))) {
                    result.add(type(t));
                }
            }
        }
        return result;
    }

    private List<ClassMember> members(JsonElement element) {
        List<ClassMember> result = new ArrayList<>();
        for (JsonObject obj : objects(element)) {
            ClassMember member = member(obj);
            attachComments(member, obj);
            result.add(member);
        }
        return result;
    }

    private ClassMember member(JsonObject obj) {
        SourceSpan span = span(obj);
        String kind = kindOf(obj);
        switch (kind) {
            case "PropertyDeclaration":
            case "PropertySignature":
                return new PropertyDecl(span, modifiers(obj), requireName(obj), type(obj.get("type")),
                        optExpression(obj, "initializer"), flag(obj, "questionToken"));
            case "MethodDeclaration":
            case "MethodSignature":
                return method(obj, span, MethodDecl.AccessorKind.NONE);
            case "GetAccessor":
                return method(obj, span, MethodDecl.AccessorKind.GETTER);
            case "SetAccessor":
                return method(obj, span, MethodDecl.AccessorKind.SETTER);
            case "Constructor":
                return new ConstructorDecl(span, modifiers(obj), parameters(obj), optBlock(obj, "body"));
            default:
                LOG.fine("未支持的成员种类: " + kind);
                return new UnsupportedMember(span, kind);
        }
    }

    private MethodDecl method(JsonObject obj, SourceSpan span, MethodDecl.AccessorKind accessorKind) {
        return new MethodDecl(span, modifiers(obj), requireName(obj), typeParameters(obj), parameters(obj),
                type(obj.get("type")), optBlock(obj, "body"), accessorKind);
    }

    private Statement enumDecl(JsonObject obj, SourceSpan span) {
        List<EnumDecl.EnumMember> members = new ArrayList<>();
        for (JsonObject m : objects(obj.get("members"))) {
            EnumDecl.EnumMember member = new EnumDecl.EnumMember(span(m), requireName(m),
                    optExpression(m, "initializer"));
            attachComments(member, m);
            members.add(member);
        }
        return new EnumDecl(span, modifiers(obj), requireName(obj), members);
    }

    private Statement moduleDecl(JsonObject obj, SourceSpan span) {
        JsonObject body = optObject(obj, "body");
        List<Statement> statements = body != null ? statements(body.get("statements"))
                : Collections.<Statement>emptyList();
        return new ModuleDecl(span, modifiers(obj), requireName(obj), statements);
    }

    private Statement importDecl(JsonObject obj, SourceSpan span) {
        JsonElement specifier = obj.get("moduleSpecifier");
        String module = specifier == null ? null
                : specifier.isJsonPrimitive() ? specifier.getAsString() : optString(specifier.getAsJsonObject(), "text");
        if (module == null) {
            throw new AstFormatException("ImportDeclaration 缺少 moduleSpecifier");
        }
        String defaultBinding = null;
        String namespaceBinding = null;
        List<String> named = new ArrayList<>();
        JsonObject clause = optObject(obj, "importClause");
        if (clause != null) {
            defaultBinding = optName(clause, "name");
            JsonObject bindings = optObject(clause, "namedBindings");
            if (bindings != null && "NamespaceImport".equals(kindOf(bindings))) {
                namespaceBinding = optName(bindings, "name");
            } else if (bindings != null) {
                for (JsonObject element : objects(bindings.get("elements"))) {
                    named.add(requireName(element));
                }
            }
        }
        return new ImportDecl(span, module, defaultBinding, namespaceBinding, named);
    }

    private List<Parameter> parameters(JsonObject obj) {
        List<Parameter> result = new ArrayList<>();
        for (JsonObject p : objects(obj.get("parameters"))) {
            result.add(new Parameter(span(p), modifiers(p), requireName(p), type(p.get("type")),
                    optExpression(p, "initializer"), flag(p, "questionToken"), flag(p, "dotDotDotToken")));
        }
        return result;
    }

    private List<TypeParameter> typeParameters(JsonObject obj) {
        List<TypeParameter> result = new ArrayList<>();
        for (JsonObject p : objects(obj.get("typeParameters"))) {
            result.add(new TypeParameter(span(p), requireName(p), type(p.get("constraint"))));
        }
        return result;
    }

    // ============ 表达式 ============

    private Expression optExpression(JsonObject parent, String property) {
        JsonElement element = parent.get(property);
        return element == null || element.isJsonNull() ? null : expression(element);
    }

    private List<Expression> expressions(JsonElement element) {
        List<Expression> result = new ArrayList<>();
        for (JsonObject obj : objects(element)) {
            result.add(expression(obj));
        }
        return result;
    }

    private Expression expression(JsonElement element) {
        if (element == null || element.isJsonNull()) {
            throw new AstFormatException("缺少表达式");
        }
        if (element.isJsonPrimitive()) {
            // 标识符可直接写成字符串
            return new Identifier(SourceSpan.UNKNOWN, element.getAsString());
        }
        JsonObject obj = element.getAsJsonObject();
        Expression expression = readExpression(obj, kindOf(obj), span(obj));
        attachComments(expression, obj);
        return expression;
    }

    private Expression readExpression(JsonObject obj, String kind, SourceSpan span) {
        switch (kind) {
            case "Identifier":
                return new Identifier(span, identifierText(obj));
            case "StringLiteral":
            case "NoSubstitutionTemplateLiteral":
                return new Literal(span, Literal.LiteralKind.STRING, requireString(obj, "text"));
            case "NumericLiteral":
                return new Literal(span, Literal.LiteralKind.NUMBER, requireString(obj, "text"));
            case "TrueKeyword":
                return new Literal(span, Literal.LiteralKind.BOOLEAN, "true");
            case "FalseKeyword":
                return new Literal(span, Literal.LiteralKind.BOOLEAN, "false");
            case "NullKeyword":
                return new Literal(span, Literal.LiteralKind.NULL, "null");
            case "UndefinedKeyword":
                return new Literal(span, Literal.LiteralKind.UNDEFINED, "undefined");
            case "ThisKeyword":
                return new ThisExpr(span);
            case "SuperKeyword":
                return new SuperExpr(span);
            case "ArrayLiteralExpression":
                return new ArrayLiteral(span, expressions(obj.get("elements")));
            case "ObjectLiteralExpression":
                return objectLiteral(obj, span);
            case "PropertyAccessExpression":
                return new PropertyAccessExpr(span, expression(obj.get("expression")), requireName(obj),
                        flag(obj, "questionDotToken"));
            case "ElementAccessExpression":
                return new ElementAccessExpr(span, expression(obj.get("expression")),
                        expression(obj.get("argumentExpression")));
            case "CallExpression":
                return new CallExpr(span, expression(obj.get("expression")), expressions(obj.get("arguments")));
            case "NewExpression":
                return new NewExpr(span, expression(obj.get("expression")), expressions(obj.get("arguments")));
            case "ParenthesizedExpression":
                return new ParenthesizedExpr(span, expression(obj.get("expression")));
            case "BinaryExpression":
                return binary(obj, span);
            case "PrefixUnaryExpression":
            case "PostfixUnaryExpression":
                return unary(obj, span, "PrefixUnaryExpression".equals(kind));
            case "ConditionalExpression":
                return new ConditionalExpr(span, expression(obj.get("condition")),
                        expression(obj.get("whenTrue")), expression(obj.get("whenFalse")));
            case "ArrowFunction":
            case "FunctionExpression":
                return arrow(obj, span, "FunctionExpression".equals(kind));
            case "AwaitExpression":
                return new AwaitExpr(span, expression(obj.get("expression")));
            case "TemplateExpression":
                return template(obj, span);
            case "AsExpression":
            case "TypeAssertionExpression":
                return new AsExpr(span, expression(obj.get("expression")), type(obj.get("type")));
            case "NonNullExpression":
                return expression(obj.get("expression"));
            default:
                LOG.fine("未支持的表达式种类: " + kind);
                return new UnsupportedExpr(span, kind);
        }
    }

    private Expression objectLiteral(JsonObject obj, SourceSpan span) {
        List<PropertyAssignment> properties = new ArrayList<>();
        for (JsonObject p : objects(obj.get("properties"))) {
            String kind = kindOf(p);
            if ("PropertyAssignment".equals(kind)) {
                properties.add(new PropertyAssignment(span(p), requireName(p), expression(p.get("initializer")), false));
            } else if ("ShorthandPropertyAssignment".equals(kind)) {
                String name = requireName(p);
                properties.add(new PropertyAssignment(span(p), name, new Identifier(span(p), name), true));
            } else {
                // 展开、方法简写等无法逐项映射
                return new UnsupportedExpr(span, kind);
            }
        }
        return new ObjectLiteral(span, properties);
    }

    private Expression binary(JsonObject obj, SourceSpan span) {
        String token = tokenText(obj.get("operatorToken"));
        BinaryExpr.BinaryOp op = token != null ? BinaryExpr.BinaryOp.fromToken(token) : null;
        if (op == null) {
            return new UnsupportedExpr(span, "BinaryExpression");
        }
        return new BinaryExpr(span, expression(obj.get("left")), op, expression(obj.get("right")));
    }

    private Expression unary(JsonObject obj, SourceSpan span, boolean prefix) {
        String token = tokenText(obj.get("operator"));
        UnaryExpr.UnaryOp op = token != null ? UnaryExpr.UnaryOp.fromToken(token) : null;
        if (op == null) {
            return new UnsupportedExpr(span, prefix ? "PrefixUnaryExpression" : "PostfixUnaryExpression");
        }
        return new UnaryExpr(span, op, expression(obj.get("operand")), prefix);
    }

    private Expression arrow(JsonObject obj, SourceSpan span, boolean functionExpression) {
        JsonObject body = optObject(obj, "body");
        if (body == null) {
            throw new AstFormatException(kindOf(obj) + " 缺少 body");
        }
        Block blockBody = null;
        Expression expressionBody = null;
        if ("Block".equals(kindOf(body))) {
            blockBody = block(body);
            attachComments(blockBody, body);
        } else {
            expressionBody = expression(body);
        }
        boolean async = modifiers(obj).contains(Modifier.ASYNC);
        return new ArrowFunction(span, parameters(obj), type(obj.get("type")), blockBody, expressionBody,
                async, functionExpression);
    }

    private Expression template(JsonObject obj, SourceSpan span) {
        List<TemplateExpr.TemplateSpan> spans = new ArrayList<>();
        for (JsonObject s : objects(obj.get("templateSpans"))) {
            spans.add(new TemplateExpr.TemplateSpan(span(s), expression(s.get("expression")),
                    textOf(s.get("literal"))));
        }
        return new TemplateExpr(span, textOf(obj.get("head")), spans);
    }

    // ============ 类型 ============

    private List<TypeNode> types(JsonElement element) {
        List<TypeNode> result = new ArrayList<>();
        for (JsonObject obj : objects(element)) {
            result.add(type(obj));
        }
        return result;
    }

    /** 缺失时返回 null（未注解） */
    private TypeNode type(JsonElement element) {
        if (element == null || element.isJsonNull()) {
            return null;
        }
        if (element.isJsonPrimitive()) {
            return new TypeReference(SourceSpan.UNKNOWN, element.getAsString(), Collections.<TypeNode>emptyList());
        }
        JsonObject obj = element.getAsJsonObject();
        String kind = kindOf(obj);
        SourceSpan span = span(obj);
        KeywordType.Keyword keyword = KeywordType.Keyword.fromSyntaxKind(kind);
        if (keyword != null) {
            return new KeywordType(span, keyword);
        }
        switch (kind) {
            case "TypeReference":
                return new TypeReference(span, entityName(obj.get("typeName")), types(obj.get("typeArguments")));
            case "ExpressionWithTypeArguments":
                return new TypeReference(span, entityName(obj.get("expression")), types(obj.get("typeArguments")));
            case "ArrayType":
                return new ArrayType(span, type(obj.get("elementType")));
            case "TupleType":
                return new TupleType(span, types(obj.has("elements") ? obj.get("elements") : obj.get("elementTypes")));
            case "UnionType":
                return new UnionType(span, types(obj.get("types")));
            case "FunctionType":
                return new FunctionType(span, parameters(obj), type(obj.get("type")));
            case "TypeLiteral":
                return new TypeLiteral(span, members(obj.get("members")));
            case "LiteralType":
                Expression literal = expression(obj.get("literal"));
                if (literal instanceof Literal) {
                    return new LiteralType(span, (Literal) literal);
                }
                return new UnsupportedType(span, kind);
            case "ParenthesizedType":
                return type(obj.get("type"));
            default:
                LOG.fine("未支持的类型种类: " + kind);
                return new UnsupportedType(span, kind);
        }
    }

    /** Identifier、字符串或 QualifiedName（A.B） */
    private String entityName(JsonElement element) {
        if (element == null || element.isJsonNull()) {
            throw new AstFormatException("缺少类型名");
        }
        if (element.isJsonPrimitive()) {
            return element.getAsString();
        }
        JsonObject obj = element.getAsJsonObject();
        String kind = kindOf(obj);
        if ("QualifiedName".equals(kind)) {
            return entityName(obj.get("left")) + "." + entityName(obj.get("right"));
        }
        if ("PropertyAccessExpression".equals(kind)) {
            return entityName(obj.get("expression")) + "." + requireName(obj);
        }
        return identifierText(obj);
    }

    // ============ 公共属性 ============

    private static String kindOf(JsonObject obj) {
        JsonElement kind = obj.get("kind");
        if (kind == null || !kind.isJsonPrimitive()) {
            throw new AstFormatException("节点缺少 kind 属性: " + abbreviate(obj));
        }
        return kind.getAsString();
    }

    private static SourceSpan span(JsonObject obj) {
        if (obj.has("pos") && obj.has("end")) {
            return new SourceSpan(obj.get("pos").getAsInt(), obj.get("end").getAsInt());
        }
        return SourceSpan.UNKNOWN;
    }

    private static List<Modifier> modifiers(JsonObject obj) {
        List<Modifier> result = new ArrayList<>();
        for (JsonElement element : array(obj.get("modifiers"))) {
            String keyword = element.isJsonPrimitive() ? element.getAsString()
                    : keywordOf(kindOf(element.getAsJsonObject()));
            Modifier modifier = Modifier.fromKeyword(keyword);
            if (modifier != null) {
                result.add(modifier);
            }
        }
        return result;
    }

    /** "ExportKeyword" → "export" */
    private static String keywordOf(String kind) {
        String word = kind.endsWith("Keyword") ? kind.substring(0, kind.length() - "Keyword".length()) : kind;
        return word.toLowerCase();
    }

    private static void attachComments(AstNode node, JsonObject obj) {
        JsonElement comments = obj.get("comments");
        if (comments == null || comments.isJsonNull()) {
            return;
        }
        List<CommentRange> ranges = new ArrayList<>();
        for (JsonElement element : comments.getAsJsonArray()) {
            JsonObject c = element.getAsJsonObject();
            ranges.add(new CommentRange(c.get("pos").getAsInt(), c.get("end").getAsInt(),
                    "MultiLineCommentTrivia".equals(optString(c, "kind"))));
        }
        node.setLeadingComments(ranges);
    }

    private static String requireName(JsonObject obj) {
        String name = optName(obj, "name");
        if (name == null) {
            throw new AstFormatException(kindOf(obj) + " 缺少 name 属性");
        }
        return name;
    }

    /** 名称属性：字符串，或带 text 的 Identifier / StringLiteral 对象 */
    private static String optName(JsonObject obj, String property) {
        JsonElement element = obj.get(property);
        if (element == null || element.isJsonNull()) {
            return null;
        }
        if (element.isJsonPrimitive()) {
            return element.getAsString();
        }
        return identifierText(element.getAsJsonObject());
    }

    private static String identifierText(JsonObject obj) {
        String text = optString(obj, "text");
        if (text == null) {
            text = optString(obj, "escapedText");
        }
        if (text == null) {
            throw new AstFormatException(kindOf(obj) + " 缺少 text 属性");
        }
        return text;
    }

    /** 模板片段：字符串或带 text 的 TemplateHead / TemplateMiddle / TemplateTail */
    private static String textOf(JsonElement element) {
        if (element == null || element.isJsonNull()) {
            return "";
        }
        if (element.isJsonPrimitive()) {
            return element.getAsString();
        }
        String text = optString(element.getAsJsonObject(), "text");
        return text != null ? text : "";
    }

    /** 运算符：源码写法字符串，或带 text 的 token 对象 */
    private static String tokenText(JsonElement element) {
        if (element == null || element.isJsonNull()) {
            return null;
        }
        if (element.isJsonPrimitive()) {
            return element.getAsString();
        }
        return optString(element.getAsJsonObject(), "text");
    }

    private static boolean flag(JsonObject obj, String property) {
        JsonElement element = obj.get(property);
        if (element == null || element.isJsonNull()) {
            return false;
        }
        // questionToken 等既可写成 true，也可以是 token 节点
        return !element.isJsonPrimitive() || element.getAsBoolean();
    }

    private static String optString(JsonObject obj, String property) {
        JsonElement element = obj.get(property);
        return element == null || element.isJsonNull() ? null : element.getAsString();
    }

    private static String requireString(JsonObject obj, String property) {
        String value = optString(obj, property);
        if (value == null) {
            throw new AstFormatException(kindOf(obj) + " 缺少 " + property + " 属性");
        }
        return value;
    }

    private static JsonObject optObject(JsonObject parent, String property) {
        JsonElement element = parent.get(property);
        return element == null || element.isJsonNull() ? null : element.getAsJsonObject();
    }

    private static JsonArray array(JsonElement element) {
        return element == null || element.isJsonNull() ? new JsonArray() : element.getAsJsonArray();
    }

    private static List<JsonObject> objects(JsonElement element) {
        List<JsonObject> result = new ArrayList<>();
        for (JsonElement e : array(element)) {
            result.add(e.getAsJsonObject());
        }
        return result;
    }

    private static String abbreviate(JsonObject obj) {
        String text = obj.toString();
        return text.length() > 80 ? text.substring(0, 80) + "..." : text;
    }
}
