package com.polyglot.codegen.generator.java;

import com.polyglot.codegen.ast.decl.Parameter;
import com.polyglot.codegen.ast.expr.ArrayLiteral;
import com.polyglot.codegen.ast.expr.ArrowFunction;
import com.polyglot.codegen.ast.expr.AsExpr;
import com.polyglot.codegen.ast.expr.BinaryExpr;
import com.polyglot.codegen.ast.expr.ConditionalExpr;
import com.polyglot.codegen.ast.expr.ElementAccessExpr;
import com.polyglot.codegen.ast.expr.Expression;
import com.polyglot.codegen.ast.expr.Identifier;
import com.polyglot.codegen.ast.expr.Literal;
import com.polyglot.codegen.ast.expr.ObjectLiteral;
import com.polyglot.codegen.ast.expr.PropertyAccessExpr;
import com.polyglot.codegen.ast.expr.PropertyAssignment;
import com.polyglot.codegen.ast.expr.SuperExpr;
import com.polyglot.codegen.ast.expr.TemplateExpr;
import com.polyglot.codegen.ast.expr.ThisExpr;
import com.polyglot.codegen.ast.expr.UnaryExpr;
import com.polyglot.codegen.ast.stmt.Statement;
import com.polyglot.codegen.ast.type.ArrayType;
import com.polyglot.codegen.ast.type.TypeNode;
import com.polyglot.codegen.generator.CallableShape;
import com.polyglot.codegen.generator.ExpressionRenderer;
import com.polyglot.codegen.generator.GenerationContext;
import com.polyglot.codegen.generator.Signature;
import com.polyglot.codegen.generator.SourceStrings;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Java 表达式渲染。
 *
 * <p>数组映射为 {@code List}，对象字面量映射为 {@code Map}，下标访问改写为 get / set / put。</p>
 */
public class JavaExpressionRenderer extends ExpressionRenderer {

    /** {@code Map.of} 最多接受十对键值 */
    static final int MAP_OF_LIMIT = 10;

    private static final Set<String> RESERVED = new HashSet<>(Arrays.asList(
            "abstract", "assert", "boolean", "byte", "char", "class", "const", "double", "final", "float",
            "goto", "int", "long", "native", "package", "short", "strictfp", "synchronized", "throws",
            "transient", "volatile", "default", "enum", "interface", "implements", "extends", "record"));

    private static final Map<String, String> METHOD_NAMES = new HashMap<>();

    /** 改写为 stream 管道的集合方法 */
    static final Set<String> STREAM_METHODS = new HashSet<>(Arrays.asList(
            "map", "filter", "some", "every", "find"));

    static {
        METHOD_NAMES.put("push", "add");
        METHOD_NAMES.put("includes", "contains");
        METHOD_NAMES.put("has", "contains");
        METHOD_NAMES.put("delete", "remove");
        METHOD_NAMES.put("set", "put");
    }

    private final JavaTypeMapper typeMapper;

    public JavaExpressionRenderer(JavaTypeMapper typeMapper) {
        this.typeMapper = typeMapper;
    }

    // ============ 命名 ============

    @Override
    public String localName(String name) {
        return RESERVED.contains(name) ? name + "_" : name;
    }

    @Override
    public String memberName(String name) {
        return name;
    }

    @Override
    public String renderParameters(List<Parameter> parameters, GenerationContext ctx) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < parameters.size(); i++) {
            Parameter p = parameters.get(i);
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(parameterType(p, ctx)).append(' ').append(localName(p.getName()));
        }
        return sb.toString();
    }

    private String parameterType(Parameter p, GenerationContext ctx) {
        TypeNode type = p.getType();
        if (p.isRest()) {
            TypeNode element = type instanceof ArrayType ? ((ArrayType) type).getElementType() : null;
            return typeMapper.mapType(element, ctx.getImports()) + "...";
        }
        String mapped = typeMapper.mapType(type, ctx.getImports());
        // 可选参数可能为 null
        return p.isOptional() ? JavaTypeMapper.box(mapped) : mapped;
    }

    // ============ 字面量 ============

    @Override
    protected String stringLiteral(String value) {
        return SourceStrings.javaQuoted(value);
    }

    @Override
    protected String numberLiteral(String text) {
        return text;
    }

    @Override
    protected String nullLiteral() {
        return "null";
    }

    @Override
    protected String typeName(String name) {
        switch (name) {
            case "Error":   return "RuntimeException";
            case "Array":   return "List";
            case "Object":  return "Object";
            default:        return name;
        }
    }

    @Override
    public String visitThisExpr(ThisExpr node, GenerationContext ctx) {
        return "this";
    }

    @Override
    public String visitSuperExpr(SuperExpr node, GenerationContext ctx) {
        return "super";
    }

    @Override
    public String visitArrayLiteral(ArrayLiteral node, GenerationContext ctx) {
        if (node.getElements().isEmpty()) {
            return "new ArrayList<>()";
        }
        return "List.of(" + joinArguments(node.getElements(), ctx) + ")";
    }

    /**
     * 对象字面量按源码顺序写出键值；超过十对改用 {@code Map.ofEntries}
     */
    @Override
    public String visitObjectLiteral(ObjectLiteral node, GenerationContext ctx) {
        List<String[]> entries = new ArrayList<>();
        for (PropertyAssignment p : node.getProperties()) {
            if (p.getKey() == null) {
                // 展开等成员：只留占位注释
                render(p.getValue(), ctx);
                continue;
            }
            String value = p.isShorthand() ? localName(p.getKey()) : render(p.getValue(), ctx);
            entries.add(new String[]{stringLiteral(p.getKey()), value});
        }
        if (entries.isEmpty()) {
            return "new HashMap<>()";
        }
        StringBuilder sb = new StringBuilder();
        if (entries.size() <= MAP_OF_LIMIT) {
            sb.append("Map.of(");
            for (int i = 0; i < entries.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(entries.get(i)[0]).append(", ").append(entries.get(i)[1]);
            }
        } else {
            sb.append("Map.ofEntries(");
            for (int i = 0; i < entries.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append("Map.entry(").append(entries.get(i)[0]).append(", ").append(entries.get(i)[1]).append(')');
            }
        }
        return sb.append(')').toString();
    }

    @Override
    public String visitTemplateExpr(TemplateExpr node, GenerationContext ctx) {
        List<String> parts = new ArrayList<>();
        if (!node.getHead().isEmpty()) {
            parts.add(stringLiteral(node.getHead()));
        }
        for (TemplateExpr.TemplateSpan span : node.getSpans()) {
            String value = render(span.getExpression(), ctx);
            boolean compound = span.getExpression() instanceof BinaryExpr
                    || span.getExpression() instanceof ConditionalExpr;
            parts.add(compound ? "(" + value + ")" : value);
            if (!span.getLiteral().isEmpty()) {
                parts.add(stringLiteral(span.getLiteral()));
            }
        }
        if (parts.isEmpty()) {
            return "\"\"";
        }
        // 首项不是字符串时从空串开始拼接，保证按字符串相加
        if (node.getHead().isEmpty() && !(parts.size() > 1 && parts.get(1).startsWith("\""))) {
            parts.add(0, "\"\"");
        }
        return String.join(" + ", parts);
    }

    @Override
    public String visitAsExpr(AsExpr node, GenerationContext ctx) {
        return "((" + typeMapper.mapType(node.getType(), ctx.getImports()) + ") "
                + render(node.getExpression(), ctx) + ")";
    }

    // ============ 成员访问 ============

    @Override
    public String visitPropertyAccessExpr(PropertyAccessExpr node, GenerationContext ctx) {
        Expression target = node.getTarget();
        String member = "length".equals(node.getName()) || "size".equals(node.getName())
                ? "size()" : memberName(node.getName());
        if (node.isOptional()) {
            String receiver = render(target, ctx);
            return "(" + receiver + " == null ? null : " + receiver + "." + member + ")";
        }
        if ("length".equals(node.getName()) && target instanceof Literal) {
            return asReceiver(target, ctx) + ".length()";
        }
        return asReceiver(target, ctx) + "." + member;
    }

    @Override
    public String visitElementAccessExpr(ElementAccessExpr node, GenerationContext ctx) {
        return asReceiver(node.getTarget(), ctx) + ".get(" + render(node.getIndex(), ctx) + ")";
    }

    // ============ 调用 ============

    @Override
    protected String consoleCall(String method, List<Expression> args, GenerationContext ctx) {
        String stream;
        switch (method) {
            case "log":
            case "info":
            case "debug":
                stream = "System.out";
                break;
            case "error":
            case "warn":
                stream = "System.err";
                break;
            default:
                return null;
        }
        if (args.isEmpty()) {
            return stream + ".println()";
        }
        List<String> parts = new ArrayList<>();
        for (Expression arg : args) {
            parts.add(render(arg, ctx));
        }
        return stream + ".println(" + String.join(" + \" \" + ", parts) + ")";
    }

    @Override
    protected String methodCall(PropertyAccessExpr callee, List<Expression> args, GenerationContext ctx) {
        String method = callee.getName();
        Expression target = callee.getTarget();

        if (target instanceof Identifier) {
            String builtin = staticBuiltinCall(((Identifier) target).getName(), method, args, ctx);
            if (builtin != null) {
                return builtin;
            }
        }

        String receiver = target instanceof ThisExpr ? "" : asReceiver(target, ctx);
        String call;
        if (STREAM_METHODS.contains(method) && args.size() == 1 && args.get(0) instanceof ArrowFunction
                && !receiver.isEmpty()) {
            call = streamCall(receiver, method, render(args.get(0), ctx));
        } else if ("join".equals(method) && args.size() <= 1 && !receiver.isEmpty()) {
            return "String.join(" + (args.isEmpty() ? "\",\"" : render(args.get(0), ctx)) + ", " + receiver + ")";
        } else {
            String name = METHOD_NAMES.containsKey(method) ? METHOD_NAMES.get(method) : memberName(method);
            call = (receiver.isEmpty() ? "" : receiver + ".") + name + "(" + joinArguments(args, ctx) + ")";
        }
        if (callee.isOptional() && !receiver.isEmpty()) {
            return "(" + receiver + " == null ? null : " + call + ")";
        }
        return call;
    }

    private static String streamCall(String receiver, String method, String fn) {
        switch (method) {
            case "map":
                return receiver + ".stream().map(" + fn + ").collect(Collectors.toList())";
            case "filter":
                return receiver + ".stream().filter(" + fn + ").collect(Collectors.toList())";
            case "some":
                return receiver + ".stream().anyMatch(" + fn + ")";
            case "every":
                return receiver + ".stream().allMatch(" + fn + ")";
            default:
                return receiver + ".stream().filter(" + fn + ").findFirst().orElse(null)";
        }
    }

    private String staticBuiltinCall(String owner, String method, List<Expression> args, GenerationContext ctx) {
        if (ctx.isLocal(owner)) {
            return null;
        }
        if ("Object".equals(owner) && args.size() == 1) {
            switch (method) {
                case "keys":    return asReceiver(args.get(0), ctx) + ".keySet()";
                case "values":  return asReceiver(args.get(0), ctx) + ".values()";
                case "entries": return asReceiver(args.get(0), ctx) + ".entrySet()";
                default:        return null;
            }
        }
        if ("Array".equals(owner) && "isArray".equals(method) && args.size() == 1) {
            return render(args.get(0), ctx) + " instanceof List";
        }
        return null;
    }

    @Override
    protected String superCall(List<Expression> args, GenerationContext ctx) {
        return "super(" + joinArguments(args, ctx) + ")";
    }

    @Override
    protected String functionCall(String name, List<Expression> args, GenerationContext ctx) {
        if (args.size() == 1 && !ctx.isLocal(name)) {
            switch (name) {
                case "String":     return "String.valueOf(" + render(args.get(0), ctx) + ")";
                case "Number":
                case "parseFloat": return "Double.parseDouble(" + render(args.get(0), ctx) + ")";
                case "parseInt":   return "Integer.parseInt(" + render(args.get(0), ctx) + ")";
                default:           break;
            }
        }
        return localName(name) + "(" + joinArguments(args, ctx) + ")";
    }

    /**
     * 按函数式接口调用闭包：Runnable.run、Supplier.get、Consumer.accept、Function.apply
     */
    @Override
    protected String invokeCallable(String target, CallableShape shape, List<Expression> args,
                                    GenerationContext ctx) {
        String method;
        if (shape.getArity() == 0) {
            method = shape.returnsVoid() ? "run" : "get";
        } else if (shape.getArity() <= 2) {
            method = shape.returnsVoid() ? "accept" : "apply";
        } else {
            method = "apply";
        }
        return target + "." + method + "(" + joinArguments(args, ctx) + ")";
    }

    @Override
    protected String newBuiltin(String name, List<Expression> args, GenerationContext ctx) {
        if (ctx.isTypeName(name)) {
            return null;
        }
        String className = builtinClass(name);
        if (className == null) {
            return null;
        }
        if (className.endsWith("Exception")) {
            return "new " + className + "(" + joinArguments(args, ctx) + ")";
        }
        return "new " + className + "<>(" + joinArguments(args, ctx) + ")";
    }

    /** 内置构造对应的 Java 类名，非内置返回 null */
    static String builtinClass(String name) {
        switch (name) {
            case "Map":        return "HashMap";
            case "Set":        return "HashSet";
            case "Array":      return "ArrayList";
            case "Error":      return "RuntimeException";
            case "TypeError":  return "IllegalArgumentException";
            case "RangeError": return "IndexOutOfBoundsException";
            default:           return null;
        }
    }

    @Override
    protected String newInstance(String className, List<Expression> args, GenerationContext ctx) {
        return "new " + className + "(" + joinArguments(args, ctx) + ")";
    }

    @Override
    protected String awaitValue(String future) {
        return future + ".join()";
    }

    // ============ 运算符 ============

    @Override
    public String visitBinaryExpr(BinaryExpr node, GenerationContext ctx) {
        BinaryExpr.BinaryOp op = node.getOperator();
        if (op.isAssignment() && node.getLeft() instanceof ElementAccessExpr) {
            return elementAssignment((ElementAccessExpr) node.getLeft(), op, node.getRight(), ctx);
        }
        String left = render(node.getLeft(), ctx);
        String right = render(node.getRight(), ctx);
        switch (op) {
            case EQ:
            case STRICT_EQ:
                return equality(node, left, right, false);
            case NE:
            case STRICT_NE:
                return equality(node, left, right, true);
            case NULLISH:
                return "(" + left + " != null ? " + left + " : " + right + ")";
            case NULLISH_ASSIGN:
                return left + " = (" + left + " != null ? " + left + " : " + right + ")";
            case AND_ASSIGN:
                return left + " = " + left + " && " + right;
            case OR_ASSIGN:
                return left + " = " + left + " || " + right;
            case POW:
                return "Math.pow(" + left + ", " + right + ")";
            case IN:
                return asReceiver(node.getRight(), ctx) + ".containsKey(" + left + ")";
            case COMMA:
                ctx.notePlaceholder("expression", "CommaListExpression");
                return left + ", " + right;
            default:
                return left + " " + op.toSourceString() + " " + right;
        }
    }

    /** 与字符串字面量比较时改用 equals */
    private static String equality(BinaryExpr node, String left, String right, boolean negate) {
        String result;
        if (isStringLiteral(node.getLeft())) {
            result = left + ".equals(" + right + ")";
        } else if (isStringLiteral(node.getRight())) {
            result = right + ".equals(" + left + ")";
        } else {
            return left + (negate ? " != " : " == ") + right;
        }
        return negate ? "!" + result : result;
    }

    private static boolean isStringLiteral(Expression e) {
        return e instanceof Literal && ((Literal) e).isString();
    }

    /** a[i] = v → a.set(i, v)；字符串键视为 Map，用 put */
    private String elementAssignment(ElementAccessExpr target, BinaryExpr.BinaryOp op, Expression value,
                                     GenerationContext ctx) {
        String receiver = asReceiver(target.getTarget(), ctx);
        String index = render(target.getIndex(), ctx);
        String setter = isStringLiteral(target.getIndex()) ? "put" : "set";
        String rendered = render(value, ctx);
        if (op != BinaryExpr.BinaryOp.ASSIGN) {
            String token = op.toSourceString();
            String current = receiver + ".get(" + index + ")";
            rendered = current + " " + token.substring(0, token.length() - 1) + " " + rendered;
        }
        return receiver + "." + setter + "(" + index + ", " + rendered + ")";
    }

    @Override
    public String visitUnaryExpr(UnaryExpr node, GenerationContext ctx) {
        String operand = render(node.getOperand(), ctx);
        String token = node.getOperator().toSourceString();
        return node.isPrefix() ? token + operand : operand + token;
    }

    // ============ 闭包 ============

    @Override
    public String visitArrowFunction(ArrowFunction node, GenerationContext ctx) {
        List<Parameter> params = node.getParameters();
        String head;
        if (params.size() == 1 && !params.get(0).isRest()) {
            head = localName(params.get(0).getName());
        } else {
            List<String> names = new ArrayList<>();
            for (Parameter p : params) {
                names.add(localName(p.getName()));
            }
            head = "(" + String.join(", ", names) + ")";
        }
        if (node.hasExpressionBody()) {
            ctx.pushScope();
            declareParameters(params, ctx);
            String body = render(node.getExpressionBody(), ctx);
            ctx.popScope();
            if (node.isAsync()) {
                body = "CompletableFuture.supplyAsync(() -> " + body + ")";
            }
            return head + " -> " + body;
        }
        List<Statement> statements = node.getBody().getStatements();
        if (!node.isAsync()) {
            return head + " -> {\n" + ctx.renderFunctionBody(params, statements, 1) + "\n}";
        }
        boolean returnsVoid = Signature.isVoid(Signature.resolveValueType(node));
        String indent = ctx.getConfig().getIndentString();
        StringBuilder sb = new StringBuilder(head).append(" -> {\n");
        sb.append(indent).append("return CompletableFuture.")
                .append(returnsVoid ? "runAsync" : "supplyAsync").append("(() -> {\n");
        sb.append(ctx.renderFunctionBody(params, statements, 2));
        if (!returnsVoid && Signature.completesNormally(statements)) {
            sb.append('\n').append(indent).append(indent).append("return null;");
        }
        sb.append('\n').append(indent).append("});\n}");
        return sb.toString();
    }
}
