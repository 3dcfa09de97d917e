package com.polyglot.codegen.generator.ruby;

import com.polyglot.codegen.ast.decl.Parameter;
import com.polyglot.codegen.ast.expr.ArrayLiteral;
import com.polyglot.codegen.ast.expr.ArrowFunction;
import com.polyglot.codegen.ast.expr.AsExpr;
import com.polyglot.codegen.ast.expr.BinaryExpr;
import com.polyglot.codegen.ast.expr.ElementAccessExpr;
import com.polyglot.codegen.ast.expr.Expression;
import com.polyglot.codegen.ast.expr.Identifier;
import com.polyglot.codegen.ast.expr.ObjectLiteral;
import com.polyglot.codegen.ast.expr.PropertyAccessExpr;
import com.polyglot.codegen.ast.expr.PropertyAssignment;
import com.polyglot.codegen.ast.expr.SuperExpr;
import com.polyglot.codegen.ast.expr.TemplateExpr;
import com.polyglot.codegen.ast.expr.ThisExpr;
import com.polyglot.codegen.ast.expr.UnaryExpr;
import com.polyglot.codegen.ast.stmt.Statement;
import com.polyglot.codegen.generator.CallableShape;
import com.polyglot.codegen.generator.ExpressionRenderer;
import com.polyglot.codegen.generator.GenerationContext;
import com.polyglot.codegen.generator.NamingConventions;
import com.polyglot.codegen.generator.SourceStrings;

import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ruby 表达式渲染
 */
public class RubyExpressionRenderer extends ExpressionRenderer {

    private static final Set<String> RESERVED = new HashSet<>(Arrays.asList(
            "alias", "and", "begin", "break", "case", "class", "def", "defined?", "do", "else", "elsif",
            "end", "ensure", "false", "for", "if", "in", "module", "next", "nil", "not", "or", "redo",
            "rescue", "retry", "return", "self", "super", "then", "true", "undef", "unless", "until",
            "when", "while", "yield"));

    /** 同义方法改名 */
    private static final Map<String, String> METHOD_NAMES = new HashMap<>();

    /** 以闭包为最后一个参数、改写为代码块的方法 */
    private static final Set<String> BLOCK_METHODS = new HashSet<>(Arrays.asList(
            "map", "filter", "forEach", "find", "findIndex", "some", "every", "reduce", "flatMap", "sort"));

    static {
        METHOD_NAMES.put("forEach", "each");
        METHOD_NAMES.put("filter", "select");
        METHOD_NAMES.put("some", "any?");
        METHOD_NAMES.put("every", "all?");
        METHOD_NAMES.put("includes", "include?");
        METHOD_NAMES.put("has", "include?");
        METHOD_NAMES.put("indexOf", "index");
        METHOD_NAMES.put("findIndex", "index");
        METHOD_NAMES.put("flatMap", "flat_map");
        METHOD_NAMES.put("toUpperCase", "upcase");
        METHOD_NAMES.put("toLowerCase", "downcase");
        METHOD_NAMES.put("toString", "to_s");
        METHOD_NAMES.put("trim", "strip");
        METHOD_NAMES.put("startsWith", "start_with?");
        METHOD_NAMES.put("endsWith", "end_with?");
        METHOD_NAMES.put("replaceAll", "gsub");
        METHOD_NAMES.put("replace", "sub");
    }

    // ============ 命名 ============

    @Override
    public String localName(String name) {
        if (NamingConventions.startsWithUpperCase(name)) {
            return name;
        }
        String snake = NamingConventions.toSnakeCase(name);
        return RESERVED.contains(snake) ? snake + "_" : snake;
    }

    @Override
    public String memberName(String name) {
        return NamingConventions.toSnakeCase(name);
    }

    @Override
    public String renderParameters(List<Parameter> parameters, GenerationContext ctx) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < parameters.size(); i++) {
            Parameter p = parameters.get(i);
            if (i > 0) {
                sb.append(", ");
            }
            if (p.isRest()) {
                sb.append('*');
            }
            sb.append(localName(p.getName()));
            if (p.hasDefaultValue()) {
                sb.append(" = ").append(render(p.getDefaultValue(), ctx));
            } else if (p.isOptional() && !p.isRest()) {
                sb.append(" = nil");
            }
        }
        return sb.toString();
    }

    // ============ 字面量 ============

    @Override
    protected String stringLiteral(String value) {
        return SourceStrings.rubyQuoted(value);
    }

    @Override
    protected String numberLiteral(String text) {
        return text;
    }

    @Override
    protected String nullLiteral() {
        return "nil";
    }

    @Override
    public String visitThisExpr(ThisExpr node, GenerationContext ctx) {
        return "self";
    }

    @Override
    public String visitSuperExpr(SuperExpr node, GenerationContext ctx) {
        return "super";
    }

    @Override
    public String visitArrayLiteral(ArrayLiteral node, GenerationContext ctx) {
        return "[" + joinArguments(node.getElements(), ctx) + "]";
    }

    @Override
    public String visitObjectLiteral(ObjectLiteral node, GenerationContext ctx) {
        List<PropertyAssignment> properties = node.getProperties();
        if (properties.isEmpty()) {
            return "{}";
        }
        StringBuilder sb = new StringBuilder("{ ");
        for (int i = 0; i < properties.size(); i++) {
            PropertyAssignment p = properties.get(i);
            if (i > 0) {
                sb.append(", ");
            }
            if (p.getKey() == null) {
                sb.append(render(p.getValue(), ctx));
                continue;
            }
            String value = p.isShorthand() ? localName(p.getKey()) : render(p.getValue(), ctx);
            if (NamingConventions.isRubySymbolName(p.getKey())) {
                sb.append(p.getKey()).append(": ").append(value);
            } else {
                sb.append(stringLiteral(p.getKey())).append(" => ").append(value);
            }
        }
        return sb.append(" }").toString();
    }

    @Override
    public String visitTemplateExpr(TemplateExpr node, GenerationContext ctx) {
        StringBuilder sb = new StringBuilder("\"");
        sb.append(SourceStrings.escapeRuby(node.getHead()));
        for (TemplateExpr.TemplateSpan span : node.getSpans()) {
            sb.append("#{").append(render(span.getExpression(), ctx)).append('}');
            sb.append(SourceStrings.escapeRuby(span.getLiteral()));
        }
        return sb.append('"').toString();
    }

    @Override
    public String visitAsExpr(AsExpr node, GenerationContext ctx) {
        return render(node.getExpression(), ctx);
    }

    // ============ 成员访问 ============

    @Override
    public String visitPropertyAccessExpr(PropertyAccessExpr node, GenerationContext ctx) {
        if (node.isOnThis()) {
            return "@" + memberName(node.getName());
        }
        Expression target = node.getTarget();
        if (target instanceof Identifier && "Math".equals(((Identifier) target).getName())
                && NamingConventions.isConstantCase(node.getName())) {
            return "Math::" + node.getName();
        }
        String separator = node.isOptional() ? "&." : ".";
        return asReceiver(target, ctx) + separator + memberName(node.getName());
    }

    @Override
    public String visitElementAccessExpr(ElementAccessExpr node, GenerationContext ctx) {
        return asReceiver(node.getTarget(), ctx) + "[" + render(node.getIndex(), ctx) + "]";
    }

    // ============ 调用 ============

    @Override
    protected String consoleCall(String method, List<Expression> args, GenerationContext ctx) {
        String printer;
        switch (method) {
            case "log":
            case "info":
            case "debug":
                printer = "puts";
                break;
            case "error":
            case "warn":
                printer = "warn";
                break;
            default:
                return null;
        }
        if (args.isEmpty()) {
            return printer;
        }
        if (args.size() == 1) {
            return printer + " " + render(args.get(0), ctx);
        }
        return printer + " [" + joinArguments(args, ctx) + "].join(\" \")";
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

        String receiver;
        if (target instanceof ThisExpr) {
            receiver = "";
        } else {
            receiver = asReceiver(target, ctx) + (callee.isOptional() ? "&." : ".");
        }

        if ("get".equals(method) && args.size() == 1 && !receiver.isEmpty()) {
            return receiver.substring(0, receiver.length() - 1) + "[" + render(args.get(0), ctx) + "]";
        }
        if ("set".equals(method) && args.size() == 2 && !receiver.isEmpty()) {
            return receiver.substring(0, receiver.length() - 1) + "[" + render(args.get(0), ctx) + "] = "
                    + render(args.get(1), ctx);
        }

        String name = METHOD_NAMES.containsKey(method) ? METHOD_NAMES.get(method) : memberName(method);
        if (BLOCK_METHODS.contains(method) && !args.isEmpty() && args.get(0) instanceof ArrowFunction) {
            List<Expression> rest = args.subList(1, args.size());
            String call = receiver + name + (rest.isEmpty() ? "" : "(" + joinArguments(rest, ctx) + ")");
            return call + " " + block((ArrowFunction) args.get(0), ctx);
        }
        if (args.isEmpty()) {
            return receiver + name;
        }
        return receiver + name + "(" + joinArguments(args, ctx) + ")";
    }

    /** Math、Object、JSON 等全局对象上的常用调用，未覆盖的返回 null */
    private String staticBuiltinCall(String owner, String method, List<Expression> args, GenerationContext ctx) {
        if (ctx.isLocal(owner)) {
            return null;
        }
        if ("Math".equals(owner)) {
            switch (method) {
                case "floor":
                case "ceil":
                case "round":
                case "abs":
                    return args.size() == 1 ? asReceiver(args.get(0), ctx) + "." + method : null;
                case "max":
                case "min":
                    return "[" + joinArguments(args, ctx) + "]." + method;
                case "random":
                    return "rand";
                default:
                    return null;
            }
        }
        if ("Object".equals(owner) && args.size() == 1) {
            switch (method) {
                case "keys":    return asReceiver(args.get(0), ctx) + ".keys";
                case "values":  return asReceiver(args.get(0), ctx) + ".values";
                case "entries": return asReceiver(args.get(0), ctx) + ".to_a";
                default:        return null;
            }
        }
        if ("Array".equals(owner) && "isArray".equals(method) && args.size() == 1) {
            return asReceiver(args.get(0), ctx) + ".is_a?(Array)";
        }
        if ("JSON".equals(owner)) {
            if ("stringify".equals(method) && !args.isEmpty()) {
                return "JSON.generate(" + render(args.get(0), ctx) + ")";
            }
            if ("parse".equals(method) && !args.isEmpty()) {
                return "JSON.parse(" + render(args.get(0), ctx) + ")";
            }
        }
        return null;
    }

    /** 闭包实参写成代码块 */
    private String block(ArrowFunction fn, GenerationContext ctx) {
        String params = fn.getParameters().isEmpty() ? "" : "|" + renderParameters(fn.getParameters(), ctx) + "| ";
        if (fn.hasExpressionBody()) {
            return "{ " + params + withParameters(fn, ctx) + " }";
        }
        String body = ctx.renderFunctionBody(fn.getParameters(), fn.getBody().getStatements(), 1);
        return "do" + (params.isEmpty() ? "" : " " + params.trim()) + "\n" + body + "\nend";
    }

    /** 在登记了闭包参数的作用域内渲染表达式体 */
    private String withParameters(ArrowFunction fn, GenerationContext ctx) {
        ctx.pushScope();
        declareParameters(fn.getParameters(), ctx);
        String body = render(fn.getExpressionBody(), ctx);
        ctx.popScope();
        return body;
    }

    @Override
    protected String superCall(List<Expression> args, GenerationContext ctx) {
        return "super(" + joinArguments(args, ctx) + ")";
    }

    @Override
    protected String functionCall(String name, List<Expression> args, GenerationContext ctx) {
        if (args.size() == 1 && !ctx.isLocal(name)) {
            switch (name) {
                case "String":     return asReceiver(args.get(0), ctx) + ".to_s";
                case "Number":
                case "parseFloat": return asReceiver(args.get(0), ctx) + ".to_f";
                case "parseInt":   return asReceiver(args.get(0), ctx) + ".to_i";
                default:           break;
            }
        }
        return localName(name) + "(" + joinArguments(args, ctx) + ")";
    }

    @Override
    protected String invokeCallable(String target, CallableShape shape, List<Expression> args,
                                    GenerationContext ctx) {
        return target + ".call(" + joinArguments(args, ctx) + ")";
    }

    @Override
    protected String newBuiltin(String name, List<Expression> args, GenerationContext ctx) {
        if (ctx.isTypeName(name)) {
            return null;
        }
        switch (name) {
            case "Map":
                return args.isEmpty() ? "{}" : asReceiver(args.get(0), ctx) + ".to_h";
            case "Set":
                return args.isEmpty() ? "Set.new" : "Set.new(" + joinArguments(args, ctx) + ")";
            case "Array":
                return args.isEmpty() ? "[]" : "Array.new(" + joinArguments(args, ctx) + ")";
            case "Error":
                return args.isEmpty() ? "StandardError.new" : "StandardError.new(" + joinArguments(args, ctx) + ")";
            case "Date":
                return args.isEmpty() ? "Time.now" : null;
            default:
                return null;
        }
    }

    @Override
    protected String newInstance(String className, List<Expression> args, GenerationContext ctx) {
        return className + ".new" + (args.isEmpty() ? "" : "(" + joinArguments(args, ctx) + ")");
    }

    @Override
    protected String awaitValue(String future) {
        return future + ".value!";
    }

    // ============ 运算符 ============

    @Override
    public String visitBinaryExpr(BinaryExpr node, GenerationContext ctx) {
        String left = render(node.getLeft(), ctx);
        String right = render(node.getRight(), ctx);
        switch (node.getOperator()) {
            case STRICT_EQ:
                return left + " == " + right;
            case STRICT_NE:
                return left + " != " + right;
            case NULLISH:
                return left + " || " + right;
            case NULLISH_ASSIGN:
                return left + " ||= " + right;
            case USHR:
                return left + " >> " + right;
            case INSTANCEOF:
                return asReceiver(node.getLeft(), ctx) + ".is_a?(" + right + ")";
            case IN:
                return asReceiver(node.getRight(), ctx) + ".key?(" + left + ")";
            case COMMA:
                return "(" + left + "; " + right + ")";
            default:
                return left + " " + node.getOperator().toSourceString() + " " + right;
        }
    }

    @Override
    public String visitUnaryExpr(UnaryExpr node, GenerationContext ctx) {
        String operand = render(node.getOperand(), ctx);
        switch (node.getOperator()) {
            case INC:
                return operand + " += 1";
            case DEC:
                return operand + " -= 1";
            default:
                return node.getOperator().toSourceString() + operand;
        }
    }

    // ============ 闭包 ============

    @Override
    public String visitArrowFunction(ArrowFunction node, GenerationContext ctx) {
        List<Parameter> params = node.getParameters();
        if (node.hasExpressionBody()) {
            String head = params.isEmpty() ? "->" : "->(" + renderParameters(params, ctx) + ")";
            String body = withParameters(node, ctx);
            if (node.isAsync()) {
                ctx.require(RubyTypeMapper.CONCURRENT);
                body = "Concurrent::Promises.future { " + body + " }";
            }
            return head + " { " + body + " }";
        }
        String head = params.isEmpty() ? "lambda do" : "lambda do |" + renderParameters(params, ctx) + "|";
        List<Statement> statements = node.getBody().getStatements();
        if (node.isAsync()) {
            String body = ctx.renderFunctionBody(params, statements, 2);
            String indent = ctx.getConfig().getIndentString();
            return head + "\n" + indent + "Concurrent::Promises.future(&-> do\n" + body + "\n" + indent + "end)\nend";
        }
        return head + "\n" + ctx.renderFunctionBody(params, statements, 1) + "\nend";
    }
}
