package com.polyglot.codegen.generator;

import com.polyglot.codegen.ast.ExpressionVisitor;
import com.polyglot.codegen.ast.decl.Parameter;
import com.polyglot.codegen.ast.expr.ArrowFunction;
import com.polyglot.codegen.ast.expr.AwaitExpr;
import com.polyglot.codegen.ast.expr.CallExpr;
import com.polyglot.codegen.ast.expr.ConditionalExpr;
import com.polyglot.codegen.ast.expr.ElementAccessExpr;
import com.polyglot.codegen.ast.expr.Expression;
import com.polyglot.codegen.ast.expr.Identifier;
import com.polyglot.codegen.ast.expr.Literal;
import com.polyglot.codegen.ast.expr.NewExpr;
import com.polyglot.codegen.ast.expr.ParenthesizedExpr;
import com.polyglot.codegen.ast.expr.PropertyAccessExpr;
import com.polyglot.codegen.ast.expr.SuperExpr;
import com.polyglot.codegen.ast.expr.ThisExpr;
import com.polyglot.codegen.ast.expr.UnsupportedExpr;
import com.polyglot.codegen.ast.type.FunctionType;

import java.util.List;

/**
 * 表达式渲染基类：表达式 → 目标语言文本。
 *
 * <p>标识符、调用、await 等各目标共有的分派逻辑在这里完成，
 * 字面量与运算符的具体写法交给子类。渲染从不抛出异常，
 * 无法处理的表达式原样输出源码并在下一行代码前补写占位注释。</p>
 */
public abstract class ExpressionRenderer implements ExpressionVisitor<String, GenerationContext> {

    public String render(Expression expression, GenerationContext ctx) {
        if (expression == null) {
            return "";
        }
        return expression.accept(this, ctx);
    }

    // ============ 命名 ============

    /** 局部变量、参数的目标名 */
    public abstract String localName(String name);

    /** 方法、属性的目标名 */
    public abstract String memberName(String name);

    /** 渲染参数列表（不含括号） */
    public abstract String renderParameters(List<Parameter> parameters, GenerationContext ctx);

    // ============ 字面量 ============

    protected abstract String stringLiteral(String value);

    protected abstract String numberLiteral(String text);

    protected abstract String nullLiteral();

    @Override
    public String visitLiteral(Literal node, GenerationContext ctx) {
        switch (node.getLiteralKind()) {
            case STRING:
                return stringLiteral(node.getValue());
            case NUMBER:
                return numberLiteral(node.getValue());
            case BOOLEAN:
                return node.getValue();
            default:
                return nullLiteral();
        }
    }

    // ============ 标识符 ============

    @Override
    public String visitIdentifier(Identifier node, GenerationContext ctx) {
        String name = node.getName();
        if ("undefined".equals(name)) {
            return nullLiteral();
        }
        if (ctx.isConstant(name)) {
            return NamingConventions.toConstantCase(name);
        }
        if (ctx.isLocal(name) || !NamingConventions.startsWithUpperCase(name)) {
            return localName(name);
        }
        return typeName(name);
    }

    /** 首字母大写的非局部标识符，通常是类名或内置对象 */
    protected String typeName(String name) {
        return name;
    }

    @Override
    public String visitParenthesizedExpr(ParenthesizedExpr node, GenerationContext ctx) {
        return "(" + render(node.getExpression(), ctx) + ")";
    }

    @Override
    public String visitConditionalExpr(ConditionalExpr node, GenerationContext ctx) {
        return render(node.getCondition(), ctx) + " ? " + render(node.getWhenTrue(), ctx)
                + " : " + render(node.getWhenFalse(), ctx);
    }

    @Override
    public String visitUnsupportedExpr(UnsupportedExpr node, GenerationContext ctx) {
        ctx.notePlaceholder("expression", node.getKind());
        String text = ctx.getUnit().textOf(node.getSpan()).trim();
        return text.isEmpty() ? nullLiteral() : text;
    }

    // ============ 调用 ============

    @Override
    public String visitCallExpr(CallExpr node, GenerationContext ctx) {
        Expression callee = node.getCallee();
        List<Expression> args = node.getArguments();
        if (callee instanceof PropertyAccessExpr) {
            PropertyAccessExpr access = (PropertyAccessExpr) callee;
            if (access.getTarget() instanceof Identifier
                    && "console".equals(((Identifier) access.getTarget()).getName())) {
                String printed = consoleCall(access.getName(), args, ctx);
                if (printed != null) {
                    return printed;
                }
            }
            return methodCall(access, args, ctx);
        }
        if (callee instanceof SuperExpr) {
            return superCall(args, ctx);
        }
        if (callee instanceof Identifier) {
            String name = ((Identifier) callee).getName();
            CallableShape shape = ctx.lookupCallable(name);
            if (shape != null) {
                return invokeCallable(localName(name), shape, args, ctx);
            }
            return functionCall(name, args, ctx);
        }
        return invokeCallable(asReceiver(callee, ctx), new CallableShape(args.size(), false), args, ctx);
    }

    /**
     * console.* 调用
     *
     * @return 目标写法，未知方法返回 null 按普通调用处理
     */
    protected abstract String consoleCall(String method, List<Expression> args, GenerationContext ctx);

    protected abstract String methodCall(PropertyAccessExpr callee, List<Expression> args, GenerationContext ctx);

    protected abstract String superCall(List<Expression> args, GenerationContext ctx);

    protected abstract String functionCall(String name, List<Expression> args, GenerationContext ctx);

    /** 调用闭包值 */
    protected abstract String invokeCallable(String target, CallableShape shape, List<Expression> args,
                                             GenerationContext ctx);

    @Override
    public String visitNewExpr(NewExpr node, GenerationContext ctx) {
        if (node.getCallee() instanceof Identifier) {
            String name = ((Identifier) node.getCallee()).getName();
            String builtin = newBuiltin(name, node.getArguments(), ctx);
            if (builtin != null) {
                return builtin;
            }
            return newInstance(name, node.getArguments(), ctx);
        }
        return newInstance(render(node.getCallee(), ctx), node.getArguments(), ctx);
    }

    /**
     * 内置类型的构造，如 Map、Set、Error
     *
     * @return 目标写法，非内置类型返回 null
     */
    protected abstract String newBuiltin(String name, List<Expression> args, GenerationContext ctx);

    protected abstract String newInstance(String className, List<Expression> args, GenerationContext ctx);

    @Override
    public String visitAwaitExpr(AwaitExpr node, GenerationContext ctx) {
        return awaitValue(asReceiver(node.getExpression(), ctx));
    }

    /** 在 future 上阻塞取值 */
    protected abstract String awaitValue(String future);

    // ============ 辅助 ============

    protected String joinArguments(List<Expression> args, GenerationContext ctx) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(render(args.get(i), ctx));
        }
        return sb.toString();
    }

    /**
     * 渲染作为方法接收者的表达式，复合表达式加括号
     */
    protected String asReceiver(Expression expression, GenerationContext ctx) {
        String text = render(expression, ctx);
        return isPrimary(expression) ? text : "(" + text + ")";
    }

    /** 可直接跟 .member 的表达式 */
    protected static boolean isPrimary(Expression expression) {
        return expression instanceof Identifier
                || expression instanceof ThisExpr
                || expression instanceof Literal
                || expression instanceof PropertyAccessExpr
                || expression instanceof ElementAccessExpr
                || expression instanceof CallExpr
                || expression instanceof NewExpr
                || expression instanceof ParenthesizedExpr;
    }

    /**
     * 参数或变量声明对应的闭包形状，不是函数值时返回 null
     */
    public static CallableShape shapeOf(Object typeOrInitializer) {
        if (typeOrInitializer instanceof FunctionType) {
            FunctionType fn = (FunctionType) typeOrInitializer;
            return new CallableShape(fn.getParameters().size(), fn.returnsVoid());
        }
        if (typeOrInitializer instanceof ArrowFunction) {
            ArrowFunction fn = (ArrowFunction) typeOrInitializer;
            boolean returnsVoid = !fn.isAsync() && Signature.isVoid(Signature.resolveValueType(fn));
            return new CallableShape(fn.getParameters().size(), returnsVoid);
        }
        return null;
    }

    /** 在闭包作用域中登记参数 */
    protected void declareParameters(List<Parameter> parameters, GenerationContext ctx) {
        for (Parameter p : parameters) {
            ctx.declareLocal(p.getName(), shapeOf(p.getType()));
        }
    }
}
