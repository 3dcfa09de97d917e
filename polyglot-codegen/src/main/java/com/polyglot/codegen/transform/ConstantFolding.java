package com.polyglot.codegen.transform;

import com.polyglot.codegen.ast.CompilationUnit;
import com.polyglot.codegen.ast.expr.BinaryExpr;
import com.polyglot.codegen.ast.expr.BinaryExpr.BinaryOp;
import com.polyglot.codegen.ast.expr.Expression;
import com.polyglot.codegen.ast.expr.Literal;
import com.polyglot.codegen.ast.expr.Literal.LiteralKind;
import com.polyglot.codegen.ast.expr.ParenthesizedExpr;
import com.polyglot.codegen.ast.expr.UnaryExpr;

/**
 * 常量折叠。
 * 编译期计算字面量之间的二元/一元运算，以及 true/false 参与的短路逻辑。
 *
 * <p>数字按 TypeScript 语义（双精度）计算；两个整数操作数得到整数结果时输出整数写法，
 * 否则输出带小数点的写法，保证 Java 侧推断出的类型不会从 double 退化为 int。</p>
 */
public class ConstantFolding extends AstTransformer implements AstPass {

    /** 整数结果必须落在 int 范围内，否则 Java 侧字面量不合法 */
    private static final double INT_LIMIT = Integer.MAX_VALUE;

    @Override
    public String getName() {
        return "ConstantFolding";
    }

    @Override
    public CompilationUnit run(CompilationUnit unit) {
        return transform(unit);
    }

    @Override
    public Expression visitBinaryExpr(BinaryExpr node, Void context) {
        Expression result = super.visitBinaryExpr(node, context);
        if (!(result instanceof BinaryExpr)) {
            return result;
        }
        BinaryExpr bin = (BinaryExpr) result;
        Expression folded = tryFoldBinary(bin);
        return folded != null ? withComments(node, folded) : bin;
    }

    @Override
    public Expression visitUnaryExpr(UnaryExpr node, Void context) {
        Expression result = super.visitUnaryExpr(node, context);
        if (!(result instanceof UnaryExpr)) {
            return result;
        }
        UnaryExpr unary = (UnaryExpr) result;
        Expression folded = tryFoldUnary(unary);
        return folded != null ? withComments(node, folded) : unary;
    }

    // ==================== 二元 ====================

    private Expression tryFoldBinary(BinaryExpr bin) {
        Expression left = unwrap(bin.getLeft());
        Expression right = unwrap(bin.getRight());
        BinaryOp op = bin.getOperator();

        // 短路逻辑：左侧为布尔常量时右侧可以是任意表达式
        if ((op == BinaryOp.AND || op == BinaryOp.OR) && isBoolean(left)) {
            boolean value = booleanValue((Literal) left);
            if (op == BinaryOp.AND) {
                return value ? bin.getRight() : left;
            }
            return value ? left : bin.getRight();
        }

        if (!(left instanceof Literal) || !(right instanceof Literal)) {
            return null;
        }
        Literal l = (Literal) left;
        Literal r = (Literal) right;

        if (l.isString() && r.isString()) {
            return foldStrings(bin, l.getValue(), op, r.getValue());
        }
        if (isBoolean(l) && isBoolean(r)) {
            return foldBooleans(bin, booleanValue(l), op, booleanValue(r));
        }
        if (l.isNumber() && r.isNumber()) {
            Double a = parseNumber(l.getValue());
            Double b = parseNumber(r.getValue());
            if (a == null || b == null) {
                return null;
            }
            return foldNumbers(bin, a, op, b, isWhole(l) && isWhole(r));
        }
        return null;
    }

    private Expression foldStrings(BinaryExpr bin, String a, BinaryOp op, String b) {
        switch (op) {
            case ADD:
                return new Literal(bin.getSpan(), LiteralKind.STRING, a + b);
            case EQ:
            case STRICT_EQ:
                return bool(bin, a.equals(b));
            case NE:
            case STRICT_NE:
                return bool(bin, !a.equals(b));
            default:
                return null;
        }
    }

    private Expression foldBooleans(BinaryExpr bin, boolean a, BinaryOp op, boolean b) {
        switch (op) {
            case EQ:
            case STRICT_EQ:
                return bool(bin, a == b);
            case NE:
            case STRICT_NE:
                return bool(bin, a != b);
            default:
                return null;
        }
    }

    private Expression foldNumbers(BinaryExpr bin, double a, BinaryOp op, double b, boolean integral) {
        switch (op) {
            case ADD: return number(bin, a + b, integral);
            case SUB: return number(bin, a - b, integral);
            case MUL: return number(bin, a * b, integral);
            case DIV:
                if (b == 0) return null;
                return number(bin, a / b, integral);
            case MOD:
                if (b == 0) return null;
                return number(bin, a % b, integral);
            case LT: return bool(bin, a < b);
            case GT: return bool(bin, a > b);
            case LE: return bool(bin, a <= b);
            case GE: return bool(bin, a >= b);
            case EQ:
            case STRICT_EQ:
                return bool(bin, a == b);
            case NE:
            case STRICT_NE:
                return bool(bin, a != b);
            default:
                return null;
        }
    }

    // ==================== 一元 ====================

    private Expression tryFoldUnary(UnaryExpr unary) {
        Expression operand = unwrap(unary.getOperand());
        if (!(operand instanceof Literal)) {
            return null;
        }
        Literal literal = (Literal) operand;
        switch (unary.getOperator()) {
            case NOT:
                return isBoolean(literal) ? bool(unary, !booleanValue(literal)) : null;
            case NEG:
            case POS: {
                if (!literal.isNumber()) {
                    return null;
                }
                Double value = parseNumber(literal.getValue());
                if (value == null) {
                    return null;
                }
                double result = unary.getOperator() == UnaryExpr.UnaryOp.NEG ? -value : value;
                return number(unary, result, isWhole(literal));
            }
            default:
                return null;
        }
    }

    // ==================== 工具 ====================

    private static Expression unwrap(Expression expr) {
        while (expr instanceof ParenthesizedExpr) {
            expr = ((ParenthesizedExpr) expr).getExpression();
        }
        return expr;
    }

    private static boolean isBoolean(Expression expr) {
        return expr instanceof Literal && ((Literal) expr).getLiteralKind() == LiteralKind.BOOLEAN;
    }

    private static boolean booleanValue(Literal literal) {
        return "true".equals(literal.getValue());
    }

    private static Literal bool(Expression origin, boolean value) {
        return new Literal(origin.getSpan(), LiteralKind.BOOLEAN, String.valueOf(value));
    }

    /**
     * 数字结果转字面量，无法精确写出时放弃折叠（返回 null）。
     */
    private static Literal number(Expression origin, double value, boolean integral) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return null;
        }
        String text;
        if (integral && value == Math.rint(value) && Math.abs(value) <= INT_LIMIT) {
            text = Long.toString((long) value);
        } else {
            text = Double.toString(value == 0 ? 0.0 : value);
            if (text.indexOf('E') >= 0) {
                return null;
            }
        }
        return new Literal(origin.getSpan(), LiteralKind.NUMBER, text);
    }

    /** 整数写法（含十六进制等前缀形式） */
    private static boolean isWhole(Literal literal) {
        String text = literal.getValue().toLowerCase();
        return literal.isIntegral() || text.startsWith("0x") || text.startsWith("0b") || text.startsWith("0o");
    }

    /**
     * 解析 TypeScript 数字字面量，BigInt、旧式八进制等不处理的写法返回 null。
     */
    static Double parseNumber(String text) {
        String s = text.replace("_", "");
        if (s.isEmpty() || s.endsWith("n")) {
            return null;
        }
        boolean negative = s.startsWith("-");
        if (negative) {
            s = s.substring(1);
        }
        String lower = s.toLowerCase();
        try {
            double value;
            if (lower.startsWith("0x")) {
                value = Long.parseLong(s.substring(2), 16);
            } else if (lower.startsWith("0b")) {
                value = Long.parseLong(s.substring(2), 2);
            } else if (lower.startsWith("0o")) {
                value = Long.parseLong(s.substring(2), 8);
            } else if (s.length() > 1 && s.charAt(0) == '0' && Character.isDigit(s.charAt(1))) {
                return null;
            } else {
                value = Double.parseDouble(s);
            }
            return negative ? -value : value;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
