package com.polyglot.codegen.ast.expr;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.ExpressionVisitor;
import com.polyglot.codegen.ast.SourceSpan;

import java.util.List;

/**
 * 二元表达式（含赋值与复合赋值）
 */
public class BinaryExpr extends Expression {
    private final Expression left;
    private final BinaryOp operator;
    private final Expression right;

    public BinaryExpr(SourceSpan span, Expression left, BinaryOp operator, Expression right) {
        super(span);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitBinaryExpr(this, context);
    }

    @Override
    public String getKind() {
        return "BinaryExpression";
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(left, right);
    }

    /**
     * 二元运算符
     */
    public enum BinaryOp {
        // 算术
        ADD("+"),
        SUB("-"),
        MUL("*"),
        DIV("/"),
        MOD("%"),
        POW("**"),

        // 比较
        EQ("=="),
        NE("!="),
        STRICT_EQ("==="),
        STRICT_NE("!=="),
        LT("<"),
        GT(">"),
        LE("<="),
        GE(">="),

        // 逻辑
        AND("&&"),
        OR("||"),
        NULLISH("??"),

        // 位运算
        BIT_AND("&"),
        BIT_OR("|"),
        BIT_XOR("^"),
        SHL("<<"),
        SHR(">>"),
        USHR(">>>"),

        // 关系
        INSTANCEOF("instanceof"),
        IN("in"),

        // 赋值
        ASSIGN("="),
        ADD_ASSIGN("+="),
        SUB_ASSIGN("-="),
        MUL_ASSIGN("*="),
        DIV_ASSIGN("/="),
        MOD_ASSIGN("%="),
        AND_ASSIGN("&&="),
        OR_ASSIGN("||="),
        NULLISH_ASSIGN("??="),

        COMMA(",");

        private final String token;

        BinaryOp(String token) {
            this.token = token;
        }

        /** 返回源码中的运算符写法 */
        public String toSourceString() {
            return token;
        }

        public boolean isAssignment() {
            return ordinal() >= ASSIGN.ordinal() && this != COMMA;
        }

        /**
         * 按源码写法查找运算符，未知写法返回 null
         */
        public static BinaryOp fromToken(String token) {
            for (BinaryOp op : values()) {
                if (op.token.equals(token)) {
                    return op;
                }
            }
            return null;
        }
    }
}
