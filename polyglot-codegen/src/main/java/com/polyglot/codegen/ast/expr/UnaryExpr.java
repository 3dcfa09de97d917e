package com.polyglot.codegen.ast.expr;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.ExpressionVisitor;
import com.polyglot.codegen.ast.SourceSpan;

import java.util.List;

/**
 * 一元表达式（前缀或后缀）
 */
public class UnaryExpr extends Expression {
    private final UnaryOp operator;
    private final Expression operand;
    private final boolean prefix;

    public UnaryExpr(SourceSpan span, UnaryOp operator, Expression operand, boolean prefix) {
        super(span);
        this.operator = operator;
        this.operand = operand;
        this.prefix = prefix;
    }

    public UnaryOp getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    public boolean isPrefix() {
        return prefix;
    }

    public boolean isIncrementOrDecrement() {
        return operator == UnaryOp.INC || operator == UnaryOp.DEC;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitUnaryExpr(this, context);
    }

    @Override
    public String getKind() {
        return prefix ? "PrefixUnaryExpression" : "PostfixUnaryExpression";
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(operand);
    }

    /**
     * 一元运算符
     */
    public enum UnaryOp {
        NOT("!"),
        NEG("-"),
        POS("+"),
        BIT_NOT("~"),
        INC("++"),
        DEC("--");

        private final String token;

        UnaryOp(String token) {
            this.token = token;
        }

        public String toSourceString() {
            return token;
        }

        public static UnaryOp fromToken(String token) {
            for (UnaryOp op : values()) {
                if (op.token.equals(token)) {
                    return op;
                }
            }
            return null;
        }
    }
}
