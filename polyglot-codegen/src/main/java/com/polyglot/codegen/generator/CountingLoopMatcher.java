package com.polyglot.codegen.generator;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.decl.VariableDecl;
import com.polyglot.codegen.ast.expr.*;
import com.polyglot.codegen.ast.stmt.ForStmt;

/**
 * 计数循环识别。
 *
 * <p>只接受结构完全确定的形状：</p>
 * <ul>
 *   <li>初始化：单个变量，初值为整数字面量</li>
 *   <li>条件：{@code i < bound}，bound 为字面量、标识符或不含调用的属性链</li>
 *   <li>更新：{@code i++}、{@code ++i} 或 {@code i += 1}</li>
 *   <li>循环体不给 i 或 bound 的根变量赋值</li>
 * </ul>
 * 同时记录循环体内的闭包是否引用 i。
 * 其余情况返回 null，由调用方走 while 回退路径。
 */
public final class CountingLoopMatcher {

    private CountingLoopMatcher() {}

    public static CountingLoop match(ForStmt loop) {
        if (!(loop.getInitializer() instanceof VariableDecl)) {
            return null;
        }
        VariableDecl init = (VariableDecl) loop.getInitializer();
        if (init.isConst() || init.getDeclarators().size() != 1) {
            return null;
        }
        VariableDecl.Declarator declarator = init.getDeclarators().get(0);
        if (!(declarator.getInitializer() instanceof Literal)
                || !((Literal) declarator.getInitializer()).isIntegral()) {
            return null;
        }
        String variable = declarator.getName();

        if (!(loop.getCondition() instanceof BinaryExpr)) {
            return null;
        }
        BinaryExpr condition = (BinaryExpr) loop.getCondition();
        if (condition.getOperator() != BinaryExpr.BinaryOp.LT
                || !isIdentifier(condition.getLeft(), variable)
                || !isStableBound(condition.getRight())) {
            return null;
        }
        if (!isUnitIncrement(loop.getIncrementor(), variable)) {
            return null;
        }
        if (assigns(loop.getBody(), variable)) {
            return null;
        }
        String boundRoot = rootName(condition.getRight());
        if (boundRoot != null && assigns(loop.getBody(), boundRoot)) {
            return null;
        }
        return new CountingLoop(variable, (Literal) declarator.getInitializer(), condition.getRight(),
                capturedByClosure(loop.getBody(), variable, false));
    }

    /** 循环期间取值不变、求值无副作用的上界 */
    static boolean isStableBound(Expression bound) {
        if (bound instanceof Literal) {
            return ((Literal) bound).isNumber();
        }
        if (bound instanceof Identifier || bound instanceof ThisExpr) {
            return true;
        }
        if (bound instanceof PropertyAccessExpr) {
            PropertyAccessExpr access = (PropertyAccessExpr) bound;
            return !access.isOptional() && isStableBound(access.getTarget());
        }
        if (bound instanceof ParenthesizedExpr) {
            return isStableBound(((ParenthesizedExpr) bound).getExpression());
        }
        return false;
    }

    private static boolean isUnitIncrement(Expression update, String variable) {
        if (update instanceof UnaryExpr) {
            UnaryExpr unary = (UnaryExpr) update;
            return unary.getOperator() == UnaryExpr.UnaryOp.INC && isIdentifier(unary.getOperand(), variable);
        }
        if (update instanceof BinaryExpr) {
            BinaryExpr binary = (BinaryExpr) update;
            return binary.getOperator() == BinaryExpr.BinaryOp.ADD_ASSIGN
                    && isIdentifier(binary.getLeft(), variable)
                    && binary.getRight() instanceof Literal
                    && "1".equals(((Literal) binary.getRight()).getValue());
        }
        return false;
    }

    /**
     * 子树中是否有对 name 的赋值或自增自减
     */
    static boolean assigns(AstNode node, String name) {
        if (node == null) {
            return false;
        }
        if (node instanceof BinaryExpr) {
            BinaryExpr binary = (BinaryExpr) node;
            if (binary.getOperator().isAssignment() && isIdentifier(binary.getLeft(), name)) {
                return true;
            }
        } else if (node instanceof UnaryExpr) {
            UnaryExpr unary = (UnaryExpr) node;
            if (unary.isIncrementOrDecrement() && isIdentifier(unary.getOperand(), name)) {
                return true;
            }
        }
        for (AstNode child : node.getChildren()) {
            if (assigns(child, name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 子树中是否有闭包引用 name
     */
    static boolean capturedByClosure(AstNode node, String name, boolean insideClosure) {
        if (node == null) {
            return false;
        }
        if (node instanceof Identifier) {
            return insideClosure && ((Identifier) node).getName().equals(name);
        }
        boolean closure = insideClosure || node instanceof ArrowFunction;
        for (AstNode child : node.getChildren()) {
            if (capturedByClosure(child, name, closure)) {
                return true;
            }
        }
        return false;
    }

    private static String rootName(Expression bound) {
        Expression current = bound;
        while (current instanceof PropertyAccessExpr || current instanceof ParenthesizedExpr) {
            current = current instanceof PropertyAccessExpr
                    ? ((PropertyAccessExpr) current).getTarget()
                    : ((ParenthesizedExpr) current).getExpression();
        }
        return current instanceof Identifier ? ((Identifier) current).getName() : null;
    }

    private static boolean isIdentifier(Expression expr, String name) {
        return expr instanceof Identifier && ((Identifier) expr).getName().equals(name);
    }
}
