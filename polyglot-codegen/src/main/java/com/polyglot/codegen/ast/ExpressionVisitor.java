package com.polyglot.codegen.ast;

import com.polyglot.codegen.ast.expr.*;

/**
 * 表达式访问者
 *
 * @param <R> 返回类型
 * @param <C> 上下文类型
 */
public interface ExpressionVisitor<R, C> {

    R visitLiteral(Literal node, C context);

    R visitIdentifier(Identifier node, C context);

    R visitThisExpr(ThisExpr node, C context);

    R visitSuperExpr(SuperExpr node, C context);

    R visitPropertyAccessExpr(PropertyAccessExpr node, C context);

    R visitElementAccessExpr(ElementAccessExpr node, C context);

    R visitCallExpr(CallExpr node, C context);

    R visitNewExpr(NewExpr node, C context);

    R visitArrayLiteral(ArrayLiteral node, C context);

    R visitObjectLiteral(ObjectLiteral node, C context);

    R visitBinaryExpr(BinaryExpr node, C context);

    R visitUnaryExpr(UnaryExpr node, C context);

    R visitConditionalExpr(ConditionalExpr node, C context);

    R visitArrowFunction(ArrowFunction node, C context);

    R visitAwaitExpr(AwaitExpr node, C context);

    R visitParenthesizedExpr(ParenthesizedExpr node, C context);

    R visitTemplateExpr(TemplateExpr node, C context);

    R visitAsExpr(AsExpr node, C context);

    R visitUnsupportedExpr(UnsupportedExpr node, C context);
}
