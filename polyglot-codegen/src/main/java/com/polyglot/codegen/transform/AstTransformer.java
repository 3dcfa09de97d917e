package com.polyglot.codegen.transform;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.CompilationUnit;
import com.polyglot.codegen.ast.ExpressionVisitor;
import com.polyglot.codegen.ast.StatementVisitor;
import com.polyglot.codegen.ast.decl.*;
import com.polyglot.codegen.ast.expr.*;
import com.polyglot.codegen.ast.stmt.*;

import java.util.ArrayList;
import java.util.List;

/**
 * AST 恒等变换基类（copy-on-change）。
 * 递归遍历所有节点，子节点无变化时返回原节点，否则构造新节点并沿用原节点的前导注释。
 * 子类可覆盖特定 visit 方法实现优化 pass。
 *
 * <p>语句位置返回 null 表示删除该语句；单语句位置（循环体、then 分支）删除后以空块代替。</p>
 */
public class AstTransformer implements StatementVisitor<Statement, Void>, ExpressionVisitor<Expression, Void> {

    public CompilationUnit transform(CompilationUnit unit) {
        List<Statement> statements = transformStatements(unit.getStatements());
        if (statements == unit.getStatements()) {
            return unit;
        }
        return withComments(unit, new CompilationUnit(unit.getFileName(), unit.getSourceText(), statements));
    }

    // ==================== 辅助方法 ====================

    protected Expression transformExpr(Expression expr) {
        if (expr == null) {
            return null;
        }
        return expr.accept(this, null);
    }

    protected Statement transformStmt(Statement stmt) {
        if (stmt == null) {
            return null;
        }
        return stmt.accept(this, null);
    }

    /** 单语句位置：删除的语句以空块代替 */
    protected Statement transformBody(Statement body) {
        if (body == null) {
            return null;
        }
        Statement result = transformStmt(body);
        return result != null ? result : withComments(body, new Block(body.getSpan(), new ArrayList<Statement>()));
    }

    protected Block transformBlock(Block block) {
        if (block == null) {
            return null;
        }
        List<Statement> statements = transformStatements(block.getStatements());
        if (statements == block.getStatements()) {
            return block;
        }
        return withComments(block, new Block(block.getSpan(), statements));
    }

    /**
     * 语句序列，无变化时返回原列表
     */
    protected List<Statement> transformStatements(List<Statement> statements) {
        List<Statement> result = new ArrayList<>(statements.size());
        boolean changed = false;
        for (Statement statement : statements) {
            Statement transformed = transformStmt(statement);
            if (transformed != statement) {
                changed = true;
            }
            if (transformed != null) {
                result.add(transformed);
            }
        }
        return changed ? result : statements;
    }

    protected List<Expression> transformExprs(List<Expression> expressions) {
        List<Expression> result = new ArrayList<>(expressions.size());
        boolean changed = false;
        for (Expression expression : expressions) {
            Expression transformed = transformExpr(expression);
            changed |= transformed != expression;
            result.add(transformed);
        }
        return changed ? result : expressions;
    }

    protected List<Parameter> transformParameters(List<Parameter> parameters) {
        List<Parameter> result = new ArrayList<>(parameters.size());
        boolean changed = false;
        for (Parameter p : parameters) {
            Expression defaultValue = transformExpr(p.getDefaultValue());
            if (defaultValue == p.getDefaultValue()) {
                result.add(p);
            } else {
                changed = true;
                result.add(withComments(p, new Parameter(p.getSpan(), p.getModifiers(), p.getName(), p.getType(),
                        defaultValue, p.isOptional(), p.isRest())));
            }
        }
        return changed ? result : parameters;
    }

    /** 把原节点的前导注释带到替换节点上 */
    protected static <T extends AstNode> T withComments(AstNode original, T replacement) {
        if (replacement != original && replacement.getLeadingComments().isEmpty()) {
            replacement.setLeadingComments(original.getLeadingComments());
        }
        return replacement;
    }

    // ==================== 声明 ====================

    @Override
    public Statement visitClassDecl(ClassDecl node, Void context) {
        List<ClassMember> members = new ArrayList<>(node.getMembers().size());
        boolean changed = false;
        for (ClassMember member : node.getMembers()) {
            ClassMember transformed = transformMember(member);
            changed |= transformed != member;
            members.add(transformed);
        }
        if (!changed) {
            return node;
        }
        return withComments(node, new ClassDecl(node.getSpan(), node.getModifiers(), node.getName(),
                node.getTypeParameters(), node.getSuperClass(), node.getInterfaces(), members));
    }

    protected ClassMember transformMember(ClassMember member) {
        if (member instanceof PropertyDecl) {
            PropertyDecl p = (PropertyDecl) member;
            Expression init = transformExpr(p.getInitializer());
            if (init == p.getInitializer()) {
                return p;
            }
            return withComments(p, new PropertyDecl(p.getSpan(), p.getModifiers(), p.getName(), p.getType(),
                    init, p.isOptional()));
        }
        if (member instanceof MethodDecl) {
            MethodDecl m = (MethodDecl) member;
            List<Parameter> params = transformParameters(m.getParameters());
            Block body = transformBlock(m.getBody());
            if (params == m.getParameters() && body == m.getBody()) {
                return m;
            }
            return withComments(m, new MethodDecl(m.getSpan(), m.getModifiers(), m.getName(),
                    m.getTypeParameters(), params, m.getReturnType(), body, m.getAccessorKind()));
        }
        if (member instanceof ConstructorDecl) {
            ConstructorDecl c = (ConstructorDecl) member;
            List<Parameter> params = transformParameters(c.getParameters());
            Block body = transformBlock(c.getBody());
            if (params == c.getParameters() && body == c.getBody()) {
                return c;
            }
            return withComments(c, new ConstructorDecl(c.getSpan(), c.getModifiers(), params, body));
        }
        return member;
    }

    @Override
    public Statement visitInterfaceDecl(InterfaceDecl node, Void context) {
        return node;
    }

    /** 枚举成员的初始化器决定自增编号，保持原样 */
    @Override
    public Statement visitEnumDecl(EnumDecl node, Void context) {
        return node;
    }

    @Override
    public Statement visitFunctionDecl(FunctionDecl node, Void context) {
        List<Parameter> params = transformParameters(node.getParameters());
        Block body = transformBlock(node.getBody());
        if (params == node.getParameters() && body == node.getBody()) {
            return node;
        }
        return withComments(node, new FunctionDecl(node.getSpan(), node.getModifiers(), node.getName(),
                node.getTypeParameters(), params, node.getReturnType(), body));
    }

    @Override
    public Statement visitVariableDecl(VariableDecl node, Void context) {
        List<VariableDecl.Declarator> declarators = new ArrayList<>(node.getDeclarators().size());
        boolean changed = false;
        for (VariableDecl.Declarator d : node.getDeclarators()) {
            Expression init = transformExpr(d.getInitializer());
            if (init == d.getInitializer()) {
                declarators.add(d);
            } else {
                changed = true;
                declarators.add(withComments(d, new VariableDecl.Declarator(d.getSpan(), d.getName(), d.getType(), init)));
            }
        }
        if (!changed) {
            return node;
        }
        return withComments(node, new VariableDecl(node.getSpan(), node.getModifiers(), node.getVariableKind(),
                declarators));
    }

    @Override
    public Statement visitModuleDecl(ModuleDecl node, Void context) {
        List<Statement> statements = transformStatements(node.getStatements());
        if (statements == node.getStatements()) {
            return node;
        }
        return withComments(node, new ModuleDecl(node.getSpan(), node.getModifiers(), node.getName(), statements));
    }

    @Override
    public Statement visitImportDecl(ImportDecl node, Void context) {
        return node;
    }

    @Override
    public Statement visitTypeAliasDecl(TypeAliasDecl node, Void context) {
        return node;
    }

    // ==================== 语句 ====================

    @Override
    public Statement visitBlock(Block node, Void context) {
        return transformBlock(node);
    }

    @Override
    public Statement visitExpressionStmt(ExpressionStmt node, Void context) {
        Expression expr = transformExpr(node.getExpression());
        if (expr == node.getExpression()) {
            return node;
        }
        return withComments(node, new ExpressionStmt(node.getSpan(), expr));
    }

    @Override
    public Statement visitIfStmt(IfStmt node, Void context) {
        Expression condition = transformExpr(node.getCondition());
        Statement thenBranch = transformBody(node.getThenBranch());
        Statement elseBranch = transformStmt(node.getElseBranch());
        if (condition == node.getCondition() && thenBranch == node.getThenBranch()
                && elseBranch == node.getElseBranch()) {
            return node;
        }
        return withComments(node, new IfStmt(node.getSpan(), condition, thenBranch, elseBranch));
    }

    @Override
    public Statement visitForStmt(ForStmt node, Void context) {
        Statement init = transformStmt(node.getInitializer());
        Expression condition = transformExpr(node.getCondition());
        Expression incrementor = transformExpr(node.getIncrementor());
        Statement body = transformBody(node.getBody());
        if (init == node.getInitializer() && condition == node.getCondition()
                && incrementor == node.getIncrementor() && body == node.getBody()) {
            return node;
        }
        return withComments(node, new ForStmt(node.getSpan(), init, condition, incrementor, body));
    }

    @Override
    public Statement visitForOfStmt(ForOfStmt node, Void context) {
        Expression iterable = transformExpr(node.getIterable());
        Statement body = transformBody(node.getBody());
        if (iterable == node.getIterable() && body == node.getBody()) {
            return node;
        }
        return withComments(node, new ForOfStmt(node.getSpan(), node.getVariableNames(), iterable, body));
    }

    @Override
    public Statement visitWhileStmt(WhileStmt node, Void context) {
        Expression condition = transformExpr(node.getCondition());
        Statement body = transformBody(node.getBody());
        if (condition == node.getCondition() && body == node.getBody()) {
            return node;
        }
        return withComments(node, new WhileStmt(node.getSpan(), condition, body));
    }

    @Override
    public Statement visitDoWhileStmt(DoWhileStmt node, Void context) {
        Statement body = transformBody(node.getBody());
        Expression condition = transformExpr(node.getCondition());
        if (condition == node.getCondition() && body == node.getBody()) {
            return node;
        }
        return withComments(node, new DoWhileStmt(node.getSpan(), body, condition));
    }

    @Override
    public Statement visitSwitchStmt(SwitchStmt node, Void context) {
        Expression subject = transformExpr(node.getSubject());
        List<SwitchClause> clauses = new ArrayList<>(node.getClauses().size());
        boolean changed = subject != node.getSubject();
        for (SwitchClause clause : node.getClauses()) {
            Expression label = transformExpr(clause.getLabel());
            List<Statement> statements = transformStatements(clause.getStatements());
            if (label == clause.getLabel() && statements == clause.getStatements()) {
                clauses.add(clause);
            } else {
                changed = true;
                clauses.add(withComments(clause, new SwitchClause(clause.getSpan(), label, statements)));
            }
        }
        if (!changed) {
            return node;
        }
        return withComments(node, new SwitchStmt(node.getSpan(), subject, clauses));
    }

    @Override
    public Statement visitTryStmt(TryStmt node, Void context) {
        Block tryBlock = transformBlock(node.getTryBlock());
        CatchClause catchClause = node.getCatchClause();
        if (catchClause != null) {
            Block handler = transformBlock(catchClause.getBody());
            if (handler != catchClause.getBody()) {
                catchClause = withComments(catchClause,
                        new CatchClause(catchClause.getSpan(), catchClause.getVariableName(), handler));
            }
        }
        Block finallyBlock = transformBlock(node.getFinallyBlock());
        if (tryBlock == node.getTryBlock() && catchClause == node.getCatchClause()
                && finallyBlock == node.getFinallyBlock()) {
            return node;
        }
        return withComments(node, new TryStmt(node.getSpan(), tryBlock, catchClause, finallyBlock));
    }

    @Override
    public Statement visitThrowStmt(ThrowStmt node, Void context) {
        Expression expr = transformExpr(node.getExpression());
        if (expr == node.getExpression()) {
            return node;
        }
        return withComments(node, new ThrowStmt(node.getSpan(), expr));
    }

    @Override
    public Statement visitReturnStmt(ReturnStmt node, Void context) {
        Expression value = transformExpr(node.getValue());
        if (value == node.getValue()) {
            return node;
        }
        return withComments(node, new ReturnStmt(node.getSpan(), value));
    }

    @Override
    public Statement visitBreakStmt(BreakStmt node, Void context) {
        return node;
    }

    @Override
    public Statement visitContinueStmt(ContinueStmt node, Void context) {
        return node;
    }

    @Override
    public Statement visitUnsupportedStmt(UnsupportedStmt node, Void context) {
        return node;
    }

    // ==================== 表达式 ====================

    @Override
    public Expression visitLiteral(Literal node, Void context) {
        return node;
    }

    @Override
    public Expression visitIdentifier(Identifier node, Void context) {
        return node;
    }

    @Override
    public Expression visitThisExpr(ThisExpr node, Void context) {
        return node;
    }

    @Override
    public Expression visitSuperExpr(SuperExpr node, Void context) {
        return node;
    }

    @Override
    public Expression visitPropertyAccessExpr(PropertyAccessExpr node, Void context) {
        Expression target = transformExpr(node.getTarget());
        if (target == node.getTarget()) {
            return node;
        }
        return withComments(node, new PropertyAccessExpr(node.getSpan(), target, node.getName(), node.isOptional()));
    }

    @Override
    public Expression visitElementAccessExpr(ElementAccessExpr node, Void context) {
        Expression target = transformExpr(node.getTarget());
        Expression index = transformExpr(node.getIndex());
        if (target == node.getTarget() && index == node.getIndex()) {
            return node;
        }
        return withComments(node, new ElementAccessExpr(node.getSpan(), target, index));
    }

    @Override
    public Expression visitCallExpr(CallExpr node, Void context) {
        Expression callee = transformExpr(node.getCallee());
        List<Expression> args = transformExprs(node.getArguments());
        if (callee == node.getCallee() && args == node.getArguments()) {
            return node;
        }
        return withComments(node, new CallExpr(node.getSpan(), callee, args));
    }

    @Override
    public Expression visitNewExpr(NewExpr node, Void context) {
        Expression callee = transformExpr(node.getCallee());
        List<Expression> args = transformExprs(node.getArguments());
        if (callee == node.getCallee() && args == node.getArguments()) {
            return node;
        }
        return withComments(node, new NewExpr(node.getSpan(), callee, args));
    }

    @Override
    public Expression visitArrayLiteral(ArrayLiteral node, Void context) {
        List<Expression> elements = transformExprs(node.getElements());
        if (elements == node.getElements()) {
            return node;
        }
        return withComments(node, new ArrayLiteral(node.getSpan(), elements));
    }

    @Override
    public Expression visitObjectLiteral(ObjectLiteral node, Void context) {
        List<PropertyAssignment> properties = new ArrayList<>(node.getProperties().size());
        boolean changed = false;
        for (PropertyAssignment p : node.getProperties()) {
            Expression value = transformExpr(p.getValue());
            if (value == p.getValue()) {
                properties.add(p);
            } else {
                changed = true;
                properties.add(withComments(p, new PropertyAssignment(p.getSpan(), p.getKey(), value, p.isShorthand())));
            }
        }
        if (!changed) {
            return node;
        }
        return withComments(node, new ObjectLiteral(node.getSpan(), properties));
    }

    @Override
    public Expression visitBinaryExpr(BinaryExpr node, Void context) {
        Expression left = transformExpr(node.getLeft());
        Expression right = transformExpr(node.getRight());
        if (left == node.getLeft() && right == node.getRight()) {
            return node;
        }
        return withComments(node, new BinaryExpr(node.getSpan(), left, node.getOperator(), right));
    }

    @Override
    public Expression visitUnaryExpr(UnaryExpr node, Void context) {
        Expression operand = transformExpr(node.getOperand());
        if (operand == node.getOperand()) {
            return node;
        }
        return withComments(node, new UnaryExpr(node.getSpan(), node.getOperator(), operand, node.isPrefix()));
    }

    @Override
    public Expression visitConditionalExpr(ConditionalExpr node, Void context) {
        Expression condition = transformExpr(node.getCondition());
        Expression whenTrue = transformExpr(node.getWhenTrue());
        Expression whenFalse = transformExpr(node.getWhenFalse());
        if (condition == node.getCondition() && whenTrue == node.getWhenTrue()
                && whenFalse == node.getWhenFalse()) {
            return node;
        }
        return withComments(node, new ConditionalExpr(node.getSpan(), condition, whenTrue, whenFalse));
    }

    @Override
    public Expression visitArrowFunction(ArrowFunction node, Void context) {
        List<Parameter> params = transformParameters(node.getParameters());
        Block body = transformBlock(node.getBody());
        Expression expressionBody = transformExpr(node.getExpressionBody());
        if (params == node.getParameters() && body == node.getBody()
                && expressionBody == node.getExpressionBody()) {
            return node;
        }
        return withComments(node, new ArrowFunction(node.getSpan(), params, node.getReturnType(), body,
                expressionBody, node.isAsync(), node.isFunctionExpression()));
    }

    @Override
    public Expression visitAwaitExpr(AwaitExpr node, Void context) {
        Expression expr = transformExpr(node.getExpression());
        if (expr == node.getExpression()) {
            return node;
        }
        return withComments(node, new AwaitExpr(node.getSpan(), expr));
    }

    @Override
    public Expression visitParenthesizedExpr(ParenthesizedExpr node, Void context) {
        Expression expr = transformExpr(node.getExpression());
        if (expr == node.getExpression()) {
            return node;
        }
        return withComments(node, new ParenthesizedExpr(node.getSpan(), expr));
    }

    @Override
    public Expression visitTemplateExpr(TemplateExpr node, Void context) {
        List<TemplateExpr.TemplateSpan> spans = new ArrayList<>(node.getSpans().size());
        boolean changed = false;
        for (TemplateExpr.TemplateSpan span : node.getSpans()) {
            Expression expr = transformExpr(span.getExpression());
            if (expr == span.getExpression()) {
                spans.add(span);
            } else {
                changed = true;
                spans.add(withComments(span, new TemplateExpr.TemplateSpan(span.getSpan(), expr, span.getLiteral())));
            }
        }
        if (!changed) {
            return node;
        }
        return withComments(node, new TemplateExpr(node.getSpan(), node.getHead(), spans));
    }

    @Override
    public Expression visitAsExpr(AsExpr node, Void context) {
        Expression expr = transformExpr(node.getExpression());
        if (expr == node.getExpression()) {
            return node;
        }
        return withComments(node, new AsExpr(node.getSpan(), expr, node.getType()));
    }

    @Override
    public Expression visitUnsupportedExpr(UnsupportedExpr node, Void context) {
        return node;
    }
}
