package com.polyglot.codegen.generator;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.CommentRange;
import com.polyglot.codegen.ast.CompilationUnit;
import com.polyglot.codegen.ast.SourceSpan;
import com.polyglot.codegen.ast.StatementVisitor;
import com.polyglot.codegen.ast.decl.ClassDecl;
import com.polyglot.codegen.ast.decl.ClassMember;
import com.polyglot.codegen.ast.decl.ConstructorDecl;
import com.polyglot.codegen.ast.decl.EnumDecl;
import com.polyglot.codegen.ast.decl.FunctionDecl;
import com.polyglot.codegen.ast.decl.FunctionLike;
import com.polyglot.codegen.ast.decl.ImportDecl;
import com.polyglot.codegen.ast.decl.InterfaceDecl;
import com.polyglot.codegen.ast.decl.MethodDecl;
import com.polyglot.codegen.ast.decl.ModuleDecl;
import com.polyglot.codegen.ast.decl.Parameter;
import com.polyglot.codegen.ast.decl.PropertyDecl;
import com.polyglot.codegen.ast.decl.TypeAliasDecl;
import com.polyglot.codegen.ast.decl.VariableDecl;
import com.polyglot.codegen.ast.expr.BinaryExpr;
import com.polyglot.codegen.ast.expr.CallExpr;
import com.polyglot.codegen.ast.expr.Expression;
import com.polyglot.codegen.ast.expr.Identifier;
import com.polyglot.codegen.ast.expr.Literal;
import com.polyglot.codegen.ast.expr.PropertyAccessExpr;
import com.polyglot.codegen.ast.expr.SuperExpr;
import com.polyglot.codegen.ast.expr.UnaryExpr;
import com.polyglot.codegen.ast.stmt.Block;
import com.polyglot.codegen.ast.stmt.BreakStmt;
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
import com.polyglot.codegen.transform.PassPipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 代码生成引擎。
 *
 * <p>两遍处理：先由 {@link RequirementScanner} 收集常量与导入，
 * 再写出文件头、导入和各顶层节点。引擎只做遍历和结构决策，
 * 具体语法由 {@link TargetDialect} 决定。实例无状态，可顺序复用。</p>
 */
public class CodeGenerator implements StatementVisitor<Void, GenerationContext> {
    private static final Logger LOG = Logger.getLogger(CodeGenerator.class.getName());

    private final TargetDialect dialect;
    private final GeneratorConfig config;

    public CodeGenerator(TargetDialect dialect, GeneratorConfig config) {
        this.dialect = dialect;
        this.config = config;
    }

    public TargetDialect getDialect() {
        return dialect;
    }

    public GeneratorConfig getConfig() {
        return config;
    }

    /**
     * 生成整个编译单元的目标代码
     *
     * @return 以单个换行结尾的源码文本
     */
    public String generate(CompilationUnit unit) {
        if (config.isOptimize()) {
            unit = PassPipeline.createDefault().run(unit);
        }
        GenerationContext ctx = new GenerationContext(unit, config, dialect, this);
        LOG.fine("生成 " + dialect.getName() + ": " + unit.getFileName() + " " + config);

        new RequirementScanner(dialect).scan(unit, ctx);

        dialect.writeHeader(unit, ctx);
        dialect.writeImports(ctx.getImports(), ctx);
        ctx.getImports().freeze();
        dialect.openNamespace(ctx);
        dialect.writeTopLevel(unit.getStatements(), ctx);
        dialect.closeNamespace(ctx);
        ctx.flushNotes();
        return ctx.getWriter().getOutput();
    }

    // ============ 分派入口 ============

    public void emit(Statement statement, GenerationContext ctx) {
        if (statement == null) {
            return;
        }
        writeLeadingComments(statement, ctx);
        statement.accept(this, ctx);
    }

    public void emitAll(List<Statement> statements, GenerationContext ctx) {
        for (Statement statement : statements) {
            emit(statement, ctx);
        }
    }

    /** 循环、分支体：块展开为语句序列 */
    public void emitBody(Statement body, GenerationContext ctx) {
        if (body instanceof Block) {
            writeLeadingComments(body, ctx);
            emitAll(((Block) body).getStatements(), ctx);
        } else {
            emit(body, ctx);
        }
    }

    /**
     * 依次写出声明，类、函数等块状声明前后留空行
     */
    public void emitDeclarations(List<Statement> statements, GenerationContext ctx) {
        for (Statement statement : statements) {
            boolean block = isBlockDeclaration(statement);
            if (block) {
                ctx.blankLine();
            }
            emit(statement, ctx);
            if (block) {
                ctx.blankLine();
            }
        }
    }

    public static boolean isBlockDeclaration(Statement statement) {
        return statement instanceof ClassDecl
                || statement instanceof InterfaceDecl
                || statement instanceof EnumDecl
                || statement instanceof FunctionDecl
                || statement instanceof ModuleDecl;
    }

    public void writeLeadingComments(AstNode node, GenerationContext ctx) {
        if (!config.isPreserveComments()) {
            return;
        }
        for (CommentRange range : node.getLeadingComments()) {
            String raw = ctx.getUnit().textOf(range);
            if (raw.isEmpty()) {
                continue;
            }
            dialect.writeComment(CommentFormatter.parse(raw), ctx);
        }
    }

    // ============ 声明 ============

    @Override
    public Void visitClassDecl(ClassDecl node, GenerationContext ctx) {
        List<PropertyDecl> fields = new ArrayList<>();
        List<ClassMember> others = new ArrayList<>();
        ConstructorDecl ctor = null;
        int ctorCount = 0;
        for (ClassMember member : node.getMembers()) {
            if (member instanceof PropertyDecl) {
                fields.add((PropertyDecl) member);
            } else if (member instanceof ConstructorDecl) {
                ctorCount++;
                ConstructorDecl c = (ConstructorDecl) member;
                if (ctor == null || (ctor.getBody() == null && c.getBody() != null)) {
                    ctor = c;
                }
            } else if (!isOverloadSignature(member, node)) {
                others.add(member);
            }
        }
        if (ctor != null) {
            for (Parameter p : ctor.getParameterProperties()) {
                fields.add(new PropertyDecl(p.getSpan(), p.getModifiers(), p.getName(), p.getType(),
                        null, p.isOptional()));
            }
        }

        if (config.isUseIdiomaticValueObjects() && dialect.supportsValueObjects(config)) {
            List<PropertyDecl> components = valueObjectComponents(node, fields, ctor, ctorCount, others);
            if (components != null) {
                LOG.fine("值对象: " + node.getName());
                dialect.writeValueObject(node, components, ctx);
                return null;
            }
        }

        List<PropertyDecl> instanceFields = new ArrayList<>();
        for (PropertyDecl field : fields) {
            if (!field.isStatic()) {
                instanceFields.add(field);
            }
        }

        dialect.openClass(node, ctx);
        MemberScope previous = ctx.enterScope(MemberScope.CLASS);
        dialect.writeFields(node, fields, ctx);
        if (ctor != null) {
            writeLeadingComments(ctor, ctx);
            emitConstructor(node, ctor, ctx);
            ctx.blankLine();
        } else if (!instanceFields.isEmpty()) {
            dialect.writeSynthesizedConstructor(node, instanceFields, ctx);
            ctx.blankLine();
        }
        dialect.writeAccessors(instanceFields, ctx);
        for (ClassMember member : others) {
            writeLeadingComments(member, ctx);
            if (member instanceof MethodDecl) {
                emitMethod(Signature.ofMethod((MethodDecl) member, node.getName(), MemberScope.CLASS),
                        (MethodDecl) member, ctx);
            } else {
                ctx.writePlaceholder("member", member.getKind());
            }
            ctx.blankLine();
        }
        ctx.enterScope(previous);
        ctx.trimTrailingBlankLines();
        dialect.closeClass(node, ctx);
        return null;
    }

    /** 非抽象类中没有函数体、且存在同名实现的方法是重载签名，不单独生成 */
    private static boolean isOverloadSignature(ClassMember member, ClassDecl owner) {
        if (!(member instanceof MethodDecl) || ((MethodDecl) member).getBody() != null
                || ((MethodDecl) member).isAbstract()) {
            return false;
        }
        for (ClassMember other : owner.getMembers()) {
            if (other != member && other instanceof MethodDecl && other.getName().equals(member.getName())
                    && ((MethodDecl) other).getBody() != null) {
                return true;
            }
        }
        return false;
    }

    /**
     * 判定值对象并确定分量顺序。
     *
     * <p>条件：无父类、非抽象、至少一个字段、全部字段为只读实例字段且无初始化器、
     * 没有方法或其他成员、至多一个构造器且构造器只做参数到字段的逐一赋值。
     * 有构造器时分量按构造器参数顺序排列，调用方的实参顺序因此不变。</p>
     *
     * @return 分量列表，不满足条件返回 null
     */
    List<PropertyDecl> valueObjectComponents(ClassDecl node, List<PropertyDecl> fields,
                                             ConstructorDecl ctor, int ctorCount, List<ClassMember> others) {
        if (node.getSuperClass() != null || node.isAbstract() || fields.isEmpty()
                || !others.isEmpty() || ctorCount > 1) {
            return null;
        }
        Map<String, PropertyDecl> byName = new LinkedHashMap<>();
        for (PropertyDecl field : fields) {
            if (!field.isReadonly() || field.isStatic() || field.getInitializer() != null) {
                return null;
            }
            byName.put(field.getName(), field);
        }
        if (ctor == null) {
            return fields;
        }
        Set<String> paramProps = new HashSet<>();
        for (Parameter p : ctor.getParameterProperties()) {
            paramProps.add(p.getName());
        }
        Map<String, String> assigned = new LinkedHashMap<>();
        if (ctor.getBody() != null) {
            for (Statement statement : ctor.getBody().getStatements()) {
                String[] pair = fieldFromParameter(statement);
                if (pair == null || assigned.containsKey(pair[0])) {
                    return null;
                }
                assigned.put(pair[0], pair[1]);
            }
        }
        List<PropertyDecl> ordered = new ArrayList<>();
        for (Parameter p : ctor.getParameters()) {
            String fieldName = null;
            if (paramProps.contains(p.getName())) {
                fieldName = p.getName();
            } else {
                for (Map.Entry<String, String> e : assigned.entrySet()) {
                    if (e.getValue().equals(p.getName())) {
                        fieldName = e.getKey();
                    }
                }
            }
            if (fieldName == null || !byName.containsKey(fieldName) || p.hasDefaultValue() || p.isRest()) {
                return null;
            }
            ordered.add(byName.get(fieldName));
        }
        return ordered.size() == byName.size() ? ordered : null;
    }

    /** 形如 this.f = p 的语句返回 {f, p}，否则 null */
    private static String[] fieldFromParameter(Statement statement) {
        if (!(statement instanceof ExpressionStmt)) {
            return null;
        }
        Expression e = ((ExpressionStmt) statement).getExpression();
        if (!(e instanceof BinaryExpr) || ((BinaryExpr) e).getOperator() != BinaryExpr.BinaryOp.ASSIGN) {
            return null;
        }
        BinaryExpr assign = (BinaryExpr) e;
        if (!(assign.getLeft() instanceof PropertyAccessExpr) || !(assign.getRight() instanceof Identifier)) {
            return null;
        }
        PropertyAccessExpr target = (PropertyAccessExpr) assign.getLeft();
        if (!target.isOnThis()) {
            return null;
        }
        return new String[]{target.getName(), ((Identifier) assign.getRight()).getName()};
    }

    private void emitConstructor(ClassDecl owner, ConstructorDecl ctor, GenerationContext ctx) {
        Signature signature = Signature.ofConstructor(ctor, owner);
        ctx.pushScope();
        declareParameters(signature.getParameters(), ctx);
        dialect.openConstructor(signature, ctx);
        Block body = ctor.getBody();
        List<Statement> statements = body != null ? body.getStatements() : Collections.<Statement>emptyList();
        int start = 0;
        // super(...) 必须在参数属性赋值之前
        if (!statements.isEmpty() && isSuperCall(statements.get(0))) {
            emit(statements.get(0), ctx);
            start = 1;
        }
        for (Parameter p : ctor.getParameterProperties()) {
            ctx.line(dialect.fieldAssignment(p.getName(), p.getName()));
        }
        List<PropertyDecl> initialized = new ArrayList<>();
        for (ClassMember member : owner.getMembers()) {
            if (member instanceof PropertyDecl && !member.isStatic()
                    && ((PropertyDecl) member).getInitializer() != null) {
                initialized.add((PropertyDecl) member);
            }
        }
        dialect.writeFieldInitializers(initialized, ctx);
        emitAll(statements.subList(start, statements.size()), ctx);
        dialect.closeConstructor(ctx);
        ctx.popScope();
    }

    private static boolean isSuperCall(Statement statement) {
        if (!(statement instanceof ExpressionStmt)) {
            return false;
        }
        Expression e = ((ExpressionStmt) statement).getExpression();
        return e instanceof CallExpr && ((CallExpr) e).getCallee() instanceof SuperExpr;
    }

    private void emitMethod(Signature signature, MethodDecl method, GenerationContext ctx) {
        if (signature.isAbstract()) {
            dialect.writeAbstractMethod(signature, ctx);
            return;
        }
        emitFunction(signature, method, ctx);
    }

    /**
     * 写出函数或方法：签名、（可选）异步包装、函数体
     */
    void emitFunction(Signature signature, FunctionLike fn, GenerationContext ctx) {
        MemberScope previousScope = ctx.enterScope(MemberScope.FUNCTION);
        ctx.pushScope();
        declareParameters(signature.getParameters(), ctx);

        dialect.openFunction(signature, ctx);
        List<Statement> statements = fn.getBody() != null
                ? fn.getBody().getStatements() : Collections.<Statement>emptyList();
        if (signature.isAsync()) {
            dialect.openAsyncBody(signature, ctx);
            emitAll(statements, ctx);
            dialect.closeAsyncBody(signature, Signature.completesNormally(statements), ctx);
        } else {
            emitAll(statements, ctx);
        }
        dialect.closeFunction(signature, ctx);

        ctx.popScope();
        ctx.enterScope(previousScope);
    }

    private static void declareParameters(List<Parameter> parameters, GenerationContext ctx) {
        for (Parameter p : parameters) {
            ctx.declareLocal(p.getName(), ExpressionRenderer.shapeOf(p.getType()));
        }
    }

    @Override
    public Void visitInterfaceDecl(InterfaceDecl node, GenerationContext ctx) {
        dialect.openInterface(node, ctx);
        MemberScope previous = ctx.enterScope(MemberScope.INTERFACE);
        for (ClassMember member : node.getMembers()) {
            writeLeadingComments(member, ctx);
            if (member instanceof PropertyDecl) {
                dialect.writePropertyStub((PropertyDecl) member, ctx);
            } else if (member instanceof MethodDecl) {
                dialect.writeMethodStub(
                        Signature.ofMethod((MethodDecl) member, node.getName(), MemberScope.INTERFACE), ctx);
            } else {
                ctx.writePlaceholder("member", member.getKind());
            }
        }
        ctx.enterScope(previous);
        ctx.trimTrailingBlankLines();
        dialect.closeInterface(node, ctx);
        return null;
    }

    @Override
    public Void visitEnumDecl(EnumDecl node, GenerationContext ctx) {
        List<EnumConstant> constants = new ArrayList<>();
        long next = 0;
        boolean numeric = true;
        for (EnumDecl.EnumMember member : node.getMembers()) {
            String name = NamingConventions.toConstantCase(member.getName());
            Expression init = member.getInitializer();
            if (init == null) {
                if (!numeric) {
                    // 字符串成员之后的无初始化成员在源语言中是编译错误，按名称兜底
                    constants.add(new EnumConstant(name, ctx.render(literal(Literal.LiteralKind.STRING,
                            member.getName())), false, EnumConstant.ValueKind.STRING));
                    continue;
                }
                constants.add(new EnumConstant(name, String.valueOf(next), false, EnumConstant.ValueKind.INTEGER));
                next++;
                continue;
            }
            String value = ctx.render(init);
            EnumConstant.ValueKind kind = EnumConstant.ValueKind.OTHER;
            Long integral = integralValue(init);
            if (integral != null) {
                kind = EnumConstant.ValueKind.INTEGER;
                next = integral + 1;
                numeric = true;
            } else if (init instanceof Literal && ((Literal) init).isNumber()) {
                kind = EnumConstant.ValueKind.NUMBER;
                numeric = false;
            } else if (init instanceof Literal && ((Literal) init).isString()) {
                kind = EnumConstant.ValueKind.STRING;
                numeric = false;
            } else {
                numeric = false;
            }
            constants.add(new EnumConstant(name, value, true, kind));
        }
        dialect.writeEnum(node, constants, ctx);
        return null;
    }

    /** 整数字面量（含负号）的值 */
    private static Long integralValue(Expression e) {
        boolean negative = false;
        if (e instanceof UnaryExpr && ((UnaryExpr) e).getOperator() == UnaryExpr.UnaryOp.NEG) {
            negative = true;
            e = ((UnaryExpr) e).getOperand();
        }
        if (!(e instanceof Literal) || !((Literal) e).isIntegral()) {
            return null;
        }
        try {
            long v = Long.parseLong(((Literal) e).getValue().replace("_", ""));
            return negative ? -v : v;
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private static Literal literal(Literal.LiteralKind kind, String value) {
        return new Literal(SourceSpan.UNKNOWN, kind, value);
    }

    @Override
    public Void visitFunctionDecl(FunctionDecl node, GenerationContext ctx) {
        if (ctx.getScope() == MemberScope.FUNCTION && !dialect.supportsNestedFunctions()) {
            ctx.writePlaceholder("statement", node.getKind());
            return null;
        }
        emitFunction(Signature.ofFunction(node, ctx.getScope()), node, ctx);
        return null;
    }

    @Override
    public Void visitVariableDecl(VariableDecl node, GenerationContext ctx) {
        boolean topLevel = ctx.getScope() == MemberScope.TOP_LEVEL || ctx.getScope() == MemberScope.NAMESPACE;
        for (VariableDecl.Declarator d : node.getDeclarators()) {
            boolean constant = topLevel && node.isConst();
            String targetName;
            if (constant) {
                targetName = NamingConventions.toConstantCase(d.getName());
            } else {
                targetName = dialect.getExpressionRenderer().localName(d.getName());
                if (!topLevel) {
                    CallableShape shape = ExpressionRenderer.shapeOf(d.getType());
                    if (shape == null) {
                        shape = ExpressionRenderer.shapeOf(d.getInitializer());
                    }
                    ctx.declareLocal(d.getName(), shape);
                }
            }
            dialect.writeVariable(node, d, targetName, constant, ctx);
        }
        return null;
    }

    @Override
    public Void visitModuleDecl(ModuleDecl node, GenerationContext ctx) {
        dialect.writeModule(node, ctx);
        return null;
    }

    @Override
    public Void visitImportDecl(ImportDecl node, GenerationContext ctx) {
        // 导入在分析阶段已登记
        return null;
    }

    @Override
    public Void visitTypeAliasDecl(TypeAliasDecl node, GenerationContext ctx) {
        dialect.writeTypeAlias(node, ctx);
        return null;
    }

    // ============ 语句 ============

    @Override
    public Void visitBlock(Block node, GenerationContext ctx) {
        dialect.openScope(ctx);
        emitAll(node.getStatements(), ctx);
        dialect.closeScope(ctx);
        return null;
    }

    @Override
    public Void visitExpressionStmt(ExpressionStmt node, GenerationContext ctx) {
        ctx.line(dialect.expressionStatement(ctx.render(node.getExpression())));
        return null;
    }

    @Override
    public Void visitIfStmt(IfStmt node, GenerationContext ctx) {
        dialect.openIf(ctx.render(node.getCondition()), ctx);
        emitBody(node.getThenBranch(), ctx);
        Statement rest = node.getElseBranch();
        while (rest instanceof IfStmt) {
            IfStmt elseIf = (IfStmt) rest;
            dialect.openElseIf(ctx.render(elseIf.getCondition()), ctx);
            emitBody(elseIf.getThenBranch(), ctx);
            rest = elseIf.getElseBranch();
        }
        if (rest != null) {
            dialect.openElse(ctx);
            emitBody(rest, ctx);
        }
        dialect.closeIf(ctx);
        return null;
    }

    @Override
    public Void visitForStmt(ForStmt node, GenerationContext ctx) {
        CountingLoop loop = CountingLoopMatcher.match(node);
        if (loop != null) {
            String variable = dialect.getExpressionRenderer().localName(loop.getVariable());
            String start = ctx.render(loop.getStart());
            String bound = ctx.render(loop.getBound());
            ctx.declareLocal(loop.getVariable(), null);
            dialect.openRangeLoop(variable, start, bound, loop.isCaptured(), ctx);
            ctx.pushLoop(null);
            emitBody(node.getBody(), ctx);
            ctx.popLoop();
            dialect.closeLoop(ctx);
            return null;
        }

        LOG.fine("计数循环回退为 while");
        dialect.openScope(ctx);
        if (node.getInitializer() != null) {
            emit(node.getInitializer(), ctx);
        }
        String condition = node.getCondition() != null
                ? ctx.render(node.getCondition())
                : ctx.render(literal(Literal.LiteralKind.BOOLEAN, "true"));
        String increment = node.getIncrementor() != null
                ? dialect.expressionStatement(ctx.render(node.getIncrementor()))
                : null;
        dialect.openWhile(condition, ctx);
        ctx.pushLoop(increment);
        emitBody(node.getBody(), ctx);
        ctx.popLoop();
        if (increment != null) {
            ctx.line(increment);
        }
        dialect.closeWhile(ctx);
        dialect.closeScope(ctx);
        return null;
    }

    @Override
    public Void visitForOfStmt(ForOfStmt node, GenerationContext ctx) {
        List<String> names = new ArrayList<>();
        for (String name : node.getVariableNames()) {
            ctx.declareLocal(name, null);
            names.add(dialect.getExpressionRenderer().localName(name));
        }
        dialect.openForEach(names, ctx.render(node.getIterable()), ctx);
        ctx.pushLoop(null);
        emitBody(node.getBody(), ctx);
        ctx.popLoop();
        dialect.closeLoop(ctx);
        return null;
    }

    @Override
    public Void visitWhileStmt(WhileStmt node, GenerationContext ctx) {
        dialect.openWhile(ctx.render(node.getCondition()), ctx);
        ctx.pushLoop(null);
        emitBody(node.getBody(), ctx);
        ctx.popLoop();
        dialect.closeWhile(ctx);
        return null;
    }

    @Override
    public Void visitDoWhileStmt(DoWhileStmt node, GenerationContext ctx) {
        dialect.openDoWhile(ctx);
        ctx.pushLoop(null);
        emitBody(node.getBody(), ctx);
        ctx.popLoop();
        dialect.closeDoWhile(ctx.render(node.getCondition()), ctx);
        return null;
    }

    @Override
    public Void visitSwitchStmt(SwitchStmt node, GenerationContext ctx) {
        List<SwitchClause> clauses = node.getClauses();
        List<List<Statement>> bodies = new ArrayList<>();
        boolean earlyBreak = false;
        boolean continues = false;
        for (SwitchClause clause : clauses) {
            List<Statement> body = clause.getStatements();
            if (!dialect.switchFallsThrough() && !body.isEmpty()
                    && body.get(body.size() - 1) instanceof BreakStmt
                    && ((BreakStmt) body.get(body.size() - 1)).getLabel() == null) {
                body = body.subList(0, body.size() - 1);
            }
            bodies.add(body);
            earlyBreak |= reachesJump(body, true);
            continues |= reachesJump(body, false);
        }

        // 分支中间的 break 在没有穿透语义的目标语言里需要显式跳出标签
        String tag = null;
        boolean capturesContinue = false;
        if (!dialect.switchFallsThrough() && earlyBreak) {
            tag = ctx.nextSwitchTag();
            capturesContinue = continues && ctx.continueEscapeTag() == null;
            LOG.fine("switch 分支内有提前 break，使用跳转标签 " + tag);
        }

        dialect.openSwitch(ctx.render(node.getSubject()), tag, capturesContinue, ctx);
        ctx.pushSwitch(tag);
        List<String> labels = new ArrayList<>();
        boolean includesDefault = false;
        for (int i = 0; i < clauses.size(); i++) {
            SwitchClause clause = clauses.get(i);
            if (clause.isDefault()) {
                includesDefault = true;
            } else {
                labels.add(ctx.render(clause.getLabel()));
            }
            if (clause.getStatements().isEmpty() && i < clauses.size() - 1) {
                continue;
            }
            dialect.openCase(labels, includesDefault, ctx);
            emitAll(bodies.get(i), ctx);
            dialect.closeCase(ctx);
            labels = new ArrayList<>();
            includesDefault = false;
        }
        ctx.popSwitch();
        dialect.closeSwitch(tag, capturesContinue, ctx);
        return null;
    }

    /**
     * 语句序列中是否有作用于外层的无标签跳转。
     *
     * @param breaks true 查找跳出当前 switch 的 break（嵌套 switch 内的不算），
     *               false 查找作用于外层循环的 continue；嵌套循环与函数内的都不算
     */
    static boolean reachesJump(List<Statement> statements, boolean breaks) {
        for (Statement statement : statements) {
            if (reachesJump(statement, breaks)) {
                return true;
            }
        }
        return false;
    }

    private static boolean reachesJump(Statement statement, boolean breaks) {
        if (statement instanceof BreakStmt) {
            return breaks && ((BreakStmt) statement).getLabel() == null;
        }
        if (statement instanceof ContinueStmt) {
            return !breaks && ((ContinueStmt) statement).getLabel() == null;
        }
        if (statement instanceof Block) {
            return reachesJump(((Block) statement).getStatements(), breaks);
        }
        if (statement instanceof IfStmt) {
            IfStmt ifStmt = (IfStmt) statement;
            return reachesJump(ifStmt.getThenBranch(), breaks)
                    || (ifStmt.getElseBranch() != null && reachesJump(ifStmt.getElseBranch(), breaks));
        }
        if (statement instanceof TryStmt) {
            TryStmt tryStmt = (TryStmt) statement;
            if (reachesJump(tryStmt.getTryBlock().getStatements(), breaks)) {
                return true;
            }
            if (tryStmt.getCatchClause() != null
                    && reachesJump(tryStmt.getCatchClause().getBody().getStatements(), breaks)) {
                return true;
            }
            return tryStmt.getFinallyBlock() != null
                    && reachesJump(tryStmt.getFinallyBlock().getStatements(), breaks);
        }
        if (statement instanceof SwitchStmt && !breaks) {
            for (SwitchClause clause : ((SwitchStmt) statement).getClauses()) {
                if (reachesJump(clause.getStatements(), false)) {
                    return true;
                }
            }
        }
        return false;
    }

    @Override
    public Void visitTryStmt(TryStmt node, GenerationContext ctx) {
        dialect.openTry(ctx);
        emitAll(node.getTryBlock().getStatements(), ctx);
        if (node.getCatchClause() != null) {
            String variable = node.getCatchClause().getVariableName();
            if (variable != null) {
                ctx.declareLocal(variable, null);
                variable = dialect.getExpressionRenderer().localName(variable);
            }
            dialect.openCatch(variable, ctx);
            emitAll(node.getCatchClause().getBody().getStatements(), ctx);
        }
        if (node.getFinallyBlock() != null) {
            dialect.openFinally(ctx);
            emitAll(node.getFinallyBlock().getStatements(), ctx);
        }
        dialect.closeTry(ctx);
        return null;
    }

    @Override
    public Void visitThrowStmt(ThrowStmt node, GenerationContext ctx) {
        ctx.line(dialect.throwStatement(node.getExpression(), ctx));
        return null;
    }

    @Override
    public Void visitReturnStmt(ReturnStmt node, GenerationContext ctx) {
        String value = node.getValue() != null ? ctx.render(node.getValue()) : null;
        ctx.line(dialect.returnStatement(value, ctx));
        return null;
    }

    @Override
    public Void visitBreakStmt(BreakStmt node, GenerationContext ctx) {
        ctx.line(dialect.breakStatement(ctx.currentBreakTag()));
        return null;
    }

    @Override
    public Void visitContinueStmt(ContinueStmt node, GenerationContext ctx) {
        String increment = ctx.currentLoopIncrement();
        if (increment != null) {
            ctx.line(increment);
        }
        ctx.line(dialect.continueStatement(ctx.continueEscapeTag()));
        return null;
    }

    @Override
    public Void visitUnsupportedStmt(UnsupportedStmt node, GenerationContext ctx) {
        ctx.writePlaceholder("statement", node.getKind());
        return null;
    }
}
