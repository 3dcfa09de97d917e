package com.polyglot.codegen.generator;

import com.polyglot.codegen.ast.CompilationUnit;
import com.polyglot.codegen.ast.decl.Parameter;
import com.polyglot.codegen.ast.expr.Expression;
import com.polyglot.codegen.ast.stmt.Statement;
import com.polyglot.codegen.ast.type.TypeNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * 单次生成调用的全部可变状态。每次 {@link CodeGenerator#generate} 新建一个，调用结束即丢弃。
 */
public class GenerationContext {
    private static final Logger LOG = Logger.getLogger(GenerationContext.class.getName());

    private final CompilationUnit unit;
    private final GeneratorConfig config;
    private final TargetDialect dialect;
    private final CodeGenerator generator;
    private final OutputWriter writer;
    private final ImportSet imports;
    private final Set<String> constants;
    private final Set<String> typeNames;
    private final Deque<Map<String, CallableShape>> locals;
    private final Deque<String> loopIncrements = new ArrayDeque<>();
    private final Deque<BreakTarget> breakTargets = new ArrayDeque<>();
    private final AtomicInteger switchTags;
    private final List<String> pendingNotes = new ArrayList<>();
    private MemberScope scope;

    public GenerationContext(CompilationUnit unit, GeneratorConfig config,
                             TargetDialect dialect, CodeGenerator generator) {
        this.unit = unit;
        this.config = config;
        this.dialect = dialect;
        this.generator = generator;
        this.writer = new OutputWriter(config.getIndentString());
        this.imports = new ImportSet();
        this.constants = new HashSet<>();
        this.typeNames = new HashSet<>();
        this.locals = new ArrayDeque<>();
        this.switchTags = new AtomicInteger();
        this.scope = MemberScope.TOP_LEVEL;
    }

    /** 派生上下文：独立的输出缓冲，共享导入与符号信息，用于渲染多行闭包体 */
    private GenerationContext(GenerationContext parent) {
        this.unit = parent.unit;
        this.config = parent.config;
        this.dialect = parent.dialect;
        this.generator = parent.generator;
        this.writer = new OutputWriter(config.getIndentString());
        this.imports = parent.imports;
        this.constants = parent.constants;
        this.typeNames = parent.typeNames;
        this.locals = new ArrayDeque<>(parent.locals);
        this.switchTags = parent.switchTags;
        this.scope = MemberScope.FUNCTION;
    }

    public GenerationContext fork() {
        return new GenerationContext(this);
    }

    public CompilationUnit getUnit() {
        return unit;
    }

    public GeneratorConfig getConfig() {
        return config;
    }

    public TargetDialect getDialect() {
        return dialect;
    }

    public OutputWriter getWriter() {
        return writer;
    }

    public ImportSet getImports() {
        return imports;
    }

    // ============ 输出 ============

    /**
     * 写一行代码。之前渲染表达式时积累的占位注释先写出。
     */
    public void line(String text) {
        flushNotes();
        writer.writeLine(text);
    }

    public void blankLine() {
        writer.blankLine();
    }

    public void indent() {
        writer.indent();
    }

    public void dedent() {
        writer.dedent();
    }

    /** 闭合代码块前调用，去掉块尾空行 */
    public void trimTrailingBlankLines() {
        writer.trimTrailingBlankLines();
    }

    /**
     * 立即写出一行占位注释，说明该节点种类未被处理
     */
    public void writePlaceholder(String category, String kind) {
        LOG.fine("未支持的" + category + "种类: " + kind);
        line(dialect.lineComment(placeholderText(category, kind)));
    }

    /**
     * 记录表达式级占位注释，在下一行代码写出前输出
     */
    public void notePlaceholder(String category, String kind) {
        LOG.fine("未支持的" + category + "种类: " + kind);
        pendingNotes.add(dialect.lineComment(placeholderText(category, kind)));
    }

    public void flushNotes() {
        if (pendingNotes.isEmpty()) {
            return;
        }
        List<String> notes = new ArrayList<>(pendingNotes);
        pendingNotes.clear();
        for (String note : notes) {
            writer.writeLine(note);
        }
    }

    static String placeholderText(String category, String kind) {
        return "TODO: unsupported " + category + " " + kind;
    }

    // ============ 委托 ============

    public void require(String entry) {
        imports.add(entry);
    }

    public String render(Expression expression) {
        return dialect.getExpressionRenderer().render(expression, this);
    }

    public String mapType(TypeNode type) {
        return dialect.getTypeMapper().mapType(type, imports);
    }

    public void emit(Statement statement) {
        generator.emit(statement, this);
    }

    public void emitAll(List<Statement> statements) {
        generator.emitAll(statements, this);
    }

    public void emitBody(Statement body) {
        generator.emitBody(body, this);
    }

    public void emitDeclarations(List<Statement> statements) {
        generator.emitDeclarations(statements, this);
    }

    /**
     * 在派生上下文中生成闭包体，返回相对当前行缩进 depth 层的多行文本
     *
     * @param parameters 闭包参数，在闭包作用域中登记
     */
    public String renderFunctionBody(List<Parameter> parameters, List<Statement> statements, int depth) {
        GenerationContext child = fork();
        child.pushScope();
        for (Parameter p : parameters) {
            child.declareLocal(p.getName(), ExpressionRenderer.shapeOf(p.getType()));
        }
        for (int i = 0; i < depth; i++) {
            child.indent();
        }
        child.emitAll(statements);
        child.flushNotes();
        child.trimTrailingBlankLines();
        StringBuilder sb = new StringBuilder();
        List<String> lines = child.writer.getLines();
        for (int i = 0; i < lines.size(); i++) {
            if (i > 0) {
                sb.append('\n');
            }
            sb.append(lines.get(i));
        }
        return sb.toString();
    }

    // ============ 符号 ============

    public void addConstant(String name) {
        constants.add(name);
    }

    /**
     * 名称是否指向顶层常量（未被局部变量遮蔽）
     */
    public boolean isConstant(String name) {
        return constants.contains(name) && !isLocal(name);
    }

    public void addTypeName(String name) {
        typeNames.add(name);
    }

    public boolean isTypeName(String name) {
        return typeNames.contains(name);
    }

    public void pushScope() {
        locals.push(new HashMap<String, CallableShape>());
    }

    public void popScope() {
        if (!locals.isEmpty()) {
            locals.pop();
        }
    }

    /**
     * 声明局部名称
     *
     * @param shape 可调用值的形状，普通值为 null
     */
    public void declareLocal(String name, CallableShape shape) {
        if (locals.isEmpty()) {
            pushScope();
        }
        locals.peek().put(name, shape);
    }

    public boolean isLocal(String name) {
        for (Map<String, CallableShape> frame : locals) {
            if (frame.containsKey(name)) {
                return true;
            }
        }
        return false;
    }

    /** 查找可调用局部名称的形状，非局部或非可调用返回 null */
    public CallableShape lookupCallable(String name) {
        Iterator<Map<String, CallableShape>> it = locals.iterator();
        while (it.hasNext()) {
            Map<String, CallableShape> frame = it.next();
            if (frame.containsKey(name)) {
                return frame.get(name);
            }
        }
        return null;
    }

    // ============ 循环与作用域状态 ============

    /**
     * 进入循环
     *
     * @param increment 回退 while 循环需要在 continue 前补写的更新语句，其他循环为 null
     */
    public void pushLoop(String increment) {
        loopIncrements.push(increment != null ? increment : "");
        breakTargets.push(BreakTarget.LOOP);
    }

    public void popLoop() {
        if (!loopIncrements.isEmpty()) {
            loopIncrements.pop();
        }
        if (!breakTargets.isEmpty()) {
            breakTargets.pop();
        }
    }

    /** 为需要跳转标签的 switch 分配本次生成内唯一的标签 */
    public String nextSwitchTag() {
        return "switch_" + switchTags.incrementAndGet();
    }

    /**
     * 进入 switch
     *
     * @param tag 跳出该 switch 所用的标签，不需要时为 null
     */
    public void pushSwitch(String tag) {
        breakTargets.push(new BreakTarget(tag));
    }

    public void popSwitch() {
        if (!breakTargets.isEmpty()) {
            breakTargets.pop();
        }
    }

    /** 无标签 break 的目标标签：最内层是循环或不带标签的 switch 时为 null */
    public String currentBreakTag() {
        return breakTargets.isEmpty() ? null : breakTargets.peek().tag;
    }

    /**
     * continue 需要穿过的最外层带标签 switch（位于最内层循环之内），没有则为 null
     */
    public String continueEscapeTag() {
        String outermost = null;
        for (BreakTarget target : breakTargets) {
            if (target == BreakTarget.LOOP) {
                break;
            }
            if (target.tag != null) {
                outermost = target.tag;
            }
        }
        return outermost;
    }

    /** 最内层循环在 continue 前需要补写的语句，没有则为 null */
    public String currentLoopIncrement() {
        if (loopIncrements.isEmpty() || loopIncrements.peek().isEmpty()) {
            return null;
        }
        return loopIncrements.peek();
    }

    public MemberScope getScope() {
        return scope;
    }

    /**
     * 切换作用域
     *
     * @return 之前的作用域，用于恢复
     */
    public MemberScope enterScope(MemberScope newScope) {
        MemberScope previous = scope;
        scope = newScope;
        return previous;
    }

    /** break 的目标：循环，或 switch（可带跳转标签） */
    private static final class BreakTarget {
        static final BreakTarget LOOP = new BreakTarget(null);

        final String tag;

        BreakTarget(String tag) {
            this.tag = tag;
        }
    }
}
