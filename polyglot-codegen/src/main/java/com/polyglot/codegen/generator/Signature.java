package com.polyglot.codegen.generator;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.Modifier;
import com.polyglot.codegen.ast.SourceSpan;
import com.polyglot.codegen.ast.decl.ClassDecl;
import com.polyglot.codegen.ast.decl.ConstructorDecl;
import com.polyglot.codegen.ast.decl.FunctionDecl;
import com.polyglot.codegen.ast.decl.FunctionLike;
import com.polyglot.codegen.ast.decl.MethodDecl;
import com.polyglot.codegen.ast.decl.Parameter;
import com.polyglot.codegen.ast.decl.TypeParameter;
import com.polyglot.codegen.ast.expr.ArrowFunction;
import com.polyglot.codegen.ast.stmt.Block;
import com.polyglot.codegen.ast.stmt.IfStmt;
import com.polyglot.codegen.ast.stmt.ReturnStmt;
import com.polyglot.codegen.ast.stmt.Statement;
import com.polyglot.codegen.ast.stmt.ThrowStmt;
import com.polyglot.codegen.ast.type.KeywordType;
import com.polyglot.codegen.ast.type.TypeNode;
import com.polyglot.codegen.ast.type.TypeReference;

import java.util.Collections;
import java.util.List;

/**
 * 函数、方法或构造器在生成阶段的统一签名视图。
 *
 * <p>异步函数的返回类型在这里解开 {@code Promise<T>}，方言只需对 {@link #getValueType()} 再包一层 future。
 * 未注解返回类型时根据函数体推断：没有带值的 return 视为 void。</p>
 */
public final class Signature {
    private static final TypeNode VOID = new KeywordType(SourceSpan.UNKNOWN, KeywordType.Keyword.VOID);

    private final String name;
    private final String ownerName;
    private final MemberScope scope;
    private final List<TypeParameter> typeParameters;
    private final List<Parameter> parameters;
    private final TypeNode valueType;
    private final Modifier visibility;
    private final boolean async;
    private final boolean isStatic;
    private final boolean isAbstract;
    private final boolean constructor;
    private final MethodDecl.AccessorKind accessorKind;

    private Signature(String name, String ownerName, MemberScope scope,
                      List<TypeParameter> typeParameters, List<Parameter> parameters,
                      TypeNode valueType, Modifier visibility, boolean async, boolean isStatic,
                      boolean isAbstract, boolean constructor, MethodDecl.AccessorKind accessorKind) {
        this.name = name;
        this.ownerName = ownerName;
        this.scope = scope;
        this.typeParameters = typeParameters != null ? typeParameters : Collections.<TypeParameter>emptyList();
        this.parameters = parameters != null ? parameters : Collections.<Parameter>emptyList();
        this.valueType = valueType;
        this.visibility = visibility;
        this.async = async;
        this.isStatic = isStatic;
        this.isAbstract = isAbstract;
        this.constructor = constructor;
        this.accessorKind = accessorKind;
    }

    public static Signature ofFunction(FunctionDecl fn, MemberScope scope) {
        Modifier visibility = fn.isExported() || scope != MemberScope.TOP_LEVEL ? Modifier.PUBLIC : null;
        return new Signature(fn.getName(), null, scope, fn.getTypeParameters(), fn.getParameters(),
                resolveValueType(fn), visibility, fn.isAsync(), true, false, false,
                MethodDecl.AccessorKind.NONE);
    }

    public static Signature ofMethod(MethodDecl method, String ownerName, MemberScope scope) {
        return new Signature(method.getName(), ownerName, scope, method.getTypeParameters(),
                method.getParameters(), resolveValueType(method), visibilityOf(method.getModifiers()),
                method.isAsync(), method.isStatic(), method.isAbstract() || method.getBody() == null,
                false, method.getAccessorKind());
    }

    public static Signature ofConstructor(ConstructorDecl ctor, ClassDecl owner) {
        return new Signature("constructor", owner.getName(), MemberScope.CLASS, null,
                ctor.getParameters(), VOID, visibilityOf(ctor.getModifiers()), false, false, false,
                true, MethodDecl.AccessorKind.NONE);
    }

    /** 值对象之外的类在没有显式构造器时合成的构造器签名 */
    public static Signature ofSynthesizedConstructor(ClassDecl owner, List<Parameter> parameters) {
        return new Signature("constructor", owner.getName(), MemberScope.CLASS, null, parameters,
                VOID, Modifier.PUBLIC, false, false, false, true, MethodDecl.AccessorKind.NONE);
    }

    private static Modifier visibilityOf(List<Modifier> modifiers) {
        if (modifiers.contains(Modifier.PRIVATE)) {
            return Modifier.PRIVATE;
        }
        if (modifiers.contains(Modifier.PROTECTED)) {
            return Modifier.PROTECTED;
        }
        return Modifier.PUBLIC;
    }

    /**
     * 解析返回值类型：异步函数去掉 Promise 包装；未注解时按函数体推断 void 或未知（null）
     */
    public static TypeNode resolveValueType(FunctionLike fn) {
        TypeNode declared = fn.getReturnType();
        if (declared != null) {
            if (fn.isAsync() && declared instanceof TypeReference
                    && "Promise".equals(((TypeReference) declared).getName())) {
                List<TypeNode> args = ((TypeReference) declared).getTypeArguments();
                return args.isEmpty() ? null : args.get(0);
            }
            return declared;
        }
        if (fn instanceof ArrowFunction && ((ArrowFunction) fn).hasExpressionBody()) {
            return null;
        }
        return returnsValue(fn.getBody()) ? null : VOID;
    }

    /**
     * 函数体中是否存在带值的 return（不进入嵌套函数与类）
     */
    public static boolean returnsValue(AstNode node) {
        if (node == null) {
            return false;
        }
        if (node instanceof ReturnStmt) {
            return ((ReturnStmt) node).getValue() != null;
        }
        for (AstNode child : node.getChildren()) {
            if (child instanceof ArrowFunction || child instanceof FunctionDecl || child instanceof ClassDecl) {
                continue;
            }
            if (returnsValue(child)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 语句序列执行完毕后是否可能落到末尾（即最后不是 return / throw）
     */
    public static boolean completesNormally(List<Statement> statements) {
        if (statements.isEmpty()) {
            return true;
        }
        return completesNormally(statements.get(statements.size() - 1));
    }

    private static boolean completesNormally(Statement last) {
        if (last instanceof ReturnStmt || last instanceof ThrowStmt) {
            return false;
        }
        if (last instanceof Block) {
            return completesNormally(((Block) last).getStatements());
        }
        if (last instanceof IfStmt) {
            IfStmt ifStmt = (IfStmt) last;
            return ifStmt.getElseBranch() == null
                    || completesNormally(ifStmt.getThenBranch())
                    || completesNormally(ifStmt.getElseBranch());
        }
        return true;
    }

    public String getName() {
        return name;
    }

    /** 所属类名，顶层函数为 null */
    public String getOwnerName() {
        return ownerName;
    }

    public MemberScope getScope() {
        return scope;
    }

    public List<TypeParameter> getTypeParameters() {
        return typeParameters;
    }

    public List<Parameter> getParameters() {
        return parameters;
    }

    /** 返回值类型（异步函数为 future 内的值类型），null 表示未知 */
    public TypeNode getValueType() {
        return valueType;
    }

    public boolean returnsVoid() {
        return isVoid(valueType);
    }

    /** void、undefined、never 都不产生返回值 */
    public static boolean isVoid(TypeNode type) {
        if (!(type instanceof KeywordType)) {
            return false;
        }
        KeywordType.Keyword keyword = ((KeywordType) type).getKeyword();
        return keyword == KeywordType.Keyword.VOID || keyword == KeywordType.Keyword.UNDEFINED
                || keyword == KeywordType.Keyword.NEVER;
    }

    /** PUBLIC / PROTECTED / PRIVATE；未导出的顶层函数为 null */
    public Modifier getVisibility() {
        return visibility;
    }

    public boolean isAsync() {
        return async;
    }

    public boolean isStatic() {
        return isStatic;
    }

    public boolean isAbstract() {
        return isAbstract;
    }

    public boolean isConstructor() {
        return constructor;
    }

    public MethodDecl.AccessorKind getAccessorKind() {
        return accessorKind;
    }

    @Override
    public String toString() {
        return "Signature(" + name + ", params=" + parameters.size() + (async ? ", async" : "") + ")";
    }
}
