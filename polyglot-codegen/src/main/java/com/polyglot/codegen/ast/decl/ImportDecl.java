package com.polyglot.codegen.ast.decl;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.SourceSpan;
import com.polyglot.codegen.ast.StatementVisitor;

import java.util.Collections;
import java.util.List;

/**
 * 导入声明 {@code import Default, { A, B } from './module'}
 */
public class ImportDecl extends Declaration {
    private final String moduleSpecifier;
    private final String defaultBinding;
    private final String namespaceBinding;
    private final List<String> namedBindings;

    public ImportDecl(SourceSpan span, String moduleSpecifier, String defaultBinding,
                      String namespaceBinding, List<String> namedBindings) {
        super(span, Collections.emptyList(), moduleSpecifier);
        this.moduleSpecifier = moduleSpecifier;
        this.defaultBinding = defaultBinding;
        this.namespaceBinding = namespaceBinding;
        this.namedBindings = namedBindings;
    }

    public String getModuleSpecifier() {
        return moduleSpecifier;
    }

    public String getDefaultBinding() {
        return defaultBinding;
    }

    public String getNamespaceBinding() {
        return namespaceBinding;
    }

    public List<String> getNamedBindings() {
        return namedBindings;
    }

    /** 以 ./ 或 ../ 开头的相对模块 */
    public boolean isRelative() {
        return moduleSpecifier.startsWith("./") || moduleSpecifier.startsWith("../");
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitImportDecl(this, context);
    }

    @Override
    public String getKind() {
        return "ImportDeclaration";
    }

    @Override
    public List<AstNode> getChildren() {
        return Collections.emptyList();
    }
}
