package com.polyglot.codegen.ast;

import com.polyglot.codegen.ast.stmt.Statement;

import java.util.List;

/**
 * 编译单元（一个源文件）
 */
public class CompilationUnit extends AstNode {
    private final String fileName;
    private final String sourceText;
    private final List<Statement> statements;

    public CompilationUnit(String fileName, String sourceText, List<Statement> statements) {
        super(sourceText != null ? new SourceSpan(0, sourceText.length()) : SourceSpan.UNKNOWN);
        this.fileName = fileName;
        this.sourceText = sourceText;
        this.statements = statements;
    }

    public String getFileName() {
        return fileName;
    }

    public String getSourceText() {
        return sourceText;
    }

    public List<Statement> getStatements() {
        return statements;
    }

    /**
     * 取区间对应的源码；无源码或区间越界时返回空串
     */
    public String textOf(SourceSpan s) {
        if (s == null || !s.isKnown()) {
            return "";
        }
        return slice(s.getPos(), s.getEnd());
    }

    public String textOf(CommentRange range) {
        return slice(range.getPos(), range.getEnd());
    }

    private String slice(int pos, int end) {
        if (sourceText == null || pos < 0 || end > sourceText.length() || end < pos) {
            return "";
        }
        return sourceText.substring(pos, end);
    }

    @Override
    public String getKind() {
        return "SourceFile";
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(statements);
    }
}
