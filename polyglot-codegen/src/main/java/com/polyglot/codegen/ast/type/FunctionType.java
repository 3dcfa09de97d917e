package com.polyglot.codegen.ast.type;

import com.polyglot.codegen.ast.AstNode;
import com.polyglot.codegen.ast.SourceSpan;
import com.polyglot.codegen.ast.decl.Parameter;

import java.util.List;

/**
 * 函数类型 {@code (a: A, b: B) => R}
 */
public class FunctionType extends TypeNode {
    private final List<Parameter> parameters;
    private final TypeNode returnType;

    public FunctionType(SourceSpan span, List<Parameter> parameters, TypeNode returnType) {
        super(span);
        this.parameters = parameters;
        this.returnType = returnType;
    }

    public List<Parameter> getParameters() {
        return parameters;
    }

    public TypeNode getReturnType() {
        return returnType;
    }

    /** 返回类型为 void（或未声明） */
    public boolean returnsVoid() {
        return returnType == null
                || (returnType instanceof KeywordType
                    && ((KeywordType) returnType).getKeyword() == KeywordType.Keyword.VOID);
    }

    @Override
    public <R> R accept(TypeNodeVisitor<R> visitor) {
        return visitor.visitFunction(this);
    }

    @Override
    public String getKind() {
        return "FunctionType";
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(parameters, returnType);
    }
}
