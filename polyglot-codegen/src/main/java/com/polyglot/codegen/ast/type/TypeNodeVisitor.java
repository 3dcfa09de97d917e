package com.polyglot.codegen.ast.type;

/**
 * 类型节点访问者，用于替代 instanceof 分派。
 */
public interface TypeNodeVisitor<R> {
    R visitKeyword(KeywordType type);
    R visitLiteral(LiteralType type);
    R visitArray(ArrayType type);
    R visitTuple(TupleType type);
    R visitUnion(UnionType type);
    R visitFunction(FunctionType type);
    R visitReference(TypeReference type);
    R visitTypeLiteral(TypeLiteral type);
    R visitUnsupported(UnsupportedType type);
}
