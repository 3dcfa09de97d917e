package com.polyglot.codegen.generator.ruby;

import com.polyglot.codegen.ast.decl.Parameter;
import com.polyglot.codegen.ast.type.ArrayType;
import com.polyglot.codegen.ast.type.FunctionType;
import com.polyglot.codegen.ast.type.KeywordType;
import com.polyglot.codegen.ast.type.LiteralType;
import com.polyglot.codegen.ast.type.TupleType;
import com.polyglot.codegen.ast.type.TypeLiteral;
import com.polyglot.codegen.ast.type.TypeNode;
import com.polyglot.codegen.ast.type.TypeNodeVisitor;
import com.polyglot.codegen.ast.type.TypeReference;
import com.polyglot.codegen.ast.type.UnionType;
import com.polyglot.codegen.ast.type.UnsupportedType;
import com.polyglot.codegen.generator.ImportSet;
import com.polyglot.codegen.generator.TypeMapper;

import java.util.List;

/**
 * Ruby 类型映射，产出 Sorbet 类型表达式。只在启用类型签名时使用。
 */
public class RubyTypeMapper implements TypeMapper {

    static final String SORBET_RUNTIME = "require 'sorbet-runtime'";
    static final String SET = "require 'set'";
    static final String CONCURRENT = "require 'concurrent'";

    private static final String UNTYPED = "T.untyped";

    @Override
    public String mapType(TypeNode type, ImportSet imports) {
        if (type == null) {
            imports.add(SORBET_RUNTIME);
            return UNTYPED;
        }
        String mapped = type.accept(new Mapping(imports));
        if (mapped.contains("T.") || mapped.contains("T::")) {
            imports.add(SORBET_RUNTIME);
        }
        return mapped;
    }

    @Override
    public String untypedType() {
        return UNTYPED;
    }

    @Override
    public String futureOf(TypeNode valueType, ImportSet imports) {
        imports.add(CONCURRENT);
        return "Concurrent::Promises::Future";
    }

    private static final class Mapping implements TypeNodeVisitor<String> {
        private final ImportSet imports;

        Mapping(ImportSet imports) {
            this.imports = imports;
        }

        private String map(TypeNode type) {
            return type == null ? UNTYPED : type.accept(this);
        }

        @Override
        public String visitKeyword(KeywordType type) {
            switch (type.getKeyword()) {
                case NUMBER:    return "Numeric";
                case STRING:    return "String";
                case BOOLEAN:   return "T::Boolean";
                case VOID:      return "void";
                case NEVER:     return "T.noreturn";
                case NULL:
                case UNDEFINED: return "NilClass";
                case OBJECT:    return "T::Hash[Symbol, T.untyped]";
                case BIGINT:    return "Integer";
                case SYMBOL:    return "Symbol";
                default:        return UNTYPED;
            }
        }

        @Override
        public String visitLiteral(LiteralType type) {
            switch (type.getLiteral().getLiteralKind()) {
                case STRING:  return "String";
                case NUMBER:  return "Numeric";
                case BOOLEAN: return "T::Boolean";
                default:      return "NilClass";
            }
        }

        @Override
        public String visitArray(ArrayType type) {
            return "T::Array[" + map(type.getElementType()) + "]";
        }

        @Override
        public String visitTuple(TupleType type) {
            return "T::Array[T.untyped]";
        }

        @Override
        public String visitUnion(UnionType type) {
            List<TypeNode> members = type.getNonNullishTypes();
            if (members.isEmpty()) {
                return "NilClass";
            }
            String first = map(members.get(0));
            for (int i = 1; i < members.size(); i++) {
                if (!first.equals(map(members.get(i)))) {
                    return UNTYPED;
                }
            }
            return members.size() < type.getTypes().size() ? "T.nilable(" + first + ")" : first;
        }

        @Override
        public String visitFunction(FunctionType type) {
            List<Parameter> params = type.getParameters();
            if (params.size() > 2) {
                return "Proc";
            }
            StringBuilder sb = new StringBuilder("T.proc");
            if (!params.isEmpty()) {
                sb.append(".params(");
                for (int i = 0; i < params.size(); i++) {
                    if (i > 0) {
                        sb.append(", ");
                    }
                    sb.append("arg").append(i).append(": ").append(map(params.get(i).getType()));
                }
                sb.append(')');
            }
            if (type.returnsVoid()) {
                sb.append(".void");
            } else {
                sb.append(".returns(").append(map(type.getReturnType())).append(')');
            }
            return sb.toString();
        }

        @Override
        public String visitReference(TypeReference type) {
            String name = type.getName();
            List<TypeNode> args = type.getTypeArguments();
            switch (name) {
                case "Array":
                case "ReadonlyArray":
                    return "T::Array[" + (args.isEmpty() ? UNTYPED : map(args.get(0))) + "]";
                case "Map":
                case "Record":
                    if (args.size() < 2) {
                        return "T::Hash[T.untyped, T.untyped]";
                    }
                    return "T::Hash[" + map(args.get(0)) + ", " + map(args.get(1)) + "]";
                case "Set":
                    imports.add(SET);
                    return "T::Set[" + (args.isEmpty() ? UNTYPED : map(args.get(0))) + "]";
                case "Promise":
                    imports.add(CONCURRENT);
                    return "Concurrent::Promises::Future";
                case "Error":
                    return "StandardError";
                case "Date":
                    return "Time";
                default:
                    break;
            }
            if (args.isEmpty()) {
                // 单字母视为泛型参数
                return isTypeParameterName(name) ? UNTYPED : name;
            }
            StringBuilder sb = new StringBuilder(name).append('[');
            for (int i = 0; i < args.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(map(args.get(i)));
            }
            return sb.append(']').toString();
        }

        @Override
        public String visitTypeLiteral(TypeLiteral type) {
            return "T::Hash[Symbol, T.untyped]";
        }

        @Override
        public String visitUnsupported(UnsupportedType type) {
            return UNTYPED;
        }
    }

    static boolean isTypeParameterName(String name) {
        return name.length() == 1 && Character.isUpperCase(name.charAt(0));
    }
}
