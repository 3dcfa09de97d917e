package com.polyglot.codegen.generator.java;

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
 * Java 类型映射。
 *
 * <p>顶层位置使用基本类型（double、boolean），类型实参位置使用包装类型。
 * 映射时把用到的 java.util / java.util.function 等类登记为导入。</p>
 */
public class JavaTypeMapper implements TypeMapper {

    private static final String OBJECT = "Object";

    @Override
    public String mapType(TypeNode type, ImportSet imports) {
        if (type == null) {
            return OBJECT;
        }
        return type.accept(new Mapping(imports, false));
    }

    /** 映射为可作类型实参的引用类型 */
    public String mapBoxed(TypeNode type, ImportSet imports) {
        if (type == null) {
            return OBJECT;
        }
        return type.accept(new Mapping(imports, true));
    }

    @Override
    public String untypedType() {
        return OBJECT;
    }

    @Override
    public String futureOf(TypeNode valueType, ImportSet imports) {
        imports.add("java.util.concurrent.CompletableFuture");
        return "CompletableFuture<" + mapBoxed(valueType, imports) + ">";
    }

    /** 基本类型的包装类型，非基本类型原样返回 */
    public static String box(String type) {
        switch (type) {
            case "double":  return "Double";
            case "int":     return "Integer";
            case "long":    return "Long";
            case "boolean": return "Boolean";
            case "void":    return "Void";
            default:        return type;
        }
    }

    public static boolean isPrimitive(String type) {
        return !box(type).equals(type);
    }

    private static final class Mapping implements TypeNodeVisitor<String> {
        private final ImportSet imports;
        private final boolean boxed;

        Mapping(ImportSet imports, boolean boxed) {
            this.imports = imports;
            this.boxed = boxed;
        }

        private String argument(TypeNode type) {
            return type == null ? OBJECT : type.accept(new Mapping(imports, true));
        }

        private String primitive(String type) {
            return boxed ? box(type) : type;
        }

        @Override
        public String visitKeyword(KeywordType type) {
            switch (type.getKeyword()) {
                case NUMBER:  return primitive("double");
                case STRING:  return "String";
                case BOOLEAN: return primitive("boolean");
                case VOID:
                case NEVER:   return primitive("void");
                case OBJECT:
                    imports.add("java.util.Map");
                    return "Map<String, Object>";
                case BIGINT:
                    imports.add("java.math.BigInteger");
                    return "BigInteger";
                default:      return OBJECT;
            }
        }

        @Override
        public String visitLiteral(LiteralType type) {
            switch (type.getLiteral().getLiteralKind()) {
                case STRING:  return "String";
                case NUMBER:  return primitive("double");
                case BOOLEAN: return primitive("boolean");
                default:      return OBJECT;
            }
        }

        @Override
        public String visitArray(ArrayType type) {
            imports.add("java.util.List");
            return "List<" + argument(type.getElementType()) + ">";
        }

        @Override
        public String visitTuple(TupleType type) {
            imports.add("java.util.List");
            return "List<Object>";
        }

        @Override
        public String visitUnion(UnionType type) {
            List<TypeNode> members = type.getNonNullishTypes();
            if (members.isEmpty()) {
                return OBJECT;
            }
            if (type.isNullableOfSingle()) {
                imports.add("java.util.Optional");
                return "Optional<" + argument(members.get(0)) + ">";
            }
            String first = members.get(0).accept(this);
            for (int i = 1; i < members.size(); i++) {
                if (!first.equals(members.get(i).accept(this))) {
                    return OBJECT;
                }
            }
            return members.size() < type.getTypes().size() ? box(first) : first;
        }

        @Override
        public String visitFunction(FunctionType type) {
            List<Parameter> params = type.getParameters();
            boolean returnsVoid = type.returnsVoid();
            switch (params.size()) {
                case 0:
                    if (returnsVoid) {
                        return "Runnable";
                    }
                    imports.add("java.util.function.Supplier");
                    return "Supplier<" + argument(type.getReturnType()) + ">";
                case 1:
                    if (returnsVoid) {
                        imports.add("java.util.function.Consumer");
                        return "Consumer<" + argument(params.get(0).getType()) + ">";
                    }
                    imports.add("java.util.function.Function");
                    return "Function<" + argument(params.get(0).getType()) + ", "
                            + argument(type.getReturnType()) + ">";
                case 2:
                    if (returnsVoid) {
                        imports.add("java.util.function.BiConsumer");
                        return "BiConsumer<" + argument(params.get(0).getType()) + ", "
                                + argument(params.get(1).getType()) + ">";
                    }
                    imports.add("java.util.function.BiFunction");
                    return "BiFunction<" + argument(params.get(0).getType()) + ", "
                            + argument(params.get(1).getType()) + ", " + argument(type.getReturnType()) + ">";
                default:
                    imports.add("java.util.function.Function");
                    return "Function";
            }
        }

        @Override
        public String visitReference(TypeReference type) {
            String name = type.getName();
            List<TypeNode> args = type.getTypeArguments();
            switch (name) {
                case "Array":
                case "ReadonlyArray":
                    imports.add("java.util.List");
                    return args.isEmpty() ? "List" : "List<" + argument(args.get(0)) + ">";
                case "Map":
                case "Record":
                    imports.add("java.util.Map");
                    return args.size() < 2 ? "Map"
                            : "Map<" + argument(args.get(0)) + ", " + argument(args.get(1)) + ">";
                case "Set":
                    imports.add("java.util.Set");
                    return args.isEmpty() ? "Set" : "Set<" + argument(args.get(0)) + ">";
                case "Promise":
                    imports.add("java.util.concurrent.CompletableFuture");
                    return args.isEmpty() ? "CompletableFuture"
                            : "CompletableFuture<" + argument(args.get(0)) + ">";
                case "Error":
                    return "RuntimeException";
                case "Object":
                    return OBJECT;
                default:
                    break;
            }
            if (args.isEmpty()) {
                return name;
            }
            StringBuilder sb = new StringBuilder(name).append('<');
            for (int i = 0; i < args.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(argument(args.get(i)));
            }
            return sb.append('>').toString();
        }

        @Override
        public String visitTypeLiteral(TypeLiteral type) {
            imports.add("java.util.Map");
            return "Map<String, Object>";
        }

        @Override
        public String visitUnsupported(UnsupportedType type) {
            return OBJECT;
        }
    }
}
