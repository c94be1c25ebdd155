package org.symproof.contract;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.symproof.core.Sort;
import org.symproof.lang.ast.Attribute;
import org.symproof.lang.ast.Call;
import org.symproof.lang.ast.Expr;
import org.symproof.lang.ast.Name;
import org.symproof.lang.ast.NumberLiteral;
import org.symproof.lang.ast.Subscript;
import org.symproof.lang.ast.TupleExpr;
import org.symproof.lang.ast.UnaryOp;
import org.symproof.lang.ast.UnaryOperator;
import org.symproof.utils.Rational;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 把源码中的类型注解解析为 {@link TypeAnnotation}。
 * 支持 int、float、bool、Annotated[base, 标记...]（可嵌套），
 * 内置别名 Positive、NonNegative、UnitInterval，以及调用方注册的别名。
 * 没有注解的参数按 float 处理。
 */
public final class TypeResolver {

    private static final Logger logger = LoggerFactory.getLogger(TypeResolver.class);

    private static final Map<String, TypeAnnotation> BUILTIN_ALIASES = Map.of(
            "Positive", TypeAnnotation.of(Sort.REAL, Refinement.gt(0)),
            "NonNegative", TypeAnnotation.of(Sort.REAL, Refinement.ge(0)),
            "UnitInterval", TypeAnnotation.of(Sort.REAL, Refinement.between(0, 1)));

    private final Map<String, TypeAnnotation> aliases;

    public TypeResolver() {
        this(Map.of());
    }

    /**
     * @param aliases 调用方注册的别名，优先于内置别名。
     */
    public TypeResolver(Map<String, TypeAnnotation> aliases) {
        this.aliases = new HashMap<>(BUILTIN_ALIASES);
        this.aliases.putAll(aliases);
    }

    /**
     * 解析注解。
     * @param annotation 注解表达式，null 表示未注解。
     * @throws UnsupportedTypeException 注解无法映射到 sort。
     */
    public TypeAnnotation resolve(Expr annotation) {
        if (annotation == null) {
            return TypeAnnotation.REAL;
        }
        TypeAnnotation resolved = resolveType(annotation);
        logger.debug("注解 {} 解析为 {}", annotation, resolved);
        return resolved;
    }

    private TypeAnnotation resolveType(Expr annotation) {
        String name = simpleName(annotation);
        if (name != null) {
            switch (name) {
                case "int":
                    return TypeAnnotation.INT;
                case "float":
                    return TypeAnnotation.REAL;
                case "bool":
                    return TypeAnnotation.BOOL;
                default:
                    TypeAnnotation alias = aliases.get(name);
                    if (alias != null) {
                        return alias;
                    }
            }
        }
        if (annotation instanceof Subscript subscript && "Annotated".equals(simpleName(subscript.getValue()))) {
            if (!(subscript.getIndex() instanceof TupleExpr args) || args.getElements().size() < 2) {
                throw unsupported(annotation, "Annotated needs a base type and at least one marker");
            }
            List<Expr> elements = args.getElements();
            TypeAnnotation base = resolveType(elements.get(0));
            List<Refinement> markers = new ArrayList<>();
            for (Expr marker : elements.subList(1, elements.size())) {
                markers.addAll(marker(marker));
            }
            return base.refine(markers);
        }
        throw unsupported(annotation, "No sort for type annotation '" + annotation + "'");
    }

    private List<Refinement> marker(Expr marker) {
        if (marker instanceof Call call && call.getKeywords().isEmpty()) {
            String kind = simpleName(call.getFunction());
            List<Expr> args = call.getArguments();
            if (kind != null) {
                switch (kind) {
                    case "Gt":
                        return List.of(Refinement.gt(bound(call, args, 1).get(0)));
                    case "Ge":
                        return List.of(Refinement.ge(bound(call, args, 1).get(0)));
                    case "Lt":
                        return List.of(Refinement.lt(bound(call, args, 1).get(0)));
                    case "Le":
                        return List.of(Refinement.le(bound(call, args, 1).get(0)));
                    case "NotEq":
                        return List.of(Refinement.notEq(bound(call, args, 1).get(0)));
                    case "Between": {
                        List<Number> bounds = bound(call, args, 2);
                        return List.of(Refinement.between(bounds.get(0), bounds.get(1)));
                    }
                    default:
                        break;
                }
            }
        }
        // 嵌套的 Annotated 或别名作为标记时，只取其细化约束
        return resolveType(marker).getRefinements();
    }

    private List<Number> bound(Call call, List<Expr> args, int expected) {
        if (args.size() != expected) {
            throw unsupported(call, "Marker '" + call + "' expects " + expected + " numeric argument(s)");
        }
        List<Number> values = new ArrayList<>();
        for (Expr arg : args) {
            values.add(numericConstant(arg, call));
        }
        return values;
    }

    private Number numericConstant(Expr expr, Call owner) {
        if (expr instanceof NumberLiteral literal) {
            return toNumber(literal);
        }
        if (expr instanceof UnaryOp unary && unary.getOperand() instanceof NumberLiteral literal) {
            if (unary.getOperator() == UnaryOperator.NEG) {
                Number n = toNumber(literal);
                return n instanceof BigDecimal d ? d.negate() : (Number) (-n.longValue());
            }
            if (unary.getOperator() == UnaryOperator.POS) {
                return toNumber(literal);
            }
        }
        throw unsupported(owner, "Marker '" + owner + "' needs constant numeric bounds");
    }

    private static Number toNumber(NumberLiteral literal) {
        Rational value = literal.getValue();
        if (literal.isFloating() || !value.isInteger()) {
            return new BigDecimal(value.getNumerator()).divide(new BigDecimal(value.getDenominator()));
        }
        return value.getNumerator().longValueExact();
    }

    private static String simpleName(Expr expr) {
        if (expr instanceof Name name) {
            return name.getId();
        }
        if (expr instanceof Attribute attribute) {
            // typing.Annotated、annotated_types.Gt 之类的限定名只看最后一段
            return attribute.getAttribute();
        }
        return null;
    }

    private static UnsupportedTypeException unsupported(Expr at, String message) {
        return new UnsupportedTypeException(message, at.getLine());
    }
}
