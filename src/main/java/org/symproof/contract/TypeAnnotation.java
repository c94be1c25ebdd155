package org.symproof.contract;

import lombok.Getter;
import org.symproof.core.Sort;
import org.symproof.expressions.terms.Term;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 解析后的类型：基础 sort 加上细化约束。
 */
@Getter
public final class TypeAnnotation {

    public static final TypeAnnotation INT = new TypeAnnotation(Sort.INT, List.of());
    public static final TypeAnnotation REAL = new TypeAnnotation(Sort.REAL, List.of());
    public static final TypeAnnotation BOOL = new TypeAnnotation(Sort.BOOL, List.of());

    private final Sort sort;
    private final List<Refinement> refinements;

    private TypeAnnotation(Sort sort, List<Refinement> refinements) {
        this.sort = sort;
        this.refinements = List.copyOf(refinements);
    }

    public static TypeAnnotation of(Sort sort, Refinement... refinements) {
        return of(sort, Arrays.asList(refinements));
    }

    public static TypeAnnotation of(Sort sort, List<Refinement> refinements) {
        Objects.requireNonNull(sort, "Sort cannot be null");
        return new TypeAnnotation(sort, refinements);
    }

    /**
     * 追加更多细化约束，基础 sort 不变。
     */
    public TypeAnnotation refine(List<Refinement> more) {
        List<Refinement> all = new ArrayList<>(refinements);
        all.addAll(more);
        return new TypeAnnotation(sort, all);
    }

    public boolean isRefined() {
        return !refinements.isEmpty();
    }

    public List<Term> constraintsOn(Term subject) {
        List<Term> formulas = new ArrayList<>();
        for (Refinement refinement : refinements) {
            formulas.addAll(refinement.expand(subject));
        }
        return formulas;
    }

    private static String baseName(Sort sort) {
        return switch (sort) {
            case INT -> "int";
            case REAL -> "float";
            case BOOL -> "bool";
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TypeAnnotation that)) {
            return false;
        }
        return sort == that.sort && refinements.equals(that.refinements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sort, refinements);
    }

    @Override
    public String toString() {
        if (refinements.isEmpty()) {
            return baseName(sort);
        }
        return refinements.stream().map(Refinement::toString)
                .collect(Collectors.joining(", ", "Annotated[" + baseName(sort) + ", ", "]"));
    }
}
