package org.rtlsym.guidance;

import com.microsoft.z3.BoolExpr;
import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;

import java.util.*;

/**
 * 一个信号的标注，构造时确定形式：按周期、按谓词或所有周期统一。
 * 此类是不可变的。
 */
@Getter
public final class CycleAnnotation {

    public enum Shape {
        BY_CYCLE,
        BY_PREDICATE,
        UNIFORM
    }

    private final Shape shape;
    private final SortedMap<Integer, AnnotationKind> cycles;
    // 有序：多个谓词同时成立时第一个生效
    private final List<Pair<BoolExpr, AnnotationKind>> predicates;
    private final AnnotationKind uniformKind;

    private CycleAnnotation(Shape shape, SortedMap<Integer, AnnotationKind> cycles,
                            List<Pair<BoolExpr, AnnotationKind>> predicates, AnnotationKind uniformKind) {
        this.shape = shape;
        this.cycles = Collections.unmodifiableSortedMap(cycles);
        this.predicates = List.copyOf(predicates);
        this.uniformKind = uniformKind;
    }

    public static CycleAnnotation byCycle(Map<Integer, AnnotationKind> cycles) {
        Objects.requireNonNull(cycles, "Cycle map cannot be null.");
        cycles.forEach((cycle, kind) -> {
            Objects.requireNonNull(cycle, "Cycle cannot be null.");
            Objects.requireNonNull(kind, "Annotation kind cannot be null.");
        });
        return new CycleAnnotation(Shape.BY_CYCLE, new TreeMap<>(cycles), List.of(), null);
    }

    /**
     * 列表下标即周期。
     */
    public static CycleAnnotation byCycleList(List<AnnotationKind> kinds) {
        Map<Integer, AnnotationKind> cycles = new TreeMap<>();
        for (int i = 0; i < kinds.size(); i++) {
            cycles.put(i, kinds.get(i));
        }
        return byCycle(cycles);
    }

    public static CycleAnnotation byPredicate(List<Pair<BoolExpr, AnnotationKind>> predicates) {
        Objects.requireNonNull(predicates, "Predicate list cannot be null.");
        return new CycleAnnotation(Shape.BY_PREDICATE, new TreeMap<>(), predicates, null);
    }

    public static CycleAnnotation uniform(AnnotationKind kind) {
        Objects.requireNonNull(kind, "Annotation kind cannot be null.");
        return new CycleAnnotation(Shape.UNIFORM, new TreeMap<>(), List.of(), kind);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        CycleAnnotation that = (CycleAnnotation) o;
        return shape == that.shape && cycles.equals(that.cycles)
                && predicates.equals(that.predicates) && uniformKind == that.uniformKind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(shape, cycles, predicates, uniformKind);
    }

    @Override
    public String toString() {
        return switch (shape) {
            case BY_CYCLE -> "byCycle" + cycles;
            case BY_PREDICATE -> "byPredicate" + predicates;
            case UNIFORM -> "uniform(" + uniformKind + ")";
        };
    }
}
