package org.rtlsym.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 模型的来源标记：一组 GenerationKind。
 * 此类是不可变的，union/with 返回新的实例。
 */
public final class Provenance {

    private static final Logger logger = LoggerFactory.getLogger(Provenance.class);

    public static final Provenance HANDWRITTEN = of(GenerationKind.HANDWRITTEN);
    public static final Provenance SYNTAX_GENERATED = of(GenerationKind.SYNTAX_GENERATED);

    private final Set<GenerationKind> kinds;

    private Provenance(Set<GenerationKind> kinds) {
        this.kinds = Collections.unmodifiableSet(kinds);
    }

    public static Provenance of(GenerationKind first, GenerationKind... rest) {
        return new Provenance(EnumSet.of(first, rest));
    }

    public Provenance union(Provenance other) {
        EnumSet<GenerationKind> merged = EnumSet.noneOf(GenerationKind.class);
        merged.addAll(this.kinds);
        merged.addAll(other.kinds);
        logger.debug("合并来源标记: {} ∪ {}", this, other);
        return new Provenance(merged);
    }

    public Provenance with(GenerationKind kind) {
        return union(of(kind));
    }

    public boolean contains(GenerationKind kind) {
        return kinds.contains(kind);
    }

    public Set<GenerationKind> getKinds() {
        return kinds;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return kinds.equals(((Provenance) o).kinds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kinds);
    }

    @Override
    public String toString() {
        return kinds.stream().map(Enum::name).collect(Collectors.joining("|"));
    }
}
