package org.rtlsym.rtl;

import lombok.Getter;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 一个 always 块：时钟触发 (posedge clock) 或组合 (always @*)。
 */
@Getter
public final class AlwaysBlock {

    private final String clock;
    private final List<RtlStatement> statements;

    private AlwaysBlock(String clock, List<RtlStatement> statements) {
        this.clock = clock;
        this.statements = List.copyOf(Objects.requireNonNull(statements, "Statements cannot be null."));
    }

    public static AlwaysBlock clocked(String clock, List<RtlStatement> statements) {
        return new AlwaysBlock(Objects.requireNonNull(clock, "Clock cannot be null."), statements);
    }

    public static AlwaysBlock combinational(List<RtlStatement> statements) {
        return new AlwaysBlock(null, statements);
    }

    public boolean isClocked() {
        return clock != null;
    }

    public Optional<String> clockName() {
        return Optional.ofNullable(clock);
    }

    @Override
    public String toString() {
        return (isClocked() ? "always @(posedge " + clock + ")" : "always @*") + " " + statements;
    }
}
