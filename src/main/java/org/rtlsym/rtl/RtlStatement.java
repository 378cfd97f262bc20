package org.rtlsym.rtl;

import lombok.Getter;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * always 块中的语句：赋值 (阻塞或非阻塞)、if/else，或前端无法归类的语句。
 */
@Getter
public final class RtlStatement {

    public enum Kind {
        ASSIGN,
        IF,
        OPAQUE
    }

    private final Kind kind;
    private final RtlExpr target;
    private final RtlExpr value;
    private final boolean blocking;
    private final RtlExpr condition;
    private final List<RtlStatement> thenBranch;
    private final List<RtlStatement> elseBranch;
    private final String text;

    private RtlStatement(Kind kind, RtlExpr target, RtlExpr value, boolean blocking, RtlExpr condition,
                         List<RtlStatement> thenBranch, List<RtlStatement> elseBranch, String text) {
        this.kind = kind;
        this.target = target;
        this.value = value;
        this.blocking = blocking;
        this.condition = condition;
        this.thenBranch = List.copyOf(thenBranch);
        this.elseBranch = List.copyOf(elseBranch);
        this.text = text;
    }

    /**
     * 阻塞赋值 target = value。
     */
    public static RtlStatement assign(RtlExpr target, RtlExpr value) {
        return new RtlStatement(Kind.ASSIGN, Objects.requireNonNull(target), Objects.requireNonNull(value),
                true, null, List.of(), List.of(), null);
    }

    /**
     * 非阻塞赋值 target &lt;= value。
     */
    public static RtlStatement assignNonBlocking(RtlExpr target, RtlExpr value) {
        return new RtlStatement(Kind.ASSIGN, Objects.requireNonNull(target), Objects.requireNonNull(value),
                false, null, List.of(), List.of(), null);
    }

    public static RtlStatement ifThen(RtlExpr condition, List<RtlStatement> thenBranch) {
        return ifThenElse(condition, thenBranch, List.of());
    }

    public static RtlStatement ifThenElse(RtlExpr condition, List<RtlStatement> thenBranch, List<RtlStatement> elseBranch) {
        return new RtlStatement(Kind.IF, null, null, false, Objects.requireNonNull(condition),
                thenBranch, elseBranch, null);
    }

    public static RtlStatement opaque(String text) {
        return new RtlStatement(Kind.OPAQUE, null, null, false, null, List.of(), List.of(), Objects.requireNonNull(text));
    }

    @Override
    public String toString() {
        return switch (kind) {
            case ASSIGN -> target + (blocking ? " = " : " <= ") + value + ";";
            case IF -> "if (" + condition + ") {" + join(thenBranch) + "}"
                    + (elseBranch.isEmpty() ? "" : " else {" + join(elseBranch) + "}");
            case OPAQUE -> text;
        };
    }

    private static String join(List<RtlStatement> statements) {
        return statements.stream().map(RtlStatement::toString).collect(Collectors.joining(" ", " ", " "));
    }
}
