package org.rtlsym.rtl;

import lombok.Getter;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 前端解析得到的 RTL 表达式树节点。
 * 此类是不可变的；各字段只在对应的 Kind 下有意义。
 */
@Getter
public final class RtlExpr {

    public enum Kind {
        REF,
        LITERAL,
        UNARY,
        BINARY,
        TERNARY,
        INDEX,
        SLICE,
        CONCAT,
        OPAQUE
    }

    private final Kind kind;
    // REF 的信号名，OPAQUE 的原始文本
    private final String name;
    private final BigInteger value;
    // LITERAL 的位宽，0 表示未指定位宽
    private final int width;
    private final UnaryOperator unaryOperator;
    private final BinaryOperator binaryOperator;
    private final List<RtlExpr> operands;
    private final int hi;
    private final int lo;

    private RtlExpr(Kind kind, String name, BigInteger value, int width, UnaryOperator unaryOperator,
                    BinaryOperator binaryOperator, List<RtlExpr> operands, int hi, int lo) {
        this.kind = kind;
        this.name = name;
        this.value = value;
        this.width = width;
        this.unaryOperator = unaryOperator;
        this.binaryOperator = binaryOperator;
        this.operands = List.copyOf(operands);
        this.hi = hi;
        this.lo = lo;
    }

    public static RtlExpr ref(String name) {
        Objects.requireNonNull(name, "Signal name cannot be null.");
        return new RtlExpr(Kind.REF, name, null, 0, null, null, List.of(), 0, 0);
    }

    /**
     * 带位宽的常量，如 3'h1。
     */
    public static RtlExpr literal(long value, int width) {
        if (width < 1) {
            throw new IllegalArgumentException("Sized literal must have a positive width, got " + width);
        }
        return new RtlExpr(Kind.LITERAL, null, BigInteger.valueOf(value), width, null, null, List.of(), 0, 0);
    }

    /**
     * 不带位宽的常量，位宽由上下文决定。
     */
    public static RtlExpr unsized(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("Unsized literal must be non-negative, got " + value);
        }
        return new RtlExpr(Kind.LITERAL, null, BigInteger.valueOf(value), 0, null, null, List.of(), 0, 0);
    }

    public static RtlExpr unary(UnaryOperator op, RtlExpr operand) {
        return new RtlExpr(Kind.UNARY, null, null, 0, Objects.requireNonNull(op), null, List.of(operand), 0, 0);
    }

    public static RtlExpr binary(BinaryOperator op, RtlExpr left, RtlExpr right) {
        return new RtlExpr(Kind.BINARY, null, null, 0, null, Objects.requireNonNull(op), List.of(left, right), 0, 0);
    }

    public static RtlExpr ternary(RtlExpr condition, RtlExpr then, RtlExpr otherwise) {
        return new RtlExpr(Kind.TERNARY, null, null, 0, null, null, List.of(condition, then, otherwise), 0, 0);
    }

    /**
     * base[index]：位向量的单个位，或存储器的一个元素。
     */
    public static RtlExpr index(RtlExpr base, RtlExpr index) {
        return new RtlExpr(Kind.INDEX, null, null, 0, null, null, List.of(base, index), 0, 0);
    }

    public static RtlExpr slice(RtlExpr base, int hi, int lo) {
        if (hi < lo || lo < 0) {
            throw new IllegalArgumentException("Illegal slice [" + hi + ":" + lo + "]");
        }
        return new RtlExpr(Kind.SLICE, null, null, 0, null, null, List.of(base), hi, lo);
    }

    /**
     * {parts[0], parts[1], ...}，parts[0] 为最高位。
     */
    public static RtlExpr concat(RtlExpr... parts) {
        if (parts.length == 0) {
            throw new IllegalArgumentException("Concatenation needs at least one part");
        }
        return new RtlExpr(Kind.CONCAT, null, null, 0, null, null, Arrays.asList(parts), 0, 0);
    }

    /**
     * 前端无法归类的构造，保留原始文本以便报错。
     */
    public static RtlExpr opaque(String text) {
        return new RtlExpr(Kind.OPAQUE, Objects.requireNonNull(text), null, 0, null, null, List.of(), 0, 0);
    }

    public RtlExpr operand(int i) {
        return operands.get(i);
    }

    public boolean isSized() {
        return kind == Kind.LITERAL && width > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        RtlExpr that = (RtlExpr) o;
        return kind == that.kind && width == that.width && hi == that.hi && lo == that.lo &&
                Objects.equals(name, that.name) && Objects.equals(value, that.value) &&
                unaryOperator == that.unaryOperator && binaryOperator == that.binaryOperator &&
                operands.equals(that.operands);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, name, value, width, unaryOperator, binaryOperator, operands, hi, lo);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case REF, OPAQUE -> name;
            case LITERAL -> width > 0 ? width + "'d" + value : value.toString();
            case UNARY -> unaryOperator.getSymbol() + operand(0);
            case BINARY -> "(" + operand(0) + " " + binaryOperator.getSymbol() + " " + operand(1) + ")";
            case TERNARY -> "(" + operand(0) + " ? " + operand(1) + " : " + operand(2) + ")";
            case INDEX -> operand(0) + "[" + operand(1) + "]";
            case SLICE -> operand(0) + "[" + hi + ":" + lo + "]";
            case CONCAT -> operands.stream().map(RtlExpr::toString).collect(Collectors.joining(", ", "{", "}"));
        };
    }
}
