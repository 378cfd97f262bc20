package org.rtlsym.core;

import com.microsoft.z3.Context;
import com.microsoft.z3.Sort;
import lombok.Getter;
import org.rtlsym.expressions.ToZ3Sort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 信号的类型：布尔、定宽位向量或数组 (index -> element)。
 * 宽度为 1 的信号统一视为布尔类型。
 * 此类是不可变的，按结构比较。
 * @author Ayalyt
 */
@Getter
public final class SignalSort implements ToZ3Sort {

    private static final Logger logger = LoggerFactory.getLogger(SignalSort.class);

    public enum Kind {
        BOOL,
        BITVECTOR,
        ARRAY
    }

    public static final SignalSort BOOL = new SignalSort(Kind.BOOL, 1, null, null);

    private final Kind kind;
    // 布尔为 1，数组为 0
    private final int width;
    private final SignalSort indexSort;
    private final SignalSort elementSort;

    private final int hashCode;

    private SignalSort(Kind kind, int width, SignalSort indexSort, SignalSort elementSort) {
        this.kind = kind;
        this.width = width;
        this.indexSort = indexSort;
        this.elementSort = elementSort;
        this.hashCode = Objects.hash(kind, width, indexSort, elementSort);
    }

    public static SignalSort bool() {
        return BOOL;
    }

    public static SignalSort bitVector(int width) {
        if (width < 1) {
            logger.error("位向量宽度必须为正数: {}", width);
            throw new IllegalArgumentException("Bit-vector width must be positive, got " + width);
        }
        return new SignalSort(Kind.BITVECTOR, width, null, null);
    }

    /**
     * 按 RTL 宽度选择类型：宽度 1 为布尔，否则为位向量。
     */
    public static SignalSort ofWidth(int width) {
        return width == 1 ? BOOL : bitVector(width);
    }

    public static SignalSort array(SignalSort indexSort, SignalSort elementSort) {
        Objects.requireNonNull(indexSort, "Index sort cannot be null.");
        Objects.requireNonNull(elementSort, "Element sort cannot be null.");
        if (indexSort.isArray() || elementSort.isArray()) {
            throw new IllegalArgumentException("Nested array sorts are not supported: [" + indexSort + "]" + elementSort);
        }
        return new SignalSort(Kind.ARRAY, 0, indexSort, elementSort);
    }

    /**
     * 为长度为 length 的存储器选择下标类型：至少 1 位、足以表示 length - 1 的位向量。
     */
    public static SignalSort memory(int length, int elementWidth) {
        if (length < 1) {
            throw new IllegalArgumentException("Memory length must be positive, got " + length);
        }
        int indexBits = Math.max(1, 32 - Integer.numberOfLeadingZeros(length - 1));
        return array(bitVector(indexBits), ofWidth(elementWidth));
    }

    public boolean isBool() {
        return kind == Kind.BOOL;
    }

    public boolean isBitVector() {
        return kind == Kind.BITVECTOR;
    }

    public boolean isArray() {
        return kind == Kind.ARRAY;
    }

    @Override
    public Sort toZ3Sort(Context ctx) {
        return switch (kind) {
            case BOOL -> ctx.mkBoolSort();
            case BITVECTOR -> ctx.mkBitVecSort(width);
            case ARRAY -> ctx.mkArraySort(indexSort.toZ3Sort(ctx), elementSort.toZ3Sort(ctx));
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SignalSort that = (SignalSort) o;
        return kind == that.kind &&
                width == that.width &&
                Objects.equals(indexSort, that.indexSort) &&
                Objects.equals(elementSort, that.elementSort);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case BOOL -> "bool";
            case BITVECTOR -> "bv" + width;
            case ARRAY -> "[" + indexSort + "]" + elementSort;
        };
    }
}
