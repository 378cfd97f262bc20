package org.rtlsym.rtl;

import lombok.Getter;
import org.rtlsym.core.SignalSort;

import java.math.BigInteger;
import java.util.Objects;

/**
 * 模块中声明的一个信号：名称、位宽、种类，以及可选的存储器长度与初值。
 */
@Getter
public final class RtlSignal {

    private final String name;
    private final int width;
    private final SignalKind kind;
    // > 0 表示非打包数组 (存储器)
    private final int arrayLength;
    private final BigInteger initValue;

    public RtlSignal(String name, int width, SignalKind kind, int arrayLength, BigInteger initValue) {
        this.name = Objects.requireNonNull(name, "Signal name cannot be null.");
        this.kind = Objects.requireNonNull(kind, "Signal kind cannot be null.");
        if (width < 1) {
            throw new IllegalArgumentException("Signal " + name + " must have a positive width, got " + width);
        }
        if (arrayLength < 0) {
            throw new IllegalArgumentException("Signal " + name + " has negative array length " + arrayLength);
        }
        this.width = width;
        this.arrayLength = arrayLength;
        this.initValue = initValue;
    }

    public RtlSignal(String name, int width, SignalKind kind) {
        this(name, width, kind, 0, null);
    }

    public boolean isArray() {
        return arrayLength > 0;
    }

    public boolean hasInitValue() {
        return initValue != null;
    }

    /**
     * 宽度为 1 的信号为布尔类型，存储器为数组类型。
     */
    public SignalSort getSort() {
        return isArray() ? SignalSort.memory(arrayLength, width) : SignalSort.ofWidth(width);
    }

    @Override
    public String toString() {
        String range = width == 1 ? "" : "[" + (width - 1) + ":0] ";
        String array = isArray() ? " [0:" + (arrayLength - 1) + "]" : "";
        return kind.name().toLowerCase() + " " + range + name + array;
    }
}
