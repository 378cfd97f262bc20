package org.rtlsym.model;

import lombok.Getter;
import org.rtlsym.core.SignalSort;
import org.rtlsym.core.Variable;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 被省略信号的占位符：一个以 params 为参数的未解释函数。
 * hasFreeArgument 为 true 时额外带一个不携带信息的自由参数，代表未建模的自由度；
 * 自由参数的类型与信号自身的类型相同。
 * 此类是不可变的。
 */
@Getter
public final class UFPlaceholder {

    private final String name;
    private final SignalSort sort;
    private final List<Variable> params;
    private final boolean hasFreeArgument;

    private final int hashCode;

    public UFPlaceholder(String name, SignalSort sort, List<Variable> params, boolean hasFreeArgument) {
        this.name = Objects.requireNonNull(name, "UF name cannot be null.");
        this.sort = Objects.requireNonNull(sort, "UF sort cannot be null.");
        this.params = List.copyOf(Objects.requireNonNull(params, "UF params cannot be null."));
        this.hasFreeArgument = hasFreeArgument;
        this.hashCode = Objects.hash(name, sort, this.params, hasFreeArgument);
    }

    /**
     * 没有参数、带自由参数的占位符：每个周期都是完全不确定的值。
     */
    public static UFPlaceholder nondeterministic(String name, SignalSort sort) {
        return new UFPlaceholder(name, sort, List.of(), true);
    }

    public SignalSort getFreeArgumentSort() {
        return hasFreeArgument ? sort : null;
    }

    /**
     * 模型中对该信号的引用仍然是同名变量。
     */
    public Variable toVariable() {
        return Variable.of(name, sort);
    }

    public int getArity() {
        return params.size() + (hasFreeArgument ? 1 : 0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        UFPlaceholder that = (UFPlaceholder) o;
        return hasFreeArgument == that.hasFreeArgument &&
                name.equals(that.name) &&
                sort.equals(that.sort) &&
                params.equals(that.params);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        String args = params.stream().map(Variable::toString).collect(Collectors.joining(", "));
        return name + "(" + args + (hasFreeArgument ? (args.isEmpty() ? "" : ", ") + "<free>" : "") + ") : " + sort;
    }
}
