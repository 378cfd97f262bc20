package org.rtlsym.core;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import lombok.Getter;
import org.rtlsym.expressions.ToZ3Expr;
import org.rtlsym.symbolic.TermManager;

import java.util.Objects;

/**
 * 一个具名、带类型的信号变量 (name, sort)。
 * 名称中的 '.' 保留给层次化引用 (instanceName.portName)，声明的变量名不应包含它；
 * 这一点由 Model 的校验检查，而不是在这里拒绝。
 * @author Ayalyt
 */
@Getter
public final class Variable implements Comparable<Variable>, ToZ3Expr {

    private final String name;
    private final SignalSort sort;

    private final int hashCode;

    private Variable(String name, SignalSort sort) {
        this.name = Objects.requireNonNull(name, "Variable name cannot be null.");
        this.sort = Objects.requireNonNull(sort, "Variable sort cannot be null.");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Variable name cannot be empty.");
        }
        this.hashCode = Objects.hash(name, sort);
    }

    public static Variable of(String name, SignalSort sort) {
        return new Variable(name, sort);
    }

    public static Variable bool(String name) {
        return new Variable(name, SignalSort.bool());
    }

    public static Variable bitVector(String name, int width) {
        return new Variable(name, SignalSort.bitVector(width));
    }

    /**
     * 层次化引用：instanceName.portName。
     */
    public Variable qualify(String instanceName) {
        return new Variable(instanceName + "." + name, sort);
    }

    public boolean isQualified() {
        return name.indexOf('.') >= 0;
    }

    @Override
    public Expr toZ3Expr(Context ctx, TermManager termManager) {
        return termManager.var(this);
    }

    @Override
    public int compareTo(Variable other) {
        return this.name.compareTo(other.name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Variable variable = (Variable) o;
        return name.equals(variable.name) && sort.equals(variable.sort);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return name + " : " + sort;
    }
}
