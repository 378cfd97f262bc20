package org.rtlsym.model;

import com.microsoft.z3.Expr;
import lombok.Getter;
import org.rtlsym.core.Variable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 子模块实例：引用一个 Model，并把子模型的每个输入绑定到父模型作用域中的一个项。
 * 同一个 Model 值可以被多个 Instance 共享。
 * 此类是不可变的。
 */
@Getter
public final class Instance {

    private final Model model;
    private final Map<Variable, Expr> inputs;

    private final int hashCode;

    public Instance(Model model, Map<Variable, ? extends Expr> inputs) {
        this.model = Objects.requireNonNull(model, "Instance model cannot be null.");
        Objects.requireNonNull(inputs, "Instance inputs cannot be null.");
        this.inputs = Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
        this.hashCode = Objects.hash(model, this.inputs);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Instance that = (Instance) o;
        return hashCode == that.hashCode && model.equals(that.model) && inputs.equals(that.inputs);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return model.getName() + inputs.entrySet().stream()
                .map(e -> e.getKey().getName() + " := " + e.getValue())
                .collect(Collectors.joining(", ", " {", "}"));
    }
}
