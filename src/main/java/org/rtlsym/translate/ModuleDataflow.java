package org.rtlsym.translate;

import com.microsoft.z3.Expr;
import lombok.Getter;
import org.rtlsym.core.Variable;
import org.rtlsym.model.Instance;
import org.rtlsym.model.Model;
import org.rtlsym.model.Provenance;
import org.rtlsym.symbolic.TermManager;

import java.util.*;

/**
 * 一个模块完整保真的数据流：声明、logic / default_next 条目、子模块实例和初值。
 * 抽象 (AbstractionPlanner) 在它之上选择保留哪些信号。
 */
@Getter
final class ModuleDataflow {

    private final String moduleName;
    // 除时钟外所有信号的声明顺序，决定 UF 参数的顺序
    private final List<String> declarationOrder;
    private final List<Variable> inputs;
    private final List<Variable> outputs;
    private final List<Variable> state;
    private final LinkedHashMap<Expr, Expr> logic;
    private final LinkedHashMap<Expr, Expr> defaultNext;
    private final LinkedHashMap<String, Instance> instances;
    private final LinkedHashMap<Variable, Expr> initValues;

    ModuleDataflow(String moduleName, List<String> declarationOrder, List<Variable> inputs, List<Variable> outputs,
                   List<Variable> state, LinkedHashMap<Expr, Expr> logic, LinkedHashMap<Expr, Expr> defaultNext,
                   LinkedHashMap<String, Instance> instances, LinkedHashMap<Variable, Expr> initValues) {
        this.moduleName = moduleName;
        this.declarationOrder = List.copyOf(declarationOrder);
        this.inputs = List.copyOf(inputs);
        this.outputs = List.copyOf(outputs);
        this.state = List.copyOf(state);
        this.logic = logic;
        this.defaultNext = defaultNext;
        this.instances = instances;
        this.initValues = initValues;
    }

    Optional<Variable> declared(String name) {
        for (List<Variable> group : List.of(inputs, outputs, state)) {
            for (Variable v : group) {
                if (v.getName().equals(name)) {
                    return Optional.of(v);
                }
            }
        }
        return Optional.empty();
    }

    boolean isInput(String name) {
        return inputs.stream().anyMatch(v -> v.getName().equals(name));
    }

    /**
     * 由时钟块驱动的信号。
     */
    boolean isRegister(String name) {
        return defines(defaultNext, name);
    }

    boolean isDriven(String name) {
        return defines(logic, name) || defines(defaultNext, name);
    }

    private static boolean defines(Map<Expr, Expr> entries, String name) {
        return entries.keySet().stream().anyMatch(k -> TermManager.rootVariable(k).filter(name::equals).isPresent());
    }

    /**
     * 信号定义 (同周期或下一周期) 中引用的所有信号，按首次出现的顺序。
     * 包括存储器写入键中的下标，也可能包括信号自身。
     */
    Set<String> dependencies(String name) {
        Set<String> deps = new LinkedHashSet<>();
        for (Map<Expr, Expr> entries : List.of(logic, defaultNext)) {
            for (Map.Entry<Expr, Expr> entry : entries.entrySet()) {
                if (TermManager.rootVariable(entry.getKey()).filter(name::equals).isEmpty()) {
                    continue;
                }
                for (String keyVar : TermManager.freeVariables(entry.getKey())) {
                    if (!keyVar.equals(name)) {
                        deps.add(keyVar);
                    }
                }
                deps.addAll(TermManager.freeVariables(entry.getValue()));
            }
        }
        return deps;
    }

    /**
     * 实例输入绑定中引用的父模块信号。
     */
    Set<String> bindingDependencies(String instanceName) {
        Set<String> deps = new LinkedHashSet<>();
        Instance instance = instances.get(instanceName);
        if (instance != null) {
            for (Expr value : instance.getInputs().values()) {
                deps.addAll(TermManager.freeVariables(value));
            }
        }
        return deps;
    }

    /**
     * 限定名 inst.port 对应的变量 (类型取子模型的输出声明)。
     */
    Optional<Variable> qualifiedOutput(String qualifiedName) {
        int dot = qualifiedName.indexOf('.');
        if (dot < 0) {
            return Optional.empty();
        }
        Instance instance = instances.get(qualifiedName.substring(0, dot));
        if (instance == null) {
            return Optional.empty();
        }
        return instance.getModel().findOutput(qualifiedName.substring(dot + 1))
                .map(port -> Variable.of(qualifiedName, port.getSort()));
    }

    /**
     * 不做任何抽象：所有信号以完整的 logic / default_next 保留。
     */
    Model toModel() {
        Model.Builder builder = Model.builder(moduleName)
                .inputs(inputs)
                .outputs(outputs)
                .state(state)
                .provenance(Provenance.SYNTAX_GENERATED);
        instances.forEach(builder::instance);
        logic.forEach(builder::logic);
        defaultNext.forEach(builder::defaultNext);
        initValues.forEach(builder::initValue);
        return builder.build();
    }
}
