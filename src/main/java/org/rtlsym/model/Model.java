package org.rtlsym.model;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Expr;
import lombok.Getter;
import org.rtlsym.core.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 符号化的模块模型：带类型的端口与状态、同周期逻辑 (logic)、状态迁移 (defaultNext)、
 * 未解释函数占位符、子模块实例、初值、断言与假设。
 * <p>
 * Model 是不可变的值：所有集合在构造时复制为不可修改的视图，变换总是产生新的 Model。
 * 结构性校验通过 {@link #validate()} 完成，校验失败以诊断数据返回，不抛出异常。
 * @author Ayalyt
 */
@Getter
public final class Model {

    private static final Logger logger = LoggerFactory.getLogger(Model.class);

    private final String name;
    private final List<Variable> inputs;
    private final List<Variable> outputs;
    private final List<Variable> state;
    private final List<UFPlaceholder> ufs;
    private final List<UFPlaceholder> nextUfs;
    private final Map<String, Instance> instances;
    private final Map<Expr, Expr> logic;
    private final Map<Expr, Expr> defaultNext;
    private final Map<Variable, Expr> initValues;
    private final List<BoolExpr> assertions;
    private final List<BoolExpr> assumptions;
    private final Provenance provenance;

    private final int hashCode;

    private Model(Builder builder) {
        this.name = builder.name;
        this.inputs = List.copyOf(builder.inputs);
        this.outputs = List.copyOf(builder.outputs);
        this.state = List.copyOf(builder.state);
        this.ufs = List.copyOf(builder.ufs);
        this.nextUfs = List.copyOf(builder.nextUfs);
        this.instances = Collections.unmodifiableMap(new LinkedHashMap<>(builder.instances));
        this.logic = Collections.unmodifiableMap(new LinkedHashMap<>(builder.logic));
        this.defaultNext = Collections.unmodifiableMap(new LinkedHashMap<>(builder.defaultNext));
        this.initValues = Collections.unmodifiableMap(new LinkedHashMap<>(builder.initValues));
        this.assertions = List.copyOf(builder.assertions);
        this.assumptions = List.copyOf(builder.assumptions);
        this.provenance = builder.provenance;
        this.hashCode = Objects.hash(name, inputs, outputs, state, ufs, nextUfs, instances,
                logic, defaultNext, initValues, assertions, assumptions, provenance);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * 以当前模型的全部内容为起点创建一个新的 Builder，不会修改当前模型。
     */
    public Builder toBuilder() {
        Builder builder = new Builder(name);
        builder.inputs.addAll(inputs);
        builder.outputs.addAll(outputs);
        builder.state.addAll(state);
        builder.ufs.addAll(ufs);
        builder.nextUfs.addAll(nextUfs);
        builder.instances.putAll(instances);
        builder.logic.putAll(logic);
        builder.defaultNext.putAll(defaultNext);
        builder.initValues.putAll(initValues);
        builder.assertions.addAll(assertions);
        builder.assumptions.addAll(assumptions);
        builder.provenance = provenance;
        return builder;
    }

    // === 查询 ===

    /**
     * 按名称查找声明的输入、输出或状态变量。
     */
    public Optional<Variable> findDeclared(String signalName) {
        return Stream.of(inputs, outputs, state)
                .flatMap(List::stream)
                .filter(v -> v.getName().equals(signalName))
                .findFirst();
    }

    public Optional<Variable> findInput(String signalName) {
        return inputs.stream().filter(v -> v.getName().equals(signalName)).findFirst();
    }

    public Optional<Variable> findOutput(String signalName) {
        return outputs.stream().filter(v -> v.getName().equals(signalName)).findFirst();
    }

    public Optional<Variable> findState(String signalName) {
        return state.stream().filter(v -> v.getName().equals(signalName)).findFirst();
    }

    /**
     * 按名称查找组合或时序 UF 占位符。
     */
    public Optional<UFPlaceholder> findUf(String ufName) {
        return Stream.concat(ufs.stream(), nextUfs.stream())
                .filter(uf -> uf.getName().equals(ufName))
                .findFirst();
    }

    public boolean isUfName(String signalName) {
        return findUf(signalName).isPresent();
    }

    /**
     * 所有声明的输入、输出和状态名称；后代模型中的名称带实例路径前缀 (inst.sub.name)。
     * 供外部的标注存储按限定名建立索引。
     */
    public List<String> getQualifiedSignalNames() {
        List<String> names = new ArrayList<>();
        collectQualifiedNames("", names);
        return names;
    }

    private void collectQualifiedNames(String prefix, List<String> names) {
        for (Variable v : inputs) {
            names.add(prefix + v.getName());
        }
        for (Variable v : outputs) {
            names.add(prefix + v.getName());
        }
        for (Variable v : state) {
            names.add(prefix + v.getName());
        }
        for (Map.Entry<String, Instance> entry : instances.entrySet()) {
            entry.getValue().getModel().collectQualifiedNames(prefix + entry.getKey() + ".", names);
        }
    }

    // === 校验 ===

    /**
     * 检查本模型及所有后代模型的结构不变式。先递归检查每个实例的子模型，
     * 收集全部诊断后返回，不会在第一处违反时停止。
     * @return 校验结果；仅当本模型与所有后代都满足不变式时才有效。
     */
    public ValidationResult validate() {
        List<Diagnostic> diagnostics = new ArrayList<>();
        new ModelValidator(diagnostics).validate(this, name);
        for (Diagnostic diagnostic : diagnostics) {
            logger.warn("模型校验失败: {}", diagnostic);
        }
        return new ValidationResult(diagnostics);
    }

    // === 输出 ===

    /**
     * 确定性的结构化文本，先打印本模型，再按首次出现的顺序打印每个不同名称的子模型。
     */
    public String prettyString() {
        StringBuilder sb = new StringBuilder();
        Set<String> printed = new HashSet<>();
        appendPretty(sb, printed);
        return sb.toString();
    }

    private void appendPretty(StringBuilder sb, Set<String> printed) {
        if (!printed.add(name)) {
            return;
        }
        sb.append("model ").append(name).append(" [").append(provenance).append("]\n");
        appendList(sb, "inputs", inputs);
        appendList(sb, "outputs", outputs);
        appendList(sb, "state", state);
        appendList(sb, "ufs", ufs);
        appendList(sb, "next ufs", nextUfs);
        if (!instances.isEmpty()) {
            sb.append("  instances:\n");
            instances.forEach((instName, inst) -> sb.append("    ").append(instName).append(" : ").append(inst).append('\n'));
        }
        appendMap(sb, "logic", logic);
        appendMap(sb, "default next", defaultNext);
        appendMap(sb, "init", initValues);
        appendList(sb, "assertions", assertions);
        appendList(sb, "assumptions", assumptions);
        for (Instance inst : instances.values()) {
            inst.getModel().appendPretty(sb, printed);
        }
    }

    private static void appendList(StringBuilder sb, String label, List<?> items) {
        if (items.isEmpty()) {
            return;
        }
        sb.append("  ").append(label).append(": ")
                .append(items.stream().map(Object::toString).collect(Collectors.joining(", ")))
                .append('\n');
    }

    private static void appendMap(StringBuilder sb, String label, Map<?, ? extends Expr> entries) {
        if (entries.isEmpty()) {
            return;
        }
        sb.append("  ").append(label).append(":\n");
        entries.forEach((k, v) -> {
            String key = k instanceof Variable ? ((Variable) k).getName() : k.toString();
            sb.append("    ").append(key).append(" := ").append(v).append('\n');
        });
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Model that = (Model) o;
        return hashCode == that.hashCode &&
                name.equals(that.name) &&
                inputs.equals(that.inputs) &&
                outputs.equals(that.outputs) &&
                state.equals(that.state) &&
                ufs.equals(that.ufs) &&
                nextUfs.equals(that.nextUfs) &&
                instances.equals(that.instances) &&
                logic.equals(that.logic) &&
                defaultNext.equals(that.defaultNext) &&
                initValues.equals(that.initValues) &&
                assertions.equals(that.assertions) &&
                assumptions.equals(that.assumptions) &&
                provenance.equals(that.provenance);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return prettyString();
    }

    /**
     * Model 的可变构造器。build() 之后继续修改构造器不会影响已构造的 Model。
     */
    public static final class Builder {

        private String name;
        private final List<Variable> inputs = new ArrayList<>();
        private final List<Variable> outputs = new ArrayList<>();
        private final List<Variable> state = new ArrayList<>();
        private final List<UFPlaceholder> ufs = new ArrayList<>();
        private final List<UFPlaceholder> nextUfs = new ArrayList<>();
        private final Map<String, Instance> instances = new LinkedHashMap<>();
        private final Map<Expr, Expr> logic = new LinkedHashMap<>();
        private final Map<Expr, Expr> defaultNext = new LinkedHashMap<>();
        private final Map<Variable, Expr> initValues = new LinkedHashMap<>();
        private final List<BoolExpr> assertions = new ArrayList<>();
        private final List<BoolExpr> assumptions = new ArrayList<>();
        private Provenance provenance = Provenance.HANDWRITTEN;

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "Model name cannot be null.");
        }

        public Builder name(String name) {
            this.name = Objects.requireNonNull(name, "Model name cannot be null.");
            return this;
        }

        public Builder input(Variable v) {
            inputs.add(Objects.requireNonNull(v));
            return this;
        }

        public Builder inputs(Collection<Variable> vs) {
            vs.forEach(this::input);
            return this;
        }

        public Builder output(Variable v) {
            outputs.add(Objects.requireNonNull(v));
            return this;
        }

        public Builder outputs(Collection<Variable> vs) {
            vs.forEach(this::output);
            return this;
        }

        public Builder state(Variable v) {
            state.add(Objects.requireNonNull(v));
            return this;
        }

        public Builder state(Collection<Variable> vs) {
            vs.forEach(this::state);
            return this;
        }

        public Builder uf(UFPlaceholder uf) {
            ufs.add(Objects.requireNonNull(uf));
            return this;
        }

        public Builder nextUf(UFPlaceholder uf) {
            nextUfs.add(Objects.requireNonNull(uf));
            return this;
        }

        public Builder instance(String instanceName, Instance instance) {
            instances.put(Objects.requireNonNull(instanceName), Objects.requireNonNull(instance));
            return this;
        }

        public Builder logic(Expr key, Expr value) {
            logic.put(Objects.requireNonNull(key), Objects.requireNonNull(value));
            return this;
        }

        public Builder defaultNext(Expr key, Expr value) {
            defaultNext.put(Objects.requireNonNull(key), Objects.requireNonNull(value));
            return this;
        }

        public Builder initValue(Variable v, Expr value) {
            initValues.put(Objects.requireNonNull(v), Objects.requireNonNull(value));
            return this;
        }

        public Builder assertion(BoolExpr term) {
            assertions.add(Objects.requireNonNull(term));
            return this;
        }

        public Builder assumption(BoolExpr term) {
            assumptions.add(Objects.requireNonNull(term));
            return this;
        }

        public Builder provenance(Provenance provenance) {
            this.provenance = Objects.requireNonNull(provenance);
            return this;
        }

        /**
         * 删除所有类别中名为 signalName 的声明 (输入、输出、状态、UF)。
         */
        public Builder removeDeclaration(String signalName) {
            inputs.removeIf(v -> v.getName().equals(signalName));
            outputs.removeIf(v -> v.getName().equals(signalName));
            state.removeIf(v -> v.getName().equals(signalName));
            ufs.removeIf(uf -> uf.getName().equals(signalName));
            nextUfs.removeIf(uf -> uf.getName().equals(signalName));
            return this;
        }

        public Builder clearState() {
            state.clear();
            return this;
        }

        public Builder clearUfs() {
            ufs.clear();
            nextUfs.clear();
            return this;
        }

        public Builder clearInstances() {
            instances.clear();
            return this;
        }

        public Builder clearLogic() {
            logic.clear();
            return this;
        }

        public Builder clearDefaultNext() {
            defaultNext.clear();
            return this;
        }

        public Builder clearInitValues() {
            initValues.clear();
            return this;
        }

        public Builder clearAssertions() {
            assertions.clear();
            return this;
        }

        public Builder clearAssumptions() {
            assumptions.clear();
            return this;
        }

        public Model build() {
            return new Model(this);
        }
    }
}
