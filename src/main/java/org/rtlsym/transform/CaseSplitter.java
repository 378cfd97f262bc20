package org.rtlsym.transform;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import org.rtlsym.core.SignalSort;
import org.rtlsym.core.Variable;
import org.rtlsym.model.GenerationKind;
import org.rtlsym.model.Instance;
import org.rtlsym.model.Model;
import org.rtlsym.model.UFPlaceholder;
import org.rtlsym.symbolic.TermManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.*;
import java.util.stream.Collectors;

/**
 * 按一个选择变量的取值把模型拆分为一个分派父模型和若干特化子模型。
 * <p>
 * 每个取值 v 生成一个子模型 (名称与实例名均为 M__sel_v)：选择变量被替换为常量 v，
 * 它的声明、定义和作为 UF 参数的出现都被删除。父模型保留原来的名称和输出，
 * 输出定义为按选择变量在子模型限定输出之间选择的 ite 链；父模型没有状态。
 * 取值集合不完整时，最后一个取值作为缺省分支，并在父模型中加入假设 sel ∈ values。
 * @author Ayalyt
 */
public class CaseSplitter {

    private static final Logger logger = LoggerFactory.getLogger(CaseSplitter.class);

    private final TermManager termManager;
    private final Context ctx;

    public CaseSplitter(TermManager termManager) {
        this.termManager = Objects.requireNonNull(termManager, "TermManager cannot be null.");
        this.ctx = termManager.getCtx();
    }

    /**
     * 使用选择变量的完整取值范围拆分：布尔为 {true, false}，n 位位向量为 0..2^n-1。
     */
    public Model split(Model model, String selectorName) {
        Variable selector = findSelector(model, selectorName);
        List<BigInteger> values = new ArrayList<>();
        if (selector.getSort().isBool()) {
            values.add(BigInteger.ONE);
            values.add(BigInteger.ZERO);
        } else {
            BigInteger count = BigInteger.ONE.shiftLeft(selector.getSort().getWidth());
            for (BigInteger v = BigInteger.ZERO; v.compareTo(count) < 0; v = v.add(BigInteger.ONE)) {
                values.add(v);
            }
        }
        return split(model, selector, values);
    }

    /**
     * 只对给定的取值拆分。布尔选择变量用 1 表示 true、0 表示 false。重复的取值只保留第一次出现。
     * @throws CaseSplitException 选择变量未知、类型不支持、取值为空或超出范围。
     */
    public Model split(Model model, String selectorName, Collection<BigInteger> values) {
        return split(model, findSelector(model, selectorName), values);
    }

    private Model split(Model model, Variable selector, Collection<BigInteger> requested) {
        List<BigInteger> values = checkValues(selector, requested);
        logger.info("按 {} 拆分模型 {}，共 {} 个取值", selector.getName(), model.getName(), values.size());

        Expr selectorTerm = termManager.var(selector);
        Model.Builder parent = Model.builder(model.getName())
                .provenance(model.getProvenance().with(GenerationKind.CASE_SPLIT));
        for (Variable input : model.getInputs()) {
            parent.input(input);
        }
        if (!model.getInputs().contains(selector)) {
            // 状态选择变量在父模型中成为分派用的输入
            parent.input(selector);
        }
        model.getOutputs().forEach(parent::output);

        List<String> instanceNames = new ArrayList<>();
        for (BigInteger value : values) {
            String childName = model.getName() + "__" + selector.getName() + "_" + suffix(selector.getSort(), value);
            Model child = specialize(model, selector, termManager.constant(selector.getSort(), value), childName);
            Map<Variable, Expr> bindings = new LinkedHashMap<>();
            for (Variable input : child.getInputs()) {
                bindings.put(input, termManager.var(input));
            }
            parent.instance(childName, new Instance(child, bindings));
            instanceNames.add(childName);
            logger.debug("生成子模型 {}", childName);
        }

        for (Variable output : model.getOutputs()) {
            Expr selection = termManager.var(output.qualify(instanceNames.get(values.size() - 1)));
            for (int i = values.size() - 2; i >= 0; i--) {
                Expr branch = termManager.var(output.qualify(instanceNames.get(i)));
                selection = ctx.mkITE(matches(selectorTerm, selector.getSort(), values.get(i)), branch, selection);
            }
            parent.logic(termManager.var(output), selection);
        }

        if (!coversRange(selector.getSort(), values)) {
            BoolExpr[] alternatives = values.stream()
                    .map(v -> matches(selectorTerm, selector.getSort(), v))
                    .toArray(BoolExpr[]::new);
            parent.assumption(alternatives.length == 1 ? alternatives[0] : ctx.mkOr(alternatives));
        }
        return parent.build();
    }

    private Variable findSelector(Model model, String selectorName) {
        Optional<Variable> selector = model.findInput(selectorName).or(() -> model.findState(selectorName));
        if (selector.isEmpty()) {
            logger.error("模型 {} 没有名为 {} 的输入或状态", model.getName(), selectorName);
            throw new CaseSplitException(CaseSplitFault.UNKNOWN_SELECTOR,
                    "Model " + model.getName() + " has no input or state named '" + selectorName + "'");
        }
        SignalSort sort = selector.get().getSort();
        if (!sort.isBool() && !sort.isBitVector()) {
            logger.error("选择变量 {} 的类型 {} 不支持拆分", selectorName, sort);
            throw new CaseSplitException(CaseSplitFault.UNSUPPORTED_SELECTOR_SORT,
                    "Selector '" + selectorName + "' has sort " + sort);
        }
        return selector.get();
    }

    private List<BigInteger> checkValues(Variable selector, Collection<BigInteger> requested) {
        List<BigInteger> values = new ArrayList<>(new LinkedHashSet<>(requested));
        if (values.isEmpty()) {
            logger.error("选择变量 {} 的取值集合为空", selector.getName());
            throw new CaseSplitException(CaseSplitFault.EMPTY_VALUE_SET, "No values given for '" + selector.getName() + "'");
        }
        BigInteger limit = BigInteger.ONE.shiftLeft(selector.getSort().getWidth());
        for (BigInteger value : values) {
            if (value.signum() < 0 || value.compareTo(limit) >= 0) {
                logger.error("取值 {} 超出 {} 的范围", value, selector);
                throw new CaseSplitException(CaseSplitFault.VALUE_OUT_OF_RANGE,
                        "Value " + value + " is out of range for " + selector);
            }
        }
        return values;
    }

    private static boolean coversRange(SignalSort sort, List<BigInteger> values) {
        return BigInteger.valueOf(values.size()).equals(BigInteger.ONE.shiftLeft(sort.getWidth()));
    }

    private BoolExpr matches(Expr selectorTerm, SignalSort sort, BigInteger value) {
        if (sort.isBool()) {
            return value.signum() != 0 ? (BoolExpr) selectorTerm : ctx.mkNot((BoolExpr) selectorTerm);
        }
        return ctx.mkEq(selectorTerm, termManager.constant(sort, value));
    }

    /**
     * 布尔为 TRUE / FALSE，位向量为定宽二进制，如 0b01。
     */
    static String suffix(SignalSort sort, BigInteger value) {
        if (sort.isBool()) {
            return value.signum() != 0 ? "TRUE" : "FALSE";
        }
        StringBuilder bits = new StringBuilder(value.toString(2));
        while (bits.length() < sort.getWidth()) {
            bits.insert(0, '0');
        }
        return "0b" + bits;
    }

    /**
     * 把选择变量替换为常量后的子模型。不修改原模型。
     */
    private Model specialize(Model model, Variable selector, Expr constant, String childName) {
        Map<Variable, Expr> substitution = Map.of(selector, constant);
        Model.Builder child = Model.builder(childName)
                .provenance(model.getProvenance().with(GenerationKind.CASE_SPLIT));
        model.getInputs().stream().filter(v -> !v.equals(selector)).forEach(child::input);
        model.getOutputs().forEach(child::output);
        model.getState().stream().filter(v -> !v.equals(selector)).forEach(child::state);
        for (UFPlaceholder uf : model.getUfs()) {
            child.uf(withoutParameter(uf, selector));
        }
        for (UFPlaceholder uf : model.getNextUfs()) {
            child.nextUf(withoutParameter(uf, selector));
        }
        model.getInstances().forEach((name, instance) -> {
            Map<Variable, Expr> bindings = new LinkedHashMap<>();
            instance.getInputs().forEach((port, value) -> bindings.put(port, termManager.replaceVars(value, substitution)));
            child.instance(name, new Instance(instance.getModel(), bindings));
        });
        copyDefinitions(model.getLogic(), selector, substitution, child::logic);
        copyDefinitions(model.getDefaultNext(), selector, substitution, child::defaultNext);
        model.getInitValues().forEach((v, value) -> {
            if (!v.equals(selector)) {
                child.initValue(v, value);
            }
        });
        for (BoolExpr assertion : model.getAssertions()) {
            child.assertion((BoolExpr) termManager.replaceVars(assertion, substitution));
        }
        for (BoolExpr assumption : model.getAssumptions()) {
            child.assumption((BoolExpr) termManager.replaceVars(assumption, substitution));
        }
        return child.build();
    }

    private interface EntrySink {
        void put(Expr key, Expr value);
    }

    private void copyDefinitions(Map<Expr, Expr> entries, Variable selector, Map<Variable, Expr> substitution, EntrySink sink) {
        for (Map.Entry<Expr, Expr> entry : entries.entrySet()) {
            if (TermManager.rootVariable(entry.getKey()).filter(selector.getName()::equals).isPresent()) {
                continue;
            }
            sink.put(termManager.replaceVars(entry.getKey(), substitution), termManager.replaceVars(entry.getValue(), substitution));
        }
    }

    private static UFPlaceholder withoutParameter(UFPlaceholder uf, Variable selector) {
        if (!uf.getParams().contains(selector)) {
            return uf;
        }
        List<Variable> params = uf.getParams().stream().filter(p -> !p.equals(selector)).collect(Collectors.toList());
        return new UFPlaceholder(uf.getName(), uf.getSort(), params, uf.isHasFreeArgument());
    }
}
