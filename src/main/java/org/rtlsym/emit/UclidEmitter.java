package org.rtlsym.emit;

import com.microsoft.z3.ArrayExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import org.rtlsym.core.SignalSort;
import org.rtlsym.core.Variable;
import org.rtlsym.model.Instance;
import org.rtlsym.model.Model;
import org.rtlsym.model.UFPlaceholder;
import org.rtlsym.symbolic.TermManager;
import org.rtlsym.symbolic.UclidTermPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 把 Model 树输出为 UCLID5 文本。
 * <p>
 * 子模型先于父模型输出，每个不同的模型名只输出一个 module 块。
 * 每个有下一周期转移的状态 s 带一个影子变量 __next_s，保存按当前周期算出的下一周期值：
 * init 中先求组合逻辑再求影子；next 中先 s' = __next_s，再按新的取值求组合逻辑和影子，最后推进子实例。
 * 组合 UF 的引用改写为 uf_x(参数..., 自由参数)，时序 UF 是普通状态变量，转移为 next_uf_x(参数...)。
 * 按位向量取值分派的组合逻辑 (如情形拆分后的输出) 输出为 case 语句。
 * @author Ayalyt
 */
public class UclidEmitter {

    private static final Logger logger = LoggerFactory.getLogger(UclidEmitter.class);

    static final String SHADOW_PREFIX = "__next_";
    static final String FREE_PREFIX = "__free_";
    static final String UF_PREFIX = "uf_";
    static final String NEXT_UF_PREFIX = "next_uf_";

    private static final String INDENT = "  ";

    private final TermManager termManager;
    private final Context ctx;
    private final UclidTermPrinter printer = new UclidTermPrinter();

    public UclidEmitter(TermManager termManager) {
        this.termManager = Objects.requireNonNull(termManager, "TermManager cannot be null.");
        this.ctx = termManager.getCtx();
    }

    /**
     * @param model 要输出的模型，通常已通过 validate()。
     * @return 所有 module 块，子模型在前。相同的模型总是得到相同的文本。
     * @throws EmissionException 引用无法解析、组合 UF 循环引用或运算符无法表达。
     */
    public String emit(Model model) {
        Objects.requireNonNull(model, "Model cannot be null.");
        List<String> blocks = new ArrayList<>();
        collect(model, new HashSet<>(), blocks);
        logger.info("模型 {} 输出完成，共 {} 个 module", model.getName(), blocks.size());
        return String.join("\n", blocks);
    }

    private void collect(Model model, Set<String> emitted, List<String> blocks) {
        if (!emitted.add(model.getName())) {
            return;
        }
        for (Instance instance : model.getInstances().values()) {
            collect(instance.getModel(), emitted, blocks);
        }
        blocks.add(new ModuleWriter(model).write());
        logger.debug("输出 module {}", model.getName());
    }

    /**
     * 单个模型的输出过程。
     */
    private final class ModuleWriter implements UclidTermPrinter.ReferenceResolver {
        private final Model model;
        private final Map<String, UFPlaceholder> combinational = new LinkedHashMap<>();
        private final Map<String, UFPlaceholder> sequential = new LinkedHashMap<>();
        private final Map<String, SignalSort> variables = new LinkedHashMap<>();
        // 转移目标 -> 折叠后的下一周期值；时序 UF 不在这里
        private final Map<String, Expr> transitions = new LinkedHashMap<>();
        private final Map<String, Expr> definitions = new LinkedHashMap<>();
        private final Deque<String> expanding = new ArrayDeque<>();
        private final StringBuilder out = new StringBuilder();

        ModuleWriter(Model model) {
            this.model = model;
            for (UFPlaceholder uf : model.getUfs()) {
                combinational.put(uf.getName(), uf);
            }
            for (UFPlaceholder uf : model.getNextUfs()) {
                sequential.put(uf.getName(), uf);
            }
            for (List<Variable> group : List.of(model.getInputs(), model.getOutputs(), model.getState())) {
                for (Variable v : group) {
                    variables.put(v.getName(), v.getSort());
                }
            }
            sequential.values().forEach(uf -> variables.putIfAbsent(uf.getName(), uf.getSort()));
            transitions.putAll(fold(model.getDefaultNext()));
            definitions.putAll(fold(model.getLogic()));
            for (Variable output : model.getOutputs()) {
                if (combinational.containsKey(output.getName()) && !definitions.containsKey(output.getName())) {
                    definitions.put(output.getName(), termManager.var(output));
                }
            }
        }

        String write() {
            line(0, "module " + model.getName() + " {");
            declarations();
            init();
            next();
            line(0, "}");
            return out.toString();
        }

        // === 声明 ===

        private void declarations() {
            for (Variable v : model.getInputs()) {
                line(1, "input " + v.getName() + " : " + UclidTermPrinter.typeName(v.getSort()) + ";");
            }
            for (Variable v : model.getOutputs()) {
                line(1, "output " + v.getName() + " : " + UclidTermPrinter.typeName(v.getSort()) + ";");
            }
            for (Variable v : model.getState()) {
                line(1, "var " + v.getName() + " : " + UclidTermPrinter.typeName(v.getSort()) + ";");
            }
            for (UFPlaceholder uf : sequential.values()) {
                if (model.findDeclared(uf.getName()).isEmpty()) {
                    line(1, "var " + uf.getName() + " : " + UclidTermPrinter.typeName(uf.getSort()) + ";");
                }
            }
            for (String target : shadowed()) {
                line(1, "var " + SHADOW_PREFIX + target + " : " + UclidTermPrinter.typeName(variables.get(target)) + ";");
            }
            for (UFPlaceholder uf : allUfs()) {
                if (uf.isHasFreeArgument()) {
                    line(1, "var " + FREE_PREFIX + uf.getName() + " : " + UclidTermPrinter.typeName(uf.getSort()) + ";");
                }
            }
            for (UFPlaceholder uf : combinational.values()) {
                line(1, function(UF_PREFIX, uf));
            }
            for (UFPlaceholder uf : sequential.values()) {
                line(1, function(NEXT_UF_PREFIX, uf));
            }
            model.getInstances().forEach((name, instance) -> {
                StringJoiner bindings = new StringJoiner(", ");
                instance.getInputs().forEach((port, value) ->
                        bindings.add(port.getName() + " : (" + render(value, false) + ")"));
                line(1, "instance " + name + " : " + instance.getModel().getName() + "(" + bindings + ");");
            });
            int index = 0;
            for (BoolExpr assumption : model.getAssumptions()) {
                line(1, "assume assumption_" + index++ + " : " + render(assumption, false) + ";");
            }
            index = 0;
            for (BoolExpr assertion : model.getAssertions()) {
                line(1, "invariant assertion_" + index++ + " : " + render(assertion, false) + ";");
            }
        }

        private String function(String prefix, UFPlaceholder uf) {
            StringJoiner params = new StringJoiner(", ");
            int i = 0;
            for (Variable param : uf.getParams()) {
                params.add("p" + i++ + " : " + UclidTermPrinter.typeName(param.getSort()));
            }
            if (uf.isHasFreeArgument()) {
                params.add("p" + i + " : " + UclidTermPrinter.typeName(uf.getFreeArgumentSort()));
            }
            return "function " + prefix + uf.getName() + "(" + params + ") : " + UclidTermPrinter.typeName(uf.getSort()) + ";";
        }

        // === init / next ===

        private void init() {
            line(1, "init {");
            model.getInitValues().forEach((v, value) -> line(2, v.getName() + " = " + render(value, false) + ";"));
            for (String name : topologicalOrder()) {
                assignment(2, name, definitions.get(name), false);
            }
            for (String target : shadowed()) {
                line(2, SHADOW_PREFIX + target + " = " + transition(target, false) + ";");
            }
            line(1, "}");
        }

        private void next() {
            line(1, "next {");
            for (UFPlaceholder uf : allUfs()) {
                if (uf.isHasFreeArgument()) {
                    line(2, "havoc " + FREE_PREFIX + uf.getName() + ";");
                }
            }
            for (String target : shadowed()) {
                line(2, target + "' = " + SHADOW_PREFIX + target + ";");
            }
            for (String name : topologicalOrder()) {
                assignment(2, name, definitions.get(name), true);
            }
            for (String target : shadowed()) {
                line(2, SHADOW_PREFIX + target + "' = " + transition(target, true) + ";");
            }
            for (String instanceName : model.getInstances().keySet()) {
                line(2, "next(" + instanceName + ");");
            }
            line(1, "}");
        }

        /**
         * 条件都是同一位向量变量与常量相等的 ite 链 (按值分派) 输出为 case 语句，其余输出为普通赋值。
         */
        private void assignment(int depth, String name, Expr value, boolean primed) {
            String target = primed ? name + "'" : name;
            List<Expr> conditions = new ArrayList<>();
            List<Expr> branches = new ArrayList<>();
            Expr selector = null;
            Expr rest = value;
            while (rest.isITE()) {
                Expr condition = rest.getArgs()[0];
                Expr tested = valueTested(condition);
                if (tested == null || (selector != null && !selector.equals(tested))) {
                    break;
                }
                selector = tested;
                conditions.add(condition);
                branches.add(rest.getArgs()[1]);
                rest = rest.getArgs()[2];
            }
            if (conditions.isEmpty()) {
                line(depth, target + " = " + render(value, primed) + ";");
                return;
            }
            line(depth, "case");
            for (int i = 0; i < conditions.size(); i++) {
                line(depth + 1, render(conditions.get(i), primed) + " : { " + target + " = " + render(branches.get(i), primed) + "; }");
            }
            line(depth + 1, "default : { " + target + " = " + render(rest, primed) + "; }");
            line(depth, "esac");
        }

        /**
         * @return condition 形如 v == 常量 且 v 是位向量变量时返回 v，否则返回 null。
         */
        private Expr valueTested(Expr condition) {
            if (!condition.isEq() || condition.getNumArgs() != 2) {
                return null;
            }
            Expr left = condition.getArgs()[0];
            Expr right = condition.getArgs()[1];
            if (TermManager.isVariable(left) && left.isBV() && right.isBVNumeral()) {
                return left;
            }
            if (TermManager.isVariable(right) && right.isBV() && left.isBVNumeral()) {
                return right;
            }
            return null;
        }

        private List<String> shadowed() {
            List<String> targets = new ArrayList<>(transitions.keySet());
            for (String name : sequential.keySet()) {
                if (!targets.contains(name)) {
                    targets.add(name);
                }
            }
            return targets;
        }

        private List<UFPlaceholder> allUfs() {
            List<UFPlaceholder> ufs = new ArrayList<>(combinational.values());
            ufs.addAll(sequential.values());
            return ufs;
        }

        private String transition(String target, boolean primed) {
            Expr folded = transitions.get(target);
            if (folded != null) {
                return render(folded, primed);
            }
            UFPlaceholder uf = sequential.get(target);
            List<String> args = new ArrayList<>();
            for (Variable param : uf.getParams()) {
                args.add(renderVariable(param.getName(), primed));
            }
            if (uf.isHasFreeArgument()) {
                args.add(FREE_PREFIX + uf.getName() + (primed ? "'" : ""));
            }
            return NEXT_UF_PREFIX + uf.getName() + "(" + String.join(", ", args) + ")";
        }

        // === 折叠部分写入 ===

        /**
         * 把以同一变量为根的所有条目合并为该变量的完整新值。
         * 位区间写入用拼接插入，存储器元素写入用 store。
         */
        private Map<String, Expr> fold(Map<Expr, Expr> entries) {
            Map<String, Expr> folded = new LinkedHashMap<>();
            for (Map.Entry<Expr, Expr> entry : entries.entrySet()) {
                String root = TermManager.rootVariable(entry.getKey()).orElseThrow(() ->
                        fail(EmissionFault.UNDECLARED_VARIABLE, "Definition key " + entry.getKey() + " has no root variable"));
                SignalSort sort = variables.get(root);
                if (sort == null) {
                    throw fail(EmissionFault.UNDECLARED_VARIABLE, "Definition of undeclared signal '" + root + "'");
                }
                Expr current = folded.getOrDefault(root, termManager.var(root, sort));
                folded.put(root, update(current, entry.getKey(), entry.getValue()));
            }
            return folded;
        }

        private Expr update(Expr whole, Expr key, Expr value) {
            if (TermManager.isVariable(key)) {
                return value;
            }
            Expr inner = key.getArgs()[0];
            Expr current = read(whole, inner);
            Expr updated;
            if (key.isBVExtract()) {
                updated = termManager.coerce(
                        termManager.insertBits(current, TermManager.extractHigh(key), TermManager.extractLow(key), value),
                        TermManager.signalSort(current.getSort()));
            } else {
                updated = ctx.mkStore((ArrayExpr) current, key.getArgs()[1], value);
            }
            return update(whole, inner, updated);
        }

        private Expr read(Expr whole, Expr key) {
            if (TermManager.isVariable(key)) {
                return whole;
            }
            Expr inner = read(whole, key.getArgs()[0]);
            if (key.isBVExtract()) {
                return termManager.extract(inner, TermManager.extractHigh(key), TermManager.extractLow(key));
            }
            return ctx.mkSelect((ArrayExpr) inner, key.getArgs()[1]);
        }

        // === 组合逻辑的求值顺序 ===

        /**
         * 被依赖的定义排在前面；组合环上的定义保持原来的相对顺序排在最后。
         */
        private List<String> topologicalOrder() {
            Map<String, Set<String>> pending = new LinkedHashMap<>();
            for (Map.Entry<String, Expr> entry : definitions.entrySet()) {
                Set<String> deps = new LinkedHashSet<>();
                collectDependencies(TermManager.freeVariables(entry.getValue()), deps, new HashSet<>());
                deps.retainAll(definitions.keySet());
                deps.remove(entry.getKey());
                pending.put(entry.getKey(), deps);
            }
            List<String> order = new ArrayList<>();
            boolean progress = true;
            while (progress) {
                progress = false;
                Iterator<Map.Entry<String, Set<String>>> it = pending.entrySet().iterator();
                while (it.hasNext()) {
                    Map.Entry<String, Set<String>> entry = it.next();
                    if (order.containsAll(entry.getValue())) {
                        order.add(entry.getKey());
                        it.remove();
                        progress = true;
                    }
                }
            }
            if (!pending.isEmpty()) {
                logger.warn("模型 {} 中存在组合环: {}", model.getName(), pending.keySet());
                order.addAll(pending.keySet());
            }
            return order;
        }

        private void collectDependencies(Collection<String> names, Set<String> deps, Set<String> seenUfs) {
            for (String name : names) {
                deps.add(name);
                UFPlaceholder uf = combinational.get(name);
                if (uf != null && seenUfs.add(name)) {
                    collectDependencies(uf.getParams().stream().map(Variable::getName).toList(), deps, seenUfs);
                }
            }
        }

        // === 引用改写 ===

        private String render(Expr term, boolean primed) {
            try {
                return printer.render(term, primed, this);
            } catch (UnsupportedOperationException e) {
                logger.error("模型 {} 中的项无法输出: {}", model.getName(), term);
                throw new EmissionException(EmissionFault.UNSUPPORTED_OPERATOR, model.getName(), e.getMessage(), e);
            }
        }

        @Override
        public String renderVariable(String name, boolean primed) {
            int dot = name.indexOf('.');
            if (dot >= 0) {
                Instance instance = model.getInstances().get(name.substring(0, dot));
                if (instance == null || instance.getModel().findOutput(name.substring(dot + 1)).isEmpty()) {
                    throw fail(EmissionFault.UNDECLARED_VARIABLE, "Reference to unknown instance output '" + name + "'");
                }
                // 子实例的输出由它自己的 next 推进
                return name;
            }
            UFPlaceholder uf = combinational.get(name);
            if (uf != null) {
                return application(uf, primed);
            }
            if (!variables.containsKey(name)) {
                throw fail(EmissionFault.UNDECLARED_VARIABLE, "Reference to undeclared signal '" + name + "'");
            }
            return primed ? name + "'" : name;
        }

        private String application(UFPlaceholder uf, boolean primed) {
            if (expanding.contains(uf.getName())) {
                throw fail(EmissionFault.CYCLIC_UF_REFERENCE, "UF '" + uf.getName() + "' depends on itself through " + expanding);
            }
            expanding.push(uf.getName());
            List<String> args = new ArrayList<>();
            for (Variable param : uf.getParams()) {
                args.add(renderVariable(param.getName(), primed));
            }
            if (uf.isHasFreeArgument()) {
                args.add(FREE_PREFIX + uf.getName() + (primed ? "'" : ""));
            }
            expanding.pop();
            return UF_PREFIX + uf.getName() + "(" + String.join(", ", args) + ")";
        }

        @Override
        public String renderApplication(String functionName, List<String> renderedArgs) {
            String prefix;
            if (combinational.containsKey(functionName)) {
                prefix = UF_PREFIX;
            } else if (sequential.containsKey(functionName)) {
                prefix = NEXT_UF_PREFIX;
            } else {
                throw fail(EmissionFault.UNDECLARED_UF, "Application of undeclared function '" + functionName + "'");
            }
            return prefix + functionName + "(" + String.join(", ", renderedArgs) + ")";
        }

        private EmissionException fail(EmissionFault fault, String message) {
            logger.error("输出模型 {} 失败: {}", model.getName(), message);
            return new EmissionException(fault, model.getName(), message);
        }

        private void line(int depth, String text) {
            out.append(INDENT.repeat(depth)).append(text).append('\n');
        }
    }
}
