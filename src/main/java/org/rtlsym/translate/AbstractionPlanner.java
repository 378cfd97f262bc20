package org.rtlsym.translate;

import com.microsoft.z3.Expr;
import org.rtlsym.core.Variable;
import org.rtlsym.model.Model;
import org.rtlsym.model.Provenance;
import org.rtlsym.model.UFPlaceholder;
import org.rtlsym.symbolic.TermManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 给定重要信号集合与 COI 策略，从完整数据流中决定保留、替换为 UF 或删除哪些信号。
 * <ul>
 *     <li>NO_COI：被保留逻辑引用的省略信号成为无参数、带自由参数的组合 UF。</li>
 *     <li>UF_ARGS_COI：省略的寄存器成为时序 UF，省略的线网成为组合 UF；参数是沿依赖穿过省略线网
 *     遇到的前沿 (重要信号、其他省略的寄存器、子模块输出)。前沿中的省略寄存器依次得到自己的时序 UF，
 *     形成链。遇到非重要输入、无驱动信号、被穿过的省略线网或自身的上一周期值时带自由参数。</li>
 *     <li>KEEP_COI：保留重要信号的传递影响锥 (包括跨周期)，删除其余信号，不引入 UF。</li>
 * </ul>
 */
final class AbstractionPlanner {

    private static final Logger logger = LoggerFactory.getLogger(AbstractionPlanner.class);

    private final ModuleDataflow dataflow;
    private final Set<String> important;

    AbstractionPlanner(ModuleDataflow dataflow, Set<String> important) {
        this.dataflow = dataflow;
        this.important = important;
        for (String name : important) {
            if (dataflow.declared(name).isEmpty()) {
                logger.error("重要信号 {} 不是模块 {} 的信号", name, dataflow.getModuleName());
                throw new TranslationException(TranslationFault.UNKNOWN_SIGNAL, dataflow.getModuleName(),
                        "Important signal '" + name + "' is not declared");
            }
        }
    }

    Model plan(CoiPolicy policy) {
        logger.debug("模块 {} 使用 {} 抽象，重要信号: {}", dataflow.getModuleName(), policy, important);
        return switch (policy) {
            case KEEP_COI -> keepCone();
            case NO_COI, UF_ARGS_COI -> abstractWithUfs(policy);
        };
    }

    // === KEEP_COI ===

    private Model keepCone() {
        Set<String> kept = new LinkedHashSet<>();
        Set<String> keptInstances = new LinkedHashSet<>();
        Deque<String> worklist = new ArrayDeque<>(important);
        while (!worklist.isEmpty()) {
            String name = worklist.poll();
            if (!kept.add(name)) {
                continue;
            }
            int dot = name.indexOf('.');
            if (dot >= 0) {
                // 子模块输出依赖于实例的全部输入绑定
                String instanceName = name.substring(0, dot);
                if (keptInstances.add(instanceName)) {
                    worklist.addAll(dataflow.bindingDependencies(instanceName));
                }
                continue;
            }
            worklist.addAll(dataflow.dependencies(name));
        }
        logger.debug("KEEP_COI 保留信号: {}", kept);
        return assemble(kept, kept, keptInstances, List.of(), List.of(), Set.of());
    }

    // === NO_COI / UF_ARGS_COI ===

    /**
     * 一次 UF 抽象的可变状态。
     */
    private final class UfSession {
        private final CoiPolicy policy;
        private final Set<String> keptInstances = new LinkedHashSet<>();
        private final Set<String> referencedInputs = new LinkedHashSet<>();
        private final Set<String> enqueued = new LinkedHashSet<>();
        private final Deque<String> worklist = new ArrayDeque<>();
        private final List<UFPlaceholder> ufs = new ArrayList<>();
        private final List<UFPlaceholder> nextUfs = new ArrayList<>();

        UfSession(CoiPolicy policy) {
            this.policy = policy;
        }

        /**
         * 被保留的逻辑引用了 name。
         */
        void reference(String name) {
            int dot = name.indexOf('.');
            if (dot >= 0) {
                keepInstance(name.substring(0, dot));
            } else if (important.contains(name)) {
                return;
            } else if (dataflow.isInput(name)) {
                referencedInputs.add(name);
            } else if (enqueued.add(name)) {
                worklist.add(name);
            }
        }

        void keepInstance(String instanceName) {
            if (keptInstances.add(instanceName)) {
                dataflow.bindingDependencies(instanceName).forEach(this::reference);
            }
        }

        void run() {
            while (!worklist.isEmpty()) {
                String elided = worklist.poll();
                Variable signal = dataflow.declared(elided).orElseThrow();
                if (policy == CoiPolicy.NO_COI || !dataflow.isDriven(elided)) {
                    ufs.add(UFPlaceholder.nondeterministic(elided, signal.getSort()));
                    logger.debug("信号 {} 抽象为无参数 UF", elided);
                    continue;
                }
                Frontier frontier = new Frontier(elided);
                frontier.walk(dataflow.dependencies(elided));
                UFPlaceholder uf = new UFPlaceholder(elided, signal.getSort(), frontier.parameters(), frontier.residual);
                if (dataflow.isRegister(elided)) {
                    nextUfs.add(uf);
                    logger.debug("寄存器 {} 抽象为时序 UF: {}", elided, uf);
                } else {
                    ufs.add(uf);
                    logger.debug("线网 {} 抽象为组合 UF: {}", elided, uf);
                }
            }
        }

        /**
         * 从一个省略信号的定义出发，穿过省略的线网，收集 UF 参数。
         */
        private final class Frontier {
            private final String root;
            private final Set<String> visitedWires = new HashSet<>();
            private final Set<String> params = new LinkedHashSet<>();
            private boolean residual;

            Frontier(String elided) {
                root = elided;
                visitedWires.add(elided);
            }

            void walk(Set<String> dependencies) {
                for (String dep : dependencies) {
                    int dot = dep.indexOf('.');
                    if (dot >= 0) {
                        params.add(dep);
                        keepInstance(dep.substring(0, dot));
                    } else if (important.contains(dep)) {
                        params.add(dep);
                    } else if (dep.equals(root)) {
                        // 自身的上一周期值没有被建模
                        residual = true;
                    } else if (dataflow.isInput(dep) || !dataflow.isDriven(dep)) {
                        residual = true;
                    } else if (dataflow.isRegister(dep)) {
                        params.add(dep);
                        reference(dep);
                    } else {
                        // 穿过的省略线网没有自己的 UF
                        residual = true;
                        if (visitedWires.add(dep)) {
                            walk(dataflow.dependencies(dep));
                        }
                    }
                }
            }

            List<Variable> parameters() {
                List<String> ordered = new ArrayList<>(params);
                List<String> order = dataflow.getDeclarationOrder();
                // 按声明顺序；限定名排在最后，保持出现顺序
                ordered.sort(Comparator.comparingInt(n -> order.contains(n) ? order.indexOf(n) : Integer.MAX_VALUE));
                List<Variable> result = new ArrayList<>();
                for (String name : ordered) {
                    result.add(name.indexOf('.') >= 0
                            ? dataflow.qualifiedOutput(name).orElseThrow()
                            : dataflow.declared(name).orElseThrow());
                }
                return result;
            }
        }
    }

    private Model abstractWithUfs(CoiPolicy policy) {
        UfSession session = new UfSession(policy);
        for (String name : important) {
            for (String dep : dataflow.dependencies(name)) {
                session.reference(dep);
            }
        }
        session.run();

        Set<String> covered = new HashSet<>();
        session.ufs.forEach(uf -> covered.add(uf.getName()));
        session.nextUfs.forEach(uf -> covered.add(uf.getName()));

        Set<String> keptDeclarations = new LinkedHashSet<>(important);
        keptDeclarations.addAll(session.referencedInputs);
        Set<String> keptOutputs = new LinkedHashSet<>(important);
        keptOutputs.addAll(covered);
        return assemble(keptDeclarations, keptOutputs, session.keptInstances, session.ufs, session.nextUfs, important);
    }

    // === 组装 ===

    private Model assemble(Set<String> keptDeclarations, Set<String> keptOutputs, Set<String> keptInstances,
                           List<UFPlaceholder> ufs, List<UFPlaceholder> nextUfs, Set<String> definitionsOnlyFor) {
        Set<String> defined = definitionsOnlyFor.isEmpty() ? keptDeclarations : definitionsOnlyFor;
        Model.Builder builder = Model.builder(dataflow.getModuleName()).provenance(Provenance.SYNTAX_GENERATED);
        dataflow.getInputs().stream().filter(v -> keptDeclarations.contains(v.getName())).forEach(builder::input);
        dataflow.getOutputs().stream().filter(v -> keptOutputs.contains(v.getName())).forEach(builder::output);
        dataflow.getState().stream().filter(v -> keptDeclarations.contains(v.getName())).forEach(builder::state);
        ufs.forEach(builder::uf);
        nextUfs.forEach(builder::nextUf);
        dataflow.getInstances().forEach((name, instance) -> {
            if (keptInstances.contains(name)) {
                builder.instance(name, instance);
            }
        });
        copyEntries(dataflow.getLogic(), defined, builder::logic);
        copyEntries(dataflow.getDefaultNext(), defined, builder::defaultNext);
        dataflow.getInitValues().forEach((v, value) -> {
            if (defined.contains(v.getName())) {
                builder.initValue(v, value);
            }
        });
        return builder.build();
    }

    private interface EntrySink {
        void put(Expr key, Expr value);
    }

    private static void copyEntries(Map<Expr, Expr> entries, Set<String> kept, EntrySink sink) {
        for (Map.Entry<Expr, Expr> entry : entries.entrySet()) {
            if (TermManager.rootVariable(entry.getKey()).filter(kept::contains).isPresent()) {
                sink.put(entry.getKey(), entry.getValue());
            }
        }
    }
}
