package org.rtlsym.translate;

import com.microsoft.z3.Expr;
import org.rtlsym.core.Variable;
import org.rtlsym.model.Instance;
import org.rtlsym.model.Model;
import org.rtlsym.model.ValidationResult;
import org.rtlsym.rtl.*;
import org.rtlsym.symbolic.TermManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 把前端给出的 RTL 模块图翻译为经过校验的 Model。
 * <p>
 * 子模块递归翻译 (或使用预先提供的模型)，每个不同的子模块在一次翻译中只翻译一次，
 * 其所有实例共享同一个 Model 值。父模块中对子模块输出的引用是限定变量 inst.port。
 * 重要信号集合只作用于顶层模块，子模块总是完整保真。
 * 翻译要么返回通过 validate() 的模型，要么抛出 TranslationException。
 * @author Ayalyt
 */
public class RtlTranslator {

    private static final Logger logger = LoggerFactory.getLogger(RtlTranslator.class);

    private final TermManager termManager;

    public RtlTranslator(TermManager termManager) {
        this.termManager = Objects.requireNonNull(termManager, "TermManager cannot be null.");
    }

    public Model translate(RtlDesign design, String moduleName) {
        return translate(design, moduleName, TranslationOptions.defaults());
    }

    /**
     * @param design 前端解析出的设计。
     * @param moduleName 顶层模块名。
     * @param options 重要信号、COI 策略和预先提供的子模块模型。
     * @return 通过校验的模型。
     * @throws TranslationException 遇到不支持的构造、无法解析的引用，或结果未通过校验。
     */
    public Model translate(RtlDesign design, String moduleName, TranslationOptions options) {
        Objects.requireNonNull(design, "Design cannot be null.");
        Objects.requireNonNull(options, "Options cannot be null.");
        logger.info("开始翻译模块 {}，{}", moduleName, options);

        Session session = new Session(design, options);
        RtlModule top = design.getModule(moduleName).orElseThrow(() -> {
            logger.error("找不到模块 {}", moduleName);
            return new TranslationException(TranslationFault.UNKNOWN_MODULE, moduleName, "Module not found in design");
        });
        session.stack.push(moduleName);
        ModuleDataflow dataflow = session.assemble(top);
        session.stack.pop();

        Model model = options.getImportantSignals()
                .map(important -> new AbstractionPlanner(dataflow, important).plan(options.getCoiPolicy()))
                .orElseGet(dataflow::toModel);

        ValidationResult result = model.validate();
        if (!result.isValid()) {
            logger.error("模块 {} 的翻译结果未通过校验:\n{}", moduleName, result);
            throw new TranslationException(TranslationFault.INVALID_MODEL, moduleName,
                    "Translated model is invalid: " + result.getDiagnostics(), result);
        }
        logger.info("模块 {} 翻译完成: {} 个输入, {} 个输出, {} 个状态, {} 个 UF, {} 个实例",
                moduleName, model.getInputs().size(), model.getOutputs().size(), model.getState().size(),
                model.getUfs().size() + model.getNextUfs().size(), model.getInstances().size());
        return model;
    }

    /**
     * 一次翻译的上下文：子模块缓存与实例化栈。
     */
    private final class Session {
        private final RtlDesign design;
        private final TranslationOptions options;
        private final Map<String, Model> translated = new HashMap<>();
        private final Deque<String> stack = new ArrayDeque<>();

        Session(RtlDesign design, TranslationOptions options) {
            this.design = design;
            this.options = options;
        }

        Model child(String parentName, String childName) {
            Optional<Model> defined = options.getDefinedModule(childName);
            if (defined.isPresent()) {
                logger.debug("使用预先提供的模型 {}", childName);
                return defined.get();
            }
            Model cached = translated.get(childName);
            if (cached != null) {
                return cached;
            }
            if (stack.contains(childName)) {
                logger.error("递归实例化: {} -> {}", stack, childName);
                throw new TranslationException(TranslationFault.RECURSIVE_INSTANTIATION, parentName,
                        "Module " + childName + " instantiates itself through " + stack);
            }
            RtlModule module = design.getModule(childName).orElseThrow(() -> {
                logger.error("找不到子模块 {}", childName);
                return new TranslationException(TranslationFault.UNKNOWN_MODULE, parentName,
                        "Instantiated module " + childName + " not found");
            });
            stack.push(childName);
            Model model = assemble(module).toModel();
            stack.pop();
            translated.put(childName, model);
            logger.debug("子模块 {} 翻译完成", childName);
            return model;
        }

        ModuleDataflow assemble(RtlModule module) {
            ExpressionLowering lowering = new ExpressionLowering(termManager, module);
            DataflowBuilder builder = new DataflowBuilder(termManager, lowering);

            Set<String> clocks = module.getClocks();
            if (clocks.size() > 1) {
                throw lowering.fail(TranslationFault.MULTIPLE_CLOCK_DOMAINS, "Clocks " + clocks);
            }
            for (String clock : clocks) {
                lowering.signal(clock);
            }

            List<String> order = new ArrayList<>();
            List<Variable> inputs = new ArrayList<>();
            List<Variable> outputs = new ArrayList<>();
            List<Variable> state = new ArrayList<>();
            LinkedHashMap<Variable, Expr> initValues = new LinkedHashMap<>();
            for (RtlSignal signal : module.getSignals().values()) {
                if (clocks.contains(signal.getName())) {
                    continue;
                }
                Variable v = ExpressionLowering.variableOf(signal);
                order.add(signal.getName());
                switch (signal.getKind()) {
                    case INPUT -> {
                        if (signal.isArray() || signal.hasInitValue()) {
                            throw lowering.fail(TranslationFault.UNSUPPORTED_CONSTRUCT, "Unsupported input declaration '" + signal + "'");
                        }
                        inputs.add(v);
                    }
                    case OUTPUT -> outputs.add(v);
                    case REG, WIRE -> state.add(v);
                }
                if (signal.hasInitValue()) {
                    if (signal.isArray()) {
                        throw lowering.fail(TranslationFault.UNSUPPORTED_CONSTRUCT, "Initialized memory '" + signal.getName() + "'");
                    }
                    initValues.put(v, termManager.constant(signal.getSort(), signal.getInitValue()));
                }
            }

            Drivers drivers = new Drivers(lowering);
            LinkedHashMap<Expr, Expr> logic = new LinkedHashMap<>();
            LinkedHashMap<Expr, Expr> defaultNext = new LinkedHashMap<>();
            int index = 0;
            for (AlwaysBlock block : module.getAlwaysBlocks()) {
                String source = (block.isClocked() ? "clocked block #" : "combinational block #") + index++;
                LinkedHashMap<Expr, Expr> entries = builder.build(block.getStatements());
                drivers.register(source, block.isClocked(), entries.keySet());
                (block.isClocked() ? defaultNext : logic).putAll(entries);
            }
            index = 0;
            for (RtlStatement assign : module.getAssigns()) {
                LinkedHashMap<Expr, Expr> entries = builder.build(List.of(assign));
                drivers.register("assign #" + index++, false, entries.keySet());
                logic.putAll(entries);
            }

            LinkedHashMap<String, Instance> instances = new LinkedHashMap<>();
            for (Instantiation instantiation : module.getInstantiations()) {
                if (instances.containsKey(instantiation.getInstanceName())) {
                    throw lowering.fail(TranslationFault.UNSUPPORTED_CONSTRUCT,
                            "Duplicate instance name '" + instantiation.getInstanceName() + "'");
                }
                instances.put(instantiation.getInstanceName(),
                        instantiate(module, instantiation, clocks, lowering, builder, drivers, logic));
            }
            return new ModuleDataflow(module.getName(), order, inputs, outputs, state, logic, defaultNext, instances, initValues);
        }

        private Instance instantiate(RtlModule parent, Instantiation instantiation, Set<String> parentClocks,
                                     ExpressionLowering lowering, DataflowBuilder builder, Drivers drivers,
                                     Map<Expr, Expr> logic) {
            String instanceName = instantiation.getInstanceName();
            Model child = child(parent.getName(), instantiation.getModuleName());
            Set<String> childClocks = design.getModule(instantiation.getModuleName())
                    .filter(m -> options.getDefinedModule(m.getName()).isEmpty())
                    .map(RtlModule::getClocks)
                    .orElse(Set.of());

            LinkedHashMap<Variable, Expr> bindings = new LinkedHashMap<>();
            for (Map.Entry<String, RtlExpr> connection : instantiation.getConnections().entrySet()) {
                String port = connection.getKey();
                RtlExpr expr = connection.getValue();
                if (childClocks.contains(port) || isClockReference(expr, parentClocks)) {
                    continue;
                }
                Optional<Variable> input = child.findInput(port);
                if (input.isPresent()) {
                    bindings.put(input.get(), lowering.lowerTo(expr, input.get().getSort(), lowering.getModuleScope()));
                    continue;
                }
                Optional<Variable> output = child.findOutput(port);
                if (output.isEmpty()) {
                    throw lowering.fail(TranslationFault.UNKNOWN_PORT,
                            "Module " + child.getName() + " has no port '" + port + "' (instance " + instanceName + ")");
                }
                Expr qualified = termManager.var(output.get().qualify(instanceName));
                LinkedHashMap<Expr, Expr> entries = builder.buildConnection(expr, qualified);
                drivers.register("instance " + instanceName, false, entries.keySet());
                logic.putAll(entries);
            }
            for (Variable input : child.getInputs()) {
                if (!bindings.containsKey(input)) {
                    throw lowering.fail(TranslationFault.UNBOUND_PORT,
                            "Input '" + input.getName() + "' of instance " + instanceName + " is not connected");
                }
            }
            return new Instance(child, bindings);
        }

        private boolean isClockReference(RtlExpr expr, Set<String> clocks) {
            return expr.getKind() == RtlExpr.Kind.REF && clocks.contains(expr.getName());
        }
    }

    /**
     * 记录每个信号由哪些块驱动，发现冲突的驱动时报错。
     * 不同块可以驱动同一信号的不同位区间或不同存储器元素，但不能都是整体驱动。
     */
    private static final class Drivers {

        private static final class Driver {
            private final String source;
            private final boolean clocked;
            private final Expr key;

            Driver(String source, boolean clocked, Expr key) {
                this.source = source;
                this.clocked = clocked;
                this.key = key;
            }

            boolean conflictsWith(Driver other) {
                return clocked != other.clocked
                        || key.equals(other.key)
                        || TermManager.isVariable(key)
                        || TermManager.isVariable(other.key);
            }
        }

        private final ExpressionLowering lowering;
        private final Map<String, List<Driver>> byRoot = new HashMap<>();

        Drivers(ExpressionLowering lowering) {
            this.lowering = lowering;
        }

        void register(String source, boolean clocked, Collection<Expr> keys) {
            for (Expr key : keys) {
                String root = TermManager.rootVariable(key).orElseThrow();
                Driver driver = new Driver(source, clocked, key);
                List<Driver> existing = byRoot.computeIfAbsent(root, r -> new ArrayList<>());
                for (Driver other : existing) {
                    if (!other.source.equals(source) && driver.conflictsWith(other)) {
                        throw lowering.fail(TranslationFault.MULTIPLE_DRIVERS,
                                "Signal '" + root + "' driven by " + other.source + " and " + source);
                    }
                }
                existing.add(driver);
            }
        }
    }
}
