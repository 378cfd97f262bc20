package org.rtlsym.guidance;

import com.microsoft.z3.BoolExpr;
import org.apache.commons.lang3.tuple.Pair;
import org.rtlsym.core.SignalSort;
import org.rtlsym.core.Variable;
import org.rtlsym.model.Instance;
import org.rtlsym.model.Model;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 综合引导的标注存储：按 (限定信号名, 周期) 或 (限定信号名, 谓词) 记录信号的角色。
 * 未标注的周期视为 DONT_CARE。查询不会修改存储。
 * 信号可以用限定名 (inst.sub.x) 查找，也可以用不产生歧义的基本名 (x) 查找。
 * @author Ayalyt
 */
public class Guidance {

    private static final Logger logger = LoggerFactory.getLogger(Guidance.class);

    private final List<String> signals;
    private final Map<String, List<String>> byBaseName = new HashMap<>();
    private final int numCycles;
    private final Map<String, Entry> entries = new LinkedHashMap<>();

    /**
     * 单个信号合并后的标注。
     */
    private static final class Entry {
        private AnnotationKind fallback = AnnotationKind.DONT_CARE;
        private final SortedMap<Integer, AnnotationKind> cycles = new TreeMap<>();
        private final List<Pair<BoolExpr, AnnotationKind>> predicates = new ArrayList<>();
    }

    public Guidance(Collection<String> qualifiedSignals, int numCycles) {
        if (numCycles <= 0) {
            throw new IllegalArgumentException("Number of cycles must be positive, got " + numCycles);
        }
        this.signals = List.copyOf(new LinkedHashSet<>(qualifiedSignals));
        this.numCycles = numCycles;
        for (String signal : signals) {
            byBaseName.computeIfAbsent(baseName(signal), b -> new ArrayList<>()).add(signal);
        }
        logger.debug("Guidance 初始化完成: {} 个信号, {} 个周期", signals.size(), numCycles);
    }

    /**
     * 以模型树中声明的所有输入、输出和状态建立存储。
     * 数组状态按下标展开为 name[0], name[1], ...，元素个数为下标位宽能表示的全部取值。
     */
    public static Guidance forModel(Model model, int numCycles) {
        List<String> names = new ArrayList<>();
        collectSignals(model, "", names);
        return new Guidance(names, numCycles);
    }

    private static void collectSignals(Model model, String prefix, List<String> names) {
        for (List<Variable> group : List.of(model.getInputs(), model.getOutputs(), model.getState())) {
            for (Variable v : group) {
                SignalSort sort = v.getSort();
                if (sort.isArray()) {
                    int length = 1 << sort.getIndexSort().getWidth();
                    for (int i = 0; i < length; i++) {
                        names.add(prefix + v.getName() + "[" + i + "]");
                    }
                } else {
                    names.add(prefix + v.getName());
                }
            }
        }
        for (Map.Entry<String, Instance> instance : model.getInstances().entrySet()) {
            collectSignals(instance.getValue().getModel(), prefix + instance.getKey() + ".", names);
        }
    }

    public List<String> getSignals() {
        return signals;
    }

    public int getNumCycles() {
        return numCycles;
    }

    /**
     * 记录标注。按周期的标注与已有的按周期标注合并；按谓词的标注追加在已有谓词之后
     * (相同的谓词就地更新)；统一标注覆盖该信号之前的全部标注。
     * @throws GuidanceException 信号无法解析、周期越界，或与已有标注的形式冲突。
     */
    public void annotate(String signal, CycleAnnotation annotation) {
        Objects.requireNonNull(annotation, "Annotation cannot be null.");
        String qualified = resolve(signal);
        Entry current = entries.get(qualified);
        switch (annotation.getShape()) {
            case UNIFORM -> {
                Entry replaced = new Entry();
                replaced.fallback = annotation.getUniformKind();
                entries.put(qualified, replaced);
            }
            case BY_CYCLE -> {
                if (current != null && !current.predicates.isEmpty()) {
                    throw shapeConflict(qualified, "cycle-keyed", "predicate-keyed");
                }
                for (Integer cycle : annotation.getCycles().keySet()) {
                    checkCycle(cycle);
                }
                entries.computeIfAbsent(qualified, s -> new Entry()).cycles.putAll(annotation.getCycles());
            }
            case BY_PREDICATE -> {
                if (current != null && !current.cycles.isEmpty()) {
                    throw shapeConflict(qualified, "predicate-keyed", "cycle-keyed");
                }
                Entry entry = entries.computeIfAbsent(qualified, s -> new Entry());
                for (Pair<BoolExpr, AnnotationKind> predicate : annotation.getPredicates()) {
                    addPredicate(entry.predicates, predicate);
                }
            }
        }
        logger.debug("标注 {}: {}", qualified, annotation);
    }

    private static void addPredicate(List<Pair<BoolExpr, AnnotationKind>> predicates, Pair<BoolExpr, AnnotationKind> predicate) {
        for (int i = 0; i < predicates.size(); i++) {
            if (predicates.get(i).getLeft().equals(predicate.getLeft())) {
                predicates.set(i, predicate);
                return;
            }
        }
        predicates.add(predicate);
    }

    /**
     * @return 该周期的标注；信号按谓词标注时为空。
     */
    public Optional<AnnotationKind> getAnnotationAt(String signal, int cycle) {
        String qualified = resolve(signal);
        checkCycle(cycle);
        Entry entry = entries.get(qualified);
        if (entry == null) {
            return Optional.of(AnnotationKind.DONT_CARE);
        }
        if (!entry.predicates.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(entry.cycles.getOrDefault(cycle, entry.fallback));
    }

    public AnnotationKind getAnnotationOrDefault(String signal, int cycle, AnnotationKind defaultKind) {
        return getAnnotationAt(signal, cycle).orElse(defaultKind);
    }

    /**
     * 按谓词的标注，保持加入顺序。信号不是按谓词标注时为空列表。
     */
    public List<Pair<BoolExpr, AnnotationKind>> getPredicatedAnnotations(String signal) {
        Entry entry = entries.get(resolve(signal));
        return entry == null ? List.of() : List.copyOf(entry.predicates);
    }

    /**
     * 所有被标注为 OUTPUT 的 (信号, 周期)，按信号声明顺序和周期排列。
     */
    public Set<Pair<String, Integer>> getCycleOutputs() {
        Set<Pair<String, Integer>> outputs = new LinkedHashSet<>();
        for (String signal : signals) {
            Entry entry = entries.get(signal);
            if (entry == null || !entry.predicates.isEmpty()) {
                continue;
            }
            for (int cycle = 0; cycle < numCycles; cycle++) {
                if (entry.cycles.getOrDefault(cycle, entry.fallback) == AnnotationKind.OUTPUT) {
                    outputs.add(Pair.of(signal, cycle));
                }
            }
        }
        return outputs;
    }

    /**
     * 所有被标注为 OUTPUT 的 (信号, 谓词)。
     */
    public Set<Pair<String, BoolExpr>> getPredicatedOutputs() {
        Set<Pair<String, BoolExpr>> outputs = new LinkedHashSet<>();
        for (String signal : signals) {
            Entry entry = entries.get(signal);
            if (entry == null) {
                continue;
            }
            for (Pair<BoolExpr, AnnotationKind> predicate : entry.predicates) {
                if (predicate.getRight() == AnnotationKind.OUTPUT) {
                    outputs.add(Pair.of(signal, predicate.getLeft()));
                }
            }
        }
        return outputs;
    }

    private String resolve(String signal) {
        Objects.requireNonNull(signal, "Signal name cannot be null.");
        if (signals.contains(signal)) {
            return signal;
        }
        List<String> candidates = byBaseName.getOrDefault(signal, List.of());
        if (candidates.size() == 1) {
            return candidates.get(0);
        }
        if (candidates.isEmpty()) {
            logger.error("未知的信号: {}", signal);
            throw new GuidanceException(GuidanceFault.UNKNOWN_SIGNAL, "Unknown signal '" + signal + "'");
        }
        logger.error("信号名 {} 有歧义: {}", signal, candidates);
        throw new GuidanceException(GuidanceFault.AMBIGUOUS_SIGNAL, "Signal '" + signal + "' matches " + candidates);
    }

    private void checkCycle(int cycle) {
        if (cycle < 0 || cycle >= numCycles) {
            logger.error("周期 {} 超出范围 [0, {})", cycle, numCycles);
            throw new GuidanceException(GuidanceFault.CYCLE_OUT_OF_RANGE,
                    "Cycle " + cycle + " is outside [0, " + numCycles + ")");
        }
    }

    private GuidanceException shapeConflict(String signal, String requested, String existing) {
        logger.error("信号 {} 已有{}标注，不能再加入{}标注", signal, existing, requested);
        return new GuidanceException(GuidanceFault.AMBIGUOUS_ANNOTATION_SHAPE,
                "Cannot add " + requested + " annotations to " + existing + " signal '" + signal + "'");
    }

    /**
     * 限定名的最后一段；数组元素保留下标，如 sub.data[3] -> data[3]。
     */
    private static String baseName(String qualified) {
        int bracket = qualified.indexOf('[');
        String path = bracket >= 0 ? qualified.substring(0, bracket) : qualified;
        int dot = path.lastIndexOf('.');
        return dot >= 0 ? qualified.substring(dot + 1) : qualified;
    }
}
