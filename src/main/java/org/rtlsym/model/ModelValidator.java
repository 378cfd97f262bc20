package org.rtlsym.model;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Expr;
import org.rtlsym.core.SignalSort;
import org.rtlsym.core.Variable;
import org.rtlsym.symbolic.TermManager;

import java.util.*;

/**
 * 收集 Model 树中所有结构不变式的违反。诊断按模型路径 (top.inst.sub) 标注。
 */
final class ModelValidator {

    private enum Category {
        INPUT, OUTPUT, STATE, UF
    }

    private final List<Diagnostic> diagnostics;

    ModelValidator(List<Diagnostic> diagnostics) {
        this.diagnostics = diagnostics;
    }

    void validate(Model model, String path) {
        // 先检查子模型
        for (Map.Entry<String, Instance> entry : model.getInstances().entrySet()) {
            validate(entry.getValue().getModel(), path + "." + entry.getKey());
        }
        checkNames(model, path);
        checkDefinitions(model, path, model.getLogic(), "logic");
        checkDefinitions(model, path, model.getDefaultNext(), "default next");
        checkStateDefined(model, path);
        checkOutputsDefined(model, path);
        checkBindings(model, path);
        checkInitValues(model, path);
        checkPredicates(path, model.getAssertions(), "assertion");
        checkPredicates(path, model.getAssumptions(), "assumption");
    }

    private void report(String path, Violation violation, String message) {
        diagnostics.add(new Diagnostic(path, violation, message));
    }

    // (1) (2)
    private void checkNames(Model model, String path) {
        Map<String, List<Category>> seen = new LinkedHashMap<>();
        model.getInputs().forEach(v -> seen.computeIfAbsent(v.getName(), k -> new ArrayList<>()).add(Category.INPUT));
        model.getOutputs().forEach(v -> seen.computeIfAbsent(v.getName(), k -> new ArrayList<>()).add(Category.OUTPUT));
        model.getState().forEach(v -> seen.computeIfAbsent(v.getName(), k -> new ArrayList<>()).add(Category.STATE));
        model.getUfs().forEach(uf -> seen.computeIfAbsent(uf.getName(), k -> new ArrayList<>()).add(Category.UF));
        model.getNextUfs().forEach(uf -> seen.computeIfAbsent(uf.getName(), k -> new ArrayList<>()).add(Category.UF));

        for (Map.Entry<String, List<Category>> entry : seen.entrySet()) {
            List<Category> categories = entry.getValue();
            if (categories.size() > 1 && !isOutputUfPair(categories)) {
                report(path, Violation.NAME_COLLISION, "Name '" + entry.getKey() + "' declared as " + categories);
            }
            if (entry.getKey().indexOf('.') >= 0) {
                report(path, Violation.QUALIFIED_DECLARATION, "Declared name '" + entry.getKey() + "' contains '.'");
            }
        }
        for (String instanceName : model.getInstances().keySet()) {
            if (instanceName.indexOf('.') >= 0) {
                report(path, Violation.QUALIFIED_DECLARATION, "Instance name '" + instanceName + "' contains '.'");
            }
        }
    }

    private static boolean isOutputUfPair(List<Category> categories) {
        return categories.size() == 2 && categories.contains(Category.OUTPUT) && categories.contains(Category.UF);
    }

    // (3) (7)
    private void checkDefinitions(Model model, String path, Map<Expr, Expr> definitions, String section) {
        for (Map.Entry<Expr, Expr> entry : definitions.entrySet()) {
            Expr key = entry.getKey();
            Expr value = entry.getValue();
            Optional<String> root = TermManager.rootVariable(key);
            if (root.isEmpty()) {
                report(path, Violation.ILLEGAL_DEFINITION, section + " key " + key + " is not a variable, slice or element");
                continue;
            }
            String target = root.get();
            if (model.findInput(target).isPresent()) {
                report(path, Violation.ILLEGAL_DEFINITION, section + " defines input '" + target + "'");
            } else if (model.isUfName(target)) {
                report(path, Violation.ILLEGAL_DEFINITION, section + " defines UF placeholder '" + target + "'");
            } else if (model.findOutput(target).isEmpty() && model.findState(target).isEmpty()) {
                report(path, Violation.ILLEGAL_DEFINITION, section + " defines undeclared signal '" + target + "'");
            } else if (TermManager.isVariable(key)) {
                SignalSort declared = model.findDeclared(target).get().getSort();
                if (!TermManager.signalSortMatches(key.getSort(), declared)) {
                    report(path, Violation.TYPE_ERROR, section + " key '" + target + "' has sort " + key.getSort() + ", declared " + declared);
                }
            }
            if (!TermManager.typecheck(key, value)) {
                report(path, Violation.TYPE_ERROR, section + " entry " + key + " := " + value + " does not type-check");
            }
            checkQualifiedReferences(model, path, value);
        }
    }

    /**
     * 值中的限定引用 inst.port 必须指向一个实例的同类型输出。
     */
    private void checkQualifiedReferences(Model model, String path, Expr term) {
        for (Map.Entry<String, SignalSort> ref : TermManager.freeVariableSorts(term).entrySet()) {
            String refName = ref.getKey();
            int dot = refName.indexOf('.');
            if (dot < 0) {
                continue;
            }
            Instance instance = model.getInstances().get(refName.substring(0, dot));
            Optional<Variable> port = instance == null
                    ? Optional.empty()
                    : instance.getModel().findOutput(refName.substring(dot + 1));
            if (port.isEmpty() || !port.get().getSort().equals(ref.getValue())) {
                report(path, Violation.TYPE_ERROR, "Unresolved qualified reference '" + refName + "'");
            }
        }
    }

    // (4)
    private void checkStateDefined(Model model, String path) {
        for (Variable v : model.getState()) {
            if (v.getSort().isArray()) {
                continue;
            }
            boolean inLogic = definesSignal(model.getLogic(), v.getName());
            boolean inNext = definesSignal(model.getDefaultNext(), v.getName());
            if (!inLogic && !inNext) {
                report(path, Violation.STATE_DEFINITION, "State '" + v.getName() + "' has no definition");
            } else if (inLogic && inNext) {
                report(path, Violation.STATE_DEFINITION, "State '" + v.getName() + "' is defined in both logic and default next");
            }
        }
    }

    // (5)
    private void checkOutputsDefined(Model model, String path) {
        for (Variable v : model.getOutputs()) {
            boolean defined = definesSignal(model.getLogic(), v.getName())
                    || definesSignal(model.getDefaultNext(), v.getName())
                    || model.isUfName(v.getName());
            if (!defined) {
                report(path, Violation.OUTPUT_UNDEFINED, "Output '" + v.getName() + "' has no definition");
            }
        }
    }

    private static boolean definesSignal(Map<Expr, Expr> definitions, String signalName) {
        for (Expr key : definitions.keySet()) {
            if (TermManager.rootVariable(key).filter(signalName::equals).isPresent()) {
                return true;
            }
        }
        return false;
    }

    // (6)
    private void checkBindings(Model model, String path) {
        for (Map.Entry<String, Instance> entry : model.getInstances().entrySet()) {
            String instanceName = entry.getKey();
            Instance instance = entry.getValue();
            Model child = instance.getModel();

            Set<String> expected = new LinkedHashSet<>();
            child.getInputs().forEach(v -> expected.add(v.getName()));
            Set<String> bound = new LinkedHashSet<>();
            instance.getInputs().keySet().forEach(v -> bound.add(v.getName()));

            for (String missing : difference(expected, bound)) {
                report(path, Violation.BINDING_MISMATCH, "Instance '" + instanceName + "' does not bind input '" + missing + "'");
            }
            for (String extra : difference(bound, expected)) {
                report(path, Violation.BINDING_MISMATCH, "Instance '" + instanceName + "' binds unknown input '" + extra + "'");
            }
            for (Map.Entry<Variable, Expr> binding : instance.getInputs().entrySet()) {
                Variable port = binding.getKey();
                child.findInput(port.getName())
                        .filter(declared -> !declared.getSort().equals(port.getSort()))
                        .ifPresent(declared -> report(path, Violation.BINDING_MISMATCH,
                                "Instance '" + instanceName + "' binds '" + port + "' but child declares '" + declared + "'"));
                Expr value = binding.getValue();
                if (!TermManager.typecheck(value) || !TermManager.signalSortMatches(value.getSort(), port.getSort())) {
                    report(path, Violation.TYPE_ERROR, "Instance '" + instanceName + "' binding " + port.getName() + " := " + value + " does not type-check");
                }
                checkQualifiedReferences(model, path, value);
            }
        }
    }

    private static Set<String> difference(Set<String> left, Set<String> right) {
        Set<String> result = new LinkedHashSet<>(left);
        result.removeAll(right);
        return result;
    }

    private void checkInitValues(Model model, String path) {
        for (Map.Entry<Variable, Expr> entry : model.getInitValues().entrySet()) {
            Variable target = entry.getKey();
            boolean declared = model.getState().contains(target) || model.getOutputs().contains(target);
            if (!declared) {
                report(path, Violation.INIT_TARGET_UNDECLARED, "Init value for undeclared '" + target + "'");
            } else if (!TermManager.typecheck(entry.getValue())
                    || !TermManager.signalSortMatches(entry.getValue().getSort(), target.getSort())) {
                report(path, Violation.TYPE_ERROR, "Init value " + entry.getValue() + " does not match '" + target + "'");
            }
        }
    }

    // (7)
    private void checkPredicates(String path, List<BoolExpr> predicates, String label) {
        for (BoolExpr predicate : predicates) {
            if (!TermManager.typecheck(predicate) || !TermManager.isBool(predicate)) {
                report(path, Violation.TYPE_ERROR, label + " " + predicate + " is not a well-sorted boolean");
            }
        }
    }
}
