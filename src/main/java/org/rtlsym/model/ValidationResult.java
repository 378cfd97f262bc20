package org.rtlsym.model;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * validate() 的结果：全部诊断 (不在第一个错误处停止)。
 * 两个结果的相等与诊断的顺序无关。
 */
public final class ValidationResult {

    private final List<Diagnostic> diagnostics;

    public ValidationResult(List<Diagnostic> diagnostics) {
        this.diagnostics = List.copyOf(diagnostics);
    }

    public boolean isValid() {
        return diagnostics.isEmpty();
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public boolean hasViolation(Violation violation) {
        return diagnostics.stream().anyMatch(d -> d.getViolation() == violation);
    }

    public List<Diagnostic> getDiagnostics(Violation violation) {
        return diagnostics.stream().filter(d -> d.getViolation() == violation).collect(Collectors.toList());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Set.copyOf(diagnostics).equals(Set.copyOf(((ValidationResult) o).diagnostics));
    }

    @Override
    public int hashCode() {
        return Set.copyOf(diagnostics).hashCode();
    }

    @Override
    public String toString() {
        if (isValid()) {
            return "valid";
        }
        return diagnostics.stream().map(Diagnostic::toString).collect(Collectors.joining("\n"));
    }
}
