package org.rtlsym.model;

import lombok.Getter;

import java.util.Objects;

/**
 * 一条校验诊断：出问题的模型路径、违反类型和说明。
 */
@Getter
public final class Diagnostic {

    private final String modelPath;
    private final Violation violation;
    private final String message;

    public Diagnostic(String modelPath, Violation violation, String message) {
        this.modelPath = Objects.requireNonNull(modelPath, "Model path cannot be null.");
        this.violation = Objects.requireNonNull(violation, "Violation cannot be null.");
        this.message = Objects.requireNonNull(message, "Message cannot be null.");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Diagnostic that = (Diagnostic) o;
        return modelPath.equals(that.modelPath) && violation == that.violation && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(modelPath, violation, message);
    }

    @Override
    public String toString() {
        return modelPath + ": [" + violation + "] " + message;
    }
}
