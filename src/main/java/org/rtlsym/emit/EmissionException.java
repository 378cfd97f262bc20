package org.rtlsym.emit;

import java.util.Objects;

public class EmissionException extends RuntimeException {

    private final EmissionFault fault;
    private final String modelName;

    public EmissionException(EmissionFault fault, String modelName, String message) {
        this(fault, modelName, message, null);
    }

    public EmissionException(EmissionFault fault, String modelName, String message, Throwable cause) {
        super("[" + fault + "] " + modelName + ": " + message, cause);
        this.fault = Objects.requireNonNull(fault, "Fault cannot be null.");
        this.modelName = modelName;
    }

    public EmissionFault getFault() {
        return fault;
    }

    public String getModelName() {
        return modelName;
    }
}
