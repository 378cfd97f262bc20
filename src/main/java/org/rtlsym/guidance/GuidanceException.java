package org.rtlsym.guidance;

import java.util.Objects;

public class GuidanceException extends RuntimeException {

    private final GuidanceFault fault;

    public GuidanceException(GuidanceFault fault, String message) {
        super("[" + fault + "] " + message);
        this.fault = Objects.requireNonNull(fault, "Fault cannot be null.");
    }

    public GuidanceFault getFault() {
        return fault;
    }
}
