package org.rtlsym.transform;

import java.util.Objects;

public class CaseSplitException extends RuntimeException {

    private final CaseSplitFault fault;

    public CaseSplitException(CaseSplitFault fault, String message) {
        super("[" + fault + "] " + message);
        this.fault = Objects.requireNonNull(fault, "Fault cannot be null.");
    }

    public CaseSplitFault getFault() {
        return fault;
    }
}
