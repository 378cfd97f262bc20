package org.rtlsym.translate;

import org.rtlsym.model.ValidationResult;

import java.util.Objects;
import java.util.Optional;

/**
 * RTL 到 Model 的翻译失败。翻译从不返回部分结果。
 */
public class TranslationException extends RuntimeException {

    private final TranslationFault fault;
    private final String moduleName;
    private final ValidationResult validationResult;

    public TranslationException(TranslationFault fault, String moduleName, String message) {
        this(fault, moduleName, message, null);
    }

    public TranslationException(TranslationFault fault, String moduleName, String message, ValidationResult validationResult) {
        super("[" + fault + "] in module " + moduleName + ": " + message);
        this.fault = Objects.requireNonNull(fault, "Fault cannot be null.");
        this.moduleName = moduleName;
        this.validationResult = validationResult;
    }

    public TranslationFault getFault() {
        return fault;
    }

    public String getModuleName() {
        return moduleName;
    }

    /**
     * 仅当 fault 为 INVALID_MODEL 时存在。
     */
    public Optional<ValidationResult> getValidationResult() {
        return Optional.ofNullable(validationResult);
    }
}
