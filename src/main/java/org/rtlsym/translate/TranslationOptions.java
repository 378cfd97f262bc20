package org.rtlsym.translate;

import org.rtlsym.model.Model;

import java.util.*;

/**
 * 翻译选项：重要信号集合 (缺省表示全部保留)、COI 策略、预先提供的子模块模型。
 * 此类是不可变的。
 */
public final class TranslationOptions {

    private static final TranslationOptions DEFAULTS = builder().build();

    private final Set<String> importantSignals;
    private final CoiPolicy coiPolicy;
    private final Map<String, Model> definedModules;

    private TranslationOptions(Builder builder) {
        this.importantSignals = builder.importantSignals == null
                ? null
                : Collections.unmodifiableSet(new LinkedHashSet<>(builder.importantSignals));
        this.coiPolicy = builder.coiPolicy;
        this.definedModules = Collections.unmodifiableMap(new LinkedHashMap<>(builder.definedModules));
    }

    public static TranslationOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Set<String>> getImportantSignals() {
        return Optional.ofNullable(importantSignals);
    }

    public CoiPolicy getCoiPolicy() {
        return coiPolicy;
    }

    public Optional<Model> getDefinedModule(String moduleName) {
        return Optional.ofNullable(definedModules.get(moduleName));
    }

    public Map<String, Model> getDefinedModules() {
        return definedModules;
    }

    @Override
    public String toString() {
        return "TranslationOptions{important=" + importantSignals + ", policy=" + coiPolicy
                + ", defined=" + definedModules.keySet() + "}";
    }

    public static final class Builder {

        private Set<String> importantSignals;
        private CoiPolicy coiPolicy = CoiPolicy.NO_COI;
        private final Map<String, Model> definedModules = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder importantSignals(Collection<String> names) {
            this.importantSignals = new LinkedHashSet<>(Objects.requireNonNull(names));
            return this;
        }

        public Builder importantSignals(String... names) {
            return importantSignals(Arrays.asList(names));
        }

        public Builder coiPolicy(CoiPolicy policy) {
            this.coiPolicy = Objects.requireNonNull(policy);
            return this;
        }

        /**
         * 以给定模型代替同名子模块的翻译结果。
         */
        public Builder definedModule(Model model) {
            definedModules.put(model.getName(), model);
            return this;
        }

        public TranslationOptions build() {
            return new TranslationOptions(this);
        }
    }
}
