package org.rtlsym.rtl;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 前端解析出的整个设计：按名称索引的模块集合。
 */
public final class RtlDesign {

    private final Map<String, RtlModule> modules;

    public RtlDesign(Collection<RtlModule> modules) {
        Map<String, RtlModule> byName = new LinkedHashMap<>();
        for (RtlModule module : modules) {
            if (byName.putIfAbsent(module.getName(), module) != null) {
                throw new IllegalArgumentException("Module " + module.getName() + " defined twice");
            }
        }
        this.modules = Collections.unmodifiableMap(byName);
    }

    public static RtlDesign of(RtlModule... modules) {
        return new RtlDesign(Arrays.asList(modules));
    }

    public Optional<RtlModule> getModule(String name) {
        return Optional.ofNullable(modules.get(name));
    }

    public Collection<RtlModule> getModules() {
        return modules.values();
    }
}
