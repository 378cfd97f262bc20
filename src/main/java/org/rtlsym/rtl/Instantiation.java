package org.rtlsym.rtl;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 子模块实例化：module instanceName(.port(expr), ...)。
 * 输入端口的连接是父模块作用域中的表达式；输出端口的连接是父模块中的左值。
 */
@Getter
public final class Instantiation {

    private final String moduleName;
    private final String instanceName;
    private final Map<String, RtlExpr> connections;

    public Instantiation(String moduleName, String instanceName, Map<String, RtlExpr> connections) {
        this.moduleName = Objects.requireNonNull(moduleName, "Module name cannot be null.");
        this.instanceName = Objects.requireNonNull(instanceName, "Instance name cannot be null.");
        this.connections = Collections.unmodifiableMap(new LinkedHashMap<>(connections));
    }

    @Override
    public String toString() {
        return moduleName + " " + instanceName + connections;
    }
}
