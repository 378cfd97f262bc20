package org.rtlsym.rtl;

import lombok.Getter;

import java.math.BigInteger;
import java.util.*;

/**
 * 前端交给翻译器的单个模块：有序的信号声明、always 块、连续赋值和子模块实例化。
 */
@Getter
public final class RtlModule {

    private final String name;
    private final Map<String, RtlSignal> signals;
    private final List<AlwaysBlock> alwaysBlocks;
    // 连续赋值 (assign lhs = rhs)，每条都是一个独立的组合驱动
    private final List<RtlStatement> assigns;
    private final List<Instantiation> instantiations;

    private RtlModule(Builder builder) {
        this.name = builder.name;
        this.signals = Collections.unmodifiableMap(new LinkedHashMap<>(builder.signals));
        this.alwaysBlocks = List.copyOf(builder.alwaysBlocks);
        this.assigns = List.copyOf(builder.assigns);
        this.instantiations = List.copyOf(builder.instantiations);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public Optional<RtlSignal> getSignal(String signalName) {
        return Optional.ofNullable(signals.get(signalName));
    }

    public List<RtlSignal> getPorts() {
        return signals.values().stream().filter(s -> s.getKind().isPort()).toList();
    }

    /**
     * 所有时钟块使用的时钟名，按首次出现顺序。
     */
    public Set<String> getClocks() {
        Set<String> clocks = new LinkedHashSet<>();
        for (AlwaysBlock block : alwaysBlocks) {
            block.clockName().ifPresent(clocks::add);
        }
        return clocks;
    }

    @Override
    public String toString() {
        return "module " + name + " " + signals.values();
    }

    public static final class Builder {

        private final String name;
        private final Map<String, RtlSignal> signals = new LinkedHashMap<>();
        private final List<AlwaysBlock> alwaysBlocks = new ArrayList<>();
        private final List<RtlStatement> assigns = new ArrayList<>();
        private final List<Instantiation> instantiations = new ArrayList<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "Module name cannot be null.");
        }

        public Builder signal(RtlSignal signal) {
            if (signals.putIfAbsent(signal.getName(), signal) != null) {
                throw new IllegalArgumentException("Signal " + signal.getName() + " declared twice in module " + name);
            }
            return this;
        }

        public Builder input(String signalName, int width) {
            return signal(new RtlSignal(signalName, width, SignalKind.INPUT));
        }

        public Builder output(String signalName, int width) {
            return signal(new RtlSignal(signalName, width, SignalKind.OUTPUT));
        }

        public Builder reg(String signalName, int width) {
            return signal(new RtlSignal(signalName, width, SignalKind.REG));
        }

        public Builder reg(String signalName, int width, long initValue) {
            return signal(new RtlSignal(signalName, width, SignalKind.REG, 0, BigInteger.valueOf(initValue)));
        }

        public Builder wire(String signalName, int width) {
            return signal(new RtlSignal(signalName, width, SignalKind.WIRE));
        }

        /**
         * reg [width-1:0] name [0:length-1]
         */
        public Builder memory(String signalName, int width, int length) {
            return signal(new RtlSignal(signalName, width, SignalKind.REG, length, null));
        }

        public Builder always(AlwaysBlock block) {
            alwaysBlocks.add(Objects.requireNonNull(block));
            return this;
        }

        public Builder assign(RtlExpr target, RtlExpr value) {
            assigns.add(RtlStatement.assign(target, value));
            return this;
        }

        public Builder instantiate(Instantiation instantiation) {
            instantiations.add(Objects.requireNonNull(instantiation));
            return this;
        }

        public RtlModule build() {
            return new RtlModule(this);
        }
    }
}
