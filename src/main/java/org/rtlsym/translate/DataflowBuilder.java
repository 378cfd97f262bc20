package org.rtlsym.translate;

import com.microsoft.z3.ArrayExpr;
import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import org.rtlsym.core.SignalSort;
import org.rtlsym.rtl.RtlExpr;
import org.rtlsym.rtl.RtlSignal;
import org.rtlsym.rtl.RtlStatement;
import org.rtlsym.rtl.SignalKind;
import org.rtlsym.symbolic.TermManager;

import java.util.*;

/**
 * 把一个块中的语句折叠为有序的 键项 -> 值项 映射。
 * <p>
 * 键是被赋值的变量、常量位区间 (extract) 或存储器元素 (select)。
 * 只在 if 的一个分支中被赋值的键在另一分支中保持原值 (cond ? new : key)。
 * 阻塞赋值对同一块中之后的读取可见；非阻塞赋值不可见。
 */
final class DataflowBuilder {

    /**
     * 一个块执行到某一点时的状态。
     */
    private static final class BlockState {
        private final LinkedHashMap<Expr, Expr> values;
        // 由阻塞赋值写入的键
        private final Set<Expr> visible;

        BlockState() {
            this(new LinkedHashMap<>(), new HashSet<>());
        }

        private BlockState(LinkedHashMap<Expr, Expr> values, Set<Expr> visible) {
            this.values = values;
            this.visible = visible;
        }

        BlockState copy() {
            return new BlockState(new LinkedHashMap<>(values), new HashSet<>(visible));
        }
    }

    private final TermManager termManager;
    private final Context ctx;
    private final ExpressionLowering lowering;

    DataflowBuilder(TermManager termManager, ExpressionLowering lowering) {
        this.termManager = termManager;
        this.ctx = termManager.getCtx();
        this.lowering = lowering;
    }

    /**
     * 执行一组语句，返回块结束时所有被赋值的键及其值。
     */
    LinkedHashMap<Expr, Expr> build(List<RtlStatement> statements) {
        BlockState state = new BlockState();
        execute(statements, state);
        return state.values;
    }

    /**
     * 子模块输出端口连接：把已经构造好的项 (inst.port) 赋给父模块中的左值。
     */
    LinkedHashMap<Expr, Expr> buildConnection(RtlExpr target, Expr value) {
        BlockState state = new BlockState();
        assignTerm(target, value, true, state);
        return state.values;
    }

    private void execute(List<RtlStatement> statements, BlockState state) {
        for (RtlStatement statement : statements) {
            switch (statement.getKind()) {
                case ASSIGN -> assign(statement.getTarget(), statement.getValue(), statement.isBlocking(), state);
                case IF -> {
                    BoolExpr condition = lowering.lowerCondition(statement.getCondition(), scopeOf(state));
                    BlockState thenState = state.copy();
                    execute(statement.getThenBranch(), thenState);
                    BlockState elseState = state.copy();
                    execute(statement.getElseBranch(), elseState);
                    merge(condition, state, thenState, elseState);
                }
                case OPAQUE -> throw lowering.fail(TranslationFault.UNSUPPORTED_CONSTRUCT,
                        "Unsupported statement '" + statement.getText() + "'");
            }
        }
    }

    // === 读取 ===

    private ExpressionLowering.Scope scopeOf(BlockState state) {
        return signal -> read(signal, state, true);
    }

    /**
     * 信号在块中此刻的值。onlyVisible 为 false 时也包括尚未生效的非阻塞赋值。
     */
    private Expr read(RtlSignal signal, BlockState state, boolean onlyVisible) {
        Expr var = termManager.var(ExpressionLowering.variableOf(signal));
        if (signal.isArray()) {
            return var;
        }
        if (state.values.containsKey(var) && (!onlyVisible || state.visible.contains(var))) {
            return state.values.get(var);
        }
        Expr current = var;
        for (Map.Entry<Expr, Expr> entry : state.values.entrySet()) {
            Expr key = entry.getKey();
            if (key.isBVExtract() && rootIs(key, signal.getName()) && (!onlyVisible || state.visible.contains(key))) {
                current = termManager.insertBits(current, TermManager.extractHigh(key), TermManager.extractLow(key), entry.getValue());
            }
        }
        return current;
    }

    private static boolean rootIs(Expr key, String name) {
        return TermManager.rootVariable(key).filter(name::equals).isPresent();
    }

    // === 赋值 ===

    private void assign(RtlExpr target, RtlExpr value, boolean blocking, BlockState state) {
        ExpressionLowering.Scope scope = scopeOf(state);
        if (target.getKind() == RtlExpr.Kind.REF) {
            RtlSignal signal = assignable(target.getName());
            if (signal.isArray()) {
                throw lowering.fail(TranslationFault.UNSUPPORTED_CONSTRUCT, "Whole-memory assignment to '" + signal.getName() + "'");
            }
            writeFull(signal, lowering.lowerTo(value, signal.getSort(), scope), blocking, state);
            return;
        }
        assignTerm(target, lowering.lowerVector(value, targetWidth(target), scope), blocking, state);
    }

    /**
     * 把值项赋给左值。值按左值的宽度截断或零扩展。
     */
    private void assignTerm(RtlExpr target, Expr value, boolean blocking, BlockState state) {
        switch (target.getKind()) {
            case REF -> {
                RtlSignal signal = assignable(target.getName());
                if (signal.isArray()) {
                    throw lowering.fail(TranslationFault.UNSUPPORTED_CONSTRUCT, "Whole-memory assignment to '" + signal.getName() + "'");
                }
                writeFull(signal, termManager.coerce(value, signal.getSort()), blocking, state);
            }
            case CONCAT -> {
                // 最高位的片段赋给第一个目标
                int total = targetWidth(target);
                BitVecExpr whole = termManager.zeroExtendTo(value, total);
                int offset = total;
                for (RtlExpr part : target.getOperands()) {
                    int width = targetWidth(part);
                    assignTerm(part, termManager.extract(whole, offset - 1, offset - width), blocking, state);
                    offset -= width;
                }
            }
            case SLICE -> {
                RtlSignal signal = assignable(baseName(target));
                lowering.checkRange(target, target.getHi(), target.getLo(), signal.getWidth());
                writeSlice(signal, target.getHi(), target.getLo(), value, blocking, state);
            }
            case INDEX -> assignIndexed(target, value, blocking, state);
            default -> throw lowering.fail(TranslationFault.UNSUPPORTED_CONSTRUCT, "'" + target + "' is not assignable");
        }
    }

    private void assignIndexed(RtlExpr target, Expr value, boolean blocking, BlockState state) {
        RtlSignal signal = assignable(baseName(target));
        RtlExpr indexExpr = target.operand(1);
        ExpressionLowering.Scope scope = scopeOf(state);
        if (signal.isArray()) {
            // 存储器元素写入：键为 select(arr, idx)，其余元素保持上一周期的值
            SignalSort sort = signal.getSort();
            BitVecExpr index = lowering.lowerVector(indexExpr, sort.getIndexSort().getWidth(), scope);
            Expr key = ctx.mkSelect((ArrayExpr) termManager.var(ExpressionLowering.variableOf(signal)), index);
            put(key, termManager.coerce(value, sort.getElementSort()), blocking, state);
            return;
        }
        if (indexExpr.getKind() == RtlExpr.Kind.LITERAL) {
            int bit = lowering.constantIndex(target, indexExpr.getValue(), signal.getWidth());
            writeSlice(signal, bit, bit, value, blocking, state);
            return;
        }
        // v = (v & ~(1 << zext(idx))) | (zext(bit) << zext(idx))，在 max(|v|, |idx|) 位上计算后截断，
        // 越界的下标不改变 v
        BitVecExpr rawIndex = lowering.lowerVector(indexExpr, lowering.selfWidth(indexExpr), scope);
        int width = Math.max(signal.getWidth(), TermManager.widthOf(rawIndex));
        BitVecExpr current = termManager.zeroExtendTo(read(signal, state, false), width);
        BitVecExpr index = termManager.zeroExtendTo(rawIndex, width);
        BitVecExpr bit = termManager.zeroExtendTo(termManager.zeroExtendTo(value, 1), width);
        BitVecExpr cleared = ctx.mkBVAND(current, ctx.mkBVNot(ctx.mkBVSHL(termManager.bv(1, width), index)));
        BitVecExpr updated = termManager.zeroExtendTo(ctx.mkBVOR(cleared, ctx.mkBVSHL(bit, index)), signal.getWidth());
        writeFull(signal, termManager.coerce(updated, signal.getSort()), blocking, state);
    }

    private void writeFull(RtlSignal signal, Expr value, boolean blocking, BlockState state) {
        Expr var = termManager.var(ExpressionLowering.variableOf(signal));
        // 整体赋值覆盖之前的位区间赋值
        removeSlices(signal.getName(), state);
        put(var, value, blocking, state);
    }

    private void writeSlice(RtlSignal signal, int hi, int lo, Expr value, boolean blocking, BlockState state) {
        if (lo == 0 && hi == signal.getWidth() - 1) {
            writeFull(signal, termManager.coerce(value, signal.getSort()), blocking, state);
            return;
        }
        Expr var = termManager.var(ExpressionLowering.variableOf(signal));
        BitVecExpr piece = termManager.zeroExtendTo(value, hi - lo + 1);
        if (state.values.containsKey(var)) {
            // 已有整体赋值时把位区间并入整体值
            Expr full = termManager.insertBits(state.values.get(var), hi, lo, piece);
            put(var, termManager.coerce(full, signal.getSort()), blocking || state.visible.contains(var), state);
            return;
        }
        put(termManager.extract(var, hi, lo), piece, blocking, state);
    }

    private void put(Expr key, Expr value, boolean blocking, BlockState state) {
        state.values.put(key, value);
        if (blocking) {
            state.visible.add(key);
        } else {
            state.visible.remove(key);
        }
    }

    private void removeSlices(String name, BlockState state) {
        Iterator<Map.Entry<Expr, Expr>> it = state.values.entrySet().iterator();
        while (it.hasNext()) {
            Expr key = it.next().getKey();
            if (key.isBVExtract() && rootIs(key, name)) {
                it.remove();
                state.visible.remove(key);
            }
        }
    }

    /**
     * 把某个信号的所有位区间键并入它的整体键。
     */
    private void foldSlices(RtlSignal signal, BlockState state) {
        Expr var = termManager.var(ExpressionLowering.variableOf(signal));
        boolean visible = state.visible.contains(var);
        for (Map.Entry<Expr, Expr> entry : state.values.entrySet()) {
            Expr key = entry.getKey();
            if (key.isBVExtract() && rootIs(key, signal.getName()) && state.visible.contains(key)) {
                visible = true;
            }
        }
        Expr full = termManager.coerce(read(signal, state, false), signal.getSort());
        removeSlices(signal.getName(), state);
        put(var, full, visible, state);
    }

    private void merge(BoolExpr condition, BlockState target, BlockState thenState, BlockState elseState) {
        // 一个分支整体赋值而另一分支只写了位区间时，先统一成整体键
        Set<String> fullyAssigned = new LinkedHashSet<>();
        for (BlockState branch : List.of(thenState, elseState)) {
            for (Expr key : branch.values.keySet()) {
                if (TermManager.isVariable(key) && !TermManager.isArray(key)) {
                    fullyAssigned.add(TermManager.nameOf(key));
                }
            }
        }
        for (String name : fullyAssigned) {
            RtlSignal signal = lowering.signal(name);
            for (BlockState branch : List.of(thenState, elseState)) {
                if (hasSlices(name, branch)) {
                    foldSlices(signal, branch);
                }
            }
        }

        LinkedHashSet<Expr> keys = new LinkedHashSet<>(thenState.values.keySet());
        keys.addAll(elseState.values.keySet());
        target.values.clear();
        target.visible.clear();
        for (Expr key : keys) {
            Expr thenValue = thenState.values.getOrDefault(key, key);
            Expr elseValue = elseState.values.getOrDefault(key, key);
            Expr merged = thenValue.equals(elseValue) ? thenValue : ctx.mkITE(condition, thenValue, elseValue);
            target.values.put(key, merged);
            if (thenState.visible.contains(key) || elseState.visible.contains(key)) {
                target.visible.add(key);
            }
        }
    }

    private static boolean hasSlices(String name, BlockState state) {
        for (Expr key : state.values.keySet()) {
            if (key.isBVExtract() && rootIs(key, name)) {
                return true;
            }
        }
        return false;
    }

    // === 左值 ===

    private RtlSignal assignable(String name) {
        RtlSignal signal = lowering.signal(name);
        if (signal.getKind() == SignalKind.INPUT) {
            throw lowering.fail(TranslationFault.UNSUPPORTED_CONSTRUCT, "Assignment to input '" + name + "'");
        }
        return signal;
    }

    private String baseName(RtlExpr target) {
        RtlExpr base = target.operand(0);
        if (base.getKind() != RtlExpr.Kind.REF) {
            throw lowering.fail(TranslationFault.UNSUPPORTED_CONSTRUCT, "'" + target + "' is not assignable");
        }
        return base.getName();
    }

    /**
     * 左值的宽度。
     */
    int targetWidth(RtlExpr target) {
        return switch (target.getKind()) {
            case REF -> {
                RtlSignal signal = lowering.signal(target.getName());
                if (signal.isArray()) {
                    throw lowering.fail(TranslationFault.UNSUPPORTED_CONSTRUCT, "Whole-memory assignment to '" + signal.getName() + "'");
                }
                yield signal.getWidth();
            }
            case INDEX -> {
                RtlSignal memory = lowering.memoryOf(target.operand(0));
                yield memory != null ? memory.getWidth() : 1;
            }
            case SLICE -> target.getHi() - target.getLo() + 1;
            case CONCAT -> target.getOperands().stream().mapToInt(this::targetWidth).sum();
            default -> throw lowering.fail(TranslationFault.UNSUPPORTED_CONSTRUCT, "'" + target + "' is not assignable");
        };
    }
}
