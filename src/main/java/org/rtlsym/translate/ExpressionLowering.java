package org.rtlsym.translate;

import com.microsoft.z3.ArrayExpr;
import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import org.rtlsym.core.SignalSort;
import org.rtlsym.core.Variable;
import org.rtlsym.rtl.BinaryOperator;
import org.rtlsym.rtl.RtlExpr;
import org.rtlsym.rtl.RtlModule;
import org.rtlsym.rtl.RtlSignal;
import org.rtlsym.symbolic.TermManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;

/**
 * 把 RTL 表达式降低为 Z3 项。
 * <p>
 * 位宽按 Verilog 的上下文规则处理：算术与按位运算的操作数扩展到 max(自身宽度, 上下文宽度) 后计算，
 * 比较运算的操作数按自身宽度计算，未指定位宽的常量取上下文宽度，最后截断到要求的宽度。
 * 常量下标的位选择降低为 extract；变量下标的位选择降低为 (v >> zext(idx)) & 1。
 */
final class ExpressionLowering {

    private static final Logger logger = LoggerFactory.getLogger(ExpressionLowering.class);

    /**
     * 读取信号当前值的方式。在 always 块内，阻塞赋值之后的读取会看到新值。
     */
    interface Scope {
        Expr read(RtlSignal signal);
    }

    private final TermManager termManager;
    private final Context ctx;
    private final RtlModule module;
    private final Scope moduleScope;

    ExpressionLowering(TermManager termManager, RtlModule module) {
        this.termManager = termManager;
        this.ctx = termManager.getCtx();
        this.module = module;
        this.moduleScope = signal -> termManager.var(variableOf(signal));
    }

    Scope getModuleScope() {
        return moduleScope;
    }

    static Variable variableOf(RtlSignal signal) {
        return Variable.of(signal.getName(), signal.getSort());
    }

    RtlSignal signal(String name) {
        return module.getSignal(name)
                .orElseThrow(() -> fail(TranslationFault.UNKNOWN_SIGNAL, "Unknown signal '" + name + "'"));
    }

    TranslationException fail(TranslationFault fault, String message) {
        logger.error("翻译模块 {} 失败: {}", module.getName(), message);
        return new TranslationException(fault, module.getName(), message);
    }

    // === 宽度 ===

    /**
     * 表达式的自身宽度 (self-determined width)。
     */
    int selfWidth(RtlExpr e) {
        return switch (e.getKind()) {
            case REF -> {
                RtlSignal signal = signal(e.getName());
                if (signal.isArray()) {
                    throw fail(TranslationFault.WIDTH_MISMATCH, "Memory '" + signal.getName() + "' used as a value");
                }
                yield signal.getWidth();
            }
            case LITERAL -> e.isSized() ? e.getWidth() : Math.max(1, e.getValue().bitLength());
            case UNARY -> e.getUnaryOperator().isBooleanValued() ? 1 : selfWidth(e.operand(0));
            case BINARY -> {
                if (e.getBinaryOperator().isComparison() || e.getBinaryOperator().isLogical()) {
                    yield 1;
                }
                if (e.getBinaryOperator().isShift()) {
                    yield selfWidth(e.operand(0));
                }
                yield Math.max(selfWidth(e.operand(0)), selfWidth(e.operand(1)));
            }
            case TERNARY -> Math.max(selfWidth(e.operand(1)), selfWidth(e.operand(2)));
            case INDEX -> {
                RtlSignal memory = memoryOf(e.operand(0));
                yield memory != null ? memory.getWidth() : 1;
            }
            case SLICE -> e.getHi() - e.getLo() + 1;
            case CONCAT -> e.getOperands().stream().mapToInt(this::selfWidth).sum();
            case OPAQUE -> throw unsupported(e);
        };
    }

    /**
     * base 是存储器引用时返回该存储器，否则返回 null。
     */
    RtlSignal memoryOf(RtlExpr base) {
        if (base.getKind() != RtlExpr.Kind.REF) {
            return null;
        }
        RtlSignal signal = signal(base.getName());
        return signal.isArray() ? signal : null;
    }

    private TranslationException unsupported(RtlExpr e) {
        return fail(TranslationFault.UNSUPPORTED_CONSTRUCT, "Unsupported expression '" + e + "'");
    }

    // === 降低 ===

    /**
     * 降低为目标类型的项。
     */
    Expr lowerTo(RtlExpr e, SignalSort target, Scope scope) {
        return switch (target.getKind()) {
            case BOOL -> lowerBit(e, scope);
            case BITVECTOR -> lowerVector(e, target.getWidth(), scope);
            case ARRAY -> {
                RtlSignal memory = memoryOf(e);
                if (memory == null || !memory.getSort().equals(target)) {
                    throw fail(TranslationFault.WIDTH_MISMATCH, "Expression '" + e + "' is not a memory of sort " + target);
                }
                yield scope.read(memory);
            }
        };
    }

    /**
     * 条件语义：值非零即为真。
     */
    BoolExpr lowerCondition(RtlExpr e, Scope scope) {
        int width = selfWidth(e);
        if (width == 1) {
            return lowerBit(e, scope);
        }
        return termManager.truthy(lowerVector(e, width, scope));
    }

    /**
     * 降低为恰好 width 位的位向量。
     */
    BitVecExpr lowerVector(RtlExpr e, int width, Scope scope) {
        int evalWidth = Math.max(width, selfWidth(e));
        switch (e.getKind()) {
            case REF:
                return termManager.zeroExtendTo(scope.read(signal(e.getName())), width);
            case LITERAL: {
                BigInteger value = e.isSized() ? e.getValue().and(mask(e.getWidth())) : e.getValue();
                return termManager.bv(value.and(mask(width)), width);
            }
            case UNARY:
                switch (e.getUnaryOperator()) {
                    case BITWISE_NOT:
                        return truncate(ctx.mkBVNot(lowerVector(e.operand(0), evalWidth, scope)), width);
                    case NEGATE:
                        return truncate(ctx.mkBVNeg(lowerVector(e.operand(0), evalWidth, scope)), width);
                    default:
                        return termManager.boolToBitVector(lowerBit(e, scope), width);
                }
            case BINARY:
                return lowerBinaryVector(e, width, evalWidth, scope);
            case TERNARY: {
                Expr result = ctx.mkITE(lowerCondition(e.operand(0), scope),
                        lowerVector(e.operand(1), evalWidth, scope),
                        lowerVector(e.operand(2), evalWidth, scope));
                return truncate((BitVecExpr) result, width);
            }
            case INDEX: {
                RtlSignal memory = memoryOf(e.operand(0));
                if (memory != null) {
                    return termManager.zeroExtendTo(lowerSelect(memory, e.operand(1), scope), width);
                }
                return termManager.zeroExtendTo(lowerBitSelect(e, scope), width);
            }
            case SLICE: {
                BitVecExpr base = lowerVector(e.operand(0), selfWidth(e.operand(0)), scope);
                checkRange(e, e.getHi(), e.getLo(), TermManager.widthOf(base));
                return termManager.zeroExtendTo(termManager.extract(base, e.getHi(), e.getLo()), width);
            }
            case CONCAT: {
                BitVecExpr result = null;
                for (RtlExpr part : e.getOperands()) {
                    BitVecExpr lowered = lowerVector(part, selfWidth(part), scope);
                    result = result == null ? lowered : ctx.mkConcat(result, lowered);
                }
                return termManager.zeroExtendTo(result, width);
            }
            default:
                throw unsupported(e);
        }
    }

    private BitVecExpr lowerBinaryVector(RtlExpr e, int width, int evalWidth, Scope scope) {
        RtlExpr left = e.operand(0);
        RtlExpr right = e.operand(1);
        if (e.getBinaryOperator().isComparison() || e.getBinaryOperator().isLogical()) {
            return termManager.boolToBitVector(lowerBit(e, scope), width);
        }
        if (e.getBinaryOperator().isShift()) {
            // 移位量按自身宽度计算，零扩展到被移位数的宽度
            int shiftWidth = Math.max(evalWidth, selfWidth(right));
            BitVecExpr l = lowerVector(left, shiftWidth, scope);
            BitVecExpr r = lowerVector(right, shiftWidth, scope);
            BitVecExpr shifted = switch (e.getBinaryOperator()) {
                case SHIFT_LEFT -> ctx.mkBVSHL(l, r);
                case SHIFT_RIGHT -> ctx.mkBVLSHR(l, r);
                default -> ctx.mkBVASHR(l, r);
            };
            return truncate(shifted, width);
        }
        BitVecExpr l = lowerVector(left, evalWidth, scope);
        BitVecExpr r = lowerVector(right, evalWidth, scope);
        BitVecExpr result = switch (e.getBinaryOperator()) {
            case ADD -> ctx.mkBVAdd(l, r);
            case SUB -> ctx.mkBVSub(l, r);
            case MUL -> ctx.mkBVMul(l, r);
            case DIV -> ctx.mkBVUDiv(l, r);
            case MOD -> ctx.mkBVURem(l, r);
            case AND -> ctx.mkBVAND(l, r);
            case OR -> ctx.mkBVOR(l, r);
            case XOR -> ctx.mkBVXOR(l, r);
            default -> throw unsupported(e);
        };
        return truncate(result, width);
    }

    /**
     * 取表达式的第 0 位作为布尔值 (赋值给 1 位信号时的截断语义)。
     */
    BoolExpr lowerBit(RtlExpr e, Scope scope) {
        switch (e.getKind()) {
            case REF: {
                RtlSignal signal = signal(e.getName());
                if (signal.isArray()) {
                    throw fail(TranslationFault.WIDTH_MISMATCH, "Memory '" + signal.getName() + "' used as a value");
                }
                return (BoolExpr) termManager.coerce(scope.read(signal), SignalSort.bool());
            }
            case LITERAL:
                return termManager.bool(e.getValue().testBit(0));
            case UNARY:
                return lowerUnaryBit(e, scope);
            case BINARY:
                return lowerBinaryBit(e, scope);
            case TERNARY:
                if (selfWidth(e) == 1) {
                    return (BoolExpr) ctx.mkITE(lowerCondition(e.operand(0), scope),
                            lowerBit(e.operand(1), scope), lowerBit(e.operand(2), scope));
                }
                break;
            case INDEX: {
                RtlSignal memory = memoryOf(e.operand(0));
                if (memory != null) {
                    return (BoolExpr) termManager.coerce(lowerSelect(memory, e.operand(1), scope), SignalSort.bool());
                }
                if (isBoolReference(e.operand(0)) && isLiteral(e.operand(1), 0)) {
                    return lowerBit(e.operand(0), scope);
                }
                return bitZero(lowerBitSelect(e, scope));
            }
            case OPAQUE:
                throw unsupported(e);
            default:
                break;
        }
        return bitZero(lowerVector(e, 1, scope));
    }

    private BoolExpr lowerUnaryBit(RtlExpr e, Scope scope) {
        RtlExpr operand = e.operand(0);
        int width = selfWidth(operand);
        switch (e.getUnaryOperator()) {
            case LOGICAL_NOT:
                return ctx.mkNot(lowerCondition(operand, scope));
            case BITWISE_NOT:
                if (width == 1) {
                    return ctx.mkNot(lowerBit(operand, scope));
                }
                break;
            case REDUCE_OR:
                return lowerCondition(operand, scope);
            case REDUCE_AND: {
                if (width == 1) {
                    return lowerBit(operand, scope);
                }
                BitVecExpr v = lowerVector(operand, width, scope);
                return ctx.mkEq(v, termManager.bv(mask(width), width));
            }
            case REDUCE_XOR: {
                if (width == 1) {
                    return lowerBit(operand, scope);
                }
                BitVecExpr v = lowerVector(operand, width, scope);
                BoolExpr parity = bitZero(termManager.extract(v, 0, 0));
                for (int i = 1; i < width; i++) {
                    parity = ctx.mkXor(parity, bitZero(termManager.extract(v, i, i)));
                }
                return parity;
            }
            default:
                break;
        }
        return bitZero(lowerVector(e, 1, scope));
    }

    private BoolExpr lowerBinaryBit(RtlExpr e, Scope scope) {
        RtlExpr left = e.operand(0);
        RtlExpr right = e.operand(1);
        switch (e.getBinaryOperator()) {
            case LOGICAL_AND:
                return ctx.mkAnd(lowerCondition(left, scope), lowerCondition(right, scope));
            case LOGICAL_OR:
                return ctx.mkOr(lowerCondition(left, scope), lowerCondition(right, scope));
            default:
                break;
        }
        boolean bothSingleBit = selfWidth(left) == 1 && selfWidth(right) == 1;
        if (e.getBinaryOperator().isComparison()) {
            if (bothSingleBit && (e.getBinaryOperator() == BinaryOperator.EQ
                    || e.getBinaryOperator() == BinaryOperator.NE)) {
                BoolExpr eq = ctx.mkEq(lowerBit(left, scope), lowerBit(right, scope));
                return e.getBinaryOperator() == BinaryOperator.EQ ? eq : ctx.mkNot(eq);
            }
            int width = Math.max(selfWidth(left), selfWidth(right));
            BitVecExpr l = lowerVector(left, width, scope);
            BitVecExpr r = lowerVector(right, width, scope);
            return switch (e.getBinaryOperator()) {
                case EQ -> ctx.mkEq(l, r);
                case NE -> ctx.mkNot(ctx.mkEq(l, r));
                case LT -> ctx.mkBVULT(l, r);
                case LE -> ctx.mkBVULE(l, r);
                case GT -> ctx.mkBVUGT(l, r);
                default -> ctx.mkBVUGE(l, r);
            };
        }
        if (bothSingleBit && e.getBinaryOperator().isBitwise()) {
            BoolExpr l = lowerBit(left, scope);
            BoolExpr r = lowerBit(right, scope);
            return switch (e.getBinaryOperator()) {
                case AND -> ctx.mkAnd(l, r);
                case OR -> ctx.mkOr(l, r);
                default -> ctx.mkXor(l, r);
            };
        }
        return bitZero(lowerVector(e, 1, scope));
    }

    /**
     * 存储器读取：select(arr, idx)，下标调整到存储器的下标宽度。
     */
    Expr lowerSelect(RtlSignal memory, RtlExpr index, Scope scope) {
        SignalSort indexSort = memory.getSort().getIndexSort();
        BitVecExpr idx = lowerVector(index, indexSort.getWidth(), scope);
        return ctx.mkSelect((ArrayExpr) scope.read(memory), idx);
    }

    /**
     * 位向量的单个位。常量下标得到 1 位的 extract；变量下标得到 v 宽度的 (v >> zext(idx)) & 1。
     * 两种结果的值都只能是 0 或 1。
     */
    BitVecExpr lowerBitSelect(RtlExpr e, Scope scope) {
        RtlExpr baseExpr = e.operand(0);
        RtlExpr indexExpr = e.operand(1);
        int baseWidth = selfWidth(baseExpr);
        BitVecExpr base = lowerVector(baseExpr, baseWidth, scope);
        if (indexExpr.getKind() == RtlExpr.Kind.LITERAL) {
            int bit = constantIndex(e, indexExpr.getValue(), baseWidth);
            return termManager.extract(base, bit, bit);
        }
        BitVecExpr index = lowerVector(indexExpr, selfWidth(indexExpr), scope);
        int width = Math.max(baseWidth, TermManager.widthOf(index));
        BitVecExpr shifted = ctx.mkBVLSHR(termManager.zeroExtendTo(base, width), termManager.zeroExtendTo(index, width));
        return ctx.mkBVAND(shifted, termManager.bv(1, width));
    }

    /**
     * 在缩窄为 int 之前检查常量下标，超出 [0, width) 时抛出 WIDTH_MISMATCH。
     */
    int constantIndex(RtlExpr e, BigInteger index, int width) {
        if (index.signum() < 0 || index.compareTo(BigInteger.valueOf(width)) >= 0) {
            throw fail(TranslationFault.WIDTH_MISMATCH, "Index " + index + " of '" + e + "' exceeds width " + width);
        }
        return index.intValue();
    }

    void checkRange(RtlExpr e, int hi, int lo, int width) {
        if (hi >= width || lo < 0) {
            throw fail(TranslationFault.WIDTH_MISMATCH, "Range [" + hi + ":" + lo + "] of '" + e + "' exceeds width " + width);
        }
    }

    private boolean isBoolReference(RtlExpr e) {
        return e.getKind() == RtlExpr.Kind.REF && signal(e.getName()).getSort().isBool();
    }

    private static boolean isLiteral(RtlExpr e, long value) {
        return e.getKind() == RtlExpr.Kind.LITERAL && e.getValue().equals(BigInteger.valueOf(value));
    }

    private BoolExpr bitZero(BitVecExpr v) {
        return (BoolExpr) termManager.coerce(v, SignalSort.bool());
    }

    private BitVecExpr truncate(BitVecExpr v, int width) {
        return termManager.zeroExtendTo(v, width);
    }

    static BigInteger mask(int width) {
        return BigInteger.ONE.shiftLeft(width).subtract(BigInteger.ONE);
    }
}
