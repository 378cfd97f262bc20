package org.rtlsym.symbolic;

import com.microsoft.z3.ArraySort;
import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.BitVecNum;
import com.microsoft.z3.BitVecSort;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.BoolSort;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Sort;
import com.microsoft.z3.enumerations.Z3_decl_kind;
import lombok.Getter;
import org.rtlsym.core.SignalSort;
import org.rtlsym.core.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.*;

/**
 * 负责管理 Java Variable 对象到 Z3 常量的映射，并提供模型各组件共用的项构造工具：
 * 常量、位宽转换、位区间提取、变量替换、类型检查和自由变量收集。
 * 确保每个 Java 变量在 Z3 Context 中有唯一的对应 Z3 常量。
 * 同一棵 Model 树中的所有项必须来自同一个 TermManager。
 * @author Ayalyt
 */
@Getter
public class TermManager implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(TermManager.class);

    private final Context ctx;
    private final boolean ownsContext;
    // 单线程使用，HashMap 即可
    private final Map<Variable, Expr> variableCache;

    /**
     * 创建并持有一个新的 Z3 Context，close() 时释放。
     */
    public TermManager() {
        this(new Context(), true);
    }

    /**
     * 使用外部的 Z3 Context，close() 时不释放它。
     * @param ctx Z3 Context 实例。
     */
    public TermManager(Context ctx) {
        this(ctx, false);
    }

    private TermManager(Context ctx, boolean ownsContext) {
        this.ctx = Objects.requireNonNull(ctx, "Z3 Context cannot be null.");
        this.ownsContext = ownsContext;
        this.variableCache = new HashMap<>();
        logger.debug("TermManager 初始化完成 (ownsContext = {})", ownsContext);
    }

    // === 变量与类型 ===

    /**
     * 获取指定 Variable 对应的 Z3 常量。如果尚未创建，则会创建并缓存。
     * @param variable Java Variable 对象。
     * @return 对应的 Z3 常量。
     */
    public Expr var(Variable variable) {
        return variableCache.computeIfAbsent(variable, v -> {
            logger.debug("创建 Z3 变量: {}", v);
            return ctx.mkConst(v.getName(), v.getSort().toZ3Sort(ctx));
        });
    }

    public Expr var(String name, SignalSort sort) {
        return var(Variable.of(name, sort));
    }

    public Sort sort(SignalSort sort) {
        return sort.toZ3Sort(ctx);
    }

    /**
     * 将 Z3 Sort 转回 SignalSort。注意 bv1 会得到 1 位的位向量而不是布尔类型。
     */
    public static SignalSort signalSort(Sort sort) {
        if (sort instanceof BoolSort) {
            return SignalSort.bool();
        }
        if (sort instanceof BitVecSort) {
            return SignalSort.bitVector(((BitVecSort) sort).getSize());
        }
        if (sort instanceof ArraySort) {
            ArraySort arraySort = (ArraySort) sort;
            return SignalSort.array(signalSort(arraySort.getDomain()), signalSort(arraySort.getRange()));
        }
        logger.error("不支持的 Z3 类型: {}", sort);
        throw new IllegalArgumentException("Unsupported Z3 sort: " + sort);
    }

    /**
     * Z3 类型与声明的 SignalSort 是否一致。
     */
    public static boolean signalSortMatches(Sort sort, SignalSort declared) {
        if (!(sort instanceof BoolSort || sort instanceof BitVecSort || sort instanceof ArraySort)) {
            return false;
        }
        return signalSort(sort).equals(declared);
    }

    /**
     * 从一个变量项 (0 元未解释常量) 还原出 Variable。
     */
    public Variable toVariable(Expr term) {
        if (!isVariable(term)) {
            throw new IllegalArgumentException("Term is not a variable: " + term);
        }
        return Variable.of(nameOf(term), signalSort(term.getSort()));
    }

    // === 常量 ===

    public BoolExpr bool(boolean value) {
        return ctx.mkBool(value);
    }

    public BitVecNum bv(long value, int width) {
        return bv(BigInteger.valueOf(value), width);
    }

    public BitVecNum bv(BigInteger value, int width) {
        if (value.signum() < 0) {
            // 负数按二进制补码截断到 width 位
            value = value.add(BigInteger.ONE.shiftLeft(width));
        }
        return ctx.mkBV(value.toString(), width);
    }

    /**
     * 构造给定类型的常量。布尔类型下非零即真。
     */
    public Expr constant(SignalSort sort, BigInteger value) {
        return switch (sort.getKind()) {
            case BOOL -> bool(value.signum() != 0);
            case BITVECTOR -> bv(value, sort.getWidth());
            case ARRAY -> throw new IllegalArgumentException("Array constants are not supported: " + sort);
        };
    }

    // === 位宽与转换 ===

    /**
     * 项的位宽：布尔为 1，位向量为其宽度。数组没有位宽。
     */
    public static int widthOf(Expr term) {
        Sort sort = term.getSort();
        if (sort instanceof BoolSort) {
            return 1;
        }
        if (sort instanceof BitVecSort) {
            return ((BitVecSort) sort).getSize();
        }
        throw new IllegalArgumentException("Term has no bit width: " + term + " : " + sort);
    }

    public static boolean isBool(Expr term) {
        return term.getSort() instanceof BoolSort;
    }

    public static boolean isBitVector(Expr term) {
        return term.getSort() instanceof BitVecSort;
    }

    public static boolean isArray(Expr term) {
        return term.getSort() instanceof ArraySort;
    }

    /**
     * 布尔转为指定宽度的位向量：ite(b, 1, 0)。
     */
    public BitVecExpr boolToBitVector(Expr bool, int width) {
        return (BitVecExpr) ctx.mkITE((BoolExpr) bool, bv(1, width), bv(0, width));
    }

    /**
     * 将布尔或位向量项按零扩展/截断调整到 width 位，结果总是位向量。
     */
    public BitVecExpr zeroExtendTo(Expr term, int width) {
        if (isBool(term)) {
            return boolToBitVector(term, width);
        }
        BitVecExpr bv = (BitVecExpr) term;
        int current = widthOf(bv);
        if (current == width) {
            return bv;
        }
        if (current < width) {
            return ctx.mkZeroExt(width - current, bv);
        }
        return ctx.mkExtract(width - 1, 0, bv);
    }

    /**
     * 同 zeroExtendTo，但扩展时复制符号位。布尔值视为 1 位有符号数。
     */
    public BitVecExpr signExtendTo(Expr term, int width) {
        BitVecExpr bv = isBool(term) ? boolToBitVector(term, 1) : (BitVecExpr) term;
        int current = widthOf(bv);
        if (current == width) {
            return bv;
        }
        if (current < width) {
            return ctx.mkSignExt(width - current, bv);
        }
        return ctx.mkExtract(width - 1, 0, bv);
    }

    /**
     * 常量位区间提取 term[hi:lo]，结果是 (hi - lo + 1) 位的位向量。
     */
    public BitVecExpr extract(Expr term, int hi, int lo) {
        BitVecExpr bv = isBool(term) ? boolToBitVector(term, 1) : (BitVecExpr) term;
        int width = widthOf(bv);
        if (lo < 0 || hi < lo || hi >= width) {
            logger.error("位区间 [{}:{}] 超出宽度 {}", hi, lo, width);
            throw new IllegalArgumentException("Bit range [" + hi + ":" + lo + "] out of bounds for width " + width);
        }
        if (lo == 0 && hi == width - 1) {
            return bv;
        }
        return ctx.mkExtract(hi, lo, bv);
    }

    /**
     * 用 value 替换 base 的 [hi:lo] 位，其余位保持不变。结果与 base 同宽。
     */
    public BitVecExpr insertBits(Expr base, int hi, int lo, Expr value) {
        BitVecExpr bv = isBool(base) ? boolToBitVector(base, 1) : (BitVecExpr) base;
        int width = widthOf(bv);
        BitVecExpr piece = zeroExtendTo(value, hi - lo + 1);
        if (lo == 0 && hi == width - 1) {
            return piece;
        }
        BitVecExpr result = piece;
        if (hi < width - 1) {
            result = ctx.mkConcat(extract(bv, width - 1, hi + 1), result);
        }
        if (lo > 0) {
            result = ctx.mkConcat(result, extract(bv, lo - 1, 0));
        }
        return result;
    }

    /**
     * extract 项的高位下标。
     */
    public static int extractHigh(Expr extractTerm) {
        return extractTerm.getFuncDecl().getParameters()[0].getInt();
    }

    public static int extractLow(Expr extractTerm) {
        return extractTerm.getFuncDecl().getParameters()[1].getInt();
    }

    /**
     * 把布尔/位向量项调整到目标类型：
     * 布尔 -> 位向量用 ite(b, 1, 0)；位向量 -> 布尔取第 0 位；位向量之间零扩展或截断。
     * 数组只接受完全相同的类型。
     */
    public Expr coerce(Expr term, SignalSort target) {
        if (target.isArray()) {
            if (!term.getSort().equals(sort(target))) {
                throw new IllegalArgumentException("Cannot coerce " + term.getSort() + " to " + target);
            }
            return term;
        }
        if (isArray(term)) {
            throw new IllegalArgumentException("Cannot coerce array term " + term + " to " + target);
        }
        if (target.isBool()) {
            if (isBool(term)) {
                return term;
            }
            return ctx.mkEq(extract(term, 0, 0), bv(1, 1));
        }
        return zeroExtendTo(term, target.getWidth());
    }

    /**
     * 条件语义：布尔不变，位向量为 (term != 0)。
     */
    public BoolExpr truthy(Expr term) {
        if (isBool(term)) {
            return (BoolExpr) term;
        }
        if (isBitVector(term)) {
            return ctx.mkNot(ctx.mkEq(term, bv(0, widthOf(term))));
        }
        throw new IllegalArgumentException("Array term cannot be used as a condition: " + term);
    }

    // === 替换、类型检查、遍历 ===

    /**
     * 返回一个新项，其中 mapping 中的每个变量都被递归替换。
     * @param term 原始项。
     * @param mapping 变量到替换项的映射，替换项的类型必须与变量一致。
     * @return 替换后的新项；原始项不变。
     */
    public Expr replaceVars(Expr term, Map<Variable, ? extends Expr> mapping) {
        if (mapping.isEmpty()) {
            return term;
        }
        Expr[] from = new Expr[mapping.size()];
        Expr[] to = new Expr[mapping.size()];
        int i = 0;
        for (Map.Entry<Variable, ? extends Expr> entry : mapping.entrySet()) {
            from[i] = var(entry.getKey());
            to[i] = entry.getValue();
            if (!from[i].getSort().equals(to[i].getSort())) {
                logger.error("替换类型不一致: {} -> {}", entry.getKey(), to[i]);
                throw new IllegalArgumentException("Substitution for " + entry.getKey() + " has sort " + to[i].getSort());
            }
            i++;
        }
        return term.substitute(from, to);
    }

    /**
     * 项自身是否类型良好。
     */
    public static boolean typecheck(Expr term) {
        return term.isWellSorted();
    }

    /**
     * 定义 key := value 是否类型良好：两者自身良好且类型相同。
     */
    public static boolean typecheck(Expr key, Expr value) {
        return key.isWellSorted() && value.isWellSorted() && key.getSort().equals(value.getSort());
    }

    /**
     * 是否为变量引用 (0 元未解释常量)。数值常量与 true/false 不算。
     */
    public static boolean isVariable(Expr term) {
        return term.isConst() && term.getFuncDecl().getDeclKind() == Z3_decl_kind.Z3_OP_UNINTERPRETED;
    }

    /**
     * 是否为 n 元 (n > 0) 未解释函数应用。
     */
    public static boolean isUninterpretedApplication(Expr term) {
        return term.isApp() && term.getNumArgs() > 0
                && term.getFuncDecl().getDeclKind() == Z3_decl_kind.Z3_OP_UNINTERPRETED;
    }

    public static String nameOf(Expr variable) {
        return variable.getFuncDecl().getName().toString();
    }

    /**
     * 按首次出现的顺序收集项中引用的变量名。
     */
    public static Set<String> freeVariables(Expr term) {
        Set<String> names = new LinkedHashSet<>();
        collectVariables(term, names, new HashSet<>());
        return names;
    }

    /**
     * 同 freeVariables，但同时给出每个变量的类型。
     */
    public static Map<String, SignalSort> freeVariableSorts(Expr term) {
        Map<String, SignalSort> sorts = new LinkedHashMap<>();
        collectVariables(term, new LinkedHashSet<>(), new HashSet<>(), sorts);
        return sorts;
    }

    private static void collectVariables(Expr term, Set<String> names, Set<Expr> visited) {
        collectVariables(term, names, visited, null);
    }

    private static void collectVariables(Expr term, Set<String> names, Set<Expr> visited, Map<String, SignalSort> sorts) {
        if (!visited.add(term)) {
            return;
        }
        if (isVariable(term)) {
            names.add(nameOf(term));
            if (sorts != null) {
                sorts.put(nameOf(term), signalSort(term.getSort()));
            }
            return;
        }
        if (term.isApp()) {
            for (Expr arg : term.getArgs()) {
                collectVariables(arg, names, visited, sorts);
            }
        }
    }

    /**
     * logic/default_next 的键所指向的变量：变量本身，或 extract/select 的最内层变量。
     * @return 变量名；键不是这三种形式之一时为空。
     */
    public static Optional<String> rootVariable(Expr key) {
        if (isVariable(key)) {
            return Optional.of(nameOf(key));
        }
        if (key.isBVExtract() || key.isSelect()) {
            return rootVariable(key.getArgs()[0]);
        }
        return Optional.empty();
    }

    @Override
    public void close() {
        variableCache.clear();
        if (ownsContext) {
            logger.debug("释放 Z3 Context");
            ctx.close();
        }
    }
}
