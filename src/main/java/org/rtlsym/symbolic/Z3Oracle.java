package org.rtlsym.symbolic;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 基于 Z3 Solver 的判定工具：可满足性、有效性和两个项的语义等价。
 * 模型生成本身不依赖它，它用于检查变换前后模型的语义关系。
 */
public class Z3Oracle implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Z3Oracle.class);

    private final TermManager termManager;
    private final Context ctx;
    private final Solver solver;

    public Z3Oracle(TermManager termManager) {
        this.termManager = Objects.requireNonNull(termManager, "TermManager cannot be null.");
        this.ctx = termManager.getCtx();
        this.solver = ctx.mkSolver();
    }

    /**
     * @param formula 布尔公式。
     * @return 公式可满足时返回 true。
     * @throws IllegalStateException Z3 返回 UNKNOWN 时。
     */
    public boolean isSatisfiable(BoolExpr formula) {
        solver.push();
        try {
            solver.add(formula);
            Status status = solver.check();
            logger.debug("检查可满足性: {} -> {}", formula, status);
            if (status == Status.UNKNOWN) {
                logger.error("Z3 无法判定: {}", solver.getReasonUnknown());
                throw new IllegalStateException("Z3 returned UNKNOWN: " + solver.getReasonUnknown());
            }
            return status == Status.SATISFIABLE;
        } finally {
            solver.pop();
        }
    }

    /**
     * 公式在所有赋值下都为真。
     */
    public boolean isValid(BoolExpr formula) {
        return !isSatisfiable(ctx.mkNot(formula));
    }

    /**
     * 两个同类型的项在所有赋值下都相等。
     */
    public boolean areEquivalent(Expr left, Expr right) {
        if (!left.getSort().equals(right.getSort())) {
            logger.debug("类型不同，不等价: {} vs {}", left.getSort(), right.getSort());
            return false;
        }
        return isValid(ctx.mkEq(left, right));
    }

    /**
     * 在假设 assumption 成立时两个项相等。
     */
    public boolean areEquivalentUnder(BoolExpr assumption, Expr left, Expr right) {
        return isValid(ctx.mkImplies(assumption, ctx.mkEq(left, right)));
    }

    public TermManager getTermManager() {
        return termManager;
    }

    @Override
    public void close() {
        solver.reset();
    }
}
