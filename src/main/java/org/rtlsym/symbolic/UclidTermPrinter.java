package org.rtlsym.symbolic;

import com.microsoft.z3.BitVecNum;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import org.rtlsym.core.SignalSort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 将 Z3 项渲染为 UCLID5 表达式语法。
 * primed 模式下，每个变量引用渲染为下一周期的值 (x')。
 * 变量引用和未解释函数应用交给 ReferenceResolver 决定如何书写。
 */
public class UclidTermPrinter {

    private static final Logger logger = LoggerFactory.getLogger(UclidTermPrinter.class);

    /**
     * 决定变量引用与函数应用的文本形式。
     */
    public interface ReferenceResolver {

        String renderVariable(String name, boolean primed);

        String renderApplication(String functionName, List<String> renderedArgs);
    }

    /**
     * 不做任何改写：x 或 x'，f(a, b)。
     */
    public static final ReferenceResolver PLAIN = new ReferenceResolver() {
        @Override
        public String renderVariable(String name, boolean primed) {
            return primed ? name + "'" : name;
        }

        @Override
        public String renderApplication(String functionName, List<String> renderedArgs) {
            return functionName + "(" + String.join(", ", renderedArgs) + ")";
        }
    };

    public String render(Expr term) {
        return render(term, false, PLAIN);
    }

    public String render(Expr term, boolean primed) {
        return render(term, primed, PLAIN);
    }

    /**
     * @param term 要渲染的项。
     * @param primed 是否把变量渲染为下一周期的值。
     * @param resolver 变量与函数应用的书写方式。
     * @return UCLID5 表达式文本。
     * @throws UnsupportedOperationException 项中含有 UCLID5 无法表达的运算符。
     */
    public String render(Expr term, boolean primed, ReferenceResolver resolver) {
        if (TermManager.isVariable(term)) {
            return resolver.renderVariable(TermManager.nameOf(term), primed);
        }
        if (term.isTrue()) {
            return "true";
        }
        if (term.isFalse()) {
            return "false";
        }
        if (term.isBVNumeral()) {
            BitVecNum num = (BitVecNum) term;
            return num.getBigInteger() + "bv" + TermManager.widthOf(term);
        }
        if (TermManager.isUninterpretedApplication(term)) {
            return resolver.renderApplication(TermManager.nameOf(term), renderAll(term.getArgs(), primed, resolver));
        }

        Expr[] args = term.getArgs();
        List<String> r = renderAll(args, primed, resolver);

        if (term.isNot()) {
            return "!" + r.get(0);
        }
        if (term.isAnd()) {
            return infix(" && ", r);
        }
        if (term.isOr()) {
            return infix(" || ", r);
        }
        if (term.isXor()) {
            return infix(" != ", r);
        }
        if (term.isImplies()) {
            return infix(" ==> ", r);
        }
        if (term.isEq() || term.isIff()) {
            return infix(" == ", r);
        }
        if (term.isDistinct() && r.size() == 2) {
            return infix(" != ", r);
        }
        if (term.isITE()) {
            return "(if (" + r.get(0) + ") then " + r.get(1) + " else " + r.get(2) + ")";
        }

        // 位向量算术与位运算
        if (term.isBVAdd()) {
            return infix(" + ", r);
        }
        if (term.isBVSub()) {
            return infix(" - ", r);
        }
        if (term.isBVMul()) {
            return infix(" * ", r);
        }
        if (term.isBVUDiv()) {
            return infix(" /_u ", r);
        }
        if (term.isBVURem()) {
            return infix(" %_u ", r);
        }
        if (term.isBVSDiv()) {
            return infix(" / ", r);
        }
        if (term.isBVSRem()) {
            return infix(" % ", r);
        }
        if (term.isBVUMinus()) {
            return "-" + r.get(0);
        }
        if (term.isBVNOT()) {
            return "~" + r.get(0);
        }
        if (term.isBVAND()) {
            return infix(" & ", r);
        }
        if (term.isBVOR()) {
            return infix(" | ", r);
        }
        if (term.isBVXOR()) {
            return infix(" ^ ", r);
        }

        // 比较
        if (term.isBVULT()) {
            return infix(" <_u ", r);
        }
        if (term.isBVULE()) {
            return infix(" <=_u ", r);
        }
        if (term.isBVUGT()) {
            return infix(" >_u ", r);
        }
        if (term.isBVUGE()) {
            return infix(" >=_u ", r);
        }
        if (term.isBVSLT()) {
            return infix(" < ", r);
        }
        if (term.isBVSLE()) {
            return infix(" <= ", r);
        }
        if (term.isBVSGT()) {
            return infix(" > ", r);
        }
        if (term.isBVSGE()) {
            return infix(" >= ", r);
        }

        // 移位、拼接、扩展、提取
        if (term.isBVShiftLeft()) {
            return "bv_left_shift(" + r.get(1) + ", " + r.get(0) + ")";
        }
        if (term.isBVShiftRightLogical()) {
            return "bv_l_right_shift(" + r.get(1) + ", " + r.get(0) + ")";
        }
        if (term.isBVShiftRightArithmetic()) {
            return "bv_a_right_shift(" + r.get(1) + ", " + r.get(0) + ")";
        }
        if (term.isBVConcat()) {
            return infix(" ++ ", r);
        }
        if (term.isBVZeroExtension()) {
            return "bv_zero_extend(" + intParameter(term, 0) + ", " + r.get(0) + ")";
        }
        if (term.isBVSignExtension()) {
            return "bv_sign_extend(" + intParameter(term, 0) + ", " + r.get(0) + ")";
        }
        if (term.isBVExtract()) {
            return r.get(0) + "[" + intParameter(term, 0) + ":" + intParameter(term, 1) + "]";
        }

        // 数组
        if (term.isSelect()) {
            return r.get(0) + "[" + r.get(1) + "]";
        }
        if (term.isStore()) {
            return r.get(0) + "[" + r.get(1) + " -> " + r.get(2) + "]";
        }

        logger.error("无法渲染的运算符: {} in {}", term.getFuncDecl().getName(), term);
        throw new UnsupportedOperationException("Operator " + term.getFuncDecl().getName() + " has no UCLID5 rendering");
    }

    /**
     * UCLID5 中的类型名：boolean、bvN、[bvI]T。
     */
    public static String typeName(SignalSort sort) {
        return switch (sort.getKind()) {
            case BOOL -> "boolean";
            case BITVECTOR -> "bv" + sort.getWidth();
            case ARRAY -> "[" + typeName(sort.getIndexSort()) + "]" + typeName(sort.getElementSort());
        };
    }

    private List<String> renderAll(Expr[] args, boolean primed, ReferenceResolver resolver) {
        List<String> rendered = new ArrayList<>(args.length);
        for (Expr arg : args) {
            rendered.add(render(arg, primed, resolver));
        }
        return rendered;
    }

    private static String infix(String op, List<String> operands) {
        if (operands.size() == 1) {
            return operands.get(0);
        }
        return operands.stream().collect(Collectors.joining(op, "(", ")"));
    }

    private static int intParameter(Expr term, int index) {
        FuncDecl.Parameter[] parameters = term.getFuncDecl().getParameters();
        return parameters[index].getInt();
    }
}
