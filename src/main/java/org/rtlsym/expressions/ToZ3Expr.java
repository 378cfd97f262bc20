package org.rtlsym.expressions;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import org.rtlsym.symbolic.TermManager;

/**
 * 定义将 Java 对象转换为 Z3 项 (Expr) 的接口。
 */
public interface ToZ3Expr {

    /**
     * 将此对象转换为 Z3 表达式。
     * @param ctx Z3 Context 实例。
     * @param termManager TermManager 实例，用于管理 Java 变量到 Z3 常量的映射。
     * @return 对应的 Z3 Expr。
     */
    Expr toZ3Expr(Context ctx, TermManager termManager);
}
