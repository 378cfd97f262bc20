package org.rtlsym.emit;

/**
 * UCLID5 输出失败的原因。
 */
public enum EmissionFault {
    /** 项中应用了模型没有声明的未解释函数 */
    UNDECLARED_UF,
    /** 项中引用了模型没有声明的变量 */
    UNDECLARED_VARIABLE,
    /** 项中含有 UCLID5 无法表达的运算符 */
    UNSUPPORTED_OPERATOR,
    /** 组合 UF 的参数直接或间接引用了它自己 */
    CYCLIC_UF_REFERENCE
}
