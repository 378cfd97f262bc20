package org.rtlsym.translate;

/**
 * 给定重要信号集合时，对其余信号的抽象策略。
 */
public enum CoiPolicy {
    /** 被引用的省略信号成为无参数、带自由参数的 UF */
    NO_COI,
    /** 被引用的省略信号成为以其影响锥前沿为参数的 UF；寄存器成为时序 UF */
    UF_ARGS_COI,
    /** 不引入 UF；保留重要信号影响锥内的全部信号，删除其余信号 */
    KEEP_COI
}
