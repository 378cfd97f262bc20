package org.rtlsym.guidance;

/**
 * 某个信号在某个周期上的角色。
 */
public enum AnnotationKind {
    /** 不关心 */
    DONT_CARE,
    /** 假定为仿真中读到的值 */
    ASSUME,
    /** 综合函数的参数 */
    PARAM,
    /** 综合函数的输出 */
    OUTPUT
}
