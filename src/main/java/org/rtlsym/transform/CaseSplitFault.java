package org.rtlsym.transform;

/**
 * 分情况拆分失败的原因。
 */
public enum CaseSplitFault {
    /** 选择变量不是模型声明的输入或状态 */
    UNKNOWN_SELECTOR,
    /** 选择变量既不是布尔也不是位向量 */
    UNSUPPORTED_SELECTOR_SORT,
    /** 给定的取值超出选择变量的取值范围 */
    VALUE_OUT_OF_RANGE,
    EMPTY_VALUE_SET
}
