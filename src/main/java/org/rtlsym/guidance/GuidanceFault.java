package org.rtlsym.guidance;

public enum GuidanceFault {
    UNKNOWN_SIGNAL,
    /** 基本名对应多个限定名 */
    AMBIGUOUS_SIGNAL,
    CYCLE_OUT_OF_RANGE,
    /** 同一信号混用按周期与按谓词两种标注 */
    AMBIGUOUS_ANNOTATION_SHAPE
}
