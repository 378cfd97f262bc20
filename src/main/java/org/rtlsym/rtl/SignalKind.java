package org.rtlsym.rtl;

/**
 * RTL 信号的声明种类。端口方向与寄存器/线网的区别由前端给出；
 * 一个信号最终进入 logic 还是 default_next 由驱动它的块决定，而不是由种类决定。
 */
public enum SignalKind {
    INPUT,
    OUTPUT,
    REG,
    WIRE;

    public boolean isPort() {
        return this == INPUT || this == OUTPUT;
    }
}
