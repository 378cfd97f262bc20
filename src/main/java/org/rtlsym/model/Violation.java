package org.rtlsym.model;

/**
 * 模型结构不变式的违反类型。括号内为对应的不变式编号。
 */
public enum Violation {
    /** (1) 同一名称在输入/输出/状态/UF 中重复声明；输出与 UF 同名除外 */
    NAME_COLLISION(1),
    /** (2) 声明的名称包含 '.' */
    QUALIFIED_DECLARATION(2),
    /** (3) 输入或 UF 带有 logic/default_next 定义；或键不是可定义的形式 */
    ILLEGAL_DEFINITION(3),
    /** (4) 非数组状态变量没有定义，或同时有 logic 和 default_next */
    STATE_DEFINITION(4),
    /** (5) 输出既没有定义也不是 UF */
    OUTPUT_UNDEFINED(5),
    /** (6) 实例的输入绑定与子模型的输入不一致 */
    BINDING_MISMATCH(6),
    /** (7) 项类型检查失败 */
    TYPE_ERROR(7),
    /** 初值指向未声明的状态/输出变量 */
    INIT_TARGET_UNDECLARED(0);

    private final int invariant;

    Violation(int invariant) {
        this.invariant = invariant;
    }

    public int getInvariant() {
        return invariant;
    }
}
