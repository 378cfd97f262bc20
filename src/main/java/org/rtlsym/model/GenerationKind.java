package org.rtlsym.model;

/**
 * 生成模型的机制。一个模型可以依次经历多种机制，因此用 Provenance 组合。
 */
public enum GenerationKind {
    HANDWRITTEN,
    SYNTAX_GENERATED,
    CASE_SPLIT,
    SYNTHESIZED
}
