package org.rtlsym.translate;

/**
 * 翻译失败的原因。
 */
public enum TranslationFault {
    UNKNOWN_MODULE,
    UNKNOWN_SIGNAL,
    UNSUPPORTED_CONSTRUCT,
    MULTIPLE_CLOCK_DOMAINS,
    MULTIPLE_DRIVERS,
    WIDTH_MISMATCH,
    UNBOUND_PORT,
    UNKNOWN_PORT,
    RECURSIVE_INSTANTIATION,
    INVALID_MODEL
}
