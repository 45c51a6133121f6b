package com.cmdlang.compiler.lexer;

/**
 * 源码行类型
 */
public enum LineKind {
    /** {@code name():} */
    LABEL,
    /** {@code loop:} 或 {@code loop(param):} */
    LOOP,
    /** {@code if <condition>:} */
    IF,
    /** {@code elif <condition>:} */
    ELIF,
    /** {@code else:} */
    ELSE,
    /** 其他任意命令行 */
    STATEMENT
}
