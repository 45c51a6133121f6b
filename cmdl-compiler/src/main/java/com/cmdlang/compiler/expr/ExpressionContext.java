package com.cmdlang.compiler.expr;

/**
 * 表达式所处的上下文
 */
public enum ExpressionContext {
    /**
     * 赋值右值和循环次数（math / set / loop）。
     * 单个 {@code =} 是语法错误；值为数字文本的变量按数字代入。
     */
    ARITHMETIC,
    /**
     * if / elif 条件。单个 {@code =} 视为相等比较；文本变量保持文本。
     */
    CONDITION
}
