package com.cmdlang.compiler.expr;

/**
 * 表达式词法单元类型
 */
public enum ExprTokenType {
    // 字面量与标识符
    NUMBER,
    STRING,
    IDENTIFIER,

    // 布尔关键词
    AND,
    OR,
    NOT,

    // 算术
    PLUS,
    MINUS,
    STAR,
    SLASH,
    PERCENT,

    // 比较
    EQ,       // ==
    NE,       // !=
    LT,
    GT,
    LE,
    GE,
    ASSIGN,   // 单个 =

    LPAREN,
    RPAREN,

    EOF
}
