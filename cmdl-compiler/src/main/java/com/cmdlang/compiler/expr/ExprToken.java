package com.cmdlang.compiler.expr;

/**
 * 表达式词法单元
 */
public final class ExprToken {
    private final ExprTokenType type;
    private final String lexeme;
    private final Object literal;
    private final int position;

    public ExprToken(ExprTokenType type, String lexeme, Object literal, int position) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.position = position;
    }

    public ExprTokenType getType() {
        return type;
    }

    public String getLexeme() {
        return lexeme;
    }

    /** NUMBER 为 Long 或 Double，STRING 为去掉引号的文本，其余为 null */
    public Object getLiteral() {
        return literal;
    }

    /** 0 起始的字符偏移 */
    public int getPosition() {
        return position;
    }

    public boolean is(ExprTokenType type) {
        return this.type == type;
    }

    public boolean isOneOf(ExprTokenType... types) {
        for (ExprTokenType t : types) {
            if (this.type == t) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        if (literal != null) {
            return String.format("%s(%s, %s) at %d", type, lexeme, literal, position);
        }
        return String.format("%s(%s) at %d", type, lexeme, position);
    }
}
