package com.cmdlang.compiler.expr;

/**
 * 表达式词法/语法错误
 */
public class ExprParseException extends RuntimeException {
    private final String expression;
    private final int position;

    public ExprParseException(String message, String expression, int position) {
        super(message);
        this.expression = expression;
        this.position = position;
    }

    public String getExpression() {
        return expression;
    }

    public int getPosition() {
        return position;
    }

    @Override
    public String getMessage() {
        return super.getMessage() + " at column " + (position + 1);
    }
}
