package com.cmdlang.compiler.expr;

/**
 * 字面量：Long、Double 或 String
 */
public final class Literal extends Expression {
    private final Object value;

    public Literal(int position, Object value) {
        super(position);
        if (!(value instanceof Long || value instanceof Double || value instanceof String)) {
            throw new IllegalArgumentException("Unsupported literal: " + value);
        }
        this.value = value;
    }

    public Object getValue() {
        return value;
    }

    public boolean isText() {
        return value instanceof String;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public String toString() {
        return isText() ? "'" + value + "'" : String.valueOf(value);
    }
}
