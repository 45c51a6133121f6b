package com.cmdlang.compiler.expr;

/**
 * 变量引用
 */
public final class Identifier extends Expression {
    private final String name;

    public Identifier(int position, String name) {
        super(position);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }

    @Override
    public String toString() {
        return name;
    }
}
