package com.cmdlang.compiler.expr;

/**
 * 表达式基类
 */
public abstract class Expression {
    protected final int position;

    protected Expression(int position) {
        this.position = position;
    }

    /** 在原表达式文本中的起始偏移 */
    public int getPosition() {
        return position;
    }

    public abstract <R> R accept(ExprVisitor<R> visitor);
}
