package com.cmdlang.compiler.expr;

/**
 * 一元表达式
 */
public final class UnaryExpr extends Expression {

    /** 一元运算符 */
    public enum UnaryOp { NEG, POS, NOT }

    private final UnaryOp operator;
    private final Expression operand;

    public UnaryExpr(int position, UnaryOp operator, Expression operand) {
        super(position);
        this.operator = operator;
        this.operand = operand;
    }

    public UnaryOp getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }

    @Override
    public String toString() {
        switch (operator) {
            case NEG: return "(-" + operand + ")";
            case POS: return "(+" + operand + ")";
            default:  return "(not " + operand + ")";
        }
    }
}
