package com.cmdlang.compiler.expr;

/**
 * 表达式访问者
 */
public interface ExprVisitor<R> {

    R visitBinary(BinaryExpr expr);

    R visitUnary(UnaryExpr expr);

    R visitLiteral(Literal expr);

    R visitIdentifier(Identifier expr);
}
