package com.cmdlang.compiler.expr;

import java.util.List;

import static com.cmdlang.compiler.expr.ExprTokenType.*;

/**
 * 表达式递归下降解析器
 *
 * <p>优先级从低到高：{@code or}、{@code and}、{@code not}、比较（可链式）、
 * 加减、乘除模、一元正负、基本项。不支持函数调用和成员访问。</p>
 */
public class ExprParser {

    private final String source;
    private final List<ExprToken> tokens;
    private final ExpressionContext context;
    private int current = 0;

    public ExprParser(String source, ExpressionContext context) {
        this.source = source;
        this.tokens = new ExprLexer(source).scanTokens();
        this.context = context;
    }

    /** 便捷入口 */
    public static Expression parse(String source, ExpressionContext context) {
        return new ExprParser(source, context).parse();
    }

    public Expression parse() {
        if (check(EOF)) {
            throw error("Empty expression", peek());
        }
        Expression expr = parseOr();
        if (!check(EOF)) {
            throw error("Unexpected '" + peek().getLexeme() + "'", peek());
        }
        return expr;
    }

    // 逻辑或
    private Expression parseOr() {
        Expression left = parseAnd();
        while (match(OR)) {
            int pos = previous().getPosition();
            Expression right = parseAnd();
            left = new BinaryExpr(pos, left, BinaryExpr.BinaryOp.OR, right);
        }
        return left;
    }

    // 逻辑与
    private Expression parseAnd() {
        Expression left = parseNot();
        while (match(AND)) {
            int pos = previous().getPosition();
            Expression right = parseNot();
            left = new BinaryExpr(pos, left, BinaryExpr.BinaryOp.AND, right);
        }
        return left;
    }

    // 逻辑非
    private Expression parseNot() {
        if (match(NOT)) {
            int pos = previous().getPosition();
            return new UnaryExpr(pos, UnaryExpr.UnaryOp.NOT, parseNot());
        }
        return parseComparison();
    }

    // 比较（支持链式比较 a < b < c -> a < b and b < c）
    private Expression parseComparison() {
        Expression left = parseAdditive();
        if (!isComparisonOperator(peek())) {
            return left;
        }

        Expression result = null;
        Expression prevRight = left;
        while (isComparisonOperator(peek())) {
            ExprToken op = advance();
            Expression right = parseAdditive();
            Expression comparison = new BinaryExpr(op.getPosition(), prevRight, comparisonOp(op), right);
            result = result == null
                    ? comparison
                    : new BinaryExpr(op.getPosition(), result, BinaryExpr.BinaryOp.AND, comparison);
            prevRight = right;
        }
        return result;
    }

    private boolean isComparisonOperator(ExprToken token) {
        if (token.is(ASSIGN)) {
            if (context == ExpressionContext.CONDITION) {
                return true;
            }
            throw error("Unexpected '=' (use '==' to compare)", token);
        }
        return token.isOneOf(EQ, NE, LT, GT, LE, GE);
    }

    private static BinaryExpr.BinaryOp comparisonOp(ExprToken op) {
        switch (op.getType()) {
            case ASSIGN:
            case EQ: return BinaryExpr.BinaryOp.EQ;
            case NE: return BinaryExpr.BinaryOp.NE;
            case LT: return BinaryExpr.BinaryOp.LT;
            case GT: return BinaryExpr.BinaryOp.GT;
            case LE: return BinaryExpr.BinaryOp.LE;
            case GE: return BinaryExpr.BinaryOp.GE;
            default: throw new IllegalStateException("Not a comparison: " + op);
        }
    }

    // 加减
    private Expression parseAdditive() {
        Expression left = parseMultiplicative();
        while (check(PLUS) || check(MINUS)) {
            ExprToken op = advance();
            Expression right = parseMultiplicative();
            BinaryExpr.BinaryOp binOp = op.is(PLUS) ? BinaryExpr.BinaryOp.ADD : BinaryExpr.BinaryOp.SUB;
            left = new BinaryExpr(op.getPosition(), left, binOp, right);
        }
        return left;
    }

    // 乘除模
    private Expression parseMultiplicative() {
        Expression left = parseUnary();
        while (peek().isOneOf(STAR, SLASH, PERCENT)) {
            ExprToken op = advance();
            Expression right = parseUnary();
            BinaryExpr.BinaryOp binOp;
            switch (op.getType()) {
                case STAR:  binOp = BinaryExpr.BinaryOp.MUL; break;
                case SLASH: binOp = BinaryExpr.BinaryOp.DIV; break;
                default:    binOp = BinaryExpr.BinaryOp.MOD; break;
            }
            left = new BinaryExpr(op.getPosition(), left, binOp, right);
        }
        return left;
    }

    // 一元正负
    private Expression parseUnary() {
        if (check(MINUS) || check(PLUS)) {
            ExprToken op = advance();
            UnaryExpr.UnaryOp unaryOp = op.is(MINUS) ? UnaryExpr.UnaryOp.NEG : UnaryExpr.UnaryOp.POS;
            return new UnaryExpr(op.getPosition(), unaryOp, parseUnary());
        }
        return parsePrimary();
    }

    private Expression parsePrimary() {
        ExprToken token = peek();
        switch (token.getType()) {
            case NUMBER:
            case STRING:
                advance();
                return new Literal(token.getPosition(), token.getLiteral());
            case IDENTIFIER:
                advance();
                if (check(LPAREN)) {
                    throw error("Function calls are not supported", peek());
                }
                return new Identifier(token.getPosition(), token.getLexeme());
            case LPAREN: {
                advance();
                Expression inner = parseOr();
                if (!match(RPAREN)) {
                    throw error("Expected ')'", peek());
                }
                return inner;
            }
            case EOF:
                throw error("Unexpected end of expression", token);
            default:
                throw error("Unexpected '" + token.getLexeme() + "'", token);
        }
    }

    // ============ 辅助方法 ============

    private ExprParseException error(String message, ExprToken token) {
        return new ExprParseException(message, source, token.getPosition());
    }

    private boolean check(ExprTokenType type) {
        return peek().is(type);
    }

    private boolean match(ExprTokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private ExprToken advance() {
        ExprToken token = tokens.get(current);
        if (!token.is(EOF)) {
            current++;
        }
        return token;
    }

    private ExprToken peek() {
        return tokens.get(current);
    }

    private ExprToken previous() {
        return tokens.get(current - 1);
    }
}
