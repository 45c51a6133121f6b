package com.cmdlang.compiler.expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 表达式词法分析器
 *
 * <p>标识符为不以数字开头的单词字符序列；{@code and}/{@code or}/{@code not}
 * 是仅有的保留字。字符串用单引号或双引号包围，不支持转义。</p>
 */
public class ExprLexer {

    private static final Map<String, ExprTokenType> KEYWORDS;

    static {
        Map<String, ExprTokenType> map = new HashMap<>();
        map.put("and", ExprTokenType.AND);
        map.put("or", ExprTokenType.OR);
        map.put("not", ExprTokenType.NOT);
        KEYWORDS = Collections.unmodifiableMap(map);
    }

    /** 是否为保留的布尔关键词 */
    public static boolean isKeyword(String word) {
        return KEYWORDS.containsKey(word);
    }

    private final String source;
    private final List<ExprToken> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;

    public ExprLexer(String source) {
        this.source = source;
    }

    public List<ExprToken> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        tokens.add(new ExprToken(ExprTokenType.EOF, "", null, current));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case ' ':
            case '\t':
            case '\r':
            case '\n':
                break;
            case '(': addToken(ExprTokenType.LPAREN); break;
            case ')': addToken(ExprTokenType.RPAREN); break;
            case '+': addToken(ExprTokenType.PLUS); break;
            case '-': addToken(ExprTokenType.MINUS); break;
            case '*': addToken(ExprTokenType.STAR); break;
            case '/': addToken(ExprTokenType.SLASH); break;
            case '%': addToken(ExprTokenType.PERCENT); break;
            case '=':
                addToken(match('=') ? ExprTokenType.EQ : ExprTokenType.ASSIGN);
                break;
            case '!':
                if (!match('=')) {
                    throw error("Unexpected character '!'");
                }
                addToken(ExprTokenType.NE);
                break;
            case '<':
                addToken(match('=') ? ExprTokenType.LE : ExprTokenType.LT);
                break;
            case '>':
                addToken(match('=') ? ExprTokenType.GE : ExprTokenType.GT);
                break;
            case '"':
            case '\'':
                scanString(c);
                break;
            default:
                if (isDigit(c) || (c == '.' && isDigit(peek()))) {
                    scanNumber();
                } else if (isIdentifierStart(c)) {
                    scanIdentifier();
                } else {
                    throw error("Unexpected character '" + c + "'");
                }
                break;
        }
    }

    private void scanString(char quote) {
        while (!isAtEnd() && peek() != quote) {
            advance();
        }
        if (isAtEnd()) {
            throw error("Unterminated string");
        }
        advance();
        String value = source.substring(start + 1, current - 1);
        addToken(ExprTokenType.STRING, value);
    }

    private void scanNumber() {
        boolean real = source.charAt(start) == '.';
        while (isDigit(peek())) {
            advance();
        }
        if (!real && peek() == '.') {
            real = true;
            advance();
            while (isDigit(peek())) {
                advance();
            }
        }
        if (peek() == 'e' || peek() == 'E') {
            int save = current;
            advance();
            if (peek() == '+' || peek() == '-') {
                advance();
            }
            if (isDigit(peek())) {
                real = true;
                while (isDigit(peek())) {
                    advance();
                }
            } else {
                current = save;
            }
        }
        if (isIdentifierPart(peek())) {
            throw error("Invalid number literal");
        }
        String text = source.substring(start, current);
        if (!real) {
            try {
                addToken(ExprTokenType.NUMBER, Long.parseLong(text));
                return;
            } catch (NumberFormatException e) {
                // 超出 long 范围，按实数处理
            }
        }
        addToken(ExprTokenType.NUMBER, Double.parseDouble(text));
    }

    private void scanIdentifier() {
        while (isIdentifierPart(peek())) {
            advance();
        }
        String text = source.substring(start, current);
        ExprTokenType keyword = KEYWORDS.get(text);
        addToken(keyword != null ? keyword : ExprTokenType.IDENTIFIER);
    }

    // ============ 辅助方法 ============

    private ExprParseException error(String message) {
        return new ExprParseException(message, source, start);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        return source.charAt(current++);
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) {
            return false;
        }
        current++;
        return true;
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(current);
    }

    private void addToken(ExprTokenType type) {
        addToken(type, null);
    }

    private void addToken(ExprTokenType type, Object literal) {
        tokens.add(new ExprToken(type, source.substring(start, current), literal, start));
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    static boolean isIdentifierStart(char c) {
        return c == '_' || Character.isLetter(c);
    }

    static boolean isIdentifierPart(char c) {
        return c == '_' || Character.isLetterOrDigit(c);
    }
}
