package cmdl.runtime.interpreter;

import java.util.Locale;

/**
 * 拆分后的语句：小写命令名加参数文本。
 *
 * <p>支持两种形式：{@code cmd(arg, ...)} 和 {@code cmd rest-of-line}。
 * 括号按嵌套匹配并跳过引号内的内容；同时存在括号参数和尾随文本时以括号参数为准。</p>
 */
public final class StatementCall {

    private final String command;
    private final String arguments;
    private final boolean parenthesized;
    private final String raw;

    private StatementCall(String command, String arguments, boolean parenthesized, String raw) {
        this.command = command;
        this.arguments = arguments;
        this.parenthesized = parenthesized;
        this.raw = raw;
    }

    /**
     * 拆分语句文本
     *
     * @return 拆分结果，不符合任何一种形式时返回 null
     */
    public static StatementCall parse(String raw) {
        String text = raw.trim();
        if (text.isEmpty() || !isNameStart(text.charAt(0))) {
            return null;
        }
        int end = 1;
        while (end < text.length() && isNamePart(text.charAt(end))) {
            end++;
        }
        String command = text.substring(0, end).toLowerCase(Locale.ROOT);
        String rest = text.substring(end);

        if (rest.isEmpty()) {
            return new StatementCall(command, "", false, raw);
        }
        if (rest.charAt(0) == '(') {
            int close = findClosingParen(rest);
            if (close < 0) {
                return null;
            }
            return new StatementCall(command, rest.substring(1, close), true, raw);
        }
        if (Character.isWhitespace(rest.charAt(0))) {
            return new StatementCall(command, rest.stripLeading(), false, raw);
        }
        return null;
    }

    /** 与 {@code text.charAt(0)} 处的左括号配对的右括号下标，未闭合返回 -1 */
    static int findClosingParen(String text) {
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static boolean isNameStart(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
    }

    private static boolean isNamePart(char c) {
        return isNameStart(c) || (c >= '0' && c <= '9');
    }

    public String getCommand() {
        return command;
    }

    public String getArguments() {
        return arguments;
    }

    public boolean isParenthesized() {
        return parenthesized;
    }

    public String getRaw() {
        return raw;
    }

    @Override
    public String toString() {
        return command + (parenthesized ? "(" + arguments + ")" : " " + arguments);
    }
}
