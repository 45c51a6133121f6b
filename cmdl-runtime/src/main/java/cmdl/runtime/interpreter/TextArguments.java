package cmdl.runtime.interpreter;

import java.util.ArrayList;
import java.util.List;

/**
 * 参数文本工具：按逗号拆分（引号内的逗号不拆）以及引号识别。
 */
final class TextArguments {

    private TextArguments() {}

    /** 按引号外的逗号拆分，各段去除首尾空白，丢弃末尾的空段 */
    static List<String> split(String arguments) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = 0;
        for (int i = 0; i < arguments.length(); i++) {
            char c = arguments.charAt(i);
            if (quote != 0) {
                current.append(c);
                if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
                current.append(c);
            } else if (c == ',') {
                parts.add(current.toString().trim());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        String last = current.toString().trim();
        if (!last.isEmpty()) {
            parts.add(last);
        }
        return parts;
    }

    /** 是否被同一种引号包围 */
    static boolean isQuoted(String text) {
        if (text.length() < 2) {
            return false;
        }
        char first = text.charAt(0);
        return (first == '"' || first == '\'') && text.charAt(text.length() - 1) == first;
    }

    static String unquote(String text) {
        return text.substring(1, text.length() - 1);
    }
}
