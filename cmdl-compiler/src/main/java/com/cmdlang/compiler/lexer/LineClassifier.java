package com.cmdlang.compiler.lexer;

import com.cmdlang.compiler.parser.ParseException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 行分类器：计算每行的缩进层级并识别行类型。
 *
 * <p>缩进规则：以 Tab 开头的行按前导 Tab 个数计层级；否则按前导空格数整除 4。
 * 非 4 的倍数的空格缩进向下取整，不视为错误。</p>
 *
 * <p>空行和以 {@code #} 开头的注释行直接跳过，不会出现在结果中。</p>
 */
public class LineClassifier {

    /** 一个缩进层级对应的空格数 */
    public static final int INDENT_UNIT = 4;

    private static final Pattern LABEL = Pattern.compile("^([A-Za-z_]\\w*)\\(\\):\\s*$");
    private static final Pattern LOOP = Pattern.compile("^loop(?:\\(([^)]*)\\))?:\\s*$");
    private static final Pattern CONDITION = Pattern.compile("^(if|elif)\\s+(\\S.*?)\\s*:\\s*$");
    private static final Pattern ELSE = Pattern.compile("^else:\\s*$");
    private static final Pattern HEADER_KEYWORD = Pattern.compile("^(if|elif|else|loop)\\b");

    private final String source;
    private final String fileName;

    public LineClassifier(String source, String fileName) {
        this.source = source;
        this.fileName = fileName;
    }

    public LineClassifier(String source) {
        this(source, "<input>");
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * 对整段源码分类，返回有效行（跳过空行和注释）
     */
    public List<SourceLine> classify() {
        List<SourceLine> result = new ArrayList<>();
        String[] rawLines = source.split("\n", -1);
        for (int i = 0; i < rawLines.length; i++) {
            SourceLine line = classifyLine(rawLines[i], i + 1);
            if (line != null) {
                result.add(line);
            }
        }
        return result;
    }

    /**
     * 分类单行。空行或注释返回 null。
     *
     * @throws ParseException 行首是 if/elif/else/loop 关键字但不符合头部格式
     */
    SourceLine classifyLine(String raw, int lineNumber) {
        if (raw.endsWith("\r")) {
            raw = raw.substring(0, raw.length() - 1);
        }
        String trimmed = raw.trim();
        if (trimmed.isEmpty() || trimmed.startsWith("#")) {
            return null;
        }

        int depth = indentLevel(raw);
        String text = stripLeading(raw);

        Matcher m = LABEL.matcher(text);
        if (m.matches()) {
            return new SourceLine(LineKind.LABEL, depth, lineNumber, text, m.group(1));
        }
        m = LOOP.matcher(text);
        if (m.matches()) {
            String param = m.group(1);
            if (param != null) {
                param = param.trim();
                if (param.isEmpty()) {
                    param = null;
                }
            }
            return new SourceLine(LineKind.LOOP, depth, lineNumber, text, param);
        }
        m = CONDITION.matcher(text);
        if (m.matches()) {
            LineKind kind = "if".equals(m.group(1)) ? LineKind.IF : LineKind.ELIF;
            return new SourceLine(kind, depth, lineNumber, text, m.group(2).trim());
        }
        if (ELSE.matcher(text).matches()) {
            return new SourceLine(LineKind.ELSE, depth, lineNumber, text, null);
        }
        m = HEADER_KEYWORD.matcher(text);
        if (m.find()) {
            throw new ParseException("Malformed '" + m.group(1) + "' header", fileName, lineNumber, text);
        }
        return new SourceLine(LineKind.STATEMENT, depth, lineNumber, text, null);
    }

    /**
     * 计算缩进层级
     */
    public static int indentLevel(String line) {
        if (line.startsWith("\t")) {
            int tabs = 0;
            while (tabs < line.length() && line.charAt(tabs) == '\t') {
                tabs++;
            }
            return tabs;
        }
        int spaces = 0;
        while (spaces < line.length() && line.charAt(spaces) == ' ') {
            spaces++;
        }
        return spaces / INDENT_UNIT;
    }

    private static String stripLeading(String s) {
        int i = 0;
        while (i < s.length() && Character.isWhitespace(s.charAt(i))) {
            i++;
        }
        return s.substring(i);
    }
}
