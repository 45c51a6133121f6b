package com.cmdlang.compiler.lexer;

/**
 * 已分类的源码行
 */
public final class SourceLine {
    private final LineKind kind;
    private final int depth;
    private final int line;
    private final String text;
    private final String argument;

    public SourceLine(LineKind kind, int depth, int line, String text, String argument) {
        this.kind = kind;
        this.depth = depth;
        this.line = line;
        this.text = text;
        this.argument = argument;
    }

    public LineKind getKind() {
        return kind;
    }

    /** 缩进层级 */
    public int getDepth() {
        return depth;
    }

    /** 1 起始的行号 */
    public int getLine() {
        return line;
    }

    /** 去掉前导空白后的行文本 */
    public String getText() {
        return text;
    }

    /**
     * 行参数：LABEL 为标签名，LOOP 为次数参数（无则 null），
     * IF/ELIF 为条件文本，ELSE/STATEMENT 为 null
     */
    public String getArgument() {
        return argument;
    }

    public boolean is(LineKind kind) {
        return this.kind == kind;
    }

    @Override
    public String toString() {
        return String.format("%s[depth=%d](%s) at line %d", kind, depth, text, line);
    }
}
