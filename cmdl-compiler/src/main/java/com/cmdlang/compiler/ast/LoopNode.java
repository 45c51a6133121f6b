package com.cmdlang.compiler.ast;

/**
 * 循环节点 {@code loop:} / {@code loop(count):}
 */
public final class LoopNode extends Node {
    private final String countSpec;  // null = 无限循环
    private final Block body;

    public LoopNode(SourceLocation location, String sourceText, String countSpec, Block body) {
        super(location, sourceText);
        this.countSpec = countSpec;
        this.body = body;
    }

    /** 次数参数原文（数字、变量名或表达式），无限循环返回 null */
    public String getCountSpec() {
        return countSpec;
    }

    public boolean isInfinite() {
        return countSpec == null;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitLoop(this, context);
    }

    @Override
    public String toString() {
        return isInfinite() ? "Loop" : "Loop(" + countSpec + ")";
    }
}
