package com.cmdlang.compiler.ast;

/**
 * 脚本树节点基类
 *
 * <p>节点在解析完成后只读。每个节点保留其所在源码行（去掉缩进），用于错误报告。</p>
 */
public abstract class Node {
    protected final SourceLocation location;
    protected final String sourceText;

    protected Node(SourceLocation location, String sourceText) {
        this.location = location;
        this.sourceText = sourceText;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public String getSourceText() {
        return sourceText;
    }

    public abstract <R, C> R accept(NodeVisitor<R, C> visitor, C context);
}
