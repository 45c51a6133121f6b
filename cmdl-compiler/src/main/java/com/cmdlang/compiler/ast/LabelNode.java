package com.cmdlang.compiler.ast;

/**
 * 标签节点 {@code name():}，仅作为跳转目标
 */
public final class LabelNode extends Node {
    private final String name;

    public LabelNode(SourceLocation location, String sourceText, String name) {
        super(location, sourceText);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitLabel(this, context);
    }

    @Override
    public String toString() {
        return "Label(" + name + ")";
    }
}
