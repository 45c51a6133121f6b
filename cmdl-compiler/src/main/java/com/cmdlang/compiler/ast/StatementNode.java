package com.cmdlang.compiler.ast;

/**
 * 普通命令行，执行时才解析为命令名和参数
 */
public final class StatementNode extends Node {

    public StatementNode(SourceLocation location, String raw) {
        super(location, raw);
    }

    public String getRaw() {
        return sourceText;
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitStatement(this, context);
    }

    @Override
    public String toString() {
        return "Statement(" + sourceText + ")";
    }
}
