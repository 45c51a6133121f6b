package com.cmdlang.compiler.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * if / elif / else 条件链
 *
 * <p>不变量：第一个分支是 IF；ELSE 至多一个且总在最后。</p>
 */
public final class ConditionalNode extends Node {
    private final List<ConditionalArm> arms = new ArrayList<>();

    public ConditionalNode(SourceLocation location, String sourceText, ConditionalArm ifArm) {
        super(location, sourceText);
        if (ifArm.getKind() != ConditionalArm.Kind.IF) {
            throw new IllegalArgumentException("Conditional chain must start with an if arm");
        }
        arms.add(ifArm);
    }

    /** 构建期追加 elif/else 分支（仅供 Parser 使用） */
    public void addArm(ConditionalArm arm) {
        if (arm.getKind() == ConditionalArm.Kind.IF) {
            throw new IllegalArgumentException("Only the first arm may be an if arm");
        }
        if (hasElse()) {
            throw new IllegalStateException("Conditional chain already closed by else");
        }
        arms.add(arm);
    }

    public List<ConditionalArm> getArms() {
        return Collections.unmodifiableList(arms);
    }

    /** 链是否已被 else 关闭 */
    public boolean hasElse() {
        return arms.get(arms.size() - 1).getKind() == ConditionalArm.Kind.ELSE;
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitConditional(this, context);
    }

    @Override
    public String toString() {
        return "Conditional(" + arms.size() + " arms)";
    }
}
