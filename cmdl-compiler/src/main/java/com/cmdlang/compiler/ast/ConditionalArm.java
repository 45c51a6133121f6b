package com.cmdlang.compiler.ast;

/**
 * 条件链中的一个分支
 */
public final class ConditionalArm {

    /** 分支类型 */
    public enum Kind { IF, ELIF, ELSE }

    private final Kind kind;
    private final String condition;  // ELSE 分支为 null
    private final Block body;
    private final SourceLocation location;

    public ConditionalArm(Kind kind, String condition, Block body, SourceLocation location) {
        this.kind = kind;
        this.condition = condition;
        this.body = body;
        this.location = location;
    }

    public Kind getKind() {
        return kind;
    }

    public String getCondition() {
        return condition;
    }

    public boolean hasCondition() {
        return condition != null;
    }

    public Block getBody() {
        return body;
    }

    public SourceLocation getLocation() {
        return location;
    }
}
