package cmdl.runtime.interpreter;

import com.cmdlang.compiler.analysis.JumpTarget;

/**
 * 节点执行结果。循环和条件分派器原样向上传递非 CONTINUE 的信号，
 * 且收到后不再继续自身的迭代。
 */
public final class ExecutionSignal {

    public enum Kind { CONTINUE, JUMP, RETURN_TO_CALLER }

    public static final ExecutionSignal CONTINUE = new ExecutionSignal(Kind.CONTINUE, null);
    public static final ExecutionSignal RETURN_TO_CALLER = new ExecutionSignal(Kind.RETURN_TO_CALLER, null);

    public static ExecutionSignal jump(JumpTarget target) {
        if (target == null) {
            throw new IllegalArgumentException("target");
        }
        return new ExecutionSignal(Kind.JUMP, target);
    }

    private final Kind kind;
    private final JumpTarget target;

    private ExecutionSignal(Kind kind, JumpTarget target) {
        this.kind = kind;
        this.target = target;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isContinue() {
        return kind == Kind.CONTINUE;
    }

    public boolean isJump() {
        return kind == Kind.JUMP;
    }

    /** 仅 JUMP 信号有目标 */
    public JumpTarget getTarget() {
        return target;
    }

    @Override
    public String toString() {
        return kind == Kind.JUMP ? "JUMP(" + target + ")" : kind.name();
    }
}
