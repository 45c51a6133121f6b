package cmdl.runtime.interpreter;

/**
 * 执行的步数超过 {@link ExecutionPolicy#getMaxSteps()}，
 * 通常意味着没有出口的 {@code loop:} 或 goto 环。
 */
public class StepLimitExceededException extends CmdlRuntimeException {

    private final long limit;

    public StepLimitExceededException(long limit, String construct) {
        super("Step limit exceeded (" + limit + " steps, possible infinite loop)", construct);
        this.limit = limit;
    }

    public long getLimit() {
        return limit;
    }
}
