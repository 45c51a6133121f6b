package cmdl.runtime.interpreter;

/**
 * 一次运行的结束方式
 */
public enum RunResult {
    /** 执行到程序末尾 */
    COMPLETED,
    /** 被 {@code exit} 终止 */
    EXITED
}
