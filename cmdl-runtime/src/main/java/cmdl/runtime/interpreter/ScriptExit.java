package cmdl.runtime.interpreter;

/**
 * {@code exit} 语句的控制流信号，穿过所有循环和条件直达运行循环。
 *
 * <p>不是错误，不记录堆栈。</p>
 */
final class ScriptExit extends RuntimeException {

    static final ScriptExit INSTANCE = new ScriptExit();

    private ScriptExit() {
        super(null, null, false, false);
    }
}
