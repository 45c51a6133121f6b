package cmdl.runtime.interpreter;

/**
 * 语句命令的实现。返回的信号交给运行循环处理，宿主命令也可以发起跳转。
 */
@FunctionalInterface
public interface CommandHandler {

    ExecutionSignal execute(Interpreter interpreter, StatementCall call);
}
