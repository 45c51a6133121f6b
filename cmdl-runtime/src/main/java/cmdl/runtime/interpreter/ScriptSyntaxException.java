package cmdl.runtime.interpreter;

/**
 * 语句参数格式错误，例如 {@code set} 缺少 {@code name = value}。
 */
public class ScriptSyntaxException extends CmdlRuntimeException {

    public ScriptSyntaxException(String message, String statement) {
        super(message + ": " + statement, statement);
    }
}
