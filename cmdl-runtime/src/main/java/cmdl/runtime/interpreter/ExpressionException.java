package cmdl.runtime.interpreter;

/**
 * 表达式解析或求值失败。{@link #getConstruct()} 为原始表达式文本。
 */
public class ExpressionException extends CmdlRuntimeException {

    public ExpressionException(String expression, String reason) {
        super("Error evaluating expression '" + expression + "': " + reason, expression);
    }

    public ExpressionException(String expression, Throwable cause) {
        super("Error evaluating expression '" + expression + "': " + cause.getMessage(), expression, cause);
    }

    public String getExpression() {
        return getConstruct();
    }
}
