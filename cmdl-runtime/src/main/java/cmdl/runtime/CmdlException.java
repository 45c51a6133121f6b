package cmdl.runtime;

/**
 * cmdl 基础运行时异常（无源位置信息）。
 *
 * <p>{@code cmdl.runtime.interpreter} 中的 {@code CmdlRuntimeException} 继承此类，
 * 并添加出错语句和源码位置。</p>
 */
public class CmdlException extends RuntimeException {

    public CmdlException(String message) {
        super(message);
    }

    public CmdlException(String message, Throwable cause) {
        super(message, cause);
    }
}
