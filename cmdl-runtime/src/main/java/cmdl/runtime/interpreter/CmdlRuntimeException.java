package cmdl.runtime.interpreter;

import cmdl.runtime.CmdlException;
import com.cmdlang.compiler.ast.SourceLocation;

/**
 * cmdl 运行时异常
 *
 * <p>携带出错的语法单元文本（语句、表达式或标签名）。异常向外传播时，
 * 解释器会补上所在语句的源码位置，{@link #getMessage()} 据此输出类似
 * 下面的定位信息：</p>
 * <pre>
 * Unknown label: nowhere
 *   --> demo.cmdl:7:5
 *   |
 * 7 |     goto nowhere()
 * </pre>
 */
public class CmdlRuntimeException extends CmdlException {

    private final String construct;
    private SourceLocation location;
    private String sourceLine;

    public CmdlRuntimeException(String message, String construct) {
        super(message);
        this.construct = construct;
    }

    public CmdlRuntimeException(String message, String construct, Throwable cause) {
        super(message, cause);
        this.construct = construct;
    }

    /** 出错的语法单元文本 */
    public String getConstruct() {
        return construct;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public String getSourceLine() {
        return sourceLine;
    }

    /** 只记录最内层的位置 */
    void attachLocation(SourceLocation location, String sourceLine) {
        if (this.location == null && location != null) {
            this.location = location;
            this.sourceLine = sourceLine;
        }
    }

    /** 返回不含位置信息的纯错误消息 */
    public String getRawMessage() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        if (location == null || location.getLine() <= 0) {
            return super.getMessage();
        }
        return super.getMessage() + "\n" + formatLocation();
    }

    private String formatLocation() {
        StringBuilder sb = new StringBuilder();
        sb.append("  --> ").append(location.getFile())
          .append(":").append(location.getLine())
          .append(":").append(location.getColumn());
        if (sourceLine != null && !sourceLine.isEmpty()) {
            String lineNum = String.valueOf(location.getLine());
            String padding = repeat(' ', lineNum.length());
            sb.append("\n").append(padding).append(" |\n");
            sb.append(lineNum).append(" | ")
              .append(repeat(' ', Math.max(0, location.getColumn() - 1)))
              .append(sourceLine);
        }
        return sb.toString();
    }

    private static String repeat(char c, int count) {
        StringBuilder sb = new StringBuilder(count);
        for (int i = 0; i < count; i++) {
            sb.append(c);
        }
        return sb.toString();
    }
}
