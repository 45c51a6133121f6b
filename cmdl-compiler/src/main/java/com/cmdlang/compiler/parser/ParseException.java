package com.cmdlang.compiler.parser;

/**
 * 解析异常
 */
public class ParseException extends RuntimeException {
    private final String fileName;
    private final int line;
    private final String lineText;

    public ParseException(String message, String fileName, int line, String lineText) {
        super(message);
        this.fileName = fileName;
        this.line = line;
        this.lineText = lineText;
    }

    public String getFileName() {
        return fileName;
    }

    public int getLine() {
        return line;
    }

    public String getLineText() {
        return lineText;
    }

    /** 不含位置信息的错误消息 */
    public String getRawMessage() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(super.getMessage());
        if (line > 0) {
            sb.append(" at ");
            if (fileName != null) {
                sb.append(fileName).append(':');
            }
            sb.append(line);
        }
        if (lineText != null) {
            sb.append(" (found '").append(lineText).append("')");
        }
        return sb.toString();
    }
}
