package cmdl.runtime;

/**
 * cmdl 运行时值的基类：数字、文本或布尔。
 */
public abstract class CmdlValue {

    /**
     * 将 Java 值转换为 CmdlValue
     *
     * @throws CmdlException 不支持的 Java 类型
     */
    public static CmdlValue fromJava(Object javaValue) {
        if (javaValue instanceof CmdlValue) {
            return (CmdlValue) javaValue;
        }
        if (javaValue instanceof Integer || javaValue instanceof Long
                || javaValue instanceof Short || javaValue instanceof Byte) {
            return CmdlNumber.of(((Number) javaValue).longValue());
        }
        if (javaValue instanceof Double || javaValue instanceof Float) {
            return CmdlNumber.of(((Number) javaValue).doubleValue());
        }
        if (javaValue instanceof Boolean) {
            return CmdlBoolean.of((Boolean) javaValue);
        }
        if (javaValue instanceof CharSequence || javaValue instanceof Character) {
            return CmdlText.of(javaValue.toString());
        }
        String type = javaValue == null ? "null" : javaValue.getClass().getName();
        throw new CmdlException("Cannot convert Java value to a cmdl value: " + type);
    }

    /** {@link #fromJava(Object)} 是否接受该 Java 值 */
    public static boolean isConvertible(Object javaValue) {
        return javaValue instanceof CmdlValue
                || javaValue instanceof Integer || javaValue instanceof Long
                || javaValue instanceof Short || javaValue instanceof Byte
                || javaValue instanceof Double || javaValue instanceof Float
                || javaValue instanceof Boolean
                || javaValue instanceof CharSequence || javaValue instanceof Character;
    }

    /**
     * 类型名称（用于错误消息）
     */
    public abstract String getTypeName();

    /**
     * 获取底层 Java 值
     */
    public abstract Object toJavaValue();

    /**
     * 转换为布尔值（用于条件判断）
     */
    public abstract boolean isTruthy();

    /**
     * 输出到终端时的文本形式
     */
    public abstract String asDisplayString();

    public boolean isNumber() {
        return false;
    }

    public boolean isText() {
        return false;
    }

    public boolean isBoolean() {
        return false;
    }

    /** 是否可参与算术运算（数字和布尔） */
    public boolean isNumeric() {
        return isNumber() || isBoolean();
    }

    /**
     * 数值视图。布尔值视为 1 / 0。
     *
     * @throws CmdlException 非数值类型
     */
    public CmdlNumber toNumber() {
        throw new CmdlException("Not a number: " + getTypeName());
    }

    @Override
    public String toString() {
        return asDisplayString();
    }
}
