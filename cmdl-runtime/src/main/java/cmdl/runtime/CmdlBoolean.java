package cmdl.runtime;

/**
 * 布尔值，由比较和 {@code not} 产生。算术中视为 1 / 0。
 */
public final class CmdlBoolean extends CmdlValue {

    public static final CmdlBoolean TRUE = new CmdlBoolean(true);
    public static final CmdlBoolean FALSE = new CmdlBoolean(false);

    public static CmdlBoolean of(boolean value) {
        return value ? TRUE : FALSE;
    }

    private final boolean value;

    private CmdlBoolean(boolean value) {
        this.value = value;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public String getTypeName() {
        return "boolean";
    }

    @Override
    public Object toJavaValue() {
        return value;
    }

    @Override
    public boolean isTruthy() {
        return value;
    }

    @Override
    public boolean isBoolean() {
        return true;
    }

    @Override
    public CmdlNumber toNumber() {
        return CmdlNumber.of(value ? 1 : 0);
    }

    @Override
    public String asDisplayString() {
        return value ? "True" : "False";
    }
}
