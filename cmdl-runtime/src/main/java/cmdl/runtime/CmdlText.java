package cmdl.runtime;

/**
 * 文本值
 */
public final class CmdlText extends CmdlValue {

    public static final CmdlText EMPTY = new CmdlText("");

    public static CmdlText of(String value) {
        return value.isEmpty() ? EMPTY : new CmdlText(value);
    }

    private final String value;

    private CmdlText(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public String getTypeName() {
        return "text";
    }

    @Override
    public Object toJavaValue() {
        return value;
    }

    @Override
    public boolean isTruthy() {
        return !value.isEmpty();
    }

    @Override
    public boolean isText() {
        return true;
    }

    @Override
    public String asDisplayString() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CmdlText)) return false;
        return value.equals(((CmdlText) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }
}
