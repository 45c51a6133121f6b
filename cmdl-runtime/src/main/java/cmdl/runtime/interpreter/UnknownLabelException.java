package cmdl.runtime.interpreter;

/**
 * {@code goto} 的目标标签不存在
 */
public class UnknownLabelException extends CmdlRuntimeException {

    public UnknownLabelException(String label) {
        super("Unknown label: " + label, label);
    }

    public String getLabel() {
        return getConstruct();
    }
}
