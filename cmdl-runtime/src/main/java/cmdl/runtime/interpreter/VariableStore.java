package cmdl.runtime.interpreter;

import cmdl.runtime.CmdlNumber;
import cmdl.runtime.CmdlText;
import cmdl.runtime.CmdlValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 全局变量表。只有一个作用域，变量在整个运行期间可见。
 *
 * <p>未定义的变量按使用场合解析为不同默认值：表达式中为 {@code 0}，
 * {@code text} 输出中为空文本。</p>
 */
public final class VariableStore {

    private final Map<String, CmdlValue> values = new LinkedHashMap<>();

    /**
     * @return 变量值，未定义返回 null
     */
    public CmdlValue lookup(String name) {
        return values.get(name);
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public void set(String name, CmdlValue value) {
        if (value == null) {
            throw new IllegalArgumentException("value of '" + name + "' must not be null");
        }
        values.put(name, value);
    }

    /** 写入 Java 值，按 {@link CmdlValue#fromJava(Object)} 转换 */
    public void setJava(String name, Object value) {
        set(name, CmdlValue.fromJava(value));
    }

    /** 表达式中的取值，未定义为 0 */
    public CmdlValue resolveForExpression(String name) {
        CmdlValue value = values.get(name);
        return value != null ? value : CmdlNumber.ZERO;
    }

    /** 输出中的取值，未定义为空文本 */
    public CmdlValue resolvePlain(String name) {
        CmdlValue value = values.get(name);
        return value != null ? value : CmdlText.EMPTY;
    }

    public CmdlValue remove(String name) {
        return values.remove(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public int size() {
        return values.size();
    }

    public void clear() {
        values.clear();
    }

    /** 按定义顺序导出为 Java 值 */
    public Map<String, Object> toJavaMap() {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<String, CmdlValue> e : values.entrySet()) {
            result.put(e.getKey(), e.getValue().toJavaValue());
        }
        return result;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
