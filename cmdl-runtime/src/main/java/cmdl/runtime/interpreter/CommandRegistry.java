package cmdl.runtime.interpreter;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * 命令名到 {@link CommandHandler} 的映射。命令名不区分大小写。
 */
public final class CommandRegistry {

    private final Map<String, CommandHandler> handlers = new TreeMap<>();

    public void register(String name, CommandHandler handler) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("command name must not be empty");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler of '" + name + "' must not be null");
        }
        handlers.put(name.toLowerCase(Locale.ROOT), handler);
    }

    /**
     * @return 处理器，未注册返回 null
     */
    public CommandHandler lookup(String name) {
        return handlers.get(name.toLowerCase(Locale.ROOT));
    }

    public boolean contains(String name) {
        return handlers.containsKey(name.toLowerCase(Locale.ROOT));
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(handlers.keySet());
    }
}
