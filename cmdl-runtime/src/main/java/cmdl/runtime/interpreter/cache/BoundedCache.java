package cmdl.runtime.interpreter.cache;

import java.util.function.Function;

/**
 * 有容量上限的缓存。解释器用它保存解析后的表达式树。
 */
public interface BoundedCache<K, V> {

    /**
     * @return 缓存值，不存在则返回 null
     */
    V get(K key);

    /**
     * 取出缓存值；不存在时调用 {@code loader} 计算并放入。
     * loader 抛出的异常原样传播，且不会留下缓存条目。
     */
    V computeIfAbsent(K key, Function<? super K, ? extends V> loader);

    long size();

    void clear();

    CacheStats getStats();
}
