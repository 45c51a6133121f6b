package cmdl.runtime.interpreter.cache;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Caffeine 缓存功能测试
 */
public class CaffeineCacheTest {

    @Test
    public void testComputeIfAbsent() {
        BoundedCache<String, Integer> cache = new CaffeineCache<>(100);

        assertEquals(Integer.valueOf(2), cache.computeIfAbsent("b", k -> 2));
        // 已存在时不重新计算
        assertEquals(Integer.valueOf(2), cache.computeIfAbsent("b", k -> 3));
        assertEquals(Integer.valueOf(2), cache.get("b"));
        assertNull(cache.get("missing"));
        assertEquals(1L, cache.size());
    }

    @Test
    public void testLoaderFailureIsNotCached() {
        BoundedCache<String, Integer> cache = new CaffeineCache<>(100);

        assertThrows(IllegalStateException.class, () -> cache.computeIfAbsent("bad", k -> {
            throw new IllegalStateException("boom");
        }));
        assertNull(cache.get("bad"));
        assertEquals(Integer.valueOf(7), cache.computeIfAbsent("bad", k -> 7));
    }

    @Test
    public void testStats() {
        BoundedCache<String, String> cache = new CaffeineCache<>(100);

        cache.computeIfAbsent("a", k -> "A");  // miss
        cache.computeIfAbsent("a", k -> "A");  // hit

        CacheStats stats = cache.getStats();
        assertEquals(1L, stats.getHitCount());
        assertEquals(1L, stats.getMissCount());
        assertEquals(0.5, stats.getHitRate(), 0.01);
        assertEquals(100L, stats.getMaximumSize());
    }

    @Test
    public void testClear() {
        BoundedCache<String, String> cache = new CaffeineCache<>(100);
        cache.computeIfAbsent("a", k -> "A");
        cache.clear();
        assertEquals(0L, cache.size());
        assertNull(cache.get("a"));
    }

    @Test
    public void testInvalidSize() {
        assertThrows(IllegalArgumentException.class, () -> new CaffeineCache<String, String>(0));
    }
}
