package io.github.vevoly.rewards.core.idempotency;

import io.github.vevoly.rewards.api.IdempotencyStrategy;
import io.github.vevoly.rewards.api.constants.IdempotencyType;

import java.io.Serial;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * <h3>基于 LRU 的精准去重策略 (LRU Exact Strategy)</h3>
 *
 * <p>
 * 保留最近 N 个 txId，无误判；超出容量后淘汰最久未访问的 txId，被淘汰的 txId 再次提交会被当作新命令。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>LRU Exact Strategy.</b><br>
 * Keeps the most recent N txIds with no false positives. Beyond capacity the least recently used txId is evicted,
 * and resubmitting an evicted txId is treated as a new command.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public class LruIdempotencyStrategy implements IdempotencyStrategy {
    @Serial
    private static final long serialVersionUID = 1L;

    private LruHashMap<String, Boolean> cache;

    public LruIdempotencyStrategy() {
        this(500_000);
    }

    public LruIdempotencyStrategy(int maxCapacity) {
        if (maxCapacity <= 0) {
            throw new IllegalArgumentException("LRU capacity must be > 0");
        }
        this.cache = new LruHashMap<>(maxCapacity);
    }

    @Override
    public boolean contains(String key) {
        return cache.containsKey(key);
    }

    @Override
    public void add(String key) {
        cache.put(key, Boolean.TRUE);
    }

    @Override
    public void clear() {
        cache.clear();
    }

    @Override
    public String getName() {
        return IdempotencyType.LRU.name();
    }

    /**
     * 必须是静态内部类且拥有无参构造函数，Kryo 才能反序列化。
     * <br><span style="color: gray;">Static nested class with a no-arg constructor so Kryo can rebuild it.</span>
     */
    public static class LruHashMap<K, V> extends LinkedHashMap<K, V> {
        @Serial
        private static final long serialVersionUID = 1L;

        private int maxCapacity;

        public LruHashMap(int maxCapacity) {
            super(16, 0.75f, true);
            this.maxCapacity = maxCapacity;
        }

        @Override
        protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
            return size() > maxCapacity;
        }
    }
}
