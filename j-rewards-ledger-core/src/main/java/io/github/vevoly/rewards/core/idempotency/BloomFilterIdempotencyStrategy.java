package io.github.vevoly.rewards.core.idempotency;

import com.google.common.hash.BloomFilter;
import com.google.common.hash.Funnels;
import io.github.vevoly.rewards.api.IdempotencyStrategy;
import io.github.vevoly.rewards.api.constants.IdempotencyType;

import java.io.Serial;
import java.nio.charset.StandardCharsets;

/**
 * <h3>基于 Guava BloomFilter 的去重策略 (BloomFilter Strategy)</h3>
 *
 * <p>按 txId 对命令去重的概率型策略。</p>
 * <ul>
 *     <li><b>优点：</b> 内存占用极低，查询极快。</li>
 *     <li><b>缺点：</b> 存在极低概率的误判 (把新的 txId 判为重复)，且不支持删除。</li>
 * </ul>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Guava BloomFilter Strategy.</b><br>
 * Probabilistic txId deduplication. Tiny memory footprint and fast lookups, at the price of rare false positives
 * (a fresh txId reported as a duplicate) and no deletion.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public class BloomFilterIdempotencyStrategy implements IdempotencyStrategy {
    @Serial
    private static final long serialVersionUID = 1L;

    private BloomFilter<CharSequence> filter;

    /**
     * 无参构造函数，默认 1000 万容量、十万分之一误判率。快照恢复时会被快照中的数据覆盖。
     * <br><span style="color: gray;">Defaults to 10M insertions at 1e-5 fpp; replaced by the snapshot copy on recovery.</span>
     */
    public BloomFilterIdempotencyStrategy() {
        this(10_000_000, 0.00001);
    }

    /**
     * @param expectedInsertions 预计插入数量 (Expected insertions)
     * @param fpp                误判率 (False positive probability)
     */
    public BloomFilterIdempotencyStrategy(int expectedInsertions, double fpp) {
        this.filter = BloomFilter.create(Funnels.stringFunnel(StandardCharsets.UTF_8), expectedInsertions, fpp);
    }

    @Override
    public boolean contains(String key) {
        return filter.mightContain(key);
    }

    @Override
    public void add(String key) {
        filter.put(key);
    }

    @Override
    public String getName() {
        return IdempotencyType.BLOOM.name();
    }
}
