package io.github.vevoly.rewards.api.constants;

/**
 * <h3>幂等策略类型枚举 (Idempotency Strategy Type)</h3>
 *
 * <p>用于配置文件中选择去重策略。</p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * Used in configuration files (application.yml) to select the deduplication strategy.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public enum IdempotencyType {

    /**
     * <b>布隆过滤器 (Bloom Filter)</b>
     * <br>
     * 省内存，高性能，但有微小误判率。
     * <br>
     * <span style="color: gray;">Low memory, slight false positive rate.</span>
     */
    BLOOM,

    /**
     * <b>LRU 缓存 (LRU Cache)</b>
     * <br>
     * 精准去重，数据量极大时内存消耗大。
     * <br>
     * <span style="color: gray;">Exact deduplication of recent transaction ids.</span>
     */
    LRU
}
