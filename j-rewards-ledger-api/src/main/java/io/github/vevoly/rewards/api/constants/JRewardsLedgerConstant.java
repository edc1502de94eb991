package io.github.vevoly.rewards.api.constants;

import java.time.Duration;

/**
 * 系统常量 / System constant
 *
 * @author vevoly
 * @since 1.0.0
 */
public class JRewardsLedgerConstant {

    public static final String J_REWARDS_LEDGER_ID = "j-rewards-ledger";

    // 配置默认值 / Config default value
    public static final String DEFAULT_BASE_DIR = "./data/";
    public static final String DEFAULT_ENGINE_NAME = "JRewardsLedgerEngine";
    public static final int DEFAULT_BATCH_SIZE = 1000;
    public static final int DEFAULT_QUEUE_SIZE = 65536;
    public static final int DEFAULT_RING_BUFFER_SIZE = 1024;
    public static final int DEFAULT_SNAPSHOT_INTERVAL = 50000;
    public static final boolean DEFAULT_ENABLE_TIME_SNAPSHOT = true;
    public static final Duration DEFAULT_SNAPSHOT_TIME_INTERVAL = Duration.ofMinutes(10);
    public static final String DEFAULT_METRICS_PREFIX = J_REWARDS_LEDGER_ID + ".";
    public static final boolean DEFAULT_JOURNAL_ENABLED = true;
    public static final boolean DEFAULT_ADMIN_ENABLED = false;

    public static final String JOURNAL_DIR = "journal";
    public static final String SNAPSHOT_DIR = "snapshot";
    public static final String JOURNAL_KEY_FIELD_NAME = "receipt";

    public static final String ADMIN_ENABLED_PROPERTY = J_REWARDS_LEDGER_ID + ".admin.enabled";

    private JRewardsLedgerConstant() {
    }
}
