package io.github.vevoly.rewards.core.snapshot;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;
import com.esotericsoftware.kryo.serializers.JavaSerializer;
import com.esotericsoftware.kryo.util.DefaultInstantiatorStrategy;
import com.google.common.hash.BloomFilter;
import io.github.vevoly.rewards.api.constants.JRewardsLedgerConstant;
import io.github.vevoly.rewards.api.exception.RewardsErrorCode;
import io.github.vevoly.rewards.api.exception.RewardsLedgerException;
import io.github.vevoly.rewards.core.idempotency.LruIdempotencyStrategy;
import lombok.extern.slf4j.Slf4j;
import org.objenesis.strategy.StdInstantiatorStrategy;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;

/**
 * <h3>快照管理器 (Snapshot Manager)</h3>
 *
 * <p>
 * 负责奖励状态的序列化与持久化。采用 <b>Kryo</b> 序列化，并使用 <b>原子文件操作</b> 保证数据完整性：
 * 先写临时文件，再原子重命名。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Snapshot Manager.</b><br>
 * Serializes the rewards state with <b>Kryo</b> and persists it with an <b>atomic file operation</b>:
 * write a temp file, then atomically rename it over the previous snapshot.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Slf4j
public class SnapshotManager {

    public static final String SNAPSHOT_FILE_NAME = "snapshot.dat";
    private static final String TEMP_FILE_NAME = "snapshot.tmp";

    private final File snapshotDir;

    /**
     * @param dataDir 引擎数据目录，快照写在其下的 snapshot 子目录 (Engine data dir; snapshots go to its snapshot subdir)
     */
    public SnapshotManager(String dataDir) {
        this.snapshotDir = new File(dataDir, JRewardsLedgerConstant.SNAPSHOT_DIR);
        if (!this.snapshotDir.exists() && !this.snapshotDir.mkdirs()) {
            log.warn("快照目录创建失败 / Failed to create snapshot dir: {}", snapshotDir.getAbsolutePath());
        }
    }

    /**
     * 原子写入快照 (Atomic snapshot write).
     *
     * @param container  快照内容 (Snapshot content)
     * @param logContext 日志上下文，如 [engine][CountTrigger] (Log context)
     * @throws RewardsLedgerException {@link RewardsErrorCode#SNAPSHOT_SAVE_FAILED}
     */
    public void save(SnapshotContainer container, String logContext) throws RewardsLedgerException {
        File tempFile = new File(snapshotDir, TEMP_FILE_NAME);
        File finalFile = new File(snapshotDir, SNAPSHOT_FILE_NAME);
        Kryo kryo = createKryo();

        // 1. 写入临时文件 / Write to temporary file
        try (Output output = new Output(new FileOutputStream(tempFile))) {
            kryo.writeObject(output, container);
            output.flush();
        } catch (IOException | RuntimeException e) {
            throw new RewardsLedgerException(RewardsErrorCode.SNAPSHOT_SAVE_FAILED,
                    logContext + " 快照写入临时文件失败 / Failed to write snapshot to temp file", e);
        }

        // 2. 原子重命名 / Atomic rename
        try {
            Files.move(tempFile.toPath(), finalFile.toPath(), StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new RewardsLedgerException(RewardsErrorCode.SNAPSHOT_SAVE_FAILED,
                    logContext + " 快照文件重命名失败 / Failed to rename snapshot file", e);
        }
        log.info("{} 快照保存成功 / Snapshot saved. commands={}, journalIndex={}",
                logContext, container.getCommandCount(), container.getLastJournalIndex());
    }

    /**
     * 加载快照 (Load snapshot).
     *
     * @return 快照，不存在时返回 null (Snapshot, or null when none exists)
     * @throws RewardsLedgerException 快照损坏或版本不兼容 ({@link RewardsErrorCode#SNAPSHOT_LOAD_FAILED})
     */
    public SnapshotContainer load() throws RewardsLedgerException {
        File file = new File(snapshotDir, SNAPSHOT_FILE_NAME);
        if (!file.exists()) {
            log.info("未发现快照文件，将以初始状态启动。/ No snapshot found, starting from the initial state.");
            return null;
        }
        return read(file);
    }

    /**
     * 读取任意快照文件，供查看工具使用 (Reads any snapshot file; used by the viewer tool).
     */
    public static SnapshotContainer read(File file) throws RewardsLedgerException {
        Kryo kryo = createKryo();
        try (Input input = new Input(new FileInputStream(file))) {
            log.info("发现快照文件，正在加载... / Snapshot found, loading: {}", file.getAbsolutePath());
            return kryo.readObject(input, SnapshotContainer.class);
        } catch (IOException | RuntimeException e) {
            throw new RewardsLedgerException(RewardsErrorCode.SNAPSHOT_LOAD_FAILED,
                    "快照文件损坏或版本不兼容 / Snapshot corrupted or incompatible: " + file.getAbsolutePath(), e);
        }
    }

    /**
     * Kryo 非线程安全，每次新建。值对象没有无参构造函数，由 Objenesis 兜底实例化。
     * <br><span style="color: gray;">Kryo is not thread-safe, so a new instance each time. Objenesis instantiates value objects without a no-arg constructor.</span>
     */
    private static Kryo createKryo() {
        Kryo kryo = new Kryo();
        kryo.setRegistrationRequired(false);
        kryo.setReferences(true);
        kryo.setInstantiatorStrategy(new DefaultInstantiatorStrategy(new StdInstantiatorStrategy()));
        // BloomFilter 走它自己的 writeObject/readObject / BloomFilter goes through its own writeObject/readObject
        kryo.register(BloomFilter.class, new JavaSerializer());
        // LRU 容量与访问顺序不在 Map 条目里 / LRU capacity and access order are not part of the map entries
        kryo.register(LruIdempotencyStrategy.LruHashMap.class, new JavaSerializer());
        return kryo;
    }
}
