package io.github.vevoly.rewards.core.tools;

import com.google.gson.ExclusionStrategy;
import com.google.gson.FieldAttributes;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializer;
import io.github.vevoly.rewards.api.IdempotencyStrategy;
import io.github.vevoly.rewards.api.constants.JRewardsLedgerConstant;
import io.github.vevoly.rewards.api.exception.RewardsLedgerException;
import io.github.vevoly.rewards.api.model.Address;
import io.github.vevoly.rewards.api.model.RewardReceipt;
import io.github.vevoly.rewards.core.journal.JournalPage;
import io.github.vevoly.rewards.core.snapshot.SnapshotContainer;
import io.github.vevoly.rewards.core.snapshot.SnapshotManager;
import lombok.extern.slf4j.Slf4j;
import net.openhft.chronicle.queue.ChronicleQueue;
import net.openhft.chronicle.queue.ExcerptTailer;
import net.openhft.chronicle.queue.TailerDirection;
import net.openhft.chronicle.queue.impl.single.SingleChronicleQueueBuilder;
import net.openhft.chronicle.wire.DocumentContext;

import java.io.File;
import java.io.FileNotFoundException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * <h3>运维工具类 (Ledger Admin Utilities)</h3>
 *
 * <p>
 * 读取回执日志与快照文件并转成 JSON，供 Actuator 端点和命令行工具使用。只读，不影响运行中的引擎。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Ledger Admin Utilities.</b><br>
 * Reads the receipt journal and snapshot files into JSON for the actuator endpoint and the command-line tools.
 * Read-only; a running engine is not affected.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Slf4j
public final class RewardsLedgerAdminUtils {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .registerTypeAdapter(Address.class, (JsonSerializer<Address>) (src, type, ctx) -> new JsonPrimitive(src.getValue()))
            .setExclusionStrategies(new ExclusionStrategy() {
                @Override
                public boolean shouldSkipField(FieldAttributes f) {
                    // 去重策略可能很大，单独输出名称 / The idempotency state can be huge; only its name is printed
                    return IdempotencyStrategy.class.isAssignableFrom(f.getDeclaredClass());
                }

                @Override
                public boolean shouldSkipClass(Class<?> clazz) {
                    return false;
                }
            })
            .create();

    private RewardsLedgerAdminUtils() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static Gson gson() {
        return GSON;
    }

    /**
     * 分页 Dump 回执日志 (Paginated receipt dump).
     *
     * <p>
     * 采用<b>游标分页</b>：游标是 Chronicle 索引的十六进制字符串。默认从末尾向前读 (最新在前)。
     * </p>
     *
     * <hr>
     * <span style="color: gray; font-size: 0.9em;">
     * Cursor pagination over Chronicle indexes (hex strings). Reads backward from the end by default, newest first.
     * </span>
     *
     * @param journalDir 日志目录 (Journal directory)
     * @param cursor     起始游标，null 表示从头或尾开始 (Start cursor; null starts at the head or tail)
     * @param pageSize   每页条数 (Page size)
     * @param backward   是否向旧翻页 (Page towards older receipts)
     * @param txId       按 txId 过滤，可空 (Optional txId filter)
     * @param account    按账户过滤，可空 (Optional account filter)
     * @throws FileNotFoundException 目录不存在 (Directory missing)
     */
    public static JournalPage<String> dumpJournalPage(String journalDir, String cursor, int pageSize, boolean backward,
                                                      String txId, String account) throws FileNotFoundException {
        File dir = new File(journalDir);
        if (!dir.exists() || !dir.isDirectory()) {
            throw new FileNotFoundException("Journal directory not found: " + journalDir);
        }
        Address accountFilter = account == null ? null : Address.of(account);
        List<String> records = new ArrayList<>();

        try (ChronicleQueue queue = SingleChronicleQueueBuilder.binary(dir).readOnly(true).build()) {
            ExcerptTailer tailer = queue.createTailer();
            tailer.direction(backward ? TailerDirection.BACKWARD : TailerDirection.FORWARD);

            // 1. 定位 / Position
            if (cursor != null) {
                if (!tailer.moveToIndex(Long.decode(cursor))) {
                    return JournalPage.empty();
                }
            } else if (backward) {
                tailer.toEnd();
            } else {
                tailer.toStart();
            }
            long startIndex = tailer.index();

            // 2. 读取 / Read
            while (records.size() < pageSize) {
                try (DocumentContext dc = tailer.readingDocument()) {
                    if (!dc.isPresent()) {
                        break;
                    }
                    RewardReceipt receipt = dc.wire().read(JRewardsLedgerConstant.JOURNAL_KEY_FIELD_NAME).object(RewardReceipt.class);
                    if (receipt != null && matches(receipt, txId, accountFilter)) {
                        records.add(GSON.toJson(receipt));
                    }
                }
            }

            // 3. 计算游标 / Cursors
            long lastReadIndex = tailer.index();
            boolean more = records.size() == pageSize && hasNext(tailer);
            String lastCursor = more ? "0x" + Long.toHexString(lastReadIndex) : null;
            String startCursor = cursor != null ? "0x" + Long.toHexString(startIndex) : null;
            if (backward) {
                Collections.reverse(records);
                return new JournalPage<>(records, startCursor, lastCursor, startCursor != null, lastCursor != null);
            }
            return new JournalPage<>(records, lastCursor, startCursor, lastCursor != null, startCursor != null);
        }
    }

    /**
     * 全量加载快照并转为 JSON (Load a snapshot file and render it as JSON).
     */
    public static String dumpSnapshot(String snapshotFile) throws FileNotFoundException, RewardsLedgerException {
        File file = new File(snapshotFile);
        if (!file.isFile()) {
            throw new FileNotFoundException("Snapshot file not found: " + snapshotFile);
        }
        SnapshotContainer container = SnapshotManager.read(file);
        JsonObject json = GSON.toJsonTree(container).getAsJsonObject();
        if (container.getIdempotencyStrategy() != null) {
            json.addProperty("idempotency", container.getIdempotencyStrategy().getName());
        }
        return GSON.toJson(json);
    }

    private static boolean matches(RewardReceipt receipt, String txId, Address account) {
        if (txId != null && !txId.equals(receipt.getTxId())) {
            return false;
        }
        return account == null || account.equals(receipt.getAccount()) || account.equals(receipt.getCaller());
    }

    private static boolean hasNext(ExcerptTailer tailer) {
        try (DocumentContext dc = tailer.readingDocument()) {
            if (dc.isPresent()) {
                dc.rollbackOnClose();
                return true;
            }
            return false;
        }
    }
}
