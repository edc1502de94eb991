package io.github.vevoly.rewards.core.tools;

import io.github.vevoly.rewards.core.journal.JournalPage;

/**
 * <h3>回执日志查看器 (Journal Viewer)</h3>
 *
 * <p>命令行工具，把 Chronicle Queue 二进制回执日志按页 dump 为 JSON。</p>
 *
 * <h3>用法 (Usage):</h3>
 * <pre>
 * java -cp "j-rewards-ledger-core.jar:..." io.github.vevoly.rewards.core.tools.JournalViewer /data/JRewardsLedgerEngine/journal [pageSize]
 * </pre>
 *
 * @author vevoly
 * @since 1.0.0
 */
public class JournalViewer {

    public static void main(String[] args) {
        System.out.println("====== j-rewards-ledger Journal Viewer ======");
        if (args.length == 0) {
            System.err.println("错误：请输入日志目录路径 / Error: Please input the journal directory path");
            System.err.println("用法 (Usage): java ... JournalViewer <path> [pageSize]");
            return;
        }
        int pageSize = args.length > 1 ? Integer.parseInt(args[1]) : 100;
        String cursor = null;
        long count = 0;
        try {
            do {
                JournalPage<String> page = RewardsLedgerAdminUtils.dumpJournalPage(args[0], cursor, pageSize, false, null, null);
                page.getRecords().forEach(System.out::println);
                count += page.getRecords().size();
                cursor = page.isHasMore() ? page.getNextCursor() : null;
            } while (cursor != null);
            System.out.println("========================================");
            System.out.println("读取完成，共 " + count + " 条回执。/ Done, " + count + " receipt(s).");
        } catch (Exception e) {
            System.err.println("读取日志失败 / Load journal failed: " + e.getMessage());
            e.printStackTrace();
        }
    }
}
