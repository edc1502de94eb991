package io.github.vevoly.rewards.core.tools;

/**
 * <h3>快照文件查看器 (Snapshot Viewer)</h3>
 *
 * <p>命令行工具，把 Kryo 快照文件 (.dat) dump 为 JSON。</p>
 *
 * <h3>用法 (Usage):</h3>
 * <pre>
 * java -cp ... io.github.vevoly.rewards.core.tools.SnapshotViewer /data/JRewardsLedgerEngine/snapshot/snapshot.dat
 * </pre>
 *
 * @author vevoly
 * @since 1.0.0
 */
public class SnapshotViewer {

    public static void main(String[] args) {
        System.out.println("====== j-rewards-ledger Snapshot Viewer ======");
        if (args.length == 0) {
            System.err.println("错误：请输入快照文件路径 / Error: Please enter the snapshot file path");
            System.err.println("用法 (Usage): java ... SnapshotViewer <file_path>");
            return;
        }
        try {
            System.out.println(RewardsLedgerAdminUtils.dumpSnapshot(args[0]));
        } catch (Exception e) {
            System.err.println("读取快照失败 / Load failed: " + e.getMessage());
            e.printStackTrace();
        }
    }
}
