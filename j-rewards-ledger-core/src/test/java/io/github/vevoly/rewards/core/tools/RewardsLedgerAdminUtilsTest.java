package io.github.vevoly.rewards.core.tools;

import io.github.vevoly.rewards.api.command.RewardsCommand;
import io.github.vevoly.rewards.core.RewardsLedgerEngine;
import io.github.vevoly.rewards.core.journal.JournalPage;
import io.github.vevoly.rewards.core.support.InMemoryBalanceLedger;
import io.github.vevoly.rewards.core.support.MutableClock;
import io.github.vevoly.rewards.core.support.RecordingTransfer;
import io.github.vevoly.rewards.core.support.StubHarvestSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.FileNotFoundException;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

import static io.github.vevoly.rewards.core.support.TestAddresses.ADMIN;
import static io.github.vevoly.rewards.core.support.TestAddresses.HARVESTER;
import static io.github.vevoly.rewards.core.support.TestAddresses.PRODUCER;
import static io.github.vevoly.rewards.core.support.TestAddresses.REWARD_A;
import static io.github.vevoly.rewards.core.support.TestAddresses.REWARD_B;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RewardsLedgerAdminUtilsTest {

    @TempDir
    Path baseDir;

    String journalDir;
    String snapshotFile;

    @BeforeEach
    void runEngine() throws Exception {
        RewardsLedgerEngine engine = RewardsLedgerEngine.builder()
                .baseDir(baseDir.toString())
                .name("admin-utils")
                .ringBufferSize(64)
                .enableTimeSnapshot(false)
                .administrator(ADMIN)
                .harvester(HARVESTER)
                .balanceLedger(new InMemoryBalanceLedger())
                .harvestSource(new StubHarvestSource())
                .rewardTransfer(new RecordingTransfer())
                .contractInspector(address -> false)
                .clock(new MutableClock(100))
                .build();
        engine.start();
        engine.submit(RewardsCommand.addRewardToken(ADMIN, PRODUCER, REWARD_A).withTxId("t1")).get(5, TimeUnit.SECONDS);
        engine.submit(RewardsCommand.addRewardToken(ADMIN, PRODUCER, REWARD_B).withTxId("t2")).get(5, TimeUnit.SECONDS);
        engine.submit(RewardsCommand.rewardAccrue(HARVESTER, PRODUCER, REWARD_A, 9).withTxId("t3")).get(5, TimeUnit.SECONDS);
        journalDir = engine.getJournalDir();
        snapshotFile = engine.getSnapshotFile();
        engine.shutdown();
    }

    @Test
    void dumpJournalPage_forward_pagesWithCursor() throws Exception {
        JournalPage<String> first = RewardsLedgerAdminUtils.dumpJournalPage(journalDir, null, 2, false, null, null);

        assertThat(first.getRecords()).hasSize(2);
        assertThat(first.getRecords().get(0)).contains("\"txId\": \"t1\"");
        assertThat(first.isHasMore()).isTrue();

        JournalPage<String> second = RewardsLedgerAdminUtils.dumpJournalPage(journalDir, first.getNextCursor(), 2, false, null, null);
        assertThat(second.getRecords()).hasSize(1);
        assertThat(second.getRecords().get(0)).contains("\"txId\": \"t3\"");
        assertThat(second.isHasMore()).isFalse();
    }

    @Test
    void dumpJournalPage_filtersByTxIdAndAccount() throws Exception {
        JournalPage<String> byTx = RewardsLedgerAdminUtils.dumpJournalPage(journalDir, null, 10, false, "t3", null);
        JournalPage<String> byAccount = RewardsLedgerAdminUtils.dumpJournalPage(journalDir, null, 10, false, null, HARVESTER.getValue());

        assertThat(byTx.getRecords()).singleElement().asString().contains(PRODUCER.getValue());
        assertThat(byAccount.getRecords()).hasSize(1);
    }

    @Test
    void dumpJournalPage_backward_returnsNewestInChronologicalOrder() throws Exception {
        JournalPage<String> page = RewardsLedgerAdminUtils.dumpJournalPage(journalDir, null, 2, true, null, null);

        assertThat(page.getRecords()).hasSize(2);
        assertThat(page.getRecords().get(1)).contains("\"txId\": \"t3\"");
    }

    @Test
    void dumpJournalPage_missingDirectory_throws() {
        assertThatThrownBy(() -> RewardsLedgerAdminUtils.dumpJournalPage(baseDir.resolve("nope").toString(), null, 5, false, null, null))
                .isInstanceOf(FileNotFoundException.class);
    }

    @Test
    void dumpSnapshot_rendersStateAsJson() throws Exception {
        String json = RewardsLedgerAdminUtils.dumpSnapshot(snapshotFile);

        assertThat(json).contains("\"commandCount\": 3", ADMIN.getValue(), "\"idempotency\": \"BLOOM\"");
    }
}
