package io.github.vevoly.rewards.core;

import io.github.vevoly.rewards.api.command.CommandType;
import io.github.vevoly.rewards.api.command.RewardsCommand;
import io.github.vevoly.rewards.api.exception.DuplicateCommandException;
import io.github.vevoly.rewards.api.exception.InitializationException;
import io.github.vevoly.rewards.api.exception.RewardsErrorCode;
import io.github.vevoly.rewards.api.exception.RewardsLedgerException;
import io.github.vevoly.rewards.api.exception.UnauthorizedException;
import io.github.vevoly.rewards.api.model.Address;
import io.github.vevoly.rewards.api.model.ClaimResult;
import io.github.vevoly.rewards.api.model.RewardReceipt;
import io.github.vevoly.rewards.core.idempotency.LruIdempotencyStrategy;
import io.github.vevoly.rewards.core.support.InMemoryBalanceLedger;
import io.github.vevoly.rewards.core.support.MutableClock;
import io.github.vevoly.rewards.core.support.RecordingTransfer;
import io.github.vevoly.rewards.core.support.StubHarvestSource;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static io.github.vevoly.rewards.core.support.TestAddresses.ADMIN;
import static io.github.vevoly.rewards.core.support.TestAddresses.ALICE;
import static io.github.vevoly.rewards.core.support.TestAddresses.HARVESTER;
import static io.github.vevoly.rewards.core.support.TestAddresses.PRODUCER;
import static io.github.vevoly.rewards.core.support.TestAddresses.REWARD_A;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RewardsLedgerEngineTest {

    @TempDir
    Path baseDir;

    MutableClock clock = new MutableClock(1_000);
    InMemoryBalanceLedger ledger = new InMemoryBalanceLedger();
    RecordingTransfer transfer = new RecordingTransfer();
    SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    List<RewardReceipt> persisted = new CopyOnWriteArrayList<>();
    RewardsLedgerEngine engine;

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.shutdown();
        }
    }

    private RewardsLedgerEngine.Builder builder() {
        return RewardsLedgerEngine.builder()
                .baseDir(baseDir.toString())
                .name("test-engine")
                .ringBufferSize(64)
                .snapshotInterval(10_000)
                .enableTimeSnapshot(false)
                .administrator(ADMIN)
                .harvester(HARVESTER)
                .balanceLedger(ledger)
                .harvestSource(new StubHarvestSource())
                .rewardTransfer(transfer)
                .contractInspector(address -> false)
                .idempotency(new LruIdempotencyStrategy(1_000))
                .meterRegistry(meterRegistry)
                .clock(clock);
    }

    private RewardsLedgerEngine started(RewardsLedgerEngine.Builder builder) throws InitializationException {
        RewardsLedgerEngine e = builder.build();
        e.start();
        return e;
    }

    private static <T> T await(CompletableFuture<T> future) throws Exception {
        return future.get(5, TimeUnit.SECONDS);
    }

    private void seedAliceWithDeposit() throws Exception {
        await(engine.submit(RewardsCommand.addRewardToken(ADMIN, PRODUCER, REWARD_A).withTxId("add-1")));
        ledger.setSilently(PRODUCER, ALICE, 100, 100);
        await(engine.submit(RewardsCommand.globalAccrue(PRODUCER)));
        await(engine.submit(RewardsCommand.userAccrue(PRODUCER, ALICE)));
        await(engine.submit(RewardsCommand.rewardAccrue(HARVESTER, PRODUCER, REWARD_A, 500).withTxId("deposit-1")));
    }

    @Test
    void submit_completesFuturesWithOperationResults() throws Exception {
        engine = started(builder());
        seedAliceWithDeposit();
        clock.advance(50);

        ClaimResult result = await(engine.submit(RewardsCommand.claim(PRODUCER, ALICE).withTxId("claim-1"), ClaimResult.class));

        assertThat(result.paidIn(REWARD_A)).isEqualTo(500);
        assertThat(transfer.totalTo(ALICE, REWARD_A)).isEqualTo(500);
        assertThat(engine.getCommandCount()).isEqualTo(5);
        assertThat(meterRegistry.get("j-rewards-ledger.commands")
                .tags("type", CommandType.CLAIM.name(), "outcome", "ok").counter().count()).isEqualTo(1.0);
    }

    @Test
    void submit_duplicateTxId_isRejectedWithoutReprocessing() throws Exception {
        engine = started(builder());
        seedAliceWithDeposit();

        CompletableFuture<Object> again = engine.submit(
                RewardsCommand.rewardAccrue(HARVESTER, PRODUCER, REWARD_A, 500).withTxId("deposit-1"));

        assertThatThrownBy(() -> await(again))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(DuplicateCommandException.class);
        long balance = await(engine.query(d -> d.getSiloBalance(PRODUCER, REWARD_A)));
        assertThat(balance).isEqualTo(500);
    }

    @Test
    void submit_rejectedCommand_failsFutureAndKeepsTxIdReusable() throws Exception {
        engine = started(builder());

        CompletableFuture<Object> rejected = engine.submit(
                RewardsCommand.addRewardToken(ALICE, PRODUCER, REWARD_A).withTxId("tx-x"));

        assertThatThrownBy(() -> await(rejected)).hasCauseInstanceOf(UnauthorizedException.class);
        assertThat(engine.getCommandCount()).isZero();
        assertThat(meterRegistry.get("j-rewards-ledger.failures").tag("code", "UNAUTHORIZED").counter().count())
                .isEqualTo(1.0);

        await(engine.submit(RewardsCommand.addRewardToken(ADMIN, PRODUCER, REWARD_A).withTxId("tx-x")));
        assertThat(await(engine.<List<Address>>query(d -> d.getRewardTokens(PRODUCER)))).containsExactly(REWARD_A);
    }

    @Test
    void submit_beforeStart_failsWithEngineNotRunning() throws Exception {
        engine = builder().build();

        CompletableFuture<Object> future = engine.submit(RewardsCommand.harvest());

        assertThatThrownBy(() -> await(future))
                .hasCauseInstanceOf(RewardsLedgerException.class)
                .satisfies(e -> assertThat(((RewardsLedgerException) e.getCause()).getErrorCode())
                        .isEqualTo(RewardsErrorCode.ENGINE_NOT_RUNNING));
        assertThat(engine.query(RewardsDistributor::getAdministrator)).isCompletedExceptionally();
    }

    @Test
    void query_seesPendingPointsAtEngineTime() throws Exception {
        engine = started(builder());
        seedAliceWithDeposit();
        clock.advance(10);

        long points = await(engine.query(d -> d.pendingPoints(PRODUCER, ALICE)));
        long reward = await(engine.query(d -> d.pendingReward(PRODUCER, ALICE, REWARD_A)));

        assertThat(points).isEqualTo(1_000);
        assertThat(reward).isEqualTo(500);
    }

    @Test
    void restart_restoresStateAndDedupWindowFromSnapshot() throws Exception {
        engine = started(builder());
        seedAliceWithDeposit();
        engine.shutdown();

        engine = started(builder());

        assertThat(engine.getCommandCount()).isEqualTo(4);
        assertThat(await(engine.<Long>query(d -> d.getSiloBalance(PRODUCER, REWARD_A)))).isEqualTo(500L);
        assertThat(await(engine.<Long>query(d -> d.getUserState(PRODUCER, ALICE).getLastAmount()))).isEqualTo(100L);
        assertThatThrownBy(() -> await(engine.submit(RewardsCommand.addRewardToken(ADMIN, PRODUCER, REWARD_A).withTxId("add-1"))))
                .hasCauseInstanceOf(DuplicateCommandException.class);
        assertThat(engine.getIdempotencyName()).isEqualTo("LRU");
    }

    @Test
    void start_withCorruptSnapshot_refusesToStart() throws Exception {
        engine = builder().build();
        File snapshot = new File(engine.getSnapshotFile());
        Files.createDirectories(snapshot.getParentFile().toPath());
        Files.write(snapshot.toPath(), "garbage".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(engine::start).isInstanceOf(InitializationException.class);
        assertThat(engine.isRunning()).isFalse();
    }

    @Test
    void batchWriter_receivesEveryCommittedReceipt() throws Exception {
        engine = started(builder().batchSize(2).queueSize(16).batchWriter(persisted::addAll));
        seedAliceWithDeposit();
        engine.shutdown();

        assertThat(persisted).hasSize(4);
        assertThat(persisted).extracting(RewardReceipt::getType).containsExactly(
                CommandType.ADD_REWARD_TOKEN, CommandType.GLOBAL_ACCRUE, CommandType.USER_ACCRUE, CommandType.REWARD_ACCRUE);
        assertThat(persisted.get(3).getTimestamp()).isEqualTo(1_000);
    }

    @Test
    void build_validatesConfiguration() {
        assertThatThrownBy(() -> builder().ringBufferSize(100).build()).isInstanceOf(InitializationException.class);
        assertThatThrownBy(() -> builder().administrator(null).build()).isInstanceOf(InitializationException.class);
        assertThatThrownBy(() -> builder().rewardTransfer(null).build()).isInstanceOf(InitializationException.class);
    }
}
