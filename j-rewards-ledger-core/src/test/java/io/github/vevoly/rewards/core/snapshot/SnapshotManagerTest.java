package io.github.vevoly.rewards.core.snapshot;

import io.github.vevoly.rewards.api.exception.RewardsErrorCode;
import io.github.vevoly.rewards.api.exception.RewardsLedgerException;
import io.github.vevoly.rewards.api.model.AccrualState;
import io.github.vevoly.rewards.core.idempotency.BloomFilterIdempotencyStrategy;
import io.github.vevoly.rewards.core.idempotency.LruIdempotencyStrategy;
import io.github.vevoly.rewards.core.state.PositionKey;
import io.github.vevoly.rewards.core.state.RewardPairKey;
import io.github.vevoly.rewards.core.state.RewardsState;
import io.github.vevoly.rewards.core.state.RouteKey;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static io.github.vevoly.rewards.core.support.TestAddresses.ADMIN;
import static io.github.vevoly.rewards.core.support.TestAddresses.ALICE;
import static io.github.vevoly.rewards.core.support.TestAddresses.CAROL;
import static io.github.vevoly.rewards.core.support.TestAddresses.HARVESTER;
import static io.github.vevoly.rewards.core.support.TestAddresses.PRODUCER;
import static io.github.vevoly.rewards.core.support.TestAddresses.REWARD_A;
import static io.github.vevoly.rewards.core.support.TestAddresses.REWARD_B;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SnapshotManagerTest {

    @TempDir
    Path tempDir;

    @Test
    void load_returnsNull_whenNoSnapshotExists() throws Exception {
        assertThat(new SnapshotManager(tempDir.toString()).load()).isNull();
    }

    @Test
    void saveThenLoad_restoresStateAndDedupWindow() throws Exception {
        RewardsState state = new RewardsState(ADMIN, HARVESTER);
        state.getGlobalStates().put(PRODUCER, AccrualState.of(10, 400, 4_000));
        state.getUserStates().put(new PositionKey(PRODUCER, ALICE), AccrualState.of(10, 100, 1_000));
        state.getUserStates().put(new PositionKey(PRODUCER, CAROL), AccrualState.uninitialized());
        state.getRewardTokens().put(PRODUCER, new ArrayList<>(List.of(REWARD_A, REWARD_B)));
        state.getSilos().put(new RewardPairKey(PRODUCER, REWARD_A), 777L);
        state.getPersonalRecipients().put(new RouteKey(ALICE, PRODUCER, REWARD_A), CAROL);
        LruIdempotencyStrategy idempotency = new LruIdempotencyStrategy(16);
        idempotency.add("tx-1");

        SnapshotManager manager = new SnapshotManager(tempDir.toString());
        manager.save(new SnapshotContainer(42, 7, 1_000L, state, idempotency), "[test]");
        SnapshotContainer loaded = manager.load();

        assertThat(loaded.getCommandCount()).isEqualTo(42);
        assertThat(loaded.getLastJournalIndex()).isEqualTo(7);
        RewardsState restored = loaded.getState();
        assertThat(restored.getAdministrator()).isEqualTo(ADMIN);
        assertThat(restored.getHarvester()).isEqualTo(HARVESTER);
        assertThat(restored.getGlobalStates()).containsEntry(PRODUCER, AccrualState.of(10, 400, 4_000));
        assertThat(restored.getUserStates().get(new PositionKey(PRODUCER, ALICE)).getPoints()).isEqualTo(1_000);
        assertThat(restored.getUserStates().get(new PositionKey(PRODUCER, CAROL)).isInitialized()).isFalse();
        assertThat(restored.getRewardTokens().get(PRODUCER)).containsExactly(REWARD_A, REWARD_B);
        assertThat(restored.getSilos()).containsEntry(new RewardPairKey(PRODUCER, REWARD_A), 777L);
        assertThat(restored.getPersonalRecipients()).containsEntry(new RouteKey(ALICE, PRODUCER, REWARD_A), CAROL);
        assertThat(loaded.getIdempotencyStrategy().contains("tx-1")).isTrue();
        assertThat(loaded.getIdempotencyStrategy().contains("tx-2")).isFalse();
    }

    @Test
    void save_overwritesPreviousSnapshot_withBloomFilter() throws Exception {
        SnapshotManager manager = new SnapshotManager(tempDir.toString());
        BloomFilterIdempotencyStrategy bloom = new BloomFilterIdempotencyStrategy(1_000, 0.001);
        bloom.add("tx-9");

        manager.save(new SnapshotContainer(1, -1, 1L, new RewardsState(ADMIN, null), bloom), "[test]");
        manager.save(new SnapshotContainer(2, -1, 2L, new RewardsState(ADMIN, HARVESTER), bloom), "[test]");
        SnapshotContainer loaded = manager.load();

        assertThat(loaded.getCommandCount()).isEqualTo(2);
        assertThat(loaded.getState().getHarvester()).isEqualTo(HARVESTER);
        assertThat(loaded.getIdempotencyStrategy().contains("tx-9")).isTrue();
    }

    @Test
    void load_corruptFile_failsWithSnapshotLoadError() throws Exception {
        SnapshotManager manager = new SnapshotManager(tempDir.toString());
        File file = tempDir.resolve("snapshot").resolve(SnapshotManager.SNAPSHOT_FILE_NAME).toFile();
        Files.write(file.toPath(), "not a snapshot".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(manager::load)
                .isInstanceOfSatisfying(RewardsLedgerException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(RewardsErrorCode.SNAPSHOT_LOAD_FAILED));
    }
}
