package io.github.vevoly.rewards.core.state;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class StateJournalTest {

    @Test
    void rollbackTo_restoresOverwrittenAndInsertedKeys() {
        StateJournal journal = new StateJournal();
        Map<String, Long> map = new HashMap<>(Map.of("a", 1L));

        int sp = journal.savepoint();
        journal.put(map, "a", 2L);
        journal.put(map, "b", 3L);
        journal.rollbackTo(sp);

        assertThat(map).containsExactly(Map.entry("a", 1L));
    }

    @Test
    void rollbackTo_restoresRemovedKey() {
        StateJournal journal = new StateJournal();
        Map<String, Long> map = new HashMap<>(Map.of("a", 1L));

        int sp = journal.savepoint();
        assertThat(journal.remove(map, "a")).isEqualTo(1L);
        assertThat(journal.remove(map, "missing")).isNull();
        journal.rollbackTo(sp);

        assertThat(map).containsEntry("a", 1L).hasSize(1);
    }

    @Test
    void rollbackTo_innerSavepoint_keepsOuterChanges() {
        StateJournal journal = new StateJournal();
        Map<String, Long> map = new HashMap<>();
        long[] counter = {0};

        int outer = journal.savepoint();
        journal.put(map, "outer", 1L);
        int inner = journal.savepoint();
        journal.put(map, "inner", 2L);
        counter[0] = 5;
        journal.record(() -> counter[0] = 0);
        journal.rollbackTo(inner);

        assertThat(map).containsOnlyKeys("outer");
        assertThat(counter[0]).isZero();
        assertThat(journal.size()).isEqualTo(1);

        journal.rollbackTo(outer);
        assertThat(map).isEmpty();
    }

    @Test
    void release_onlyOutermostClearsTheLog() {
        StateJournal journal = new StateJournal();
        Map<String, Long> map = new HashMap<>();

        int outer = journal.savepoint();
        journal.put(map, "a", 1L);
        int inner = journal.savepoint();
        journal.put(map, "b", 2L);
        journal.release(inner);

        assertThat(journal.size()).isEqualTo(2);

        journal.release(outer);
        assertThat(journal.size()).isZero();
        journal.rollbackTo(0);
        assertThat(map).containsOnlyKeys("a", "b");
    }
}
