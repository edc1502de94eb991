package io.github.vevoly.rewards.core.state;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;

/**
 * <h3>状态撤销日志 (State Undo Journal)</h3>
 *
 * <p>
 * 每次状态修改都会压入一条撤销动作。操作开始时取一个保存点 ({@link #savepoint()})，
 * 失败时 {@link #rollbackTo(int)} 按逆序撤销到保存点，成功时 {@link #release(int)}。
 * 嵌套 (重入) 调用各自持有保存点，最外层提交时才清空日志。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>State Undo Journal.</b><br>
 * Every state mutation pushes an undo action. An operation takes a savepoint when it starts, rolls back to it
 * in reverse order on failure and releases it on success. Nested (reentrant) operations hold their own savepoints;
 * the log is cleared only when the outermost operation commits.
 * </span>
 *
 * <p>Not thread-safe; owned by the single thread that drives the state.</p>
 *
 * @author vevoly
 * @since 1.0.0
 */
public final class StateJournal {

    private final Deque<Runnable> undoLog = new ArrayDeque<>();

    public int savepoint() {
        return undoLog.size();
    }

    public <K, V> V put(Map<K, V> map, K key, V value) {
        boolean existed = map.containsKey(key);
        V previous = map.put(key, value);
        undoLog.push(() -> {
            if (existed) {
                map.put(key, previous);
            } else {
                map.remove(key);
            }
        });
        return previous;
    }

    public <K, V> V remove(Map<K, V> map, K key) {
        if (!map.containsKey(key)) {
            return null;
        }
        V previous = map.remove(key);
        undoLog.push(() -> map.put(key, previous));
        return previous;
    }

    /**
     * 记录一条自定义撤销动作 (Record a custom undo action).
     */
    public void record(Runnable undoAction) {
        undoLog.push(undoAction);
    }

    public void rollbackTo(int savepoint) {
        while (undoLog.size() > savepoint) {
            undoLog.pop().run();
        }
    }

    public void release(int savepoint) {
        if (savepoint == 0) {
            undoLog.clear();
        }
    }

    public int size() {
        return undoLog.size();
    }
}
