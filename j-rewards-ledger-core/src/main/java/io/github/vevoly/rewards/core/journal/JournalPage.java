package io.github.vevoly.rewards.core.journal;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 回执日志分页查询结果 / Receipt journal page
 *
 * @author vevoly
 * @since 1.0.0
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class JournalPage<T> {

    /**
     * 当前页的数据 / Current page data
     */
    private List<T> records;
    /**
     * 下一页 (更新) 的游标 / Cursor towards newer receipts
     */
    private String nextCursor;
    /**
     * 上一页 (更旧) 的游标 / Cursor towards older receipts
     */
    private String prevCursor;
    private boolean hasMore;
    private boolean hasPrev;

    public static <T> JournalPage<T> empty() {
        return new JournalPage<>(List.of(), null, null, false, false);
    }
}
