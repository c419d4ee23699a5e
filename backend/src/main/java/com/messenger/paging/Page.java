package com.messenger.paging;

import java.util.List;
import java.util.function.Function;

/**
 * One page of a most-recent-first scan. {@code nextCursor} is null once the scan is exhausted.
 */
public record Page<T>(List<T> items, String nextCursor) {

    public Page {
        items = List.copyOf(items);
    }

    public boolean hasMore() {
        return nextCursor != null;
    }

    /**
     * Cuts an over-fetched result ({@code limit + 1} rows) down to {@code limit} and,
     * when a surplus row proved that more exist, derives the cursor from the last kept item.
     */
    public static <T> Page<T> fromOverfetch(List<T> rows, int limit, Function<T, String> cursorOf) {
        if (rows.size() <= limit) {
            return new Page<>(rows, null);
        }
        List<T> kept = rows.subList(0, limit);
        return new Page<>(kept, cursorOf.apply(kept.get(limit - 1)));
    }
}
