package io.rankwatch4j.normalize;

import java.util.Objects;

/**
 * Counters of one book at crawl time. Detail-only counters are zero on list payloads.
 */
public record NormalizedStat(
        String bookId,
        long clicks,
        long favorites,
        long comments,
        long chapters,
        long wordCount,
        long nutrition,
        long vipChapterId
) {
    public NormalizedStat {
        Objects.requireNonNull(bookId, "bookId must not be null");
    }
}
