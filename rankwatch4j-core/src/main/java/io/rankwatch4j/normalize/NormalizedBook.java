package io.rankwatch4j.normalize;

import java.util.List;
import java.util.Objects;

/**
 * Identity part of a crawled book. {@code bookId} and {@code title} are never blank.
 */
public record NormalizedBook(
        String bookId,
        String title,
        String authorId,
        String authorName,
        String category,
        List<String> tags
) {
    public NormalizedBook {
        Objects.requireNonNull(bookId, "bookId must not be null");
        Objects.requireNonNull(title, "title must not be null");
        if (bookId.isBlank() || title.isBlank()) {
            throw new IllegalArgumentException("bookId and title must not be blank");
        }
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
