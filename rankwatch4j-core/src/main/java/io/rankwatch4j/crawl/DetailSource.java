package io.rankwatch4j.crawl;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Detail page of one book.
 */
public class DetailSource extends TemplatedSource {
    public static final String ID_PREFIX = "detail:";
    public static final String BOOK_ID_PARAM = "novel_id";

    private final String bookId;

    public DetailSource(String bookId, String template, Map<String, String> baseParams) {
        super(ID_PREFIX + bookId, template, withBookId(bookId, baseParams));
        this.bookId = bookId;
    }

    public String bookId() {
        return bookId;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.DETAIL;
    }

    private static Map<String, String> withBookId(String bookId, Map<String, String> baseParams) {
        Objects.requireNonNull(bookId, "bookId must not be null");
        if (bookId.isBlank()) {
            throw new IllegalArgumentException("bookId must not be blank");
        }
        Map<String, String> params = new HashMap<>();
        if (baseParams != null) {
            params.putAll(baseParams);
        }
        params.put(BOOK_ID_PARAM, bookId);
        return params;
    }
}
