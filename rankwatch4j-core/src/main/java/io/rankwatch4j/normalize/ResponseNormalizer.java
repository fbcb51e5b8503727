package io.rankwatch4j.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import io.rankwatch4j.exception.MalformedItemException;
import io.rankwatch4j.exception.TransientCrawlException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Converts raw source payloads into {@link NormalizedBook} / {@link NormalizedStat} records.
 *
 * <p>Holds no mutable state; a single instance is shared by all crawl runs.
 */
public class ResponseNormalizer {
    private static final Logger log = LoggerFactory.getLogger(ResponseNormalizer.class);

    private static final String SUCCESS_CODE = "200";

    private final MalformedItemPolicy malformedItemPolicy;

    public ResponseNormalizer() {
        this(MalformedItemPolicy.FAIL_BATCH);
    }

    public ResponseNormalizer(MalformedItemPolicy malformedItemPolicy) {
        this.malformedItemPolicy = Objects.requireNonNull(malformedItemPolicy, "malformedItemPolicy must not be null");
    }

    public MalformedItemPolicy getMalformedItemPolicy() {
        return malformedItemPolicy;
    }

    /**
     * Rejects upstream error envelopes: a top-level {@code code} other than {@code "200"}.
     * Payloads without a {@code code} field pass.
     *
     * @throws TransientCrawlException carrying the upstream {@code message}
     */
    public void checkEnvelope(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            return;
        }
        JsonNode code = payload.get("code");
        if (code == null || code.isNull()) {
            return;
        }
        if (!SUCCESS_CODE.equals(code.asText())) {
            String message = payload.path("message").asText("unknown error");
            throw new TransientCrawlException("upstream error code=" + code.asText() + " message=" + message);
        }
    }

    /**
     * Parse a payload of the given shape. Positions are 1-based and follow list order.
     *
     * @throws MalformedItemException on an item without id or title under {@link MalformedItemPolicy#FAIL_BATCH},
     *                                and always for a malformed {@link ShapeHint#SINGLE_OBJECT} payload
     */
    public NormalizedPayload parse(JsonNode payload, ShapeHint shape) {
        Objects.requireNonNull(shape, "shape must not be null");
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            return new NormalizedPayload(List.of(), 0);
        }

        if (shape == ShapeHint.SINGLE_OBJECT) {
            JsonNode item = detailObject(payload);
            return new NormalizedPayload(List.of(parseItem(item, 0)), 0);
        }

        List<JsonNode> items = shape == ShapeHint.BLOCKS ? flattenBlocks(payload) : flatList(payload);

        List<RankedEntry> entries = new ArrayList<>(items.size());
        int skipped = 0;
        int position = 0;
        for (JsonNode item : items) {
            position++;
            try {
                entries.add(parseItem(item, position));
            } catch (MalformedItemException e) {
                if (malformedItemPolicy == MalformedItemPolicy.FAIL_BATCH) {
                    throw e;
                }
                skipped++;
                log.warn("Skipping malformed item position={} msg={} fragment={}", position, e.getMessage(), e.getFragment());
            }
        }
        return new NormalizedPayload(entries, skipped);
    }

    /**
     * Parse one item. {@code position} is only used for the entry and error reporting.
     */
    public RankedEntry parseItem(JsonNode item, int position) {
        String bookId = BookField.BOOK_ID.text(item);
        String title = BookField.TITLE.text(item);
        if (bookId == null || title == null) {
            String missing = bookId == null && title == null ? "id and title" : bookId == null ? "id" : "title";
            throw new MalformedItemException(
                    "item is missing " + missing + " at position " + position,
                    position,
                    item == null ? null : item.toString()
            );
        }

        NormalizedBook book = new NormalizedBook(
                bookId,
                title,
                BookField.AUTHOR_ID.text(item),
                BookField.AUTHOR_NAME.text(item),
                BookField.CATEGORY.text(item),
                tags(BookField.TAGS.find(item))
        );

        NormalizedStat stat = new NormalizedStat(
                bookId,
                BookField.CLICKS.count(item, 0L),
                BookField.FAVORITES.count(item, 0L),
                BookField.COMMENTS.count(item, 0L),
                BookField.CHAPTERS.count(item, 0L),
                BookField.WORD_COUNT.count(item, 0L),
                BookField.NUTRITION.count(item, 0L),
                BookField.VIP_CHAPTER.count(item, 0L)
        );

        return new RankedEntry(position, book, stat);
    }

    private static List<JsonNode> flatList(JsonNode payload) {
        JsonNode data = payload.path("data");
        JsonNode list = data.path("list");
        if (list.isArray()) {
            return toList(list);
        }
        if (data.isArray()) {
            return toList(data);
        }
        JsonNode legacy = payload.path("content").path("data");
        if (legacy.isArray()) {
            return toList(legacy);
        }
        return List.of();
    }

    private static List<JsonNode> flattenBlocks(JsonNode payload) {
        JsonNode blocks = payload.path("data").path("blocks");
        if (!blocks.isArray()) {
            return flatList(payload);
        }
        List<JsonNode> items = new ArrayList<>();
        for (JsonNode block : blocks) {
            JsonNode list = block.path("list");
            if (list.isArray()) {
                list.forEach(items::add);
            }
        }
        return items;
    }

    private static JsonNode detailObject(JsonNode payload) {
        JsonNode data = payload.path("data");
        if (data.isObject() && BookField.BOOK_ID.find(data) != null) {
            return data;
        }
        return payload;
    }

    private static List<JsonNode> toList(JsonNode array) {
        List<JsonNode> items = new ArrayList<>(array.size());
        array.forEach(items::add);
        return items;
    }

    private static List<String> tags(JsonNode node) {
        if (node == null) {
            return List.of();
        }
        List<String> tags = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode tag : node) {
                String s = tag.isObject() ? tag.path("tagName").asText("") : tag.asText("");
                if (!s.isBlank()) {
                    tags.add(s.trim());
                }
            }
            return tags;
        }
        for (String part : node.asText("").split("[,，\\s]+")) {
            if (!part.isBlank()) {
                tags.add(part.trim());
            }
        }
        return tags;
    }
}
