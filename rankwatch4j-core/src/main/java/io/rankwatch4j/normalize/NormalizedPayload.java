package io.rankwatch4j.normalize;

import java.util.List;

/**
 * Result of normalizing one payload.
 *
 * @param entries      items in source order
 * @param skippedItems items dropped under {@link MalformedItemPolicy#SKIP_ITEM}
 */
public record NormalizedPayload(List<RankedEntry> entries, int skippedItems) {

    public NormalizedPayload {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
