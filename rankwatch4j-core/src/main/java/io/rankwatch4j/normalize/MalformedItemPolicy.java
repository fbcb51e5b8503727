package io.rankwatch4j.normalize;

/**
 * What the normalizer does with a list item that lacks its identity fields.
 */
public enum MalformedItemPolicy {
    /** The first malformed item fails the whole payload. */
    FAIL_BATCH,
    /** Malformed items are logged, counted and dropped; positions of the remaining items are kept. */
    SKIP_ITEM
}
