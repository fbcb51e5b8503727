package io.rankwatch4j.normalize;

/**
 * Layout of a source's payload.
 */
public enum ShapeHint {
    /** {@code data.list}: one ranked list. */
    FLAT_LIST,
    /** {@code data.blocks[].list}, or a flat {@code data.list}: flattened in block order. */
    BLOCKS,
    /** One book detail object. */
    SINGLE_OBJECT
}
