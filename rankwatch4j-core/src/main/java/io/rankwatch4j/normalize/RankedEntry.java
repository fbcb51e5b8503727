package io.rankwatch4j.normalize;

/**
 * One parsed item: its 1-based position in the source list, and its book and stat records.
 */
public record RankedEntry(int position, NormalizedBook book, NormalizedStat stat) {
}
