package io.rankwatch4j.crawl;

import io.rankwatch4j.normalize.ShapeHint;

/**
 * One upstream endpoint this system knows how to crawl.
 */
public interface CrawlSource {

    /**
     * Source id, also used as the ranking snapshot key.
     */
    String id();

    SourceKind kind();

    /**
     * @throws io.rankwatch4j.exception.ConfigurationException when a template placeholder has no value
     */
    String buildUrl();

    ShapeHint expectedShape();

    /**
     * Whether a successful list crawl is followed by a detail crawl of each listed book.
     */
    default boolean followDetails() {
        return false;
    }
}
