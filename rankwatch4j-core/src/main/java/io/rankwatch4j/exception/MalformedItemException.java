package io.rankwatch4j.exception;

/**
 * A single list item lacks the identity fields every book needs (id and title).
 */
public class MalformedItemException extends FatalCrawlException {

    private final String fragment;
    private final int position;

    public MalformedItemException(String message, int position, String fragment) {
        super(message);
        this.position = position;
        this.fragment = MalformedResponseException.truncate(fragment);
    }

    public String getFragment() {
        return fragment;
    }

    /**
     * 1-based position of the item in the flattened list, or 0 for a single-object payload.
     */
    public int getPosition() {
        return position;
    }
}
