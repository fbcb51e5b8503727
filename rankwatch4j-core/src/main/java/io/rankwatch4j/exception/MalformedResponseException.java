package io.rankwatch4j.exception;

/**
 * The response body could not be decoded as JSON.
 */
public class MalformedResponseException extends FatalCrawlException {

    private static final int MAX_FRAGMENT = 200;

    private final String fragment;

    public MalformedResponseException(String message, String body, Throwable cause) {
        super(message, cause);
        this.fragment = truncate(body);
    }

    /**
     * Leading part of the offending body.
     */
    public String getFragment() {
        return fragment;
    }

    static String truncate(String raw) {
        if (raw == null) {
            return null;
        }
        return raw.length() <= MAX_FRAGMENT ? raw : raw.substring(0, MAX_FRAGMENT) + "...";
    }
}
