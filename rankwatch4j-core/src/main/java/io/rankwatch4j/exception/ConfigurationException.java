package io.rankwatch4j.exception;

/**
 * Unknown source id, missing URL template or unresolved template placeholder.
 *
 * <p>Raised at job-creation time, before any network call.
 */
public class ConfigurationException extends CrawlException {

    public ConfigurationException(String message) {
        super(message);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
