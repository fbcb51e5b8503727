package io.rankwatch4j.crawl;

import io.rankwatch4j.exception.ConfigurationException;
import io.rankwatch4j.normalize.ShapeHint;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Source whose URL is a template with {@code {name}} placeholders.
 *
 * <p>Placeholder values are form-encoded. The URL is rendered and checked on construction, so a
 * template that cannot produce a valid URI is a {@link ConfigurationException}.
 */
abstract class TemplatedSource implements CrawlSource {
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z0-9_]+)}");

    private final String id;
    private final Map<String, String> params;
    private final String url;

    TemplatedSource(String id, String template, Map<String, String> params) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(template, "template must not be null");
        this.params = params == null ? Map.of() : Map.copyOf(params);
        this.url = render(id, template, this.params);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public ShapeHint expectedShape() {
        return kind().shape();
    }

    @Override
    public String buildUrl() {
        return url;
    }

    Map<String, String> params() {
        return params;
    }

    static String render(String sourceId, String template, Map<String, String> params) {
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String value = params.get(m.group(1));
            if (value == null) {
                throw new ConfigurationException(
                        "missing value for placeholder {" + m.group(1) + "} in template of source " + sourceId);
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(URLEncoder.encode(value, StandardCharsets.UTF_8)));
        }
        m.appendTail(sb);
        String url = sb.toString();
        try {
            URI uri = new URI(url);
            if (!uri.isAbsolute() || uri.getHost() == null) {
                throw new ConfigurationException("URL of source " + sourceId + " has no scheme or host: " + url);
            }
        } catch (URISyntaxException e) {
            throw new ConfigurationException("invalid URL for source " + sourceId + ": " + e.getMessage());
        }
        return url;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + id + "]";
    }
}
