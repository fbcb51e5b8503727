package io.rankwatch4j.crawl;

import java.util.Map;

/**
 * The hourly hot list ("jiazi"); a single flat {@code data.list}.
 */
public class HotListSource extends TemplatedSource {

    private final boolean followDetails;

    public HotListSource(String id, String template, Map<String, String> params, boolean followDetails) {
        super(id, template, params);
        this.followDetails = followDetails;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.HOT_LIST;
    }

    @Override
    public boolean followDetails() {
        return followDetails;
    }
}
