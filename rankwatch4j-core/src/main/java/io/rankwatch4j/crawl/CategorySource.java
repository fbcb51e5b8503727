package io.rankwatch4j.crawl;

import java.util.Map;

/**
 * A category (channel) page; either a flat list or several named blocks.
 */
public class CategorySource extends TemplatedSource {

    private final boolean followDetails;

    public CategorySource(String id, String template, Map<String, String> params, boolean followDetails) {
        super(id, template, params);
        this.followDetails = followDetails;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.CATEGORY;
    }

    @Override
    public boolean followDetails() {
        return followDetails;
    }
}
