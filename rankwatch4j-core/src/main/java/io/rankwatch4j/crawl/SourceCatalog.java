package io.rankwatch4j.crawl;

import io.rankwatch4j.config.SourceProperties;
import io.rankwatch4j.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Static table of configured sources, loaded once at startup.
 *
 * <p>Also resolves trigger targets: a source id, {@code detail:<bookId>}, or one of the keywords
 * {@link #ALL} (every list source) and {@link #CATEGORY} (every category source).
 */
public class SourceCatalog {
    public static final String ALL = "all";
    public static final String CATEGORY = "category";
    public static final String DEFAULT_DETAIL_TEMPLATE = "novel_detail";

    private final Map<String, String> templates;
    private final Map<String, String> baseParams;
    private final Map<String, SourceDefinition> definitions;
    private final String detailTemplate;

    public SourceCatalog(Map<String, String> templates,
                         Map<String, String> baseParams,
                         Collection<SourceDefinition> definitions,
                         String detailTemplate) {
        this.templates = templates == null ? Map.of() : Map.copyOf(templates);
        this.baseParams = baseParams == null ? Map.of() : Map.copyOf(baseParams);
        this.detailTemplate = detailTemplate == null || detailTemplate.isBlank() ? DEFAULT_DETAIL_TEMPLATE : detailTemplate;

        Map<String, SourceDefinition> byId = new LinkedHashMap<>();
        for (SourceDefinition def : Objects.requireNonNull(definitions, "definitions must not be null")) {
            if (ALL.equals(def.id()) || CATEGORY.equals(def.id()) || def.id().startsWith(DetailSource.ID_PREFIX)) {
                throw new ConfigurationException("source id is reserved: " + def.id());
            }
            if (def.kind() == SourceKind.DETAIL) {
                throw new ConfigurationException("detail sources are derived per book and cannot be configured: " + def.id());
            }
            if (byId.putIfAbsent(def.id(), def) != null) {
                throw new ConfigurationException("duplicate source id: " + def.id());
            }
        }
        this.definitions = Collections.unmodifiableMap(byId);

        // fail fast on unknown templates and unresolved placeholders
        for (SourceDefinition def : this.definitions.values()) {
            create(def.id()).buildUrl();
        }
    }

    public static SourceCatalog fromProperties(Map<String, String> templates,
                                               Map<String, String> baseParams,
                                               Map<String, SourceProperties> sources,
                                               String detailTemplate) {
        List<SourceDefinition> defs = new ArrayList<>();
        if (sources != null) {
            sources.forEach((id, props) -> defs.add(SourceDefinition.of(id, props)));
        }
        return new SourceCatalog(templates, baseParams, defs, detailTemplate);
    }

    public Collection<SourceDefinition> definitions() {
        return definitions.values();
    }

    public Optional<SourceDefinition> find(String sourceId) {
        return Optional.ofNullable(definitions.get(sourceId));
    }

    /**
     * Build the crawl source for a source id or a {@code detail:<bookId>} target.
     *
     * @throws ConfigurationException unknown source id, or missing template
     */
    public CrawlSource create(String sourceId) {
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        if (sourceId.startsWith(DetailSource.ID_PREFIX)) {
            return detail(sourceId.substring(DetailSource.ID_PREFIX.length()));
        }

        SourceDefinition def = definitions.get(sourceId);
        if (def == null) {
            throw new ConfigurationException("unknown source id: " + sourceId);
        }
        String template = requireTemplate(def.template(), sourceId);
        Map<String, String> params = new HashMap<>(baseParams);
        params.putAll(def.params());

        return switch (def.kind()) {
            case HOT_LIST -> new HotListSource(def.id(), template, params, def.followDetails());
            case CATEGORY -> new CategorySource(def.id(), template, params, def.followDetails());
            case DETAIL -> throw new ConfigurationException("detail source cannot be created by id: " + sourceId);
        };
    }

    public DetailSource detail(String bookId) {
        if (bookId == null || bookId.isBlank()) {
            throw new ConfigurationException("detail target requires a book id");
        }
        return new DetailSource(bookId, requireTemplate(detailTemplate, DetailSource.ID_PREFIX + bookId), baseParams);
    }

    /**
     * Expand a trigger target into concrete source ids, in configuration order.
     * A comma-separated list is expanded element-wise with duplicates removed.
     *
     * @throws ConfigurationException unknown id, or a keyword matching no source
     */
    public List<String> resolveTargets(String target) {
        Objects.requireNonNull(target, "target must not be null");
        Set<String> resolved = new LinkedHashSet<>();
        for (String part : target.split(",")) {
            String t = part.trim();
            if (t.isEmpty()) {
                continue;
            }
            if (ALL.equals(t)) {
                resolved.addAll(definitions.keySet());
            } else if (CATEGORY.equals(t)) {
                definitions.values().stream()
                        .filter(d -> d.kind() == SourceKind.CATEGORY)
                        .map(SourceDefinition::id)
                        .forEach(resolved::add);
            } else if (t.startsWith(DetailSource.ID_PREFIX)) {
                detail(t.substring(DetailSource.ID_PREFIX.length()));
                resolved.add(t);
            } else if (definitions.containsKey(t)) {
                resolved.add(t);
            } else {
                throw new ConfigurationException("unknown source id: " + t);
            }
        }
        if (resolved.isEmpty()) {
            throw new ConfigurationException("target resolves to no source: " + target);
        }
        return List.copyOf(resolved);
    }

    private String requireTemplate(String name, String sourceId) {
        String template = templates.get(name);
        if (template == null || template.isBlank()) {
            throw new ConfigurationException("missing URL template '" + name + "' for source " + sourceId);
        }
        return template;
    }
}
