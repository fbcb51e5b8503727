package io.rankwatch4j.crawl;

import io.rankwatch4j.config.SourceProperties;
import io.rankwatch4j.exception.ConfigurationException;
import io.rankwatch4j.normalize.ShapeHint;
import io.rankwatch4j.testing.Fixtures;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SourceCatalogTest {

    private final SourceCatalog catalog = Fixtures.catalog();

    @Test
    void createShouldMergeBaseAndSourceParams() {
        CrawlSource romance = catalog.create("romance");

        assertInstanceOf(CategorySource.class, romance);
        assertEquals(SourceKind.CATEGORY, romance.kind());
        assertEquals(ShapeHint.BLOCKS, romance.expectedShape());
        assertEquals("https://app.test/getAppIndexData?channel=romance&version=20", romance.buildUrl());

        CrawlSource jiazi = catalog.create("jiazi");
        assertInstanceOf(HotListSource.class, jiazi);
        assertEquals(ShapeHint.FLAT_LIST, jiazi.expectedShape());
        assertEquals("https://app.test/getPrivilegeList?version=20", jiazi.buildUrl());
    }

    @Test
    void detailTargetShouldBuildDetailSource() {
        CrawlSource detail = catalog.create("detail:12345");

        assertInstanceOf(DetailSource.class, detail);
        assertEquals("detail:12345", detail.id());
        assertEquals(ShapeHint.SINGLE_OBJECT, detail.expectedShape());
        assertEquals("https://app.test/getNovelInfo?novelId=12345&version=20", detail.buildUrl());
        assertFalse(detail.kind().isRanked());
    }

    @Test
    void placeholderValuesShouldBeUrlEncoded() {
        assertEquals("https://app.test/getNovelInfo?novelId=12+34&version=20",
                catalog.create("detail:12 34").buildUrl());

        SourceCatalog chinese = SourceCatalog.fromProperties(Fixtures.TEMPLATES, Fixtures.BASE_PARAMS,
                Map.of("yanqing", Fixtures.source(SourceKind.CATEGORY, "page", null, Map.of("channel", "言情"))), null);
        assertEquals("https://app.test/getAppIndexData?channel=%E8%A8%80%E6%83%85&version=20",
                chinese.create("yanqing").buildUrl());
    }

    @Test
    void templateThatCannotFormUriShouldBeConfigurationError() {
        Map<String, String> templates = Map.of("spaced", "https://app.test/rank list?version={version}");
        Map<String, SourceProperties> sources = Map.of(
                "jiazi", Fixtures.source(SourceKind.HOT_LIST, "spaced", null, Map.of()));
        assertThrows(ConfigurationException.class,
                () -> SourceCatalog.fromProperties(templates, Fixtures.BASE_PARAMS, sources, null));

        Map<String, String> relative = Map.of("rel", "getPrivilegeList?version={version}");
        Map<String, SourceProperties> relSources = Map.of(
                "jiazi", Fixtures.source(SourceKind.HOT_LIST, "rel", null, Map.of()));
        assertThrows(ConfigurationException.class,
                () -> SourceCatalog.fromProperties(relative, Fixtures.BASE_PARAMS, relSources, null));
    }

    @Test
    void unknownSourceShouldBeConfigurationError() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> catalog.create("nope"));
        assertFalse(e.isRetryable());
        assertThrows(ConfigurationException.class, () -> catalog.create("detail:"));
    }

    @Test
    void resolveTargetsShouldExpandKeywordsAndLists() {
        assertEquals(List.of("jiazi"), catalog.resolveTargets("jiazi"));
        assertEquals(List.of("jiazi", "romance", "fantasy"), catalog.resolveTargets("all"));
        assertEquals(List.of("romance", "fantasy"), catalog.resolveTargets("category"));
        assertEquals(List.of("romance", "fantasy", "jiazi", "detail:9"),
                catalog.resolveTargets("category, jiazi, romance, detail:9"));
        assertThrows(ConfigurationException.class, () -> catalog.resolveTargets("jiazi,unknown"));
        assertThrows(ConfigurationException.class, () -> catalog.resolveTargets(" , "));
    }

    @Test
    void constructionShouldFailFastOnBadConfiguration() {
        Map<String, SourceProperties> missingParam = Map.of(
                "broken", Fixtures.source(SourceKind.CATEGORY, "page", null, Map.of()));
        assertThrows(ConfigurationException.class,
                () -> SourceCatalog.fromProperties(Fixtures.TEMPLATES, Fixtures.BASE_PARAMS, missingParam, null));

        Map<String, SourceProperties> missingTemplate = Map.of(
                "broken", Fixtures.source(SourceKind.CATEGORY, "no-such-template", null, Map.of("channel", "x")));
        assertThrows(ConfigurationException.class,
                () -> SourceCatalog.fromProperties(Fixtures.TEMPLATES, Fixtures.BASE_PARAMS, missingTemplate, null));

        Map<String, SourceProperties> reserved = Map.of(
                "all", Fixtures.source(SourceKind.HOT_LIST, "jiazi", null, Map.of()));
        assertThrows(ConfigurationException.class,
                () -> SourceCatalog.fromProperties(Fixtures.TEMPLATES, Fixtures.BASE_PARAMS, reserved, null));

        Map<String, SourceProperties> badTrigger = Map.of(
                "jiazi", Fixtures.source(SourceKind.HOT_LIST, "jiazi", "every now and then", Map.of()));
        assertThrows(ConfigurationException.class,
                () -> SourceCatalog.fromProperties(Fixtures.TEMPLATES, Fixtures.BASE_PARAMS, badTrigger, null));
    }

    @Test
    void monitorIntervalShouldDeriveFromIntervalTriggers() {
        assertEquals(Duration.ofHours(2), catalog.find("romance").orElseThrow().monitorInterval());
        assertNull(catalog.find("fantasy").orElseThrow().monitorInterval());
        assertTrue(catalog.find("jiazi").orElseThrow().isScheduled());
        assertFalse(catalog.find("fantasy").orElseThrow().isScheduled());
    }
}
