package io.rankwatch4j.testing;

import io.rankwatch4j.config.SourceProperties;
import io.rankwatch4j.crawl.SourceCatalog;
import io.rankwatch4j.crawl.SourceKind;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Source catalog and payloads shared by the crawl, scheduler and monitor tests.
 */
public final class Fixtures {

    public static final Map<String, String> TEMPLATES = Map.of(
            "jiazi", "https://app.test/getPrivilegeList?version={version}",
            "page", "https://app.test/getAppIndexData?channel={channel}&version={version}",
            "novel_detail", "https://app.test/getNovelInfo?novelId={novel_id}&version={version}"
    );

    public static final Map<String, String> BASE_PARAMS = Map.of("version", "20");

    private Fixtures() {
    }

    public static SourceProperties source(SourceKind kind, String template, String trigger, Map<String, String> params) {
        SourceProperties p = new SourceProperties();
        p.setKind(kind);
        p.setTemplate(template);
        p.setTrigger(trigger);
        p.setParams(params);
        return p;
    }

    public static Map<String, SourceProperties> sources() {
        Map<String, SourceProperties> sources = new LinkedHashMap<>();
        sources.put("jiazi", source(SourceKind.HOT_LIST, "jiazi", "1 hour", Map.of()));
        sources.put("romance", source(SourceKind.CATEGORY, "page", "2 hours", Map.of("channel", "romance")));
        sources.put("fantasy", source(SourceKind.CATEGORY, "page", null, Map.of("channel", "fantasy")));
        return sources;
    }

    public static SourceCatalog catalog() {
        return SourceCatalog.fromProperties(TEMPLATES, BASE_PARAMS, sources(), null);
    }

    /**
     * Hot-list body with {@code count} books, ids {@code 1001..}.
     */
    public static String hotList(int count) {
        StringBuilder sb = new StringBuilder("{\"code\":\"200\",\"data\":{\"list\":[");
        for (int i = 0; i < count; i++) {
            if (i > 0) {
                sb.append(',');
            }
            int id = 1001 + i;
            sb.append("{\"novelId\":\"").append(id)
                    .append("\",\"novelName\":\"Book ").append(id)
                    .append("\",\"authorName\":\"Author ").append(id)
                    .append("\",\"totalClicks\":\"").append(i + 1).append(".5万\"}");
        }
        return sb.append("]}}").toString();
    }

    public static String detail(String bookId) {
        return "{\"code\":\"200\",\"data\":{\"novelId\":\"" + bookId + "\",\"novelName\":\"Book " + bookId
                + "\",\"novelbefavoritedcount\":\"1200\",\"novelChapterCount\":\"88\"}}";
    }
}
