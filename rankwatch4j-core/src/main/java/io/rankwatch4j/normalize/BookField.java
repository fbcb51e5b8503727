package io.rankwatch4j.normalize;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Alias table: each logical book field with the upstream field names it has appeared under,
 * in lookup order.
 */
public enum BookField {
    BOOK_ID("novelId", "novelid", "novel_id"),
    TITLE("novelName", "novelname", "novel_name"),
    AUTHOR_ID("authorId", "authorid", "author_id"),
    AUTHOR_NAME("authorName", "authorname", "author_name"),
    CATEGORY("novelClass", "novelclass", "novel_class"),
    TAGS("tags", "novelTags", "novel_tags"),
    CLICKS("totalClicks", "totalclicks", "novip_clicks"),
    FAVORITES("totalFavorites", "totalfavorites", "novelbefavoritedcount"),
    COMMENTS("commentCount", "commentcount", "comment_count"),
    CHAPTERS("chapterCount", "chaptercount", "novelChapterCount"),
    WORD_COUNT("novelSize", "novelsize", "novel_size"),
    NUTRITION("nutritionNovel", "nutrition_novel"),
    VIP_CHAPTER("vipChapterid", "vipChapterId");

    private final List<String> aliases;

    BookField(String... aliases) {
        this.aliases = List.of(aliases);
    }

    public List<String> aliases() {
        return aliases;
    }

    /**
     * First alias present with a non-null value, or {@code null}.
     */
    public JsonNode find(JsonNode item) {
        if (item == null || !item.isObject()) {
            return null;
        }
        for (String alias : aliases) {
            JsonNode value = item.get(alias);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }

    /**
     * First alias whose value is non-blank text (numbers are rendered as text), or {@code null}.
     */
    public String text(JsonNode item) {
        if (item == null || !item.isObject()) {
            return null;
        }
        for (String alias : aliases) {
            JsonNode value = item.get(alias);
            if (value == null || value.isNull() || value.isContainerNode()) {
                continue;
            }
            String s = value.asText().trim();
            if (!s.isEmpty()) {
                return s;
            }
        }
        return null;
    }

    public long count(JsonNode item, long defaultValue) {
        return NumberParser.parse(find(item), defaultValue);
    }
}
