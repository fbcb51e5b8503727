package io.rankwatch4j.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Append-only counter snapshot of one book.
 */
@Document(collection = "book_stats")
public class BookStatDocument {

    @Id
    private String id;

    private String bookId;
    private long clicks;
    private long favorites;
    private long comments;
    private long chapters;
    private long wordCount;
    private long nutrition;
    private long vipChapterId;
    private Instant capturedAt;

    public BookStatDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getBookId() {
        return bookId;
    }

    public void setBookId(String bookId) {
        this.bookId = bookId;
    }

    public long getClicks() {
        return clicks;
    }

    public void setClicks(long clicks) {
        this.clicks = clicks;
    }

    public long getFavorites() {
        return favorites;
    }

    public void setFavorites(long favorites) {
        this.favorites = favorites;
    }

    public long getComments() {
        return comments;
    }

    public void setComments(long comments) {
        this.comments = comments;
    }

    public long getChapters() {
        return chapters;
    }

    public void setChapters(long chapters) {
        this.chapters = chapters;
    }

    public long getWordCount() {
        return wordCount;
    }

    public void setWordCount(long wordCount) {
        this.wordCount = wordCount;
    }

    public long getNutrition() {
        return nutrition;
    }

    public void setNutrition(long nutrition) {
        this.nutrition = nutrition;
    }

    public long getVipChapterId() {
        return vipChapterId;
    }

    public void setVipChapterId(long vipChapterId) {
        this.vipChapterId = vipChapterId;
    }

    public Instant getCapturedAt() {
        return capturedAt;
    }

    public void setCapturedAt(Instant capturedAt) {
        this.capturedAt = capturedAt;
    }
}
