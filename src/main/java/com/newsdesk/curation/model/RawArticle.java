package com.newsdesk.curation.model;

import java.time.Instant;
import java.util.List;

/**
 * A record handed over by the feed fetcher, before it is stored as an {@link Article}.
 */
public class RawArticle {
    private Long feed_id;
    private Long category_id; // the feed's default category, if any
    private String title;
    private String link;
    private String description;
    private String content;
    private String author;
    private Instant published_date;
    private List<String> image_urls;

    public Long getFeed_id() { return feed_id; }
    public void setFeed_id(Long feed_id) { this.feed_id = feed_id; }
    public Long getCategory_id() { return category_id; }
    public void setCategory_id(Long category_id) { this.category_id = category_id; }
    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }
    public String getLink() { return link; }
    public void setLink(String link) { this.link = link; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public String getContent() { return content; }
    public void setContent(String content) { this.content = content; }
    public String getAuthor() { return author; }
    public void setAuthor(String author) { this.author = author; }
    public Instant getPublished_date() { return published_date; }
    public void setPublished_date(Instant published_date) { this.published_date = published_date; }
    public List<String> getImage_urls() { return image_urls; }
    public void setImage_urls(List<String> image_urls) { this.image_urls = image_urls; }
}
