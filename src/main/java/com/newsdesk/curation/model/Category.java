package com.newsdesk.curation.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class Category {
    private Long id;
    private Long user_id;
    private String name;
    private String slug;
    private String description;
    private int display_order;
    private boolean is_deleted;

    public Category() {}

    public Category(Long id, Long user_id, String name, String slug, int display_order) {
        this.id = id;
        this.user_id = user_id;
        this.name = name;
        this.slug = slug;
        this.display_order = display_order;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Long getUser_id() { return user_id; }
    public void setUser_id(Long user_id) { this.user_id = user_id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getSlug() { return slug; }
    public void setSlug(String slug) { this.slug = slug; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public int getDisplay_order() { return display_order; }
    public void setDisplay_order(int display_order) { this.display_order = display_order; }
    public boolean getIs_deleted() { return is_deleted; }
    public void setIs_deleted(boolean is_deleted) { this.is_deleted = is_deleted; }
}
