package com.newsdesk.curation.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered article ids for one edition: the "today" front page and one list per category slug.
 * Category order is insertion order (category display order), so serialization is stable.
 */
@JsonPropertyOrder({"today", "categories"})
public class NewspaperStructure {
    private List<Long> today = new ArrayList<>();
    private LinkedHashMap<String, List<Long>> categories = new LinkedHashMap<>();

    public NewspaperStructure() {}

    public NewspaperStructure(List<Long> today, LinkedHashMap<String, List<Long>> categories) {
        this.today = today;
        this.categories = categories;
    }

    public List<Long> getToday() { return today; }
    public void setToday(List<Long> today) { this.today = today; }
    public LinkedHashMap<String, List<Long>> getCategories() { return categories; }
    public void setCategories(LinkedHashMap<String, List<Long>> categories) { this.categories = categories; }

    public int todayCount() {
        return today != null ? today.size() : 0;
    }

    public int categoryCount() {
        int n = 0;
        if (categories != null) {
            for (List<Long> ids : categories.values()) n += ids.size();
        }
        return n;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NewspaperStructure)) return false;
        NewspaperStructure that = (NewspaperStructure) o;
        if (!Objects.equals(today, that.today)) return false;
        // LinkedHashMap equality ignores order; editions with reordered sections differ.
        if (categories == null || that.categories == null) return categories == that.categories;
        return new ArrayList<>(categories.entrySet()).equals(new ArrayList<>(that.categories.entrySet()));
    }

    @Override
    public int hashCode() {
        return Objects.hash(today, categories);
    }
}
