package com.newsdesk.curation.controller;

import com.newsdesk.curation.config.AppProperties;
import org.springframework.stereotype.Component;

/** Header checks shared by the controllers. */
@Component
public class AdminAccess {
    private final AppProperties appProperties;

    public AdminAccess(AppProperties appProperties) {
        this.appProperties = appProperties;
    }

    public boolean isAdmin(String adminKey) {
        String expected = appProperties.getAdminKey();
        return adminKey != null && expected != null && !expected.isBlank() && adminKey.equals(expected);
    }

    public long resolveUser(Long headerUserId) {
        return headerUserId != null ? headerUserId : appProperties.getDefaultUserId();
    }
}
