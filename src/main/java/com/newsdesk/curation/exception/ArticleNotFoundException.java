package com.newsdesk.curation.exception;

public class ArticleNotFoundException extends CurationException {
    public ArticleNotFoundException(long articleId) {
        super("Article not found: " + articleId);
    }
}
