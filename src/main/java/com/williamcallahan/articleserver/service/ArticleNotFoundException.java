package com.williamcallahan.articleserver.service;

/**
 * Signals that an article id is not present in the current index.
 */
public class ArticleNotFoundException extends RuntimeException {

    private final int articleId;

    /**
     * Creates a not-found exception for the given id.
     *
     * @param articleId id that was looked up
     */
    public ArticleNotFoundException(int articleId) {
        super("Article " + articleId + " not found");
        this.articleId = articleId;
    }

    public int getArticleId() {
        return articleId;
    }
}
