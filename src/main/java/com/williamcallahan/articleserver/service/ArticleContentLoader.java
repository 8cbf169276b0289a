package com.williamcallahan.articleserver.service;

import com.williamcallahan.articleserver.config.AppProperties;
import com.williamcallahan.articleserver.domain.Article;
import com.williamcallahan.articleserver.domain.ArticleMeta;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads an article's markdown source from the articles root and renders it.
 *
 * <p>This is the expensive step a render cache miss pays for.</p>
 */
@Component
public class ArticleContentLoader {
    private static final Logger log = LoggerFactory.getLogger(ArticleContentLoader.class);

    private final Path articlesRoot;
    private final MarkdownRenderer markdownRenderer;

    /**
     * Creates a loader rooted at {@code app.articles.dir}.
     *
     * @param appProperties application configuration
     * @param markdownRenderer markdown to HTML renderer
     */
    public ArticleContentLoader(AppProperties appProperties, MarkdownRenderer markdownRenderer) {
        this.articlesRoot = appProperties.getArticles().rootPath();
        this.markdownRenderer = Objects.requireNonNull(markdownRenderer, "markdownRenderer");
    }

    /**
     * Returns the directory holding the article with {@code id}.
     */
    public Path articleDirectory(int id) {
        return articlesRoot.resolve(Integer.toString(id));
    }

    /**
     * Loads and renders the article described by {@code meta}.
     *
     * @param meta indexed metadata
     * @return article with rendered HTML
     * @throws ArticleLoadException if the markdown source cannot be read or rendered
     */
    public Article load(ArticleMeta meta) {
        Path markdownFile = articleDirectory(meta.id()).resolve(meta.contentPath()).normalize();
        String markdown;
        try {
            markdown = Files.readString(markdownFile, StandardCharsets.UTF_8);
        } catch (IOException readFailure) {
            throw new ArticleLoadException(
                    "Failed to read markdown for article " + meta.id() + " from " + markdownFile, readFailure);
        }
        try {
            String html = markdownRenderer.render(markdown);
            log.debug("Rendered article {} ({} chars of markdown)", meta.id(), markdown.length());
            return new Article(meta, html);
        } catch (MarkdownProcessingException renderFailure) {
            throw new ArticleLoadException("Failed to render markdown for article " + meta.id(), renderFailure);
        }
    }
}
