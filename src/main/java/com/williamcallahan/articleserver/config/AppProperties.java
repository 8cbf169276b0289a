package com.williamcallahan.articleserver.config;

import jakarta.annotation.PostConstruct;
import java.nio.file.Path;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private Articles articles = new Articles();
    private Cache cache = new Cache();
    private Markdown markdown = new Markdown();

    public Articles getArticles() {
        return articles;
    }

    public void setArticles(Articles articles) {
        this.articles = articles;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public Markdown getMarkdown() {
        return markdown;
    }

    public void setMarkdown(Markdown markdown) {
        this.markdown = markdown;
    }

    /**
     * Rejects settings the index and cache cannot operate with.
     *
     * @throws IllegalArgumentException when a size is non-positive or a name is blank
     */
    @PostConstruct
    public void validateConfiguration() {
        if (articles.getDir() == null || articles.getDir().isBlank()) {
            throw new IllegalArgumentException("app.articles.dir must not be blank");
        }
        if (articles.getMetadataFile() == null || articles.getMetadataFile().isBlank()) {
            throw new IllegalArgumentException("app.articles.metadata-file must not be blank");
        }
        if (articles.getArticlesPerPage() <= 0) {
            throw new IllegalArgumentException(
                    "app.articles.articles-per-page must be positive, got: " + articles.getArticlesPerPage());
        }
        if (cache.getMaxCachedArticles() <= 0) {
            throw new IllegalArgumentException(
                    "app.cache.max-cached-articles must be positive, got: " + cache.getMaxCachedArticles());
        }
    }

    public static class Articles {
        private String dir = "articles";
        private String metadataFile = "metainfo.toml";
        private int articlesPerPage = 10;

        public String getDir() { return dir; }
        public void setDir(String dir) { this.dir = dir; }

        public String getMetadataFile() { return metadataFile; }
        public void setMetadataFile(String metadataFile) { this.metadataFile = metadataFile; }

        public int getArticlesPerPage() { return articlesPerPage; }
        public void setArticlesPerPage(int articlesPerPage) { this.articlesPerPage = articlesPerPage; }

        /**
         * Returns the articles root as an absolute, normalized path.
         */
        public Path rootPath() {
            return Path.of(dir).toAbsolutePath().normalize();
        }
    }

    public static class Cache {
        private int maxCachedArticles = 100;
        private boolean recordStats = true;

        public int getMaxCachedArticles() { return maxCachedArticles; }
        public void setMaxCachedArticles(int maxCachedArticles) { this.maxCachedArticles = maxCachedArticles; }

        public boolean isRecordStats() { return recordStats; }
        public void setRecordStats(boolean recordStats) { this.recordStats = recordStats; }
    }

    /**
     * Markdown extension switches applied when rendering article bodies.
     */
    public static class Markdown {
        private boolean strikethrough = true;
        private boolean table = true;
        private boolean autolink = true;
        private boolean tasklist = true;
        private boolean footnotes = true;
        private boolean descriptionLists = true;
        private boolean wikilinksTitleAfterPipe = true;
        private boolean wikilinksTitleBeforePipe = true;

        public boolean isStrikethrough() { return strikethrough; }
        public void setStrikethrough(boolean strikethrough) { this.strikethrough = strikethrough; }

        public boolean isTable() { return table; }
        public void setTable(boolean table) { this.table = table; }

        public boolean isAutolink() { return autolink; }
        public void setAutolink(boolean autolink) { this.autolink = autolink; }

        public boolean isTasklist() { return tasklist; }
        public void setTasklist(boolean tasklist) { this.tasklist = tasklist; }

        public boolean isFootnotes() { return footnotes; }
        public void setFootnotes(boolean footnotes) { this.footnotes = footnotes; }

        public boolean isDescriptionLists() { return descriptionLists; }
        public void setDescriptionLists(boolean descriptionLists) { this.descriptionLists = descriptionLists; }

        public boolean isWikilinksTitleAfterPipe() { return wikilinksTitleAfterPipe; }
        public void setWikilinksTitleAfterPipe(boolean wikilinksTitleAfterPipe) {
            this.wikilinksTitleAfterPipe = wikilinksTitleAfterPipe;
        }

        public boolean isWikilinksTitleBeforePipe() { return wikilinksTitleBeforePipe; }
        public void setWikilinksTitleBeforePipe(boolean wikilinksTitleBeforePipe) {
            this.wikilinksTitleBeforePipe = wikilinksTitleBeforePipe;
        }
    }
}
