package com.williamcallahan.articleserver.service.index;

import com.williamcallahan.articleserver.domain.ArticleMeta;
import com.williamcallahan.articleserver.domain.ArticlePage;
import com.williamcallahan.articleserver.domain.TagCount;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable point-in-time index of article metadata.
 *
 * <p>Lookups by id, tag and keyword. Tag and keyword membership keeps scan insertion order;
 * every listing is presented newest first ({@code date} descending, then {@code id} ascending)
 * so pages stay stable between calls against the same snapshot.</p>
 *
 * <p>Instances are never modified after {@link Builder#build()}; a rebuild produces a new instance.</p>
 */
public final class ArticleIndex {

    /** Display order shared by every listing. */
    public static final Comparator<ArticleMeta> DISPLAY_ORDER =
            Comparator.comparingInt(ArticleMeta::date).reversed().thenComparingInt(ArticleMeta::id);

    private static final ArticleIndex EMPTY = new Builder().build();

    private final Map<Integer, ArticleMeta> byId;
    private final Map<String, Set<Integer>> byTag;
    private final Map<String, Set<Integer>> byKeyword;
    private final List<ArticleMeta> displayOrder;
    private final Map<String, List<ArticleMeta>> tagDisplayOrder;
    private final Map<String, List<ArticleMeta>> keywordDisplayOrder;

    private ArticleIndex(
            Map<Integer, ArticleMeta> byId, Map<String, Set<Integer>> byTag, Map<String, Set<Integer>> byKeyword) {
        this.byId = Collections.unmodifiableMap(new LinkedHashMap<>(byId));
        this.byTag = freezeMembership(byTag);
        this.byKeyword = freezeMembership(byKeyword);
        this.displayOrder = sortedForDisplay(this.byId.values());
        this.tagDisplayOrder = displayOrderPerKey(this.byTag);
        this.keywordDisplayOrder = displayOrderPerKey(this.byKeyword);
    }

    /**
     * Returns an index containing no articles.
     */
    public static ArticleIndex empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<ArticleMeta> get(int id) {
        return Optional.ofNullable(byId.get(id));
    }

    public boolean contains(int id) {
        return byId.containsKey(id);
    }

    public int size() {
        return byId.size();
    }

    /**
     * Returns every indexed id in scan order.
     */
    public Set<Integer> ids() {
        return byId.keySet();
    }

    /**
     * Returns the ids carrying {@code tag} in scan insertion order, empty for an unknown tag.
     */
    public Set<Integer> idsForTag(String tag) {
        return byTag.getOrDefault(tag, Set.of());
    }

    /**
     * Returns the ids carrying {@code keyword} in scan insertion order, empty for an unknown keyword.
     */
    public Set<Integer> idsForKeyword(String keyword) {
        return byKeyword.getOrDefault(keyword, Set.of());
    }

    /**
     * Lists all tags in first-seen order with the number of articles carrying each.
     */
    public List<TagCount> tags() {
        List<TagCount> tags = new ArrayList<>(byTag.size());
        byTag.forEach((tag, ids) -> tags.add(new TagCount(tag, ids.size())));
        return List.copyOf(tags);
    }

    /**
     * Returns one page of all articles in display order.
     *
     * @param limit page size, must be positive
     * @param page zero-based page index, must be non-negative
     * @return the page, with empty items when {@code page} is past the last page
     * @throws IllegalArgumentException if {@code limit <= 0} or {@code page < 0}
     */
    public ArticlePage listAll(int limit, int page) {
        return slice(displayOrder, limit, page);
    }

    /**
     * Returns one page of the articles carrying {@code tag}; an unknown tag yields an empty page.
     */
    public ArticlePage listByTag(String tag, int limit, int page) {
        return slice(tagDisplayOrder.getOrDefault(tag, List.of()), limit, page);
    }

    /**
     * Returns one page of the articles carrying {@code keyword}; an unknown keyword yields an empty page.
     */
    public ArticlePage listByKeyword(String keyword, int limit, int page) {
        return slice(keywordDisplayOrder.getOrDefault(keyword, List.of()), limit, page);
    }

    /**
     * Returns every article in display order as a single unpaginated listing. {@code pageSize} only
     * feeds the reported {@code limit} and {@code totalPages}.
     *
     * @throws IllegalArgumentException if {@code pageSize <= 0}
     */
    public ArticlePage listAllUnpaged(int pageSize) {
        return whole(displayOrder, pageSize);
    }

    public ArticlePage listByTagUnpaged(String tag, int pageSize) {
        return whole(tagDisplayOrder.getOrDefault(tag, List.of()), pageSize);
    }

    public ArticlePage listByKeywordUnpaged(String keyword, int pageSize) {
        return whole(keywordDisplayOrder.getOrDefault(keyword, List.of()), pageSize);
    }

    public int pageCount(int limit) {
        return pageCount(displayOrder.size(), limit);
    }

    public int tagPageCount(String tag, int limit) {
        return pageCount(idsForTag(tag).size(), limit);
    }

    public int keywordPageCount(String keyword, int limit) {
        return pageCount(idsForKeyword(keyword).size(), limit);
    }

    /**
     * Computes {@code ceil(total / limit)}.
     *
     * @throws IllegalArgumentException if {@code limit <= 0} or {@code total < 0}
     */
    public static int pageCount(int total, int limit) {
        requirePositiveLimit(limit);
        if (total < 0) {
            throw new IllegalArgumentException("total must be non-negative, got: " + total);
        }
        return (int) (((long) total + limit - 1) / limit);
    }

    private static ArticlePage slice(List<ArticleMeta> ordered, int limit, int page) {
        requirePositiveLimit(limit);
        if (page < 0) {
            throw new IllegalArgumentException("page must be non-negative, got: " + page);
        }
        int total = ordered.size();
        long from = (long) page * limit;
        List<ArticleMeta> items = from >= total
                ? List.of()
                : ordered.subList((int) from, (int) Math.min(from + limit, total));
        return new ArticlePage(items, page, limit, total, pageCount(total, limit));
    }

    private static ArticlePage whole(List<ArticleMeta> ordered, int pageSize) {
        return new ArticlePage(ordered, 0, pageSize, ordered.size(), pageCount(ordered.size(), pageSize));
    }

    private static void requirePositiveLimit(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, got: " + limit);
        }
    }

    private static Map<String, Set<Integer>> freezeMembership(Map<String, Set<Integer>> membership) {
        Map<String, Set<Integer>> frozen = new LinkedHashMap<>();
        membership.forEach((key, ids) -> frozen.put(key, Collections.unmodifiableSet(new LinkedHashSet<>(ids))));
        return Collections.unmodifiableMap(frozen);
    }

    private Map<String, List<ArticleMeta>> displayOrderPerKey(Map<String, Set<Integer>> membership) {
        Map<String, List<ArticleMeta>> ordered = new LinkedHashMap<>();
        membership.forEach((key, ids) -> ordered.put(key, sortedForDisplay(ids.stream().map(byId::get).toList())));
        return Collections.unmodifiableMap(ordered);
    }

    private static List<ArticleMeta> sortedForDisplay(Iterable<ArticleMeta> metas) {
        List<ArticleMeta> sorted = new ArrayList<>();
        metas.forEach(sorted::add);
        sorted.sort(DISPLAY_ORDER);
        return List.copyOf(sorted);
    }

    /**
     * Accumulates metadata during a scan. Not thread-safe; owned by a single build.
     */
    public static final class Builder {
        private final Map<Integer, ArticleMeta> byId = new LinkedHashMap<>();
        private final Map<String, Set<Integer>> byTag = new LinkedHashMap<>();
        private final Map<String, Set<Integer>> byKeyword = new LinkedHashMap<>();
        private boolean built;

        private Builder() {
        }

        /**
         * Adds one article.
         *
         * @throws IllegalStateException if the id was already added or the builder was already built
         */
        public Builder add(ArticleMeta meta) {
            Objects.requireNonNull(meta, "meta");
            if (built) {
                throw new IllegalStateException("Index already built");
            }
            if (byId.putIfAbsent(meta.id(), meta) != null) {
                throw new IllegalStateException("Duplicate article id " + meta.id());
            }
            meta.tags().forEach(tag -> byTag.computeIfAbsent(tag, key -> new LinkedHashSet<>()).add(meta.id()));
            meta.keywords().forEach(keyword ->
                    byKeyword.computeIfAbsent(keyword, key -> new LinkedHashSet<>()).add(meta.id()));
            return this;
        }

        public int size() {
            return byId.size();
        }

        public ArticleIndex build() {
            built = true;
            return new ArticleIndex(byId, byTag, byKeyword);
        }
    }
}
