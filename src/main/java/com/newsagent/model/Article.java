package com.newsagent.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.newsagent.util.ArticleIds;

import java.util.Map;

/**
 * A news article as served by the API and stored in the headline cache.
 * The id is a digest of URL and publish timestamp, so re-fetching the same
 * article yields the same id.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Article(
    @JsonProperty("id") String id,
    @JsonProperty("title") String title,
    @JsonProperty("url") String url,
    @JsonProperty("summary") String summary,
    @JsonProperty("published_at") String publishedAt,
    @JsonProperty("source_name") String sourceName,
    @JsonProperty("author") String author,
    @JsonProperty("image_url") String imageUrl
) {

    public static Article fromNewsApi(NewsApiArticle article) {
        return new Article(
                ArticleIds.digest(article.url(), article.publishedAt()),
                article.title(),
                article.url(),
                article.description(),
                article.publishedAt(),
                article.sourceName(),
                article.author(),
                article.urlToImage()
        );
    }

    /**
     * Builds an article from the metadata fields of a vector store record.
     * Ingested records carry the NewsAPI description under "description".
     */
    public static Article fromVectorFields(String id, Map<String, Object> fields) {
        String summary = text(fields, "summary");
        if (summary.isEmpty()) {
            summary = text(fields, "description");
        }
        String imageUrl = text(fields, "image_url");
        return new Article(
                id,
                text(fields, "title"),
                text(fields, "url"),
                summary,
                text(fields, "published_at"),
                text(fields, "source_name"),
                text(fields, "author"),
                imageUrl.isEmpty() ? null : imageUrl
        );
    }

    private static String text(Map<String, Object> fields, String key) {
        if (fields == null) return "";
        Object value = fields.get(key);
        return value == null ? "" : value.toString();
    }
}
