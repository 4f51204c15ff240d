package dev.codex.search;

/**
 * One ranked chunk returned by a search.
 *
 * @param content the chunk text
 * @param jurisdiction the city or county of the source document
 * @param sourceDocumentId the source document id
 * @param chunkNumber ordinal of the chunk within its document
 * @param relevanceScore cosine similarity to the query, clamped to [0, 1]
 */
public record SearchResult(
    String content,
    String jurisdiction,
    String sourceDocumentId,
    int chunkNumber,
    double relevanceScore) {}
