package dev.codex.ingestion;

/**
 * A raw ordinance document as delivered by an upstream scraper.
 *
 * @param documentId stable identifier of the document
 * @param jurisdiction the city or county
 * @param region the state
 * @param rawText the scraped text, possibly containing navigation boilerplate
 */
public record SourceDocument(
    String documentId, String jurisdiction, String region, String rawText) {}
