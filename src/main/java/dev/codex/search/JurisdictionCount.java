package dev.codex.search;

/**
 * Number of indexed chunks for one jurisdiction of a region.
 *
 * @param jurisdiction the city or county
 * @param chunkCount indexed chunks
 */
public record JurisdictionCount(String jurisdiction, long chunkCount) {}
