package dev.jobscout.source;

/**
 * One search to run against a query-driven source: free-text keywords plus the location to search in.
 */
public record SearchQuery(String text, String location) {
}
