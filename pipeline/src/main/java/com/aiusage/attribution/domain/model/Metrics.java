package com.aiusage.attribution.domain.model;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Metric names shared between normalizers, classification and fact assembly.
 */
public final class Metrics {

    public static final String COST_MINOR_UNITS = "cost_minor_units";

    public static final String INPUT_TOKENS = "input_tokens";
    public static final String OUTPUT_TOKENS = "output_tokens";
    public static final String CACHE_READ_INPUT_TOKENS = "cache_read_input_tokens";
    public static final String CACHE_CREATION_INPUT_TOKENS = "cache_creation_input_tokens";
    public static final String WEB_SEARCH_REQUESTS = "web_search_requests";

    public static final String LINES_ADDED = "lines_added";
    public static final String LINES_REMOVED = "lines_removed";
    public static final String TOTAL_LINES_ADDED = "total_lines_added";
    public static final String ACCEPTED_LINES_ADDED = "accepted_lines_added";
    public static final String COMMITS = "commits";

    public static final String EVENTS = "events";

    public static final Set<String> CODING_FIELDS = Set.of(
            LINES_ADDED, LINES_REMOVED, TOTAL_LINES_ADDED, ACCEPTED_LINES_ADDED, COMMITS
    );

    public static final Set<String> TOKEN_FIELDS = Set.of(
            INPUT_TOKENS, OUTPUT_TOKENS, CACHE_READ_INPUT_TOKENS, CACHE_CREATION_INPUT_TOKENS
    );

    /**
     * Fields of a plain API request record: token counters plus server tool requests.
     */
    public static final Set<String> API_REQUEST_FIELDS = Set.of(
            INPUT_TOKENS, OUTPUT_TOKENS, CACHE_READ_INPUT_TOKENS, CACHE_CREATION_INPUT_TOKENS, WEB_SEARCH_REQUESTS
    );

    private Metrics() {
    }

    /**
     * Compares metric maps by numeric value, ignoring BigDecimal scale.
     */
    public static boolean sameValues(Map<String, BigDecimal> left, Map<String, BigDecimal> right) {
        if (!left.keySet().equals(right.keySet())) {
            return false;
        }
        return left.entrySet().stream()
                .allMatch(e -> e.getValue().compareTo(right.get(e.getKey())) == 0);
    }

    public static Map<String, BigDecimal> sum(Map<String, BigDecimal> left, Map<String, BigDecimal> right) {
        Map<String, BigDecimal> result = new TreeMap<>(left);
        right.forEach((name, value) -> result.merge(name, value, BigDecimal::add));
        return result;
    }
}
