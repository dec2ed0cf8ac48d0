package com.aiusage.attribution.domain.model;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Well-known dimension names carried on raw records, and the fact discriminator built from them.
 */
public final class Dimensions {

    public static final String PLATFORM = "platform";
    public static final String MODEL = "model";
    public static final String COST_TYPE = "cost_type";
    public static final String TOKEN_TYPE = "token_type";
    public static final String EVENT_TYPE = "event_type";
    public static final String CONTEXT_WINDOW = "context_window";
    public static final String SERVICE_TIER = "service_tier";
    public static final String CURRENCY = "currency";
    public static final String SCOPE = "scope";
    public static final String DESCRIPTION = "description";

    public static final String SCOPE_ORGANIZATION = "organization";
    public static final String SCOPE_WORKSPACE = "workspace";

    public static final String NO_DISCRIMINATOR = "-";

    /**
     * Dimensions that split facts of the same user, day and platform. Order is part of the key format.
     */
    public static final List<String> DISCRIMINATOR_KEYS = List.of(
            MODEL, COST_TYPE, TOKEN_TYPE, EVENT_TYPE, CONTEXT_WINDOW, SERVICE_TIER, CURRENCY
    );

    private Dimensions() {
    }

    public static String discriminator(Map<String, String> dimensions) {
        String value = DISCRIMINATOR_KEYS.stream()
                .filter(dimensions::containsKey)
                .map(key -> key + "=" + dimensions.get(key))
                .collect(Collectors.joining("|"));
        return value.isEmpty() ? NO_DISCRIMINATOR : value;
    }
}
