package com.geico.poc.streamcatalog.show;

import java.util.Locale;

/**
 * What a {@code SHOW} statement lists.
 */
public enum ShowObject {
    DATABASES,
    SCHEMAS,
    TABLES,
    INTERNAL_TABLES,
    MATERIALIZED_VIEWS,
    SOURCES,
    SINKS,
    VIEWS,
    INDEXES,
    FUNCTIONS,
    COLUMNS;

    /**
     * Parse {@code "materialized views"}, {@code "materialized_views"} and the like.
     */
    public static ShowObject parse(String text) {
        String normalized = text.trim().replaceAll("[\\s-]+", "_").toUpperCase(Locale.ROOT);
        return valueOf(normalized);
    }
}
