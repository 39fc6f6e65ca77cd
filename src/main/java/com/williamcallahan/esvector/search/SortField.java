package com.williamcallahan.esvector.search;

import java.util.Objects;

/**
 * One ordering criterion for filtered retrieval.
 *
 * @param property model name of a key or data property
 * @param ascending true for ascending order
 */
public record SortField(String property, boolean ascending) {

    public SortField {
        Objects.requireNonNull(property, "property");
    }

    public static SortField ascending(String property) {
        return new SortField(property, true);
    }

    public static SortField descending(String property) {
        return new SortField(property, false);
    }
}
