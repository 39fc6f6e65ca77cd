package com.williamcallahan.esvector.model;

import java.util.Arrays;
import java.util.List;

/**
 * Explicit, ordered list of property definitions for one collection.
 *
 * @param properties property definitions in storage order
 */
public record CollectionDefinition(List<PropertyDefinition> properties) {

    public CollectionDefinition {
        properties = properties == null ? List.of() : List.copyOf(properties);
    }

    public static CollectionDefinition of(PropertyDefinition... properties) {
        return new CollectionDefinition(Arrays.asList(properties));
    }
}
