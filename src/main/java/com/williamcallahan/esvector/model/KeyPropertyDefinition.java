package com.williamcallahan.esvector.model;

import java.lang.reflect.Type;
import java.util.Objects;

/**
 * Describes the key property.
 *
 * @param name model name
 * @param type declared key type
 * @param storageName explicit storage name or {@code null}
 */
public record KeyPropertyDefinition(String name, Type type, String storageName) implements PropertyDefinition {

    public KeyPropertyDefinition {
        Objects.requireNonNull(name, "name");
    }

    public KeyPropertyDefinition storedAs(String explicitStorageName) {
        return new KeyPropertyDefinition(name, type, explicitStorageName);
    }
}
