package com.williamcallahan.esvector.model;

import java.lang.reflect.Type;
import java.util.Objects;

/**
 * Describes a data property and how it is indexed.
 *
 * @param name model name
 * @param type declared type
 * @param indexed whether exact-match filtering is enabled
 * @param fullTextIndexed whether full-text search is enabled
 * @param storageName explicit storage name or {@code null}
 */
public record DataPropertyDefinition(
        String name, Type type, boolean indexed, boolean fullTextIndexed, String storageName)
        implements PropertyDefinition {

    public DataPropertyDefinition {
        Objects.requireNonNull(name, "name");
    }

    public DataPropertyDefinition asIndexed() {
        return new DataPropertyDefinition(name, type, true, fullTextIndexed, storageName);
    }

    public DataPropertyDefinition asFullTextIndexed() {
        return new DataPropertyDefinition(name, type, indexed, true, storageName);
    }

    public DataPropertyDefinition storedAs(String explicitStorageName) {
        return new DataPropertyDefinition(name, type, indexed, fullTextIndexed, explicitStorageName);
    }
}
