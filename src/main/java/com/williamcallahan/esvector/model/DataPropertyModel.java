package com.williamcallahan.esvector.model;

import java.lang.reflect.Type;

/**
 * A scalar or array property stored in the document body.
 *
 * <p>Full-text indexing takes precedence: a property is never both exact-match and full-text indexed.</p>
 */
public final class DataPropertyModel extends PropertyModel {

    private final boolean indexed;
    private final boolean fullTextIndexed;

    public DataPropertyModel(
            String modelName,
            String storageName,
            Type type,
            PropertyReader reader,
            boolean indexed,
            boolean fullTextIndexed) {
        super(modelName, storageName, type, reader);
        this.fullTextIndexed = fullTextIndexed;
        this.indexed = indexed && !fullTextIndexed;
    }

    public boolean isIndexed() {
        return indexed;
    }

    public boolean isFullTextIndexed() {
        return fullTextIndexed;
    }
}
