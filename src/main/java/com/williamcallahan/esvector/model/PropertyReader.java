package com.williamcallahan.esvector.model;

import java.lang.reflect.Field;
import java.util.Map;

/**
 * Reads one property value from a record instance.
 */
@FunctionalInterface
public interface PropertyReader {

    Object read(Object record);

    /**
     * Reads a declared field reflectively.
     *
     * @param field field backing the property
     * @return reader for the field
     */
    static PropertyReader forField(Field field) {
        field.setAccessible(true);
        return record -> {
            try {
                return field.get(record);
            } catch (IllegalAccessException accessFailure) {
                throw new IllegalStateException("Cannot read field '" + field.getName() + "'", accessFailure);
            }
        };
    }

    /**
     * Reads an entry of a dynamic map record.
     *
     * @param key model name used as map key
     * @return reader for the entry
     */
    static PropertyReader forMapEntry(String key) {
        return record -> ((Map<?, ?>) record).get(key);
    }
}
