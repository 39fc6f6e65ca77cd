package com.williamcallahan.esvector.model;

import com.google.common.reflect.TypeToken;
import java.lang.reflect.Type;
import java.util.Objects;

/**
 * Built, validated description of one record property.
 */
public abstract class PropertyModel {

    private final String modelName;
    private final String storageName;
    private final Type type;
    private final PropertyReader reader;

    protected PropertyModel(String modelName, String storageName, Type type, PropertyReader reader) {
        this.modelName = Objects.requireNonNull(modelName, "modelName");
        this.storageName = Objects.requireNonNull(storageName, "storageName");
        this.type = Objects.requireNonNull(type, "type");
        this.reader = Objects.requireNonNull(reader, "reader");
    }

    /** Application-facing property name. */
    public String modelName() {
        return modelName;
    }

    /** Field name inside the stored document. */
    public String storageName() {
        return storageName;
    }

    public Type type() {
        return type;
    }

    public Class<?> rawType() {
        return TypeToken.of(type).getRawType();
    }

    /**
     * Reads this property's value from a record.
     *
     * @param record typed record or dynamic map
     * @return property value, possibly {@code null}
     */
    public Object readValue(Object record) {
        return reader.read(record);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + modelName + " -> " + storageName + "]";
    }
}
