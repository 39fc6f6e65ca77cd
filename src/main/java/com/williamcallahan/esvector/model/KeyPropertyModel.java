package com.williamcallahan.esvector.model;

import com.google.common.primitives.Primitives;
import java.lang.reflect.Type;
import java.util.Set;
import java.util.UUID;

/**
 * The record key, stored as the document identifier outside the document body.
 */
public final class KeyPropertyModel extends PropertyModel {

    /** Key types that round-trip through a string document identifier. */
    public static final Set<Class<?>> SUPPORTED_KEY_TYPES = Set.of(String.class, Long.class, UUID.class);

    public static final String SUPPORTED_KEY_TYPE_NAMES = "String, Long, UUID";

    public KeyPropertyModel(String modelName, String storageName, Type type, PropertyReader reader) {
        super(modelName, storageName, type, reader);
    }

    public static boolean isSupportedKeyType(Class<?> candidateType) {
        return candidateType != null && SUPPORTED_KEY_TYPES.contains(Primitives.wrap(candidateType));
    }
}
