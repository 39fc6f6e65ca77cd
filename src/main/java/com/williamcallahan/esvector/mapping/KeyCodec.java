package com.williamcallahan.esvector.mapping;

import com.google.common.primitives.Primitives;
import com.williamcallahan.esvector.domain.errors.UnsupportedTypeException;
import com.williamcallahan.esvector.model.KeyPropertyModel;
import java.util.Objects;
import java.util.UUID;

/**
 * Converts typed record keys to and from document identifiers.
 */
public final class KeyCodec {

    private KeyCodec() {}

    /**
     * Encodes a key as a document identifier.
     *
     * @param key string, long, or UUID key
     * @return document identifier
     */
    public static String toStorageId(Object key) {
        Objects.requireNonNull(key, "key");
        if (key instanceof String stringKey) {
            return stringKey;
        }
        if (key instanceof Long longKey) {
            return Long.toString(longKey);
        }
        if (key instanceof UUID uuidKey) {
            return uuidKey.toString();
        }
        throw unsupported(key.getClass());
    }

    /**
     * Decodes a document identifier into the typed key.
     *
     * @param storageId document identifier
     * @param keyType declared key type
     * @param <K> key type
     * @return typed key
     */
    @SuppressWarnings("unchecked")
    public static <K> K fromStorageId(String storageId, Class<K> keyType) {
        Objects.requireNonNull(storageId, "storageId");
        Class<?> wrappedType = Primitives.wrap(Objects.requireNonNull(keyType, "keyType"));
        try {
            if (wrappedType == String.class) {
                return (K) storageId;
            }
            if (wrappedType == Long.class) {
                return (K) Long.valueOf(Long.parseLong(storageId));
            }
            if (wrappedType == UUID.class) {
                return (K) UUID.fromString(storageId);
            }
        } catch (IllegalArgumentException parseFailure) {
            throw new IllegalArgumentException(
                    "Document id '" + storageId + "' is not a valid " + wrappedType.getSimpleName() + " key",
                    parseFailure);
        }
        throw unsupported(keyType);
    }

    private static UnsupportedTypeException unsupported(Class<?> keyType) {
        return new UnsupportedTypeException("Key type '" + keyType.getName() + "' is not supported. Supported types: "
                + KeyPropertyModel.SUPPORTED_KEY_TYPE_NAMES);
    }
}
