package com.williamcallahan.esvector.mapping;

/**
 * Converts application records to stored documents and back.
 *
 * @param <R> record type
 */
public interface RecordMapper<R> {

    /**
     * Converts a record to its stored form.
     *
     * @param record record to store
     * @param generatedEmbeddings generated vectors indexed like the model's vector properties; the array
     *     and its elements may be {@code null}
     * @return stored document with the key carried out of band
     */
    StorageDocument toStorage(R record, float[][] generatedEmbeddings);

    /**
     * Rebuilds a record from a stored document.
     *
     * @param document stored document; its body is never modified
     * @param includeVectors whether vector fields are restored
     * @return rebuilt record
     */
    R fromStorage(StorageDocument document, boolean includeVectors);
}
