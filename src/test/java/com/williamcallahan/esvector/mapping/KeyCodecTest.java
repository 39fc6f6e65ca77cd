package com.williamcallahan.esvector.mapping;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.williamcallahan.esvector.domain.errors.UnsupportedTypeException;
import java.util.UUID;
import org.junit.jupiter.api.Test;

/**
 * Verifies key encoding to document identifiers.
 */
class KeyCodecTest {

    @Test
    void encodesSupportedKeyTypes() {
        UUID key = UUID.fromString("0f8fad5b-d9cb-469f-a165-70867728950e");

        assertEquals("abc", KeyCodec.toStorageId("abc"));
        assertEquals("-17", KeyCodec.toStorageId(-17L));
        assertEquals("0f8fad5b-d9cb-469f-a165-70867728950e", KeyCodec.toStorageId(key));
        assertEquals(key, KeyCodec.fromStorageId("0f8fad5b-d9cb-469f-a165-70867728950e", UUID.class));
        assertEquals(-17L, KeyCodec.fromStorageId("-17", long.class));
    }

    @Test
    void rejectsUnsupportedKeyTypes() {
        assertThrows(UnsupportedTypeException.class, () -> KeyCodec.toStorageId(1.5f));
        assertThrows(UnsupportedTypeException.class, () -> KeyCodec.fromStorageId("1", Integer.class));
    }

    @Test
    void rejectsMalformedIdentifiers() {
        IllegalArgumentException thrown =
                assertThrows(IllegalArgumentException.class, () -> KeyCodec.fromStorageId("xyz", Long.class));

        assertEquals("Document id 'xyz' is not a valid Long key", thrown.getMessage());
    }
}
