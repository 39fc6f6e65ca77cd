package com.williamcallahan.esvector.mapping;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;

/**
 * Elasticsearch field mappings for one collection.
 *
 * @param properties the {@code mappings.properties} object keyed by storage name
 */
public record IndexSchema(ObjectNode properties) {

    public IndexSchema {
        Objects.requireNonNull(properties, "properties");
    }

    /**
     * Returns the body of a create-index request.
     *
     * @return {@code {"mappings":{"properties":{...}}}}
     */
    public ObjectNode toCreateIndexBody() {
        ObjectNode body = JsonNodeFactory.instance.objectNode();
        body.putObject("mappings").set("properties", properties.deepCopy());
        return body;
    }
}
