package com.williamcallahan.esvector.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.PropertyNamingStrategy;

/**
 * Default storage-name policy applied when no explicit override exists.
 */
@FunctionalInterface
public interface FieldNameInferrer {

    String storageNameFor(String modelName);

    static FieldNameInferrer identity() {
        return modelName -> modelName;
    }

    /**
     * Mirrors the naming strategy configured on a Jackson mapper so dynamic and typed records agree.
     *
     * @param objectMapper storage mapper
     * @return inferrer applying the mapper's naming strategy, or identity when none is configured
     */
    static FieldNameInferrer fromObjectMapper(ObjectMapper objectMapper) {
        PropertyNamingStrategy strategy = objectMapper.getPropertyNamingStrategy();
        if (strategy instanceof PropertyNamingStrategies.NamingBase namingBase) {
            return namingBase::translate;
        }
        return identity();
    }
}
