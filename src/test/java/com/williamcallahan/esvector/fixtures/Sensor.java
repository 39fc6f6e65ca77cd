package com.williamcallahan.esvector.fixtures;

import com.williamcallahan.esvector.model.VectorStoreData;
import com.williamcallahan.esvector.model.VectorStoreKey;
import com.williamcallahan.esvector.model.VectorStoreVector;
import java.util.Collection;
import java.util.List;

/**
 * Record carrying one vector in each boxed and collection vector shape.
 */
public record Sensor(
        @VectorStoreKey Long sensorId,
        @VectorStoreData String label,
        @VectorStoreVector(dimensions = 2) Float[] boxedReading,
        @VectorStoreVector(dimensions = 2) List<Float> listReading,
        @VectorStoreVector(dimensions = 2) Collection<Float> collectionReading) {}
