package com.formdb.index.domain.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Geospatial record as stored in the journal.
 * Indexes only keep {@link #id()} and {@link #bbox()}; the journal owns the rest.
 */
public record Feature(
        String id,
        String database,
        BoundingBox bbox,
        JsonNode geometry,
        Map<String, Object> properties,
        Map<String, Object> provenance
) {
    public Feature {
        properties = properties == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        provenance = provenance == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(provenance));
    }

    public static Feature of(String database, String id, BoundingBox bbox) {
        return new Feature(id, database, bbox, null, Map.of(), Map.of());
    }
}
