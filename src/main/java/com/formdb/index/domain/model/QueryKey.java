package com.formdb.index.domain.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Cache key for a read query: database, query kind and a canonical JSON rendering of the parameters.
 * Parameter order and numeric representation do not affect the key, so {@code limit=10}
 * and {@code limit=10.0} map to the same entry.
 */
public record QueryKey(
        String database,
        String kind,
        String canonicalParams
) {
    private static final ObjectMapper CANONICAL_MAPPER = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
            .build();

    public QueryKey {
        Objects.requireNonNull(database, "database");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(canonicalParams, "canonicalParams");
    }

    public static QueryKey of(String database, String kind, Map<String, ?> params) {
        try {
            String canonical = CANONICAL_MAPPER.writeValueAsString(normalize(params == null ? Map.of() : params));
            return new QueryKey(database, kind, canonical);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Query parameters are not serializable: " + params, e);
        }
    }

    public boolean belongsTo(String db) {
        return database.equals(db);
    }

    private static Object normalize(Object value) {
        if (value instanceof Number number) {
            return canonicalNumber(number);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> sorted = new TreeMap<>();
            map.forEach((k, v) -> sorted.put(String.valueOf(k), normalize(v)));
            return sorted;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> items = new ArrayList<>(collection.size());
            collection.forEach(item -> items.add(normalize(item)));
            return items;
        }
        if (value instanceof double[] array) {
            List<Object> items = new ArrayList<>(array.length);
            for (double d : array) {
                items.add(canonicalNumber(d));
            }
            return items;
        }
        if (value instanceof Enum<?> constant) {
            return constant.name();
        }
        return value;
    }

    private static Object canonicalNumber(Number number) {
        BigDecimal decimal;
        if (number instanceof BigDecimal big) {
            decimal = big;
        } else if (number instanceof BigInteger big) {
            decimal = new BigDecimal(big);
        } else if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            if (!Double.isFinite(d)) {
                return Double.toString(d);
            }
            decimal = BigDecimal.valueOf(d);
        } else {
            decimal = BigDecimal.valueOf(number.longValue());
        }
        // -0.0 and 0E-10 both collapse to 0
        return decimal.signum() == 0 ? BigDecimal.ZERO : decimal.stripTrailingZeros();
    }

    @Override
    public String toString() {
        return database + "|" + kind + "|" + canonicalParams;
    }
}
