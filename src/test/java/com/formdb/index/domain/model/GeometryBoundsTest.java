package com.formdb.index.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.formdb.index.domain.exception.InvalidBoundingBoxException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GeometryBoundsTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void shouldBoundPoint() throws Exception {
        JsonNode point = objectMapper.readTree("""
                {"type": "Point", "coordinates": [-74.0060, 40.7128]}
                """);

        assertThat(GeometryBounds.of(point)).isEqualTo(BoundingBox.point(-74.0060, 40.7128));
    }

    @Test
    void shouldBoundPolygonRings() throws Exception {
        JsonNode polygon = objectMapper.readTree("""
                {"type": "Polygon", "coordinates": [[
                    [-74.0, 40.7], [-73.9, 40.7], [-73.9, 40.8], [-74.0, 40.8], [-74.0, 40.7]
                ]]}
                """);

        assertThat(GeometryBounds.of(polygon)).isEqualTo(BoundingBox.of(-74.0, 40.7, -73.9, 40.8));
    }

    @Test
    void shouldBoundMultiPolygonAndIgnoreAltitude() throws Exception {
        JsonNode multiPolygon = objectMapper.readTree("""
                {"type": "MultiPolygon", "coordinates": [
                    [[[0, 0, 100], [1, 0, 100], [1, 1, 100], [0, 0, 100]]],
                    [[[5, -2, 7], [6, -2, 7], [6, 3, 7], [5, -2, 7]]]
                ]}
                """);

        assertThat(GeometryBounds.of(multiPolygon)).isEqualTo(BoundingBox.of(0, -2, 6, 3));
    }

    @Test
    void shouldUnionGeometryCollectionMembers() throws Exception {
        JsonNode collection = objectMapper.readTree("""
                {"type": "GeometryCollection", "geometries": [
                    {"type": "Point", "coordinates": [10, 10]},
                    {"type": "LineString", "coordinates": [[-1, 2], [3, 4]]}
                ]}
                """);

        assertThat(GeometryBounds.of(collection)).isEqualTo(BoundingBox.of(-1, 2, 10, 10));
    }

    @Test
    void shouldRejectGeometryWithoutCoordinates() throws Exception {
        JsonNode empty = objectMapper.readTree("""
                {"type": "LineString", "coordinates": []}
                """);

        assertThatThrownBy(() -> GeometryBounds.of(empty)).isInstanceOf(InvalidBoundingBoxException.class);
        assertThatThrownBy(() -> GeometryBounds.of(null)).isInstanceOf(InvalidBoundingBoxException.class);
    }

    @Test
    void shouldRejectShortPosition() throws Exception {
        JsonNode broken = objectMapper.readTree("""
                {"type": "Point", "coordinates": [12.5]}
                """);

        assertThatThrownBy(() -> GeometryBounds.of(broken)).isInstanceOf(InvalidBoundingBoxException.class);
    }
}
