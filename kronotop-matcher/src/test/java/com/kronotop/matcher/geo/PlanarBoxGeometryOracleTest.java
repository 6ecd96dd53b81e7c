/*
 * Copyright (c) 2023-2025 Burak Sezer
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.kronotop.matcher.geo;

import org.bson.BsonDocument;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PlanarBoxGeometryOracleTest {
    private static final BsonDocument BOX = BsonDocument.parse("{$box: [[0, 0], [10, 10]]}");
    private static final BsonDocument RECTANGLE = BsonDocument.parse("""
            {$geometry: {type: 'Polygon', coordinates: [[[0, 0], [10, 0], [10, 10], [0, 10], [0, 0]]]}}
            """);

    private final GeometryOracle oracle = PlanarBoxGeometryOracle.INSTANCE;

    private static BsonDocument geometry(String json) {
        return BsonDocument.parse(json);
    }

    @Nested
    @DisplayName("contains")
    class ContainsTests {

        @Test
        void testPointInsideBox() {
            assertTrue(oracle.contains(BOX, geometry("{type: 'Point', coordinates: [5, 5]}")));
            assertTrue(oracle.contains(RECTANGLE, geometry("{type: 'Point', coordinates: [5, 5]}")));
        }

        @Test
        @DisplayName("The border belongs to the region")
        void testBorder() {
            assertTrue(oracle.contains(BOX, geometry("{type: 'Point', coordinates: [0, 10]}")));
        }

        @Test
        void testPolygonInside() {
            BsonDocument polygon = geometry("{type: 'Polygon', coordinates: [[[1, 1], [4, 1], [4, 4], [1, 1]]]}");
            assertTrue(oracle.contains(RECTANGLE, polygon));
        }

        @Test
        void testPolygonCrossingTheBorder() {
            BsonDocument polygon = geometry("{type: 'Polygon', coordinates: [[[1, 1], [14, 1], [4, 4], [1, 1]]]}");
            assertFalse(oracle.contains(RECTANGLE, polygon));
            assertTrue(oracle.intersects(RECTANGLE, polygon));
        }

        @Test
        @DisplayName("Regions other than rectangles are never proven")
        void testUnsupportedRegions() {
            BsonDocument triangle = geometry("""
                    {$geometry: {type: 'Polygon', coordinates: [[[0, 0], [10, 0], [5, 10], [0, 0]]]}}
                    """);
            BsonDocument rotated = geometry("""
                    {$geometry: {type: 'Polygon', coordinates: [[[5, 0], [10, 5], [5, 10], [0, 5], [5, 0]]]}}
                    """);
            BsonDocument center = geometry("{$center: [[0, 0], 5]}");
            BsonDocument point = geometry("{type: 'Point', coordinates: [5, 5]}");

            assertFalse(oracle.contains(triangle, point));
            assertFalse(oracle.contains(rotated, point));
            assertFalse(oracle.contains(center, point));
        }

        @Test
        void testMalformedGeometry() {
            assertFalse(oracle.contains(BOX, geometry("{type: 'Point', coordinates: ['x', 5]}")));
            assertFalse(oracle.contains(BOX, geometry("{type: 'Circle', coordinates: [5, 5]}")));
            assertFalse(oracle.contains(BOX, geometry("{type: 'Point'}")));
        }
    }

    @Nested
    @DisplayName("intersects")
    class IntersectsTests {

        @Test
        void testLineStringTouchingTheBox() {
            assertTrue(oracle.intersects(BOX, geometry("{type: 'LineString', coordinates: [[-5, -5], [5, 5]]}")));
        }

        @Test
        void testDisjointGeometry() {
            assertFalse(oracle.intersects(BOX, geometry("{type: 'MultiPoint', coordinates: [[20, 20], [-1, 3]]}")));
        }
    }

    @Test
    void testNoneOracle() {
        assertFalse(GeometryOracle.NONE.contains(BOX, geometry("{type: 'Point', coordinates: [5, 5]}")));
        assertFalse(GeometryOracle.NONE.intersects(BOX, geometry("{type: 'Point', coordinates: [5, 5]}")));
    }
}
