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

import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonValue;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A planar {@link GeometryOracle} that understands axis-aligned rectangles only: {@code $box} regions and
 * {@code $geometry} polygons with a single rectangular ring. Any other region answers false.
 * <p>
 * A geometry is contained when all of its vertices lie in the rectangle, borders included. It intersects the
 * rectangle when at least one vertex does.
 */
public final class PlanarBoxGeometryOracle implements GeometryOracle {
    public static final PlanarBoxGeometryOracle INSTANCE = new PlanarBoxGeometryOracle();

    private PlanarBoxGeometryOracle() {
    }

    @Override
    public boolean contains(BsonDocument region, BsonDocument geometry) {
        Box box = parseRegion(region);
        List<Point> vertices = vertices(geometry);
        if (box == null || vertices == null || vertices.isEmpty()) {
            return false;
        }
        for (Point vertex : vertices) {
            if (!box.covers(vertex)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean intersects(BsonDocument region, BsonDocument geometry) {
        Box box = parseRegion(region);
        List<Point> vertices = vertices(geometry);
        if (box == null || vertices == null) {
            return false;
        }
        for (Point vertex : vertices) {
            if (box.covers(vertex)) {
                return true;
            }
        }
        return false;
    }

    @Nullable
    private static Box parseRegion(BsonDocument region) {
        if (region.isArray("$box")) {
            BsonArray corners = region.getArray("$box");
            if (corners.size() != 2) {
                return null;
            }
            Point first = toPoint(corners.get(0));
            Point second = toPoint(corners.get(1));
            if (first == null || second == null) {
                return null;
            }
            return Box.spanning(List.of(first, second));
        }
        if (region.isDocument("$geometry")) {
            return parseRectangle(region.getDocument("$geometry"));
        }
        return null;
    }

    @Nullable
    private static Box parseRectangle(BsonDocument geometry) {
        if (!isType(geometry, "Polygon") || !geometry.isArray("coordinates")) {
            return null;
        }
        BsonArray rings = geometry.getArray("coordinates");
        if (rings.size() != 1) {
            return null;
        }
        List<Point> ring = toPoints(rings.get(0));
        // A closed ring of four corners
        if (ring == null || ring.size() != 5 || !ring.get(0).equals(ring.get(4))) {
            return null;
        }
        Box box = Box.spanning(ring);
        Set<Point> corners = new HashSet<>();
        for (int i = 0; i < 4; i++) {
            Point current = ring.get(i);
            Point next = ring.get(i + 1);
            if (!box.hasCorner(current)) {
                return null;
            }
            if (current.x() != next.x() && current.y() != next.y()) {
                return null;
            }
            corners.add(current);
        }
        return corners.size() == 4 ? box : null;
    }

    @Nullable
    private static List<Point> vertices(BsonDocument geometry) {
        if (!geometry.isArray("coordinates")) {
            return null;
        }
        BsonArray coordinates = geometry.getArray("coordinates");
        String type = geometry.isString("type") ? geometry.getString("type").getValue() : "";
        return switch (type) {
            case "Point" -> {
                Point point = toPoint(coordinates);
                yield point == null ? null : List.of(point);
            }
            case "MultiPoint", "LineString" -> toPoints(coordinates);
            case "Polygon", "MultiLineString" -> flatten(coordinates);
            case "MultiPolygon" -> {
                List<Point> points = new ArrayList<>();
                for (BsonValue polygon : coordinates) {
                    if (!polygon.isArray()) {
                        yield null;
                    }
                    List<Point> polygonPoints = flatten(polygon.asArray());
                    if (polygonPoints == null) {
                        yield null;
                    }
                    points.addAll(polygonPoints);
                }
                yield points;
            }
            default -> null;
        };
    }

    @Nullable
    private static List<Point> flatten(BsonArray lists) {
        List<Point> points = new ArrayList<>();
        for (BsonValue list : lists) {
            List<Point> converted = toPoints(list);
            if (converted == null) {
                return null;
            }
            points.addAll(converted);
        }
        return points;
    }

    @Nullable
    private static List<Point> toPoints(BsonValue value) {
        if (!value.isArray()) {
            return null;
        }
        List<Point> points = new ArrayList<>();
        for (BsonValue element : value.asArray()) {
            Point point = toPoint(element);
            if (point == null) {
                return null;
            }
            points.add(point);
        }
        return points;
    }

    @Nullable
    private static Point toPoint(BsonValue value) {
        if (!value.isArray()) {
            return null;
        }
        BsonArray pair = value.asArray();
        if (pair.size() != 2 || !pair.get(0).isNumber() || !pair.get(1).isNumber()) {
            return null;
        }
        return new Point(pair.get(0).asNumber().doubleValue(), pair.get(1).asNumber().doubleValue());
    }

    private static boolean isType(BsonDocument geometry, String type) {
        return geometry.isString("type") && geometry.getString("type").getValue().equals(type);
    }

    private record Point(double x, double y) {
    }

    private record Box(double minX, double minY, double maxX, double maxY) {

        static Box spanning(List<Point> points) {
            double minX = Double.POSITIVE_INFINITY;
            double minY = Double.POSITIVE_INFINITY;
            double maxX = Double.NEGATIVE_INFINITY;
            double maxY = Double.NEGATIVE_INFINITY;
            for (Point point : points) {
                minX = Math.min(minX, point.x());
                minY = Math.min(minY, point.y());
                maxX = Math.max(maxX, point.x());
                maxY = Math.max(maxY, point.y());
            }
            return new Box(minX, minY, maxX, maxY);
        }

        boolean covers(Point point) {
            return point.x() >= minX && point.x() <= maxX && point.y() >= minY && point.y() <= maxY;
        }

        boolean hasCorner(Point point) {
            return (point.x() == minX || point.x() == maxX) && (point.y() == minY || point.y() == maxY);
        }
    }
}
