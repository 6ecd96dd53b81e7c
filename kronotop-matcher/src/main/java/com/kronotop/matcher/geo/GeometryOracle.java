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

/**
 * Answers spatial questions about regions and GeoJSON geometries. A region is the operand document of a geo
 * predicate, e.g. {@code {$geometry: {...}}} or {@code {$box: [[0, 0], [1, 1]]}}.
 * <p>
 * Implementations must be sound: a true answer has to be correct, false is always an acceptable answer.
 */
public interface GeometryOracle {

    /**
     * An oracle that cannot prove anything.
     */
    GeometryOracle NONE = new GeometryOracle() {
        @Override
        public boolean contains(BsonDocument region, BsonDocument geometry) {
            return false;
        }

        @Override
        public boolean intersects(BsonDocument region, BsonDocument geometry) {
            return false;
        }
    };

    boolean contains(BsonDocument region, BsonDocument geometry);

    boolean intersects(BsonDocument region, BsonDocument geometry);
}
