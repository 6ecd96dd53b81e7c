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

package com.kronotop.matcher.expression;

import org.bson.BsonDocument;

import java.util.Objects;

/**
 * $geoWithin and $geoIntersects against a region given either in the {@code $geometry} form or in one of the
 * legacy shape forms such as {@code $box}.
 */
public final class GeoMatchExpression extends LeafMatchExpression {
    public static final String GEOMETRY_OPERATOR = "$geometry";

    private final GeoPredicate predicate;
    private final BsonDocument region;

    public GeoMatchExpression(String path, GeoPredicate predicate, BsonDocument region) {
        super(MatchType.GEO, path);
        this.predicate = Objects.requireNonNull(predicate, "predicate must not be null");
        this.region = Objects.requireNonNull(region, "region must not be null");
    }

    public GeoPredicate getPredicate() {
        return predicate;
    }

    public BsonDocument getRegion() {
        return region;
    }

    /**
     * Returns true if the region is expressed with the {@code $geometry} operator.
     */
    public boolean usesGeometryOperator() {
        return region.isDocument(GEOMETRY_OPERATOR);
    }

    @Override
    public boolean equivalent(MatchExpression other) {
        if (!(other instanceof GeoMatchExpression geo)) {
            return false;
        }
        return getPath().equals(geo.getPath()) && predicate == geo.predicate && region.equals(geo.region);
    }

    @Override
    public BsonDocument serialize() {
        return serializeOperator(new BsonDocument(predicate.getOperatorName(), region));
    }

    public enum GeoPredicate {
        WITHIN("$geoWithin"),
        INTERSECT("$geoIntersects");

        private final String operatorName;

        GeoPredicate(String operatorName) {
            this.operatorName = operatorName;
        }

        public String getOperatorName() {
            return operatorName;
        }
    }
}
