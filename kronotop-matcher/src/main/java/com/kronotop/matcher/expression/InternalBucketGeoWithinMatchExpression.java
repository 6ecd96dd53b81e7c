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
import org.bson.BsonString;

import java.util.Objects;

/**
 * Geo containment over a bucketed collection, where each record summarises many measurements. It reads the
 * data of the field and the control min/max bounds kept for it.
 */
public final class InternalBucketGeoWithinMatchExpression extends MatchExpression {
    public static final String OPERATOR_NAME = "$_internalBucketGeoWithin";
    public static final String WITHIN_REGION_FIELD = "withinRegion";
    public static final String FIELD_FIELD = "field";

    private final BsonDocument withinRegion;
    private final String field;

    public InternalBucketGeoWithinMatchExpression(BsonDocument withinRegion, String field) {
        super(MatchType.INTERNAL_BUCKET_GEO_WITHIN);
        this.withinRegion = Objects.requireNonNull(withinRegion, "withinRegion must not be null");
        this.field = Objects.requireNonNull(field, "field must not be null");
    }

    public BsonDocument getWithinRegion() {
        return withinRegion;
    }

    public String getField() {
        return field;
    }

    @Override
    public MatchCategory getCategory() {
        return MatchCategory.OTHER;
    }

    @Override
    public void addDependencies(DependencyTracker deps) {
        deps.addField("data." + field);
        deps.addField("control.min." + field);
        deps.addField("control.max." + field);
    }

    @Override
    public boolean equivalent(MatchExpression other) {
        if (!(other instanceof InternalBucketGeoWithinMatchExpression bucket)) {
            return false;
        }
        return field.equals(bucket.field) && withinRegion.equals(bucket.withinRegion);
    }

    @Override
    public BsonDocument serialize() {
        BsonDocument body = new BsonDocument(WITHIN_REGION_FIELD, withinRegion)
                .append(FIELD_FIELD, new BsonString(field));
        return new BsonDocument(OPERATOR_NAME, body);
    }
}
