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

import org.bson.BsonValue;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * $eq, $lt, $lte, $gt and $gte.
 */
public final class ComparisonMatchExpression extends ComparisonMatchExpressionBase {

    public ComparisonMatchExpression(MatchType matchType, String path, BsonValue data) {
        super(checkComparison(matchType), path, data);
    }

    public static ComparisonMatchExpression eq(String path, BsonValue data) {
        return new ComparisonMatchExpression(MatchType.EQ, path, data);
    }

    public static ComparisonMatchExpression lt(String path, BsonValue data) {
        return new ComparisonMatchExpression(MatchType.LT, path, data);
    }

    public static ComparisonMatchExpression lte(String path, BsonValue data) {
        return new ComparisonMatchExpression(MatchType.LTE, path, data);
    }

    public static ComparisonMatchExpression gt(String path, BsonValue data) {
        return new ComparisonMatchExpression(MatchType.GT, path, data);
    }

    public static ComparisonMatchExpression gte(String path, BsonValue data) {
        return new ComparisonMatchExpression(MatchType.GTE, path, data);
    }

    private static MatchType checkComparison(MatchType matchType) {
        checkArgument(matchType.isComparison(), "not a comparison type: %s", matchType);
        return matchType;
    }

    @Override
    protected String operatorName() {
        return switch (getMatchType()) {
            case EQ -> "$eq";
            case LT -> "$lt";
            case LTE -> "$lte";
            case GT -> "$gt";
            case GTE -> "$gte";
            default -> throw new IllegalStateException("Unexpected value: " + getMatchType());
        };
    }
}
