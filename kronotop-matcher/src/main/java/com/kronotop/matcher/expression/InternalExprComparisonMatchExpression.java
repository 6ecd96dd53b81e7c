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
 * Comparisons produced by rewriting $expr into match language. Unlike {@link ComparisonMatchExpression}
 * they compare across types by the raw value ordering.
 */
public final class InternalExprComparisonMatchExpression extends ComparisonMatchExpressionBase {

    public InternalExprComparisonMatchExpression(MatchType matchType, String path, BsonValue data) {
        super(checkInternalExpr(matchType), path, data);
    }

    private static MatchType checkInternalExpr(MatchType matchType) {
        checkArgument(matchType.isInternalExprComparison(), "not an internal expression comparison: %s", matchType);
        return matchType;
    }

    @Override
    protected String operatorName() {
        return switch (getMatchType()) {
            case INTERNAL_EXPR_EQ -> "$_internalExprEq";
            case INTERNAL_EXPR_LT -> "$_internalExprLt";
            case INTERNAL_EXPR_LTE -> "$_internalExprLte";
            case INTERNAL_EXPR_GT -> "$_internalExprGt";
            case INTERNAL_EXPR_GTE -> "$_internalExprGte";
            default -> throw new IllegalStateException("Unexpected value: " + getMatchType());
        };
    }
}
