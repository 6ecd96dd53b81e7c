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

import javax.annotation.Nullable;

public enum MatchType {
    // Logical
    AND,
    OR,
    NOR,
    NOT,
    INTERNAL_SCHEMA_XOR,

    // Comparisons
    EQ(ComparisonKind.EQ, false),
    LT(ComparisonKind.LT, false),
    LTE(ComparisonKind.LTE, false),
    GT(ComparisonKind.GT, false),
    GTE(ComparisonKind.GTE, false),
    INTERNAL_EXPR_EQ(ComparisonKind.EQ, true),
    INTERNAL_EXPR_LT(ComparisonKind.LT, true),
    INTERNAL_EXPR_LTE(ComparisonKind.LTE, true),
    INTERNAL_EXPR_GT(ComparisonKind.GT, true),
    INTERNAL_EXPR_GTE(ComparisonKind.GTE, true),

    // Other leaves
    MATCH_IN,
    EXISTS,
    REGEX,
    MOD,
    TYPE_OPERATOR,
    GEO,

    // Array matching
    SIZE,
    ELEM_MATCH_OBJECT,
    ELEM_MATCH_VALUE,

    // Everything else
    EXPRESSION,
    INTERNAL_BUCKET_GEO_WITHIN,
    TEXT,
    ALWAYS_TRUE,
    ALWAYS_FALSE;

    @Nullable
    private final ComparisonKind comparisonKind;
    private final boolean internalExpr;

    MatchType() {
        this(null, false);
    }

    MatchType(@Nullable ComparisonKind comparisonKind, boolean internalExpr) {
        this.comparisonKind = comparisonKind;
        this.internalExpr = internalExpr;
    }

    /**
     * Returns the ordering relation of a comparison type, or null for any other type.
     */
    @Nullable
    public ComparisonKind comparisonKind() {
        return comparisonKind;
    }

    /**
     * $eq, $lt, $lte, $gt and $gte.
     */
    public boolean isComparison() {
        return comparisonKind != null && !internalExpr;
    }

    /**
     * The $_internalExpr family of comparisons.
     */
    public boolean isInternalExprComparison() {
        return comparisonKind != null && internalExpr;
    }
}
