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

import com.kronotop.matcher.values.Collation;
import org.bson.BsonDocument;
import org.bson.BsonType;
import org.bson.BsonValue;

import javax.annotation.Nullable;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A leaf comparing the field value against a constant. The constant is never undefined.
 */
public abstract sealed class ComparisonMatchExpressionBase extends LeafMatchExpression
        permits ComparisonMatchExpression, InternalExprComparisonMatchExpression {

    private final BsonValue data;
    @Nullable
    private Collation collation;

    protected ComparisonMatchExpressionBase(MatchType matchType, String path, BsonValue data) {
        super(matchType, path);
        Objects.requireNonNull(data, "data must not be null");
        checkArgument(data.getBsonType() != BsonType.UNDEFINED, "cannot compare to undefined");
        this.data = data;
    }

    public BsonValue getData() {
        return data;
    }

    public ComparisonKind getComparisonKind() {
        return Objects.requireNonNull(getMatchType().comparisonKind());
    }

    /**
     * Returns the collation this comparison is evaluated with, or null for the simple binary ordering.
     * The collation is borrowed from the query context.
     */
    @Nullable
    public Collation getCollation() {
        return collation;
    }

    public void setCollation(@Nullable Collation collation) {
        this.collation = collation;
    }

    protected abstract String operatorName();

    @Override
    public boolean equivalent(MatchExpression other) {
        if (other == this) {
            return true;
        }
        if (!(other instanceof ComparisonMatchExpressionBase comparison)) {
            return false;
        }
        return getMatchType() == comparison.getMatchType()
                && getPath().equals(comparison.getPath())
                && Collation.matches(collation, comparison.collation)
                && data.equals(comparison.data);
    }

    @Override
    public BsonDocument serialize() {
        return serializeOperator(new BsonDocument(operatorName(), data));
    }
}
