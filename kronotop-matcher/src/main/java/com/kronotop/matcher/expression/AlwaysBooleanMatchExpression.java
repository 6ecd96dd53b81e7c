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
import org.bson.BsonInt32;

import static com.google.common.base.Preconditions.checkArgument;

public final class AlwaysBooleanMatchExpression extends MatchExpression {

    private AlwaysBooleanMatchExpression(MatchType matchType) {
        super(matchType);
        checkArgument(matchType == MatchType.ALWAYS_TRUE || matchType == MatchType.ALWAYS_FALSE);
    }

    public static AlwaysBooleanMatchExpression alwaysTrue() {
        return new AlwaysBooleanMatchExpression(MatchType.ALWAYS_TRUE);
    }

    public static AlwaysBooleanMatchExpression alwaysFalse() {
        return new AlwaysBooleanMatchExpression(MatchType.ALWAYS_FALSE);
    }

    @Override
    public MatchCategory getCategory() {
        return MatchCategory.OTHER;
    }

    @Override
    public void addDependencies(DependencyTracker deps) {
    }

    @Override
    public boolean equivalent(MatchExpression other) {
        return other.getMatchType() == getMatchType();
    }

    @Override
    public BsonDocument serialize() {
        String name = getMatchType() == MatchType.ALWAYS_TRUE ? "$alwaysTrue" : "$alwaysFalse";
        return new BsonDocument(name, new BsonInt32(1));
    }
}
