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

package com.kronotop.matcher.expression.aggregation;

import com.kronotop.matcher.expression.DependencyTracker;
import org.bson.BsonDocument;
import org.bson.BsonValue;

import java.util.Map;
import java.util.Objects;

public final class ConstantExpression implements AggregationExpression {
    private final BsonValue value;

    public ConstantExpression(BsonValue value) {
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    public BsonValue getValue() {
        return value;
    }

    @Override
    public void addDependencies(DependencyTracker deps) {
    }

    @Override
    public void applyRename(Map<String, String> renames) {
    }

    @Override
    public boolean equivalent(AggregationExpression other) {
        return other instanceof ConstantExpression constant && value.equals(constant.value);
    }

    @Override
    public BsonValue serialize() {
        // Strings starting with '$' would read back as field paths.
        if (value.isString() && value.asString().getValue().startsWith("$")) {
            return new BsonDocument("$literal", value);
        }
        return value;
    }
}
