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
import org.bson.BsonValue;

import java.util.Map;

/**
 * An aggregation-language expression wrapped by {@code $expr}.
 */
public interface AggregationExpression {

    void addDependencies(DependencyTracker deps);

    /**
     * Rewrites every field path this expression refers to, in place.
     */
    void applyRename(Map<String, String> renames);

    boolean equivalent(AggregationExpression other);

    BsonValue serialize();
}
