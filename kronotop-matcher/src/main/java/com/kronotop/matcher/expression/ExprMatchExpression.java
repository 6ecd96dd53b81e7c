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

import com.kronotop.matcher.expression.aggregation.AggregationExpression;
import org.bson.BsonDocument;

import java.util.Map;
import java.util.Objects;

/**
 * $expr, wrapping an aggregation expression. The wrapped expression knows its own field paths, so the node
 * can be renamed although it belongs to no renameable category.
 */
public final class ExprMatchExpression extends MatchExpression {
    private final AggregationExpression expression;

    public ExprMatchExpression(AggregationExpression expression) {
        super(MatchType.EXPRESSION);
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
    }

    public AggregationExpression getExpression() {
        return expression;
    }

    @Override
    public MatchCategory getCategory() {
        return MatchCategory.OTHER;
    }

    public void applyRename(Map<String, String> renames) {
        expression.applyRename(renames);
    }

    @Override
    public void addDependencies(DependencyTracker deps) {
        expression.addDependencies(deps);
    }

    @Override
    public boolean equivalent(MatchExpression other) {
        return other instanceof ExprMatchExpression expr && expression.equivalent(expr.expression);
    }

    @Override
    public BsonDocument serialize() {
        return new BsonDocument("$expr", expression.serialize());
    }
}
