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
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonValue;

import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * An operator applied to a list of operands, e.g. {@code {$eq: ["$a", 5]}}.
 */
public final class OperatorExpression implements AggregationExpression {
    private final String operator;
    private final List<AggregationExpression> operands;

    public OperatorExpression(String operator, List<? extends AggregationExpression> operands) {
        Objects.requireNonNull(operator, "operator must not be null");
        checkArgument(operator.startsWith("$"), "operator name must start with '$': %s", operator);
        this.operator = operator;
        this.operands = List.copyOf(operands);
    }

    public OperatorExpression(String operator, AggregationExpression... operands) {
        this(operator, List.of(operands));
    }

    public String getOperator() {
        return operator;
    }

    public List<AggregationExpression> getOperands() {
        return operands;
    }

    @Override
    public void addDependencies(DependencyTracker deps) {
        for (AggregationExpression operand : operands) {
            operand.addDependencies(deps);
        }
    }

    @Override
    public void applyRename(Map<String, String> renames) {
        for (AggregationExpression operand : operands) {
            operand.applyRename(renames);
        }
    }

    @Override
    public boolean equivalent(AggregationExpression other) {
        if (!(other instanceof OperatorExpression that)) {
            return false;
        }
        if (!operator.equals(that.operator) || operands.size() != that.operands.size()) {
            return false;
        }
        for (int i = 0; i < operands.size(); i++) {
            if (!operands.get(i).equivalent(that.operands.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public BsonValue serialize() {
        BsonArray array = new BsonArray();
        for (AggregationExpression operand : operands) {
            array.add(operand.serialize());
        }
        return new BsonDocument(operator, array);
    }
}
