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

import java.util.List;
import java.util.Objects;

public final class NotMatchExpression extends LogicalMatchExpression {
    private final MatchExpression child;

    public NotMatchExpression(MatchExpression child) {
        super(MatchType.NOT);
        Objects.requireNonNull(child, "child must not be null");
        child.attachTo(this);
        this.child = child;
    }

    @Override
    public List<MatchExpression> getChildren() {
        return List.of(child);
    }

    @Override
    public boolean equivalent(MatchExpression other) {
        if (other == this) {
            return true;
        }
        return other.getMatchType() == MatchType.NOT && child.equivalent(other.getChild(0));
    }

    @Override
    public BsonDocument serialize() {
        return new BsonDocument("$not", child.serialize());
    }
}
