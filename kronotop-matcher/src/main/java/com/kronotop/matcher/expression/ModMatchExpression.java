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

import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonInt64;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

public final class ModMatchExpression extends LeafMatchExpression {
    private final long divisor;
    private final long remainder;

    public ModMatchExpression(String path, long divisor, long remainder) {
        super(MatchType.MOD, path);
        checkArgument(divisor != 0, "divisor cannot be 0");
        this.divisor = divisor;
        this.remainder = remainder;
    }

    public long getDivisor() {
        return divisor;
    }

    public long getRemainder() {
        return remainder;
    }

    @Override
    public boolean equivalent(MatchExpression other) {
        if (!(other instanceof ModMatchExpression mod)) {
            return false;
        }
        return getPath().equals(mod.getPath()) && divisor == mod.divisor && remainder == mod.remainder;
    }

    @Override
    public BsonDocument serialize() {
        BsonArray operands = new BsonArray(List.of(new BsonInt64(divisor), new BsonInt64(remainder)));
        return serializeOperator(new BsonDocument("$mod", operands));
    }
}
