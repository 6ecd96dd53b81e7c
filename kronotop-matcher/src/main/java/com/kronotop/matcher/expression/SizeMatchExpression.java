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

public final class SizeMatchExpression extends ArrayMatchingMatchExpression {
    private final int size;

    public SizeMatchExpression(String path, int size) {
        super(MatchType.SIZE, path);
        checkArgument(size >= 0, "$size must be non-negative: %s", size);
        this.size = size;
    }

    public int getSize() {
        return size;
    }

    @Override
    protected boolean equivalentPayload(ArrayMatchingMatchExpression other) {
        return size == ((SizeMatchExpression) other).size;
    }

    @Override
    public BsonDocument serialize() {
        return new BsonDocument(getPath(), new BsonDocument("$size", new BsonInt32(size)));
    }
}
