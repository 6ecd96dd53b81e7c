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
import org.bson.BsonInt32;
import org.bson.BsonType;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * $type, matching any of a set of BSON types.
 */
public final class TypeMatchExpression extends LeafMatchExpression {
    private final Set<BsonType> types;

    public TypeMatchExpression(String path, Set<BsonType> types) {
        super(MatchType.TYPE_OPERATOR, path);
        checkArgument(!types.isEmpty(), "$type requires at least one type");
        this.types = Collections.unmodifiableSet(EnumSet.copyOf(types));
    }

    public Set<BsonType> getTypes() {
        return types;
    }

    @Override
    public boolean equivalent(MatchExpression other) {
        if (!(other instanceof TypeMatchExpression type)) {
            return false;
        }
        return getPath().equals(type.getPath()) && types.equals(type.types);
    }

    @Override
    public BsonDocument serialize() {
        if (types.size() == 1) {
            BsonType type = types.iterator().next();
            return serializeOperator(new BsonDocument("$type", new BsonInt32(type.getValue())));
        }
        BsonArray codes = new BsonArray();
        for (BsonType type : types) {
            codes.add(new BsonInt32(type.getValue()));
        }
        return serializeOperator(new BsonDocument("$type", codes));
    }
}
