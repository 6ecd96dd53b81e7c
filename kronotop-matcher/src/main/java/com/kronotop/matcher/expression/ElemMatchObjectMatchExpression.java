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

/**
 * {@code {path: {$elemMatch: {...}}}} where the sub-predicate addresses fields of each array element.
 */
public final class ElemMatchObjectMatchExpression extends ArrayMatchingMatchExpression {
    private final MatchExpression sub;

    public ElemMatchObjectMatchExpression(String path, MatchExpression sub) {
        super(MatchType.ELEM_MATCH_OBJECT, path);
        Objects.requireNonNull(sub, "sub must not be null");
        sub.attachTo(this);
        this.sub = sub;
    }

    @Override
    public List<MatchExpression> getChildren() {
        return List.of(sub);
    }

    @Override
    public BsonDocument serialize() {
        return new BsonDocument(getPath(), new BsonDocument("$elemMatch", sub.serialize()));
    }
}
