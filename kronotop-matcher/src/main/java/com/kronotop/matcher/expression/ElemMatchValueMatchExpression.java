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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@code {path: {$elemMatch: {$gt: 1, $lt: 5}}}}. The sub-predicates apply to the array elements themselves
 * and therefore carry an empty path.
 */
public final class ElemMatchValueMatchExpression extends ArrayMatchingMatchExpression {
    private final List<MatchExpression> subs = new ArrayList<>();

    public ElemMatchValueMatchExpression(String path, List<? extends MatchExpression> subs) {
        super(MatchType.ELEM_MATCH_VALUE, path);
        for (MatchExpression sub : subs) {
            sub.attachTo(this);
            this.subs.add(sub);
        }
    }

    @Override
    public List<MatchExpression> getChildren() {
        return Collections.unmodifiableList(subs);
    }

    @Override
    public BsonDocument serialize() {
        BsonDocument operators = new BsonDocument();
        for (MatchExpression sub : subs) {
            BsonDocument serialized = sub.serialize();
            if (serialized.isDocument("")) {
                operators.putAll(serialized.getDocument(""));
            } else {
                operators.putAll(serialized);
            }
        }
        return new BsonDocument(getPath(), new BsonDocument("$elemMatch", operators));
    }
}
