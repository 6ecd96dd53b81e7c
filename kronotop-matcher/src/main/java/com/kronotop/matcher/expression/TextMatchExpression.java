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
import org.bson.BsonString;

import java.util.Objects;

public final class TextMatchExpression extends MatchExpression {
    private final String search;

    public TextMatchExpression(String search) {
        super(MatchType.TEXT);
        this.search = Objects.requireNonNull(search, "search must not be null");
    }

    public String getSearch() {
        return search;
    }

    @Override
    public MatchCategory getCategory() {
        return MatchCategory.OTHER;
    }

    @Override
    public void addDependencies(DependencyTracker deps) {
        // Text search reads every indexed string of the record.
        deps.setNeedWholeDocument(true);
    }

    @Override
    public boolean equivalent(MatchExpression other) {
        return other instanceof TextMatchExpression text && search.equals(text.search);
    }

    @Override
    public BsonDocument serialize() {
        return new BsonDocument("$text", new BsonDocument("$search", new BsonString(search)));
    }
}
