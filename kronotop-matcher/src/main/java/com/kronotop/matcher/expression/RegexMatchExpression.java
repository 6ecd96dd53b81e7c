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

public final class RegexMatchExpression extends LeafMatchExpression {
    private final String pattern;
    private final String options;

    public RegexMatchExpression(String path, String pattern, String options) {
        super(MatchType.REGEX, path);
        this.pattern = Objects.requireNonNull(pattern, "pattern must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    public RegexMatchExpression(String path, String pattern) {
        this(path, pattern, "");
    }

    public String getPattern() {
        return pattern;
    }

    public String getOptions() {
        return options;
    }

    @Override
    public boolean equivalent(MatchExpression other) {
        if (!(other instanceof RegexMatchExpression regex)) {
            return false;
        }
        return getPath().equals(regex.getPath()) && pattern.equals(regex.pattern) && options.equals(regex.options);
    }

    @Override
    public BsonDocument serialize() {
        BsonDocument operator = new BsonDocument("$regex", new BsonString(pattern));
        if (!options.isEmpty()) {
            operator.append("$options", new BsonString(options));
        }
        return serializeOperator(operator);
    }
}
