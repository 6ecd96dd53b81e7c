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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * A predicate on the value at a single field path. Leaves are the only nodes whose path can be renamed.
 */
public abstract sealed class LeafMatchExpression extends MatchExpression
        permits ComparisonMatchExpressionBase, InMatchExpression, ExistsMatchExpression, RegexMatchExpression,
        ModMatchExpression, TypeMatchExpression, GeoMatchExpression {

    private static final Logger LOGGER = LoggerFactory.getLogger(LeafMatchExpression.class);

    private String path;

    protected LeafMatchExpression(MatchType matchType, String path) {
        super(matchType);
        this.path = Objects.requireNonNull(path, "path must not be null");
    }

    @Override
    public MatchCategory getCategory() {
        return MatchCategory.LEAF;
    }

    @Override
    public String getPath() {
        return path;
    }

    /**
     * Rewrites the path with the rename entry that applies to it, if any.
     *
     * @see PathUtils#renamePath(String, Map)
     */
    public void applyRename(Map<String, String> renames) {
        if (path.isEmpty()) {
            return;
        }
        String rewritten = PathUtils.renamePath(path, renames);
        if (rewritten != null) {
            LOGGER.trace("Renaming {} path '{}' to '{}'", getMatchType(), path, rewritten);
            path = rewritten;
        }
    }

    @Override
    public void addDependencies(DependencyTracker deps) {
        if (!path.isEmpty()) {
            deps.addField(path);
        }
    }

    protected BsonDocument serializeOperator(BsonDocument operator) {
        return new BsonDocument(path, operator);
    }
}
