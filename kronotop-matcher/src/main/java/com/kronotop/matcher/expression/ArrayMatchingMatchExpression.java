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

import java.util.Objects;

/**
 * Predicates over an array field as a whole. Their sub-predicates are relative to the array elements, so the
 * path of an array-matching node cannot be rewritten independently of them.
 */
public abstract sealed class ArrayMatchingMatchExpression extends MatchExpression
        permits SizeMatchExpression, ElemMatchObjectMatchExpression, ElemMatchValueMatchExpression {

    private final String path;

    protected ArrayMatchingMatchExpression(MatchType matchType, String path) {
        super(matchType);
        this.path = Objects.requireNonNull(path, "path must not be null");
    }

    @Override
    public MatchCategory getCategory() {
        return MatchCategory.ARRAY_MATCHING;
    }

    @Override
    public String getPath() {
        return path;
    }

    @Override
    public void addDependencies(DependencyTracker deps) {
        deps.addField(path);
    }

    @Override
    public boolean equivalent(MatchExpression other) {
        if (other == this) {
            return true;
        }
        if (other.getMatchType() != getMatchType() || !path.equals(other.getPath())) {
            return false;
        }
        if (other.numChildren() != numChildren()) {
            return false;
        }
        for (int i = 0; i < numChildren(); i++) {
            if (!getChild(i).equivalent(other.getChild(i))) {
                return false;
            }
        }
        return equivalentPayload((ArrayMatchingMatchExpression) other);
    }

    protected boolean equivalentPayload(ArrayMatchingMatchExpression other) {
        return true;
    }
}
