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

import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * A node of a predicate tree over BSON documents.
 * <p>
 * Every child is owned by exactly one parent. A node that already has a parent cannot be attached to
 * another one; logical nodes release their children explicitly before the children are re-attached
 * elsewhere (see {@link ListOfMatchExpression#releaseChildren()}).
 */
public abstract sealed class MatchExpression
        permits LogicalMatchExpression, LeafMatchExpression, ArrayMatchingMatchExpression,
        ExprMatchExpression, InternalBucketGeoWithinMatchExpression, TextMatchExpression,
        AlwaysBooleanMatchExpression {

    private final MatchType matchType;
    @Nullable
    private MatchExpression parent;

    protected MatchExpression(MatchType matchType) {
        this.matchType = Objects.requireNonNull(matchType, "matchType must not be null");
    }

    public MatchType getMatchType() {
        return matchType;
    }

    public abstract MatchCategory getCategory();

    /**
     * Returns the dotted field path this node applies to, or an empty string for nodes without a path.
     */
    public String getPath() {
        return "";
    }

    public List<MatchExpression> getChildren() {
        return List.of();
    }

    public int numChildren() {
        return getChildren().size();
    }

    public MatchExpression getChild(int index) {
        return getChildren().get(index);
    }

    @Nullable
    public MatchExpression getParent() {
        return parent;
    }

    final void attachTo(MatchExpression owner) {
        if (parent != null) {
            throw new IllegalStateException(matchType + " node is already owned by a " + parent.getMatchType() + " node");
        }
        parent = owner;
    }

    final void detach() {
        parent = null;
    }

    /**
     * Structural equivalence: same kind, same path, same payload and equivalent children in the same order.
     */
    public abstract boolean equivalent(MatchExpression other);

    public abstract BsonDocument serialize();

    /**
     * Adds the field paths this subtree reads to the given tracker.
     */
    public abstract void addDependencies(DependencyTracker deps);

    @Override
    public String toString() {
        return serialize().toJson();
    }
}
