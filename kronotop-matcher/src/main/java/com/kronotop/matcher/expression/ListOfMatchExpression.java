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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Base class of the n-ary connectives.
 */
public abstract sealed class ListOfMatchExpression extends LogicalMatchExpression
        permits AndMatchExpression, OrMatchExpression, NorMatchExpression, InternalSchemaXorMatchExpression {

    private final List<MatchExpression> expressions = new ArrayList<>();

    protected ListOfMatchExpression(MatchType matchType, List<? extends MatchExpression> children) {
        super(matchType);
        for (MatchExpression child : children) {
            add(child);
        }
    }

    /**
     * Attaches a parentless node as the last child.
     *
     * @throws IllegalStateException if the node already has a parent
     */
    public void add(MatchExpression child) {
        Objects.requireNonNull(child, "child must not be null");
        child.attachTo(this);
        expressions.add(child);
    }

    @Override
    public List<MatchExpression> getChildren() {
        return Collections.unmodifiableList(expressions);
    }

    /**
     * Moves every child out of this node. The node is left empty and the returned children have no parent,
     * so they can be attached to a new node.
     */
    public List<MatchExpression> releaseChildren() {
        List<MatchExpression> released = new ArrayList<>(expressions);
        expressions.clear();
        for (MatchExpression child : released) {
            child.detach();
        }
        return released;
    }

    protected abstract String operatorName();

    @Override
    public boolean equivalent(MatchExpression other) {
        if (other == this) {
            return true;
        }
        if (other.getMatchType() != getMatchType() || other.numChildren() != numChildren()) {
            return false;
        }
        for (int i = 0; i < expressions.size(); i++) {
            if (!expressions.get(i).equivalent(other.getChild(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public BsonDocument serialize() {
        BsonArray array = new BsonArray();
        for (MatchExpression child : expressions) {
            array.add(child.serialize());
        }
        return new BsonDocument(operatorName(), array);
    }
}
