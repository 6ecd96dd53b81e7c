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

import com.kronotop.matcher.values.Collation;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonRegularExpression;
import org.bson.BsonType;
import org.bson.BsonValue;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * $in. Regular expression members are kept apart from the equality members; duplicate equalities are dropped.
 */
public final class InMatchExpression extends LeafMatchExpression {
    private final List<BsonValue> equalities;
    private final List<BsonRegularExpression> regexes;
    private final boolean hasNull;
    @Nullable
    private Collation collation;

    public InMatchExpression(String path, Collection<? extends BsonValue> members) {
        super(MatchType.MATCH_IN, path);
        Set<BsonValue> uniqueEqualities = new LinkedHashSet<>();
        List<BsonRegularExpression> regexMembers = new ArrayList<>();
        boolean nullFound = false;
        for (BsonValue member : members) {
            Objects.requireNonNull(member, "$in member must not be null");
            checkArgument(member.getBsonType() != BsonType.UNDEFINED, "$in cannot contain undefined");
            if (member.isRegularExpression()) {
                regexMembers.add(member.asRegularExpression());
                continue;
            }
            if (member.isNull()) {
                nullFound = true;
            }
            uniqueEqualities.add(member);
        }
        this.equalities = List.copyOf(uniqueEqualities);
        this.regexes = Collections.unmodifiableList(regexMembers);
        this.hasNull = nullFound;
    }

    public List<BsonValue> getEqualities() {
        return equalities;
    }

    public List<BsonRegularExpression> getRegexes() {
        return regexes;
    }

    public boolean hasRegex() {
        return !regexes.isEmpty();
    }

    public boolean hasNull() {
        return hasNull;
    }

    @Nullable
    public Collation getCollation() {
        return collation;
    }

    public void setCollation(@Nullable Collation collation) {
        this.collation = collation;
    }

    @Override
    public boolean equivalent(MatchExpression other) {
        if (other == this) {
            return true;
        }
        if (!(other instanceof InMatchExpression in)) {
            return false;
        }
        return getPath().equals(in.getPath())
                && Collation.matches(collation, in.collation)
                && new HashSet<>(equalities).equals(new HashSet<>(in.equalities))
                && new HashSet<>(regexes).equals(new HashSet<>(in.regexes));
    }

    @Override
    public BsonDocument serialize() {
        BsonArray members = new BsonArray(new ArrayList<>(equalities));
        members.addAll(regexes);
        return serializeOperator(new BsonDocument("$in", members));
    }
}
