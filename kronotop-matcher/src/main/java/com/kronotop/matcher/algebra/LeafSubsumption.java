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

package com.kronotop.matcher.algebra;

import com.kronotop.matcher.expression.ComparisonKind;
import com.kronotop.matcher.expression.ComparisonMatchExpression;
import com.kronotop.matcher.expression.ComparisonMatchExpressionBase;
import com.kronotop.matcher.expression.ExistsMatchExpression;
import com.kronotop.matcher.expression.InMatchExpression;
import com.kronotop.matcher.expression.InternalExprComparisonMatchExpression;
import com.kronotop.matcher.expression.MatchExpression;
import com.kronotop.matcher.expression.MatchType;
import com.kronotop.matcher.values.Collation;
import com.kronotop.matcher.values.ValueComparator;
import org.bson.BsonValue;

import java.util.Objects;

/**
 * Subset tests between two leaf predicates. Every test answers false for leaves on different paths, and
 * false whenever the relation cannot be proven.
 */
public final class LeafSubsumption {
    private final ValueComparator comparator;

    public LeafSubsumption(ValueComparator comparator) {
        this.comparator = Objects.requireNonNull(comparator, "comparator must not be null");
    }

    /**
     * Tests {@code lhs} against a $eq, $lt, $lte, $gt or $gte predicate. A comparison or a regex-free $in is
     * accepted as the left side; for $in every member must be a subset on its own.
     */
    public boolean isSubsetOfComparison(MatchExpression lhs, ComparisonMatchExpression rhs) {
        if (!lhs.getPath().equals(rhs.getPath())) {
            return false;
        }
        if (lhs instanceof ComparisonMatchExpression comparison) {
            return isSubsetOf(comparison, rhs);
        }
        if (lhs instanceof InMatchExpression in) {
            if (in.hasRegex()) {
                return false;
            }
            for (BsonValue member : in.getEqualities()) {
                ComparisonMatchExpression equality = ComparisonMatchExpression.eq(in.getPath(), member);
                equality.setCollation(in.getCollation());
                if (!isSubsetOf(equality, rhs)) {
                    return false;
                }
            }
            return true;
        }
        return false;
    }

    public boolean isSubsetOfInternalExpr(MatchExpression lhs, InternalExprComparisonMatchExpression rhs) {
        if (lhs instanceof InternalExprComparisonMatchExpression internal) {
            return isSubsetOf(internal, rhs);
        }
        return false;
    }

    /**
     * Tests whether {@code lhs} can only match records in which the field of {@code rhs} exists.
     */
    public boolean isSubsetOfExists(MatchExpression lhs, ExistsMatchExpression rhs) {
        // A negation has no path of its own; its child is checked below.
        if (lhs.getMatchType() != MatchType.NOT && !lhs.getPath().equals(rhs.getPath())) {
            return false;
        }
        if (lhs instanceof ComparisonMatchExpression comparison) {
            return !comparison.getData().isNull();
        }
        switch (lhs.getMatchType()) {
            case ELEM_MATCH_VALUE:
            case ELEM_MATCH_OBJECT:
            case EXISTS:
            case GEO:
            case MOD:
            case REGEX:
            case SIZE:
            case TYPE_OPERATOR:
                return true;
            case MATCH_IN:
                return !((InMatchExpression) lhs).hasNull();
            case NOT:
                return isNegatedNullCheck(lhs.getChild(0), rhs.getPath());
            default:
                return false;
        }
    }

    // {$not: {a: null}} and {$not: {a: {$in: [null, ...]}}} both require 'a' to exist.
    private boolean isNegatedNullCheck(MatchExpression negated, String path) {
        if (!negated.getPath().equals(path)) {
            return false;
        }
        if (negated.getMatchType() == MatchType.EQ) {
            return ((ComparisonMatchExpression) negated).getData().isNull();
        }
        if (negated.getMatchType() == MatchType.MATCH_IN) {
            return ((InMatchExpression) negated).hasNull();
        }
        return false;
    }

    boolean isSubsetOf(ComparisonMatchExpression lhs, ComparisonMatchExpression rhs) {
        if (!lhs.getPath().equals(rhs.getPath())) {
            return false;
        }
        BsonValue lhsData = lhs.getData();
        BsonValue rhsData = rhs.getData();
        if (comparator.canonicalType(lhsData) != comparator.canonicalType(rhsData)) {
            return false;
        }
        // NaN is only equal to itself
        if (comparator.isNaN(lhsData) || comparator.isNaN(rhsData)) {
            if (lhs.getComparisonKind().supportsEquality() && rhs.getComparisonKind().supportsEquality()) {
                return comparator.isNaN(lhsData) && comparator.isNaN(rhsData);
            }
            return false;
        }
        return compareAndDecide(lhs, rhs);
    }

    boolean isSubsetOf(InternalExprComparisonMatchExpression lhs, InternalExprComparisonMatchExpression rhs) {
        if (!lhs.getPath().equals(rhs.getPath())) {
            return false;
        }
        return compareAndDecide(lhs, rhs);
    }

    private boolean compareAndDecide(ComparisonMatchExpressionBase lhs, ComparisonMatchExpressionBase rhs) {
        if (!Collation.matches(lhs.getCollation(), rhs.getCollation()) && comparator.isCollatable(lhs.getData())) {
            return false;
        }
        // Either collation works here: they match, or no string ordering is involved.
        int cmp = comparator.compare(lhs.getData(), rhs.getData(), rhs.getCollation());
        if (lhs.getMatchType() == rhs.getMatchType() && cmp == 0) {
            return true;
        }
        return tieBreak(lhs.getComparisonKind(), rhs.getComparisonKind(), cmp);
    }

    static boolean tieBreak(ComparisonKind lhs, ComparisonKind rhs, int cmp) {
        switch (rhs) {
            case LT:
            case LTE:
                if (lhs == ComparisonKind.LT || lhs == ComparisonKind.LTE || lhs == ComparisonKind.EQ) {
                    return rhs == ComparisonKind.LTE ? cmp <= 0 : cmp < 0;
                }
                return false;
            case GT:
            case GTE:
                if (lhs == ComparisonKind.GT || lhs == ComparisonKind.GTE || lhs == ComparisonKind.EQ) {
                    return rhs == ComparisonKind.GTE ? cmp >= 0 : cmp > 0;
                }
                return false;
            default:
                return false;
        }
    }
}
