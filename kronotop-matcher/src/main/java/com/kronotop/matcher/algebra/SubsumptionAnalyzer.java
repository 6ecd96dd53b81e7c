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

import com.kronotop.matcher.Invariants;
import com.kronotop.matcher.expression.ComparisonMatchExpression;
import com.kronotop.matcher.expression.ExistsMatchExpression;
import com.kronotop.matcher.expression.GeoMatchExpression;
import com.kronotop.matcher.expression.InMatchExpression;
import com.kronotop.matcher.expression.InternalBucketGeoWithinMatchExpression;
import com.kronotop.matcher.expression.InternalExprComparisonMatchExpression;
import com.kronotop.matcher.expression.MatchExpression;
import com.kronotop.matcher.expression.MatchType;
import com.kronotop.matcher.geo.GeometryOracle;
import com.kronotop.matcher.values.ValueComparator;
import org.bson.BsonDocument;
import org.bson.BsonValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Decides whether every record matched by one predicate tree is also matched by another.
 * <p>
 * The test is sound but incomplete: a true answer is always correct, while false only means that no rule
 * proved the relation. Rules are tried in a fixed order and the first applicable one decides:
 * <ol>
 *   <li>structurally equivalent trees</li>
 *   <li>rhs is $or: lhs is a subset of at least one disjunct</li>
 *   <li>rhs is $and: lhs is a subset of every conjunct</li>
 *   <li>lhs is $and: at least one conjunct is a subset of rhs</li>
 *   <li>lhs is $or: every disjunct is a subset of rhs</li>
 *   <li>bucketed $geoWithin on both sides</li>
 *   <li>$geoWithin on lhs, any geo predicate on rhs: the rhs region contains the lhs geometry</li>
 *   <li>leaf tests, chosen by the kind of rhs</li>
 * </ol>
 * Decomposing rhs before lhs matters: {@code {a: 5, b: 5}} is a subset of
 * {@code {$or: [{a: 3}, {$and: [{a: 5}, {b: 5}]}]}} only because the $or is opened first.
 */
public class SubsumptionAnalyzer {
    private static final Logger LOGGER = LoggerFactory.getLogger(SubsumptionAnalyzer.class);

    private final GeometryOracle geometryOracle;
    private final LeafSubsumption leaves;

    public SubsumptionAnalyzer(ValueComparator comparator, GeometryOracle geometryOracle) {
        this.geometryOracle = Objects.requireNonNull(geometryOracle, "geometryOracle must not be null");
        this.leaves = new LeafSubsumption(comparator);
    }

    public boolean isSubsetOf(MatchExpression lhs, MatchExpression rhs) {
        Invariants.invariant(lhs != null, "lhs of a subset test must not be null");
        Invariants.invariant(rhs != null, "rhs of a subset test must not be null");

        if (lhs.equivalent(rhs)) {
            return decided(1, lhs, rhs, true);
        }

        if (rhs.getMatchType() == MatchType.OR) {
            for (MatchExpression disjunct : rhs.getChildren()) {
                if (isSubsetOf(lhs, disjunct)) {
                    return decided(2, lhs, rhs, true);
                }
            }
            return decided(2, lhs, rhs, false);
        }

        if (rhs.getMatchType() == MatchType.AND) {
            for (MatchExpression conjunct : rhs.getChildren()) {
                if (!isSubsetOf(lhs, conjunct)) {
                    return decided(3, lhs, rhs, false);
                }
            }
            return decided(3, lhs, rhs, true);
        }

        if (lhs.getMatchType() == MatchType.AND) {
            for (MatchExpression conjunct : lhs.getChildren()) {
                if (isSubsetOf(conjunct, rhs)) {
                    return decided(4, lhs, rhs, true);
                }
            }
            return decided(4, lhs, rhs, false);
        }

        if (lhs.getMatchType() == MatchType.OR) {
            for (MatchExpression disjunct : lhs.getChildren()) {
                if (!isSubsetOf(disjunct, rhs)) {
                    return decided(5, lhs, rhs, false);
                }
            }
            return decided(5, lhs, rhs, true);
        }

        if (lhs instanceof InternalBucketGeoWithinMatchExpression lhsBucket
                && rhs instanceof InternalBucketGeoWithinMatchExpression rhsBucket) {
            return decided(6, lhs, rhs, isSubsetOf(lhsBucket, rhsBucket));
        }

        if (lhs instanceof GeoMatchExpression lhsGeo && rhs instanceof GeoMatchExpression rhsGeo) {
            if (lhsGeo.getPredicate() == GeoMatchExpression.GeoPredicate.WITHIN
                    && lhsGeo.usesGeometryOperator()
                    && lhsGeo.getPath().equals(rhsGeo.getPath())) {
                // Every point of the lhs geometry has to satisfy rhs, so only containment proves it,
                // for $geoIntersects as well.
                BsonDocument geometry = lhsGeo.getRegion().getDocument(GeoMatchExpression.GEOMETRY_OPERATOR);
                return decided(7, lhs, rhs, geometryOracle.contains(rhsGeo.getRegion(), geometry));
            }
        }

        return decided(8, lhs, rhs, isSubsetOfLeaf(lhs, rhs));
    }

    private boolean isSubsetOfLeaf(MatchExpression lhs, MatchExpression rhs) {
        MatchType rhsType = rhs.getMatchType();
        if (rhsType.isComparison()) {
            return leaves.isSubsetOfComparison(lhs, (ComparisonMatchExpression) rhs);
        }
        if (rhsType.isInternalExprComparison()) {
            return leaves.isSubsetOfInternalExpr(lhs, (InternalExprComparisonMatchExpression) rhs);
        }
        if (rhsType == MatchType.EXISTS) {
            return leaves.isSubsetOfExists(lhs, (ExistsMatchExpression) rhs);
        }
        if (rhsType == MatchType.MATCH_IN) {
            return isSubsetOfIn(lhs, (InMatchExpression) rhs);
        }
        return false;
    }

    // lhs must collapse into one of the values rhs allows.
    private boolean isSubsetOfIn(MatchExpression lhs, InMatchExpression rhs) {
        if (rhs.hasRegex()) {
            return false;
        }
        for (BsonValue member : rhs.getEqualities()) {
            ComparisonMatchExpression equality = ComparisonMatchExpression.eq(rhs.getPath(), member);
            equality.setCollation(rhs.getCollation());
            if (isSubsetOf(lhs, equality)) {
                return true;
            }
        }
        return false;
    }

    /**
     * The lhs region is read back from its serialized form, which is how the predicate travels between
     * planner stages.
     */
    private boolean isSubsetOf(InternalBucketGeoWithinMatchExpression lhs, InternalBucketGeoWithinMatchExpression rhs) {
        BsonDocument serialized = lhs.serialize().getDocument(InternalBucketGeoWithinMatchExpression.OPERATOR_NAME);
        BsonValue field = serialized.get(InternalBucketGeoWithinMatchExpression.FIELD_FIELD);
        if (field == null || !field.isString() || !field.asString().getValue().equals(rhs.getField())) {
            return false;
        }
        if (!serialized.isDocument(InternalBucketGeoWithinMatchExpression.WITHIN_REGION_FIELD)) {
            return false;
        }
        BsonDocument region = serialized.getDocument(InternalBucketGeoWithinMatchExpression.WITHIN_REGION_FIELD);
        if (!region.isDocument(GeoMatchExpression.GEOMETRY_OPERATOR)) {
            return false;
        }
        return geometryOracle.contains(rhs.getWithinRegion(), region.getDocument(GeoMatchExpression.GEOMETRY_OPERATOR));
    }

    private static boolean decided(int step, MatchExpression lhs, MatchExpression rhs, boolean result) {
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("Rule {} decided {} for {} against {}", step, result, lhs, rhs);
        }
        return result;
    }
}
