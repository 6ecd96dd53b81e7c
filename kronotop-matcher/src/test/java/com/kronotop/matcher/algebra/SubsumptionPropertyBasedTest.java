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

import com.kronotop.matcher.expression.MatchExpression;
import com.kronotop.matcher.expression.MatchExpressionParser;
import com.kronotop.matcher.geo.PlanarBoxGeometryOracle;
import com.kronotop.matcher.values.BsonValueComparator;
import org.bson.BsonDocument;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Property-based testing of the subset test using randomized queries and documents.
 */
class SubsumptionPropertyBasedTest {
    private static final int DOCUMENTS_PER_PAIR = 200;

    private final MatchExpressionGenerator generator = new MatchExpressionGenerator();
    private final SubsumptionAnalyzer analyzer =
            new SubsumptionAnalyzer(BsonValueComparator.INSTANCE, PlanarBoxGeometryOracle.INSTANCE);

    @RepeatedTest(200)
    @DisplayName("Every tree is a subset of itself")
    void shouldBeReflexive() {
        String query = generator.generateRandomQuery();
        MatchExpression tree = MatchExpressionParser.parse(query);
        assertTrue(analyzer.isSubsetOf(tree, tree), "Not reflexive: " + query);
        assertTrue(analyzer.isSubsetOf(tree, MatchExpressionParser.parse(query)), "Not reflexive: " + query);
    }

    @RepeatedTest(500)
    @DisplayName("A proven subset never matches a document its superset rejects")
    void shouldBeSound() {
        String lhsQuery = generator.generateRandomQuery();
        String rhsQuery = generator.generateRandomQuery();
        MatchExpression lhs = MatchExpressionParser.parse(lhsQuery);
        MatchExpression rhs = MatchExpressionParser.parse(rhsQuery);

        if (!analyzer.isSubsetOf(lhs, rhs)) {
            return;
        }
        for (int i = 0; i < DOCUMENTS_PER_PAIR; i++) {
            BsonDocument document = generator.generateDocument();
            if (DocumentMatcher.matches(lhs, document)) {
                assertTrue(DocumentMatcher.matches(rhs, document),
                        String.format("%s is reported as a subset of %s but %s only matches the former",
                                lhsQuery, rhsQuery, document.toJson()));
            }
        }
    }

    @RepeatedTest(200)
    @DisplayName("A single-field conjunct of an $and is a superset of the $and")
    void shouldAcceptConjunctsAsSupersets() {
        // An $or on the right is opened first and may hide the conjunct, so only single selectors are used
        String first = generator.generateSimpleQuery();
        String second = generator.generateSimpleQuery();
        MatchExpression conjunction = MatchExpressionParser.parse("{$and: [" + first + ", " + second + "]}");

        assertTrue(analyzer.isSubsetOf(conjunction, MatchExpressionParser.parse(first)));
        assertTrue(analyzer.isSubsetOf(conjunction, MatchExpressionParser.parse(second)));
    }

    @RepeatedTest(200)
    @DisplayName("Any disjunct of an $or is a subset of the $or")
    void shouldAcceptDisjunctsAsSubsets() {
        String first = generator.generateRandomQuery();
        String second = generator.generateRandomQuery();
        MatchExpression disjunction = MatchExpressionParser.parse("{$or: [" + first + ", " + second + "]}");

        assertTrue(analyzer.isSubsetOf(MatchExpressionParser.parse(first), disjunction));
        assertTrue(analyzer.isSubsetOf(MatchExpressionParser.parse(second), disjunction));
    }
}
