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

import com.kronotop.matcher.InvariantViolationError;
import com.kronotop.matcher.expression.AndMatchExpression;
import com.kronotop.matcher.expression.MatchExpression;
import com.kronotop.matcher.expression.MatchExpressionParser;
import com.kronotop.matcher.expression.MatchType;
import org.bson.BsonDocument;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionSplitterTest {

    private static SplitResult splitBy(String query, Set<String> fields) {
        return ExpressionSplitter.splitBy(MatchExpressionParser.parse(query), fields, Map.of());
    }

    private static void assertSerialized(String expected, MatchExpression actual) {
        assertNotNull(actual);
        assertEquals(BsonDocument.parse(expected), actual.serialize());
    }

    @Nested
    @DisplayName("Atomic nodes")
    class AtomicTests {

        @Test
        @DisplayName("An independent tree is extracted whole")
        void testWholeTreeExtracted() {
            MatchExpression tree = MatchExpressionParser.parse("{$or: [{a: 1}, {b: 1}]}");
            SplitResult result = ExpressionSplitter.splitBy(tree, Set.of("c"), Map.of());
            assertSame(tree, result.extracted());
            assertFalse(result.hasRemaining());
        }

        @Test
        @DisplayName("A dependent leaf stays")
        void testDependentLeaf() {
            MatchExpression tree = MatchExpressionParser.parse("{a: 1}");
            SplitResult result = ExpressionSplitter.splitBy(tree, Set.of("a"), Map.of());
            assertFalse(result.hasExtracted());
            assertSame(tree, result.remaining());
        }

        @Test
        @DisplayName("$or, $not and $_internalSchemaXor are never split")
        void testUnsplittableConnectives() {
            SplitResult or = splitBy("{$or: [{a: 1}, {b: 1}]}", Set.of("b"));
            assertFalse(or.hasExtracted());
            assertSerialized("{$or: [{a: {$eq: 1}}, {b: {$eq: 1}}]}", or.remaining());

            SplitResult not = splitBy("{a: {$not: {$gt: 1}}}", Set.of("a"));
            assertFalse(not.hasExtracted());
            assertEquals(MatchType.NOT, not.remaining().getMatchType());

            SplitResult xor = splitBy("{$_internalSchemaXor: [{a: 1}, {b: 1}]}", Set.of("a"));
            assertFalse(xor.hasExtracted());
            assertEquals(MatchType.INTERNAL_SCHEMA_XOR, xor.remaining().getMatchType());
        }

        @Test
        @DisplayName("Array-matching nodes are never extracted by independence")
        void testArrayMatching() {
            SplitResult result = splitBy("{a: {$size: 1}, b: 1}", Set.of("b"));
            assertFalse(result.hasExtracted());
            assertEquals(MatchType.AND, result.remaining().getMatchType());
        }
    }

    @Nested
    @DisplayName("$and")
    class AndTests {

        @Test
        void testConjunctsArePartitioned() {
            SplitResult result = splitBy("{a: 1, b: 2, c: 3}", Set.of("b"));
            assertSerialized("{$and: [{a: {$eq: 1}}, {c: {$eq: 3}}]}", result.extracted());
            assertSerialized("{b: {$eq: 2}}", result.remaining());
        }

        @Test
        @DisplayName("Single-child sides collapse to the child")
        void testCollapse() {
            SplitResult result = splitBy("{a: 1, b: 2}", Set.of("b"));
            assertEquals(MatchType.EQ, result.extracted().getMatchType());
            assertEquals(MatchType.EQ, result.remaining().getMatchType());
            assertNull(result.extracted().getParent());
            assertNull(result.remaining().getParent());
        }

        @Test
        @DisplayName("Nested $and nodes are split recursively")
        void testNestedAnd() {
            SplitResult result = splitBy("{$and: [{a: 1}, {$and: [{b: 1}, {c: 1}]}, {$or: [{a: 2}, {c: 2}]}]}",
                    Set.of("c"));
            assertSerialized("{$and: [{a: {$eq: 1}}, {b: {$eq: 1}}]}", result.extracted());
            assertSerialized("{$and: [{c: {$eq: 1}}, {$or: [{a: {$eq: 2}}, {c: {$eq: 2}}]}]}", result.remaining());
        }

        @Test
        @DisplayName("The input $and is consumed")
        void testInputConsumed() {
            AndMatchExpression tree = (AndMatchExpression) MatchExpressionParser.parse("{a: 1, b: 2}");
            ExpressionSplitter.splitBy(tree, Set.of("b"), Map.of());
            assertEquals(0, tree.numChildren());
        }
    }

    @Nested
    @DisplayName("$nor")
    class NorTests {

        @Test
        @DisplayName("Clauses move whole and are never decomposed")
        void testNorAtomicity() {
            SplitResult result = splitBy("{$nor: [{a: 1}, {$and: [{a: 1}, {b: 1}]}]}", Set.of("b"));
            assertSerialized("{$nor: [{a: {$eq: 1}}]}", result.extracted());
            assertSerialized("{$nor: [{$and: [{a: {$eq: 1}}, {b: {$eq: 1}}]}]}", result.remaining());
        }

        @Test
        @DisplayName("A single surviving clause stays a $nor")
        void testSingleClauseNor() {
            SplitResult result = splitBy("{$nor: [{a: 1}, {b: 1}]}", Set.of("b"));
            assertEquals(MatchType.NOR, result.extracted().getMatchType());
            assertEquals(1, result.extracted().numChildren());
            assertEquals(MatchType.NOR, result.remaining().getMatchType());
        }

        @Test
        void testNoIndependentClause() {
            SplitResult result = splitBy("{$nor: [{a: 1}, {'a.b': 1}]}", Set.of("a"));
            assertFalse(result.hasExtracted());
            assertEquals(2, result.remaining().numChildren());
        }
    }

    @Nested
    @DisplayName("Renames")
    class RenameTests {

        @Test
        @DisplayName("Only the extracted side is renamed")
        void testRenameExtractedOnly() {
            MatchExpression tree = MatchExpressionParser.parse("{a: 1, 'b.c': 2, d: 3}");
            SplitResult result = ExpressionSplitter.splitBy(tree, Set.of("d"), Map.of("a", "x", "b", "y"));
            assertSerialized("{$and: [{x: {$eq: 1}}, {'y.c': {$eq: 2}}]}", result.extracted());
            assertSerialized("{d: {$eq: 3}}", result.remaining());
        }

        @Test
        void testRenameInsideExpr() {
            MatchExpression tree = MatchExpressionParser.parse("{$expr: {$eq: ['$a', 1]}, b: 2}");
            SplitResult result = ExpressionSplitter.splitBy(tree, Set.of("b"), Map.of("a", "z"));
            assertSerialized("{$expr: {$eq: ['$z', 1]}}", result.extracted());
        }
    }

    @Nested
    @DisplayName("Custom predicates")
    class CustomPredicateTests {

        @Test
        void testIsOnlyDependentOn() {
            MatchExpression tree = MatchExpressionParser.parse("{a: 1, b: 2, 'a.c': 3}");
            SplitResult result = ExpressionSplitter.splitBy(tree, Set.of("a"), Map.of(),
                    DependencyAnalyzer::isOnlyDependentOn);
            assertSerialized("{$and: [{a: {$eq: 1}}, {'a.c': {$eq: 3}}]}", result.extracted());
            assertSerialized("{b: {$eq: 2}}", result.remaining());
        }

        @Test
        @DisplayName("A split with neither side is an invariant violation")
        void testEmptyResult() {
            MatchExpression empty = new AndMatchExpression();
            assertThrows(InvariantViolationError.class,
                    () -> ExpressionSplitter.split(empty, Set.of(), (expression, fields) -> false));
        }

        @Test
        @DisplayName("Only root nodes can be split")
        void testAttachedNode() {
            AndMatchExpression tree = (AndMatchExpression) MatchExpressionParser.parse("{a: 1, b: 2}");
            assertThrows(IllegalArgumentException.class,
                    () -> ExpressionSplitter.split(tree.getChild(0), Set.of(), (expression, fields) -> true));
        }
    }

    @RepeatedTest(200)
    @DisplayName("Both sides together match exactly the documents the original tree matches")
    void shouldPreserveSemantics() {
        MatchExpressionGenerator generator = new MatchExpressionGenerator();
        String query = generator.generateRandomQuery();
        Set<String> fields = Set.of("b");

        MatchExpression original = MatchExpressionParser.parse(query);
        SplitResult result = ExpressionSplitter.split(MatchExpressionParser.parse(query), fields,
                DependencyAnalyzer::isIndependentOf);

        assertTrue(result.hasExtracted() || result.hasRemaining());
        if (result.hasExtracted()) {
            assertTrue(DependencyAnalyzer.isIndependentOf(result.extracted(), fields),
                    "Extracted part depends on " + fields + ": " + result.extracted());
        }
        for (int i = 0; i < 100; i++) {
            BsonDocument document = generator.generateDocument();
            boolean expected = DocumentMatcher.matches(original, document);
            boolean actual = DocumentMatcher.matches(result.extracted(), document)
                    && DocumentMatcher.matches(result.remaining(), document);
            assertEquals(expected, actual, String.format("Split of %s changed the result for %s: %s",
                    query, document.toJson(), result));
        }
    }
}
