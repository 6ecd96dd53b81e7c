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
import com.kronotop.matcher.expression.AndMatchExpression;
import com.kronotop.matcher.expression.ListOfMatchExpression;
import com.kronotop.matcher.expression.MatchCategory;
import com.kronotop.matcher.expression.MatchExpression;
import com.kronotop.matcher.expression.NorMatchExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Partitions a predicate tree into a part that can be moved elsewhere, typically before a pipeline stage,
 * and a part that has to stay.
 * <p>
 * Splitting consumes the input tree. Children of a split $and or $nor are released from it and attached to
 * newly built nodes, so the input must not be used afterwards.
 */
public final class ExpressionSplitter {
    private static final Logger LOGGER = LoggerFactory.getLogger(ExpressionSplitter.class);

    private ExpressionSplitter() {
    }

    /**
     * Splits {@code tree} into a part that satisfies {@code predicate} and the rest.
     * <ul>
     *   <li>A tree that satisfies the predicate is extracted whole.</li>
     *   <li>Non-logical nodes are atomic.</li>
     *   <li>An $and is split child by child.</li>
     *   <li>A $nor gives away whole clauses only, since {@code !(x || y)} equals {@code !x && !y}.</li>
     *   <li>$or, $not and $_internalSchemaXor cannot be split.</li>
     * </ul>
     *
     * @throws IllegalArgumentException if the tree is attached to a parent
     */
    public static SplitResult split(MatchExpression tree, Set<String> fields, SplitPredicate predicate) {
        checkArgument(tree.getParent() == null, "Only a root node can be split");
        SplitResult result = splitNode(tree, fields, predicate);
        LOGGER.trace("Split {} by {}: extracted={}, remaining={}",
                tree.getMatchType(), fields, result.extracted(), result.remaining());
        return result;
    }

    /**
     * Splits the tree by {@link DependencyAnalyzer#isIndependentOf(MatchExpression, Set)} and renames the
     * paths of the extracted part.
     */
    public static SplitResult splitBy(MatchExpression tree, Set<String> fields, Map<String, String> renames) {
        return splitBy(tree, fields, renames, DependencyAnalyzer::isIndependentOf);
    }

    /**
     * Splits the tree and renames the paths of the extracted part. The remaining part keeps its paths.
     */
    public static SplitResult splitBy(MatchExpression tree, Set<String> fields, Map<String, String> renames,
                                      SplitPredicate predicate) {
        SplitResult result = split(tree, fields, predicate);
        if (result.extracted() != null && !renames.isEmpty()) {
            RenamePropagator.applyRenames(result.extracted(), renames);
        }
        return result;
    }

    private static SplitResult splitNode(MatchExpression expr, Set<String> fields, SplitPredicate predicate) {
        SplitResult result = splitNodeUnchecked(expr, fields, predicate);
        Invariants.invariant(result.hasExtracted() || result.hasRemaining(),
                "Splitting %s produced neither an extracted nor a remaining part", expr.getMatchType());
        return result;
    }

    private static SplitResult splitNodeUnchecked(MatchExpression expr, Set<String> fields, SplitPredicate predicate) {
        if (predicate.shouldExtract(expr, fields)) {
            return new SplitResult(expr, null);
        }
        if (expr.getCategory() != MatchCategory.LOGICAL) {
            return new SplitResult(null, expr);
        }
        return switch (expr.getMatchType()) {
            case AND -> splitAnd((AndMatchExpression) expr, fields, predicate);
            case NOR -> splitNor((NorMatchExpression) expr, fields, predicate);
            case OR, NOT, INTERNAL_SCHEMA_XOR -> new SplitResult(null, expr);
            default -> throw Invariants.violation("Unexpected logical node in split: %s", expr.getMatchType());
        };
    }

    private static SplitResult splitAnd(AndMatchExpression and, Set<String> fields, SplitPredicate predicate) {
        List<MatchExpression> extracted = new ArrayList<>();
        List<MatchExpression> remaining = new ArrayList<>();
        for (MatchExpression child : and.releaseChildren()) {
            SplitResult childResult = splitNode(child, fields, predicate);
            if (childResult.extracted() != null) {
                extracted.add(childResult.extracted());
            }
            if (childResult.remaining() != null) {
                remaining.add(childResult.remaining());
            }
        }
        return new SplitResult(createAndOfNodes(extracted), createAndOfNodes(remaining));
    }

    private static SplitResult splitNor(NorMatchExpression nor, Set<String> fields, SplitPredicate predicate) {
        List<MatchExpression> extracted = new ArrayList<>();
        List<MatchExpression> remaining = new ArrayList<>();
        for (MatchExpression clause : nor.releaseChildren()) {
            // Clauses move as a whole, never in parts
            if (predicate.shouldExtract(clause, fields)) {
                extracted.add(clause);
            } else {
                remaining.add(clause);
            }
        }
        return new SplitResult(createNorOfNodes(extracted), createNorOfNodes(remaining));
    }

    @Nullable
    private static MatchExpression createAndOfNodes(List<MatchExpression> children) {
        if (children.isEmpty()) {
            return null;
        }
        if (children.size() == 1) {
            return children.get(0);
        }
        return new AndMatchExpression(children);
    }

    // A single clause stays a $nor; it is not rewritten to $not.
    @Nullable
    private static ListOfMatchExpression createNorOfNodes(List<MatchExpression> children) {
        if (children.isEmpty()) {
            return null;
        }
        return new NorMatchExpression(children);
    }
}
