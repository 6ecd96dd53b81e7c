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

package com.kronotop.matcher;

import com.kronotop.matcher.algebra.DependencyAnalyzer;
import com.kronotop.matcher.algebra.ExpressionSplitter;
import com.kronotop.matcher.algebra.ExpressionTraversal;
import com.kronotop.matcher.algebra.NodeTraversalFunction;
import com.kronotop.matcher.algebra.RenamePropagator;
import com.kronotop.matcher.algebra.SplitPredicate;
import com.kronotop.matcher.algebra.SplitResult;
import com.kronotop.matcher.algebra.SubsumptionAnalyzer;
import com.kronotop.matcher.expression.MatchExpression;
import com.kronotop.matcher.expression.PathUtils;
import com.kronotop.matcher.geo.GeometryOracle;
import com.kronotop.matcher.geo.PlanarBoxGeometryOracle;
import com.kronotop.matcher.values.BsonValueComparator;
import com.kronotop.matcher.values.ValueComparator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;

/**
 * Entry point of the predicate algebra for planners and optimizers.
 * <p>
 * The algorithms recurse over the trees and put no bound on their depth. Callers that accept trees from
 * untrusted input can set {@code matcher.max_expression_depth}: every operation then rejects deeper trees
 * before any analysis. The limit is off by default. Instances hold no mutable state and can be shared between
 * threads; the trees passed in cannot.
 */
public class ExpressionAlgebra {
    private static final Logger LOGGER = LoggerFactory.getLogger(ExpressionAlgebra.class);

    private final MatcherConfig config;
    private final SubsumptionAnalyzer subsumptionAnalyzer;

    public ExpressionAlgebra() {
        this(MatcherConfig.load());
    }

    public ExpressionAlgebra(MatcherConfig config) {
        this(config, BsonValueComparator.INSTANCE, PlanarBoxGeometryOracle.INSTANCE);
    }

    public ExpressionAlgebra(MatcherConfig config, ValueComparator comparator, GeometryOracle geometryOracle) {
        this.config = config;
        this.subsumptionAnalyzer = new SubsumptionAnalyzer(comparator, geometryOracle);
    }

    public MatcherConfig getConfig() {
        return config;
    }

    /**
     * Returns true only if every record matching {@code lhs} is proven to match {@code rhs}.
     *
     * @throws ExpressionTooDeepException if a depth limit is configured and either tree exceeds it
     */
    public boolean isSubsetOf(MatchExpression lhs, MatchExpression rhs) {
        Invariants.invariant(lhs != null && rhs != null, "Subset test requires two trees");
        checkDepth(lhs);
        checkDepth(rhs);
        boolean result = subsumptionAnalyzer.isSubsetOf(lhs, rhs);
        if (config.getLogDecisions()) {
            LOGGER.debug("{} is {}a subset of {}", lhs, result ? "" : "not ", rhs);
        }
        return result;
    }

    public boolean renameSafe(MatchExpression tree) {
        checkDepth(tree);
        return DependencyAnalyzer.renameSafe(tree);
    }

    public boolean isIndependentOf(MatchExpression tree, Set<String> fields) {
        checkDepth(tree);
        return DependencyAnalyzer.isIndependentOf(tree, fields);
    }

    public boolean isOnlyDependentOn(MatchExpression tree, Set<String> fields) {
        checkDepth(tree);
        return DependencyAnalyzer.isOnlyDependentOn(tree, fields);
    }

    /**
     * Moves the part of {@code tree} that does not touch {@code fields} to the extracted side and renames its
     * paths. The tree is consumed.
     */
    public SplitResult splitBy(MatchExpression tree, Set<String> fields, Map<String, String> renames) {
        checkDepth(tree);
        return logSplit(ExpressionSplitter.splitBy(tree, fields, renames));
    }

    public SplitResult splitBy(MatchExpression tree, Set<String> fields, Map<String, String> renames,
                               SplitPredicate predicate) {
        checkDepth(tree);
        return logSplit(ExpressionSplitter.splitBy(tree, fields, renames, predicate));
    }

    public void applyRenames(MatchExpression tree, Map<String, String> renames) {
        checkDepth(tree);
        RenamePropagator.applyRenames(tree, renames);
    }

    public boolean hasExistencePredicateOnPath(MatchExpression tree, String path) {
        checkDepth(tree);
        return ExpressionTraversal.hasExistencePredicateOnPath(tree, path);
    }

    public void mapOver(MatchExpression tree, NodeTraversalFunction function) {
        checkDepth(tree);
        ExpressionTraversal.mapOver(tree, function);
    }

    public boolean isPathPrefixOf(String first, String second) {
        return PathUtils.isPathPrefixOf(first, second);
    }

    public boolean bidirectionalPathPrefixOf(String first, String second) {
        return PathUtils.bidirectionalPathPrefixOf(first, second);
    }

    private SplitResult logSplit(SplitResult result) {
        if (config.getLogDecisions()) {
            LOGGER.debug("Extracted {}, remaining {}", result.extracted(), result.remaining());
        }
        return result;
    }

    private void checkDepth(MatchExpression tree) {
        if (config.getMaxExpressionDepth() == 0) {
            return;
        }
        int depth = ExpressionTraversal.depth(tree);
        if (depth > config.getMaxExpressionDepth()) {
            throw new ExpressionTooDeepException(depth, config.getMaxExpressionDepth());
        }
    }
}
