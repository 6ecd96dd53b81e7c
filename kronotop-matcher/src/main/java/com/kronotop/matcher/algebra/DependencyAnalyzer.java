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

import com.kronotop.matcher.expression.DependencyTracker;
import com.kronotop.matcher.expression.MatchCategory;
import com.kronotop.matcher.expression.MatchExpression;
import com.kronotop.matcher.expression.MatchType;
import com.kronotop.matcher.expression.PathUtils;

import javax.annotation.Nullable;
import java.util.Set;

/**
 * Field dependence tests. Trees containing nodes whose paths cannot be renamed are never analyzed, and every
 * test answers false for them.
 */
public final class DependencyAnalyzer {

    private DependencyAnalyzer() {
    }

    /**
     * Returns true if every node of the tree is a logical node, a leaf or an $expr.
     */
    public static boolean renameSafe(MatchExpression expr) {
        if (expr.getMatchType() == MatchType.EXPRESSION) {
            return true;
        }
        if (expr.getCategory() == MatchCategory.ARRAY_MATCHING || expr.getCategory() == MatchCategory.OTHER) {
            return false;
        }
        for (MatchExpression child : expr.getChildren()) {
            if (!renameSafe(child)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns true if no path the tree reads overlaps with any of {@code fields}. Paths overlap when they are
     * equal or one is a dotted prefix of the other.
     */
    public static boolean isIndependentOf(MatchExpression expr, Set<String> fields) {
        DependencyTracker deps = dependenciesOf(expr);
        if (deps == null) {
            return false;
        }
        for (String dependency : deps.getFields()) {
            for (String field : fields) {
                if (PathUtils.bidirectionalPathPrefixOf(dependency, field)) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Returns true if every path the tree reads is one of {@code fields} or lies below one of them.
     */
    public static boolean isOnlyDependentOn(MatchExpression expr, Set<String> fields) {
        DependencyTracker deps = dependenciesOf(expr);
        if (deps == null) {
            return false;
        }
        for (String dependency : deps.getFields()) {
            if (!isCoveredBy(dependency, fields)) {
                return false;
            }
        }
        return true;
    }

    private static boolean isCoveredBy(String dependency, Set<String> fields) {
        if (fields.contains(dependency)) {
            return true;
        }
        for (String field : fields) {
            if (PathUtils.isPathPrefixOf(field, dependency)) {
                return true;
            }
        }
        return false;
    }

    @Nullable
    private static DependencyTracker dependenciesOf(MatchExpression expr) {
        if (!renameSafe(expr)) {
            return null;
        }
        DependencyTracker deps = new DependencyTracker();
        expr.addDependencies(deps);
        if (deps.getNeedWholeDocument()) {
            // $$ROOT and friends read every field
            return null;
        }
        return deps;
    }
}
