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
import com.kronotop.matcher.expression.ExprMatchExpression;
import com.kronotop.matcher.expression.LeafMatchExpression;
import com.kronotop.matcher.expression.MatchExpression;

import java.util.Map;

/**
 * Rewrites the field paths of a tree in place.
 */
public final class RenamePropagator {

    private RenamePropagator() {
    }

    /**
     * Applies {@code renames} to every leaf and $expr of the tree. The tree must be rename safe, see
     * {@link DependencyAnalyzer#renameSafe(MatchExpression)}.
     *
     * @throws com.kronotop.matcher.InvariantViolationError if an array-matching or other opaque node is reached
     */
    public static void applyRenames(MatchExpression expr, Map<String, String> renames) {
        if (renames.isEmpty()) {
            return;
        }
        rename(expr, renames);
    }

    private static void rename(MatchExpression expr, Map<String, String> renames) {
        if (expr instanceof ExprMatchExpression exprMatch) {
            exprMatch.applyRename(renames);
            return;
        }
        switch (expr.getCategory()) {
            case ARRAY_MATCHING, OTHER -> throw Invariants.violation(
                    "Cannot rename paths of a %s node, the tree is not rename safe: %s", expr.getMatchType(), expr);
            case LEAF -> ((LeafMatchExpression) expr).applyRename(renames);
            case LOGICAL -> {
                for (MatchExpression child : expr.getChildren()) {
                    rename(child, renames);
                }
            }
        }
    }
}
