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

import com.kronotop.matcher.expression.MatchCategory;
import com.kronotop.matcher.expression.MatchExpression;
import com.kronotop.matcher.expression.MatchType;
import com.kronotop.matcher.expression.PathUtils;

import java.util.ArrayDeque;
import java.util.Deque;

public final class ExpressionTraversal {

    private ExpressionTraversal() {
    }

    /**
     * Returns true if the tree contains an $exists leaf on exactly {@code path}.
     */
    public static boolean hasExistencePredicateOnPath(MatchExpression expr, String path) {
        if (expr.getCategory() == MatchCategory.LEAF) {
            return expr.getMatchType() == MatchType.EXISTS && expr.getPath().equals(path);
        }
        for (MatchExpression child : expr.getChildren()) {
            if (hasExistencePredicateOnPath(child, path)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Visits every node in post-order. Each node is passed with the path formed by joining the non-empty
     * paths of its ancestors and its own, e.g. {@code a.b} for {@code {a: {$elemMatch: {b: 1}}}}.
     */
    public static void mapOver(MatchExpression expr, NodeTraversalFunction function) {
        mapOver(expr, function, "");
    }

    public static void mapOver(MatchExpression expr, NodeTraversalFunction function, String path) {
        String nodePath = path;
        if (!expr.getPath().isEmpty()) {
            nodePath = path.isEmpty() ? expr.getPath() : path + PathUtils.PATH_SEPARATOR + expr.getPath();
        }
        for (MatchExpression child : expr.getChildren()) {
            mapOver(child, function, nodePath);
        }
        function.apply(expr, nodePath);
    }

    /**
     * Returns the number of nodes on the longest root-to-leaf chain. Computed without recursion, so it is
     * safe to call on trees of any depth.
     */
    public static int depth(MatchExpression expr) {
        int max = 0;
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(expr, 1));
        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            max = Math.max(max, frame.depth());
            for (MatchExpression child : frame.node().getChildren()) {
                stack.push(new Frame(child, frame.depth() + 1));
            }
        }
        return max;
    }

    private record Frame(MatchExpression node, int depth) {
    }
}
