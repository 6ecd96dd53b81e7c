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

/**
 * Thrown when a predicate tree is nested deeper than {@code matcher.max_expression_depth}.
 */
public class ExpressionTooDeepException extends MatcherException {
    private final int depth;
    private final int limit;

    public ExpressionTooDeepException(int depth, int limit) {
        super(String.format("Expression depth %d exceeds the configured limit of %d", depth, limit));
        this.depth = depth;
        this.limit = limit;
    }

    public int getDepth() {
        return depth;
    }

    public int getLimit() {
        return limit;
    }
}
