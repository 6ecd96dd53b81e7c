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

import javax.annotation.Nullable;

/**
 * The two parts of a split tree. Their conjunction is equivalent to the original tree; an absent part stands
 * for "always true" and must be omitted rather than materialized.
 *
 * @param extracted the part that satisfied the split predicate, or null
 * @param remaining the part that stays where the original tree was, or null
 */
public record SplitResult(@Nullable MatchExpression extracted, @Nullable MatchExpression remaining) {

    public boolean hasExtracted() {
        return extracted != null;
    }

    public boolean hasRemaining() {
        return remaining != null;
    }
}
