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

package com.kronotop.matcher.values;

import javax.annotation.Nullable;

/**
 * A string ordering attached to a query. Two collations are interchangeable when their specs are equal.
 */
public interface Collation {

    /**
     * Returns true if both are null, or both are non-null and have the same spec.
     */
    static boolean matches(@Nullable Collation first, @Nullable Collation second) {
        if (first == null || second == null) {
            return first == second;
        }
        return first.getSpec().equals(second.getSpec());
    }

    int compare(String left, String right);

    /**
     * Identifies the ordering, e.g. {@code "en_US/3"}.
     */
    String getSpec();
}
