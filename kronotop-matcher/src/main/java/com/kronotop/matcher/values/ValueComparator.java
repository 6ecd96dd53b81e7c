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

import org.bson.BsonValue;

import javax.annotation.Nullable;

/**
 * Type and collation aware ordering of BSON values.
 */
public interface ValueComparator {

    /**
     * Three-way comparison. Values of different canonical types order by their canonical type. Strings,
     * including those nested in documents and arrays, use the collation when one is given.
     */
    int compare(BsonValue left, BsonValue right, @Nullable Collation collation);

    /**
     * Returns the type family of a value. Values are only ordered meaningfully within a family; all
     * numeric types share one.
     */
    int canonicalType(BsonValue value);

    boolean isNaN(BsonValue value);

    /**
     * Returns true if comparing values of this type can depend on a collation.
     */
    boolean isCollatable(BsonValue value);
}
