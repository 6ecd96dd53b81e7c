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

package com.kronotop.matcher.expression;

import java.util.List;

/**
 * Matches documents that match none of its children.
 */
public final class NorMatchExpression extends ListOfMatchExpression {
    public NorMatchExpression(List<? extends MatchExpression> children) {
        super(MatchType.NOR, children);
    }

    public NorMatchExpression(MatchExpression... children) {
        this(List.of(children));
    }

    @Override
    protected String operatorName() {
        return "$nor";
    }
}
