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

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Settings of the predicate algebra, read from the {@code matcher} block of a Typesafe config.
 * Missing keys fall back to the library's {@code reference.conf}.
 */
public class MatcherConfig {
    public static final String ROOT = "matcher";

    private final int maxExpressionDepth;
    private final boolean logDecisions;

    public MatcherConfig(Config config) {
        Config matcher = config.withFallback(ConfigFactory.defaultReference()).getConfig(ROOT);
        this.maxExpressionDepth = matcher.getInt("max_expression_depth");
        checkArgument(maxExpressionDepth >= 0, "max_expression_depth must not be negative, got %s", maxExpressionDepth);
        this.logDecisions = matcher.getBoolean("log_decisions");
    }

    public static MatcherConfig load() {
        return new MatcherConfig(ConfigFactory.load());
    }

    /**
     * Returns the deepest tree the facade accepts, or 0 if the depth is not limited.
     */
    public int getMaxExpressionDepth() {
        return maxExpressionDepth;
    }

    public boolean getLogDecisions() {
        return logDecisions;
    }

    @Override
    public String toString() {
        return "MatcherConfig {" +
                "maxExpressionDepth=" + maxExpressionDepth + ", " +
                "logDecisions=" + logDecisions + "}";
    }
}
