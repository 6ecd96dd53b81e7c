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
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MatcherConfigTest {

    @Test
    void shouldLoadDefaults() {
        MatcherConfig config = MatcherConfig.load();
        assertThat(config.getMaxExpressionDepth()).isZero();
        assertThat(config.getLogDecisions()).isFalse();
    }

    @Test
    void shouldOverrideSingleKey() {
        Config config = ConfigFactory.parseString("matcher.max_expression_depth = 16");
        MatcherConfig matcherConfig = new MatcherConfig(config);
        assertThat(matcherConfig.getMaxExpressionDepth()).isEqualTo(16);
        assertThat(matcherConfig.getLogDecisions()).isFalse();
    }

    @Test
    void shouldFallBackToReferenceWithoutMatcherBlock() {
        MatcherConfig config = new MatcherConfig(ConfigFactory.empty());
        assertThat(config.getMaxExpressionDepth()).isZero();
    }

    @Test
    void shouldRejectNegativeDepth() {
        Config config = ConfigFactory.parseString("matcher.max_expression_depth = -1");
        assertThatThrownBy(() -> new MatcherConfig(config))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("max_expression_depth");
    }
}
