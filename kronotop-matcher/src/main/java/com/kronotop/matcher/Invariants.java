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

import com.google.common.base.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fatal invariant checks. A failed check is logged and raised as an {@link InvariantViolationError}.
 * Messages use {@code %s} placeholders.
 */
public final class Invariants {
    private static final Logger LOGGER = LoggerFactory.getLogger(Invariants.class);

    private Invariants() {
    }

    public static void invariant(boolean condition, String template, Object... args) {
        if (!condition) {
            throw violation(template, args);
        }
    }

    /**
     * Creates the error for a failed invariant. Callers throw the returned value, which keeps
     * the compiler aware that the branch does not complete normally.
     */
    public static InvariantViolationError violation(String template, Object... args) {
        String message = Strings.lenientFormat(template, args);
        LOGGER.error("Invariant failure: {}", message);
        return new InvariantViolationError(message);
    }
}
