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

import com.kronotop.matcher.Invariants;

import javax.annotation.Nullable;
import java.util.Map;

/**
 * Helpers for dotted field paths such as {@code a.b.c}.
 */
public final class PathUtils {
    public static final char PATH_SEPARATOR = '.';

    private PathUtils() {
    }

    /**
     * Returns true if {@code first} is a strict dotted-path prefix of {@code second}.
     * "a" is a prefix of "a.b" but neither of "ab" nor of "a".
     */
    public static boolean isPathPrefixOf(String first, String second) {
        if (first.length() >= second.length()) {
            return false;
        }
        return second.startsWith(first) && second.charAt(first.length()) == PATH_SEPARATOR;
    }

    /**
     * Returns true if the paths are equal or one of them is a dotted-path prefix of the other.
     */
    public static boolean bidirectionalPathPrefixOf(String first, String second) {
        return first.equals(second) || isPathPrefixOf(first, second) || isPathPrefixOf(second, first);
    }

    /**
     * Rewrites {@code path} with the single entry of {@code renames} that applies to it. An entry applies
     * when its key equals the path or is a dotted-path prefix of it; in the latter case the remaining
     * components are kept, so {@code a -> x} rewrites {@code a.b} to {@code x.b}.
     *
     * @return the rewritten path, or null if no entry applies
     */
    @Nullable
    public static String renamePath(String path, Map<String, String> renames) {
        String rewritten = null;
        int renamesFound = 0;
        for (Map.Entry<String, String> rename : renames.entrySet()) {
            if (rename.getKey().equals(path)) {
                rewritten = rename.getValue();
                renamesFound++;
            } else if (isPathPrefixOf(rename.getKey(), path)) {
                rewritten = rename.getValue() + path.substring(rename.getKey().length());
                renamesFound++;
            }
        }
        Invariants.invariant(renamesFound <= 1, "Multiple renames apply to path '%s': %s", path, renames);
        return rewritten;
    }
}
