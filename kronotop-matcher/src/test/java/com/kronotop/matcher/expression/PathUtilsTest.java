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

import com.kronotop.matcher.InvariantViolationError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PathUtilsTest {

    @Nested
    @DisplayName("isPathPrefixOf")
    class IsPathPrefixOfTests {

        @Test
        @DisplayName("Parent path is a prefix of its child")
        void testParentIsPrefix() {
            assertTrue(PathUtils.isPathPrefixOf("a", "a.b"));
            assertTrue(PathUtils.isPathPrefixOf("a", "a.b.c"));
            assertTrue(PathUtils.isPathPrefixOf("a.b", "a.b.c"));
        }

        @Test
        @DisplayName("Plain string prefix is not a path prefix")
        void testStringPrefixIsNotPathPrefix() {
            assertFalse(PathUtils.isPathPrefixOf("a", "ab"));
            assertFalse(PathUtils.isPathPrefixOf("a.b", "a.bc"));
        }

        @Test
        @DisplayName("A path is not a prefix of itself")
        void testEqualPaths() {
            assertFalse(PathUtils.isPathPrefixOf("a", "a"));
            assertFalse(PathUtils.isPathPrefixOf("a.b", "a.b"));
        }

        @Test
        @DisplayName("Longer path is never a prefix")
        void testLongerPath() {
            assertFalse(PathUtils.isPathPrefixOf("a.b", "a"));
            assertFalse(PathUtils.isPathPrefixOf("b", "a.b"));
        }
    }

    @Nested
    @DisplayName("bidirectionalPathPrefixOf")
    class BidirectionalTests {

        @Test
        void testEitherDirection() {
            assertTrue(PathUtils.bidirectionalPathPrefixOf("a", "a.b"));
            assertTrue(PathUtils.bidirectionalPathPrefixOf("a.b", "a"));
            assertTrue(PathUtils.bidirectionalPathPrefixOf("a", "a"));
        }

        @Test
        void testUnrelatedPaths() {
            assertFalse(PathUtils.bidirectionalPathPrefixOf("a", "ab"));
            assertFalse(PathUtils.bidirectionalPathPrefixOf("a.b", "a.c"));
            assertFalse(PathUtils.bidirectionalPathPrefixOf("x", "y"));
        }
    }

    @Nested
    @DisplayName("renamePath")
    class RenamePathTests {

        @Test
        @DisplayName("Exact match is replaced")
        void testExactMatch() {
            assertEquals("x", PathUtils.renamePath("a", Map.of("a", "x")));
        }

        @Test
        @DisplayName("Prefix match keeps the remaining components")
        void testPrefixMatch() {
            assertEquals("x.y.b.c", PathUtils.renamePath("a.b.c", Map.of("a", "x.y")));
        }

        @Test
        @DisplayName("No applicable rename returns null")
        void testNoMatch() {
            assertNull(PathUtils.renamePath("ab", Map.of("a", "x")));
            assertNull(PathUtils.renamePath("a", Map.of("a.b", "x")));
            assertNull(PathUtils.renamePath("a", Map.of()));
        }

        @Test
        @DisplayName("Two applicable renames are an invariant violation")
        void testAmbiguousRename() {
            Map<String, String> renames = Map.of("a", "x", "a.b", "y");
            assertThrows(InvariantViolationError.class, () -> PathUtils.renamePath("a.b", renames));
        }
    }
}
