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

import org.bson.BsonArray;
import org.bson.BsonBoolean;
import org.bson.BsonDateTime;
import org.bson.BsonDecimal128;
import org.bson.BsonDocument;
import org.bson.BsonDouble;
import org.bson.BsonInt32;
import org.bson.BsonInt64;
import org.bson.BsonMaxKey;
import org.bson.BsonMinKey;
import org.bson.BsonNull;
import org.bson.BsonString;
import org.bson.BsonSymbol;
import org.bson.BsonTimestamp;
import org.bson.types.Decimal128;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BsonValueComparatorTest {
    private final BsonValueComparator comparator = BsonValueComparator.INSTANCE;

    @Nested
    @DisplayName("Canonical types")
    class CanonicalTypeTests {

        @Test
        @DisplayName("All numeric types share a family")
        void testNumbersShareFamily() {
            int family = comparator.canonicalType(new BsonInt32(1));
            assertEquals(family, comparator.canonicalType(new BsonInt64(1)));
            assertEquals(family, comparator.canonicalType(new BsonDouble(1.5)));
            assertEquals(family, comparator.canonicalType(new BsonDecimal128(Decimal128.parse("1.5"))));
        }

        @Test
        void testStringAndSymbolShareFamily() {
            assertEquals(comparator.canonicalType(new BsonString("a")), comparator.canonicalType(new BsonSymbol("a")));
        }

        @Test
        @DisplayName("Families follow the BSON sort order")
        void testFamilyOrder() {
            assertTrue(comparator.compare(new BsonMinKey(), BsonNull.VALUE, null) < 0);
            assertTrue(comparator.compare(BsonNull.VALUE, new BsonInt32(0), null) < 0);
            assertTrue(comparator.compare(new BsonInt32(100), new BsonString(""), null) < 0);
            assertTrue(comparator.compare(new BsonString("z"), new BsonDocument(), null) < 0);
            assertTrue(comparator.compare(BsonBoolean.TRUE, new BsonDateTime(0), null) < 0);
            assertTrue(comparator.compare(new BsonDateTime(0), new BsonMaxKey(), null) < 0);
        }
    }

    @Nested
    @DisplayName("Numbers")
    class NumberTests {

        @Test
        void testCrossTypeEquality() {
            assertEquals(0, comparator.compare(new BsonInt32(5), new BsonDouble(5.0), null));
            assertEquals(0, comparator.compare(new BsonInt64(5), new BsonDecimal128(Decimal128.parse("5.00")), null));
            assertEquals(0, comparator.compare(new BsonDouble(0.0), new BsonDouble(-0.0), null));
        }

        @Test
        void testCrossTypeOrdering() {
            assertTrue(comparator.compare(new BsonInt32(5), new BsonDouble(5.5), null) < 0);
            assertTrue(comparator.compare(new BsonInt64(Long.MAX_VALUE), new BsonInt64(Long.MAX_VALUE - 1), null) > 0);
            assertTrue(comparator.compare(new BsonDecimal128(Decimal128.parse("0.1")), new BsonDouble(0.2), null) < 0);
        }

        @Test
        @DisplayName("NaN sorts below every number and equals itself")
        void testNaN() {
            BsonDouble nan = new BsonDouble(Double.NaN);
            assertTrue(comparator.isNaN(nan));
            assertTrue(comparator.isNaN(new BsonDecimal128(Decimal128.NaN)));
            assertFalse(comparator.isNaN(new BsonInt32(1)));
            assertEquals(0, comparator.compare(nan, new BsonDecimal128(Decimal128.NaN), null));
            assertTrue(comparator.compare(nan, new BsonDouble(Double.NEGATIVE_INFINITY), null) < 0);
            assertTrue(comparator.compare(new BsonInt32(Integer.MIN_VALUE), nan, null) > 0);
        }

        @Test
        void testInfinity() {
            assertTrue(comparator.compare(new BsonDouble(Double.POSITIVE_INFINITY), new BsonInt64(Long.MAX_VALUE), null) > 0);
            assertTrue(comparator.compare(new BsonDouble(Double.NEGATIVE_INFINITY), new BsonInt64(Long.MIN_VALUE), null) < 0);
            assertEquals(0, comparator.compare(new BsonDouble(Double.POSITIVE_INFINITY),
                    new BsonDecimal128(Decimal128.POSITIVE_INFINITY), null));
        }
    }

    @Nested
    @DisplayName("Strings")
    class StringTests {

        @Test
        @DisplayName("Without a collation strings compare by UTF-8 bytes")
        void testBinaryOrder() {
            assertTrue(comparator.compare(new BsonString("B"), new BsonString("a"), null) < 0);
            assertTrue(comparator.compare(new BsonString("a"), new BsonString("ab"), null) < 0);
            assertTrue(comparator.compare(new BsonString("z"), new BsonString("é"), null) < 0);
        }

        @Test
        void testCollation() {
            Collation collation = IcuCollation.of("en_US", com.ibm.icu.text.Collator.SECONDARY);
            assertEquals(0, comparator.compare(new BsonString("abc"), new BsonString("ABC"), collation));
            assertTrue(comparator.compare(new BsonString("a"), new BsonString("B"), collation) < 0);
        }

        @Test
        void testCollatableTypes() {
            assertTrue(comparator.isCollatable(new BsonString("a")));
            assertTrue(comparator.isCollatable(new BsonDocument()));
            assertTrue(comparator.isCollatable(new BsonArray()));
            assertFalse(comparator.isCollatable(new BsonInt32(1)));
            assertFalse(comparator.isCollatable(BsonNull.VALUE));
        }
    }

    @Nested
    @DisplayName("Documents and arrays")
    class CompositeTests {

        @Test
        void testArrays() {
            BsonArray shorter = new BsonArray(List.of(new BsonInt32(1)));
            BsonArray longer = new BsonArray(List.of(new BsonInt32(1), new BsonInt32(0)));
            assertTrue(comparator.compare(shorter, longer, null) < 0);
            assertTrue(comparator.compare(new BsonArray(List.of(new BsonInt32(2))), longer, null) > 0);
        }

        @Test
        void testDocuments() {
            assertEquals(0, comparator.compare(BsonDocument.parse("{a: 1}"), BsonDocument.parse("{a: 1.0}"), null));
            assertTrue(comparator.compare(BsonDocument.parse("{a: 1}"), BsonDocument.parse("{b: 0}"), null) < 0);
            assertTrue(comparator.compare(BsonDocument.parse("{a: 1}"), BsonDocument.parse("{a: 1, b: 0}"), null) < 0);
            // The value type is compared before the field name
            assertTrue(comparator.compare(BsonDocument.parse("{b: 1}"), BsonDocument.parse("{a: 'x'}"), null) < 0);
        }

        @Test
        void testTimestampsAreUnsigned() {
            assertTrue(comparator.compare(new BsonTimestamp(-1L), new BsonTimestamp(1L), null) > 0);
        }
    }
}
