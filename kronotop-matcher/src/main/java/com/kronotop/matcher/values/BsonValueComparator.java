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

import com.google.common.primitives.UnsignedBytes;
import org.bson.BsonArray;
import org.bson.BsonBinary;
import org.bson.BsonDocument;
import org.bson.BsonRegularExpression;
import org.bson.BsonType;
import org.bson.BsonValue;
import org.bson.types.Decimal128;

import javax.annotation.Nullable;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Comparator;
import java.util.Iterator;
import java.util.Map;

/**
 * The standard BSON sort order. Numbers of different types compare by value; NaN sorts below every other
 * number and is equal to itself.
 */
public final class BsonValueComparator implements ValueComparator {
    public static final BsonValueComparator INSTANCE = new BsonValueComparator();

    private static final Comparator<byte[]> BYTES = UnsignedBytes.lexicographicalComparator();

    private BsonValueComparator() {
    }

    @Override
    public int canonicalType(BsonValue value) {
        return switch (value.getBsonType()) {
            case MIN_KEY -> -1;
            case UNDEFINED, END_OF_DOCUMENT -> 0;
            case NULL -> 5;
            case DOUBLE, INT32, INT64, DECIMAL128 -> 10;
            case STRING, SYMBOL -> 15;
            case DOCUMENT -> 20;
            case ARRAY -> 25;
            case BINARY -> 30;
            case OBJECT_ID -> 35;
            case BOOLEAN -> 40;
            case DATE_TIME -> 45;
            case TIMESTAMP -> 47;
            case REGULAR_EXPRESSION -> 50;
            case DB_POINTER -> 55;
            case JAVASCRIPT -> 60;
            case JAVASCRIPT_WITH_SCOPE -> 65;
            case MAX_KEY -> 127;
        };
    }

    @Override
    public boolean isNaN(BsonValue value) {
        return switch (value.getBsonType()) {
            case DOUBLE -> Double.isNaN(value.asDouble().getValue());
            case DECIMAL128 -> value.asDecimal128().getValue().isNaN();
            default -> false;
        };
    }

    @Override
    public boolean isCollatable(BsonValue value) {
        return switch (value.getBsonType()) {
            case STRING, SYMBOL, DOCUMENT, ARRAY -> true;
            default -> false;
        };
    }

    @Override
    public int compare(BsonValue left, BsonValue right, @Nullable Collation collation) {
        int result = Integer.compare(canonicalType(left), canonicalType(right));
        if (result != 0) {
            return result;
        }
        return switch (left.getBsonType()) {
            case DOUBLE, INT32, INT64, DECIMAL128 -> compareNumbers(left, right);
            case STRING, SYMBOL -> compareStrings(stringValue(left), stringValue(right), collation);
            case DOCUMENT -> compareDocuments(left.asDocument(), right.asDocument(), collation);
            case ARRAY -> compareArrays(left.asArray(), right.asArray(), collation);
            case BINARY -> compareBinaries(left.asBinary(), right.asBinary());
            case OBJECT_ID -> left.asObjectId().getValue().compareTo(right.asObjectId().getValue());
            case BOOLEAN -> Boolean.compare(left.asBoolean().getValue(), right.asBoolean().getValue());
            case DATE_TIME -> Long.compare(left.asDateTime().getValue(), right.asDateTime().getValue());
            case TIMESTAMP -> Long.compareUnsigned(left.asTimestamp().getValue(), right.asTimestamp().getValue());
            case REGULAR_EXPRESSION -> compareRegexes(left.asRegularExpression(), right.asRegularExpression());
            case DB_POINTER -> compareDbPointers(left, right);
            case JAVASCRIPT -> compareStrings(left.asJavaScript().getCode(), right.asJavaScript().getCode(), null);
            case JAVASCRIPT_WITH_SCOPE -> {
                int code = compareStrings(left.asJavaScriptWithScope().getCode(),
                        right.asJavaScriptWithScope().getCode(), null);
                if (code != 0) {
                    yield code;
                }
                yield compareDocuments(left.asJavaScriptWithScope().getScope(),
                        right.asJavaScriptWithScope().getScope(), null);
            }
            // A single value each
            case NULL, UNDEFINED, MIN_KEY, MAX_KEY, END_OF_DOCUMENT -> 0;
        };
    }

    private int compareNumbers(BsonValue left, BsonValue right) {
        boolean leftNaN = isNaN(left);
        boolean rightNaN = isNaN(right);
        if (leftNaN || rightNaN) {
            return Boolean.compare(rightNaN, leftNaN);
        }
        int leftInfinity = infinitySign(left);
        int rightInfinity = infinitySign(right);
        if (leftInfinity != 0 || rightInfinity != 0) {
            return Integer.compare(leftInfinity, rightInfinity);
        }
        return toBigDecimal(left).compareTo(toBigDecimal(right));
    }

    private static int infinitySign(BsonValue value) {
        if (value.isDouble()) {
            double d = value.asDouble().getValue();
            if (Double.isInfinite(d)) {
                return d > 0 ? 1 : -1;
            }
        } else if (value.isDecimal128()) {
            Decimal128 d = value.asDecimal128().getValue();
            if (d.isInfinite()) {
                return d.isNegative() ? -1 : 1;
            }
        }
        return 0;
    }

    private static BigDecimal toBigDecimal(BsonValue value) {
        return switch (value.getBsonType()) {
            case INT32 -> BigDecimal.valueOf(value.asInt32().getValue());
            case INT64 -> BigDecimal.valueOf(value.asInt64().getValue());
            case DOUBLE -> new BigDecimal(value.asDouble().getValue());
            // Decimal128#bigDecimalValue rejects negative zero
            case DECIMAL128 -> new BigDecimal(value.asDecimal128().getValue().toString());
            default -> throw new IllegalArgumentException("Not a number: " + value.getBsonType());
        };
    }

    private static String stringValue(BsonValue value) {
        if (value.isSymbol()) {
            return value.asSymbol().getSymbol();
        }
        return value.asString().getValue();
    }

    private static int compareStrings(String left, String right, @Nullable Collation collation) {
        if (collation != null) {
            return collation.compare(left, right);
        }
        return BYTES.compare(left.getBytes(StandardCharsets.UTF_8), right.getBytes(StandardCharsets.UTF_8));
    }

    private int compareDocuments(BsonDocument left, BsonDocument right, @Nullable Collation collation) {
        Iterator<Map.Entry<String, BsonValue>> leftIterator = left.entrySet().iterator();
        Iterator<Map.Entry<String, BsonValue>> rightIterator = right.entrySet().iterator();
        while (leftIterator.hasNext() && rightIterator.hasNext()) {
            Map.Entry<String, BsonValue> leftEntry = leftIterator.next();
            Map.Entry<String, BsonValue> rightEntry = rightIterator.next();
            int result = Integer.compare(canonicalType(leftEntry.getValue()), canonicalType(rightEntry.getValue()));
            if (result != 0) {
                return result;
            }
            // Field names are never collated
            result = compareStrings(leftEntry.getKey(), rightEntry.getKey(), null);
            if (result != 0) {
                return result;
            }
            result = compare(leftEntry.getValue(), rightEntry.getValue(), collation);
            if (result != 0) {
                return result;
            }
        }
        return Boolean.compare(leftIterator.hasNext(), rightIterator.hasNext());
    }

    private int compareArrays(BsonArray left, BsonArray right, @Nullable Collation collation) {
        int length = Math.min(left.size(), right.size());
        for (int i = 0; i < length; i++) {
            int result = compare(left.get(i), right.get(i), collation);
            if (result != 0) {
                return result;
            }
        }
        return Integer.compare(left.size(), right.size());
    }

    private static int compareBinaries(BsonBinary left, BsonBinary right) {
        int result = Integer.compare(left.getData().length, right.getData().length);
        if (result != 0) {
            return result;
        }
        result = Integer.compare(Byte.toUnsignedInt(left.getType()), Byte.toUnsignedInt(right.getType()));
        if (result != 0) {
            return result;
        }
        return BYTES.compare(left.getData(), right.getData());
    }

    private static int compareRegexes(BsonRegularExpression left, BsonRegularExpression right) {
        int result = compareStrings(left.getPattern(), right.getPattern(), null);
        if (result != 0) {
            return result;
        }
        return compareStrings(left.getOptions(), right.getOptions(), null);
    }

    private static int compareDbPointers(BsonValue left, BsonValue right) {
        int result = compareStrings(left.asDBPointer().getNamespace(), right.asDBPointer().getNamespace(), null);
        if (result != 0) {
            return result;
        }
        return left.asDBPointer().getId().compareTo(right.asDBPointer().getId());
    }
}
