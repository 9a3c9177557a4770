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

package com.docmatch.equality;

import org.bson.BsonValue;
import org.bson.types.Decimal128;

import java.math.BigDecimal;

/**
 * Built-in {@link ScalarComparator}s.
 */
public final class ScalarComparators {

    /**
     * Equality as a shell sees deserialized values: numbers compare by value regardless of
     * their BSON type, so {@code 1}, {@code 1L} and {@code 1.0} are equal and {@code -0.0}
     * equals {@code 0}. Finite numbers are compared by their exact value, with no rounding to
     * {@code double}. NaN equals NaN, keeping the relation reflexive. Any other pair
     * compares with {@link BsonValue#equals(Object)}.
     */
    public static final ScalarComparator NATIVE = ScalarComparators::nativeEquals;

    /**
     * Type and value must both match, {@code 1} and {@code 1.0} are different.
     */
    public static final ScalarComparator STRICT = BsonValue::equals;

    private ScalarComparators() {
    }

    static boolean nativeEquals(BsonValue left, BsonValue right) {
        if (isNumeric(left) && isNumeric(right)) {
            return numericEquals(left, right);
        }
        return left.equals(right);
    }

    private static boolean isNumeric(BsonValue value) {
        return value.isNumber() || value.isDecimal128();
    }

    // Finite values compare exactly: an int64 above 2^53 never equals the double nearest to it.
    private static boolean numericEquals(BsonValue left, BsonValue right) {
        if (isNaN(left) || isNaN(right)) {
            return isNaN(left) && isNaN(right);
        }
        int leftInfinity = infinitySign(left);
        int rightInfinity = infinitySign(right);
        if (leftInfinity != 0 || rightInfinity != 0) {
            return leftInfinity == rightInfinity;
        }
        return toBigDecimal(left).compareTo(toBigDecimal(right)) == 0;
    }

    private static boolean isNaN(BsonValue value) {
        if (value.isDouble()) {
            return Double.isNaN(value.asDouble().getValue());
        }
        return value.isDecimal128() && value.asDecimal128().getValue().isNaN();
    }

    private static int infinitySign(BsonValue value) {
        if (value.isDouble()) {
            double d = value.asDouble().getValue();
            return Double.isInfinite(d) ? (d > 0 ? 1 : -1) : 0;
        }
        if (value.isDecimal128()) {
            Decimal128 decimal = value.asDecimal128().getValue();
            return decimal.isInfinite() ? (decimal.isNegative() ? -1 : 1) : 0;
        }
        return 0;
    }

    private static BigDecimal toBigDecimal(BsonValue value) {
        if (value.isDouble()) {
            return new BigDecimal(value.asDouble().getValue());
        }
        if (value.isDecimal128()) {
            // Decimal128#bigDecimalValue rejects negative zero, its string form does not.
            return new BigDecimal(value.asDecimal128().getValue().toString());
        }
        return BigDecimal.valueOf(value.asNumber().longValue());
    }
}
