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

import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonValue;
import org.bson.Document;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.stream.Stream;

import static com.docmatch.common.utils.BSONUtil.parseValue;
import static org.junit.jupiter.api.Assertions.*;

class ValueEqualityTest {

    private static final ScalarComparator LESS_THAN =
            (x, y) -> x.asNumber().doubleValue() < y.asNumber().doubleValue();

    static Stream<String> values() {
        return Stream.of(
                "1",
                "2.5",
                "'text'",
                "null",
                "true",
                "[]",
                "{}",
                "[1, 2, [3, 4]]",
                "{a: 1, b: {c: [1, {d: 'x'}]}}",
                "[{a: 1}, {a: 1}, {b: 2}]",
                "{'$date': 1640995200000}",
                "{'$numberLong': '9007199254740993'}",
                "{'$numberDecimal': '1.10'}",
                "{'$numberDouble': 'NaN'}"
        );
    }

    static Stream<Arguments> pairs() {
        return Stream.of(
                Arguments.of("1", "1"),
                Arguments.of("1", "2"),
                Arguments.of("[]", "{}"),
                Arguments.of("[1, 2]", "[2, 1]"),
                Arguments.of("[1, 1]", "[1, 2]"),
                Arguments.of("{a: 1, b: 2}", "{b: 2, a: 1}"),
                Arguments.of("{a: 1}", "{a: 1, b: 2}"),
                Arguments.of("{_id: 1, a: [1, {x: 2}]}", "{_id: 2, a: [{x: 2}, 1]}"),
                Arguments.of("'1'", "1"),
                Arguments.of("null", "{}"),
                Arguments.of("[[1, 2], [3]]", "[[3], [2, 1]]")
        );
    }

    @ParameterizedTest
    @MethodSource("values")
    @DisplayName("Every value equals itself")
    void shouldBeReflexive(String json) {
        BsonValue value = parseValue(json);
        assertTrue(Equality.anyEq(value, value));
        assertTrue(Equality.anyEq(value, parseValue(json)));
    }

    @ParameterizedTest
    @MethodSource("pairs")
    @DisplayName("Equality does not depend on argument order")
    void shouldBeSymmetric(String left, String right) {
        BsonValue l = parseValue(left);
        BsonValue r = parseValue(right);
        assertEquals(Equality.anyEq(l, r), Equality.anyEq(r, l));
    }

    @Nested
    @DisplayName("Type tag dominates")
    class TypeTagTests {

        @Test
        @DisplayName("Empty array is not equal to empty document")
        void shouldNotMatchEmptyArrayWithEmptyDocument() {
            assertFalse(Equality.anyEq(parseValue("[]"), parseValue("{}")));
            assertFalse(Equality.anyEq(parseValue("{}"), parseValue("[]")));
        }

        @ParameterizedTest
        @ValueSource(strings = {"1", "'a'", "null", "[1]", "{a: 1}"})
        @DisplayName("Values of different shapes never match")
        void shouldNotMatchAcrossShapes(String json) {
            BsonValue value = parseValue(json);
            for (String other : List.of("2", "[2]", "{a: 2}")) {
                if (!json.equals(other)) {
                    assertFalse(Equality.anyEq(value, parseValue(other)), json + " vs " + other);
                }
            }
        }

        @Test
        @DisplayName("Scalar is never equal to a single element array")
        void shouldNotMatchScalarWithArray() {
            assertFalse(Equality.anyEq(1, List.of(1)));
            assertFalse(Equality.anyEq(List.of(1), 1));
        }
    }

    @Nested
    @DisplayName("Scalars")
    class ScalarTests {

        @Test
        @DisplayName("Numbers compare by value across BSON types")
        void shouldCompareNumbersByValue() {
            assertTrue(Equality.anyEq(1, 1L));
            assertTrue(Equality.anyEq(1, 1.0));
            assertFalse(Equality.anyEq(1, 1.5));
        }

        @Test
        @DisplayName("A string is not equal to a number")
        void shouldNotMatchStringWithNumber() {
            assertFalse(Equality.anyEq("1", 1));
        }

        @Test
        @DisplayName("Plain Java values and BSON values are interchangeable")
        void shouldAcceptJavaAndBsonValues() {
            assertTrue(Equality.anyEq(new Document("a", List.of(1, 2)), BsonDocument.parse("{a: [2, 1]}")));
            assertTrue(Equality.anyEq(null, parseValue("null")));
        }
    }

    @Nested
    @DisplayName("Custom scalar comparator")
    class ComparatorTests {

        @Test
        @DisplayName("Comparator replaces scalar equality")
        void shouldUseComparatorForScalars() {
            assertTrue(Equality.anyEq(5, 6, false, LESS_THAN));
            assertFalse(Equality.anyEq(6, 5, false, LESS_THAN));
        }

        @Test
        @DisplayName("Comparator reaches scalars nested in arrays and documents")
        void shouldThreadComparatorThroughNestedValues() {
            assertTrue(Equality.anyEq(List.of(5), List.of(6), false, LESS_THAN));
            assertTrue(Equality.anyEq(new Document("a", 5), new Document("a", 6), false, LESS_THAN));
            assertTrue(Equality.anyEq(
                    new Document("a", List.of(new Document("b", 1))),
                    new Document("a", List.of(new Document("b", 2))),
                    false, LESS_THAN));
            assertFalse(Equality.anyEq(List.of(5), List.of(6)));
        }

        @Test
        @DisplayName("Comparator does not change structural dispatch")
        void shouldNotApplyComparatorToStructure() {
            ScalarComparator always = (x, y) -> true;
            assertFalse(Equality.anyEq(List.of(), new Document(), false, always));
            assertFalse(Equality.anyEq(1, List.of(1), false, always));
            assertFalse(Equality.anyEq(new Document("a", 1), new Document("b", 1), false, always));
        }

        @Test
        @DisplayName("Comparator receives BSON values")
        void shouldPassBsonValuesToComparator() {
            ScalarComparator capture = (x, y) -> {
                assertEquals(new BsonInt32(5), x);
                assertEquals(new BsonInt32(6), y);
                return true;
            };
            assertTrue(Equality.anyEq(5, 6, false, capture));
        }
    }
}
