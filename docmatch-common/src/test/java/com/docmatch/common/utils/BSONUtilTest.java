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

package com.docmatch.common.utils;

import org.bson.*;
import org.bson.types.Binary;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BSONUtilTest {

    @Test
    void test_toBsonValue_primitiveTypes() {
        assertEquals(new BsonString("hello"), BSONUtil.toBsonValue("hello"));
        assertEquals(new BsonInt32(42), BSONUtil.toBsonValue(42));
        assertEquals(new BsonInt64(123L), BSONUtil.toBsonValue(123L));
        assertEquals(new BsonDouble(3.14), BSONUtil.toBsonValue(3.14));
        assertEquals(new BsonBoolean(true), BSONUtil.toBsonValue(true));
        assertEquals(BsonNull.VALUE, BSONUtil.toBsonValue(null));
    }

    @Test
    void test_toBsonValue_dateDecimalAndObjectId() {
        Date date = new Date(1640995200000L); // 2022-01-01
        assertEquals(new BsonDateTime(1640995200000L), BSONUtil.toBsonValue(date));

        BigDecimal decimal = new BigDecimal("123.456");
        assertEquals(new BsonDecimal128(new Decimal128(decimal)), BSONUtil.toBsonValue(decimal));

        ObjectId objectId = new ObjectId();
        assertEquals(new BsonObjectId(objectId), BSONUtil.toBsonValue(objectId));
    }

    @Test
    void test_toBsonValue_existingBsonValueIsReturnedAsIs() {
        BsonString existing = new BsonString("existing");
        assertSame(existing, BSONUtil.toBsonValue(existing));

        BsonDocument document = new BsonDocument("a", new BsonInt32(1));
        assertSame(document, BSONUtil.toBsonValue(document));
    }

    @Test
    void test_toBsonValue_document() {
        Document doc = new Document("name", "John").append("age", 25);
        BsonValue result = BSONUtil.toBsonValue(doc);

        assertInstanceOf(BsonDocument.class, result);
        BsonDocument bsonDoc = (BsonDocument) result;
        assertEquals(new BsonString("John"), bsonDoc.get("name"));
        assertEquals(new BsonInt32(25), bsonDoc.get("age"));
    }

    @Test
    void test_toBsonValue_map() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("a", 1);
        map.put("b", List.of("x", "y"));

        BsonValue result = BSONUtil.toBsonValue(map);

        assertInstanceOf(BsonDocument.class, result);
        assertEquals(BsonDocument.parse("{a: 1, b: ['x', 'y']}"), result);
    }

    @Test
    void test_toBsonValue_mapWithNonStringKey() {
        Map<Integer, Object> map = Map.of(1, "one");
        assertThrows(IllegalArgumentException.class, () -> BSONUtil.toBsonValue(map));
    }

    @Test
    void test_toBsonValue_nestedArray() {
        List<Object> nested = Arrays.asList(
                Arrays.asList(1, 2),
                Arrays.asList("a", "b"),
                3
        );
        BsonValue result = BSONUtil.toBsonValue(nested);

        assertInstanceOf(BsonArray.class, result);
        BsonArray bsonArray = (BsonArray) result;
        assertEquals(3, bsonArray.size());
        assertEquals(new BsonArray(List.of(new BsonInt32(1), new BsonInt32(2))), bsonArray.get(0));
        assertEquals(new BsonArray(List.of(new BsonString("a"), new BsonString("b"))), bsonArray.get(1));
        assertEquals(new BsonInt32(3), bsonArray.get(2));
    }

    @Test
    void test_toBsonValue_objectArray() {
        Object[] array = {"test", 123, false};
        BsonValue result = BSONUtil.toBsonValue(array);

        assertInstanceOf(BsonArray.class, result);
        BsonArray bsonArray = (BsonArray) result;
        assertEquals(3, bsonArray.size());
        assertEquals(new BsonString("test"), bsonArray.get(0));
        assertEquals(new BsonInt32(123), bsonArray.get(1));
        assertEquals(new BsonBoolean(false), bsonArray.get(2));
    }

    @Test
    void test_toBsonValue_binaryTypes() {
        Binary binary = new Binary("Hello World".getBytes());
        BsonValue result = BSONUtil.toBsonValue(binary);

        assertInstanceOf(BsonBinary.class, result);
        assertArrayEquals("Hello World".getBytes(), result.asBinary().getData());
    }

    @Test
    void test_toBsonValue_unsupportedType() {
        Object unsupported = new Object();

        IllegalArgumentException exception = assertThrows(
                IllegalArgumentException.class,
                () -> BSONUtil.toBsonValue(unsupported)
        );

        assertTrue(exception.getMessage().contains("Unsupported value type for BSON conversion"));
        assertTrue(exception.getMessage().contains("Object"));
    }

    @Test
    void test_parseValue() {
        assertEquals(new BsonInt32(5), BSONUtil.parseValue("5"));
        assertEquals(new BsonString("text"), BSONUtil.parseValue("\"text\""));

        BsonValue array = BSONUtil.parseValue("[1, {a: 2}]");
        assertTrue(array.isArray());
        assertEquals(BsonDocument.parse("{a: 2}"), array.asArray().get(1));
    }

    @Test
    void test_toJson() {
        assertEquals("{\"a\": 1}", BSONUtil.toJson(BsonDocument.parse("{a: 1}")));
        assertEquals("[1, \"x\"]", BSONUtil.toJson(BSONUtil.parseValue("[1, 'x']")));
        assertEquals("\"x\"", BSONUtil.toJson(new BsonString("x")));
        assertEquals("null", BSONUtil.toJson((BsonValue) null));
    }

    @Test
    void test_toJson_arrays() {
        BsonArray array = new BsonArray(List.of(new BsonInt32(1), new BsonString("x")));
        assertEquals("[1, \"x\"]", BSONUtil.toJson(array));
        assertEquals("[]", BSONUtil.toJson(new BsonArray()));

        assertEquals("[{\"a\": 1}, {\"b\": 2}]", BSONUtil.toJsonArray(List.of(
                BsonDocument.parse("{a: 1}"),
                BsonDocument.parse("{b: 2}")
        )));
        assertEquals("[]", BSONUtil.toJsonArray(List.of()));
    }
}
