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
import org.bson.json.JsonMode;
import org.bson.json.JsonWriterSettings;
import org.bson.types.Binary;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Map;

/**
 * Utility class for moving between plain Java values, BSON values and their JSON text form.
 * <p>
 * Test code usually states expected results as {@link Document}s, lists and boxed primitives
 * while a database hands back {@link BsonValue}s. Everything is converted to {@link BsonValue}
 * before it is compared, and rendered as relaxed extended JSON when it is printed.
 */
public class BSONUtil {

    private static final JsonWriterSettings RELAXED = JsonWriterSettings.builder().outputMode(JsonMode.RELAXED).build();

    private static final String WRAPPER_FIELD = "v";
    private static final String WRAPPER_PREFIX = "{\"" + WRAPPER_FIELD + "\": ";

    private BSONUtil() {
    }

    /**
     * Converts a Java object to its equivalent BSON value representation.
     *
     * @param value the Java object to convert to BsonValue
     * @return the equivalent BsonValue representation
     * @throws IllegalArgumentException if the value type is not supported for BSON conversion
     */
    public static BsonValue toBsonValue(Object value) {
        if (value == null) {
            return BsonNull.VALUE;
        }
        if (value instanceof BsonValue bsonVal) {
            return bsonVal;
        }
        if (value instanceof String str) {
            return new BsonString(str);
        }
        if (value instanceof Integer intVal) {
            return new BsonInt32(intVal);
        }
        if (value instanceof Short shortVal) {
            return new BsonInt32(shortVal);
        }
        if (value instanceof Long longVal) {
            return new BsonInt64(longVal);
        }
        if (value instanceof Double doubleVal) {
            return new BsonDouble(doubleVal);
        }
        if (value instanceof Float floatVal) {
            return new BsonDouble(floatVal);
        }
        if (value instanceof Boolean boolVal) {
            return new BsonBoolean(boolVal);
        }
        if (value instanceof Date dateVal) {
            return new BsonDateTime(dateVal.getTime());
        }
        if (value instanceof BigDecimal decimalVal) {
            return new BsonDecimal128(new Decimal128(decimalVal));
        }
        if (value instanceof Decimal128 decimal128Val) {
            return new BsonDecimal128(decimal128Val);
        }
        if (value instanceof ObjectId objectId) {
            return new BsonObjectId(objectId);
        }
        if (value instanceof byte[] binaryVal) {
            return new BsonBinary(binaryVal);
        }
        if (value instanceof Binary binaryVal) {
            return new BsonBinary(binaryVal.getType(), binaryVal.getData());
        }
        if (value instanceof Document docVal) {
            return docVal.toBsonDocument();
        }
        if (value instanceof Map<?, ?> map) {
            BsonDocument document = new BsonDocument();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    throw new IllegalArgumentException("Document field names must be strings: " + entry.getKey());
                }
                document.put(key, toBsonValue(entry.getValue()));
            }
            return document;
        }
        if (value instanceof Collection<?> collection) {
            BsonArray bsonArray = new BsonArray();
            for (Object element : collection) {
                bsonArray.add(toBsonValue(element));
            }
            return bsonArray;
        }
        if (value instanceof Object[] array) {
            BsonArray bsonArray = new BsonArray();
            for (Object element : array) {
                bsonArray.add(toBsonValue(element));
            }
            return bsonArray;
        }
        throw new IllegalArgumentException("Unsupported value type for BSON conversion: " + value.getClass().getSimpleName());
    }

    /**
     * Converts every element of the given list with {@link #toBsonValue(Object)}.
     *
     * @param values plain Java or BSON values
     * @return a new array holding the converted values
     */
    public static BsonArray toBsonArray(List<?> values) {
        BsonArray array = new BsonArray();
        for (Object value : values) {
            array.add(toBsonValue(value));
        }
        return array;
    }

    /**
     * Parses any JSON value, not only a document, e.g. {@code [1, {"a": 2}]} or {@code "text"}.
     *
     * @param json extended JSON text
     * @return the parsed value
     */
    public static BsonValue parseValue(String json) {
        return BsonDocument.parse(WRAPPER_PREFIX + json + "}").get(WRAPPER_FIELD);
    }

    /**
     * Renders a BSON value as relaxed extended JSON. Scalars and arrays are rendered as they
     * would appear inside a document.
     *
     * @param value the value to render, may be null
     * @return JSON text
     */
    public static String toJson(BsonValue value) {
        if (value == null) {
            return "null";
        }
        if (value.isDocument()) {
            return value.asDocument().toJson(RELAXED);
        }
        String json = new BsonDocument(WRAPPER_FIELD, value).toJson(RELAXED);
        if (json.startsWith(WRAPPER_PREFIX) && json.endsWith("}")) {
            return json.substring(WRAPPER_PREFIX.length(), json.length() - 1);
        }
        return json;
    }

    /**
     * Renders a list of BSON values as a JSON array.
     *
     * @param values the values to render
     * @return JSON text
     */
    public static String toJsonArray(List<? extends BsonValue> values) {
        return toJson(new BsonArray(values));
    }
}
