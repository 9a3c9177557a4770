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

import com.docmatch.common.utils.BSONUtil;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonNull;
import org.bson.BsonValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * A value taking part in a comparison: a scalar, a sequence (array) or a structured value
 * (document). Instances are thin read-only views over the underlying BSON; nothing is copied
 * and the wrapped value is never modified.
 */
public sealed interface DocValue {

    /**
     * Wraps a BSON value. A {@code null} reference is treated as BSON null.
     *
     * @param value the value to wrap
     * @return a view tagged with the value's shape
     */
    static DocValue of(BsonValue value) {
        if (value == null) {
            return new Scalar(BsonNull.VALUE);
        }
        if (value.isArray()) {
            return new Sequence(value.asArray());
        }
        if (value.isDocument()) {
            return new Structured(value.asDocument());
        }
        return new Scalar(value);
    }

    /**
     * Converts a plain Java value with {@link BSONUtil#toBsonValue(Object)} and wraps it.
     *
     * @param value a BSON value, a {@code Document}, a {@code Map}, a collection, an array or a boxed primitive
     * @return a view tagged with the value's shape
     * @throws IllegalArgumentException if the value cannot be converted to BSON
     */
    static DocValue of(Object value) {
        return of(BSONUtil.toBsonValue(value));
    }

    ValueKind kind();

    BsonValue bson();

    record Scalar(BsonValue bson) implements DocValue {
        @Override
        public ValueKind kind() {
            return ValueKind.SCALAR;
        }

        @Override
        public String toString() {
            return BSONUtil.toJson(bson);
        }
    }

    record Sequence(BsonArray bson) implements DocValue {
        @Override
        public ValueKind kind() {
            return ValueKind.SEQUENCE;
        }

        public int size() {
            return bson.size();
        }

        public DocValue get(int index) {
            return DocValue.of(bson.get(index));
        }

        public List<DocValue> elements() {
            List<DocValue> elements = new ArrayList<>(bson.size());
            for (BsonValue element : bson) {
                elements.add(DocValue.of(element));
            }
            return elements;
        }

        @Override
        public String toString() {
            return BSONUtil.toJson(bson);
        }
    }

    record Structured(BsonDocument bson) implements DocValue {
        @Override
        public ValueKind kind() {
            return ValueKind.STRUCTURED;
        }

        public Set<String> fieldNames() {
            return bson.keySet();
        }

        public boolean has(String fieldName) {
            return bson.containsKey(fieldName);
        }

        public DocValue get(String fieldName) {
            return DocValue.of(bson.get(fieldName));
        }

        @Override
        public String toString() {
            return BSONUtil.toJson(bson);
        }
    }
}
