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

package com.docmatch.assertion;

import com.docmatch.common.utils.BSONUtil;
import com.docmatch.equality.MatchOptions;
import com.docmatch.equality.ScalarComparators;
import com.docmatch.store.AggregateArgs;
import com.docmatch.store.AggregateCursor;
import com.docmatch.store.DocumentStore;
import org.bson.BsonDocument;
import org.bson.BsonNull;
import org.bson.BsonValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Evaluates a single aggregation expression against one empty document and asserts its value.
 * <p>
 * The collection passed in is scratch space: its contents are replaced on every call.
 */
public class ExpressionEvaluator {
    private static final Logger LOGGER = LoggerFactory.getLogger(ExpressionEvaluator.class);

    private final DocumentStore store;
    private final String outputField;

    public ExpressionEvaluator(DocumentStore store) {
        this(store, MatchOptions.defaults());
    }

    public ExpressionEvaluator(DocumentStore store, MatchOptions options) {
        this.store = store;
        this.outputField = options.getExpressionOutputField();
    }

    /**
     * Computes the result of evaluating {@code expression} and compares it to {@code result}.
     * Replaces the contents of {@code collection} with a single empty document.
     *
     * @param collection scratch collection name
     * @param expression the expression, as BSON or as plain Java values
     * @param result     the expected value
     */
    public void testExpression(String collection, Object expression, Object result) {
        testExpressionWithCollation(collection, expression, result, null);
    }

    /**
     * Same as {@link #testExpression(String, Object, Object)}, evaluated under the given
     * collation. A missing output field compares equal to {@code null}. Numbers of different
     * BSON types are equal when their values are, see {@link #outputEquals(BsonValue, BsonValue)}.
     *
     * @param collationSpec collation document such as {@code {locale: "en_US", strength: 2}}, or {@code null}
     */
    public void testExpressionWithCollation(String collection, Object expression, Object result, @Nullable BsonDocument collationSpec) {
        store.replaceContents(collection, List.of(new BsonDocument()));

        BsonDocument project = new BsonDocument("$project", new BsonDocument(outputField, BSONUtil.toBsonValue(expression)));
        AggregateArgs args = new AggregateArgs();
        if (collationSpec != null) {
            args.collation(collationSpec);
        }
        LOGGER.debug("Evaluating {} on {} with collation {}", project, collection, collationSpec);

        List<BsonDocument> res;
        try (AggregateCursor cursor = store.aggregate(collection, List.of(project), args)) {
            res = cursor.toList();
        }

        String json = BSONUtil.toJsonArray(res);
        assertEquals(1, res.size(), json);

        BsonValue expected = BSONUtil.toBsonValue(result);
        BsonValue actual = res.get(0).get(outputField, BsonNull.VALUE);
        assertTrue(outputEquals(expected, actual), () -> "expected: " + BSONUtil.toJson(expected) + ", results: " + json);
    }

    /**
     * Equality of an expression's value as a shell assertion sees it: numbers compare with
     * {@link ScalarComparators#NATIVE}, so {@code 3} equals {@code 3.0}, while arrays compare
     * by position and documents need the same fields in the same order.
     */
    static boolean outputEquals(BsonValue expected, BsonValue actual) {
        if (expected.isDocument()) {
            if (!actual.isDocument()) {
                return false;
            }
            BsonDocument left = expected.asDocument();
            BsonDocument right = actual.asDocument();
            if (!new ArrayList<>(left.keySet()).equals(new ArrayList<>(right.keySet()))) {
                return false;
            }
            for (String fieldName : left.keySet()) {
                if (!outputEquals(left.get(fieldName), right.get(fieldName))) {
                    return false;
                }
            }
            return true;
        }
        if (expected.isArray()) {
            if (!actual.isArray() || expected.asArray().size() != actual.asArray().size()) {
                return false;
            }
            for (int i = 0; i < expected.asArray().size(); i++) {
                if (!outputEquals(expected.asArray().get(i), actual.asArray().get(i))) {
                    return false;
                }
            }
            return true;
        }
        if (actual.isDocument() || actual.isArray()) {
            return false;
        }
        return ScalarComparators.NATIVE.test(expected, actual);
    }
}
