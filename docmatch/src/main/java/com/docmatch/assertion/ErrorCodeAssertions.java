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
import com.docmatch.store.AggregateArgs;
import com.docmatch.store.AggregateCursor;
import com.docmatch.store.DocumentStore;
import com.docmatch.store.StoreCommandException;
import org.bson.BsonDocument;
import org.bson.BsonValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Asserts that aggregations fail with a given error code.
 */
public class ErrorCodeAssertions {
    private static final Logger LOGGER = LoggerFactory.getLogger(ErrorCodeAssertions.class);

    private final DocumentStore store;

    public ErrorCodeAssertions(DocumentStore store) {
        this.store = store;
    }

    /**
     * Accepts a single stage or a list of stages.
     */
    static List<BsonDocument> toPipeline(Object pipe) {
        BsonValue value = BSONUtil.toBsonValue(pipe);
        List<BsonDocument> pipeline = new ArrayList<>();
        if (!value.isArray()) {
            value = BSONUtil.toBsonArray(List.of(value));
        }
        for (BsonValue stage : value.asArray()) {
            if (!stage.isDocument()) {
                throw new IllegalArgumentException("Each pipeline stage must be a document: " + BSONUtil.toJson(stage));
            }
            pipeline.add(stage.asDocument());
        }
        return pipeline;
    }

    public void assertErrorCode(String collection, Object pipe, int code) {
        assertErrorCode(collection, pipe, code, null);
    }

    /**
     * Asserts that the given aggregation fails with a specific code. The failure may come from
     * the command itself or, as the first batch is empty, from iterating its cursor.
     *
     * @param errmsg when not {@code null}, a substring the error message must contain
     */
    public void assertErrorCode(String collection, Object pipe, int code, @Nullable String errmsg) {
        List<BsonDocument> pipeline = toPipeline(pipe);

        AggregateCursor cursor;
        try {
            cursor = store.aggregate(collection, pipeline, AggregateArgs.Builder.batchSize(0));
        } catch (StoreCommandException e) {
            LOGGER.debug("aggregate on {} failed with code {}", collection, e.getCode());
            assertFailure(e, code, errmsg);
            return;
        }

        try (cursor) {
            StoreCommandException error = assertThrows(StoreCommandException.class, cursor::itcount, "expected error: " + code);
            assertFailure(error, code, errmsg);
        }
    }

    /**
     * Asserts that an aggregation fails with a specific code and the error message contains
     * the given string.
     */
    public void assertErrMsgContains(String collection, Object pipe, int code, String expectedMessage) {
        List<BsonDocument> pipeline = toPipeline(pipe);
        StoreCommandException error = assertThrows(
                StoreCommandException.class,
                () -> store.aggregate(collection, pipeline, new AggregateArgs()).close(),
                "command worked, expected failure with code " + code
        );
        assertEquals(code, error.getCode(), BSONUtil.toJson(error.getResponse()));
        assertMessageContains(error, expectedMessage);
    }

    private void assertFailure(StoreCommandException error, int code, @Nullable String errmsg) {
        assertEquals(code, error.getCode(), BSONUtil.toJson(error.getResponse()));
        if (errmsg != null) {
            assertMessageContains(error, errmsg);
        }
    }

    private void assertMessageContains(StoreCommandException error, String expectedMessage) {
        assertNotEquals(
                -1,
                error.getErrmsg().indexOf(expectedMessage),
                "Error message did not contain '" + expectedMessage + "', found:\n" + BSONUtil.toJson(error.getResponse())
        );
    }
}
