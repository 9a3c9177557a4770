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

package com.docmatch.client;

import com.docmatch.store.AggregateCursor;
import com.docmatch.store.StoreCommandException;
import org.bson.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Follows a server side cursor batch by batch with {@code getMore} until its id drops to zero.
 */
class MongoAggregateCursor implements AggregateCursor {
    private static final Logger LOGGER = LoggerFactory.getLogger(MongoAggregateCursor.class);

    private final MongoDocumentStore store;
    private final String collection;
    private final Integer batchSize;
    private final Deque<BsonDocument> buffer = new ArrayDeque<>();
    private long cursorId;

    MongoAggregateCursor(MongoDocumentStore store, String collection, long cursorId, BsonArray firstBatch, Integer batchSize) {
        this.store = store;
        this.collection = collection;
        this.cursorId = cursorId;
        this.batchSize = batchSize;
        fill(firstBatch);
    }

    private void fill(BsonArray batch) {
        for (BsonValue document : batch) {
            buffer.add(document.asDocument());
        }
    }

    private void getMore() {
        BsonDocument command = new BsonDocument("getMore", new BsonInt64(cursorId))
                .append("collection", new BsonString(collection));
        if (batchSize != null && batchSize > 0) {
            command.append("batchSize", new BsonInt32(batchSize));
        }

        BsonDocument response;
        try {
            response = store.runCommand(command);
        } catch (StoreCommandException e) {
            // A failed getMore leaves nothing to kill on the server
            cursorId = 0;
            throw e;
        }

        BsonDocument cursor = response.getDocument("cursor");
        cursorId = cursor.getNumber("id").longValue();
        fill(cursor.getArray("nextBatch"));
    }

    @Override
    public boolean hasNext() {
        while (buffer.isEmpty() && cursorId != 0) {
            getMore();
        }
        return !buffer.isEmpty();
    }

    @Override
    public BsonDocument next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return buffer.poll();
    }

    @Override
    public void close() {
        buffer.clear();
        if (cursorId == 0) {
            return;
        }
        BsonDocument command = new BsonDocument("killCursors", new BsonString(collection))
                .append("cursors", new BsonArray(List.of(new BsonInt64(cursorId))));
        cursorId = 0;
        try {
            store.runCommand(command);
        } catch (StoreCommandException e) {
            LOGGER.warn("Failed to kill cursor on {}: {}", collection, e.getMessage());
        }
    }
}
