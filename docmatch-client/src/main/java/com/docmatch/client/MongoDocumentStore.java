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

import com.docmatch.store.AggregateArgs;
import com.docmatch.store.AggregateCursor;
import com.docmatch.store.DocumentStore;
import com.docmatch.store.StoreCommandException;
import com.mongodb.MongoBulkWriteException;
import com.mongodb.MongoCommandException;
import com.mongodb.bulk.BulkWriteError;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import org.bson.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link DocumentStore} backed by a database of the MongoDB synchronous driver.
 * <p>
 * Aggregations are sent as raw {@code aggregate} commands so that server errors reach the
 * caller with their original code, whether they happen on the command or on a later
 * {@code getMore}. The store does not own the client; closing the client is up to the caller.
 */
public class MongoDocumentStore implements DocumentStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(MongoDocumentStore.class);

    private final MongoDatabase database;

    public MongoDocumentStore(MongoDatabase database) {
        this.database = database;
    }

    static StoreCommandException translate(MongoCommandException e) {
        return new StoreCommandException(e.getErrorCode(), e.getErrorCodeName(), e.getErrorMessage(), e.getResponse(), e);
    }

    static StoreCommandException translate(MongoBulkWriteException e) {
        BulkWriteError first = e.getWriteErrors().get(0);
        BsonDocument response = new BsonDocument("ok", new BsonInt32(0))
                .append("code", new BsonInt32(first.getCode()))
                .append("errmsg", new BsonString(first.getMessage()))
                .append("writeErrorCount", new BsonInt32(e.getWriteErrors().size()));
        return new StoreCommandException(first.getCode(), first.getCategory().name(), first.getMessage(), response, e);
    }

    public MongoDatabase getDatabase() {
        return database;
    }

    @Override
    public void replaceContents(String collection, List<BsonDocument> documents) {
        MongoCollection<BsonDocument> target = database.getCollection(collection, BsonDocument.class);
        try {
            long deleted = target.deleteMany(new BsonDocument()).getDeletedCount();
            if (!documents.isEmpty()) {
                // insertMany adds an _id to documents missing one, keep the caller's documents intact
                List<BsonDocument> copies = new ArrayList<>(documents.size());
                for (BsonDocument document : documents) {
                    copies.add(document.clone());
                }
                target.insertMany(copies);
            }
            LOGGER.debug("Replaced {} documents of {} with {} documents", deleted, collection, documents.size());
        } catch (MongoCommandException e) {
            throw translate(e);
        } catch (MongoBulkWriteException e) {
            throw translate(e);
        }
    }

    @Override
    public AggregateCursor aggregate(String collection, List<BsonDocument> pipeline, AggregateArgs args) {
        BsonDocument command = new BsonDocument("aggregate", new BsonString(collection))
                .append("pipeline", new BsonArray(pipeline));
        args.build(command);

        LOGGER.debug("Running {}", command);
        BsonDocument response = runCommand(command);

        BsonDocument cursor = response.getDocument("cursor");
        return new MongoAggregateCursor(
                this,
                collection,
                cursor.getNumber("id").longValue(),
                cursor.getArray("firstBatch"),
                args.getBatchSize()
        );
    }

    BsonDocument runCommand(BsonDocument command) {
        try {
            return database.runCommand(command, BsonDocument.class);
        } catch (MongoCommandException e) {
            throw translate(e);
        }
    }
}
