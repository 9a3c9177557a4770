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

package com.docmatch.store;

import org.bson.BsonDocument;

import java.util.List;

/**
 * The slice of a document database the assertion helpers need.
 */
public interface DocumentStore {

    /**
     * Removes every document of the collection, then inserts the given ones.
     *
     * @param collection  collection name
     * @param documents   documents to insert, may be empty
     * @throws StoreCommandException if the database rejects the removal or the insert
     */
    void replaceContents(String collection, List<BsonDocument> documents);

    /**
     * Runs an aggregation pipeline against a collection.
     *
     * @param collection collection name
     * @param pipeline   pipeline stages
     * @param args       cursor and collation options
     * @return a cursor over the results, to be closed by the caller
     * @throws StoreCommandException if the command itself fails
     */
    AggregateCursor aggregate(String collection, List<BsonDocument> pipeline, AggregateArgs args);
}
