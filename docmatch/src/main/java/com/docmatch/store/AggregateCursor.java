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

import java.io.Closeable;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Iterates over the documents returned by an aggregation. Fetching a further batch may fail
 * with a {@link StoreCommandException}, so errors can surface long after the command itself
 * succeeded.
 */
public interface AggregateCursor extends Iterator<BsonDocument>, Closeable {

    /**
     * Releases server side resources held by the cursor. Closing an exhausted cursor is a no-op.
     */
    @Override
    void close();

    /**
     * Exhausts the cursor and returns the number of documents it produced.
     *
     * @throws StoreCommandException if a batch cannot be fetched
     */
    default int itcount() {
        int count = 0;
        while (hasNext()) {
            next();
            count++;
        }
        return count;
    }

    /**
     * Exhausts the cursor into a list.
     *
     * @throws StoreCommandException if a batch cannot be fetched
     */
    default List<BsonDocument> toList() {
        List<BsonDocument> documents = new ArrayList<>();
        while (hasNext()) {
            documents.add(next());
        }
        return documents;
    }
}
