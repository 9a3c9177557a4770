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
import org.bson.BsonInt32;

/**
 * Optional parts of an {@code aggregate} command.
 */
public class AggregateArgs {
    private Integer batchSize;
    private BsonDocument collation;

    public AggregateArgs batchSize(int batchSize) {
        if (batchSize < 0) {
            throw new IllegalArgumentException("batchSize cannot be negative");
        }
        this.batchSize = batchSize;
        return this;
    }

    public AggregateArgs collation(BsonDocument collation) {
        this.collation = collation;
        return this;
    }

    public Integer getBatchSize() {
        return batchSize;
    }

    public BsonDocument getCollation() {
        return collation;
    }

    /**
     * Appends the {@code cursor} and, if set, {@code collation} fields to an aggregate command.
     *
     * @param command the command document, modified in place
     */
    public void build(BsonDocument command) {
        BsonDocument cursor = new BsonDocument();
        if (batchSize != null) {
            cursor.put("batchSize", new BsonInt32(batchSize));
        }
        command.put("cursor", cursor);

        if (collation != null) {
            if (collation.isEmpty()) {
                throw new IllegalArgumentException("collation cannot be empty");
            }
            command.put("collation", collation);
        }
    }

    public static class Builder {
        private Builder() {
        }

        public static AggregateArgs batchSize(int batchSize) {
            return new AggregateArgs().batchSize(batchSize);
        }

        public static AggregateArgs collation(BsonDocument collation) {
            return new AggregateArgs().collation(collation);
        }
    }
}
