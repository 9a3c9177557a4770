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
import com.docmatch.store.StoreCommandException;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

class MongoDocumentStoreTest extends BaseMongoTest {
    private static final String COLLECTION = "store_test";

    private List<BsonDocument> findAll() {
        return database.getCollection(COLLECTION, BsonDocument.class).find().into(new ArrayList<>());
    }

    @Test
    void test_replaceContents() {
        store.replaceContents(COLLECTION, List.of(BsonDocument.parse("{_id: 1, a: 1}"), BsonDocument.parse("{_id: 2, a: 2}")));
        store.replaceContents(COLLECTION, List.of(BsonDocument.parse("{_id: 3, a: 3}")));

        assertThat(findAll()).containsExactly(BsonDocument.parse("{_id: 3, a: 3}"));
    }

    @Test
    void test_replaceContents_empty() {
        store.replaceContents(COLLECTION, List.of(BsonDocument.parse("{_id: 1}")));
        store.replaceContents(COLLECTION, List.of());

        assertThat(findAll()).isEmpty();
    }

    @Test
    void test_replaceContents_keepsCallerDocuments() {
        BsonDocument document = new BsonDocument();
        store.replaceContents(COLLECTION, List.of(document));

        assertThat(document).isEmpty();
        assertThat(findAll()).hasSize(1);
        assertThat(findAll().get(0).containsKey("_id")).isTrue();
    }

    @Test
    void test_replaceContents_duplicateKey() {
        assertThatExceptionOfType(StoreCommandException.class)
                .isThrownBy(() -> store.replaceContents(COLLECTION, List.of(BsonDocument.parse("{_id: 1}"), BsonDocument.parse("{_id: 1}"))))
                .satisfies(e -> assertThat(e.getCode()).isEqualTo(11000));
    }

    @Test
    void test_aggregate() {
        store.replaceContents(COLLECTION, List.of(
                BsonDocument.parse("{_id: 1, a: 1}"),
                BsonDocument.parse("{_id: 2, a: 2}"),
                BsonDocument.parse("{_id: 3, a: 3}")
        ));

        List<BsonDocument> pipeline = List.of(BsonDocument.parse("{$match: {a: {$gte: 2}}}"), BsonDocument.parse("{$sort: {a: 1}}"));
        try (AggregateCursor cursor = store.aggregate(COLLECTION, pipeline, new AggregateArgs())) {
            assertThat(cursor.toList()).containsExactly(BsonDocument.parse("{_id: 2, a: 2}"), BsonDocument.parse("{_id: 3, a: 3}"));
            assertThat(cursor.hasNext()).isFalse();
        }
    }

    @Test
    void test_aggregate_smallBatches() {
        List<BsonDocument> documents = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            documents.add(new BsonDocument("_id", new BsonInt32(i)));
        }
        store.replaceContents(COLLECTION, documents);

        try (AggregateCursor cursor = store.aggregate(COLLECTION, List.of(BsonDocument.parse("{$match: {}}")), AggregateArgs.Builder.batchSize(3))) {
            assertThat(cursor.itcount()).isEqualTo(10);
        }
    }

    @Test
    void test_aggregate_closeEarly() {
        List<BsonDocument> documents = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            documents.add(new BsonDocument("_id", new BsonInt32(i)));
        }
        store.replaceContents(COLLECTION, documents);

        AggregateCursor cursor = store.aggregate(COLLECTION, List.of(BsonDocument.parse("{$match: {}}")), AggregateArgs.Builder.batchSize(2));
        assertThat(cursor.next()).isNotNull();
        cursor.close();

        assertThat(cursor.hasNext()).isFalse();
    }

    @Test
    void test_aggregate_unknownStage() {
        store.replaceContents(COLLECTION, List.of(new BsonDocument()));

        assertThatExceptionOfType(StoreCommandException.class)
                .isThrownBy(() -> store.aggregate(COLLECTION, List.of(BsonDocument.parse("{$unknown: {}}")), new AggregateArgs()))
                .withMessageContaining("Command failed with error 40324 (Location40324): 'Unrecognized pipeline stage name: '$unknown'")
                .satisfies(e -> {
                    assertThat(e.getCode()).isEqualTo(40324);
                    assertThat(e.getCodeName()).isEqualTo("Location40324");
                    assertThat(e.getResponse().getNumber("ok").intValue()).isZero();
                });
    }
}
