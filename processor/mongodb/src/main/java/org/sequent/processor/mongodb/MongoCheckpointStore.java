/*
 * Copyright 2023 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.sequent.processor.mongodb;

import com.mongodb.MongoWriteException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.result.UpdateResult;
import org.bson.Document;
import org.jspecify.annotations.Nullable;
import org.sequent.eventstore.api.PositionToken;
import org.sequent.processor.CheckpointStore;
import org.sequent.processor.ProcessorKey;
import org.sequent.processor.StoreCheckpointResult;

import java.time.Clock;
import java.util.Date;

import static com.mongodb.client.model.Filters.and;
import static com.mongodb.client.model.Filters.eq;
import static com.mongodb.client.model.Updates.combine;
import static com.mongodb.client.model.Updates.set;
import static java.util.Objects.requireNonNull;
import static org.sequent.eventstore.mongodb.internal.MongoExceptionTranslator.isDuplicateKey;

/**
 * Stores checkpoints in the {@value #COLLECTION} collection, one document per processor, partition and version.
 * Writes are conditional on the checkpoint the caller last stored.
 */
public class MongoCheckpointStore implements CheckpointStore {
    public static final String COLLECTION = "emt_processors";

    private static final String ID = "_id";
    private static final String PROCESSOR_ID = "processorId";
    private static final String PARTITION = "partition";
    private static final String VERSION = "version";
    private static final String LAST_CHECKPOINT = "lastCheckpoint";
    private static final String UPDATED_AT = "updatedAt";

    private final MongoCollection<Document> collection;
    private final Clock clock;

    public MongoCheckpointStore(MongoDatabase database) {
        this(database, Clock.systemUTC());
    }

    public MongoCheckpointStore(MongoDatabase database, Clock clock) {
        requireNonNull(database, MongoDatabase.class.getSimpleName() + " cannot be null");
        this.collection = database.getCollection(COLLECTION);
        this.clock = requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
    }

    @Override
    public @Nullable PositionToken read(ProcessorKey key) {
        requireNonNull(key, ProcessorKey.class.getSimpleName() + " cannot be null");
        Document document = collection.find(eq(ID, id(key))).first();
        String checkpoint = document == null ? null : document.getString(LAST_CHECKPOINT);
        return checkpoint == null ? null : MongoCheckpoint.parse(checkpoint);
    }

    @Override
    public StoreCheckpointResult store(ProcessorKey key, @Nullable PositionToken lastStoredCheckpoint, PositionToken newCheckpoint) {
        requireNonNull(key, ProcessorKey.class.getSimpleName() + " cannot be null");
        requireNonNull(newCheckpoint, "newCheckpoint cannot be null");

        StoreCheckpointResult.Failure failure = StoreCheckpointResult.classify(read(key), lastStoredCheckpoint, newCheckpoint, false);
        if (failure != null) {
            return failure;
        }

        Date now = Date.from(clock.instant());
        boolean written;
        if (lastStoredCheckpoint == null) {
            try {
                collection.insertOne(new Document(ID, id(key))
                        .append(PROCESSOR_ID, key.processorId())
                        .append(PARTITION, key.partition())
                        .append(VERSION, key.version())
                        .append(LAST_CHECKPOINT, newCheckpoint.asString())
                        .append(UPDATED_AT, now));
                written = true;
            } catch (MongoWriteException e) {
                if (!isDuplicateKey(e)) {
                    throw e;
                }
                written = false;
            }
        } else {
            UpdateResult result = collection.updateOne(and(eq(ID, id(key)), eq(LAST_CHECKPOINT, lastStoredCheckpoint.asString())),
                    combine(set(LAST_CHECKPOINT, newCheckpoint.asString()), set(UPDATED_AT, now)));
            written = result.getMatchedCount() == 1;
        }

        if (written) {
            return StoreCheckpointResult.success(newCheckpoint);
        }
        StoreCheckpointResult.Failure raced = StoreCheckpointResult.classify(read(key), lastStoredCheckpoint, newCheckpoint, false);
        return raced == null ? StoreCheckpointResult.failure(StoreCheckpointResult.Reason.MISMATCH) : raced;
    }

    @Override
    public void reset(ProcessorKey key) {
        requireNonNull(key, ProcessorKey.class.getSimpleName() + " cannot be null");
        collection.deleteOne(eq(ID, id(key)));
    }

    private static String id(ProcessorKey key) {
        return key.partition() + ":" + key.processorId() + ":" + key.version();
    }
}
