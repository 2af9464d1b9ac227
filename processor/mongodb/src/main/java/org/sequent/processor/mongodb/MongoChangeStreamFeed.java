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

import com.mongodb.MongoException;
import com.mongodb.MongoNotPrimaryException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.client.ChangeStreamIterable;
import com.mongodb.client.MongoChangeStreamCursor;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Aggregates;
import com.mongodb.client.model.changestream.ChangeStreamDocument;
import com.mongodb.client.model.changestream.FullDocument;
import com.mongodb.client.model.changestream.OperationType;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonDocumentReader;
import org.bson.BsonValue;
import org.bson.Document;
import org.bson.codecs.DecoderContext;
import org.bson.codecs.DocumentCodec;
import org.bson.conversions.Bson;
import org.jspecify.annotations.Nullable;
import org.sequent.eventstore.api.RecordedMessage;
import org.sequent.eventstore.mongodb.internal.StreamDocumentMapper;
import org.sequent.processor.MessageFeed;
import org.sequent.processor.StartFrom;
import org.sequent.retry.RetryStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;

import static com.mongodb.client.model.Filters.*;
import static java.util.Objects.requireNonNull;
import static org.sequent.eventstore.mongodb.StorageStrategy.COLLECTION_PREFIX;
import static org.sequent.eventstore.mongodb.internal.StreamDocumentMapper.MESSAGES;

/**
 * Reads appended messages from a database level change stream on all stream collections. Every message gets a
 * {@link MongoCheckpoint} made of the resume token of its change event and its index among the messages of that event.
 * <p>
 * The change stream can't be replayed from the beginning of time, so {@link StartFrom#beginning()} and {@link StartFrom#end()}
 * both start at the time the feed is opened. A checkpoint resumes after the change event of the checkpoint. If MongoDB becomes
 * unavailable the feed resubscribes after the last change it has seen.
 */
public class MongoChangeStreamFeed implements MessageFeed {
    private static final Logger log = LoggerFactory.getLogger(MongoChangeStreamFeed.class);
    private static final String MESSAGES_PREFIX = MESSAGES + ".";
    private static final String RESUMABLE_CHANGE_STREAM_ERROR = "ResumableChangeStreamError";

    private final MongoDatabase database;
    private final StreamDocumentMapper mapper;
    private final int batchSize;
    private final long maxAwaitTimeMillis;
    private final RetryStrategy resubscribeRetryStrategy;
    private final DocumentCodec documentCodec = new DocumentCodec();
    private final Deque<RecordedMessage> pending = new ArrayDeque<>();

    private volatile @Nullable MongoChangeStreamCursor<ChangeStreamDocument<Document>> cursor;
    private volatile boolean open;
    private @Nullable BsonDocument lastResumeToken;
    private @Nullable FullDocument fullDocument;

    public MongoChangeStreamFeed(MongoDatabase database, MongoConsumerConfig config) {
        requireNonNull(database, MongoDatabase.class.getSimpleName() + " cannot be null");
        requireNonNull(config, MongoConsumerConfig.class.getSimpleName() + " cannot be null");
        this.database = database;
        this.mapper = new StreamDocumentMapper(config.objectMapper);
        this.batchSize = config.batchSize;
        this.maxAwaitTimeMillis = config.maxAwaitTime.toMillis();
        this.resubscribeRetryStrategy = config.resubscribeRetryStrategy instanceof RetryStrategy.Retry retry ?
                retry.mapRetryPredicate(predicate -> predicate.and(MongoChangeStreamFeed::isMongoUnavailable))
                        .onError(e -> log.warn("Failed to resubscribe to change stream: {}", e.getMessage())) :
                config.resubscribeRetryStrategy;
    }

    @Override
    public synchronized void open(StartFrom startFrom) {
        requireNonNull(startFrom, StartFrom.class.getSimpleName() + " cannot be null");
        if (fullDocument == null) {
            fullDocument = fullDocumentFor(database);
        }
        final BsonDocument startAfter;
        if (startFrom instanceof StartFrom.Checkpoint checkpoint) {
            if (!(checkpoint.token() instanceof MongoCheckpoint mongoCheckpoint)) {
                throw new IllegalArgumentException("Cannot read from " + checkpoint.token() + ", expected a " + MongoCheckpoint.class.getSimpleName());
            }
            startAfter = mongoCheckpoint.resumeTokenDocument();
        } else if (startFrom instanceof StartFrom.Beginning || startFrom instanceof StartFrom.End) {
            startAfter = null;
        } else {
            throw new IllegalArgumentException("Cannot open feed from " + startFrom);
        }
        pending.clear();
        lastResumeToken = startAfter;
        cursor = resubscribeRetryStrategy.execute(() -> watch(startAfter));
        open = true;
        log.debug("Watching database '{}' from {}", database.getName(), startFrom);
    }

    @Override
    public synchronized List<RecordedMessage> nextBatch() {
        List<RecordedMessage> batch = new ArrayList<>();
        while (open && batch.size() < batchSize) {
            if (pending.isEmpty()) {
                ChangeStreamDocument<Document> change = tryNext();
                if (change == null) {
                    break;
                }
                pending.addAll(messagesOf(change));
            }
            while (!pending.isEmpty() && batch.size() < batchSize) {
                batch.add(pending.poll());
            }
        }
        return open ? batch : Collections.emptyList();
    }

    /**
     * Close the change stream. May be called from another thread than the one reading batches.
     */
    @Override
    public void close() {
        open = false;
        closeCursor();
    }

    private @Nullable ChangeStreamDocument<Document> tryNext() {
        MongoChangeStreamCursor<ChangeStreamDocument<Document>> current = cursor;
        if (current == null) {
            return null;
        }
        try {
            ChangeStreamDocument<Document> change = current.tryNext();
            BsonDocument resumeToken = current.getResumeToken();
            if (resumeToken != null) {
                lastResumeToken = resumeToken;
            }
            return change;
        } catch (MongoException | IllegalStateException e) {
            if (!open) {
                log.debug("Caught {} (message={}), this might happen when the cursor is closed.", e.getClass().getName(), e.getMessage());
                return null;
            }
            if (!isMongoUnavailable(e)) {
                throw e;
            }
            log.warn("Change stream was interrupted ({}), resubscribing after {}", e.getMessage(), lastResumeToken);
            closeCursor();
            BsonDocument resumeToken = lastResumeToken;
            cursor = resubscribeRetryStrategy.execute(() -> watch(resumeToken));
            return null;
        }
    }

    private MongoChangeStreamCursor<ChangeStreamDocument<Document>> watch(@Nullable BsonDocument startAfter) {
        List<Bson> pipeline = List.of(Aggregates.match(and(
                regex("ns.coll", "^" + COLLECTION_PREFIX),
                in("operationType", OperationType.INSERT.getValue(), OperationType.UPDATE.getValue(), OperationType.REPLACE.getValue()))));
        ChangeStreamIterable<Document> changeStream = database.watch(pipeline)
                .fullDocument(requireNonNull(fullDocument))
                .batchSize(batchSize)
                .maxAwaitTime(maxAwaitTimeMillis, TimeUnit.MILLISECONDS);
        if (startAfter != null) {
            changeStream = changeStream.startAfter(startAfter);
        }
        return changeStream.cursor();
    }

    private List<RecordedMessage> messagesOf(ChangeStreamDocument<Document> change) {
        List<Document> appended = new ArrayList<>();
        OperationType operationType = change.getOperationType();
        if (operationType == OperationType.INSERT || operationType == OperationType.REPLACE) {
            Document fullDocument = change.getFullDocument();
            if (fullDocument != null) {
                appended.addAll(fullDocument.getList(MESSAGES, Document.class, Collections.emptyList()));
            }
        } else if (operationType == OperationType.UPDATE && change.getUpdateDescription() != null && change.getUpdateDescription().getUpdatedFields() != null) {
            appended.addAll(appendedMessages(change.getUpdateDescription().getUpdatedFields()));
        }

        BsonDocument resumeToken = requireNonNull(change.getResumeToken(), "Change event without resume token");
        List<RecordedMessage> messages = new ArrayList<>(appended.size());
        for (int i = 0; i < appended.size(); i++) {
            messages.add(mapper.toRecordedMessage(appended.get(i)).withGlobalPosition(MongoCheckpoint.of(resumeToken, i)));
        }
        return messages;
    }

    // $push reports every appended element as "messages.<index>", a replaced array is reported as "messages"
    private List<Document> appendedMessages(BsonDocument updatedFields) {
        Map<Integer, Document> byIndex = new TreeMap<>();
        List<Document> replaced = new ArrayList<>();
        for (Map.Entry<String, BsonValue> field : updatedFields.entrySet()) {
            String name = field.getKey();
            if (name.startsWith(MESSAGES_PREFIX) && field.getValue().isDocument()) {
                String index = name.substring(MESSAGES_PREFIX.length());
                if (index.chars().allMatch(Character::isDigit)) {
                    byIndex.put(Integer.parseInt(index), decode(field.getValue().asDocument()));
                }
            } else if (name.equals(MESSAGES) && field.getValue().isArray()) {
                BsonArray array = field.getValue().asArray();
                for (BsonValue value : array) {
                    replaced.add(decode(value.asDocument()));
                }
            }
        }
        return byIndex.isEmpty() ? replaced : new ArrayList<>(byIndex.values());
    }

    private Document decode(BsonDocument document) {
        return documentCodec.decode(new BsonDocumentReader(document), DecoderContext.builder().build());
    }

    private void closeCursor() {
        MongoChangeStreamCursor<ChangeStreamDocument<Document>> current = cursor;
        cursor = null;
        if (current != null) {
            try {
                current.close();
            } catch (RuntimeException e) {
                log.debug("Caught {} when closing change stream cursor (message={})", e.getClass().getName(), e.getMessage());
            }
        }
    }

    /**
     * Pick the richest full document mode that the server supports
     */
    static FullDocument fullDocumentFor(MongoDatabase database) {
        Document buildInfo = database.runCommand(new Document("buildInfo", 1));
        String version = buildInfo.getString("version");
        int major = majorVersion(version);
        if (major >= 6) {
            return FullDocument.WHEN_AVAILABLE;
        } else if (major == 5) {
            return FullDocument.UPDATE_LOOKUP;
        }
        log.warn("MongoDB {} doesn't support full documents in change streams, falling back to the default", version);
        return FullDocument.DEFAULT;
    }

    static int majorVersion(@Nullable String version) {
        if (version == null) {
            return 0;
        }
        int dot = version.indexOf('.');
        try {
            return Integer.parseInt(dot < 0 ? version : version.substring(0, dot));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    static boolean isMongoUnavailable(Throwable e) {
        return e instanceof MongoSocketException
                || e instanceof MongoTimeoutException
                || e instanceof MongoNotPrimaryException
                || (e instanceof MongoException mongoException && mongoException.hasErrorLabel(RESUMABLE_CHANGE_STREAM_ERROR));
    }
}
