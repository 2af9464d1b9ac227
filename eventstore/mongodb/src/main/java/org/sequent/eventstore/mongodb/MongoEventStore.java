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

package org.sequent.eventstore.mongodb;

import com.fasterxml.jackson.databind.JsonNode;
import com.mongodb.ConnectionString;
import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.*;
import com.mongodb.client.result.UpdateResult;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.jspecify.annotations.Nullable;
import org.sequent.eventstore.api.*;
import org.sequent.eventstore.mongodb.internal.StreamDocumentMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import static com.mongodb.client.model.Filters.and;
import static com.mongodb.client.model.Filters.eq;
import static java.util.Objects.requireNonNull;
import static org.sequent.eventstore.mongodb.internal.MongoExceptionTranslator.isDuplicateKey;
import static org.sequent.eventstore.mongodb.internal.StreamDocumentMapper.*;

/**
 * This is an {@link EventStore} that stores each stream as a single MongoDB document using the "native" synchronous java driver.
 * Messages are kept in the {@value StreamDocumentMapper#MESSAGES} array of the document and inline projections in the
 * {@value StreamDocumentMapper#PROJECTIONS} sub document, which makes every append a single atomic document update whose
 * filter includes the stream position that the append was based on.
 * <p>
 * Messages read from this store have no global position, global positions are assigned by the change stream.
 */
public class MongoEventStore implements EventStore, Closeable {
    private static final Logger log = LoggerFactory.getLogger(MongoEventStore.class);

    private final MongoClient mongoClient;
    private final boolean ownsMongoClient;
    private final MongoDatabase database;
    private final MongoEventStoreConfig config;
    private final StreamDocumentMapper mapper;
    private final Map<String, MongoCollection<Document>> collections = new ConcurrentHashMap<>();

    /**
     * Create a new instance of {@code MongoEventStore}. The {@code mongoClient} is not closed by {@link #close()}.
     *
     * @param mongoClient The mongo client that the {@code MongoEventStore} will use
     * @param config      The {@link MongoEventStoreConfig} that will be used
     */
    public MongoEventStore(MongoClient mongoClient, MongoEventStoreConfig config) {
        this(mongoClient, config, false);
    }

    private MongoEventStore(MongoClient mongoClient, MongoEventStoreConfig config, boolean ownsMongoClient) {
        requireNonNull(mongoClient, "Mongo client cannot be null");
        requireNonNull(config, MongoEventStoreConfig.class.getSimpleName() + " cannot be null");
        this.mongoClient = mongoClient;
        this.ownsMongoClient = ownsMongoClient;
        this.config = config;
        this.database = mongoClient.getDatabase(config.databaseName);
        this.mapper = new StreamDocumentMapper(config.objectMapper);
    }

    /**
     * Create a {@code MongoEventStore} that creates, and owns, its {@link MongoClient}. The database name is taken from the connection string.
     * The client is closed when calling {@link #close()}.
     */
    public static MongoEventStore create(ConnectionString connectionString) {
        return create(connectionString, new MongoEventStoreConfig.Builder());
    }

    public static MongoEventStore create(ConnectionString connectionString, MongoEventStoreConfig.Builder config) {
        requireNonNull(connectionString, ConnectionString.class.getSimpleName() + " cannot be null");
        String databaseName = requireNonNull(connectionString.getDatabase(), "Database must be defined in the connection string");
        return new MongoEventStore(MongoClients.create(connectionString), config.databaseName(databaseName).build(), true);
    }

    @Override
    public AppendResult appendToStream(String streamName, List<Message> messages, ExpectedStreamVersion expectedVersion) {
        StreamName.requireValid(streamName);
        requireNonNull(messages, "messages cannot be null");
        requireNonNull(expectedVersion, ExpectedStreamVersion.class.getSimpleName() + " cannot be null");

        MongoCollection<Document> collection = collectionFor(streamName);
        Document current = collection.find(eq(STREAM_NAME, streamName)).projection(Projections.include(STREAM_POSITION, PROJECTIONS)).first();
        boolean streamExists = current != null;
        long currentVersion = streamExists ? streamPosition(current) : 0;
        if (!expectedVersion.isFulfilledBy(streamExists, currentVersion)) {
            throw new ExpectedVersionConflictException(streamName, expectedVersion, currentVersion);
        } else if (messages.isEmpty()) {
            return new AppendResult(currentVersion, false);
        }

        Instant now = config.clock.instant().truncatedTo(ChronoUnit.MILLIS);
        List<RecordedMessage> recorded = new ArrayList<>(messages.size());
        List<Document> messageDocuments = new ArrayList<>(messages.size());
        for (int i = 0; i < messages.size(); i++) {
            long streamPosition = currentVersion + i + 1;
            recorded.add(new RecordedMessage(messages.get(i), streamName, streamPosition, null, now));
            messageDocuments.add(mapper.toDocument(messages.get(i), streamName, streamPosition, now));
        }
        long nextVersion = currentVersion + messages.size();

        List<Bson> updates = new ArrayList<>();
        updates.add(Updates.pushEach(MESSAGES, messageDocuments));
        updates.add(Updates.set(STREAM_POSITION, nextVersion));
        updates.add(Updates.set(METADATA + ".updatedAt", Date.from(now)));
        updates.add(Updates.setOnInsert(METADATA + ".streamId", StreamName.streamId(streamName)));
        updates.add(Updates.setOnInsert(METADATA + ".streamType", StreamName.streamType(streamName)));
        updates.add(Updates.setOnInsert(METADATA + ".createdAt", Date.from(now)));
        updates.addAll(inlineProjectionUpdates(current, recorded, nextVersion));

        Bson filter = and(eq(STREAM_NAME, streamName), eq(STREAM_POSITION, currentVersion));
        try {
            UpdateResult result = collection.updateOne(filter, Updates.combine(updates), new UpdateOptions().upsert(!streamExists));
            if (result.getMatchedCount() == 0 && result.getUpsertedId() == null) {
                throw new ExpectedVersionConflictException(streamName, expectedVersion, readStreamPosition(collection, streamName));
            }
        } catch (MongoException e) {
            if (isDuplicateKey(e)) {
                throw new ExpectedVersionConflictException(streamName, expectedVersion, readStreamPosition(collection, streamName), e);
            }
            throw e;
        }

        AfterCommitHook.invokeAll(config.afterCommitHooks, streamName, recorded);
        return new AppendResult(nextVersion, !streamExists);
    }

    @Override
    public ReadStreamResult readStream(String streamName, ReadStreamOptions options) {
        StreamName.requireValid(streamName);
        requireNonNull(options, ReadStreamOptions.class.getSimpleName() + " cannot be null");

        Bson messagesProjection;
        int skip = (int) Math.max(0, options.fromPosition() - 1);
        if (options.toPosition() == null) {
            messagesProjection = skip == 0 ? Projections.include(MESSAGES) : Projections.slice(MESSAGES, skip, Integer.MAX_VALUE);
        } else {
            int limit = (int) Math.max(0, options.toPosition() - skip);
            messagesProjection = Projections.slice(MESSAGES, skip, Math.max(limit, 1));
        }
        Document document = collectionFor(streamName).find(eq(STREAM_NAME, streamName))
                .projection(Projections.fields(messagesProjection, Projections.include(STREAM_POSITION)))
                .first();

        boolean streamExists = document != null;
        long currentVersion = streamExists ? streamPosition(document) : 0;
        if (!options.expectedVersion().isFulfilledBy(streamExists, currentVersion)) {
            throw new ExpectedVersionConflictException(streamName, options.expectedVersion(), currentVersion);
        } else if (!streamExists) {
            return ReadStreamResult.streamNotFound();
        }

        List<RecordedMessage> messages = document.getList(MESSAGES, Document.class, Collections.emptyList()).stream()
                .map(mapper::toRecordedMessage)
                .filter(message -> options.includes(message.streamPosition()))
                .collect(Collectors.toList());
        return new ReadStreamResult(messages, currentVersion, true);
    }

    /**
     * Find the document of an inline projection
     *
     * @param name       The name of the inline projection
     * @param streamName The stream that the document was projected from
     * @return The document, without its {@value StreamDocumentMapper#PROJECTION_METADATA} field, or {@code Optional.empty()} if the stream has no such projection
     */
    public Optional<JsonNode> findInlineProjection(String name, String streamName) {
        String field = PROJECTIONS + "." + name;
        Document document = collectionFor(streamName).find(eq(STREAM_NAME, streamName)).projection(Projections.include(field)).first();
        return Optional.ofNullable(document)
                .map(d -> d.get(PROJECTIONS, Document.class))
                .map(projections -> projections.get(name, Document.class))
                .map(this::withoutProjectionMetadata);
    }

    /**
     * @return The name of the collection that stores the given stream
     */
    public String collectionName(String streamName) {
        return config.storageStrategy.collectionName(StreamName.streamType(streamName));
    }

    public MongoDatabase database() {
        return database;
    }

    @Override
    public void close() {
        if (ownsMongoClient) {
            mongoClient.close();
        }
    }

    private List<Bson> inlineProjectionUpdates(@Nullable Document current, List<RecordedMessage> recorded, long nextVersion) {
        List<Bson> updates = new ArrayList<>();
        Document currentProjections = current == null ? null : current.get(PROJECTIONS, Document.class);
        for (InlineProjection<JsonNode> projection : config.inlineProjections) {
            if (!projection.canHandleAny(recorded)) {
                continue;
            }
            Document previous = currentProjections == null ? null : currentProjections.get(projection.name(), Document.class);
            JsonNode projected = projection.project(previous == null ? null : withoutProjectionMetadata(previous), recorded);
            String field = PROJECTIONS + "." + projection.name();
            if (projected == null) {
                updates.add(Updates.unset(field));
            } else {
                Document document = mapper.toBson(projected);
                document.put(PROJECTION_METADATA, new Document("name", projection.name()).append("streamPosition", nextVersion));
                updates.add(Updates.set(field, document));
            }
            log.debug("Updating inline projection {} at stream position {}", projection.name(), nextVersion);
        }
        return updates;
    }

    private JsonNode withoutProjectionMetadata(Document projection) {
        Document copy = new Document(projection);
        copy.remove(PROJECTION_METADATA);
        return mapper.toJson(copy);
    }

    private MongoCollection<Document> collectionFor(String streamName) {
        return collections.computeIfAbsent(collectionName(streamName), collectionName -> {
            MongoCollection<Document> collection = database.getCollection(collectionName);
            collection.createIndex(Indexes.ascending(STREAM_NAME), new IndexOptions().unique(true));
            return collection;
        });
    }

    private static long readStreamPosition(MongoCollection<Document> collection, String streamName) {
        Document document = collection.find(eq(STREAM_NAME, streamName)).projection(Projections.include(STREAM_POSITION)).first();
        return document == null ? 0 : streamPosition(document);
    }

    private static long streamPosition(Document document) {
        Number streamPosition = document.getEmbedded(List.of(METADATA, "streamPosition"), Number.class);
        return streamPosition == null ? 0 : streamPosition.longValue();
    }
}
