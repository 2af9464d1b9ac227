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

package org.sequent.eventstore.postgresql;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;
import org.sequent.eventstore.api.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * This is an {@link EventStore} that stores messages in PostgreSQL using Spring's {@link JdbcTemplate}. Each append
 * runs in a single transaction that also updates the configured inline projections. The current version of each
 * stream is kept in {@code emt_streams} and the row is locked during an append so that concurrent appenders
 * to the same stream are serialized by the database.
 */
public class PostgresEventStore implements EventStore {
    private static final Logger log = LoggerFactory.getLogger(PostgresEventStore.class);

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final TransactionTemplate readTransactionTemplate;
    private final RecordedMessageRowMapper rowMapper;
    private final PostgresEventStoreConfig config;

    /**
     * Create a new instance of {@code PostgresEventStore} with the default configuration
     *
     * @param dataSource The data source to use, it's not closed by the event store
     */
    public PostgresEventStore(DataSource dataSource) {
        this(dataSource, PostgresEventStoreConfig.defaultConfig());
    }

    /**
     * Create a new instance of {@code PostgresEventStore}
     *
     * @param dataSource The data source to use, it's not closed by the event store
     * @param config     The {@link PostgresEventStoreConfig} that will be used
     */
    public PostgresEventStore(DataSource dataSource, PostgresEventStoreConfig config) {
        requireNonNull(dataSource, DataSource.class.getSimpleName() + " cannot be null");
        requireNonNull(config, PostgresEventStoreConfig.class.getSimpleName() + " cannot be null");
        this.config = config;
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        DataSourceTransactionManager transactionManager = new DataSourceTransactionManager(dataSource);
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.readTransactionTemplate = new TransactionTemplate(transactionManager);
        this.readTransactionTemplate.setReadOnly(true);
        this.readTransactionTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_REPEATABLE_READ);
        this.rowMapper = new RecordedMessageRowMapper(config.objectMapper);
        if (config.createSchemaIfNotExists) {
            PostgresEventStoreSchema.createIfNotExists(dataSource);
        }
    }

    @Override
    public AppendResult appendToStream(String streamName, List<Message> messages, ExpectedStreamVersion expectedVersion) {
        StreamName.requireValid(streamName);
        requireNonNull(messages, "messages cannot be null");
        requireNonNull(expectedVersion, ExpectedStreamVersion.class.getSimpleName() + " cannot be null");

        List<RecordedMessage> recorded = new ArrayList<>(messages.size());
        AppendResult result;
        try {
            result = requireNonNull(transactionTemplate.execute(__ -> {
                Long currentStreamPosition = lockStream(streamName);
                boolean streamExists = currentStreamPosition != null;
                long currentVersion = streamExists ? currentStreamPosition : 0;
                if (!expectedVersion.isFulfilledBy(streamExists, currentVersion)) {
                    throw new ExpectedVersionConflictException(streamName, expectedVersion, currentVersion);
                } else if (messages.isEmpty()) {
                    return new AppendResult(currentVersion, false);
                }

                long nextVersion = currentVersion + messages.size();
                if (streamExists) {
                    int updated = jdbcTemplate.update("UPDATE emt_streams SET stream_position = ?, last_updated = now() WHERE stream_id = ? AND partition = ? AND stream_position = ?",
                            nextVersion, streamName, config.partition, currentVersion);
                    if (updated == 0) {
                        throw new ExpectedVersionConflictException(streamName, expectedVersion, currentVersion);
                    }
                } else {
                    jdbcTemplate.update("INSERT INTO emt_streams (stream_id, stream_position, partition, stream_type) VALUES (?, ?, ?, ?)",
                            streamName, nextVersion, config.partition, StreamName.streamType(streamName));
                }

                for (int i = 0; i < messages.size(); i++) {
                    recorded.add(insertMessage(streamName, currentVersion + i + 1, messages.get(i)));
                }
                applyInlineProjections(streamName, nextVersion, recorded);
                return new AppendResult(nextVersion, !streamExists);
            }));
        } catch (DuplicateKeyException e) {
            // Another transaction created the stream concurrently
            if (expectedVersion instanceof ExpectedStreamVersion.Any) {
                return appendToStream(streamName, messages, expectedVersion);
            }
            long actualVersion = readStreamPosition(streamName);
            throw new ExpectedVersionConflictException(streamName, expectedVersion, actualVersion, e);
        }

        if (!recorded.isEmpty()) {
            AfterCommitHook.invokeAll(config.afterCommitHooks, streamName, recorded);
        }
        return result;
    }

    @Override
    public ReadStreamResult readStream(String streamName, ReadStreamOptions options) {
        StreamName.requireValid(streamName);
        requireNonNull(options, ReadStreamOptions.class.getSimpleName() + " cannot be null");
        return readTransactionTemplate.execute(__ -> {
            Long currentStreamPosition = jdbcTemplate.query("SELECT stream_position FROM emt_streams WHERE stream_id = ? AND partition = ? AND is_archived = FALSE",
                    rs -> rs.next() ? rs.getLong(1) : null, streamName, config.partition);
            boolean streamExists = currentStreamPosition != null;
            long currentVersion = streamExists ? currentStreamPosition : 0;
            if (!options.expectedVersion().isFulfilledBy(streamExists, currentVersion)) {
                throw new ExpectedVersionConflictException(streamName, options.expectedVersion(), currentVersion);
            } else if (!streamExists) {
                return ReadStreamResult.streamNotFound();
            }

            long to = options.toPosition() == null ? currentVersion : options.toPosition();
            List<RecordedMessage> messages = jdbcTemplate.query("SELECT " + RecordedMessageRowMapper.COLUMNS + " FROM emt_messages " +
                            "WHERE stream_id = ? AND partition = ? AND is_archived = FALSE AND stream_position >= ? AND stream_position <= ? ORDER BY stream_position",
                    rowMapper, streamName, config.partition, options.fromPosition(), to);
            return new ReadStreamResult(messages, currentVersion, true);
        });
    }

    /**
     * Find the document of an inline projection
     *
     * @param name       The name of the inline projection
     * @param streamName The stream that the document was projected from
     * @return The document or {@code Optional.empty()} if the projection has no document for the stream
     */
    public Optional<JsonNode> findInlineProjection(String name, String streamName) {
        List<JsonNode> documents = jdbcTemplate.query("SELECT data FROM emt_inline_projections WHERE name = ? AND stream_id = ? AND partition = ?",
                (rs, __) -> rowMapper.readJson(rs.getString("data")), name, streamName, config.partition);
        return documents.stream().findFirst();
    }

    private @Nullable Long lockStream(String streamName) {
        return jdbcTemplate.query("SELECT stream_position FROM emt_streams WHERE stream_id = ? AND partition = ? AND is_archived = FALSE FOR UPDATE",
                rs -> rs.next() ? rs.getLong(1) : null, streamName, config.partition);
    }

    private long readStreamPosition(String streamName) {
        Long position = jdbcTemplate.query("SELECT stream_position FROM emt_streams WHERE stream_id = ? AND partition = ?",
                rs -> rs.next() ? rs.getLong(1) : null, streamName, config.partition);
        return position == null ? 0 : position;
    }

    private RecordedMessage insertMessage(String streamName, long streamPosition, Message message) {
        return requireNonNull(jdbcTemplate.queryForObject("INSERT INTO emt_messages (stream_id, stream_position, partition, message_kind, message_type, message_data, message_id) " +
                        "VALUES (?, ?, ?, ?, ?, CAST(? AS jsonb), ?) RETURNING global_position, created",
                (rs, __) -> new RecordedMessage(message, streamName, streamPosition, GlobalPosition.of(rs.getLong("global_position")), rs.getObject("created", OffsetDateTime.class).toInstant()),
                streamName, streamPosition, config.partition, message.kind().code(), message.type(), rowMapper.writeJson(message.data()), message.messageId()));
    }

    private void applyInlineProjections(String streamName, long streamPosition, List<RecordedMessage> recorded) {
        for (InlineProjection<JsonNode> projection : config.inlineProjections) {
            if (!projection.canHandleAny(recorded)) {
                continue;
            }
            List<JsonNode> current = jdbcTemplate.query("SELECT data FROM emt_inline_projections WHERE name = ? AND stream_id = ? AND partition = ? FOR UPDATE",
                    (rs, __) -> rowMapper.readJson(rs.getString("data")), projection.name(), streamName, config.partition);
            JsonNode document = projection.project(current.isEmpty() ? null : current.get(0), recorded);
            if (document == null) {
                jdbcTemplate.update("DELETE FROM emt_inline_projections WHERE name = ? AND stream_id = ? AND partition = ?", projection.name(), streamName, config.partition);
            } else {
                jdbcTemplate.update("INSERT INTO emt_inline_projections (name, stream_id, partition, data, stream_position) VALUES (?, ?, ?, CAST(? AS jsonb), ?) " +
                                "ON CONFLICT (name, stream_id, partition) DO UPDATE SET data = EXCLUDED.data, stream_position = EXCLUDED.stream_position, last_updated = now()",
                        projection.name(), streamName, config.partition, rowMapper.writeJson(document), streamPosition);
            }
            if (log.isDebugEnabled()) {
                log.debug("Updated inline projection {} for stream '{}' at position {}", projection.name(), streamName, streamPosition);
            }
        }
    }
}
