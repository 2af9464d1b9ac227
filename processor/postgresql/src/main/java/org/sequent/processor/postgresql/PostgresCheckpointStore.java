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

package org.sequent.processor.postgresql;

import org.jspecify.annotations.Nullable;
import org.sequent.eventstore.api.GlobalPosition;
import org.sequent.eventstore.api.PositionToken;
import org.sequent.processor.CheckpointStore;
import org.sequent.processor.ProcessorKey;
import org.sequent.processor.StoreCheckpointResult;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Stores checkpoints in the {@code emt_processors} table as 19 digit zero-padded global positions. Writes are conditional on
 * the checkpoint the caller last stored, so concurrent writers for the same processor can't move the checkpoint backwards.
 * <p>
 * When invoked inside a Spring managed transaction on the same {@link DataSource}, the checkpoint is written in that transaction.
 */
public class PostgresCheckpointStore implements CheckpointStore {
    private static final String SELECT_CHECKPOINT = "SELECT last_processed_checkpoint FROM emt_processors WHERE processor_id = ? AND partition = ? AND version = ?";

    private static final String UPDATE_CHECKPOINT = "UPDATE emt_processors SET last_processed_checkpoint = ?, last_processed_transaction_id = pg_current_xact_id(), last_updated = now() " +
            "WHERE processor_id = ? AND partition = ? AND version = ? AND last_processed_checkpoint = ?";

    private static final String INSERT_CHECKPOINT = "INSERT INTO emt_processors (processor_id, partition, version, last_processed_checkpoint, last_processed_transaction_id, created_at, last_updated) " +
            "VALUES (?, ?, ?, ?, pg_current_xact_id(), now(), now()) ON CONFLICT (processor_id, partition, version) DO NOTHING";

    // The status row also carries the lock, so it's kept and only the checkpoint is reset
    private static final String RESET_CHECKPOINT = "UPDATE emt_processors SET last_processed_checkpoint = '" + PostgresProcessorLock.INITIAL_CHECKPOINT + "', " +
            "last_processed_transaction_id = '0'::xid8, last_updated = now() WHERE processor_id = ? AND partition = ? AND version = ?";

    private final JdbcTemplate jdbcTemplate;

    public PostgresCheckpointStore(DataSource dataSource) {
        requireNonNull(dataSource, DataSource.class.getSimpleName() + " cannot be null");
        this.jdbcTemplate = new JdbcTemplate(dataSource);
    }

    @Override
    public @Nullable PositionToken read(ProcessorKey key) {
        requireNonNull(key, ProcessorKey.class.getSimpleName() + " cannot be null");
        List<String> checkpoints = jdbcTemplate.queryForList(SELECT_CHECKPOINT, String.class, key.processorId(), key.partition(), key.version());
        return checkpoints.isEmpty() ? null : GlobalPosition.parse(checkpoints.get(0));
    }

    @Override
    public StoreCheckpointResult store(ProcessorKey key, @Nullable PositionToken lastStoredCheckpoint, PositionToken newCheckpoint) {
        requireNonNull(key, ProcessorKey.class.getSimpleName() + " cannot be null");
        requireNonNull(newCheckpoint, "newCheckpoint cannot be null");

        StoreCheckpointResult.Failure failure = StoreCheckpointResult.classify(read(key), lastStoredCheckpoint, newCheckpoint, true);
        if (failure != null) {
            return failure;
        }

        final int rowsAffected;
        if (lastStoredCheckpoint == null) {
            rowsAffected = jdbcTemplate.update(INSERT_CHECKPOINT, key.processorId(), key.partition(), key.version(), newCheckpoint.asString());
        } else {
            rowsAffected = jdbcTemplate.update(UPDATE_CHECKPOINT, newCheckpoint.asString(), key.processorId(), key.partition(), key.version(), lastStoredCheckpoint.asString());
        }
        if (rowsAffected == 1) {
            return StoreCheckpointResult.success(newCheckpoint);
        }

        // Another writer got in between the read and the write
        StoreCheckpointResult.Failure raced = StoreCheckpointResult.classify(read(key), lastStoredCheckpoint, newCheckpoint, true);
        return raced == null ? StoreCheckpointResult.failure(StoreCheckpointResult.Reason.MISMATCH) : raced;
    }

    @Override
    public void reset(ProcessorKey key) {
        requireNonNull(key, ProcessorKey.class.getSimpleName() + " cannot be null");
        jdbcTemplate.update(RESET_CHECKPOINT, key.processorId(), key.partition(), key.version());
    }
}
