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

import org.sequent.processor.LockMode;
import org.sequent.processor.ProcessorDefinition;
import org.sequent.processor.ProcessorLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;

/**
 * A lock backed by a transaction scoped advisory lock and the status row of the processor in {@code emt_processors}.
 * <p>
 * The advisory lock serializes competing instances while the status row is claimed. The row is owned by an instance until it
 * is released, or until it hasn't been refreshed within the lock timeout, after which another instance may take over.
 * A shared lock is refused while the projection isn't active, or while another instance holds the processor exclusively.
 * An inactive projection stays inactive while it's processed, only {@link PostgresProjections#activate} activates it again.
 */
class PostgresProcessorLock implements ProcessorLock {
    private static final Logger log = LoggerFactory.getLogger(PostgresProcessorLock.class);

    static final String UNKNOWN_INSTANCE = "emt:unknown";
    static final String INITIAL_CHECKPOINT = "0000000000000000000";

    private static final String TRY_ACQUIRE_EXCLUSIVE = "WITH lock_check AS (SELECT pg_try_advisory_xact_lock(?) AS lock_acquired), " +
            "ownership_check AS (" +
            " INSERT INTO emt_processors (processor_id, partition, version, processor_instance_id, status, last_processed_checkpoint, last_processed_transaction_id, created_at, last_updated)" +
            " SELECT ?, ?, ?, ?, 'running', '" + INITIAL_CHECKPOINT + "', '0'::xid8, now(), now()" +
            " WHERE (SELECT lock_acquired FROM lock_check) = true" +
            " ON CONFLICT (processor_id, partition, version) DO UPDATE" +
            " SET processor_instance_id = EXCLUDED.processor_instance_id, status = 'running', last_updated = now()" +
            " WHERE emt_processors.processor_instance_id = EXCLUDED.processor_instance_id" +
            " OR emt_processors.processor_instance_id = '" + UNKNOWN_INSTANCE + "'" +
            " OR emt_processors.status = 'stopped'" +
            " OR emt_processors.last_updated < now() - CAST(? AS INTEGER) * INTERVAL '1 second'" +
            " RETURNING processor_id) " +
            "SELECT COUNT(*) > 0 FROM ownership_check";

    private static final String MARK_PROJECTION_PROCESSING = "INSERT INTO emt_projections (name, partition, version, kind, status, created_at, last_updated) " +
            "VALUES (?, ?, ?, 'async', 'async_processing', now(), now()) " +
            "ON CONFLICT (name, partition, version) DO UPDATE SET status = 'async_processing', last_updated = now() " +
            "WHERE emt_projections.status <> '" + ProjectionStatus.INACTIVE.value + "'";

    private static final String TRY_ACQUIRE_SHARED = "SELECT pg_try_advisory_xact_lock_shared(?) AND " +
            "COALESCE((SELECT status = 'active' FROM emt_projections WHERE name = ? AND partition = ? AND version = ?), true) AND " +
            "NOT EXISTS (SELECT 1 FROM emt_processors WHERE processor_id = ? AND partition = ? AND version = ? AND status = 'running'" +
            " AND processor_instance_id NOT IN (?, '" + UNKNOWN_INSTANCE + "')" +
            " AND last_updated >= now() - CAST(? AS INTEGER) * INTERVAL '1 second')";

    private static final String RELEASE_PROCESSOR = "UPDATE emt_processors SET status = 'stopped', processor_instance_id = '" + UNKNOWN_INSTANCE + "', last_updated = now() " +
            "WHERE processor_id = ? AND partition = ? AND version = ? AND processor_instance_id = ?";

    private static final String RELEASE_PROJECTION = "UPDATE emt_projections SET status = 'active', last_updated = now() " +
            "WHERE name = ? AND partition = ? AND version = ? AND status = 'async_processing'";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ProcessorDefinition definition;
    private final String instanceId;
    private final LockMode lockMode;
    private final Duration lockTimeout;
    private final long lockKey;

    PostgresProcessorLock(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate, ProcessorDefinition definition, String instanceId, LockMode lockMode, Duration lockTimeout) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.definition = definition;
        this.instanceId = instanceId;
        this.lockMode = lockMode;
        this.lockTimeout = lockTimeout;
        this.lockKey = LockKeys.lockKey(definition);
    }

    @Override
    public boolean tryAcquire() {
        Boolean acquired = transactionTemplate.execute(__ -> lockMode == LockMode.EXCLUSIVE ? tryAcquireExclusive() : tryAcquireShared());
        boolean result = Boolean.TRUE.equals(acquired);
        if (!result) {
            log.debug("Lock {} of processor '{}' is held by another instance", lockKey, definition.processorId());
        }
        return result;
    }

    @Override
    public void release() {
        if (lockMode == LockMode.SHARED) {
            // Released when the acquiring transaction ended
            return;
        }
        transactionTemplate.executeWithoutResult(__ -> {
            int released = jdbcTemplate.update(RELEASE_PROCESSOR, definition.processorId(), definition.partition(), definition.version(), instanceId);
            if (released > 0 && definition instanceof ProcessorDefinition.Projector) {
                jdbcTemplate.update(RELEASE_PROJECTION, definition.lockName(), definition.partition(), definition.version());
            }
        });
    }

    private boolean tryAcquireExclusive() {
        Boolean acquired = jdbcTemplate.queryForObject(TRY_ACQUIRE_EXCLUSIVE, Boolean.class, lockKey, definition.processorId(), definition.partition(), definition.version(), instanceId, lockTimeout.toSeconds());
        if (Boolean.TRUE.equals(acquired) && definition instanceof ProcessorDefinition.Projector) {
            jdbcTemplate.update(MARK_PROJECTION_PROCESSING, definition.lockName(), definition.partition(), definition.version());
        }
        return Boolean.TRUE.equals(acquired);
    }

    private boolean tryAcquireShared() {
        return Boolean.TRUE.equals(jdbcTemplate.queryForObject(TRY_ACQUIRE_SHARED, Boolean.class, lockKey, definition.lockName(), definition.partition(), definition.version(),
                definition.processorId(), definition.partition(), definition.version(), instanceId, lockTimeout.toSeconds()));
    }

    @Override
    public String toString() {
        return "PostgresProcessorLock[" + definition.processorId() + ", " + lockMode + ", " + instanceId + "]";
    }
}
