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

import org.sequent.processor.ProcessorDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Registers projections in {@code emt_projections} and activates or deactivates them. Each change takes the transaction
 * scoped advisory lock of the projection first and is skipped, returning {@code false}, if another transaction holds it.
 * <p>
 * An inactive projection is not handed out to shared locks and keeps its status while an exclusive projector processes it,
 * which is how a projection is rebuilt: deactivate it, run {@link PostgresEventStoreConsumer#rebuild} and activate it.
 */
public class PostgresProjections {
    private static final Logger log = LoggerFactory.getLogger(PostgresProjections.class);

    private static final String REGISTER = "WITH lock_check AS (SELECT pg_try_advisory_xact_lock(?) AS lock_acquired), " +
            "registered AS (" +
            " INSERT INTO emt_projections (name, partition, version, kind, status, created_at, last_updated)" +
            " SELECT ?, ?, ?, ?, ?, now(), now() WHERE (SELECT lock_acquired FROM lock_check) = true" +
            " ON CONFLICT (name, partition, version) DO UPDATE SET kind = EXCLUDED.kind, last_updated = now()" +
            " RETURNING name) " +
            "SELECT COUNT(*) > 0 FROM registered";

    private static final String CHANGE_STATUS = "WITH lock_check AS (SELECT pg_try_advisory_xact_lock(?) AS lock_acquired), " +
            "changed AS (" +
            " UPDATE emt_projections SET status = ?, last_updated = now()" +
            " WHERE name = ? AND partition = ? AND version = ? AND (SELECT lock_acquired FROM lock_check) = true" +
            " RETURNING name) " +
            "SELECT COUNT(*) > 0 FROM changed";

    private static final String SELECT_PROJECTION = "SELECT kind, status, created_at, last_updated FROM emt_projections WHERE name = ? AND partition = ? AND version = ?";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public PostgresProjections(DataSource dataSource) {
        requireNonNull(dataSource, DataSource.class.getSimpleName() + " cannot be null");
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
    }

    /**
     * Register the projection of a projector, a projection that is already registered keeps its status.
     *
     * @param status The status of a new registration, {@link ProjectionStatus#ACTIVE} or {@link ProjectionStatus#INACTIVE}
     * @return {@code true} if the projection was registered or already registered
     */
    public boolean register(ProcessorDefinition.Projector projector, ProjectionStatus status) {
        requireNonNull(projector, ProcessorDefinition.Projector.class.getSimpleName() + " cannot be null");
        return register(projector.lockName(), projector.partition(), projector.version(), status);
    }

    public boolean register(String name, String partition, int version, ProjectionStatus status) {
        requireNonNull(name, "name cannot be null");
        requireNonNull(partition, "partition cannot be null");
        requireNonNull(status, ProjectionStatus.class.getSimpleName() + " cannot be null");
        if (status == ProjectionStatus.ASYNC_PROCESSING) {
            throw new IllegalArgumentException("A projection can only be registered as " + ProjectionStatus.ACTIVE + " or " + ProjectionStatus.INACTIVE);
        }
        boolean registered = inTransaction(REGISTER, LockKeys.lockKey(partition, name, version), name, partition, version, "async", status.value);
        log.info("Registration of projection '{}' (partition '{}', version {}) as {}: {}", name, partition, version, status, registered ? "done" : "skipped, it's locked");
        return registered;
    }

    /**
     * @return {@code true} if the projection is registered and was activated
     */
    public boolean activate(String name, String partition, int version) {
        return changeStatus(name, partition, version, ProjectionStatus.ACTIVE);
    }

    /**
     * @return {@code true} if the projection is registered and was deactivated
     */
    public boolean deactivate(String name, String partition, int version) {
        return changeStatus(name, partition, version, ProjectionStatus.INACTIVE);
    }

    public Optional<ProjectionInfo> find(String name, String partition, int version) {
        List<ProjectionInfo> projections = jdbcTemplate.query(SELECT_PROJECTION, (rs, __) -> new ProjectionInfo(name, partition, version, rs.getString("kind"),
                ProjectionStatus.parse(rs.getString("status")), rs.getObject("created_at", OffsetDateTime.class).toInstant(),
                rs.getObject("last_updated", OffsetDateTime.class).toInstant()), name, partition, version);
        return projections.stream().findFirst();
    }

    private boolean changeStatus(String name, String partition, int version, ProjectionStatus status) {
        requireNonNull(name, "name cannot be null");
        requireNonNull(partition, "partition cannot be null");
        boolean changed = inTransaction(CHANGE_STATUS, LockKeys.lockKey(partition, name, version), status.value, name, partition, version);
        if (!changed) {
            log.warn("Projection '{}' (partition '{}', version {}) wasn't changed to {}, it's either not registered or locked", name, partition, version, status);
        }
        return changed;
    }

    private boolean inTransaction(String sql, Object... args) {
        return Boolean.TRUE.equals(transactionTemplate.execute(__ -> jdbcTemplate.queryForObject(sql, Boolean.class, args)));
    }

    public record ProjectionInfo(String name, String partition, int version, String kind, ProjectionStatus status, Instant createdAt, Instant lastUpdated) {
    }
}
