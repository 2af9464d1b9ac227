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

import org.sequent.eventstore.api.GlobalPosition;
import org.sequent.eventstore.api.RecordedMessage;
import org.sequent.eventstore.postgresql.RecordedMessageRowMapper;
import org.sequent.processor.MessageFeed;
import org.sequent.processor.StartFrom;
import org.sequent.retry.RetryStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static java.util.Objects.requireNonNull;

/**
 * Polls {@code emt_messages} of a partition in global order. Only messages written by transactions that are older than every
 * transaction still in flight are read, so a message committed late by a long-running transaction is never skipped.
 * <p>
 * When a poll returns no messages the feed waits before returning an empty batch, doubling the wait for every empty poll
 * up to the configured max. Closing the feed interrupts the wait.
 */
public class PostgresMessageFeed implements MessageFeed {
    private static final Logger log = LoggerFactory.getLogger(PostgresMessageFeed.class);

    private static final String SELECT_MESSAGES = "SELECT " + RecordedMessageRowMapper.COLUMNS + " FROM emt_messages " +
            "WHERE partition = ? AND NOT is_archived AND transaction_id < pg_snapshot_xmin(pg_current_snapshot()) AND global_position > ? " +
            "ORDER BY transaction_id, global_position LIMIT ?";

    private static final String SELECT_MAX_POSITION = "SELECT COALESCE(MAX(global_position), 0) FROM emt_messages WHERE partition = ?";

    private final JdbcTemplate jdbcTemplate;
    private final RecordedMessageRowMapper rowMapper;
    private final String partition;
    private final int batchSize;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final RetryStrategy retryStrategy;

    private volatile CountDownLatch closeSignal = new CountDownLatch(0);
    private volatile boolean open;
    private long lastPosition;
    private Duration backoff;

    public PostgresMessageFeed(DataSource dataSource, PostgresConsumerConfig config) {
        requireNonNull(dataSource, DataSource.class.getSimpleName() + " cannot be null");
        requireNonNull(config, PostgresConsumerConfig.class.getSimpleName() + " cannot be null");
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.rowMapper = new RecordedMessageRowMapper(config.objectMapper);
        this.partition = config.partition;
        this.batchSize = config.batchSize;
        this.initialBackoff = config.initialBackoff;
        this.maxBackoff = config.maxBackoff;
        this.retryStrategy = config.pollingRetryStrategy instanceof RetryStrategy.Retry retry ?
                retry.mapRetryPredicate(predicate -> predicate.and(PostgresMessageFeed::isDatabaseUnavailable)).onError(e -> log.warn("Polling messages of partition '{}' failed: {}", partition, e.getMessage())) :
                config.pollingRetryStrategy;
        this.backoff = initialBackoff;
    }

    @Override
    public synchronized void open(StartFrom startFrom) {
        requireNonNull(startFrom, StartFrom.class.getSimpleName() + " cannot be null");
        if (startFrom instanceof StartFrom.Beginning) {
            lastPosition = 0;
        } else if (startFrom instanceof StartFrom.End) {
            Long max = retryStrategy.execute(() -> jdbcTemplate.queryForObject(SELECT_MAX_POSITION, Long.class, partition));
            lastPosition = max == null ? 0 : max;
        } else if (startFrom instanceof StartFrom.Checkpoint checkpoint) {
            if (!(checkpoint.token() instanceof GlobalPosition globalPosition)) {
                throw new IllegalArgumentException("Cannot read from " + checkpoint.token() + ", expected a " + GlobalPosition.class.getSimpleName());
            }
            lastPosition = globalPosition.value();
        } else {
            throw new IllegalArgumentException("Cannot open feed from " + startFrom);
        }
        backoff = initialBackoff;
        closeSignal = new CountDownLatch(1);
        open = true;
        log.debug("Polling partition '{}' after global position {}", partition, lastPosition);
    }

    @Override
    public List<RecordedMessage> nextBatch() {
        if (!open) {
            return Collections.emptyList();
        }
        List<RecordedMessage> messages = retryStrategy.execute(() -> jdbcTemplate.query(SELECT_MESSAGES, rowMapper, partition, lastPosition, batchSize));
        if (messages.isEmpty()) {
            awaitBackoff();
            return Collections.emptyList();
        }
        backoff = initialBackoff;
        lastPosition = ((GlobalPosition) messages.get(messages.size() - 1).globalPosition()).value();
        return messages;
    }

    @Override
    public void close() {
        open = false;
        closeSignal.countDown();
    }

    private void awaitBackoff() {
        try {
            if (closeSignal.await(backoff.toMillis(), TimeUnit.MILLISECONDS)) {
                return;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }
        backoff = nextBackoff(backoff, maxBackoff);
    }

    Duration currentBackoff() {
        return backoff;
    }

    static Duration nextBackoff(Duration backoff, Duration maxBackoff) {
        Duration doubled = backoff.multipliedBy(2);
        return doubled.compareTo(maxBackoff) > 0 ? maxBackoff : doubled;
    }

    static boolean isDatabaseUnavailable(Throwable e) {
        return e instanceof TransientDataAccessException || e instanceof DataAccessResourceFailureException;
    }
}
