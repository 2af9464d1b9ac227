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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.sequent.processor.ProcessorLockConfig;
import org.sequent.retry.RetryStrategy;

import java.time.Duration;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.UUID;

import static java.util.Objects.requireNonNull;
import static org.sequent.processor.ProcessorDefinition.DEFAULT_PARTITION;

/**
 * Configuration for the {@link PostgresEventStoreConsumer}
 */
public class PostgresConsumerConfig {
    public static final int DEFAULT_BATCH_SIZE = 100;
    public static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofMillis(100);
    public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofMillis(1000);

    public final String partition;
    public final int batchSize;
    public final Duration initialBackoff;
    public final Duration maxBackoff;
    public final ProcessorLockConfig lockConfig;
    public final RetryStrategy pollingRetryStrategy;
    public final String instanceId;
    public final ObjectMapper objectMapper;
    public final boolean createSchemaIfNotExists;
    public final boolean stopWhenNoMessagesLeft;

    private PostgresConsumerConfig(String partition, int batchSize, Duration initialBackoff, Duration maxBackoff, ProcessorLockConfig lockConfig,
                                   RetryStrategy pollingRetryStrategy, String instanceId, ObjectMapper objectMapper, boolean createSchemaIfNotExists,
                                   boolean stopWhenNoMessagesLeft) {
        requireNonNull(partition, "partition cannot be null");
        requireNonNull(initialBackoff, "initialBackoff cannot be null");
        requireNonNull(maxBackoff, "maxBackoff cannot be null");
        requireNonNull(lockConfig, ProcessorLockConfig.class.getSimpleName() + " cannot be null");
        requireNonNull(pollingRetryStrategy, RetryStrategy.class.getSimpleName() + " cannot be null");
        requireNonNull(instanceId, "instanceId cannot be null");
        requireNonNull(objectMapper, ObjectMapper.class.getSimpleName() + " cannot be null");
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be greater than 0");
        }
        if (maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be greater than or equal to initialBackoff");
        }
        this.partition = partition;
        this.batchSize = batchSize;
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
        this.lockConfig = lockConfig;
        this.pollingRetryStrategy = pollingRetryStrategy;
        this.instanceId = instanceId;
        this.objectMapper = objectMapper;
        this.createSchemaIfNotExists = createSchemaIfNotExists;
        this.stopWhenNoMessagesLeft = stopWhenNoMessagesLeft;
    }

    public static PostgresConsumerConfig defaultConfig() {
        return new Builder().build();
    }

    /**
     * @return A builder initialized with the settings of this configuration
     */
    public Builder toBuilder() {
        return new Builder()
                .partition(partition)
                .batchSize(batchSize)
                .backoff(initialBackoff, maxBackoff)
                .lockConfig(lockConfig)
                .pollingRetryStrategy(pollingRetryStrategy)
                .instanceId(instanceId)
                .objectMapper(objectMapper)
                .createSchemaIfNotExists(createSchemaIfNotExists)
                .stopWhenNoMessagesLeft(stopWhenNoMessagesLeft);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PostgresConsumerConfig)) return false;
        PostgresConsumerConfig that = (PostgresConsumerConfig) o;
        return batchSize == that.batchSize && createSchemaIfNotExists == that.createSchemaIfNotExists && stopWhenNoMessagesLeft == that.stopWhenNoMessagesLeft
                && Objects.equals(partition, that.partition)
                && Objects.equals(initialBackoff, that.initialBackoff) && Objects.equals(maxBackoff, that.maxBackoff) && Objects.equals(lockConfig, that.lockConfig)
                && Objects.equals(pollingRetryStrategy, that.pollingRetryStrategy) && Objects.equals(instanceId, that.instanceId) && Objects.equals(objectMapper, that.objectMapper);
    }

    @Override
    public int hashCode() {
        return Objects.hash(partition, batchSize, initialBackoff, maxBackoff, lockConfig, pollingRetryStrategy, instanceId, objectMapper, createSchemaIfNotExists, stopWhenNoMessagesLeft);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", PostgresConsumerConfig.class.getSimpleName() + "[", "]")
                .add("partition='" + partition + "'")
                .add("batchSize=" + batchSize)
                .add("initialBackoff=" + initialBackoff)
                .add("maxBackoff=" + maxBackoff)
                .add("lockConfig=" + lockConfig)
                .add("pollingRetryStrategy=" + pollingRetryStrategy)
                .add("instanceId='" + instanceId + "'")
                .add("createSchemaIfNotExists=" + createSchemaIfNotExists)
                .add("stopWhenNoMessagesLeft=" + stopWhenNoMessagesLeft)
                .toString();
    }

    public static final class Builder {
        private String partition = DEFAULT_PARTITION;
        private int batchSize = DEFAULT_BATCH_SIZE;
        private Duration initialBackoff = DEFAULT_INITIAL_BACKOFF;
        private Duration maxBackoff = DEFAULT_MAX_BACKOFF;
        private ProcessorLockConfig lockConfig = ProcessorLockConfig.defaultConfig();
        private RetryStrategy pollingRetryStrategy = RetryStrategy.exponentialBackoff(Duration.ofMillis(100), Duration.ofSeconds(2), 2.0).maxAttempts(10);
        private String instanceId = UUID.randomUUID().toString();
        private ObjectMapper objectMapper = new ObjectMapper();
        private boolean createSchemaIfNotExists = true;
        private boolean stopWhenNoMessagesLeft = false;

        /**
         * @param partition The partition to read messages from. Default is {@value org.sequent.processor.ProcessorDefinition#DEFAULT_PARTITION}.
         * @return The same {@code Builder} instance
         */
        public Builder partition(String partition) {
            this.partition = partition;
            return this;
        }

        /**
         * @param batchSize The max number of messages read per poll. Default is {@value #DEFAULT_BATCH_SIZE}.
         * @return The same {@code Builder} instance
         */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Configure how long to wait between polls when no messages were found. The wait starts at {@code initialBackoff} and is
         * doubled for every empty poll until it reaches {@code maxBackoff}. Default is 100 ms and 1000 ms.
         *
         * @return The same {@code Builder} instance
         */
        public Builder backoff(Duration initialBackoff, Duration maxBackoff) {
            this.initialBackoff = initialBackoff;
            this.maxBackoff = maxBackoff;
            return this;
        }

        public Builder lockConfig(ProcessorLockConfig lockConfig) {
            this.lockConfig = lockConfig;
            return this;
        }

        /**
         * @param pollingRetryStrategy How to retry polls that fail because the database is unavailable
         * @return The same {@code Builder} instance
         */
        public Builder pollingRetryStrategy(RetryStrategy pollingRetryStrategy) {
            this.pollingRetryStrategy = pollingRetryStrategy;
            return this;
        }

        /**
         * @param instanceId The id of this consumer instance, used as owner of processor locks. Default is a random UUID.
         * @return The same {@code Builder} instance
         */
        public Builder instanceId(String instanceId) {
            this.instanceId = instanceId;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder createSchemaIfNotExists(boolean createSchemaIfNotExists) {
            this.createSchemaIfNotExists = createSchemaIfNotExists;
            return this;
        }

        /**
         * @param stopWhenNoMessagesLeft Stop the consumer once a poll returns no messages. Default is {@code false}, poll forever.
         * @return The same {@code Builder} instance
         */
        public Builder stopWhenNoMessagesLeft(boolean stopWhenNoMessagesLeft) {
            this.stopWhenNoMessagesLeft = stopWhenNoMessagesLeft;
            return this;
        }

        public PostgresConsumerConfig build() {
            return new PostgresConsumerConfig(partition, batchSize, initialBackoff, maxBackoff, lockConfig, pollingRetryStrategy, instanceId, objectMapper,
                    createSchemaIfNotExists, stopWhenNoMessagesLeft);
        }
    }
}
