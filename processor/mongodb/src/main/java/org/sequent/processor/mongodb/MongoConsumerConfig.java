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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.sequent.processor.ProcessorLockConfig;
import org.sequent.retry.RetryStrategy;

import java.time.Duration;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * Configuration for the {@link MongoEventStoreConsumer}
 */
public class MongoConsumerConfig {
    public static final int DEFAULT_BATCH_SIZE = 100;
    public static final Duration DEFAULT_MAX_AWAIT_TIME = Duration.ofMillis(500);

    public final String databaseName;
    public final int batchSize;
    public final Duration maxAwaitTime;
    public final ProcessorLockConfig lockConfig;
    public final RetryStrategy resubscribeRetryStrategy;
    public final String instanceId;
    public final ObjectMapper objectMapper;

    private MongoConsumerConfig(String databaseName, int batchSize, Duration maxAwaitTime, ProcessorLockConfig lockConfig, RetryStrategy resubscribeRetryStrategy,
                                String instanceId, ObjectMapper objectMapper) {
        requireNonNull(databaseName, "databaseName cannot be null");
        requireNonNull(maxAwaitTime, "maxAwaitTime cannot be null");
        requireNonNull(lockConfig, ProcessorLockConfig.class.getSimpleName() + " cannot be null");
        requireNonNull(resubscribeRetryStrategy, RetryStrategy.class.getSimpleName() + " cannot be null");
        requireNonNull(instanceId, "instanceId cannot be null");
        requireNonNull(objectMapper, ObjectMapper.class.getSimpleName() + " cannot be null");
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be greater than 0");
        }
        this.databaseName = databaseName;
        this.batchSize = batchSize;
        this.maxAwaitTime = maxAwaitTime;
        this.lockConfig = lockConfig;
        this.resubscribeRetryStrategy = resubscribeRetryStrategy;
        this.instanceId = instanceId;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MongoConsumerConfig)) return false;
        MongoConsumerConfig that = (MongoConsumerConfig) o;
        return batchSize == that.batchSize && Objects.equals(databaseName, that.databaseName) && Objects.equals(maxAwaitTime, that.maxAwaitTime)
                && Objects.equals(lockConfig, that.lockConfig) && Objects.equals(resubscribeRetryStrategy, that.resubscribeRetryStrategy)
                && Objects.equals(instanceId, that.instanceId) && Objects.equals(objectMapper, that.objectMapper);
    }

    @Override
    public int hashCode() {
        return Objects.hash(databaseName, batchSize, maxAwaitTime, lockConfig, resubscribeRetryStrategy, instanceId, objectMapper);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", MongoConsumerConfig.class.getSimpleName() + "[", "]")
                .add("databaseName='" + databaseName + "'")
                .add("batchSize=" + batchSize)
                .add("maxAwaitTime=" + maxAwaitTime)
                .add("lockConfig=" + lockConfig)
                .add("resubscribeRetryStrategy=" + resubscribeRetryStrategy)
                .add("instanceId='" + instanceId + "'")
                .toString();
    }

    public static final class Builder {
        private String databaseName;
        private int batchSize = DEFAULT_BATCH_SIZE;
        private Duration maxAwaitTime = DEFAULT_MAX_AWAIT_TIME;
        private ProcessorLockConfig lockConfig = ProcessorLockConfig.defaultConfig();
        private RetryStrategy resubscribeRetryStrategy = RetryStrategy.exponentialBackoff(Duration.ofMillis(100), Duration.ofSeconds(5), 2.0).maxAttempts(10);
        private String instanceId = UUID.randomUUID().toString();
        private ObjectMapper objectMapper = new ObjectMapper();

        /**
         * @param databaseName The database that the event store writes to. Required.
         * @return The same {@code Builder} instance
         */
        public Builder databaseName(String databaseName) {
            this.databaseName = databaseName;
            return this;
        }

        /**
         * @param batchSize The max number of messages returned per batch. Default is {@value #DEFAULT_BATCH_SIZE}.
         * @return The same {@code Builder} instance
         */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * @param maxAwaitTime How long to wait for new changes before an empty batch is returned
         * @return The same {@code Builder} instance
         */
        public Builder maxAwaitTime(Duration maxAwaitTime) {
            this.maxAwaitTime = maxAwaitTime;
            return this;
        }

        public Builder lockConfig(ProcessorLockConfig lockConfig) {
            this.lockConfig = lockConfig;
            return this;
        }

        /**
         * @param resubscribeRetryStrategy How to retry resubscribing to the change stream after MongoDB has been unavailable
         * @return The same {@code Builder} instance
         */
        public Builder resubscribeRetryStrategy(RetryStrategy resubscribeRetryStrategy) {
            this.resubscribeRetryStrategy = resubscribeRetryStrategy;
            return this;
        }

        public Builder instanceId(String instanceId) {
            this.instanceId = instanceId;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public MongoConsumerConfig build() {
            return new MongoConsumerConfig(databaseName, batchSize, maxAwaitTime, lockConfig, resubscribeRetryStrategy, instanceId, objectMapper);
        }
    }
}
