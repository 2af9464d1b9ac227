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
import com.fasterxml.jackson.databind.ObjectMapper;
import org.sequent.eventstore.api.AfterCommitHook;
import org.sequent.eventstore.api.InlineProjection;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * Configuration for the {@link MongoEventStore}
 */
public class MongoEventStoreConfig {
    public final String databaseName;
    public final StorageStrategy storageStrategy;
    public final ObjectMapper objectMapper;
    public final List<InlineProjection<JsonNode>> inlineProjections;
    public final List<AfterCommitHook> afterCommitHooks;
    public final Clock clock;

    private MongoEventStoreConfig(String databaseName, StorageStrategy storageStrategy, ObjectMapper objectMapper, List<InlineProjection<JsonNode>> inlineProjections,
                                  List<AfterCommitHook> afterCommitHooks, Clock clock) {
        requireNonNull(databaseName, "databaseName cannot be null");
        requireNonNull(storageStrategy, StorageStrategy.class.getSimpleName() + " cannot be null");
        requireNonNull(objectMapper, ObjectMapper.class.getSimpleName() + " cannot be null");
        requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
        this.databaseName = databaseName;
        this.storageStrategy = storageStrategy;
        this.objectMapper = objectMapper;
        this.inlineProjections = List.copyOf(inlineProjections);
        this.afterCommitHooks = List.copyOf(afterCommitHooks);
        this.clock = clock;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MongoEventStoreConfig)) return false;
        MongoEventStoreConfig that = (MongoEventStoreConfig) o;
        return Objects.equals(databaseName, that.databaseName) && Objects.equals(storageStrategy, that.storageStrategy) && Objects.equals(objectMapper, that.objectMapper)
                && Objects.equals(inlineProjections, that.inlineProjections) && Objects.equals(afterCommitHooks, that.afterCommitHooks) && Objects.equals(clock, that.clock);
    }

    @Override
    public int hashCode() {
        return Objects.hash(databaseName, storageStrategy, objectMapper, inlineProjections, afterCommitHooks, clock);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", MongoEventStoreConfig.class.getSimpleName() + "[", "]")
                .add("databaseName='" + databaseName + "'")
                .add("storageStrategy=" + storageStrategy)
                .add("inlineProjections=" + inlineProjections)
                .add("afterCommitHooks=" + afterCommitHooks)
                .add("clock=" + clock)
                .toString();
    }

    public static final class Builder {
        private String databaseName;
        private StorageStrategy storageStrategy = StorageStrategy.collectionPerStreamType();
        private ObjectMapper objectMapper = new ObjectMapper();
        private final List<InlineProjection<JsonNode>> inlineProjections = new ArrayList<>();
        private final List<AfterCommitHook> afterCommitHooks = new ArrayList<>();
        private Clock clock = Clock.systemUTC();

        /**
         * @param databaseName The database in which the stream collections are stored
         * @return The same {@code Builder} instance
         */
        public Builder databaseName(String databaseName) {
            this.databaseName = databaseName;
            return this;
        }

        /**
         * @param storageStrategy How streams are mapped to collections, default is {@link StorageStrategy#collectionPerStreamType()}
         * @return The same {@code Builder} instance
         */
        public Builder storageStrategy(StorageStrategy storageStrategy) {
            this.storageStrategy = storageStrategy;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        /**
         * @param inlineProjection A projection stored in the stream document and updated by the same write as the appended messages
         * @return The same {@code Builder} instance
         */
        public Builder inlineProjection(InlineProjection<JsonNode> inlineProjection) {
            requireNonNull(inlineProjection, InlineProjection.class.getSimpleName() + " cannot be null");
            this.inlineProjections.add(inlineProjection);
            return this;
        }

        public Builder afterCommitHook(AfterCommitHook afterCommitHook) {
            requireNonNull(afterCommitHook, AfterCommitHook.class.getSimpleName() + " cannot be null");
            this.afterCommitHooks.add(afterCommitHook);
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public MongoEventStoreConfig build() {
            return new MongoEventStoreConfig(databaseName, storageStrategy, objectMapper, inlineProjections, afterCommitHooks, clock);
        }
    }
}
