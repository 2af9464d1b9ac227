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
import com.fasterxml.jackson.databind.ObjectMapper;
import org.sequent.eventstore.api.AfterCommitHook;
import org.sequent.eventstore.api.InlineProjection;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;
import static org.sequent.eventstore.postgresql.PostgresEventStoreSchema.DEFAULT_PARTITION;

/**
 * Configuration for the {@link PostgresEventStore}
 */
public class PostgresEventStoreConfig {
    public final String partition;
    public final ObjectMapper objectMapper;
    public final List<InlineProjection<JsonNode>> inlineProjections;
    public final List<AfterCommitHook> afterCommitHooks;
    public final boolean createSchemaIfNotExists;

    private PostgresEventStoreConfig(String partition, ObjectMapper objectMapper, List<InlineProjection<JsonNode>> inlineProjections, List<AfterCommitHook> afterCommitHooks, boolean createSchemaIfNotExists) {
        requireNonNull(partition, "partition cannot be null");
        requireNonNull(objectMapper, ObjectMapper.class.getSimpleName() + " cannot be null");
        this.partition = partition;
        this.objectMapper = objectMapper;
        this.inlineProjections = List.copyOf(inlineProjections);
        this.afterCommitHooks = List.copyOf(afterCommitHooks);
        this.createSchemaIfNotExists = createSchemaIfNotExists;
    }

    public static PostgresEventStoreConfig defaultConfig() {
        return new Builder().build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PostgresEventStoreConfig)) return false;
        PostgresEventStoreConfig that = (PostgresEventStoreConfig) o;
        return createSchemaIfNotExists == that.createSchemaIfNotExists && Objects.equals(partition, that.partition) && Objects.equals(objectMapper, that.objectMapper) && Objects.equals(inlineProjections, that.inlineProjections) && Objects.equals(afterCommitHooks, that.afterCommitHooks);
    }

    @Override
    public int hashCode() {
        return Objects.hash(partition, objectMapper, inlineProjections, afterCommitHooks, createSchemaIfNotExists);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", PostgresEventStoreConfig.class.getSimpleName() + "[", "]")
                .add("partition='" + partition + "'")
                .add("objectMapper=" + objectMapper)
                .add("inlineProjections=" + inlineProjections)
                .add("afterCommitHooks=" + afterCommitHooks)
                .add("createSchemaIfNotExists=" + createSchemaIfNotExists)
                .toString();
    }

    public static final class Builder {
        private String partition = DEFAULT_PARTITION;
        private ObjectMapper objectMapper = new ObjectMapper();
        private final List<InlineProjection<JsonNode>> inlineProjections = new ArrayList<>();
        private final List<AfterCommitHook> afterCommitHooks = new ArrayList<>();
        private boolean createSchemaIfNotExists = true;

        /**
         * @param partition The partition that streams are written to and read from. Default is {@value PostgresEventStoreSchema#DEFAULT_PARTITION}.
         * @return The same {@code Builder} instance
         */
        public Builder partition(String partition) {
            this.partition = partition;
            return this;
        }

        /**
         * @param objectMapper The {@code ObjectMapper} used to serialize message data to {@code jsonb}
         * @return The same {@code Builder} instance
         */
        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        /**
         * @param inlineProjection A projection that is updated in the same transaction as the append
         * @return The same {@code Builder} instance
         */
        public Builder inlineProjection(InlineProjection<JsonNode> inlineProjection) {
            requireNonNull(inlineProjection, InlineProjection.class.getSimpleName() + " cannot be null");
            this.inlineProjections.add(inlineProjection);
            return this;
        }

        /**
         * @param afterCommitHook A hook that is invoked after the append transaction has been committed
         * @return The same {@code Builder} instance
         */
        public Builder afterCommitHook(AfterCommitHook afterCommitHook) {
            requireNonNull(afterCommitHook, AfterCommitHook.class.getSimpleName() + " cannot be null");
            this.afterCommitHooks.add(afterCommitHook);
            return this;
        }

        /**
         * @param createSchemaIfNotExists Whether the tables should be created when the event store is instantiated. Default is {@code true}.
         * @return The same {@code Builder} instance
         */
        public Builder createSchemaIfNotExists(boolean createSchemaIfNotExists) {
            this.createSchemaIfNotExists = createSchemaIfNotExists;
            return this;
        }

        public PostgresEventStoreConfig build() {
            return new PostgresEventStoreConfig(partition, objectMapper, inlineProjections, afterCommitHooks, createSchemaIfNotExists);
        }
    }
}
