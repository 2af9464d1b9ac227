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

import org.sequent.eventstore.postgresql.PostgresEventStoreSchema;
import org.sequent.processor.EventStoreConsumer;
import org.sequent.processor.ProcessorDefinition;
import org.sequent.processor.Projection;
import org.sequent.processor.StartFrom;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.util.Collections;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * An {@link EventStoreConsumer} that polls the messages of a PostgreSQL event store. Each message is handled, and its
 * checkpoint stored, in a database transaction.
 * <p>
 * The {@link DataSource} is owned by the caller and is not closed when the consumer is closed.
 */
public class PostgresEventStoreConsumer extends EventStoreConsumer {
    static final String REBUILD_SUFFIX = "-rebuild";

    public PostgresEventStoreConsumer(DataSource dataSource) {
        this(dataSource, PostgresConsumerConfig.defaultConfig());
    }

    public PostgresEventStoreConsumer(DataSource dataSource, PostgresConsumerConfig config) {
        super(new PostgresMessageFeed(createSchemaIfConfigured(dataSource, config), config),
                new PostgresCheckpointStore(dataSource),
                new PostgresProcessorLockFactory(dataSource, config.lockConfig.lockTimeout),
                new TransactionalProcessingScope(new TransactionTemplate(new DataSourceTransactionManager(dataSource))),
                config.lockConfig,
                config.instanceId,
                Collections.emptyList(),
                config.stopWhenNoMessagesLeft);
    }

    /**
     * Create a consumer that rebuilds the projections of the given projectors from the beginning and stops once it has caught up.
     * Each projector is registered with processor id {@code <processor id>-rebuild} and {@code truncateOnStart}, so the projection
     * is truncated first and the checkpoint of the regular projector is left untouched.
     */
    public static PostgresEventStoreConsumer rebuild(DataSource dataSource, PostgresConsumerConfig config, List<ProcessorDefinition.Projector> projectors) {
        requireNonNull(config, PostgresConsumerConfig.class.getSimpleName() + " cannot be null");
        requireNonNull(projectors, "projectors cannot be null");
        if (projectors.isEmpty()) {
            throw new IllegalArgumentException("At least one projector must be rebuilt");
        }
        PostgresEventStoreConsumer consumer = new PostgresEventStoreConsumer(dataSource, config.toBuilder().stopWhenNoMessagesLeft(true).build());
        for (ProcessorDefinition.Projector projector : projectors) {
            consumer.projector(projector
                    .withProcessorId(rebuildProcessorId(projector))
                    .withStartFrom(StartFrom.beginning())
                    .withTruncateOnStart(true));
        }
        return consumer;
    }

    public static PostgresEventStoreConsumer rebuild(DataSource dataSource, Projection projection) {
        return rebuild(dataSource, PostgresConsumerConfig.defaultConfig(), List.of(ProcessorDefinition.projector(projection)));
    }

    static String rebuildProcessorId(ProcessorDefinition.Projector projector) {
        return projector.processorId().endsWith(REBUILD_SUFFIX) ? projector.processorId() : projector.processorId() + REBUILD_SUFFIX;
    }

    private static DataSource createSchemaIfConfigured(DataSource dataSource, PostgresConsumerConfig config) {
        requireNonNull(dataSource, DataSource.class.getSimpleName() + " cannot be null");
        requireNonNull(config, PostgresConsumerConfig.class.getSimpleName() + " cannot be null");
        if (config.createSchemaIfNotExists) {
            PostgresEventStoreSchema.createIfNotExists(dataSource);
        }
        return dataSource;
    }
}
