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

import com.mongodb.ConnectionString;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoDatabase;
import org.sequent.processor.EventStoreConsumer;
import org.sequent.processor.ProcessingScope;

import java.util.Collections;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * An {@link EventStoreConsumer} that reads the messages of a MongoDB event store from a change stream. Checkpoints and
 * locks are stored in the same database as the streams.
 * <p>
 * Note that change streams require MongoDB to run as a replica set.
 */
public class MongoEventStoreConsumer extends EventStoreConsumer {

    /**
     * Create a consumer that uses a {@link MongoClient} owned by the caller. The client is not closed when the consumer is closed.
     */
    public MongoEventStoreConsumer(MongoClient mongoClient, MongoConsumerConfig config) {
        this(database(mongoClient, config), config, Collections.emptyList());
    }

    private MongoEventStoreConsumer(MongoDatabase database, MongoConsumerConfig config, List<AutoCloseable> ownedResources) {
        super(new MongoChangeStreamFeed(database, config),
                new MongoCheckpointStore(database),
                new MongoProcessorLockFactory(database, config.lockConfig.lockTimeout),
                ProcessingScope.none(),
                config.lockConfig,
                config.instanceId,
                ownedResources);
    }

    public static MongoEventStoreConsumer create(ConnectionString connectionString) {
        return create(connectionString, new MongoConsumerConfig.Builder());
    }

    /**
     * Create a consumer with its own {@link MongoClient}, closed when the consumer is closed. The database is taken from the connection string.
     */
    public static MongoEventStoreConsumer create(ConnectionString connectionString, MongoConsumerConfig.Builder config) {
        requireNonNull(connectionString, ConnectionString.class.getSimpleName() + " cannot be null");
        requireNonNull(config, MongoConsumerConfig.Builder.class.getSimpleName() + " cannot be null");
        String databaseName = requireNonNull(connectionString.getDatabase(), "Database must be defined in the connection string");
        MongoConsumerConfig consumerConfig = config.databaseName(databaseName).build();
        MongoClient mongoClient = MongoClients.create(connectionString);
        return new MongoEventStoreConsumer(mongoClient.getDatabase(databaseName), consumerConfig, List.<AutoCloseable>of(mongoClient::close));
    }

    private static MongoDatabase database(MongoClient mongoClient, MongoConsumerConfig config) {
        requireNonNull(mongoClient, MongoClient.class.getSimpleName() + " cannot be null");
        requireNonNull(config, MongoConsumerConfig.class.getSimpleName() + " cannot be null");
        return mongoClient.getDatabase(config.databaseName);
    }
}
