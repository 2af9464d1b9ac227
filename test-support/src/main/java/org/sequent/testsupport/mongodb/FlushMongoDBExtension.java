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

package org.sequent.testsupport.mongodb;

import com.mongodb.ConnectionString;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoDatabase;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Drops the collections of the event store before each test: the stream collections, prefixed {@code emt:}, and the
 * processor collections, prefixed {@code emt_}. Other collections of the database are left untouched.
 */
public class FlushMongoDBExtension implements BeforeEachCallback {
    private static final List<String> EVENT_STORE_PREFIXES = List.of("emt:", "emt_");

    private final ConnectionString connectionString;

    public FlushMongoDBExtension(ConnectionString connectionString) {
        this.connectionString = requireNonNull(connectionString, ConnectionString.class.getSimpleName() + " cannot be null");
    }

    @Override
    public void beforeEach(ExtensionContext extensionContext) {
        String databaseName = requireNonNull(connectionString.getDatabase(), "Database cannot be null in MongoDB connection string");
        try (MongoClient mongoClient = MongoClients.create(connectionString)) {
            MongoDatabase database = mongoClient.getDatabase(databaseName);
            database.listCollectionNames().into(new ArrayList<String>()).stream()
                    .filter(name -> EVENT_STORE_PREFIXES.stream().anyMatch(name::startsWith))
                    .forEach(name -> database.getCollection(name).drop());
        }
    }
}
