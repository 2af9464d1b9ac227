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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import javax.sql.DataSource;

import static java.util.Objects.requireNonNull;

/**
 * Creates the tables and sequences used by the PostgreSQL event store and its processors. All statements are
 * idempotent so this can be invoked every time the application starts.
 */
public final class PostgresEventStoreSchema {
    private static final Logger log = LoggerFactory.getLogger(PostgresEventStoreSchema.class);

    public static final String DEFAULT_PARTITION = "emt:default";
    public static final String SCHEMA_LOCATION = "org/sequent/eventstore/postgresql/schema.sql";

    private PostgresEventStoreSchema() {
    }

    public static void createIfNotExists(DataSource dataSource) {
        requireNonNull(dataSource, DataSource.class.getSimpleName() + " cannot be null");
        log.debug("Creating event store schema from {} (if not exists)", SCHEMA_LOCATION);
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource(SCHEMA_LOCATION, PostgresEventStoreSchema.class.getClassLoader()));
        populator.setContinueOnError(false);
        populator.execute(dataSource);
    }
}
