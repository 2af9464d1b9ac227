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

package org.sequent.testsupport.postgresql;

import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

import static java.util.Objects.requireNonNull;

/**
 * Truncates all event store tables before each test, if the schema has been created. The global position
 * sequence is restarted so that the first message appended in each test gets global position 1.
 */
public class TruncatePostgresTablesExtension implements BeforeEachCallback {

    private final DataSource dataSource;

    public TruncatePostgresTablesExtension(DataSource dataSource) {
        this.dataSource = requireNonNull(dataSource, DataSource.class.getSimpleName() + " cannot be null");
    }

    @Override
    public void beforeEach(ExtensionContext extensionContext) {
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        String table = jdbcTemplate.queryForObject("SELECT CAST(to_regclass('emt_messages') AS TEXT)", String.class);
        if (table == null) {
            return;
        }
        jdbcTemplate.execute("TRUNCATE emt_streams, emt_messages, emt_processors, emt_projections, emt_inline_projections");
        jdbcTemplate.execute("ALTER SEQUENCE emt_global_message_position RESTART WITH 1");
    }
}
