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

import org.sequent.processor.LockMode;
import org.sequent.processor.ProcessorDefinition;
import org.sequent.processor.ProcessorLock;
import org.sequent.processor.ProcessorLockFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.time.Duration;

import static java.util.Objects.requireNonNull;

public class PostgresProcessorLockFactory implements ProcessorLockFactory {
    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final Duration lockTimeout;

    public PostgresProcessorLockFactory(DataSource dataSource, Duration lockTimeout) {
        requireNonNull(dataSource, DataSource.class.getSimpleName() + " cannot be null");
        this.lockTimeout = requireNonNull(lockTimeout, "lockTimeout cannot be null");
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
    }

    @Override
    public ProcessorLock create(ProcessorDefinition definition, String instanceId, LockMode lockMode) {
        requireNonNull(definition, ProcessorDefinition.class.getSimpleName() + " cannot be null");
        requireNonNull(instanceId, "instanceId cannot be null");
        requireNonNull(lockMode, LockMode.class.getSimpleName() + " cannot be null");
        return new PostgresProcessorLock(jdbcTemplate, transactionTemplate, definition, instanceId, lockMode, lockTimeout);
    }
}
