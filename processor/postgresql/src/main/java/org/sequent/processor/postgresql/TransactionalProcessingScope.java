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

import org.sequent.processor.ProcessingScope;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Runs each handled message and its checkpoint in one database transaction. Projections that write with a
 * {@code JdbcTemplate} on the same {@code DataSource} join the transaction.
 */
class TransactionalProcessingScope implements ProcessingScope {
    private final TransactionTemplate transactionTemplate;

    TransactionalProcessingScope(TransactionTemplate transactionTemplate) {
        this.transactionTemplate = requireNonNull(transactionTemplate, TransactionTemplate.class.getSimpleName() + " cannot be null");
    }

    @Override
    public <T> T execute(Supplier<T> work) {
        return transactionTemplate.execute(__ -> work.get());
    }
}
