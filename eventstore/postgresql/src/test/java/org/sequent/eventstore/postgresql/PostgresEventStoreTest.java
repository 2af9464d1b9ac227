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
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.sequent.eventstore.api.*;
import org.sequent.testsupport.postgresql.PostgresDataSources;
import org.sequent.testsupport.postgresql.TruncatePostgresTablesExtension;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.junit.jupiter.api.Assertions.assertAll;
import static org.sequent.testsupport.domain.ShoppingCartMessages.*;

@Testcontainers
@Timeout(30)
@DisplayNameGeneration(ReplaceUnderscores.class)
class PostgresEventStoreTest {

    @Container
    private static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine");

    private final DataSource dataSource = PostgresDataSources.dataSource(postgres);

    @RegisterExtension
    TruncatePostgresTablesExtension truncatePostgresTablesExtension = new TruncatePostgresTablesExtension(dataSource);

    @Test
    void can_read_and_write_messages() {
        // Given
        PostgresEventStore eventStore = new PostgresEventStore(dataSource);
        Message added = productItemAdded("shoes", 2);
        Message confirmed = shoppingCartConfirmed();

        // When
        AppendResult appendResult = eventStore.appendToStream("cart:1", List.of(added, confirmed), ExpectedStreamVersion.streamDoesNotExist());

        // Then
        ReadStreamResult readResult = eventStore.readStream("cart:1");
        assertAll(
                () -> assertThat(appendResult).isEqualTo(new AppendResult(2, true)),
                () -> assertThat(readResult.currentStreamVersion()).isEqualTo(2),
                () -> assertThat(readResult.streamExists()).isTrue(),
                () -> assertThat(readResult.messages()).extracting(RecordedMessage::message).containsExactly(added, confirmed),
                () -> assertThat(readResult.messages()).extracting(RecordedMessage::streamPosition).containsExactly(1L, 2L),
                () -> assertThat(readResult.messages()).extracting(RecordedMessage::globalPosition).containsExactly(GlobalPosition.of(1), GlobalPosition.of(2))
        );
    }

    @Test
    void commands_keep_their_kind() {
        // Given
        PostgresEventStore eventStore = new PostgresEventStore(dataSource);

        // When
        eventStore.appendToStream("cart:1", List.of(confirmShoppingCart()));

        // Then
        assertThat(eventStore.readStream("cart:1").messages()).extracting(RecordedMessage::kind).containsExactly(MessageKind.COMMAND);
    }

    @Test
    void reading_a_stream_that_does_not_exist_returns_an_empty_result() {
        // Given
        PostgresEventStore eventStore = new PostgresEventStore(dataSource);

        // When
        ReadStreamResult result = eventStore.readStream("cart:unknown");

        // Then
        assertThat(result).isEqualTo(ReadStreamResult.streamNotFound());
    }

    @Test
    void reads_the_requested_range_and_reports_the_current_version() {
        // Given
        PostgresEventStore eventStore = new PostgresEventStore(dataSource);
        eventStore.appendToStream("cart:1", List.of(productItemAdded("a", 1), productItemAdded("b", 1), productItemAdded("c", 1)));
        eventStore.appendToStream("cart:1", List.of(productItemRemoved("a", 1)));

        // When
        ReadStreamResult result = eventStore.readStream("cart:1", ReadStreamOptions.from(2).withTo(3));

        // Then
        assertAll(
                () -> assertThat(result.messages()).extracting(RecordedMessage::streamPosition).containsExactly(2L, 3L),
                () -> assertThat(result.currentStreamVersion()).isEqualTo(4)
        );
    }

    @Test
    void aggregate_stream_folds_all_messages() {
        // Given
        PostgresEventStore eventStore = new PostgresEventStore(dataSource);
        eventStore.appendToStream("cart:1", List.of(productItemAdded("a", 2), productItemAdded("b", 3), productItemRemoved("a", 1)));

        // When
        AggregateStreamResult<Integer> result = eventStore.aggregateStream("cart:1", 0, (quantity, message) -> {
            int delta = message.data().get("quantity").asInt();
            return message.type().equals(PRODUCT_ITEM_REMOVED) ? quantity - delta : quantity + delta;
        });

        // Then
        assertThat(result).isEqualTo(new AggregateStreamResult<>(4, 3, true));
    }

    @Test
    void streams_in_different_partitions_are_independent() {
        // Given
        PostgresEventStore tenant1 = new PostgresEventStore(dataSource, new PostgresEventStoreConfig.Builder().partition("tenant1").build());
        PostgresEventStore tenant2 = new PostgresEventStore(dataSource, new PostgresEventStoreConfig.Builder().partition("tenant2").build());

        // When
        tenant1.appendToStream("cart:1", List.of(productItemAdded("a", 1)));

        // Then
        assertAll(
                () -> assertThat(tenant1.readStream("cart:1").currentStreamVersion()).isEqualTo(1),
                () -> assertThat(tenant2.readStream("cart:1").streamExists()).isFalse()
        );
    }

    @Nested
    class OptimisticConcurrency {

        @Test
        void append_with_wrong_expected_version_fails_and_writes_nothing() {
            // Given
            PostgresEventStore eventStore = new PostgresEventStore(dataSource);
            eventStore.appendToStream("cart:1", List.of(productItemAdded("a", 1)));

            // When
            Throwable throwable = catchThrowable(() -> eventStore.appendToStream("cart:1", List.of(productItemAdded("b", 1), productItemAdded("c", 1)), ExpectedStreamVersion.exactly(0)));

            // Then
            assertAll(
                    () -> assertThat(throwable).isExactlyInstanceOf(ExpectedVersionConflictException.class).hasMessage("Expected version 0 but was 1 for stream 'cart:1'."),
                    () -> assertThat(eventStore.readStream("cart:1").messages()).hasSize(1)
            );
        }

        @Test
        void stream_does_not_exist_fails_when_the_stream_exists() {
            // Given
            PostgresEventStore eventStore = new PostgresEventStore(dataSource);
            eventStore.appendToStream("cart:1", List.of(productItemAdded("a", 1)));

            // When
            Throwable throwable = catchThrowable(() -> eventStore.appendToStream("cart:1", List.of(productItemAdded("b", 1)), ExpectedStreamVersion.streamDoesNotExist()));

            // Then
            assertThat(throwable).isInstanceOfSatisfying(ExpectedVersionConflictException.class, e -> assertThat(e.actualVersion).isEqualTo(1));
        }

        @Test
        void read_with_wrong_expected_version_fails() {
            // Given
            PostgresEventStore eventStore = new PostgresEventStore(dataSource);

            // When
            Throwable throwable = catchThrowable(() -> eventStore.readStream("cart:1", ReadStreamOptions.all().withExpectedVersion(ExpectedStreamVersion.streamExists())));

            // Then
            assertThat(throwable).isExactlyInstanceOf(ExpectedVersionConflictException.class);
        }

        @Test
        void exactly_one_of_many_concurrent_appenders_with_the_same_expected_version_succeeds() throws Exception {
            // Given
            PostgresEventStore eventStore = new PostgresEventStore(dataSource);
            List<Throwable> failures = appendConcurrently(eventStore, 8, ExpectedStreamVersion.exactly(0));

            // Then
            assertAll(
                    () -> assertThat(failures).hasSize(7).allMatch(ExpectedVersionConflictException.class::isInstance),
                    () -> assertThat(eventStore.readStream("cart:1").messages()).extracting(RecordedMessage::streamPosition).containsExactly(1L)
            );
        }

        @Test
        void concurrent_appenders_without_expected_version_all_succeed_without_gaps() throws Exception {
            // Given
            PostgresEventStore eventStore = new PostgresEventStore(dataSource);
            List<Throwable> failures = appendConcurrently(eventStore, 8, ExpectedStreamVersion.any());

            // Then
            assertAll(
                    () -> assertThat(failures).isEmpty(),
                    () -> assertThat(eventStore.readStream("cart:1").messages()).extracting(RecordedMessage::streamPosition).containsExactly(1L, 2L, 3L, 4L, 5L, 6L, 7L, 8L)
            );
        }

        private List<Throwable> appendConcurrently(PostgresEventStore eventStore, int writers, ExpectedStreamVersion expectedVersion) throws InterruptedException {
            ExecutorService executor = Executors.newFixedThreadPool(writers);
            CountDownLatch startSignal = new CountDownLatch(1);
            List<Future<AppendResult>> futures = new ArrayList<>();
            for (int i = 0; i < writers; i++) {
                String productId = "product" + i;
                futures.add(executor.submit(() -> {
                    startSignal.await();
                    return eventStore.appendToStream("cart:1", List.of(productItemAdded(productId, 1)), expectedVersion);
                }));
            }
            startSignal.countDown();
            List<Throwable> failures = new CopyOnWriteArrayList<>();
            for (Future<AppendResult> future : futures) {
                try {
                    future.get(20, TimeUnit.SECONDS);
                } catch (ExecutionException e) {
                    failures.add(e.getCause());
                } catch (TimeoutException e) {
                    failures.add(e);
                }
            }
            executor.shutdownNow();
            return failures;
        }
    }

    @Nested
    class InlineProjections {

        private final InlineProjection<JsonNode> cartSummary = InlineProjection.of("cart_summary", Set.of(PRODUCT_ITEM_ADDED, SHOPPING_CART_CONFIRMED), (document, message) -> {
            if (message.type().equals(SHOPPING_CART_CONFIRMED)) {
                return null;
            }
            int current = document == null ? 0 : document.get("quantity").asInt();
            return JsonNodeFactory.instance.objectNode().put("quantity", current + message.data().get("quantity").asInt());
        });

        @Test
        void projection_document_is_written_in_the_append_transaction() {
            // Given
            PostgresEventStore eventStore = new PostgresEventStore(dataSource, new PostgresEventStoreConfig.Builder().inlineProjection(cartSummary).build());

            // When
            eventStore.appendToStream("cart:1", List.of(productItemAdded("a", 2)));
            eventStore.appendToStream("cart:1", List.of(productItemAdded("b", 5), productItemRemoved("a", 1)));

            // Then
            assertThat(eventStore.findInlineProjection("cart_summary", "cart:1")).hasValue(JsonNodeFactory.instance.objectNode().put("quantity", 7));
        }

        @Test
        void projection_returning_null_deletes_the_document() {
            // Given
            PostgresEventStore eventStore = new PostgresEventStore(dataSource, new PostgresEventStoreConfig.Builder().inlineProjection(cartSummary).build());
            eventStore.appendToStream("cart:1", List.of(productItemAdded("a", 2)));

            // When
            eventStore.appendToStream("cart:1", List.of(shoppingCartConfirmed()));

            // Then
            assertThat(eventStore.findInlineProjection("cart_summary", "cart:1")).isEmpty();
        }

        @Test
        void failing_projection_rolls_back_the_append() {
            // Given
            InlineProjection<JsonNode> failing = InlineProjection.of("failing", Set.of(PRODUCT_ITEM_ADDED), (document, message) -> {
                throw new IllegalStateException("expected");
            });
            PostgresEventStore eventStore = new PostgresEventStore(dataSource, new PostgresEventStoreConfig.Builder().inlineProjection(failing).build());

            // When
            Throwable throwable = catchThrowable(() -> eventStore.appendToStream("cart:1", List.of(productItemAdded("a", 2))));

            // Then
            assertAll(
                    () -> assertThat(throwable).isExactlyInstanceOf(IllegalStateException.class),
                    () -> assertThat(eventStore.readStream("cart:1").streamExists()).isFalse()
            );
        }
    }

    @Test
    void after_commit_hooks_are_invoked_with_recorded_messages_and_failures_are_swallowed() {
        // Given
        CopyOnWriteArrayList<RecordedMessage> received = new CopyOnWriteArrayList<>();
        PostgresEventStore eventStore = new PostgresEventStore(dataSource, new PostgresEventStoreConfig.Builder()
                .afterCommitHook((streamName, messages) -> {
                    throw new IllegalStateException("expected");
                })
                .afterCommitHook((streamName, messages) -> received.addAll(messages))
                .build());

        // When
        AppendResult result = eventStore.appendToStream("cart:1", List.of(productItemAdded("a", 2), shoppingCartConfirmed()));

        // Then
        assertAll(
                () -> assertThat(result.nextExpectedStreamVersion()).isEqualTo(2),
                () -> assertThat(received).extracting(RecordedMessage::globalPosition).containsExactly(GlobalPosition.of(1), GlobalPosition.of(2))
        );
    }
}
