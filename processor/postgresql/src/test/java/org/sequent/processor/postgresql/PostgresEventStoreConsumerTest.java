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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.sequent.eventstore.api.GlobalPosition;
import org.sequent.eventstore.api.RecordedMessage;
import org.sequent.eventstore.postgresql.PostgresEventStore;
import org.sequent.processor.MessageHandlerResult;
import org.sequent.processor.MessageProcessor;
import org.sequent.processor.ProcessorDefinition;
import org.sequent.processor.ProcessorStatus;
import org.sequent.processor.Projection;
import org.sequent.testsupport.postgresql.PostgresDataSources;
import org.sequent.testsupport.postgresql.TruncatePostgresTablesExtension;
import org.springframework.jdbc.core.JdbcTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertAll;
import static org.sequent.testsupport.domain.ShoppingCartMessages.*;

@Testcontainers
@Timeout(60)
@DisplayNameGeneration(ReplaceUnderscores.class)
class PostgresEventStoreConsumerTest {
    private static final Duration WAIT = Duration.ofSeconds(10);

    @Container
    private static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine");

    private final DataSource dataSource = PostgresDataSources.dataSource(postgres);
    private final JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);

    @RegisterExtension
    TruncatePostgresTablesExtension truncatePostgresTablesExtension = new TruncatePostgresTablesExtension(dataSource);

    private PostgresEventStore eventStore;
    private PostgresEventStoreConsumer consumer;

    @BeforeEach
    void create_event_store_and_consumer() {
        eventStore = new PostgresEventStore(dataSource);
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS cart_items (cart_id TEXT PRIMARY KEY, quantity INT NOT NULL)");
        jdbcTemplate.execute("TRUNCATE cart_items");
        consumer = new PostgresEventStoreConsumer(dataSource, consumerConfig("instance-1"));
    }

    @AfterEach
    void close_consumer() {
        consumer.close();
    }

    @Test
    void cannot_start_consumer_without_processors() {
        // When
        Throwable throwable = catchThrowable(consumer::start);

        // Then
        assertThat(throwable).isExactlyInstanceOf(IllegalStateException.class).hasMessage("Cannot start consumer without at least a single processor");
    }

    @Test
    void reactor_stops_after_condition_and_resumes_after_its_checkpoint_when_restarted() {
        // Given
        for (int i = 1; i <= 10; i++) {
            eventStore.appendToStream("cart:" + i, List.of(productItemAdded("p" + i, i)));
        }
        List<RecordedMessage> received = new CopyOnWriteArrayList<>();
        consumer.reactor(ProcessorDefinition.reactor("reactor", message -> {
            received.add(message);
            return MessageHandlerResult.ack();
        }).withStopAfter(message -> message.globalPosition().equals(GlobalPosition.of(5))));

        // When
        CompletableFuture<Void> firstRun = consumer.start();

        // Then
        assertThat(firstRun).succeedsWithin(WAIT);
        assertThat(received).extracting(RecordedMessage::globalPosition)
                .containsExactly(GlobalPosition.of(1), GlobalPosition.of(2), GlobalPosition.of(3), GlobalPosition.of(4), GlobalPosition.of(5));

        // When
        List<RecordedMessage> receivedAfterRestart = new CopyOnWriteArrayList<>();
        try (PostgresEventStoreConsumer restarted = new PostgresEventStoreConsumer(dataSource, consumerConfig("instance-2"))) {
            restarted.reactor(ProcessorDefinition.reactor("reactor", message -> {
                receivedAfterRestart.add(message);
                return MessageHandlerResult.ack();
            }));
            restarted.start();

            // Then
            await().atMost(WAIT).untilAsserted(() -> assertThat(receivedAfterRestart).hasSize(5));
            assertThat(receivedAfterRestart).extracting(RecordedMessage::globalPosition)
                    .containsExactly(GlobalPosition.of(6), GlobalPosition.of(7), GlobalPosition.of(8), GlobalPosition.of(9), GlobalPosition.of(10));
        }
    }

    @Test
    void projector_writes_read_model_in_the_same_transaction_as_the_checkpoint() {
        // Given
        MessageProcessor processor = consumer.projector(ProcessorDefinition.projector(new CartItemsProjection()));
        eventStore.appendToStream("cart:1", List.of(productItemAdded("p1", 2), productItemAdded("p2", 3), shoppingCartConfirmed()));

        // When
        consumer.start();

        // Then
        await().atMost(WAIT).untilAsserted(() -> assertThat(processor.lastCheckpoint()).hasValue(GlobalPosition.of(3)));
        assertAll(
                () -> assertThat(jdbcTemplate.queryForObject("SELECT quantity FROM cart_items WHERE cart_id = 'cart:1'", Integer.class)).isEqualTo(5),
                () -> assertThat(jdbcTemplate.queryForObject("SELECT last_processed_checkpoint FROM emt_processors WHERE processor_id = 'projection:cart-items'", String.class))
                        .isEqualTo("0000000000000000003"),
                () -> assertThat(jdbcTemplate.queryForObject("SELECT status FROM emt_projections WHERE name = 'cart-items'", String.class)).isEqualTo("async_processing")
        );
    }

    @Test
    void failing_projection_rolls_back_its_writes_and_fails_the_consumer() {
        // Given
        MessageProcessor processor = consumer.projector(ProcessorDefinition.projector(new CartItemsProjection() {
            @Override
            public void handle(RecordedMessage message) {
                super.handle(message);
                if (message.globalPosition().equals(GlobalPosition.of(2))) {
                    throw new IllegalStateException("expected");
                }
            }
        }));
        eventStore.appendToStream("cart:1", List.of(productItemAdded("p1", 2), productItemAdded("p2", 3)));

        // When
        CompletableFuture<Void> future = consumer.start();

        // Then
        assertThat(future).failsWithin(WAIT).withThrowableOfType(ExecutionException.class).withCauseExactlyInstanceOf(IllegalStateException.class);
        assertAll(
                () -> assertThat(processor.status()).isEqualTo(ProcessorStatus.FAILED),
                () -> assertThat(jdbcTemplate.queryForObject("SELECT quantity FROM cart_items WHERE cart_id = 'cart:1'", Integer.class)).isEqualTo(2),
                () -> assertThat(jdbcTemplate.queryForObject("SELECT last_processed_checkpoint FROM emt_processors WHERE processor_id = 'projection:cart-items'", String.class))
                        .isEqualTo("0000000000000000001"),
                () -> assertThat(jdbcTemplate.queryForObject("SELECT status FROM emt_processors WHERE processor_id = 'projection:cart-items'", String.class)).isEqualTo("stopped")
        );
    }

    @Test
    void only_one_instance_runs_a_processor_at_a_time() {
        // Given
        List<String> handledBy = new CopyOnWriteArrayList<>();
        consumer.reactor(ProcessorDefinition.reactor("reactor", message -> {
            handledBy.add("instance-1");
            return MessageHandlerResult.ack();
        }));
        MessageProcessor first = consumer.processors().get(0);
        consumer.start();
        await().atMost(WAIT).until(first::isActive);

        try (PostgresEventStoreConsumer second = new PostgresEventStoreConsumer(dataSource, consumerConfig("instance-2"))) {
            MessageProcessor secondProcessor = second.reactor(ProcessorDefinition.reactor("reactor", message -> {
                handledBy.add("instance-2");
                return MessageHandlerResult.ack();
            }));

            // When
            CompletableFuture<Void> secondRun = second.start();
            eventStore.appendToStream("cart:1", List.of(productItemAdded("p1", 1), productItemAdded("p2", 1)));

            // Then
            assertThat(secondRun).succeedsWithin(WAIT);
            await().atMost(WAIT).untilAsserted(() -> assertThat(handledBy).hasSize(2));
            assertAll(
                    () -> assertThat(secondProcessor.status()).isEqualTo(ProcessorStatus.IDLE),
                    () -> assertThat(handledBy).containsOnly("instance-1")
            );
        }
    }

    @Test
    void stopping_the_consumer_releases_the_processor_lock() {
        // Given
        consumer.reactor(ProcessorDefinition.reactor("reactor", message -> MessageHandlerResult.ack()));
        MessageProcessor processor = consumer.processors().get(0);
        CompletableFuture<Void> future = consumer.start();
        await().atMost(WAIT).until(processor::isActive);

        // When
        consumer.stop();
        consumer.stop();

        // Then
        assertAll(
                () -> assertThat(future).isCompleted(),
                () -> assertThat(jdbcTemplate.queryForObject("SELECT status FROM emt_processors WHERE processor_id = 'reactor'", String.class)).isEqualTo("stopped"),
                () -> assertThat(jdbcTemplate.queryForObject("SELECT processor_instance_id FROM emt_processors WHERE processor_id = 'reactor'", String.class)).isEqualTo("emt:unknown")
        );
    }

    @Test
    void consumer_that_stops_when_no_messages_are_left_completes_once_it_has_caught_up() {
        // Given
        eventStore.appendToStream("cart:1", List.of(productItemAdded("p1", 1), productItemAdded("p2", 1), shoppingCartConfirmed()));
        List<RecordedMessage> received = new CopyOnWriteArrayList<>();
        try (PostgresEventStoreConsumer catchingUp = new PostgresEventStoreConsumer(dataSource, consumerConfig("instance-2").toBuilder().batchSize(2).stopWhenNoMessagesLeft(true).build())) {
            catchingUp.reactor(ProcessorDefinition.reactor("reactor", message -> {
                received.add(message);
                return MessageHandlerResult.ack();
            }));

            // When
            CompletableFuture<Void> future = catchingUp.start();

            // Then
            assertThat(future).succeedsWithin(WAIT);
            assertAll(
                    () -> assertThat(received).extracting(RecordedMessage::globalPosition).containsExactly(GlobalPosition.of(1), GlobalPosition.of(2), GlobalPosition.of(3)),
                    () -> assertThat(jdbcTemplate.queryForObject("SELECT status FROM emt_processors WHERE processor_id = 'reactor'", String.class)).isEqualTo("stopped")
            );
        }
    }

    @Test
    void rebuild_truncates_the_projection_replays_all_messages_and_stops() {
        // Given
        jdbcTemplate.update("INSERT INTO cart_items (cart_id, quantity) VALUES ('cart:stale', 99)");
        eventStore.appendToStream("cart:1", List.of(productItemAdded("p1", 2), productItemAdded("p2", 3)));
        eventStore.appendToStream("cart:2", List.of(productItemAdded("p3", 1)));

        // When
        CompletableFuture<Void> future;
        try (PostgresEventStoreConsumer rebuild = PostgresEventStoreConsumer.rebuild(dataSource, consumerConfig("rebuild"), List.of(ProcessorDefinition.projector(new CartItemsProjection())))) {
            future = rebuild.start();
            assertThat(future).succeedsWithin(WAIT);
        }

        // Then
        assertAll(
                () -> assertThat(jdbcTemplate.queryForList("SELECT cart_id FROM cart_items ORDER BY cart_id", String.class)).containsExactly("cart:1", "cart:2"),
                () -> assertThat(jdbcTemplate.queryForObject("SELECT quantity FROM cart_items WHERE cart_id = 'cart:1'", Integer.class)).isEqualTo(5),
                () -> assertThat(jdbcTemplate.queryForObject("SELECT last_processed_checkpoint FROM emt_processors WHERE processor_id = 'projection:cart-items-rebuild'", String.class))
                        .isEqualTo("0000000000000000003"),
                () -> assertThat(jdbcTemplate.queryForList("SELECT processor_id FROM emt_processors", String.class)).containsExactly("projection:cart-items-rebuild")
        );
    }

    @Test
    void rebuild_can_be_repeated_and_leaves_a_deactivated_projection_inactive() {
        // Given
        ProcessorDefinition.Projector projector = ProcessorDefinition.projector(new CartItemsProjection());
        PostgresProjections projections = new PostgresProjections(dataSource);
        projections.register(projector, ProjectionStatus.ACTIVE);
        projections.deactivate("cart-items", projector.partition(), projector.version());
        eventStore.appendToStream("cart:1", List.of(productItemAdded("p1", 2), productItemAdded("p2", 3)));

        // When
        for (int run = 1; run <= 2; run++) {
            try (PostgresEventStoreConsumer rebuild = PostgresEventStoreConsumer.rebuild(dataSource, consumerConfig("rebuild-" + run), List.of(projector))) {
                assertThat(rebuild.start()).succeedsWithin(WAIT);
            }
        }

        // Then
        assertAll(
                () -> assertThat(jdbcTemplate.queryForObject("SELECT quantity FROM cart_items WHERE cart_id = 'cart:1'", Integer.class)).isEqualTo(5),
                () -> assertThat(projections.find("cart-items", projector.partition(), projector.version())).map(PostgresProjections.ProjectionInfo::status).hasValue(ProjectionStatus.INACTIVE)
        );
    }

    private static PostgresConsumerConfig consumerConfig(String instanceId) {
        return new PostgresConsumerConfig.Builder().instanceId(instanceId).backoff(Duration.ofMillis(10), Duration.ofMillis(100)).build();
    }

    private class CartItemsProjection implements Projection {

        @Override
        public String name() {
            return "cart-items";
        }

        @Override
        public Set<String> canHandle() {
            return Set.of(PRODUCT_ITEM_ADDED);
        }

        @Override
        public void truncate() {
            jdbcTemplate.update("DELETE FROM cart_items");
        }

        @Override
        public void handle(RecordedMessage message) {
            jdbcTemplate.update("INSERT INTO cart_items (cart_id, quantity) VALUES (?, ?) ON CONFLICT (cart_id) DO UPDATE SET quantity = cart_items.quantity + EXCLUDED.quantity",
                    message.streamName(), message.data().get("quantity").asInt());
        }
    }
}
