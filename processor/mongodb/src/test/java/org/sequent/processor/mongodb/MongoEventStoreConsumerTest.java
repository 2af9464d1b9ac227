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
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.sequent.eventstore.api.RecordedMessage;
import org.sequent.eventstore.mongodb.MongoEventStore;
import org.sequent.eventstore.mongodb.MongoEventStoreConfig;
import org.sequent.processor.MessageHandlerResult;
import org.sequent.processor.MessageProcessor;
import org.sequent.processor.ProcessorDefinition;
import org.sequent.processor.ProcessorStatus;
import org.sequent.testsupport.mongodb.FlushMongoDBExtension;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertAll;
import static org.sequent.testsupport.domain.ShoppingCartMessages.*;

@Testcontainers
@Timeout(60)
@DisplayNameGeneration(ReplaceUnderscores.class)
class MongoEventStoreConsumerTest {
    private static final Duration WAIT = Duration.ofSeconds(15);

    @Container
    private static final MongoDBContainer mongoDBContainer = new MongoDBContainer("mongo:6.0");

    @RegisterExtension
    FlushMongoDBExtension flushMongoDBExtension = new FlushMongoDBExtension(new ConnectionString(mongoDBContainer.getReplicaSetUrl()));

    private MongoClient mongoClient;
    private MongoEventStore eventStore;
    private MongoEventStoreConsumer consumer;

    @BeforeEach
    void create_event_store_and_consumer() {
        mongoClient = MongoClients.create(mongoDBContainer.getReplicaSetUrl());
        eventStore = new MongoEventStore(mongoClient, new MongoEventStoreConfig.Builder().databaseName("test").build());
        consumer = new MongoEventStoreConsumer(mongoClient, consumerConfig("instance-1"));
    }

    @AfterEach
    void close_consumer_and_mongo_client() {
        consumer.close();
        mongoClient.close();
    }

    @Test
    void cannot_start_consumer_without_processors() {
        // When
        Throwable throwable = catchThrowable(consumer::start);

        // Then
        assertThat(throwable).isExactlyInstanceOf(IllegalStateException.class).hasMessage("Cannot start consumer without at least a single processor");
    }

    @Test
    void reactor_receives_messages_appended_after_it_started() {
        // Given
        List<RecordedMessage> received = new CopyOnWriteArrayList<>();
        MessageProcessor processor = consumer.reactor(ProcessorDefinition.reactor("reactor", message -> {
            received.add(message);
            return MessageHandlerResult.ack();
        }));
        consumer.start();
        awaitChangeStreamIsOpen(received);

        // When
        eventStore.appendToStream("cart:1", List.of(productItemAdded("a", 1), productItemAdded("b", 2)));
        eventStore.appendToStream("cart:1", List.of(shoppingCartConfirmed()));

        // Then
        await().atMost(WAIT).untilAsserted(() -> assertThat(cartMessages(received)).hasSize(3));
        RecordedMessage last = received.get(received.size() - 1);
        await().atMost(WAIT).untilAsserted(() -> assertThat(processor.lastCheckpoint()).contains(last.globalPosition()));
        assertAll(
                () -> assertThat(cartMessages(received)).extracting(RecordedMessage::type).containsExactly(PRODUCT_ITEM_ADDED, PRODUCT_ITEM_ADDED, SHOPPING_CART_CONFIRMED),
                () -> assertThat(processor.status()).isEqualTo(ProcessorStatus.ACTIVE)
        );
    }

    @Test
    void reactor_resumes_after_its_checkpoint_when_restarted() {
        // Given
        List<RecordedMessage> received = new CopyOnWriteArrayList<>();
        AtomicInteger cartMessages = new AtomicInteger();
        consumer.reactor(ProcessorDefinition.reactor("reactor", message -> {
            received.add(message);
            return MessageHandlerResult.ack();
        }).withStopAfter(message -> message.streamName().startsWith("cart:") && cartMessages.incrementAndGet() == 5));
        CompletableFuture<Void> firstRun = consumer.start();
        awaitChangeStreamIsOpen(received);

        // When
        for (int i = 1; i <= 10; i++) {
            eventStore.appendToStream("cart:" + i, List.of(productItemAdded("p" + i, i)));
        }

        // Then
        assertThat(firstRun).succeedsWithin(WAIT);
        assertThat(cartMessages(received)).extracting(RecordedMessage::streamName).containsExactly("cart:1", "cart:2", "cart:3", "cart:4", "cart:5");

        // When
        List<RecordedMessage> receivedAfterRestart = new CopyOnWriteArrayList<>();
        try (MongoEventStoreConsumer restarted = new MongoEventStoreConsumer(mongoClient, consumerConfig("instance-2"))) {
            restarted.reactor(ProcessorDefinition.reactor("reactor", message -> {
                receivedAfterRestart.add(message);
                return MessageHandlerResult.ack();
            }));
            restarted.start();

            // Then
            await().atMost(WAIT).untilAsserted(() -> assertThat(receivedAfterRestart).hasSize(5));
            assertThat(receivedAfterRestart).extracting(RecordedMessage::streamName).containsExactly("cart:6", "cart:7", "cart:8", "cart:9", "cart:10");
        }
    }

    @Test
    void only_one_instance_runs_an_exclusive_processor() {
        // Given
        List<RecordedMessage> received = new CopyOnWriteArrayList<>();
        MessageProcessor first = consumer.reactor(ProcessorDefinition.reactor("reactor", message -> {
            received.add(message);
            return MessageHandlerResult.ack();
        }));
        consumer.start();
        awaitChangeStreamIsOpen(received);

        // When
        try (MongoEventStoreConsumer second = new MongoEventStoreConsumer(mongoClient, consumerConfig("instance-2"))) {
            MessageProcessor idle = second.reactor(ProcessorDefinition.reactor("reactor", message -> MessageHandlerResult.ack()));
            CompletableFuture<Void> secondRun = second.start();

            // Then
            assertThat(secondRun).succeedsWithin(WAIT);
            assertAll(
                    () -> assertThat(first.status()).isEqualTo(ProcessorStatus.ACTIVE),
                    () -> assertThat(idle.status()).isEqualTo(ProcessorStatus.IDLE)
            );
        }
    }

    @Test
    void consumer_created_from_connection_string_closes_its_own_client() {
        // Given
        MongoEventStoreConsumer owning = MongoEventStoreConsumer.create(new ConnectionString(mongoDBContainer.getReplicaSetUrl()));
        List<RecordedMessage> received = new CopyOnWriteArrayList<>();
        owning.reactor(ProcessorDefinition.reactor("reactor", message -> {
            received.add(message);
            return MessageHandlerResult.ack();
        }));
        owning.start();
        awaitChangeStreamIsOpen(received);

        // When
        owning.close();

        // Then
        assertAll(
                () -> assertThat(owning.isRunning()).isFalse(),
                () -> assertThat(catchThrowable(owning::start)).isInstanceOf(IllegalStateException.class)
        );
    }

    // The change stream starts when the consumer has opened it, so keep appending until the processor sees a message
    private void awaitChangeStreamIsOpen(List<RecordedMessage> received) {
        AtomicInteger ping = new AtomicInteger();
        await().atMost(WAIT).pollInterval(Duration.ofMillis(200)).until(() -> {
            if (received.isEmpty()) {
                eventStore.appendToStream("ping:" + ping.incrementAndGet(), List.of(productItemAdded("ping", 1)));
            }
            return !received.isEmpty();
        });
    }

    private static List<RecordedMessage> cartMessages(List<RecordedMessage> received) {
        return received.stream().filter(message -> message.streamName().startsWith("cart:")).toList();
    }

    private static MongoConsumerConfig consumerConfig(String instanceId) {
        return new MongoConsumerConfig.Builder().databaseName("test").instanceId(instanceId).maxAwaitTime(Duration.ofMillis(100)).build();
    }
}
