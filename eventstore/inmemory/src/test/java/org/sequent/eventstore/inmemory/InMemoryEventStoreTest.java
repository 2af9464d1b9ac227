/*
 * Copyright 2020 Johan Haleby
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

package org.sequent.eventstore.inmemory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.assertj.core.api.SoftAssertions;
import org.assertj.core.api.junit.jupiter.SoftAssertionsExtension;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.sequent.eventstore.api.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.junit.jupiter.api.Assertions.assertAll;

@ExtendWith(SoftAssertionsExtension.class)
@DisplayNameGeneration(ReplaceUnderscores.class)
class InMemoryEventStoreTest {

    @Test
    void read_and_write(SoftAssertions softly) {
        // Given
        InMemoryEventStore eventStore = new InMemoryEventStore();
        Message added = productItemAdded("shoes", 2);

        // When
        AppendResult appendResult = eventStore.appendToStream("cart:1", List.of(added), ExpectedStreamVersion.streamDoesNotExist());

        // Then
        ReadStreamResult readResult = eventStore.readStream("cart:1");
        softly.assertThat(appendResult).isEqualTo(new AppendResult(1, true));
        softly.assertThat(readResult.streamExists()).isTrue();
        softly.assertThat(readResult.currentStreamVersion()).isEqualTo(1);
        softly.assertThat(readResult.messages()).extracting(RecordedMessage::message).containsExactly(added);
        softly.assertThat(readResult.messages()).extracting(RecordedMessage::globalPosition).containsExactly(GlobalPosition.of(1));
    }

    @Test
    void reading_a_stream_that_does_not_exist_returns_an_empty_result() {
        // Given
        InMemoryEventStore eventStore = new InMemoryEventStore();

        // When
        ReadStreamResult result = eventStore.readStream("cart:unknown");

        // Then
        assertThat(result).isEqualTo(ReadStreamResult.streamNotFound());
    }

    @Test
    void read_range_is_inclusive_in_both_ends() {
        // Given
        InMemoryEventStore eventStore = new InMemoryEventStore();
        eventStore.appendToStream("cart:1", List.of(productItemAdded("a", 1), productItemAdded("b", 1), productItemAdded("c", 1), productItemAdded("d", 1)));

        // When
        ReadStreamResult result = eventStore.readStream("cart:1", ReadStreamOptions.from(2).withTo(3));

        // Then
        assertAll(
                () -> assertThat(result.messages()).extracting(RecordedMessage::streamPosition).containsExactly(2L, 3L),
                () -> assertThat(result.currentStreamVersion()).isEqualTo(4)
        );
    }

    @Test
    void aggregate_stream_folds_messages_in_order() {
        // Given
        InMemoryEventStore eventStore = new InMemoryEventStore();
        eventStore.appendToStream("cart:1", List.of(productItemAdded("a", 1), productItemAdded("b", 3)));
        eventStore.appendToStream("cart:1", List.of(productItemAdded("c", 2)));

        // When
        AggregateStreamResult<List<String>> result = eventStore.aggregateStream("cart:1", List.of(), (products, message) -> {
            List<String> next = new ArrayList<>(products);
            next.add(message.data().get("productId").asText());
            return next;
        });

        // Then
        assertThat(result).isEqualTo(new AggregateStreamResult<>(List.of("a", "b", "c"), 3, true));
    }

    @Test
    void empty_append_returns_current_version_without_creating_the_stream() {
        // Given
        InMemoryEventStore eventStore = new InMemoryEventStore();

        // When
        AppendResult result = eventStore.appendToStream("cart:1", List.of());

        // Then
        assertAll(
                () -> assertThat(result).isEqualTo(new AppendResult(0, false)),
                () -> assertThat(eventStore.exists("cart:1")).isFalse()
        );
    }

    @Nested
    class ExpectedVersion {

        @Test
        void append_fails_when_expected_version_does_not_match_and_nothing_is_written() {
            // Given
            InMemoryEventStore eventStore = new InMemoryEventStore();
            eventStore.appendToStream("cart:1", List.of(productItemAdded("a", 1)));

            // When
            Throwable throwable = catchThrowable(() -> eventStore.appendToStream("cart:1", List.of(productItemAdded("b", 1)), ExpectedStreamVersion.exactly(0)));

            // Then
            assertAll(
                    () -> assertThat(throwable).isExactlyInstanceOf(ExpectedVersionConflictException.class)
                            .hasMessage("Expected version 0 but was 1 for stream 'cart:1'."),
                    () -> assertThat(eventStore.readStream("cart:1").currentStreamVersion()).isEqualTo(1)
            );
        }

        @Test
        void stream_exists_is_not_fulfilled_by_a_missing_stream() {
            // Given
            InMemoryEventStore eventStore = new InMemoryEventStore();

            // When
            Throwable throwable = catchThrowable(() -> eventStore.appendToStream("cart:1", List.of(productItemAdded("a", 1)), ExpectedStreamVersion.streamExists()));

            // Then
            assertThat(throwable).isInstanceOf(ExpectedVersionConflictException.class);
        }

        @Test
        void read_fails_when_expected_version_does_not_match() {
            // Given
            InMemoryEventStore eventStore = new InMemoryEventStore();
            eventStore.appendToStream("cart:1", List.of(productItemAdded("a", 1), productItemAdded("b", 1)));

            // When
            Throwable throwable = catchThrowable(() -> eventStore.readStream("cart:1", ReadStreamOptions.all().withExpectedVersion(ExpectedStreamVersion.exactly(1))));

            // Then
            assertThat(throwable).isExactlyInstanceOf(ExpectedVersionConflictException.class);
        }

        @Test
        void only_one_of_several_concurrent_appenders_with_the_same_expected_version_succeeds() throws Exception {
            // Given
            InMemoryEventStore eventStore = new InMemoryEventStore();
            int writers = 10;
            ExecutorService executor = Executors.newFixedThreadPool(writers);
            CountDownLatch startSignal = new CountDownLatch(1);
            List<Future<AppendResult>> futures = new ArrayList<>();

            // When
            for (int i = 0; i < writers; i++) {
                futures.add(executor.submit(() -> {
                    startSignal.await();
                    return eventStore.appendToStream("cart:1", List.of(productItemAdded("a", 1)), ExpectedStreamVersion.exactly(0));
                }));
            }
            startSignal.countDown();

            int succeeded = 0;
            int conflicts = 0;
            for (Future<AppendResult> future : futures) {
                try {
                    assertThat(future.get(5, TimeUnit.SECONDS).nextExpectedStreamVersion()).isEqualTo(1);
                    succeeded++;
                } catch (ExecutionException e) {
                    assertThat(e.getCause()).isInstanceOf(ExpectedVersionConflictException.class);
                    conflicts++;
                }
            }
            executor.shutdownNow();

            // Then
            assertThat(succeeded).isEqualTo(1);
            assertThat(conflicts).isEqualTo(writers - 1);
            assertThat(eventStore.readStream("cart:1").messages()).hasSize(1);
        }
    }

    @Nested
    class InlineProjections {

        @Test
        void projection_is_updated_with_each_append() {
            // Given
            InlineProjection<JsonNode> itemCount = InlineProjection.of("item_count", Set.of("ProductItemAdded"), (document, message) -> {
                int current = document == null ? 0 : document.get("count").asInt();
                return JsonNodeFactory.instance.objectNode().put("count", current + message.data().get("quantity").asInt());
            });
            InMemoryEventStore eventStore = new InMemoryEventStore(List.of(itemCount), List.of());

            // When
            eventStore.appendToStream("cart:1", List.of(productItemAdded("a", 2)));
            eventStore.appendToStream("cart:1", List.of(productItemAdded("b", 3), Message.event("ShoppingCartConfirmed")));

            // Then
            assertThat(eventStore.findInlineProjection("item_count", "cart:1")).hasValue(JsonNodeFactory.instance.objectNode().put("count", 5));
        }

        @Test
        void projection_returning_null_deletes_the_document() {
            // Given
            InlineProjection<JsonNode> openCart = InlineProjection.of("open_cart", Set.of("ProductItemAdded", "ShoppingCartConfirmed"),
                    (document, message) -> message.type().equals("ShoppingCartConfirmed") ? null : JsonNodeFactory.instance.objectNode().put("open", true));
            InMemoryEventStore eventStore = new InMemoryEventStore(List.of(openCart), List.of());
            eventStore.appendToStream("cart:1", List.of(productItemAdded("a", 2)));

            // When
            eventStore.appendToStream("cart:1", List.of(Message.event("ShoppingCartConfirmed")));

            // Then
            assertThat(eventStore.findInlineProjection("open_cart", "cart:1")).isEmpty();
        }

        @Test
        void failing_projection_rolls_back_the_append() {
            // Given
            InlineProjection<JsonNode> failing = InlineProjection.of("failing", Set.of("ProductItemAdded"), (document, message) -> {
                throw new IllegalStateException("expected");
            });
            InMemoryEventStore eventStore = new InMemoryEventStore(List.of(failing), List.of());

            // When
            Throwable throwable = catchThrowable(() -> eventStore.appendToStream("cart:1", List.of(productItemAdded("a", 2))));

            // Then
            assertAll(
                    () -> assertThat(throwable).isExactlyInstanceOf(IllegalStateException.class),
                    () -> assertThat(eventStore.exists("cart:1")).isFalse()
            );
        }
    }

    @Test
    void after_commit_hooks_receive_recorded_messages_and_their_failures_do_not_fail_the_append() {
        // Given
        CopyOnWriteArrayList<RecordedMessage> received = new CopyOnWriteArrayList<>();
        AfterCommitHook failing = (streamName, messages) -> {
            throw new IllegalStateException("expected");
        };
        InMemoryEventStore eventStore = new InMemoryEventStore(List.of(), List.of(failing, (streamName, messages) -> received.addAll(messages)));

        // When
        AppendResult result = eventStore.appendToStream("cart:1", List.of(productItemAdded("a", 2)));

        // Then
        assertAll(
                () -> assertThat(result.nextExpectedStreamVersion()).isEqualTo(1),
                () -> assertThat(received).extracting(RecordedMessage::streamPosition).containsExactly(1L)
        );
    }

    @Test
    void after_commit_hooks_receive_concurrent_appends_in_global_position_order() throws Exception {
        // Given
        CountDownLatch slowHookEntered = new CountDownLatch(1);
        CopyOnWriteArrayList<PositionToken> received = new CopyOnWriteArrayList<>();
        AfterCommitHook slowForCartA = (streamName, messages) -> {
            if (streamName.equals("cart:a")) {
                slowHookEntered.countDown();
                sleep(300);
            }
        };
        AfterCommitHook recording = (streamName, messages) -> messages.forEach(m -> received.add(m.globalPosition()));
        InMemoryEventStore eventStore = new InMemoryEventStore(List.of(), List.of(slowForCartA, recording));
        ExecutorService executor = Executors.newSingleThreadExecutor();

        // When
        try {
            Future<AppendResult> cartA = executor.submit(() -> eventStore.appendToStream("cart:a", List.of(productItemAdded("a", 1))));
            assertThat(slowHookEntered.await(5, TimeUnit.SECONDS)).isTrue();
            eventStore.appendToStream("cart:b", List.of(productItemAdded("b", 1)));
            cartA.get(5, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }

        // Then
        assertThat(received).containsExactly(GlobalPosition.of(1), GlobalPosition.of(2));
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static Message productItemAdded(String productId, int quantity) {
        ObjectNode data = JsonNodeFactory.instance.objectNode().put("productId", productId).put("quantity", quantity);
        return Message.event("ProductItemAdded", data);
    }
}
