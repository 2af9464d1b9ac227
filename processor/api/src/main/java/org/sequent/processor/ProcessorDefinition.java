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

package org.sequent.processor;

import org.sequent.eventstore.api.RecordedMessage;

import java.util.Set;
import java.util.function.Predicate;

import static java.util.Objects.requireNonNull;

/**
 * Defines a processor, which is either a {@link Reactor} that performs arbitrary side effects or a {@link Projector}
 * that updates a {@link Projection}. Definitions are immutable, use the {@code withX} methods to derive new ones.
 */
public sealed interface ProcessorDefinition {
    String DEFAULT_PARTITION = "emt:default";
    int DEFAULT_VERSION = 1;

    String processorId();

    int version();

    String partition();

    StartFrom startFrom();

    Predicate<RecordedMessage> stopAfter();

    /**
     * @return The name used for locking, the projection name for projectors and the processor id for reactors
     */
    String lockName();

    /**
     * @return {@code true} if the message should be passed to the handler of this processor
     */
    boolean canHandle(RecordedMessage message);

    default ProcessorKey key() {
        return new ProcessorKey(processorId(), partition(), version());
    }

    /**
     * Create a reactor that handles all messages
     */
    static Reactor reactor(String processorId, MessageHandler eachMessage) {
        return reactor(processorId, Set.of(), eachMessage);
    }

    /**
     * Create a reactor
     *
     * @param processorId The id of the processor, used as key for checkpoints and locks
     * @param canHandle   The message types passed to {@code eachMessage}, an empty set means all types
     * @param eachMessage The handler
     */
    static Reactor reactor(String processorId, Set<String> canHandle, MessageHandler eachMessage) {
        return new Reactor(processorId, DEFAULT_VERSION, DEFAULT_PARTITION, canHandle, StartFrom.current(), __ -> false, eachMessage);
    }

    /**
     * Create a projector with processor id {@code projection:<projection name>}
     */
    static Projector projector(Projection projection) {
        requireNonNull(projection, Projection.class.getSimpleName() + " cannot be null");
        return new Projector(Projector.PROCESSOR_ID_PREFIX + projection.name(), DEFAULT_VERSION, DEFAULT_PARTITION, StartFrom.current(), __ -> false, projection, false);
    }

    record Reactor(String processorId, int version, String partition, Set<String> canHandleTypes, StartFrom startFrom,
                   Predicate<RecordedMessage> stopAfter, MessageHandler eachMessage) implements ProcessorDefinition {

        public Reactor {
            requireNonNull(processorId, "processorId cannot be null");
            requireNonNull(partition, "partition cannot be null");
            requireNonNull(startFrom, StartFrom.class.getSimpleName() + " cannot be null");
            requireNonNull(stopAfter, "stopAfter cannot be null");
            requireNonNull(eachMessage, MessageHandler.class.getSimpleName() + " cannot be null");
            canHandleTypes = Set.copyOf(canHandleTypes);
        }

        @Override
        public String lockName() {
            return processorId;
        }

        @Override
        public boolean canHandle(RecordedMessage message) {
            return canHandleTypes.isEmpty() || canHandleTypes.contains(message.type());
        }

        public Reactor withVersion(int version) {
            return new Reactor(processorId, version, partition, canHandleTypes, startFrom, stopAfter, eachMessage);
        }

        public Reactor withPartition(String partition) {
            return new Reactor(processorId, version, partition, canHandleTypes, startFrom, stopAfter, eachMessage);
        }

        public Reactor withStartFrom(StartFrom startFrom) {
            return new Reactor(processorId, version, partition, canHandleTypes, startFrom, stopAfter, eachMessage);
        }

        public Reactor withStopAfter(Predicate<RecordedMessage> stopAfter) {
            return new Reactor(processorId, version, partition, canHandleTypes, startFrom, stopAfter, eachMessage);
        }
    }

    /**
     * @param truncateOnStart Truncate the projection, and forget the checkpoint, each time the processor starts so that the
     *                        projection is rebuilt from the beginning
     */
    record Projector(String processorId, int version, String partition, StartFrom startFrom,
                     Predicate<RecordedMessage> stopAfter, Projection projection, boolean truncateOnStart) implements ProcessorDefinition {
        public static final String PROCESSOR_ID_PREFIX = "projection:";

        public Projector {
            requireNonNull(processorId, "processorId cannot be null");
            requireNonNull(partition, "partition cannot be null");
            requireNonNull(startFrom, StartFrom.class.getSimpleName() + " cannot be null");
            requireNonNull(stopAfter, "stopAfter cannot be null");
            requireNonNull(projection, Projection.class.getSimpleName() + " cannot be null");
        }

        @Override
        public String lockName() {
            return projection.name();
        }

        @Override
        public boolean canHandle(RecordedMessage message) {
            return projection.canHandle().contains(message.type());
        }

        public Projector withProcessorId(String processorId) {
            return new Projector(processorId, version, partition, startFrom, stopAfter, projection, truncateOnStart);
        }

        public Projector withVersion(int version) {
            return new Projector(processorId, version, partition, startFrom, stopAfter, projection, truncateOnStart);
        }

        public Projector withPartition(String partition) {
            return new Projector(processorId, version, partition, startFrom, stopAfter, projection, truncateOnStart);
        }

        public Projector withStartFrom(StartFrom startFrom) {
            return new Projector(processorId, version, partition, startFrom, stopAfter, projection, truncateOnStart);
        }

        public Projector withStopAfter(Predicate<RecordedMessage> stopAfter) {
            return new Projector(processorId, version, partition, startFrom, stopAfter, projection, truncateOnStart);
        }

        public Projector withTruncateOnStart(boolean truncateOnStart) {
            return new Projector(processorId, version, partition, startFrom, stopAfter, projection, truncateOnStart);
        }
    }
}
