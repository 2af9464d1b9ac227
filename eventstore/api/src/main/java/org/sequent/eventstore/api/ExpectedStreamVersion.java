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

package org.sequent.eventstore.api;

/**
 * The version a stream is expected to have when appending to, or reading from, it. If the expectation is not
 * fulfilled by the current state of the stream an {@link ExpectedVersionConflictException} is thrown and nothing is written.
 */
public sealed interface ExpectedStreamVersion {

    /**
     * @return An expectation that is always fulfilled, i.e. no optimistic concurrency check is made.
     */
    static ExpectedStreamVersion any() {
        return Any.INSTANCE;
    }

    static ExpectedStreamVersion streamDoesNotExist() {
        return StreamDoesNotExist.INSTANCE;
    }

    static ExpectedStreamVersion streamExists() {
        return StreamExists.INSTANCE;
    }

    static ExpectedStreamVersion exactly(long version) {
        return new Exactly(version);
    }

    /**
     * @param streamExists          Whether the stream currently exists
     * @param currentStreamPosition The current stream position, {@code 0} if the stream doesn't exist
     * @return {@code true} if this expectation is fulfilled by the given state
     */
    boolean isFulfilledBy(boolean streamExists, long currentStreamPosition);

    final class Any implements ExpectedStreamVersion {
        private static final Any INSTANCE = new Any();

        private Any() {
        }

        @Override
        public boolean isFulfilledBy(boolean streamExists, long currentStreamPosition) {
            return true;
        }

        @Override
        public String toString() {
            return "any";
        }
    }

    final class StreamDoesNotExist implements ExpectedStreamVersion {
        private static final StreamDoesNotExist INSTANCE = new StreamDoesNotExist();

        private StreamDoesNotExist() {
        }

        @Override
        public boolean isFulfilledBy(boolean streamExists, long currentStreamPosition) {
            return !streamExists;
        }

        @Override
        public String toString() {
            return "stream does not exist";
        }
    }

    final class StreamExists implements ExpectedStreamVersion {
        private static final StreamExists INSTANCE = new StreamExists();

        private StreamExists() {
        }

        @Override
        public boolean isFulfilledBy(boolean streamExists, long currentStreamPosition) {
            return streamExists;
        }

        @Override
        public String toString() {
            return "stream exists";
        }
    }

    record Exactly(long version) implements ExpectedStreamVersion {
        public Exactly {
            if (version < 0) {
                throw new IllegalArgumentException("Expected version cannot be negative");
            }
        }

        @Override
        public boolean isFulfilledBy(boolean streamExists, long currentStreamPosition) {
            return version == currentStreamPosition;
        }

        @Override
        public String toString() {
            return String.valueOf(version);
        }
    }
}
