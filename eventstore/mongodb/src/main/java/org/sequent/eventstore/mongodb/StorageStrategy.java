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

package org.sequent.eventstore.mongodb;

import java.util.Objects;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * Decides in which collection a stream document is stored. Only collections whose name start with
 * {@value #COLLECTION_PREFIX} are observed by the change stream based message feed.
 */
public sealed interface StorageStrategy {
    String COLLECTION_PREFIX = "emt:";
    String DEFAULT_SINGLE_COLLECTION_NAME = "emt:streams";

    /**
     * @param streamType The type of the stream, see {@link org.sequent.eventstore.api.StreamName#streamType(String)}
     * @return The name of the collection that stores streams of this type
     */
    String collectionName(String streamType);

    /**
     * Store each stream type in its own collection named {@code emt:<streamType>}. This is the default.
     */
    static StorageStrategy collectionPerStreamType() {
        return CollectionPerStreamType.INSTANCE;
    }

    static StorageStrategy singleCollection() {
        return new SingleCollection(DEFAULT_SINGLE_COLLECTION_NAME);
    }

    static StorageStrategy singleCollection(String collectionName) {
        return new SingleCollection(collectionName);
    }

    static StorageStrategy custom(Function<String, String> collectionNameForStreamType) {
        return new Custom(collectionNameForStreamType);
    }

    final class CollectionPerStreamType implements StorageStrategy {
        private static final CollectionPerStreamType INSTANCE = new CollectionPerStreamType();

        private CollectionPerStreamType() {
        }

        @Override
        public String collectionName(String streamType) {
            return COLLECTION_PREFIX + streamType;
        }

        @Override
        public String toString() {
            return "COLLECTION_PER_STREAM_TYPE";
        }
    }

    record SingleCollection(String collectionName) implements StorageStrategy {
        public SingleCollection {
            requireNonNull(collectionName, "collectionName cannot be null");
        }

        @Override
        public String collectionName(String streamType) {
            return collectionName;
        }
    }

    record Custom(Function<String, String> collectionNameForStreamType) implements StorageStrategy {
        public Custom {
            requireNonNull(collectionNameForStreamType, "collectionNameForStreamType cannot be null");
        }

        @Override
        public String collectionName(String streamType) {
            return Objects.requireNonNull(collectionNameForStreamType.apply(streamType), "Collection name for stream type " + streamType + " cannot be null");
        }
    }
}
