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

package org.sequent.eventstore.api;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiFunction;

/**
 * A projection that is updated synchronously, in the same atomic unit as the append that triggered it.
 * The document type {@code D} depends on the backend.
 *
 * @param <D> The type of the projected document
 */
public interface InlineProjection<D> {

    String name();

    /**
     * @return The message types this projection is interested in. The projection is only invoked if the appended
     * messages contain at least one of these types.
     */
    Set<String> canHandle();

    /**
     * @param document The current projected document or {@code null} if there is none
     * @param messages All messages of the append
     * @return The new document, or {@code null} to delete it
     */
    @Nullable D project(@Nullable D document, List<RecordedMessage> messages);

    default boolean canHandleAny(List<RecordedMessage> messages) {
        Set<String> types = canHandle();
        return messages.stream().map(RecordedMessage::type).anyMatch(types::contains);
    }

    /**
     * Create an inline projection that folds {@code evolve} over every appended message it can handle.
     */
    static <D> InlineProjection<D> of(String name, Set<String> canHandle, BiFunction<@Nullable D, RecordedMessage, @Nullable D> evolve) {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(evolve, "evolve cannot be null");
        Set<String> types = Set.copyOf(canHandle);
        return new InlineProjection<>() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Set<String> canHandle() {
                return types;
            }

            @Override
            public @Nullable D project(@Nullable D document, List<RecordedMessage> messages) {
                D state = document;
                for (RecordedMessage message : messages) {
                    if (types.contains(message.type())) {
                        state = evolve.apply(state, message);
                    }
                }
                return state;
            }

            @Override
            public String toString() {
                return "InlineProjection[" + name + "]";
            }
        };
    }
}
