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

import org.jspecify.annotations.Nullable;

/**
 * The outcome of handling a single message.
 */
public sealed interface MessageHandlerResult {

    /**
     * The message was handled, continue with the next one.
     */
    static MessageHandlerResult ack() {
        return Ack.INSTANCE;
    }

    /**
     * The message was deliberately not handled. It still counts as processed and the checkpoint moves past it.
     */
    static MessageHandlerResult skip() {
        return new Skip(null);
    }

    static MessageHandlerResult skip(String reason) {
        return new Skip(reason);
    }

    /**
     * Stop the processor after this message. The checkpoint moves past it.
     */
    static MessageHandlerResult stop() {
        return new Stop(null, null);
    }

    static MessageHandlerResult stop(String reason) {
        return new Stop(reason, null);
    }

    static MessageHandlerResult stop(String reason, Throwable error) {
        return new Stop(reason, error);
    }

    final class Ack implements MessageHandlerResult {
        private static final Ack INSTANCE = new Ack();

        private Ack() {
        }

        @Override
        public String toString() {
            return "ACK";
        }
    }

    record Skip(@Nullable String reason) implements MessageHandlerResult {
    }

    record Stop(@Nullable String reason, @Nullable Throwable error) implements MessageHandlerResult {
    }
}
