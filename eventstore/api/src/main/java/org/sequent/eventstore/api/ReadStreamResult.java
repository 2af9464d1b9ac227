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

import java.util.List;

/**
 * The result of reading a stream. A stream that doesn't exist is returned as an empty result with
 * {@code streamExists = false} and {@code currentStreamVersion = 0}.
 */
public record ReadStreamResult(List<RecordedMessage> messages, long currentStreamVersion, boolean streamExists) {

    public ReadStreamResult {
        messages = List.copyOf(messages);
    }

    public static ReadStreamResult streamNotFound() {
        return new ReadStreamResult(List.of(), 0, false);
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }
}
