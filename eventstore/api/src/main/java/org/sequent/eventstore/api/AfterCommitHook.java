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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Invoked after messages have been durably appended. A failing hook never fails the append.
 */
@FunctionalInterface
public interface AfterCommitHook {

    void afterCommit(String streamName, List<RecordedMessage> messages);

    /**
     * Invoke all {@code hooks} in order. Exceptions are logged and swallowed since the append has already been committed.
     */
    static void invokeAll(List<AfterCommitHook> hooks, String streamName, List<RecordedMessage> messages) {
        for (AfterCommitHook hook : hooks) {
            try {
                hook.afterCommit(streamName, messages);
            } catch (Exception e) {
                Logger log = LoggerFactory.getLogger(AfterCommitHook.class);
                log.error("After commit hook {} failed for stream '{}', the append itself succeeded.", hook, streamName, e);
            }
        }
    }
}
