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

package org.sequent.retry.internal;

import org.jspecify.annotations.Nullable;
import org.sequent.retry.ErrorInfo;

import java.time.Duration;
import java.util.Optional;
import java.util.StringJoiner;

record ErrorInfoImpl(int attemptNumber, @Nullable Duration backoffBeforeNextRetryAttempt, boolean retryable) implements ErrorInfo {

    @Override
    public int getAttemptNumber() {
        return attemptNumber;
    }

    @Override
    public Optional<Duration> getBackoffBeforeNextRetryAttempt() {
        return Optional.ofNullable(backoffBeforeNextRetryAttempt);
    }

    @Override
    public boolean isRetryable() {
        return retryable;
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", ErrorInfoImpl.class.getSimpleName() + "[", "]")
                .add("attemptNumber=" + attemptNumber)
                .add("backoffBeforeNextRetryAttempt=" + backoffBeforeNextRetryAttempt)
                .add("retryable=" + retryable)
                .toString();
    }
}
