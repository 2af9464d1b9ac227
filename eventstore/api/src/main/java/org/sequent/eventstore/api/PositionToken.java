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

/**
 * A comparable, serializable marker of how far something has read in the global message order of a store.
 * <p>
 * Implementations are only comparable with tokens of the same kind, comparing tokens from different backends
 * throws {@link IllegalStateException}. A {@code null} token is earlier than any concrete token.
 * Each implementation provides a static {@code parse(String)} that is the inverse of {@link #asString()}.
 */
public interface PositionToken extends Comparable<PositionToken> {

    /**
     * @return The string form of this token, as it's stored by a checkpoint store.
     */
    String asString();

    static int compare(@Nullable PositionToken token1, @Nullable PositionToken token2) {
        if (token1 == null && token2 == null) {
            return 0;
        } else if (token1 == null) {
            return -1;
        } else if (token2 == null) {
            return 1;
        }
        return Integer.signum(token1.compareTo(token2));
    }

    static boolean isAtOrBefore(PositionToken token, @Nullable PositionToken reference) {
        return reference != null && compare(token, reference) <= 0;
    }
}
