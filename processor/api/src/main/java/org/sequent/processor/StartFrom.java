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

import org.sequent.eventstore.api.PositionToken;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Where a processor starts reading the message feed.
 */
public sealed interface StartFrom {

    /**
     * Start from the first message available in the feed.
     */
    static StartFrom beginning() {
        return Beginning.INSTANCE;
    }

    /**
     * Start from messages written after the processor was started.
     */
    static StartFrom end() {
        return End.INSTANCE;
    }

    /**
     * Resume from the stored checkpoint of the processor, or from the beginning if no checkpoint has been stored. This is the default.
     */
    static StartFrom current() {
        return Current.INSTANCE;
    }

    /**
     * Start after the given checkpoint.
     */
    static StartFrom checkpoint(PositionToken checkpoint) {
        return new Checkpoint(checkpoint);
    }

    /**
     * Find the earliest position among the supplied, already resolved, start positions so that no processor misses a message
     * when they share the same feed.
     * {@link #beginning()} wins over everything, {@link #end()} is only returned if all positions are {@code end}, otherwise the
     * earliest {@link Checkpoint} is returned.
     *
     * @param startPositions Resolved start positions, i.e. not {@link #current()}
     * @return The earliest start position, {@link #beginning()} if {@code startPositions} is empty
     */
    static StartFrom earliest(List<StartFrom> startPositions) {
        requireNonNull(startPositions, "startPositions cannot be null");
        if (startPositions.isEmpty()) {
            return beginning();
        }
        Checkpoint earliest = null;
        boolean allEnd = true;
        for (StartFrom startFrom : startPositions) {
            if (startFrom instanceof Current) {
                throw new IllegalArgumentException(Current.class.getSimpleName() + " must be resolved before the earliest start position can be found");
            } else if (startFrom instanceof Beginning) {
                return beginning();
            } else if (startFrom instanceof Checkpoint checkpoint) {
                allEnd = false;
                if (earliest == null || PositionToken.compare(checkpoint.token(), earliest.token()) < 0) {
                    earliest = checkpoint;
                }
            }
        }
        return allEnd || earliest == null ? end() : earliest;
    }

    final class Beginning implements StartFrom {
        private static final Beginning INSTANCE = new Beginning();

        private Beginning() {
        }

        @Override
        public String toString() {
            return "BEGINNING";
        }
    }

    final class End implements StartFrom {
        private static final End INSTANCE = new End();

        private End() {
        }

        @Override
        public String toString() {
            return "END";
        }
    }

    final class Current implements StartFrom {
        private static final Current INSTANCE = new Current();

        private Current() {
        }

        @Override
        public String toString() {
            return "CURRENT";
        }
    }

    record Checkpoint(PositionToken token) implements StartFrom {
        public Checkpoint {
            requireNonNull(token, PositionToken.class.getSimpleName() + " cannot be null");
        }
    }
}
