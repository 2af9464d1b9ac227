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

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertAll;
import static org.sequent.eventstore.api.GlobalPosition.of;
import static org.sequent.processor.StoreCheckpointResult.Reason.*;
import static org.sequent.processor.StoreCheckpointResult.classify;

@DisplayNameGeneration(ReplaceUnderscores.class)
class StoreCheckpointResultTest {

    @Test
    void first_checkpoint_is_written_when_nothing_is_stored() {
        assertThat(classify(null, null, of(1), true)).isNull();
    }

    @Test
    void checkpoint_after_the_stored_one_is_written_when_the_callers_view_matches() {
        assertThat(classify(of(5), of(5), of(6), true)).isNull();
    }

    @Test
    void checkpoint_at_or_before_the_stored_one_is_ignored_when_the_callers_view_matches() {
        assertAll(
                () -> assertThat(classify(of(5), of(5), of(5), true)).isEqualTo(new StoreCheckpointResult.Failure(IGNORED)),
                () -> assertThat(classify(of(5), of(5), of(3), false)).isEqualTo(new StoreCheckpointResult.Failure(IGNORED))
        );
    }

    @Test
    void stale_view_of_stored_checkpoint_is_a_mismatch() {
        assertAll(
                () -> assertThat(classify(of(5), of(4), of(6), true)).isEqualTo(new StoreCheckpointResult.Failure(MISMATCH)),
                () -> assertThat(classify(null, of(4), of(6), true)).isEqualTo(new StoreCheckpointResult.Failure(MISMATCH)),
                () -> assertThat(classify(of(5), null, of(6), true)).isEqualTo(new StoreCheckpointResult.Failure(MISMATCH))
        );
    }

    @Test
    void stored_checkpoint_after_the_new_one_is_reported_as_current_ahead_only_when_distinguished() {
        assertAll(
                () -> assertThat(classify(of(10), of(4), of(6), true)).isEqualTo(new StoreCheckpointResult.Failure(CURRENT_AHEAD)),
                () -> assertThat(classify(of(10), of(4), of(6), false)).isEqualTo(new StoreCheckpointResult.Failure(MISMATCH))
        );
    }
}
