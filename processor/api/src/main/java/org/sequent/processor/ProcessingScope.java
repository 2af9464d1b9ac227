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

import java.util.function.Supplier;

/**
 * The unit of work in which a message is handled and its checkpoint is stored. A relational backend runs both in one
 * transaction while a document backend has no shared scope.
 */
public interface ProcessingScope {

    <T> T execute(Supplier<T> work);

    static ProcessingScope none() {
        return new ProcessingScope() {
            @Override
            public <T> T execute(Supplier<T> work) {
                return work.get();
            }

            @Override
            public String toString() {
                return "ProcessingScope[none]";
            }
        };
    }
}
