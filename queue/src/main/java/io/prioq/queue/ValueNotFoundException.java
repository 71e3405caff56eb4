/**
 * Copyright Pravega Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.prioq.queue;

import java.util.NoSuchElementException;

/**
 * Exception that is thrown when attempting to remove a value that is not in a {@link PriorityQueue}.
 */
public class ValueNotFoundException extends NoSuchElementException {
    private static final long serialVersionUID = 1L;

    /**
     * Creates a new instance of the ValueNotFoundException class.
     *
     * @param value The value that could not be found.
     */
    public ValueNotFoundException(Object value) {
        super(String.format("'%s' is not in priority queue.", value));
    }
}
