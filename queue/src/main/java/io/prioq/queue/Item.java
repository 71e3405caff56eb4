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

import javax.annotation.concurrent.Immutable;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * A value stored in a {@link BinaryHeap}, along with its precomputed priority. The priority is either the value itself
 * or the result of applying the {@link QueueOrder}'s key function to it. Items are ordered by priority only, and only
 * through the {@link QueueOrder} that created them.
 *
 * @param <V> Type of the value.
 */
@Immutable
@Getter(AccessLevel.PACKAGE)
@RequiredArgsConstructor(access = AccessLevel.PACKAGE)
final class Item<V> {
    private final Object priority;
    private final V value;

    @Override
    public String toString() {
        return this.priority == this.value ? String.valueOf(this.value) : String.format("%s (%s)", this.value, this.priority);
    }
}
