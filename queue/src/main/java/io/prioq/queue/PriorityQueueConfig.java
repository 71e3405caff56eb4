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

import io.prioq.common.util.ConfigBuilder;
import io.prioq.common.util.ConfigurationException;
import io.prioq.common.util.Property;
import io.prioq.common.util.TypedProperties;
import lombok.Getter;

/**
 * Configuration for {@link PriorityQueue} instances.
 */
public class PriorityQueueConfig {
    //region Config Names

    public static final Property<Integer> INITIAL_CAPACITY = Property.named("initialCapacity", 16);
    public static final Property<Boolean> REUSE_SORTED_SNAPSHOTS = Property.named("reuseSortedSnapshots", true);
    public static final String COMPONENT_CODE = "priorityqueue";

    /**
     * The configuration used when none is given explicitly.
     */
    public static final PriorityQueueConfig DEFAULT = builder().build();

    //endregion

    //region Members

    /**
     * The number of values an empty queue can hold before its backing array needs to grow.
     */
    @Getter
    private final int initialCapacity;

    /**
     * Whether set operations between two queues that share the same key function may reuse the right operand's cached
     * sorted snapshot (reversing it if needed) instead of applying the key function to its values and sorting them
     * again.
     */
    @Getter
    private final boolean reuseSortedSnapshots;

    //endregion

    //region Constructor

    private PriorityQueueConfig(TypedProperties properties) throws ConfigurationException {
        this.initialCapacity = properties.getNonNegativeInt(INITIAL_CAPACITY);
        this.reuseSortedSnapshots = properties.getBoolean(REUSE_SORTED_SNAPSHOTS);
    }

    /**
     * Creates a new ConfigBuilder that can be used to create instances of this class.
     *
     * @return A new Builder for this class.
     */
    public static ConfigBuilder<PriorityQueueConfig> builder() {
        return new ConfigBuilder<>(COMPONENT_CODE, PriorityQueueConfig::new);
    }

    //endregion

    @Override
    public String toString() {
        return String.format("InitialCapacity = %d, ReuseSortedSnapshots = %s", this.initialCapacity, this.reuseSortedSnapshots);
    }
}
