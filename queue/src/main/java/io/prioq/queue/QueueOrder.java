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

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import javax.annotation.concurrent.Immutable;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Defines how values are prioritized in a {@link PriorityQueue}: by their natural ordering or by a key function, in
 * ascending or descending (reverse) order. The variant is chosen once, when the {@link QueueOrder} is created.
 * <p>
 * The value with the lowest priority according to this order is at the head of the queue. In reverse mode this is the
 * value with the greatest natural (or key) ordering.
 * <p>
 * Keys (or values, for natural orders) that cannot be compared with each other at runtime cause the comparison to
 * throw {@link ClassCastException}; that exception is never caught internally.
 *
 * @param <V> Type of the values being ordered.
 */
@Immutable
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class QueueOrder<V> {
    //region Members

    @SuppressWarnings("unchecked")
    private static final Comparator<Object> ASCENDING = (p1, p2) -> ((Comparable<Object>) p1).compareTo(p2);
    private static final Comparator<Object> DESCENDING = (p1, p2) -> ASCENDING.compare(p2, p1);

    /**
     * The variant of this order.
     */
    @Getter
    private final Kind kind;
    private final Function<? super V, ?> key;
    private final Comparator<Object> priorityComparator;

    //endregion

    //region Factories

    /**
     * Creates a {@link QueueOrder} that prioritizes values by their natural ordering, smallest first.
     *
     * @param <V> Type of the values.
     * @return A new {@link QueueOrder}.
     */
    public static <V extends Comparable<? super V>> QueueOrder<V> natural() {
        return natural(false);
    }

    /**
     * Creates a {@link QueueOrder} that prioritizes values by their natural ordering, largest first.
     *
     * @param <V> Type of the values.
     * @return A new {@link QueueOrder}.
     */
    public static <V extends Comparable<? super V>> QueueOrder<V> reversed() {
        return natural(true);
    }

    /**
     * Creates a {@link QueueOrder} that prioritizes values by their natural ordering.
     *
     * @param reverse If true, the largest value has the highest priority.
     * @param <V>     Type of the values.
     * @return A new {@link QueueOrder}.
     */
    public static <V extends Comparable<? super V>> QueueOrder<V> natural(boolean reverse) {
        return reverse
                ? new QueueOrder<>(Kind.REVERSED, null, DESCENDING)
                : new QueueOrder<>(Kind.NATURAL, null, ASCENDING);
    }

    /**
     * Creates a {@link QueueOrder} that prioritizes values by the natural ordering of the keys extracted from them,
     * smallest key first.
     *
     * @param key A function that computes the priority key of a value. Must not return null.
     * @param <V> Type of the values.
     * @param <K> Type of the keys.
     * @return A new {@link QueueOrder}.
     */
    public static <V, K extends Comparable<? super K>> QueueOrder<V> by(Function<? super V, ? extends K> key) {
        return by(key, false);
    }

    /**
     * Creates a {@link QueueOrder} that prioritizes values by the natural ordering of the keys extracted from them.
     *
     * @param key     A function that computes the priority key of a value. Must not return null.
     * @param reverse If true, the value with the largest key has the highest priority.
     * @param <V>     Type of the values.
     * @param <K>     Type of the keys.
     * @return A new {@link QueueOrder}.
     */
    public static <V, K extends Comparable<? super K>> QueueOrder<V> by(@NonNull Function<? super V, ? extends K> key,
                                                                       boolean reverse) {
        return reverse
                ? new QueueOrder<>(Kind.KEYED_REVERSED, key, DESCENDING)
                : new QueueOrder<>(Kind.KEYED, key, ASCENDING);
    }

    /**
     * Creates a {@link QueueOrder} with the same key as this one, but with the opposite direction.
     *
     * @return A new {@link QueueOrder}.
     */
    public QueueOrder<V> reverse() {
        return new QueueOrder<>(this.kind.opposite(), this.key, isReverse() ? ASCENDING : DESCENDING);
    }

    //endregion

    //region Properties

    /**
     * Gets the key function of this order.
     *
     * @return The key function, or null if values are ordered by their natural ordering.
     */
    public Function<? super V, ?> getKey() {
        return this.key;
    }

    /**
     * Gets a value indicating whether this order is descending.
     *
     * @return True if the greatest value (or key) has the highest priority.
     */
    public boolean isReverse() {
        return this.kind.isReverse();
    }

    /**
     * Determines whether this order derives priorities the same way as the given one. This is the case if both use the
     * natural ordering of values, or if both use the very same key function instance. Direction is not considered.
     *
     * @param other The other order.
     * @return True if priorities computed by one are interchangeable with priorities computed by the other.
     */
    public boolean hasSameKey(@NonNull QueueOrder<?> other) {
        return this.key == other.key;
    }

    //endregion

    //region Item Operations

    /**
     * Wraps the given value into an {@link Item} carrying its priority.
     *
     * @param value The value to wrap.
     * @return A new {@link Item}.
     * @throws NullPointerException If value is null, or if the key function returned null for it.
     */
    Item<V> wrap(@NonNull V value) {
        return new Item<>(priorityOf(value), value);
    }

    /**
     * Wraps the given values and sorts them by this order.
     *
     * @param values The values to wrap.
     * @return A new mutable list of {@link Item}s, sorted by this order.
     */
    List<Item<V>> sortedItems(Collection<? extends V> values) {
        List<Item<V>> result = new ArrayList<>(values.size());
        for (V value : values) {
            result.add(wrap(value));
        }

        result.sort(this::compare);
        return result;
    }

    /**
     * Compares two {@link Item}s by priority, according to this order.
     *
     * @param i1 The first item.
     * @param i2 The second item.
     * @return A negative number, zero or a positive number if i1 has higher, same or lower priority than i2
     * (i.e., if it should come before, tie with or come after i2).
     * @throws ClassCastException If the priorities cannot be compared to each other.
     */
    int compare(Item<V> i1, Item<V> i2) {
        return this.priorityComparator.compare(i1.getPriority(), i2.getPriority());
    }

    /**
     * Determines whether two {@link Item}s represent the same element: their priorities tie and their values are equal.
     *
     * @param i1 The first item.
     * @param i2 The second item.
     * @return True if the items match.
     */
    boolean matches(Item<V> i1, Item<V> i2) {
        return compare(i1, i2) == 0 && Objects.equals(i1.getValue(), i2.getValue());
    }

    private Object priorityOf(V value) {
        if (this.key == null) {
            return value;
        }

        return Preconditions.checkNotNull(this.key.apply(value), "Key function returned null for value '%s'.", value);
    }

    //endregion

    @Override
    public String toString() {
        return String.format("%s(key=%s, reverse=%s)", this.kind, this.key, isReverse());
    }

    //region Kind

    /**
     * The four ways a {@link QueueOrder} can derive and compare priorities.
     */
    @RequiredArgsConstructor
    public enum Kind {
        /**
         * Values, ascending.
         */
        NATURAL(false, false),
        /**
         * Values, descending.
         */
        REVERSED(false, true),
        /**
         * Keys of values, ascending.
         */
        KEYED(true, false),
        /**
         * Keys of values, descending.
         */
        KEYED_REVERSED(true, true);

        @Getter
        private final boolean keyed;
        @Getter
        private final boolean reverse;

        Kind opposite() {
            switch (this) {
                case NATURAL:
                    return REVERSED;
                case REVERSED:
                    return NATURAL;
                case KEYED:
                    return KEYED_REVERSED;
                default:
                    return KEYED;
            }
        }
    }

    //endregion
}
