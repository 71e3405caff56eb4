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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import io.prioq.common.LoggerHelpers;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import javax.annotation.concurrent.NotThreadSafe;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * A mutable priority queue backed by a binary heap. The value with the highest priority, as defined by the queue's
 * {@link QueueOrder}, can be inspected in O(1) time; values are added in O(log n) time.
 * <p>
 * The queue also behaves as a multiset of values, supporting subset and superset tests, intersection, union,
 * difference and symmetric difference. Two values are the same element if they are equal according to
 * {@link Object#equals}; multiplicity is always taken into account. Binary operations return a new queue that uses the
 * order and configuration of the left operand ({@code this}); they are computed by sorting both operands by that order
 * and merging them in linear time.
 * <p>
 * Null values are not permitted.
 *
 * @param <V> Type of the values.
 */
@Slf4j
@NotThreadSafe
public class PriorityQueue<V> implements Iterable<V> {
    //region Members

    private final String traceObjectId;
    /**
     * The order in which values are prioritized.
     */
    @Getter
    private final QueueOrder<V> order;
    /**
     * The configuration this queue (and any queue derived from it via set operations) was created with.
     */
    @Getter
    private final PriorityQueueConfig config;
    private final BinaryHeap<V> heap;

    //endregion

    //region Constructor

    /**
     * Creates a new, empty instance of the {@link PriorityQueue} class.
     *
     * @param order The order in which values are prioritized.
     */
    public PriorityQueue(QueueOrder<V> order) {
        this(order, PriorityQueueConfig.DEFAULT, Collections.emptyList());
    }

    /**
     * Creates a new instance of the {@link PriorityQueue} class with the default configuration.
     *
     * @param order  The order in which values are prioritized.
     * @param values The initial values. These are arranged in heap order in O(n) time.
     */
    public PriorityQueue(QueueOrder<V> order, Collection<? extends V> values) {
        this(order, PriorityQueueConfig.DEFAULT, values);
    }

    /**
     * Creates a new instance of the {@link PriorityQueue} class.
     *
     * @param order  The order in which values are prioritized.
     * @param config The configuration to use.
     * @param values The initial values. These are arranged in heap order in O(n) time.
     * @throws NullPointerException If any of the arguments or any of the values is null.
     * @throws ClassCastException   If any two values (or their keys) cannot be compared to each other.
     */
    public PriorityQueue(@NonNull QueueOrder<V> order, @NonNull PriorityQueueConfig config, @NonNull Collection<? extends V> values) {
        this.traceObjectId = String.format("PriorityQueue[%x]", System.identityHashCode(this));
        this.order = order;
        this.config = config;
        this.heap = new BinaryHeap<>(order, config.getInitialCapacity());
        this.heap.load(values);
    }

    private PriorityQueue(PriorityQueue<V> source, BinaryHeap<V> heap) {
        this.traceObjectId = String.format("PriorityQueue[%x]", System.identityHashCode(this));
        this.order = source.order;
        this.config = source.config;
        this.heap = heap;
    }

    /**
     * Creates a new {@link PriorityQueue} that prioritizes the smallest value.
     *
     * @param values The initial values.
     * @param <V>    Type of the values.
     * @return A new {@link PriorityQueue}.
     */
    @SafeVarargs
    public static <V extends Comparable<? super V>> PriorityQueue<V> of(V... values) {
        return new PriorityQueue<>(QueueOrder.natural(), Arrays.asList(values));
    }

    /**
     * Creates a new {@link PriorityQueue} that prioritizes the largest value.
     *
     * @param values The initial values.
     * @param <V>    Type of the values.
     * @return A new {@link PriorityQueue}.
     */
    @SafeVarargs
    public static <V extends Comparable<? super V>> PriorityQueue<V> reversed(V... values) {
        return new PriorityQueue<>(QueueOrder.reversed(), Arrays.asList(values));
    }

    /**
     * Creates a new {@link PriorityQueue} that prioritizes values by a key computed from each of them.
     *
     * @param key     A function that computes the priority key of a value. Must not return null.
     * @param reverse If true, the value with the largest key has the highest priority; otherwise the smallest does.
     * @param values  The initial values.
     * @param <V>     Type of the values.
     * @param <K>     Type of the keys.
     * @return A new {@link PriorityQueue}.
     */
    @SafeVarargs
    public static <V, K extends Comparable<? super K>> PriorityQueue<V> withKey(Function<? super V, ? extends K> key,
                                                                               boolean reverse, V... values) {
        return new PriorityQueue<>(QueueOrder.by(key, reverse), Arrays.asList(values));
    }

    //endregion

    //region Properties

    /**
     * Gets the number of values in the queue, in O(1) time.
     *
     * @return The number of values.
     */
    public int size() {
        return this.heap.size();
    }

    /**
     * Gets a value indicating whether the queue is empty.
     *
     * @return True if empty, false otherwise.
     */
    public boolean isEmpty() {
        return this.heap.isEmpty();
    }

    /**
     * Gets the function used to compute the priority key of values.
     *
     * @return The key function, or null if values are prioritized by their natural ordering.
     */
    public Function<? super V, ?> getKey() {
        return this.order.getKey();
    }

    /**
     * Gets a value indicating whether the queue prioritizes the largest value (or key) instead of the smallest.
     *
     * @return True if in reverse mode.
     */
    public boolean isReverse() {
        return this.order.isReverse();
    }

    /**
     * Determines whether the queue contains a value equal to the given one, in O(n) time.
     *
     * @param value The value to look for.
     * @return True if found, false otherwise.
     */
    public boolean contains(Object value) {
        return this.heap.containsValue(value);
    }

    //endregion

    //region Queue Operations

    /**
     * Adds a value to the queue, in O(log n) time.
     *
     * @param value The value to add.
     * @throws NullPointerException If value is null, or if the key function returned null for it.
     * @throws ClassCastException   If the value (or its key) cannot be compared to the ones already in the queue.
     */
    public void add(@NonNull V value) {
        this.heap.push(this.order.wrap(value));
    }

    /**
     * Removes one occurrence of the given value from the queue, in O(n) time.
     *
     * @param value The value to remove.
     * @throws ValueNotFoundException If the queue does not contain the value.
     */
    public void remove(@NonNull V value) {
        this.heap.remove(this.order.wrap(value));
    }

    /**
     * Removes one occurrence of the given value from the queue, if present, in O(n) time.
     *
     * @param value The value to remove.
     * @return True if a value was removed, false if the queue did not contain it.
     */
    public boolean discard(@NonNull V value) {
        try {
            this.heap.remove(this.order.wrap(value));
            return true;
        } catch (ValueNotFoundException ex) {
            log.debug("{}: discard found nothing to remove for '{}'.", this.traceObjectId, value);
            return false;
        }
    }

    /**
     * Returns (without removing) the value with the highest priority, in O(1) time.
     *
     * @return The value at the front of the queue.
     * @throws EmptyQueueException If the queue is empty.
     */
    public V peek() {
        return this.heap.peekMin().getValue();
    }

    /**
     * Removes and returns the value with the highest priority, in O(log n) time.
     *
     * @return The value that was at the front of the queue.
     * @throws EmptyQueueException If the queue is empty.
     */
    public V pop() {
        return this.heap.popMin().getValue();
    }

    /**
     * Removes all values from the queue. The order is unchanged.
     */
    public void clear() {
        this.heap.clear();
    }

    /**
     * Creates a new {@link PriorityQueue} with the same order, configuration and contents as this one. The two queues
     * share their values, but not their backing storage.
     *
     * @return The copy.
     */
    public PriorityQueue<V> copy() {
        return new PriorityQueue<>(this, this.heap.copy());
    }

    //endregion

    //region Iteration

    /**
     * Gets a snapshot of the values in the queue, sorted from highest to lowest priority, in O(n log n) time. The queue
     * itself is not reordered.
     *
     * @return An immutable list with the values.
     */
    public List<V> values() {
        return toValues(this.heap.sortedItems());
    }

    /**
     * Returns an iterator over a sorted snapshot of the values in the queue (see {@link #values()}). Changes made to
     * the queue after this call are not reflected in the iterator. The iterator does not support removal.
     *
     * @return A new iterator.
     */
    @Override
    public Iterator<V> iterator() {
        return values().iterator();
    }

    /**
     * Returns a sequential {@link Stream} over a sorted snapshot of the values in the queue.
     *
     * @return A new stream.
     */
    public Stream<V> stream() {
        return values().stream();
    }

    //endregion

    //region Comparisons

    /**
     * Determines whether every value in this queue is also in the other one, at least as many times ({@code this <= other}).
     *
     * @param other The other queue.
     * @return True if this queue is a sub-multiset of the other one.
     */
    public boolean isSubsetOf(@NonNull PriorityQueue<V> other) {
        return this == other || SortedMerge.isIncluded(this.heap.sortedItems(), alignedItems(other), this.order);
    }

    /**
     * Determines whether this queue is a subset of the other one and is smaller than it ({@code this < other}).
     *
     * @param other The other queue.
     * @return True if this queue is a proper sub-multiset of the other one.
     */
    public boolean isProperSubsetOf(@NonNull PriorityQueue<V> other) {
        return size() < other.size() && isSubsetOf(other);
    }

    /**
     * Determines whether every value in the other queue is also in this one, at least as many times ({@code this >= other}).
     *
     * @param other The other queue.
     * @return True if this queue is a super-multiset of the other one.
     */
    public boolean isSupersetOf(@NonNull PriorityQueue<V> other) {
        return this == other || SortedMerge.isIncluded(alignedItems(other), this.heap.sortedItems(), this.order);
    }

    /**
     * Determines whether this queue is a superset of the other one and is larger than it ({@code this > other}).
     *
     * @param other The other queue.
     * @return True if this queue is a proper super-multiset of the other one.
     */
    public boolean isProperSupersetOf(@NonNull PriorityQueue<V> other) {
        return size() > other.size() && isSupersetOf(other);
    }

    /**
     * Determines whether this queue and the other one have no values in common.
     *
     * @param other The other queue.
     * @return True if the intersection of the two queues is empty.
     */
    public boolean isDisjoint(@NonNull PriorityQueue<V> other) {
        if (isEmpty() || other.isEmpty()) {
            return true;
        }

        return SortedMerge.isDisjoint(this.heap.sortedItems(), alignedItems(other), this.order);
    }

    //endregion

    //region Set Operations

    /**
     * Creates a queue with the values that are in both this queue and the other one ({@code this & other}). A value
     * that occurs m times here and n times in the other queue occurs min(m, n) times in the result.
     *
     * @param other The other queue.
     * @return A new queue, with this queue's order and configuration.
     */
    public PriorityQueue<V> intersection(@NonNull PriorityQueue<V> other) {
        long traceId = LoggerHelpers.traceEnterWithContext(log, this.traceObjectId, "intersection", other.traceObjectId);
        List<V> result = isEmpty() || other.isEmpty()
                ? Collections.emptyList()
                : SortedMerge.intersect(this.heap.sortedItems(), alignedItems(other), this.order);
        LoggerHelpers.traceLeave(log, this.traceObjectId, "intersection", traceId, result.size());
        return derive(result);
    }

    /**
     * Creates a queue with all the values from this queue and the other one ({@code this | other}). A value that occurs
     * m times here and n times in the other queue occurs m + n times in the result.
     *
     * @param other The other queue.
     * @return A new queue, with this queue's order and configuration.
     */
    public PriorityQueue<V> union(@NonNull PriorityQueue<V> other) {
        List<V> result = new ArrayList<>(size() + other.size());
        result.addAll(this.heap.values());
        result.addAll(other.heap.values());
        return derive(result);
    }

    /**
     * Creates a queue with the values from this queue that are not in the other one ({@code this - other}). A value
     * that occurs m times here and n times in the other queue occurs max(m - n, 0) times in the result.
     *
     * @param other The other queue.
     * @return A new queue, with this queue's order and configuration.
     */
    public PriorityQueue<V> difference(@NonNull PriorityQueue<V> other) {
        if (isEmpty() || other.isEmpty()) {
            return copy();
        }

        long traceId = LoggerHelpers.traceEnterWithContext(log, this.traceObjectId, "difference", other.traceObjectId);
        List<V> result = SortedMerge.subtract(this.heap.sortedItems(), alignedItems(other), this.order);
        LoggerHelpers.traceLeave(log, this.traceObjectId, "difference", traceId, result.size());
        return derive(result);
    }

    /**
     * Creates a queue with the values that are in exactly one of this queue and the other one ({@code this ^ other}),
     * which is {@code (this - other) | (other - this)}.
     *
     * @param other The other queue.
     * @return A new queue, with this queue's order and configuration.
     */
    public PriorityQueue<V> symmetricDifference(@NonNull PriorityQueue<V> other) {
        if (other.isEmpty()) {
            return copy();
        } else if (isEmpty()) {
            return derive(other.heap.values());
        }

        long traceId = LoggerHelpers.traceEnterWithContext(log, this.traceObjectId, "symmetricDifference", other.traceObjectId);
        List<V> result = SortedMerge.symmetricSubtract(this.heap.sortedItems(), alignedItems(other), this.order);
        LoggerHelpers.traceLeave(log, this.traceObjectId, "symmetricDifference", traceId, result.size());
        return derive(result);
    }

    /**
     * Retains only the values that are also in the other queue ({@code this &= other}).
     *
     * @param other The other queue.
     */
    public void intersectWith(@NonNull PriorityQueue<V> other) {
        replaceContents(intersection(other), "intersectWith");
    }

    /**
     * Adds all values from the other queue to this one ({@code this |= other}).
     *
     * @param other The other queue.
     */
    public void unionWith(@NonNull PriorityQueue<V> other) {
        replaceContents(union(other), "unionWith");
    }

    /**
     * Removes the values that are in the other queue from this one ({@code this -= other}).
     *
     * @param other The other queue.
     */
    public void subtractWith(@NonNull PriorityQueue<V> other) {
        replaceContents(difference(other), "subtractWith");
    }

    /**
     * Keeps only the values that are in exactly one of this queue and the other one ({@code this ^= other}).
     *
     * @param other The other queue.
     */
    public void symmetricDifferenceWith(@NonNull PriorityQueue<V> other) {
        replaceContents(symmetricDifference(other), "symmetricDifferenceWith");
    }

    //endregion

    //region Object Implementation

    /**
     * Determines whether the given object is a {@link PriorityQueue} with the same values, with the same multiplicity.
     * Orders are not taken into account: a queue is equal to its reversed counterpart.
     *
     * @param obj The object to compare to.
     * @return True if equal, false otherwise.
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }

        if (!(obj instanceof PriorityQueue)) {
            return false;
        }

        PriorityQueue<?> other = (PriorityQueue<?>) obj;
        return size() == other.size()
                && HashMultiset.create(this.heap.values()).equals(HashMultiset.create(other.heap.values()));
    }

    @Override
    public int hashCode() {
        return HashMultiset.create(this.heap.values()).hashCode();
    }

    @Override
    public String toString() {
        String values = values().stream().map(String::valueOf).collect(Collectors.joining(", "));
        return String.format("PriorityQueue(%s%skey=%s, reverse=%s)",
                values, values.isEmpty() ? "" : ", ", getKey(), isReverse());
    }

    //endregion

    //region Helpers

    /**
     * Gets the other queue's items sorted by this queue's order. If both queues derive priorities the same way, the
     * other queue's sorted snapshot is used as-is, in reverse if the directions differ. That snapshot is cached by the
     * other queue's heap until it is modified, so neither keys nor sorting are computed again.
     */
    private List<Item<V>> alignedItems(PriorityQueue<V> other) {
        if (other == this) {
            return this.heap.sortedItems();
        }

        if (this.config.isReuseSortedSnapshots() && this.order.hasSameKey(other.order)) {
            List<Item<V>> items = other.heap.sortedItems();
            return this.order.isReverse() == other.order.isReverse() ? items : Lists.reverse(items);
        }

        return this.order.sortedItems(other.heap.values());
    }

    private PriorityQueue<V> derive(Collection<V> values) {
        return new PriorityQueue<>(this.order, this.config, values);
    }

    private void replaceContents(PriorityQueue<V> result, String operation) {
        log.debug("{}: {} replaced {} values with {}.", this.traceObjectId, operation, size(), result.size());
        this.heap.replaceWith(result.heap);
    }

    private static <V> List<V> toValues(List<Item<V>> items) {
        ImmutableList.Builder<V> result = ImmutableList.builderWithExpectedSize(items.size());
        for (Item<V> item : items) {
            result.add(item.getValue());
        }

        return result.build();
    }

    @VisibleForTesting
    BinaryHeap<V> getHeap() {
        return this.heap;
    }

    //endregion
}
