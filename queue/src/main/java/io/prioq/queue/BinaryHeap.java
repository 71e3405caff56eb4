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
import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import javax.annotation.concurrent.NotThreadSafe;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Array-backed binary min-heap of {@link Item}s, ordered by a {@link QueueOrder}.
 * <p>
 * The heap invariant ({@code items[i] <= items[2i+1]} and {@code items[i] <= items[2i+2]}, as defined by the order)
 * holds whenever a method returns, including when it throws. Every restructuring performs all of its comparisons before
 * writing to the backing array, so a {@link ClassCastException} from the order leaves the heap unchanged.
 * <p>
 * Items never leave this package; {@link PriorityQueue} only hands out their values.
 *
 * @param <V> Type of the values.
 */
@Slf4j
@NotThreadSafe
final class BinaryHeap<V> {
    //region Members

    private static final int MAX_CAPACITY = Integer.MAX_VALUE - Long.BYTES;
    private static final int MAX_HALF = MAX_CAPACITY / 2;
    private static final int MAX_DEPTH = Integer.SIZE;
    @Getter
    private final QueueOrder<V> order;
    private Object[] items;
    private int size;
    /**
     * The result of the last sortedItems() call. Reset by every operation that changes the contents of the heap.
     */
    private List<Item<V>> sortedSnapshot;

    //endregion

    //region Constructor

    /**
     * Creates a new, empty instance of the {@link BinaryHeap} class.
     *
     * @param order           The order to arrange items by.
     * @param initialCapacity The initial capacity of the backing array.
     */
    BinaryHeap(@NonNull QueueOrder<V> order, int initialCapacity) {
        Preconditions.checkArgument(initialCapacity >= 0, "initialCapacity must be a non-negative number.");
        this.order = order;
        this.items = new Object[initialCapacity];
        this.size = 0;
    }

    //endregion

    //region Operations

    /**
     * Replaces the contents of this heap with the given values, arranged in heap order in O(n) time.
     * The new contents are built in a separate array, which is published only if every value could be wrapped and
     * compared.
     *
     * @param values The values to load.
     */
    void load(Collection<? extends V> values) {
        Object[] newItems = new Object[Math.max(this.items.length, values.size())];
        int count = 0;
        for (V value : values) {
            newItems[count++] = this.order.wrap(value);
        }

        heapify(newItems, count);
        this.items = newItems;
        this.size = count;
        this.sortedSnapshot = null;
    }

    /**
     * Adds the given item to the heap, in O(log n) time.
     *
     * @param item The item to add.
     */
    void push(@NonNull Item<V> item) {
        if (this.size == this.items.length) {
            expand();
        }

        int target = siftUpTarget(this.items, item, this.size);
        moveUp(this.items, item, this.size, target);
        this.size++;
        this.sortedSnapshot = null;
    }

    /**
     * Returns (without removing) the item with the highest priority, in O(1) time.
     *
     * @return The item at the top of the heap.
     * @throws EmptyQueueException If the heap is empty.
     */
    Item<V> peekMin() {
        if (this.size == 0) {
            throw new EmptyQueueException();
        }

        return get(this.items, 0);
    }

    /**
     * Removes and returns the item with the highest priority, in O(log n) time.
     *
     * @return The removed item.
     * @throws EmptyQueueException If the heap is empty.
     */
    Item<V> popMin() {
        Item<V> result = peekMin();
        removeAt(0);
        return result;
    }

    /**
     * Removes one item matching the given one (same priority and equal value). Locating the item takes O(n) time;
     * restoring the heap invariant afterwards takes O(log n).
     *
     * @param item The item to remove.
     * @throws ValueNotFoundException If there is no matching item in the heap. The heap is not modified in this case.
     */
    void remove(@NonNull Item<V> item) {
        int index = indexOf(item);
        if (index < 0) {
            throw new ValueNotFoundException(item.getValue());
        }

        removeAt(index);
    }

    /**
     * Determines whether the heap contains a value equal to the given one. This is a linear scan by value equality; no
     * priorities are computed or compared.
     *
     * @param value The value to search for.
     * @return True if found, false otherwise.
     */
    boolean containsValue(Object value) {
        for (int i = 0; i < this.size; i++) {
            if (Objects.equals(get(this.items, i).getValue(), value)) {
                return true;
            }
        }

        return false;
    }

    /**
     * Removes all items from the heap. The capacity of the backing array is retained.
     */
    void clear() {
        Arrays.fill(this.items, 0, this.size, null);
        this.size = 0;
        this.sortedSnapshot = null;
    }

    /**
     * Replaces the contents of this heap with the contents of the given one, which must have been created with the same
     * {@link QueueOrder}. The given heap must not be used afterwards, as it shares its backing array with this one.
     *
     * @param source The heap to take the contents of.
     */
    void replaceWith(@NonNull BinaryHeap<V> source) {
        Preconditions.checkArgument(source.order == this.order, "source must use the same QueueOrder.");
        this.items = source.items;
        this.size = source.size;
        this.sortedSnapshot = source.sortedSnapshot;
    }

    /**
     * Creates a new {@link BinaryHeap} with the same order and contents as this one, in O(n) time.
     *
     * @return A new {@link BinaryHeap} with its own backing array.
     */
    BinaryHeap<V> copy() {
        BinaryHeap<V> result = new BinaryHeap<>(this.order, 0);
        result.items = Arrays.copyOf(this.items, this.items.length);
        result.size = this.size;
        result.sortedSnapshot = this.sortedSnapshot;
        return result;
    }

    int size() {
        return this.size;
    }

    boolean isEmpty() {
        return this.size == 0;
    }

    /**
     * Gets a snapshot of the values in this heap, in no particular order.
     *
     * @return A new list with the values.
     */
    List<V> values() {
        List<V> result = new ArrayList<>(this.size);
        for (int i = 0; i < this.size; i++) {
            Item<V> item = get(this.items, i);
            result.add(item.getValue());
        }

        return result;
    }

    /**
     * Gets a snapshot of the items in this heap, sorted by priority. The backing array is not reordered. The snapshot
     * is computed in O(n log n) time and then kept until the heap is next modified, so repeated calls on an unchanged
     * heap return the same list in O(1) time.
     *
     * @return An unmodifiable list with the items, in priority order.
     */
    List<Item<V>> sortedItems() {
        if (this.sortedSnapshot == null) {
            List<Item<V>> result = new ArrayList<>(this.size);
            for (int i = 0; i < this.size; i++) {
                result.add(get(this.items, i));
            }

            result.sort(this.order::compare);
            this.sortedSnapshot = Collections.unmodifiableList(result);
        }

        return this.sortedSnapshot;
    }

    /**
     * Verifies that the heap invariant holds for every parent-child pair.
     *
     * @return True if the invariant holds.
     */
    @VisibleForTesting
    boolean isHeapOrdered() {
        for (int i = 1; i < this.size; i++) {
            if (this.order.compare(get(this.items, (i - 1) >>> 1), get(this.items, i)) > 0) {
                return false;
            }
        }

        return true;
    }

    @VisibleForTesting
    int capacity() {
        return this.items.length;
    }

    @Override
    public String toString() {
        return String.format("Size = %s, Capacity = %s, Order = %s", this.size, this.items.length, this.order);
    }

    //endregion

    //region Helpers

    private int indexOf(Item<V> item) {
        for (int i = 0; i < this.size; i++) {
            if (this.order.matches(get(this.items, i), item)) {
                return i;
            }
        }

        return -1;
    }

    private void removeAt(int index) {
        this.sortedSnapshot = null;
        int last = this.size - 1;
        Item<V> moved = get(this.items, last);
        if (index == last) {
            this.items[last] = null;
            this.size = last;
            return;
        }

        // Place the last item in the freed slot. All comparisons happen before anything is written.
        int[] path = new int[MAX_DEPTH];
        int pathLength = siftDownPath(this.items, last, moved, index, path);
        int target = pathLength == 0 ? siftUpTarget(this.items, moved, index) : index;
        this.items[last] = null;
        this.size = last;
        if (pathLength > 0) {
            moveDown(this.items, moved, index, path, pathLength);
        } else {
            moveUp(this.items, moved, index, target);
        }
    }

    private void heapify(Object[] heap, int count) {
        int[] path = new int[MAX_DEPTH];
        for (int i = (count >>> 1) - 1; i >= 0; i--) {
            Item<V> item = get(heap, i);
            int pathLength = siftDownPath(heap, count, item, i, path);
            moveDown(heap, item, i, path, pathLength);
        }
    }

    /**
     * Finds the slot that the given item, if placed at index, would have to be moved up to. Only reads the heap.
     */
    private int siftUpTarget(Object[] heap, Item<V> item, int index) {
        int target = index;
        while (target > 0) {
            int parentIndex = (target - 1) >>> 1;
            if (this.order.compare(item, get(heap, parentIndex)) >= 0) {
                break;
            }

            target = parentIndex;
        }

        return target;
    }

    private void moveUp(Object[] heap, Item<V> item, int index, int target) {
        int hole = index;
        while (hole > target) {
            int parentIndex = (hole - 1) >>> 1;
            heap[hole] = heap[parentIndex];
            hole = parentIndex;
        }

        heap[hole] = item;
    }

    /**
     * Collects the slots that the given item, if placed at index, would have to be moved down through. Only reads
     * the heap.
     *
     * @return The number of slots written into path.
     */
    private int siftDownPath(Object[] heap, int count, Item<V> item, int index, int[] path) {
        int length = 0;
        int half = count >>> 1;
        int current = index;
        while (current < half) {
            int childIndex = 2 * current + 1;
            int rightIndex = childIndex + 1;
            if (rightIndex < count && this.order.compare(get(heap, rightIndex), get(heap, childIndex)) < 0) {
                childIndex = rightIndex;
            }

            if (this.order.compare(item, get(heap, childIndex)) <= 0) {
                break;
            }

            path[length++] = childIndex;
            current = childIndex;
        }

        return length;
    }

    private void moveDown(Object[] heap, Item<V> item, int index, int[] path, int pathLength) {
        int hole = index;
        for (int i = 0; i < pathLength; i++) {
            heap[hole] = heap[path[i]];
            hole = path[i];
        }

        heap[hole] = item;
    }

    private void expand() {
        if (this.items.length >= MAX_CAPACITY) {
            // Can't allocate an array bigger than this.
            throw new OutOfMemoryError("Unable to grow BinaryHeap.");
        }

        int newCapacity;
        if (this.items.length >= MAX_HALF) {
            newCapacity = MAX_CAPACITY;
        } else {
            newCapacity = Math.max(1, this.items.length * 2);
        }

        log.debug("Expanding heap capacity from {} to {}.", this.items.length, newCapacity);
        this.items = Arrays.copyOf(this.items, newCapacity);
    }

    @SuppressWarnings("unchecked")
    private static <V> Item<V> get(Object[] heap, int index) {
        return (Item<V>) heap[index];
    }

    //endregion
}
