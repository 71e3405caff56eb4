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

import com.google.common.collect.HashMultiset;
import com.google.common.collect.Multiset;
import java.util.ArrayList;
import java.util.List;

/**
 * Multiset algebra over two lists of {@link Item}s that are both sorted by the same {@link QueueOrder}.
 * <p>
 * The scan advances through both lists in lockstep, in O(n + m) time. Items with different priorities can never match.
 * Inside a run of tied priorities, values are matched by equality, one left value consuming at most one right value,
 * so the outcome is exact multiset algebra even when distinct values share a priority.
 */
final class SortedMerge {
    private SortedMerge() {
    }

    /**
     * Calculates the multiset intersection of the two lists.
     *
     * @return The left-side values that have a matching right-side value.
     */
    static <V> List<V> intersect(List<Item<V>> left, List<Item<V>> right, QueueOrder<V> order) {
        List<V> result = new ArrayList<>(Math.min(left.size(), right.size()));
        scan(left, right, order, new Visitor<V>() {
            @Override
            public boolean onBoth(V value) {
                result.add(value);
                return true;
            }
        });
        return result;
    }

    /**
     * Calculates the multiset difference of the two lists.
     *
     * @return The left-side values that are left over after removing one match for every right-side value.
     */
    static <V> List<V> subtract(List<Item<V>> left, List<Item<V>> right, QueueOrder<V> order) {
        List<V> result = new ArrayList<>(left.size());
        scan(left, right, order, new Visitor<V>() {
            @Override
            public boolean onLeftOnly(V value) {
                result.add(value);
                return true;
            }
        });
        return result;
    }

    /**
     * Calculates the multiset symmetric difference of the two lists.
     *
     * @return The values from either side that have no match on the other side.
     */
    static <V> List<V> symmetricSubtract(List<Item<V>> left, List<Item<V>> right, QueueOrder<V> order) {
        List<V> result = new ArrayList<>(left.size() + right.size());
        scan(left, right, order, new Visitor<V>() {
            @Override
            public boolean onLeftOnly(V value) {
                result.add(value);
                return true;
            }

            @Override
            public boolean onRightOnly(V value) {
                result.add(value);
                return true;
            }
        });
        return result;
    }

    /**
     * Determines whether every left-side value has a distinct match on the right side. Stops at the first value that
     * does not.
     */
    static <V> boolean isIncluded(List<Item<V>> left, List<Item<V>> right, QueueOrder<V> order) {
        if (left.size() > right.size()) {
            return false;
        }

        return scan(left, right, order, new Visitor<V>() {
            @Override
            public boolean onLeftOnly(V value) {
                return false;
            }
        });
    }

    /**
     * Determines whether the two lists have no value in common. Stops at the first match.
     */
    static <V> boolean isDisjoint(List<Item<V>> left, List<Item<V>> right, QueueOrder<V> order) {
        return scan(left, right, order, new Visitor<V>() {
            @Override
            public boolean onBoth(V value) {
                return false;
            }
        });
    }

    /**
     * Walks both lists and reports every value to the visitor.
     *
     * @return True if the scan completed, false if the visitor stopped it.
     */
    private static <V> boolean scan(List<Item<V>> left, List<Item<V>> right, QueueOrder<V> order, Visitor<V> visitor) {
        int leftIndex = 0;
        int rightIndex = 0;
        while (leftIndex < left.size() && rightIndex < right.size()) {
            int c = order.compare(left.get(leftIndex), right.get(rightIndex));
            if (c < 0) {
                if (!visitor.onLeftOnly(left.get(leftIndex++).getValue())) {
                    return false;
                }
            } else if (c > 0) {
                if (!visitor.onRightOnly(right.get(rightIndex++).getValue())) {
                    return false;
                }
            } else {
                int leftEnd = runEnd(left, leftIndex, order);
                int rightEnd = runEnd(right, rightIndex, order);
                if (!matchRun(left.subList(leftIndex, leftEnd), right.subList(rightIndex, rightEnd), visitor)) {
                    return false;
                }

                leftIndex = leftEnd;
                rightIndex = rightEnd;
            }
        }

        while (leftIndex < left.size()) {
            if (!visitor.onLeftOnly(left.get(leftIndex++).getValue())) {
                return false;
            }
        }

        while (rightIndex < right.size()) {
            if (!visitor.onRightOnly(right.get(rightIndex++).getValue())) {
                return false;
            }
        }

        return true;
    }

    /**
     * Matches values within two runs of items that all share the same priority, in O(k + j) time. Right-side values
     * left without a match are reported in no particular order.
     */
    private static <V> boolean matchRun(List<Item<V>> leftRun, List<Item<V>> rightRun, Visitor<V> visitor) {
        Multiset<V> unmatched = HashMultiset.create(rightRun.size());
        for (Item<V> item : rightRun) {
            unmatched.add(item.getValue());
        }

        for (Item<V> item : leftRun) {
            V value = item.getValue();
            boolean proceed = unmatched.remove(value, 1) > 0 ? visitor.onBoth(value) : visitor.onLeftOnly(value);
            if (!proceed) {
                return false;
            }
        }

        for (V value : unmatched) {
            if (!visitor.onRightOnly(value)) {
                return false;
            }
        }

        return true;
    }

    private static <V> int runEnd(List<Item<V>> items, int start, QueueOrder<V> order) {
        Item<V> first = items.get(start);
        int end = start + 1;
        while (end < items.size() && order.compare(first, items.get(end)) == 0) {
            end++;
        }

        return end;
    }

    /**
     * Receives the outcome of a scan, one value at a time. Each method returns whether the scan should continue.
     */
    private interface Visitor<V> {
        default boolean onLeftOnly(V value) {
            return true;
        }

        default boolean onRightOnly(V value) {
            return true;
        }

        default boolean onBoth(V value) {
            return true;
        }
    }
}
