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

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.prioq.test.common.AssertExtensions;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.val;
import org.junit.Assert;
import org.junit.Test;
import org.slf4j.LoggerFactory;

/**
 * Unit tests for the comparison and set operations of the {@link PriorityQueue} class. Most of these verify algebraic
 * laws over randomly generated groups of queues that share a key function, each with a random direction.
 */
public class PriorityQueueSetOperationsTests {
    private static final int GROUP_COUNT = 200;
    private static final int MAX_QUEUE_SIZE = 12;

    //region Examples

    @Test
    public void testIntersectionExample() {
        val result = PriorityQueue.of(1, 2, 3).intersection(PriorityQueue.of(2, 3, 4));
        Assert.assertEquals(QueueGenerator.list(2, 3), result.values());
    }

    @Test
    public void testUnionExample() {
        val result = PriorityQueue.of(1, 2).union(PriorityQueue.of(2, 3));
        Assert.assertEquals(4, result.size());
        Assert.assertEquals(QueueGenerator.list(1, 2, 2, 3), result.values());
    }

    @Test
    public void testDifferenceExample() {
        val left = PriorityQueue.of(1, 1, 2, 3);
        Assert.assertEquals(QueueGenerator.list(1, 3), left.difference(PriorityQueue.reversed(2, 1, 5)).values());
        Assert.assertEquals(QueueGenerator.list(1, 1, 5), left.symmetricDifference(PriorityQueue.of(2, 3, 5)).values());
    }

    /**
     * Tests operations between queues with different key functions; the left operand's order is used throughout.
     */
    @Test
    public void testDifferentKeys() {
        val byAbs = PriorityQueue.withKey(QueueGenerator.ABS, true, -3, 2, -1, 1);
        val natural = PriorityQueue.of(1, 2, 3, -3);
        val result = byAbs.intersection(natural);
        Assert.assertSame(byAbs.getOrder(), result.getOrder());
        Assert.assertEquals(-3, (int) result.pop());
        Assert.assertEquals(2, (int) result.pop());
        Assert.assertEquals(1, (int) result.pop());
        Assert.assertTrue(result.isEmpty());

        Assert.assertTrue(PriorityQueue.of(1, -3).isSubsetOf(byAbs));
        Assert.assertFalse(PriorityQueue.of(3).isSubsetOf(byAbs));
        Assert.assertTrue(byAbs.isSupersetOf(PriorityQueue.of(1, -1)));
    }

    /**
     * Tests the comparison operators on small, hand-picked queues.
     */
    @Test
    public void testComparisonsExample() {
        val small = PriorityQueue.of(1, 2);
        val large = PriorityQueue.reversed(2, 1, 2);
        Assert.assertTrue(small.isSubsetOf(large));
        Assert.assertTrue(small.isProperSubsetOf(large));
        Assert.assertFalse(large.isSubsetOf(small));
        Assert.assertTrue(large.isSupersetOf(small));
        Assert.assertTrue(large.isProperSupersetOf(small));
        Assert.assertFalse(small.isProperSubsetOf(small.copy()));
        Assert.assertTrue(small.isSubsetOf(small));
        Assert.assertFalse("Multiplicity was not taken into account.", PriorityQueue.of(2, 2).isSubsetOf(small));
        Assert.assertTrue(PriorityQueue.<Integer>of().isSubsetOf(small));
        Assert.assertTrue(small.isDisjoint(PriorityQueue.of(3, 4)));
        Assert.assertFalse(small.isDisjoint(large));
        Assert.assertTrue(small.isDisjoint(PriorityQueue.<Integer>of()));
    }

    /**
     * Tests that null operands are rejected.
     */
    @Test
    public void testNullOperands() {
        val q = PriorityQueue.of(1);
        AssertExtensions.assertThrows("intersection() accepted null.", () -> q.intersection(null), ex -> ex instanceof NullPointerException);
        AssertExtensions.assertThrows("isSubsetOf() accepted null.", () -> q.isSubsetOf(null), ex -> ex instanceof NullPointerException);
        AssertExtensions.assertThrows("unionWith() accepted null.", () -> q.unionWith(null), ex -> ex instanceof NullPointerException);
    }

    //endregion

    //region Equality

    @Test
    public void testEqualityReflexive() {
        forEachGroup(1, group -> {
            val a = group.get(0);
            Assert.assertEquals(a, a);
            Assert.assertEquals(a, a.copy());
        });
    }

    @Test
    public void testEqualitySymmetric() {
        forEachGroup(2, group -> {
            val a = group.get(0);
            val b = group.get(1);
            Assert.assertEquals(a.equals(b), b.equals(a));
            val reversedCopy = new PriorityQueue<>(a.getOrder().reverse(), a.values());
            Assert.assertEquals(a, reversedCopy);
            Assert.assertEquals(reversedCopy, a);
        });
    }

    @Test
    public void testEqualityTransitive() {
        forEachGroup(1, group -> {
            val a = group.get(0);
            val b = new PriorityQueue<>(a.getOrder().reverse(), a.values());
            val c = new PriorityQueue<>(QueueOrder.<Integer>natural(), b.values());
            Assert.assertEquals(a, b);
            Assert.assertEquals(b, c);
            Assert.assertEquals(a, c);
        });
    }

    /**
     * Tests that {@code a <= b && b <= a} holds exactly when the two queues are equal, even with different directions.
     */
    @Test
    public void testSubsetAntisymmetric() {
        forEachGroup(2, group -> {
            val a = group.get(0);
            val b = group.get(1);
            Assert.assertEquals(a.equals(b), a.isSubsetOf(b) && b.isSubsetOf(a));
            val reversedCopy = new PriorityQueue<>(a.getOrder().reverse(), a.values());
            Assert.assertTrue(a.isSubsetOf(reversedCopy) && reversedCopy.isSubsetOf(a));
        });
    }

    //endregion

    //region Comparisons

    @Test
    public void testProperComparisons() {
        forEachGroup(2, group -> {
            val a = group.get(0);
            val b = group.get(1);
            Assert.assertEquals(a.isSubsetOf(b) && !a.equals(b), a.isProperSubsetOf(b));
            Assert.assertEquals(a.isSupersetOf(b) && !a.equals(b), a.isProperSupersetOf(b));
            Assert.assertEquals(a.isSubsetOf(b), b.isSupersetOf(a));
            Assert.assertEquals(a.isProperSubsetOf(b), b.isProperSupersetOf(a));
        });
    }

    @Test
    public void testDisjointSymmetric() {
        forEachGroup(2, group -> {
            val a = group.get(0);
            val b = group.get(1);
            Assert.assertEquals(a.isDisjoint(b), b.isDisjoint(a));
            Assert.assertEquals(a.intersection(b).isEmpty(), a.isDisjoint(b));
            Assert.assertEquals(a.isEmpty(), a.isDisjoint(a));
        });
    }

    //endregion

    //region Set Operations

    @Test
    public void testIntersectionLaws() {
        forEachGroup(2, group -> {
            val a = group.get(0);
            val b = group.get(1);
            val intersection = a.intersection(b);
            Assert.assertTrue(intersection.isSubsetOf(a));
            Assert.assertTrue(intersection.isSubsetOf(b));
            Assert.assertEquals(intersection, b.intersection(a));
            Assert.assertEquals(a, a.intersection(a));
            Assert.assertEquals("Absorption law does not hold.", a, a.intersection(a.union(b)));
        });
    }

    @Test
    public void testUnionLaws() {
        forEachGroup(2, group -> {
            val a = group.get(0);
            val b = group.get(1);
            val union = a.union(b);
            Assert.assertEquals(a.size() + b.size(), union.size());
            Assert.assertTrue(a.isSubsetOf(union));
            Assert.assertTrue(b.isSubsetOf(union));
            Assert.assertEquals(union, b.union(a));
            Assert.assertEquals(a, union.difference(b));
        });
    }

    @Test
    public void testDifferenceLaws() {
        forEachGroup(2, group -> {
            val a = group.get(0);
            val b = group.get(1);
            val difference = a.difference(b);
            Assert.assertTrue(difference.isSubsetOf(a));
            Assert.assertEquals(a, difference.union(a.intersection(b)));
            Assert.assertTrue(a.difference(a).isEmpty());
        });
    }

    @Test
    public void testSymmetricDifferenceLaws() {
        forEachGroup(2, group -> {
            val a = group.get(0);
            val b = group.get(1);
            val empty = new PriorityQueue<>(b.getOrder());
            Assert.assertTrue(a.symmetricDifference(a).isEmpty());
            Assert.assertEquals(a, a.symmetricDifference(empty));
            Assert.assertEquals(a, empty.symmetricDifference(a));
            Assert.assertEquals(a.symmetricDifference(b), b.symmetricDifference(a));
            Assert.assertEquals(a.difference(b).union(b.difference(a)), a.symmetricDifference(b));
        });
    }

    /**
     * Tests that binary operations never modify their operands and that results use the left operand's order.
     */
    @Test
    public void testOperandsUnchanged() {
        List<BiFunction<PriorityQueue<Integer>, PriorityQueue<Integer>, PriorityQueue<Integer>>> operations = Arrays.asList(
                PriorityQueue::intersection, PriorityQueue::union, PriorityQueue::difference, PriorityQueue::symmetricDifference);
        forEachGroup(2, group -> {
            val a = group.get(0);
            val b = group.get(1);
            val aValues = a.values();
            val bValues = b.values();
            for (val operation : operations) {
                val result = operation.apply(a, b);
                Assert.assertNotSame(a, result);
                Assert.assertNotSame(b, result);
                Assert.assertSame(a.getOrder(), result.getOrder());
                Assert.assertSame(a.getConfig(), result.getConfig());
                Assert.assertTrue(result.getHeap().isHeapOrdered());
                Assert.assertEquals(aValues, a.values());
                Assert.assertEquals(bValues, b.values());
            }
        });
    }

    /**
     * Tests that the in-place operations produce the same outcome as their counterparts.
     */
    @Test
    public void testInPlaceOperations() {
        verifyInPlace(PriorityQueue::intersection, PriorityQueue::intersectWith);
        verifyInPlace(PriorityQueue::union, PriorityQueue::unionWith);
        verifyInPlace(PriorityQueue::difference, PriorityQueue::subtractWith);
        verifyInPlace(PriorityQueue::symmetricDifference, PriorityQueue::symmetricDifferenceWith);
    }

    /**
     * Tests that an in-place operation with the queue itself as operand works.
     */
    @Test
    public void testInPlaceWithSelf() {
        val q = PriorityQueue.of(1, 2, 2);
        q.unionWith(q);
        Assert.assertEquals(QueueGenerator.list(1, 1, 2, 2, 2, 2), q.values());
        q.intersectWith(q);
        Assert.assertEquals(6, q.size());
        q.symmetricDifferenceWith(q);
        Assert.assertTrue(q.isEmpty());
    }

    /**
     * Tests that results are the same whether or not sorted snapshots are reused.
     */
    @Test
    public void testSnapshotReuse() {
        val noReuse = PriorityQueueConfig.builder().with(PriorityQueueConfig.REUSE_SORTED_SNAPSHOTS, false).build();
        forEachGroup(2, group -> {
            val a = group.get(0);
            val b = group.get(1);
            val a2 = new PriorityQueue<>(a.getOrder(), noReuse, a.values());
            Assert.assertEquals(a.intersection(b), a2.intersection(b));
            Assert.assertEquals(a.difference(b), a2.difference(b));
            Assert.assertEquals(a.symmetricDifference(b), a2.symmetricDifference(b));
            Assert.assertEquals(a.isSubsetOf(b), a2.isSubsetOf(b));
            Assert.assertEquals(a.isDisjoint(b), a2.isDisjoint(b));
        });
    }

    /**
     * Tests that a queue sharing the key function of the other operand neither applies that key function nor sorts
     * again when its sorted snapshot can be reused.
     */
    @Test
    public void testSnapshotReuseSkipsKeysAndSorting() {
        val keyCalls = new AtomicInteger();
        Function<Integer, Integer> key = v -> {
            keyCalls.incrementAndGet();
            return v % 7;
        };
        val values = QueueGenerator.list(1, 8, 3, 10, 6, 13, 20);
        val left = new PriorityQueue<>(QueueOrder.by(key, false), values.subList(0, 4));
        val right = new PriorityQueue<>(QueueOrder.by(key, true), values);
        val rightSnapshot = right.getHeap().sortedItems();

        keyCalls.set(0);
        Assert.assertTrue(left.isSubsetOf(right));
        Assert.assertFalse(left.isDisjoint(right));
        Assert.assertEquals("Key function applied despite a reusable snapshot.", 0, keyCalls.get());
        Assert.assertSame("Right operand's snapshot was recomputed.", rightSnapshot, right.getHeap().sortedItems());

        val noReuse = PriorityQueueConfig.builder().with(PriorityQueueConfig.REUSE_SORTED_SNAPSHOTS, false).build();
        val leftNoReuse = new PriorityQueue<>(left.getOrder(), noReuse, left.values());
        keyCalls.set(0);
        Assert.assertTrue(leftNoReuse.isSubsetOf(right));
        Assert.assertEquals("Key function not applied to the other operand's values.", values.size(), keyCalls.get());
    }

    /**
     * Tests that intersection(), difference() and symmetricDifference() log their entry and exit at trace level.
     */
    @Test
    public void testTraceLogging() {
        val log = (Logger) LoggerFactory.getLogger(PriorityQueue.class);
        val appender = new ListAppender<ILoggingEvent>();
        appender.start();
        log.addAppender(appender);
        Level previousLevel = log.getLevel();
        log.setLevel(Level.TRACE);
        try {
            val left = PriorityQueue.of(1, 2, 3);
            val right = PriorityQueue.of(2, 3, 4);
            Assert.assertEquals(2, left.intersection(right).size());
            Assert.assertEquals(1, left.difference(right).size());
            Assert.assertEquals(2, left.symmetricDifference(right).size());
        } finally {
            log.setLevel(previousLevel);
            log.detachAppender(appender);
            appender.stop();
        }

        for (String method : Arrays.asList("intersection", "difference", "symmetricDifference")) {
            val messages = appender.list.stream()
                    .filter(e -> e.getLevel() == Level.TRACE)
                    .map(ILoggingEvent::getFormattedMessage)
                    .filter(m -> m.contains("::" + method + "@"))
                    .collect(Collectors.toList());
            Assert.assertEquals("Unexpected trace events for " + method, 2, messages.size());
            Assert.assertTrue(messages.get(0).startsWith("ENTER PriorityQueue["));
            Assert.assertTrue(messages.get(1).startsWith("LEAVE PriorityQueue["));
        }
    }

    //endregion

    //region Helpers

    private void verifyInPlace(BiFunction<PriorityQueue<Integer>, PriorityQueue<Integer>, PriorityQueue<Integer>> operation,
                               BiConsumer<PriorityQueue<Integer>, PriorityQueue<Integer>> inPlaceOperation) {
        forEachGroup(2, group -> {
            val a = group.get(0);
            val b = group.get(1);
            val order = a.getOrder();
            val expected = operation.apply(a, b);
            val bValues = b.values();
            inPlaceOperation.accept(a, b);
            Assert.assertEquals(expected, a);
            Assert.assertSame("In-place operation changed the order.", order, a.getOrder());
            Assert.assertTrue(a.getHeap().isHeapOrdered());
            Assert.assertEquals("In-place operation modified its argument.", bValues, b.values());
        });
    }

    private void forEachGroup(int groupSize, GroupTest test) {
        val generator = new QueueGenerator(groupSize);
        val groups = generator.queueGroups(GROUP_COUNT, groupSize, MAX_QUEUE_SIZE);
        groups.add(Collections.nCopies(groupSize, PriorityQueue.<Integer>of()));
        for (val group : groups) {
            test.run(group);
        }
    }

    @FunctionalInterface
    private interface GroupTest {
        void run(List<PriorityQueue<Integer>> group);
    }

    //endregion
}
