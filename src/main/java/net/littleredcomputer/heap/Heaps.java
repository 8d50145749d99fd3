// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.heap;

import com.google.common.collect.ImmutableList;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Algorithms built on top of {@link BinaryHeap}.
 */
public final class Heaps {
    private Heaps() {}

    /**
     * Finds the nth smallest value (counting from zero) by extracting from a min-heap
     * nth+1 times. Reading position nth of the heapified array would be wrong: only
     * the root's position is fixed by the heap property.
     *
     * @return the value, or empty if nth is not an index into values
     */
    public static <E extends Comparable<? super E>> Optional<E> nthSmallest(Collection<? extends E> values, int nth) {
        if (nth < 0 || nth >= values.size()) return Optional.empty();
        BinaryHeap<E> h = new BinaryHeap<>(values, Priority.MIN);
        Optional<E> value = Optional.empty();
        for (int i = 0; i <= nth; ++i) value = h.remove();
        return value;
    }

    public static OptionalInt nthSmallest(int[] values, int nth) {
        if (nth < 0 || nth >= values.length) return OptionalInt.empty();
        IntBinaryHeap h = new IntBinaryHeap(Priority.MIN, values);
        OptionalInt value = OptionalInt.empty();
        for (int i = 0; i <= nth; ++i) value = h.remove();
        return value;
    }

    /**
     * A new heap holding the elements of both a and b, which must have the same
     * priority. Neither input is modified.
     */
    public static <E extends Comparable<? super E>> BinaryHeap<E> union(BinaryHeap<E> a, BinaryHeap<E> b) {
        checkArgument(a.priority() == b.priority(), "cannot combine %s heap with %s heap", a.priority(), b.priority());
        BinaryHeap<E> u = new BinaryHeap<>(a.elements(), a.priority());
        u.merge(b);
        return u;
    }

    /** Only inspects the tag, not the contents. */
    public static boolean isMinHeap(Priority priority) {
        return priority == Priority.MIN;
    }

    /** True if every parent in values is less than or equal to each of its children. */
    public static <E extends Comparable<? super E>> boolean isMinHeap(List<E> values) {
        return isHeap(values, Priority.MIN);
    }

    /**
     * True if no child in values has higher priority than its parent. Parents are
     * examined from the last one back to the root, stopping at the first violation.
     */
    public static <E extends Comparable<? super E>> boolean isHeap(List<E> values, Priority priority) {
        final int n = values.size();
        for (int i = n / 2 - 1; i >= 0; --i) {
            final E parent = values.get(i);
            final int left = 2*i+1, right = 2*i+2;
            if (priority.higher(values.get(left), parent)) return false;
            if (right < n && priority.higher(values.get(right), parent)) return false;
        }
        return true;
    }

    /** Heap sort: values in order of the given priority (descending for MAX, ascending for MIN). */
    public static <E extends Comparable<? super E>> ImmutableList<E> sorted(Collection<? extends E> values, Priority priority) {
        return new BinaryHeap<E>(values, priority).drain();
    }
}
