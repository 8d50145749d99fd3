// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.heap;

import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A binary heap stored as a complete binary tree in an array. The children of
 * the node at index i live at 2i+1 and 2i+2, and its parent at (i-1)/2.
 * <p>
 * Elements are only ever appended at, or removed from, the end of the array, so
 * the tree stays complete; every mutation restores the heap property before
 * returning. Not thread safe.
 *
 * @param <E> element type, which must be totally ordered
 */
public class BinaryHeap<E extends Comparable<? super E>> {
    private static final Logger log = LogManager.getFormatterLogger(BinaryHeap.class);
    private final ArrayList<E> a;
    private final Priority priority;

    public BinaryHeap() {
        this(Priority.MAX);
    }

    public BinaryHeap(Priority priority) {
        this.a = new ArrayList<>();
        this.priority = checkNotNull(priority);
    }

    public BinaryHeap(Collection<? extends E> elements) {
        this(elements, Priority.MAX);
    }

    /**
     * Creates a heap holding a copy of the given elements. The input need not
     * be in any particular order; it is heapified in linear time.
     */
    public BinaryHeap(Collection<? extends E> elements, Priority priority) {
        this.a = new ArrayList<>(elements.size());
        this.priority = checkNotNull(priority);
        addAll(elements);
        heapify();
    }

    public Priority priority() { return priority; }

    public boolean isEmpty() { return a.isEmpty(); }

    public int size() { return a.size(); }

    /** The element of highest priority, without removing it. */
    public Optional<E> peek() {
        return a.isEmpty() ? Optional.empty() : Optional.of(a.get(0));
    }

    public void insert(E value) {
        a.add(checkNotNull(value));
        siftUp(a.size() - 1);
    }

    /** Removes and returns the element of highest priority. */
    public Optional<E> remove() {
        if (a.isEmpty()) return Optional.empty();
        final int last = a.size() - 1;
        swap(0, last);
        E top = a.remove(last);
        if (!a.isEmpty()) siftDown(0);
        return Optional.of(top);
    }

    /**
     * Removes the element at the given array position. The element moved into
     * the hole may belong either above or below it, so both sifts are run.
     *
     * @return the removed element, or empty if index is out of range (in which
     * case the heap is unchanged)
     */
    public Optional<E> removeAt(int index) {
        final int last = a.size() - 1;
        if (index < 0 || index > last) return Optional.empty();
        if (index == last) return Optional.of(a.remove(last));
        swap(index, last);
        E value = a.remove(last);
        siftDown(index);
        siftUp(index);
        return Optional.of(value);
    }

    /**
     * Adds all of the given elements and heapifies the result. This is linear in
     * the combined size, rather than an insert per element.
     */
    public void merge(Collection<? extends E> elements) {
        log.trace("merging %d elements into heap of %d", elements.size(), a.size());
        addAll(elements);
        heapify();
    }

    /** Merges the elements of another heap into this one. The other heap is not modified. */
    public void merge(BinaryHeap<? extends E> other) {
        merge(other.elements());
    }

    /** Removes every element, returning them in order of priority. */
    public ImmutableList<E> drain() {
        ImmutableList.Builder<E> b = ImmutableList.builderWithExpectedSize(a.size());
        while (!a.isEmpty()) b.add(remove().get());
        return b.build();
    }

    public int indexOf(E value) {
        return indexOf(value, 0);
    }

    /**
     * Searches the subtree rooted at index {@code from} for an element equal to value.
     * A subtree is skipped as soon as value outranks its root, since nothing
     * below the root can outrank it either.
     *
     * @return the array index of a matching element, or -1 if there is none
     */
    public int indexOf(E value, int from) {
        if (from < 0 || from >= a.size()) return -1;
        final E e = a.get(from);
        if (priority.higher(value, e)) return -1;
        if (e.equals(value)) return from;
        int left = indexOf(value, 2*from+1);
        if (left != -1) return left;
        return indexOf(value, 2*from+2);
    }

    public boolean contains(E value) {
        return indexOf(value) != -1;
    }

    /** A snapshot of the elements in array (heap) order. */
    public ImmutableList<E> elements() {
        return ImmutableList.copyOf(a);
    }

    // All or nothing: a null anywhere in elements leaves the heap untouched.
    private void addAll(Collection<? extends E> elements) {
        a.addAll(ImmutableList.copyOf(elements));
    }

    private void heapify() {
        final int n = a.size();
        if (n > 1) log.debug("heapifying %d elements", n);
        for (int start = n / 2 - 1; start >= 0; --start) siftDown(start);
    }

    // Of the two indices, the one whose element has higher priority. An index past
    // the end never wins; ties go to j.
    private int higher(int i, int j) {
        if (i >= a.size()) return j;
        return priority.higher(a.get(i), a.get(j)) ? i : j;
    }

    private void siftUp(int child) {
        int parent = (child - 1) / 2;
        while (child > 0 && higher(child, parent) == child) {
            swap(child, parent);
            child = parent;
            parent = (child - 1) / 2;
        }
    }

    private void siftDown(int root) {
        while (true) {
            int chosen = higher(2*root+1, root);
            chosen = higher(2*root+2, chosen);
            if (chosen == root) return;
            swap(root, chosen);
            root = chosen;
        }
    }

    private void swap(int i, int j) {
        E tmp = a.get(i);
        a.set(i, a.get(j));
        a.set(j, tmp);
    }

    @Override
    public String toString() {
        return a.toString();
    }
}
