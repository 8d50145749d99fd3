// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.heap;

import gnu.trove.list.array.TIntArrayList;

import java.util.OptionalInt;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The same heap as {@link BinaryHeap}, for unboxed ints.
 */
public class IntBinaryHeap {
    private final TIntArrayList a;
    private final Priority priority;

    public IntBinaryHeap(Priority priority, int... values) {
        this.a = new TIntArrayList(values);
        this.priority = checkNotNull(priority);
        heapify();
    }

    public Priority priority() { return priority; }

    public boolean isEmpty() { return a.isEmpty(); }

    public int size() { return a.size(); }

    public OptionalInt peek() {
        return a.isEmpty() ? OptionalInt.empty() : OptionalInt.of(a.get(0));
    }

    public void insert(int value) {
        a.add(value);
        siftUp(a.size() - 1);
    }

    public OptionalInt remove() {
        if (a.isEmpty()) return OptionalInt.empty();
        int top = a.get(0);
        int last = a.removeAt(a.size() - 1);
        if (!a.isEmpty()) {
            a.set(0, last);
            siftDown(0);
        }
        return OptionalInt.of(top);
    }

    public int[] toArray() { return a.toArray(); }

    private void heapify() {
        for (int start = a.size() / 2 - 1; start >= 0; --start) siftDown(start);
    }

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
        int tmp = a.get(i);
        a.set(i, a.get(j));
        a.set(j, tmp);
    }

    @Override
    public String toString() {
        return a.toString();
    }
}
