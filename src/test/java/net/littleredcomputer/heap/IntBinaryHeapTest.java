package net.littleredcomputer.heap;

import org.junit.Test;

import java.util.Arrays;
import java.util.OptionalInt;
import java.util.Random;
import java.util.stream.IntStream;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;

public class IntBinaryHeapTest {

    private static int[] drain(IntBinaryHeap h) {
        return IntStream.generate(() -> h.remove().getAsInt()).limit(h.size()).toArray();
    }

    @Test
    public void heapify() {
        final int[] data = new int[]{3, 7, 6, 2, 3, 4, 5, 1, 3};
        IntBinaryHeap h = new IntBinaryHeap(Priority.MAX, data);
        assertThat(h.size(), is(data.length));
        assertThat(h.peek(), is(OptionalInt.of(7)));
        assertThat(drain(h), is(new int[]{7, 6, 5, 4, 3, 3, 3, 2, 1}));
        assertThat(h.isEmpty(), is(true));
        IntBinaryHeap g = new IntBinaryHeap(Priority.MIN, data);
        assertThat(drain(g), is(new int[]{1, 2, 3, 3, 3, 4, 5, 6, 7}));
        // the heap works on its own copy
        assertThat(data[0], is(3));
    }

    @Test
    public void empty() {
        IntBinaryHeap h = new IntBinaryHeap(Priority.MIN);
        assertThat(h.peek(), is(OptionalInt.empty()));
        assertThat(h.remove(), is(OptionalInt.empty()));
        h.insert(4);
        assertThat(h.remove(), is(OptionalInt.of(4)));
        assertThat(h.isEmpty(), is(true));
    }

    @Test(expected = NullPointerException.class)
    public void rejectsNullPriority() {
        new IntBinaryHeap(null, 1, 2);
    }

    @Test
    public void randomTests() {
        Random R = new Random(-271828);
        for (Priority p : Priority.values()) {
            for (int t = 0; t < 100; ++t) {
                int len = R.nextInt(100) + 2;
                IntBinaryHeap h = new IntBinaryHeap(p);
                int[] A = new int[len];
                for (int i = 0; i < len; ++i) {
                    A[i] = R.nextInt(100);
                    h.insert(A[i]);
                }
                assertThat(Heaps.isHeap(Arrays.asList(Arrays.stream(h.toArray()).boxed().toArray(Integer[]::new)), p), is(true));
                Arrays.sort(A);
                if (p == Priority.MAX) {
                    for (int i = 0, j = len - 1; i < j; ++i, --j) {
                        int tmp = A[i];
                        A[i] = A[j];
                        A[j] = tmp;
                    }
                }
                assertThat(drain(h), is(A));
            }
        }
    }
}
