// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.heap;

import java.util.Locale;

/**
 * The ordering of a heap. In a MAX heap larger values have higher priority
 * and come out first; in a MIN heap smaller values do.
 */
public enum Priority {
    MAX {
        @Override
        <E extends Comparable<? super E>> boolean higher(E a, E b) { return a.compareTo(b) > 0; }
        @Override
        boolean higher(int a, int b) { return a > b; }
    },
    MIN {
        @Override
        <E extends Comparable<? super E>> boolean higher(E a, E b) { return a.compareTo(b) < 0; }
        @Override
        boolean higher(int a, int b) { return a < b; }
    };

    /** True if a has strictly higher priority than b. Equal values never outrank each other. */
    abstract <E extends Comparable<? super E>> boolean higher(E a, E b);

    abstract boolean higher(int a, int b);

    static Priority parse(String s) {
        switch (s.toLowerCase(Locale.ROOT)) {
            case "max": return MAX;
            case "min": return MIN;
            default: throw new IllegalArgumentException("unknown priority: " + s);
        }
    }
}
