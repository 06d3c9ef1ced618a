package com.williamcallahan.mathcore.service.mathml;

import java.util.Objects;

/**
 * Equation number source for numbered environment rows.
 */
public final class EquationCounter {

    private final CounterScope scope;
    private int value;

    public EquationCounter(CounterScope scope) {
        this.scope = Objects.requireNonNull(scope, "Counter scope cannot be null");
    }

    public static EquationCounter local() {
        return new EquationCounter(CounterScope.LOCAL);
    }

    /**
     * Advances the counter.
     *
     * @return the next equation number, starting at 1
     */
    public synchronized int next() {
        value++;
        return value;
    }

    /**
     * Returns the last number handed out.
     *
     * @return 0 before the first {@link #next()}
     */
    public synchronized int current() {
        return value;
    }

    public synchronized void reset() {
        value = 0;
    }

    public CounterScope scope() {
        return scope;
    }
}
