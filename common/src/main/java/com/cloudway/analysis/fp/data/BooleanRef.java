/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.analysis.fp.data;

import java.util.function.BooleanSupplier;

/**
 * Java lambda "closes" environment variables, a {@code BooleanRef} can capture
 * a flag that is set from inside a lambda.
 */
public class BooleanRef implements BooleanSupplier {
    private boolean value;

    /**
     * Creates a new BooleanRef with the given initial value.
     *
     * @param initialValue the initial value
     */
    public BooleanRef(boolean initialValue) {
        value = initialValue;
    }

    /**
     * Creates a new BooleanRef with initial value {@code false}.
     */
    public BooleanRef() {}

    /**
     * Gets the indirect referenced value.
     */
    public boolean get() {
        return value;
    }

    @Override
    public boolean getAsBoolean() {
        return value;
    }

    /**
     * Sets to the given value.
     *
     * @param newValue the new value
     */
    public boolean set(boolean newValue) {
        return value = newValue;
    }

    public String toString() {
        return String.valueOf(value);
    }
}
