package com.alert.engine.service.support;

import java.util.random.RandomGenerator;

/**
 * Random source returning a configurable constant from {@link #nextDouble()}.
 */
public class FixedRandom implements RandomGenerator {

    private volatile double value;

    public FixedRandom(double value) {
        this.value = value;
    }

    public void setValue(double value) {
        this.value = value;
    }

    @Override
    public double nextDouble() {
        return value;
    }

    @Override
    public long nextLong() {
        return (long) (value * Long.MAX_VALUE);
    }
}
