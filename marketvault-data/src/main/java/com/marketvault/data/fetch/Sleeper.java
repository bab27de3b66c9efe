package com.marketvault.data.fetch;

import java.util.concurrent.TimeUnit;

/**
 * Blocking wait, replaceable in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = TimeUnit.NANOSECONDS::sleep;

    void sleepNanos(long nanos) throws InterruptedException;
}
