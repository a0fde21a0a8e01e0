package com.eainde.forecast.llm;

import java.time.Duration;

/**
 * Blocking wait between retry attempts. Swapped for a recording implementation in tests.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
