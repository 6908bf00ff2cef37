package io.quotecache.time;

/**
 * Suspends the calling thread. Injected next to a {@link java.time.Clock} so waits can be simulated in tests.
 */
@FunctionalInterface
public interface Sleeper {
    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
