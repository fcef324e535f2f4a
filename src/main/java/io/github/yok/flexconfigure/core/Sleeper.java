package io.github.yok.flexconfigure.core;

import java.util.concurrent.TimeUnit;

/**
 * Blocking wait between deployment status checks (replaceable in tests).
 */
@FunctionalInterface
public interface Sleeper {

    /** Sleeps on the calling thread. */
    Sleeper SYSTEM = TimeUnit.SECONDS::sleep;

    /**
     * Blocks the calling thread.
     *
     * @param seconds seconds to wait
     * @throws InterruptedException if the thread is interrupted while waiting
     */
    void sleep(long seconds) throws InterruptedException;
}
