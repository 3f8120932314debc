package com.oslira.bulk.service.batch;

/**
 * Blocking pause used for backoff and cooldown.
 */
@FunctionalInterface
interface Sleeper {

    Sleeper THREAD_SLEEP = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
