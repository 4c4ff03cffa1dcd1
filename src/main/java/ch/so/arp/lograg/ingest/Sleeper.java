package ch.so.arp.lograg.ingest;

import java.time.Duration;

/**
 * Blocking pause between two write batches.
 */
@FunctionalInterface
interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
