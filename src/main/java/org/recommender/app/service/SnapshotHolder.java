package org.recommender.app.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Hands the current {@link RecommenderSnapshot} to request handlers.
 *
 * The first {@link #publish} opens a one-time readiness barrier; later publishes
 * swap the reference atomically, so in-flight requests keep the snapshot they started with.
 */
public final class SnapshotHolder implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SnapshotHolder.class);

    private final AtomicReference<RecommenderSnapshot> current = new AtomicReference<>();
    private final CountDownLatch ready = new CountDownLatch(1);

    public SnapshotHolder() {
    }

    public SnapshotHolder(RecommenderSnapshot initial) {
        publish(initial);
    }

    /**
     * Makes the snapshot visible to new requests.
     *
     * @return the replaced snapshot, if any. It is not closed here because in-flight
     *         requests may still use it; the caller closes it once they have drained.
     */
    public Optional<RecommenderSnapshot> publish(RecommenderSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        RecommenderSnapshot previous = current.getAndSet(snapshot);
        ready.countDown();
        log.info("Published recommender snapshot (mode={}, customers={}, catalog={})",
                snapshot.engine().mode(), snapshot.engine().customers().size(), snapshot.engine().catalogSize());
        return Optional.ofNullable(previous);
    }

    public boolean isReady() {
        return ready.getCount() == 0;
    }

    /**
     * Blocks until the first snapshot is published or the timeout elapses.
     *
     * @return true if ready
     */
    public boolean awaitReady(Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout must not be null");
        return ready.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * @throws IllegalStateException if nothing has been published yet
     */
    public RecommenderSnapshot current() {
        RecommenderSnapshot snapshot = current.get();
        if (snapshot == null) {
            throw new IllegalStateException("Recommender is not initialized yet");
        }
        return snapshot;
    }

    @Override
    public void close() {
        RecommenderSnapshot snapshot = current.get();
        if (snapshot != null) {
            snapshot.close();
        }
    }
}
