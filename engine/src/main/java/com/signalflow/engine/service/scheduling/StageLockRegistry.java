package com.signalflow.engine.service.scheduling;

import com.signalflow.engine.model.Venue;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Semaphore;

/**
 * At most one running instance per (stage, venue). Acquisition never waits: a caller
 * that finds the slot taken is expected to skip that venue for this invocation.
 * Permits are not reentrant, so a nested call on the same thread is refused as well.
 */
@Component
public class StageLockRegistry {

    private final ConcurrentMap<Key, Semaphore> permits = new ConcurrentHashMap<>();

    public Optional<StageLock> tryAcquire(Stage stage, Venue venue) {
        Key key = new Key(stage, venue);
        Semaphore semaphore = permits.computeIfAbsent(key, k -> new Semaphore(1));
        if (!semaphore.tryAcquire()) {
            return Optional.empty();
        }
        return Optional.of(new StageLock(key, semaphore));
    }

    public boolean isHeld(Stage stage, Venue venue) {
        Semaphore semaphore = permits.get(new Key(stage, venue));
        return semaphore != null && semaphore.availablePermits() == 0;
    }

    private record Key(Stage stage, Venue venue) {}

    public static final class StageLock implements AutoCloseable {
        private final Key key;
        private final Semaphore semaphore;
        private boolean released;

        private StageLock(Key key, Semaphore semaphore) {
            this.key = key;
            this.semaphore = semaphore;
        }

        public Stage stage() {
            return key.stage();
        }

        public Venue venue() {
            return key.venue();
        }

        @Override
        public synchronized void close() {
            if (!released) {
                released = true;
                semaphore.release();
            }
        }
    }
}
