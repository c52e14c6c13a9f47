package org.deepsymmetry.lxmonitor.data;

import org.apiguardian.api.API;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Holds the most recent frame of DMX data received for each universe. There is no history: each frame simply
 * replaces the one before it, whichever source sent it.
 */
@API(status = API.Status.STABLE)
public class DmxStore {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<Integer, byte[]> frames = new TreeMap<>();

    /**
     * Record a newly received frame.
     *
     * @param universe the universe the frame belongs to
     * @param data the slot values; a copy is kept, so the caller may reuse the array
     */
    @API(status = API.Status.STABLE)
    public void update(int universe, byte[] data) {
        final byte[] copy = data.clone();
        lock.writeLock().lock();
        try {
            frames.put(universe, copy);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Get the latest frame for a universe.
     *
     * @param universe the universe of interest
     *
     * @return a copy of the frame, or {@code null} if none has been received
     */
    @API(status = API.Status.STABLE)
    public byte[] get(int universe) {
        lock.readLock().lock();
        try {
            final byte[] frame = frames.get(universe);
            return (frame == null) ? null : frame.clone();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Get the latest frame of every universe seen.
     *
     * @return copies of the frames, keyed and ordered by universe
     */
    @API(status = API.Status.STABLE)
    public Map<Integer, byte[]> getAll() {
        final Map<Integer, byte[]> result = new TreeMap<>();
        lock.readLock().lock();
        try {
            for (Map.Entry<Integer, byte[]> entry : frames.entrySet()) {
                result.put(entry.getKey(), entry.getValue().clone());
            }
        } finally {
            lock.readLock().unlock();
        }
        return Collections.unmodifiableMap(result);
    }

    /**
     * Discard every frame.
     */
    @API(status = API.Status.STABLE)
    public void clear() {
        lock.writeLock().lock();
        try {
            frames.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
