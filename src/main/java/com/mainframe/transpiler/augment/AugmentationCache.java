package com.mainframe.transpiler.augment;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import com.mainframe.transpiler.diagnostics.TranspilerException;

/**
 * Answers already obtained for a snippet, keyed by the SHA-256 of its text and shared by every
 * program of a run. An entry older than the TTL is treated as absent on read and dropped on the
 * next put.
 */
public class AugmentationCache {

    private final Map<String, Entry> entries = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Duration ttl;
    private final Clock clock;

    public AugmentationCache(Duration ttl) {
        this(ttl, Clock.systemUTC());
    }

    public AugmentationCache(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    public Optional<AugmentationResult> get(String snippet) {
        String key = key(snippet);
        Instant now = clock.instant();
        lock.readLock().lock();
        try {
            Entry entry = entries.get(key);
            if (entry == null || entry.isExpired(now, ttl)) {
                return Optional.empty();
            }
            return Optional.of(entry.result);
        } finally {
            lock.readLock().unlock();
        }
    }

    public void put(String snippet, AugmentationResult result) {
        String key = key(snippet);
        Instant now = clock.instant();
        lock.writeLock().lock();
        try {
            evictExpired(now);
            entries.put(key, new Entry(result, now));
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private void evictExpired(Instant now) {
        Iterator<Entry> it = entries.values().iterator();
        while (it.hasNext()) {
            if (it.next().isExpired(now, ttl)) {
                it.remove();
            }
        }
    }

    static String key(String snippet) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] hash = md.digest(snippet.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new TranspilerException("SHA-256 is not available", e);
        }
    }

    private static final class Entry {
        private final AugmentationResult result;
        private final Instant storedAt;

        private Entry(AugmentationResult result, Instant storedAt) {
            this.result = result;
            this.storedAt = storedAt;
        }

        private boolean isExpired(Instant now, Duration ttl) {
            return !storedAt.plus(ttl).isAfter(now);
        }
    }
}
