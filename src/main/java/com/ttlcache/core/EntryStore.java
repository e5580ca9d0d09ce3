package com.ttlcache.core;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Anahtar ile {@link CacheEntry} arasındaki eşlemeyi ve bu eşlemeyi koruyan tek
 * kilidi barındıran depo yapısıdır. Kendi başına süre dolumu kararı vermez;
 * önbellek cephesi ve {@link ExpirationStrategy} uygulamaları bu deponun
 * üzerine kilit altında çalışır.
 * <p>
 * {@link #now()}, {@link #size()}, {@link #iterator()}, {@link #requeue(String)}
 * ve {@link #yieldLock()} yalnızca kilit tutulurken çağrılmalıdır.
 */
public final class EntryStore<V>
{
    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    // fair, so a waiting get/set really gets the lock when a sweep yields it
    private final ReentrantLock lock = new ReentrantLock(true);
    private final Clock clock;
    private Map<String, CacheEntry<V>> entries;
    private boolean closed;

    EntryStore(int initialCapacity, Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.entries = initialCapacity > 0 ? new LinkedHashMap<>(initialCapacity) : new LinkedHashMap<>();
    }

    void lock() { lock.lock(); }
    void unlock() { lock.unlock(); }
    boolean isHeldByCurrentThread() { return lock.isHeldByCurrentThread(); }
    boolean hasQueuedThreads() { return lock.hasQueuedThreads(); }

    CacheEntry<V> get(String key) {
        return entries == null ? null : entries.get(key);
    }

    void put(String key, CacheEntry<V> entry) {
        if (entries != null) entries.put(key, entry);
    }

    CacheEntry<V> remove(String key) {
        return entries == null ? null : entries.remove(key);
    }

    // closes and drops every entry in one critical section; returns the dropped count
    int discard() {
        int discarded = size();
        closed = true;
        entries = null;
        return discarded;
    }

    // epoch nanos
    public long now() {
        Instant instant = clock.instant();
        try {
            return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), NANOS_PER_SECOND), instant.getNano());
        } catch (ArithmeticException e) {
            return instant.getEpochSecond() < 0 ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
    }

    public int size() {
        return entries == null ? 0 : entries.size();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Girdileri tarama sırasıyla dolaşır. {@code remove()} desteklenir; iterator
     * {@link #yieldLock()} çağrısından sonra kullanılmamalıdır.
     */
    public Iterator<Map.Entry<String, CacheEntry<V>>> iterator() {
        if (entries == null) {
            return Collections.emptyIterator();
        }
        return entries.entrySet().iterator();
    }

    /**
     * Girdiyi tarama sırasının sonuna taşır; sonraki kısmi tarama henüz
     * bakılmamış girdilerden başlar.
     */
    public void requeue(String key) {
        if (entries == null) return;
        CacheEntry<V> entry = entries.remove(key);
        if (entry != null) {
            entries.put(key, entry);
        }
    }

    /**
     * Kilidi bırakır, bekleyen çağıranlara sıra verip kilidi geri alır.
     *
     * @return kilit bırakılmışken depo kapatıldıysa {@code false}
     */
    public boolean yieldLock() {
        lock.unlock();
        try {
            Thread.yield();
        } finally {
            lock.lock();
        }
        return !closed;
    }
}
