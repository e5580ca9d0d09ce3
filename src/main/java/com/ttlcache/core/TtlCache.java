package com.ttlcache.core;

import com.ttlcache.metric.Counter;
import com.ttlcache.metric.MetricsRegistry;
import com.ttlcache.metric.Timer;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Her değerin bir son kullanma zamanı taşıdığı, süreç içi anahtar-değer
 * önbelleğidir. Tüm işlemler tek bir kilit altında sıralanır; okumalar süresi
 * dolmuş girdiyi anında siler, arka plandaki {@link Sweeper} ise seçilen
 * {@link ExpirationStrategy} ile terk edilmiş anahtarları periyodik olarak
 * temizler. Süpürücü ilk yazmada başlar, depo boşaldığında ya da önbellek
 * kapatıldığında durur.
 */
public final class TtlCache<V> implements AutoCloseable
{
    private static final Logger LOG = Logger.getLogger(TtlCache.class);

    /** Anahtar yoksa ya da süresi dolmuşsa {@link #ttl(String)} bunu döndürür. */
    public static final Duration NO_TTL = Duration.ofMillis(-1);
    public static final Duration NO_EXPIRY = ChronoUnit.FOREVER.getDuration();
    public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofSeconds(10);

    private final EntryStore<V> store;
    private final Duration sweepInterval;
    private final ExpirationStrategy strategy;
    private final ThreadFactory sweeperFactory;

    private final Counter hits, misses, lazyExpired, sweptExpired, sweeps; // nullable
    private final Timer tSweep;                                             // nullable

    private Sweeper sweeper; // guarded by store lock, null while no sweeper is active

    private TtlCache(Duration sweepInterval, ExpirationStrategy strategy, int initialCapacity,
                     Clock clock, ThreadFactory sweeperFactory, MetricsRegistry metrics) {
        this.store = new EntryStore<>(initialCapacity, clock);
        this.sweepInterval = sweepInterval;
        this.strategy = strategy;
        this.sweeperFactory = sweeperFactory;
        if (metrics != null) {
            this.hits = metrics.counter("cache_hits");
            this.misses = metrics.counter("cache_misses");
            this.lazyExpired = metrics.counter("cache_expired_lazy");
            this.sweptExpired = metrics.counter("cache_expired_swept");
            this.sweeps = metrics.counter("cache_sweeps");
            this.tSweep = metrics.timer("cache_sweep");
        } else {
            this.hits = this.misses = this.lazyExpired = this.sweptExpired = this.sweeps = null;
            this.tSweep = null;
        }
    }

    public static <V> Builder<V> builder() { return new Builder<>(); }

    /**
     * Önbelleğin süpürme aralığı, süpürme stratejisi ve başlangıç kapasitesi
     * gibi kurulum seçeneklerini toplayan akıcı yapılandırma sınıfıdır.
     * Verilmeyen her seçenek için varsayılan değer kullanılır.
     */
    public static final class Builder<V>
    {
        private Duration sweepInterval = DEFAULT_SWEEP_INTERVAL;
        private ExpirationStrategy strategy = new BoundedBatchExpirationStrategy();
        private int initialCapacity;
        private Clock clock = Clock.systemUTC();
        private ThreadFactory sweeperFactory = new SweeperThreadFactory();
        private MetricsRegistry metrics;

        private Builder() {}

        // null, zero or negative keeps the default
        public Builder<V> sweepInterval(Duration d) {
            if (d != null && !d.isZero() && !d.isNegative()) this.sweepInterval = d;
            return this;
        }
        public Builder<V> expirationStrategy(ExpirationStrategy s) { this.strategy = Objects.requireNonNull(s, "strategy"); return this; }
        public Builder<V> initialCapacity(int n) { this.initialCapacity = n; return this; }
        public Builder<V> clock(Clock c) { this.clock = Objects.requireNonNull(c, "clock"); return this; }
        public Builder<V> sweeperFactory(ThreadFactory f) { this.sweeperFactory = Objects.requireNonNull(f, "sweeperFactory"); return this; }
        public Builder<V> metrics(MetricsRegistry m) { this.metrics = m; return this; }
        public TtlCache<V> build() {
            return new TtlCache<>(sweepInterval, strategy, initialCapacity, clock, sweeperFactory, metrics);
        }
    }

    public V get(String key) {
        Objects.requireNonNull(key, "key");
        store.lock();
        try {
            CacheEntry<V> entry = store.get(key);
            if (entry == null) {
                inc(misses);
                return null;
            }
            if (entry.isExpired(store.now())) {
                store.remove(key);
                inc(lazyExpired);
                inc(misses);
                return null;
            }
            inc(hits);
            return entry.value();
        } finally {
            store.unlock();
        }
    }

    /**
     * Değeri {@code ttl} süresince saklar. Boş değer, sıfır/negatif ttl ve
     * kapatılmış önbelleğe yazma sessizce yok sayılır.
     */
    public void setEx(String key, V value, Duration ttl) {
        Objects.requireNonNull(key, "key");
        if (isEmptyPayload(value) || ttl == null || ttl.isZero() || ttl.isNegative()) {
            return;
        }
        store.lock();
        try {
            if (store.isClosed()) {
                return;
            }
            store.put(key, new CacheEntry<>(value, computeExpireAt(ttl, store.now())));
            if (sweeper == null) {
                launchSweeper();
            }
        } finally {
            store.unlock();
        }
    }

    public Duration ttl(String key) {
        Objects.requireNonNull(key, "key");
        store.lock();
        try {
            CacheEntry<V> entry = store.get(key);
            if (entry == null) {
                return NO_TTL;
            }
            if (!entry.hasDeadline()) {
                return NO_EXPIRY;
            }
            long now = store.now();
            if (entry.isExpired(now)) {
                store.remove(key);
                inc(lazyExpired);
                return NO_TTL;
            }
            return Duration.ofNanos(entry.expireAtNanos() - now);
        } finally {
            store.unlock();
        }
    }

    // may count expired entries nobody has touched yet
    public int len() {
        store.lock();
        try {
            return store.size();
        } finally {
            store.unlock();
        }
    }

    public boolean isClosed() {
        store.lock();
        try {
            return store.isClosed();
        } finally {
            store.unlock();
        }
    }

    public boolean isSweeperRunning() {
        store.lock();
        try {
            return sweeper != null;
        } finally {
            store.unlock();
        }
    }

    public Duration sweepInterval() { return sweepInterval; }
    public ExpirationStrategy expirationStrategy() { return strategy; }

    /**
     * Önbelleği boşaltır ve sonraki yazmaları reddeder; bekleyen süpürücü
     * aralığını beklemeden uyandırılır.
     *
     * @throws AlreadyClosedException ilk çağrıdan sonraki her çağrıda
     */
    @Override
    public void close() {
        int discarded;
        store.lock();
        try {
            if (store.isClosed()) {
                throw new AlreadyClosedException();
            }
            discarded = store.discard();
            if (sweeper != null) {
                sweeper.wake();
            }
        } finally {
            store.unlock();
        }
        LOG.infof("Cache closed, %d entries discarded", discarded);
    }

    // false: cache closed or empty, sweeper detached
    boolean sweep(Sweeper current) {
        store.lock();
        try {
            if (sweeper != current) {
                return false;
            }
            if (store.isClosed() || store.size() == 0) {
                sweeper = null;
                LOG.debugf("Sweeper stopped, cache %s", store.isClosed() ? "closed" : "empty");
                return false;
            }
            long t0 = System.nanoTime();
            int removed = strategy.expire(store);
            long elapsed = System.nanoTime() - t0;
            inc(sweeps);
            if (sweptExpired != null) sweptExpired.add(removed);
            if (tSweep != null) tSweep.record(elapsed);
            LOG.debugf("Sweep removed %d expired entries, %d remain (%d µs)", removed, store.size(), elapsed / 1_000);
            return true;
        } finally {
            store.unlock();
        }
    }

    void detach(Sweeper current) {
        store.lock();
        try {
            if (sweeper == current) {
                sweeper = null;
            }
        } finally {
            store.unlock();
        }
    }

    Sweeper currentSweeper() {
        store.lock();
        try {
            return sweeper;
        } finally {
            store.unlock();
        }
    }

    EntryStore<V> store() {
        return store;
    }

    private void launchSweeper() {
        Sweeper next = new Sweeper(this, Math.max(1L, sweepInterval.toMillis()));
        Thread thread = sweeperFactory.newThread(next);
        if (thread == null) {
            LOG.error("Sweeper thread factory returned null, active expiration skipped until the next write");
            return;
        }
        try {
            thread.start();
        } catch (RuntimeException e) {
            LOG.error("Failed to start sweeper thread, active expiration skipped until the next write", e);
            return;
        }
        // the new thread blocks on the store lock until this write returns
        sweeper = next;
        LOG.debugf("Sweeper started with interval %s and %s", sweepInterval, strategy);
    }

    private static long computeExpireAt(Duration ttl, long now) {
        long nanos;
        try {
            nanos = ttl.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
        long expireAt = now + nanos;
        if (expireAt <= 0L) {
            return Long.MAX_VALUE;
        }
        return expireAt;
    }

    private static boolean isEmptyPayload(Object value) {
        if (value == null) return true;
        if (value instanceof CharSequence cs) return cs.length() == 0;
        if (value instanceof byte[] bytes) return bytes.length == 0;
        return false;
    }

    private static void inc(Counter counter) {
        if (counter != null) counter.inc();
    }

    private static final class SweeperThreadFactory implements ThreadFactory
    {
        private static final AtomicInteger COUNTER = new AtomicInteger(1);

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "ttl-cache-sweeper-" + COUNTER.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
