package com.ttlcache.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class TtlCacheConcurrencyTest
{
    private static final int WRITERS = 8;
    private static final int READERS = 8;
    private static final int KEYS_PER_WRITER = 500;

    // Bu test eşzamanlı yazıcı ve okuyucuların kilitlenmeden tam değerler gördüğünü doğrular.
    @Test
    void concurrent_writers_and_readers_never_deadlock_or_tear() throws Exception
    {
        TtlCache<String> cache = TtlCache.<String>builder()
                .sweepInterval(Duration.ofMillis(1))
                .expirationStrategy(new BoundedBatchExpirationStrategy(16, 0.01))
                .build();
        ExecutorService pool = Executors.newFixedThreadPool(WRITERS + READERS);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger written = new AtomicInteger();
        AtomicInteger reads = new AtomicInteger();
        try
        {
            List<Future<?>> futures = new ArrayList<>();
            for (int w = 0; w < WRITERS; w++)
            {
                int writer = w;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < KEYS_PER_WRITER; i++)
                    {
                        String key = key(writer, i);
                        cache.setEx(key, payload(key), Duration.ofMinutes(10));
                        written.incrementAndGet();
                    }
                    return null;
                }));
            }
            for (int r = 0; r < READERS; r++)
            {
                int reader = r;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int round = 0; round < 2_000; round++)
                    {
                        String key = key(reader % WRITERS, round % KEYS_PER_WRITER);
                        String value = cache.get(key);
                        if (value != null)
                        {
                            assertEquals(payload(key), value);
                            reads.incrementAndGet();
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures)
            {
                f.get(30, TimeUnit.SECONDS);
            }

            assertEquals(WRITERS * KEYS_PER_WRITER, written.get());
            assertEquals(WRITERS * KEYS_PER_WRITER, cache.len());
            for (int w = 0; w < WRITERS; w++)
            {
                assertEquals(payload(key(w, 0)), cache.get(key(w, 0)));
            }
        }
        finally
        {
            pool.shutdownNow();
            cache.close();
        }
    }

    // Bu test kısa ömürlü girdilerle yoğun yazma sırasında süpürücünün tabloyu sonunda boşalttığını gösterir.
    @Test
    void sweeper_drains_short_lived_entries_under_load() throws Exception
    {
        TtlCache<String> cache = TtlCache.<String>builder()
                .sweepInterval(Duration.ofMillis(5))
                .expirationStrategy(new BoundedBatchExpirationStrategy(32, 0.2))
                .build();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try
        {
            List<Future<?>> futures = new ArrayList<>();
            for (int w = 0; w < 4; w++)
            {
                int writer = w;
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < 1_000; i++)
                    {
                        cache.setEx(key(writer, i), "v", Duration.ofMillis(5));
                        cache.get(key(writer, i / 2));
                    }
                }));
            }
            for (Future<?> f : futures)
            {
                f.get(30, TimeUnit.SECONDS);
            }

            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
            while (cache.isSweeperRunning() && System.nanoTime() < deadline)
            {
                TtlCacheTest.sleep(5);
            }
            assertFalse(cache.isSweeperRunning());
            assertEquals(0, cache.len());
        }
        finally
        {
            pool.shutdownNow();
            cache.close();
        }
    }

    private static String key(int writer, int index)
    {
        return "w" + writer + ":k" + index;
    }

    private static String payload(String key)
    {
        return "payload-for-" + key + "-" + "x".repeat(32);
    }
}
