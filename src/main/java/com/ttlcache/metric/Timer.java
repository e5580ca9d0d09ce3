package com.ttlcache.metric;

import java.util.Arrays;
import java.util.concurrent.atomic.LongAdder;

/**
 * Süpürme geçişleri gibi işlemlerin sürelerini toplayan zamanlayıcıdır. Sabit
 * boyutlu dairesel bir örnek havuzunda son ölçümleri tutar; p50/p95 değerleri
 * yalnızca gerçekten kaydedilmiş örneklerden hesaplanır.
 */
public final class Timer
{
    private final String name;
    private final LongAdder count = new LongAdder();
    private final LongAdder totalNs = new LongAdder();
    private long minNs = Long.MAX_VALUE;
    private long maxNs = Long.MIN_VALUE;

    private final long[] reservoir;
    private int next;
    private int filled;

    public Timer(String name) { this(name, 1024); }
    public Timer(String name, int reservoirSize) {
        this.name = name;
        this.reservoir = new long[Math.max(128, reservoirSize)];
    }

    public void record(long durationNs)
    {
        count.increment();
        totalNs.add(durationNs);
        synchronized (reservoir) {
            if (durationNs < minNs) minNs = durationNs;
            if (durationNs > maxNs) maxNs = durationNs;
            reservoir[next] = durationNs;
            next = (next + 1) % reservoir.length;
            if (filled < reservoir.length) filled++;
        }
    }

    public String name() { return name; }

    public Sample snapshot() {
        long c = count.sum();
        long t = totalNs.sum();
        double avg = c == 0 ? 0.0 : (double) t / c;

        long[] copy;
        long min, max;
        synchronized (reservoir) {
            copy = Arrays.copyOf(reservoir, filled);
            min = filled == 0 ? 0 : minNs;
            max = filled == 0 ? 0 : maxNs;
        }
        Arrays.sort(copy);
        long p50 = percentile(copy, 0.50);
        long p95 = percentile(copy, 0.95);

        return new Sample(name, c, t, avg, min, max, p50, p95);
    }

    private static long percentile(long[] sorted, double q) {
        if (sorted.length == 0) return 0;
        return sorted[(int) (q * (sorted.length - 1))];
    }

    /**
     * Anlık zamanlayıcı değerlerini taşıyan değişmez kayıttır.
     */
    public record Sample(String name, long count, long totalNs, double avgNs,
                         long minNs, long maxNs, long p50Ns, long p95Ns) {}
}
