package com.ttlcache.core;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Depoyu en fazla {@code batchSize} girdilik parçalar halinde tarayan süpürme
 * stratejisidir. Bir parçada süresi dolan girdilerin oranı
 * {@code continueRatio} değerinin altında kalırsa geçiş biter; aksi halde kilit
 * kısa süreliğine bırakılır, bekleyen okuma/yazma işlemlerine sıra verilir ve
 * yeni bir parçayla devam edilir. Böylece kilidin tek seferde tutulduğu süre
 * tablonun boyutundan bağımsız olarak yaklaşık bir parça ile sınırlı kalır.
 * <p>
 * Taranıp hayatta kalan girdiler tarama sırasının sonuna taşınır; sonraki
 * parça ve sonraki geçiş henüz bakılmamış girdilerden başlar.
 * Depo {@code batchSize} veya daha az girdi içeriyorsa
 * {@link ExhaustiveExpirationStrategy} davranışına düşülür.
 */
public final class BoundedBatchExpirationStrategy implements ExpirationStrategy
{
    public static final int DEFAULT_BATCH_SIZE = 1000;
    public static final double DEFAULT_CONTINUE_RATIO = 0.2;
    static final double MIN_CONTINUE_RATIO = 0.01;

    private final int batchSize;
    private final double continueRatio;

    public BoundedBatchExpirationStrategy() {
        this(DEFAULT_BATCH_SIZE, DEFAULT_CONTINUE_RATIO);
    }

    // batchSize < 1 -> 1; continueRatio <= 0 (or NaN) -> 0.01, > 1 -> 1
    public BoundedBatchExpirationStrategy(int batchSize, double continueRatio) {
        this.batchSize = Math.max(1, batchSize);
        if (!(continueRatio > 0.0)) {
            this.continueRatio = MIN_CONTINUE_RATIO;
        } else {
            this.continueRatio = Math.min(1.0, continueRatio);
        }
    }

    public int batchSize() { return batchSize; }
    public double continueRatio() { return continueRatio; }

    @Override
    public <V> int expire(EntryStore<V> store) {
        if (batchSize >= store.size()) {
            return ExhaustiveExpirationStrategy.expireAll(store);
        }
        int removed = 0;
        while (true) {
            Batch batch = expireBatch(store, store.now());
            removed += batch.expired();
            if (batch.ratio() < continueRatio) {
                return removed;
            }
            if (!store.yieldLock()) {
                return removed;
            }
        }
    }

    private <V> Batch expireBatch(EntryStore<V> store, long now) {
        int scanned = 0;
        int expired = 0;
        List<String> survivors = new ArrayList<>(Math.min(batchSize, store.size()));
        Iterator<Map.Entry<String, CacheEntry<V>>> it = store.iterator();
        while (scanned < batchSize && it.hasNext()) {
            Map.Entry<String, CacheEntry<V>> e = it.next();
            scanned++;
            if (e.getValue().isExpired(now)) {
                it.remove();
                expired++;
            } else {
                survivors.add(e.getKey());
            }
        }
        for (String key : survivors) {
            store.requeue(key);
        }
        return new Batch(scanned, expired);
    }

    @Override
    public String toString() {
        return "BoundedBatchExpirationStrategy{batchSize=" + batchSize + ", continueRatio=" + continueRatio + '}';
    }

    private record Batch(int scanned, int expired) {
        double ratio() {
            return scanned == 0 ? 0.0 : (double) expired / scanned;
        }
    }
}
