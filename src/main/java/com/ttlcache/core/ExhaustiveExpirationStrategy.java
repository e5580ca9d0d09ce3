package com.ttlcache.core;

import java.util.Iterator;
import java.util.Map;

/**
 * Depodaki her girdiyi tek geçişte tarar ve taramanın başında alınan tek bir
 * "şimdi" anına göre süresi dolanları siler. Kilidi geçiş boyunca bırakmaz;
 * küçük tablolar için öngörülebilir, büyük tablolarda ise bütün çağıranları
 * tarama süresince bekletir.
 */
public final class ExhaustiveExpirationStrategy implements ExpirationStrategy
{
    public static final ExhaustiveExpirationStrategy INSTANCE = new ExhaustiveExpirationStrategy();

    private ExhaustiveExpirationStrategy() {
    }

    @Override
    public <V> int expire(EntryStore<V> store) {
        return expireAll(store);
    }

    static <V> int expireAll(EntryStore<V> store) {
        long now = store.now();
        int removed = 0;
        Iterator<Map.Entry<String, CacheEntry<V>>> it = store.iterator();
        while (it.hasNext()) {
            if (it.next().getValue().isExpired(now)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    @Override
    public String toString() {
        return "ExhaustiveExpirationStrategy";
    }
}
