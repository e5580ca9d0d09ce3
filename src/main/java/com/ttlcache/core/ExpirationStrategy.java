package com.ttlcache.core;

/**
 * Abstraction for the active expiration pass run by the background sweeper.
 * Implementations decide how much of the store is scanned per pass; the
 * expiry decision itself always comes from {@link CacheEntry#isExpired(long)}.
 */
public interface ExpirationStrategy
{
    /**
     * Depodaki süresi dolmuş girdilerin bir kısmını ya da tamamını siler.
     * Kilit tutulurken çağrılır ve kilit tutulurken dönmelidir; adımlar
     * arasında {@link EntryStore#yieldLock()} ile kilit bırakılabilir, depo
     * bu arada kapandıysa geçiş hemen bitmelidir.
     *
     * @return bu geçişte silinen girdi sayısı
     */
    <V> int expire(EntryStore<V> store);
}
