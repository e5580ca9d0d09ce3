package com.ttlcache.core;

/**
 * Önbellekte tutulan değeri ve varsa mutlak son kullanma zamanını taşıyan
 * değişmez kayıttır. Değer olduğu gibi saklanır, kopyalanmaz ve yorumlanmaz.
 *
 * @param expireAtNanos epoch nanos; <=0: no TTL
 */
public record CacheEntry<V>(V value, long expireAtNanos)
{
    /**
     * Tembel okuma yolu ile aktif süpürme yolunun ortak kullandığı tek süre
     * dolumu kararıdır: bitiş zamanı tanımlı ve {@code now} ondan kesin olarak
     * sonraysa girdi süresi dolmuş sayılır.
     */
    public boolean isExpired(long now) {
        return expireAtNanos > 0 && now > expireAtNanos;
    }

    public boolean hasDeadline() {
        return expireAtNanos > 0;
    }
}
