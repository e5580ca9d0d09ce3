package com.ttlcache;

import com.ttlcache.core.TtlCache;
import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * TTL önbellek servisinin giriş noktasıdır. Açılışta önbelleğin süpürme
 * ayarlarını loglar, ardından ana thread'i Quarkus kapanana kadar bekletir.
 * Kapanışta önbelleği {@code AppConfig} içindeki disposer kapatır.
 */
@QuarkusMain
public class TtlCacheApplication implements QuarkusApplication
{
    private static final Logger LOG = Logger.getLogger(TtlCacheApplication.class);

    @Inject
    TtlCache<Object> cache;

    @Override
    public int run(String... args)
    {
        LOG.infof("ttl-cache serving: sweepInterval=%s strategy=%s",
                cache.sweepInterval(), cache.expirationStrategy());
        Quarkus.waitForExit();
        LOG.infof("ttl-cache stopping with %d live entries", cache.len());
        return 0;
    }

    public static void main(String... args) {
        Quarkus.run(TtlCacheApplication.class, args);
    }
}
