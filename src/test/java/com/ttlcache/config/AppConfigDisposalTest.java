package com.ttlcache.config;

import com.ttlcache.core.TtlCache;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigDisposalTest {

    private final AppConfig config = new AppConfig(null);

    // Bu test kapatma sırasında önbelleğin kapatıldığını doğrular.
    @Test
    void disposerClosesOpenCache() {
        TtlCache<Object> cache = TtlCache.builder().build();
        cache.setEx("k", "v", Duration.ofSeconds(30));

        config.disposeTtlCache(cache);

        assertTrue(cache.isClosed());
    }

    // Bu test uygulama kodu önbelleği önceden kapattıysa kapatıcının hata fırlatmadığını gösterir.
    @Test
    void disposerToleratesAlreadyClosedCache() {
        TtlCache<Object> cache = TtlCache.builder().build();
        cache.close();

        assertDoesNotThrow(() -> config.disposeTtlCache(cache));
        assertTrue(cache.isClosed());
    }
}
