package com.ttlcache.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * {@code application.properties} içindeki "app" önekli değerleri tip güvenli
 * okumak için kullanılan konfigürasyon arayüzüdür. Önbelleğin süpürme aralığı,
 * süpürme stratejisi ve başlangıç kapasitesi ile metrik raporlama sıklığını
 * CDI bileşenlerine sağlar.
 */
@ConfigMapping(prefix = "app")
public interface AppProperties
{
    Cache cache();
    Metrics metrics();

    interface Cache {
        @WithDefault("10000")
        long sweepIntervalMillis();

        @WithDefault("BOUNDED_BATCH")
        String expirationStrategy();

        @WithDefault("1000")
        int batchSize();

        @WithDefault("0.2")
        double continueRatio();

        /** 0 leaves the entry store unsized. */
        @WithDefault("0")
        int initialCapacity();
    }

    interface Metrics {
        /** 0 disables periodic reporting. */
        @WithDefault("0")
        long reportIntervalSeconds();
    }
}
