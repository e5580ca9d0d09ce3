package com.ttlcache.config;

import com.ttlcache.core.AlreadyClosedException;
import com.ttlcache.core.ExpirationStrategy;
import com.ttlcache.core.ExpirationStrategyType;
import com.ttlcache.core.TtlCache;
import com.ttlcache.metric.MetricsRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.time.Duration;

/**
 * CDI tarafından yönetilen bu yapılandırma sınıfı, {@link AppProperties}
 * üzerinden okunan değerlerle uygulama genelinde paylaşılan önbelleği ve metrik
 * kayıt defterini üretir. Konteyner kapanırken önbelleği kapatarak süpürücünün
 * sonlanmasını sağlar.
 */
@ApplicationScoped
public class AppConfig {

    private static final Logger LOG = Logger.getLogger(AppConfig.class);

    private final AppProperties properties;

    @Inject
    public AppConfig(AppProperties properties) {
        this.properties = properties;
    }

    @Produces
    @Singleton
    public MetricsRegistry metricsRegistry() {
        return new MetricsRegistry();
    }

    @Produces
    @Singleton
    public TtlCache<Object> ttlCache(MetricsRegistry metrics) {
        var cacheProps = properties.cache();
        ExpirationStrategy strategy = ExpirationStrategyType.fromConfig(cacheProps.expirationStrategy())
                .create(cacheProps.batchSize(), cacheProps.continueRatio());
        TtlCache<Object> cache = TtlCache.builder()
                .sweepInterval(Duration.ofMillis(cacheProps.sweepIntervalMillis()))
                .expirationStrategy(strategy)
                .initialCapacity(cacheProps.initialCapacity())
                .metrics(metrics)
                .build();
        LOG.infof("TTL cache ready: sweepInterval=%s strategy=%s initialCapacity=%d",
                cache.sweepInterval(), strategy, cacheProps.initialCapacity());
        return cache;
    }

    void disposeTtlCache(@Disposes TtlCache<Object> cache) {
        try {
            cache.close();
        } catch (AlreadyClosedException e) {
            // closed by application code before shutdown
            LOG.debug("TTL cache was already closed before disposal");
        }
    }
}
