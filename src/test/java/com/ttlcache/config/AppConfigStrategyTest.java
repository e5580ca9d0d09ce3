package com.ttlcache.config;

import com.ttlcache.core.ExhaustiveExpirationStrategy;
import com.ttlcache.core.TtlCache;
import io.quarkus.test.junit.QuarkusTest;
import io.quarkus.test.junit.QuarkusTestProfile;
import io.quarkus.test.junit.TestProfile;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

@QuarkusTest
@TestProfile(AppConfigStrategyTest.ExhaustiveProfile.class)
class AppConfigStrategyTest {

    @Inject
    TtlCache<Object> cache;

    @Inject
    AppProperties properties;

    @Nested
    class CustomStrategy {
        /**
         * Konfigürasyonda verilen strateji adı ve süpürme aralığı AppConfig tarafından önbelleğe aktarılır.
         */
        @Test
        void producesCacheWithConfiguredStrategyAndInterval() {
            assertSame(ExhaustiveExpirationStrategy.INSTANCE, cache.expirationStrategy());
            assertEquals(Duration.ofMillis(250), cache.sweepInterval());
            assertEquals("exhaustive", properties.cache().expirationStrategy());
        }
    }

    public static class ExhaustiveProfile implements QuarkusTestProfile {

        public ExhaustiveProfile() {
        }

        @Override
        public Map<String, String> getConfigOverrides() {
            return Map.of(
                    "app.cache.expiration-strategy", "exhaustive",
                    "app.cache.sweep-interval-millis", "250",
                    "app.cache.initial-capacity", "64"
            );
        }
    }
}
