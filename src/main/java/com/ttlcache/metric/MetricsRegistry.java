package com.ttlcache.metric;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Önbelleğin sayaç ve zamanlayıcılarını isimleriyle tutar. Metrik ilk talepte
 * oluşturulur ve aynı isim her zaman aynı örneği döndürür. Okuma tarafı için
 * isme göre sıralı, değiştirilemez görünümler sunar; raporlar böylece her
 * turda aynı sırada çıkar.
 */
public final class MetricsRegistry {

    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();

    public Counter counter(String name) {
        return counters.computeIfAbsent(requireName(name), Counter::new);
    }

    public Timer timer(String name) {
        return timers.computeIfAbsent(requireName(name), Timer::new);
    }

    /** İsme göre sıralı zamanlayıcı listesi. */
    public List<Timer> timers() {
        return timers.values().stream()
                .sorted(Comparator.comparing(Timer::name))
                .toList();
    }

    /**
     * Sayaçların o anki değerlerini isme göre sıralı olarak döndürür. Dönen harita
     * bir kopyadır; sonraki artışlar ona yansımaz.
     */
    public Map<String, Long> counterValues() {
        Map<String, Long> values = new TreeMap<>();
        counters.forEach((name, counter) -> values.put(name, counter.get()));
        return values;
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("metric name must not be blank");
        }
        return name;
    }
}
