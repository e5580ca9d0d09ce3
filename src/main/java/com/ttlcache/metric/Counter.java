package com.ttlcache.metric;

import java.util.concurrent.atomic.LongAdder;

/**
 * Önbellek olaylarını (isabet, ıskalama, süre dolumu, süpürme) sayan
 * thread-safe sayaçtır. Süpürücü ile çağıran thread'ler aynı sayaca aynı anda
 * yazabildiği için {@link LongAdder} kullanır.
 */
public final class Counter
{
    private final String name;
    private final LongAdder value = new LongAdder();

    public Counter(String name) { this.name = name; }

    public void inc() { value.increment(); }
    public void add(long delta) { value.add(delta); }
    public long get() { return value.sum(); }
    public String name() { return name; }
}
