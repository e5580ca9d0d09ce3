package com.ttlcache.core;

import org.jboss.logging.Logger;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Tek bir {@link TtlCache} örneği için aktif süre dolumunu çalıştıran arka plan
 * görevidir. İlk yazmada başlatılır, her {@code interval} süresinde ya da
 * kapatma sinyaliyle uyanır ve süpürme işini önbelleğe devreder. Önbellek
 * kapandığında veya depo boşaldığında kendiliğinden sonlanır; hata fırlatarak
 * çıkmaz.
 * <p>
 * Uyandırma sinyali tek kapasiteli bir kuyruktur: görev o an beklemiyorsa ve
 * yuva zaten doluysa yeni sinyal düşürülür.
 */
final class Sweeper implements Runnable
{
    private static final Logger LOG = Logger.getLogger(Sweeper.class);

    enum State { IDLE, WAITING, SWEEPING, TERMINATED }

    private final TtlCache<?> cache;
    private final long intervalMillis;
    private final BlockingQueue<Boolean> wakeSignal = new ArrayBlockingQueue<>(1);
    private volatile State state = State.IDLE;

    Sweeper(TtlCache<?> cache, long intervalMillis) {
        this.cache = cache;
        this.intervalMillis = intervalMillis;
    }

    State state() {
        return state;
    }

    /** Non-blocking; dropped when a wake-up is already pending. */
    void wake() {
        wakeSignal.offer(Boolean.TRUE);
    }

    @Override
    public void run() {
        try {
            while (true) {
                state = State.WAITING;
                wakeSignal.poll(intervalMillis, TimeUnit.MILLISECONDS);
                state = State.SWEEPING;
                if (!cache.sweep(this)) {
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.debug("Sweeper interrupted, stopping");
            cache.detach(this);
        } catch (RuntimeException e) {
            LOG.error("Expiration pass failed, sweeper stopped until the next write", e);
            cache.detach(this);
        } finally {
            state = State.TERMINATED;
        }
    }
}
