package com.ttlcache.core;

/**
 * Thrown by {@link TtlCache#close()} when the cache has already been closed.
 */
public final class AlreadyClosedException extends IllegalStateException
{
    private static final long serialVersionUID = 1L;

    public AlreadyClosedException() {
        super("cache: already closed");
    }
}
