package com.ttlcache.core;

import java.util.Locale;

public enum ExpirationStrategyType
{
    EXHAUSTIVE {
        @Override
        public ExpirationStrategy create(int batchSize, double continueRatio)
        {
            return ExhaustiveExpirationStrategy.INSTANCE;
        }
    },
    BOUNDED_BATCH {
        @Override
        public ExpirationStrategy create(int batchSize, double continueRatio)
        {
            return new BoundedBatchExpirationStrategy(batchSize, continueRatio);
        }
    };

    /** Batch parameters are ignored by strategies that do not scan in batches. */
    public abstract ExpirationStrategy create(int batchSize, double continueRatio);

    public static ExpirationStrategyType fromConfig(String value)
    {
        if (value == null || value.isBlank()) return BOUNDED_BATCH;
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return ExpirationStrategyType.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown expiration strategy: " + value, ex);
        }
    }
}
