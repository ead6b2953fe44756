/*
 * Copyright (c) 2014-2022 Dell Inc. or its subsidiaries. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.mediabridge.sync.retry;

import com.mediabridge.sync.config.SyncOptions;

import java.util.Random;

/**
 * Backoff and timeout settings for one kind of export. The delay before retry {@code n} (0-based) is
 * {@code min(base * 2^n, max)} plus a random jitter of up to 25% of that value.
 */
public class RetryPolicy {
    public static final long DEFAULT_TICK_MS = 1000;
    public static final double MAX_JITTER = 0.25;

    public static RetryPolicy fromOptions(SyncOptions options) {
        return new RetryPolicy(options.getRetryAttempts(), options.getRetryBaseDelayMs(), options.getRetryMaxDelayMs(),
                options.getRequestTimeoutSeconds() * 1000L, options.getSlowFetchTimeoutMultiplier(), DEFAULT_TICK_MS);
    }

    private final int maxRetries;
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final long timeoutMs;
    private final double timeoutMultiplier;
    private final long tickMs;
    private final Random random = new Random();

    public RetryPolicy(int maxRetries, long baseDelayMs, long maxDelayMs, long timeoutMs, double timeoutMultiplier,
                       long tickMs) {
        this.maxRetries = Math.max(0, maxRetries);
        this.baseDelayMs = Math.max(0, baseDelayMs);
        this.maxDelayMs = Math.max(this.baseDelayMs, maxDelayMs);
        this.timeoutMs = timeoutMs;
        this.timeoutMultiplier = timeoutMultiplier;
        this.tickMs = Math.max(1, tickMs);
    }

    /**
     * The capped exponential delay before retry number {@code attempt}, without jitter
     */
    public long baseDelayFor(int attempt) {
        double delay = baseDelayMs * Math.pow(2, attempt);
        return (long) Math.min(delay, maxDelayMs);
    }

    public long delayFor(int attempt) {
        long delay = baseDelayFor(attempt);
        long jitter;
        synchronized (random) {
            jitter = (long) (delay * MAX_JITTER * random.nextDouble());
        }
        return delay + jitter;
    }

    /**
     * timeout in effect once a slow, still-progressing transfer has been detected
     */
    public long extendedTimeoutMs() {
        return (long) (timeoutMs * timeoutMultiplier);
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public int getMaxAttempts() {
        return maxRetries + 1;
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public double getTimeoutMultiplier() {
        return timeoutMultiplier;
    }

    public long getTickMs() {
        return tickMs;
    }
}
