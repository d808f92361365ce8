package dev.mars.netdrive.transfer;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import dev.mars.netdrive.core.ErrorKind;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Decides whether a failed attempt is retried automatically and how long to back off.
 *
 * <p>Delay for the n-th retry is {@code baseDelay * 2^(n-1)}, capped at {@code maxDelay}.
 * Jitter is off unless a positive jitter ratio is given.</p>
 */
public final class RetryPolicy {

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double jitterRatio;

    public RetryPolicy(Duration baseDelay, Duration maxDelay) {
        this(baseDelay, maxDelay, 0.0);
    }

    public RetryPolicy(Duration baseDelay, Duration maxDelay, double jitterRatio) {
        this.baseDelay = Objects.requireNonNull(baseDelay, "baseDelay cannot be null");
        this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay cannot be null");
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("Retry delays cannot be negative");
        }
        if (jitterRatio < 0.0 || jitterRatio > 1.0) {
            throw new IllegalArgumentException("jitterRatio must be between 0 and 1");
        }
        this.jitterRatio = jitterRatio;
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(Duration.ofSeconds(1), Duration.ofSeconds(60));
    }

    /**
     * A failure qualifies for an automatic retry when its kind is transient and
     * the item still has budget left.
     */
    public boolean shouldRetry(ErrorKind kind, int retryCount, int maxRetries) {
        return kind != null && kind.isTransient() && retryCount < maxRetries;
    }

    /**
     * @param retryNumber the 1-based number of the retry about to be scheduled
     */
    public Duration delayFor(int retryNumber) {
        if (retryNumber < 1) {
            return Duration.ZERO;
        }
        long baseMs = baseDelay.toMillis();
        long capMs = maxDelay.toMillis();
        int shift = Math.min(retryNumber - 1, 30);
        long delayMs = baseMs > (capMs >> shift) ? capMs : Math.min(capMs, baseMs << shift);
        if (jitterRatio > 0.0 && delayMs > 0) {
            long spread = (long) (delayMs * jitterRatio);
            delayMs = Math.min(capMs, delayMs - spread + ThreadLocalRandom.current().nextLong(2 * spread + 1));
        }
        return Duration.ofMillis(delayMs);
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    @Override
    public String toString() {
        return "RetryPolicy{base=" + baseDelay.toMillis() + "ms, max=" + maxDelay.toMillis() + "ms}";
    }
}
