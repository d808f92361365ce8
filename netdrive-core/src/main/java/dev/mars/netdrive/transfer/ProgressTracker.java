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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * Tracks progress of one transfer item with rate calculation and ETA estimation.
 *
 * <p>The current rate is an exponential moving average over samples taken at
 * least one second apart. Fed from the queue's progress events, so updates
 * arrive from one thread at a time; reads may come from any thread.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ProgressTracker {

    private static final long MIN_SAMPLE_INTERVAL_MS = 1000;
    private static final double PREVIOUS_WEIGHT = 0.7;
    private static final double SAMPLE_WEIGHT = 0.3;

    private final String itemId;
    private final Clock clock;
    private final Instant startTime;

    private volatile long totalBytes;
    private volatile long transferredBytes;
    private volatile double currentRate;
    private volatile Instant lastUpdateTime;

    // rate sampling window, separate from the last update so frequent updates still produce samples
    private Instant lastSampleTime;
    private long lastSampleBytes;

    public ProgressTracker(String itemId, long totalBytes) {
        this(itemId, totalBytes, Clock.systemUTC());
    }

    public ProgressTracker(String itemId, long totalBytes, Clock clock) {
        this.itemId = itemId;
        this.clock = clock;
        this.totalBytes = totalBytes;
        this.startTime = clock.instant();
        this.lastUpdateTime = startTime;
        this.lastSampleTime = startTime;
    }

    public String getItemId() {
        return itemId;
    }

    public synchronized void update(long bytesTransferred, long total) {
        Instant now = clock.instant();
        if (total > 0) {
            this.totalBytes = total;
        }
        if (bytesTransferred < transferredBytes) {
            return;
        }
        this.transferredBytes = bytesTransferred;
        long sinceSampleMs = Duration.between(lastSampleTime, now).toMillis();
        if (sinceSampleMs >= MIN_SAMPLE_INTERVAL_MS) {
            long bytesDiff = bytesTransferred - lastSampleBytes;
            double sampleRate = (double) bytesDiff / sinceSampleMs * 1000.0;
            currentRate = currentRate == 0.0 ? sampleRate : currentRate * PREVIOUS_WEIGHT + sampleRate * SAMPLE_WEIGHT;
            lastSampleTime = now;
            lastSampleBytes = bytesTransferred;
        }
        this.lastUpdateTime = now;
    }

    public long getTotalBytes() {
        return totalBytes;
    }

    public long getTransferredBytes() {
        return transferredBytes;
    }

    public double getProgress() {
        long total = totalBytes;
        if (total <= 0) {
            return 0.0;
        }
        return Math.min(1.0, (double) transferredBytes / total);
    }

    public double getCurrentRateBytesPerSecond() {
        return currentRate;
    }

    public double getAverageRateBytesPerSecond() {
        long elapsedMs = Duration.between(startTime, clock.instant()).toMillis();
        if (elapsedMs <= 0) {
            return 0.0;
        }
        return (double) transferredBytes / elapsedMs * 1000.0;
    }

    /**
     * @return seconds remaining at the current rate, or -1 when unknown
     */
    public long getEstimatedRemainingSeconds() {
        long total = totalBytes;
        long transferred = transferredBytes;
        double rate = currentRate;
        if (total <= 0 || transferred <= 0 || rate <= 0) {
            return -1;
        }
        return (long) (Math.max(0, total - transferred) / rate);
    }

    public String getEstimatedRemainingTime() {
        return formatDuration(getEstimatedRemainingSeconds());
    }

    public String getFormattedSpeed() {
        return formatSpeed(currentRate);
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getLastUpdateTime() {
        return lastUpdateTime;
    }

    static String formatDuration(long seconds) {
        if (seconds < 0) {
            return "Unknown";
        }
        if (seconds < 60) {
            return seconds + "s";
        } else if (seconds < 3600) {
            return (seconds / 60) + "m " + (seconds % 60) + "s";
        } else {
            return (seconds / 3600) + "h " + ((seconds % 3600) / 60) + "m";
        }
    }

    static String formatSpeed(double bytesPerSecond) {
        if (bytesPerSecond >= 1024.0 * 1024.0) {
            return String.format(Locale.ROOT, "%.1f MB/s", bytesPerSecond / (1024.0 * 1024.0));
        } else if (bytesPerSecond >= 1024.0) {
            return String.format(Locale.ROOT, "%.1f KB/s", bytesPerSecond / 1024.0);
        }
        return String.format(Locale.ROOT, "%.0f B/s", bytesPerSecond);
    }

    @Override
    public String toString() {
        return String.format("ProgressTracker{itemId='%s', progress=%.1f%%, speed=%s, ETA=%s}",
                itemId, getProgress() * 100, getFormattedSpeed(), getEstimatedRemainingTime());
    }
}
