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

package dev.mars.netdrive.transfer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class ProgressTrackerTest {

    private MutableClock clock;
    private ProgressTracker tracker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        tracker = new ProgressTracker("item-1", 10_000, clock);
    }

    @Test
    void testUnknownBeforeFirstSample() {
        tracker.update(100, 10_000);

        assertEquals(0.01, tracker.getProgress(), 1e-9);
        assertEquals(0.0, tracker.getCurrentRateBytesPerSecond());
        assertEquals(-1, tracker.getEstimatedRemainingSeconds());
        assertEquals("Unknown", tracker.getEstimatedRemainingTime());
    }

    @Test
    void testRateAndEta() {
        clock.advance(Duration.ofSeconds(1));
        tracker.update(1000, 10_000);

        assertEquals(1000.0, tracker.getCurrentRateBytesPerSecond(), 1e-9);
        assertEquals(9, tracker.getEstimatedRemainingSeconds());
        assertEquals("9s", tracker.getEstimatedRemainingTime());
        assertEquals("1000 B/s", tracker.getFormattedSpeed());
    }

    @Test
    void testRateIsSmoothed() {
        clock.advance(Duration.ofSeconds(1));
        tracker.update(1000, 10_000);
        clock.advance(Duration.ofSeconds(1));
        tracker.update(3000, 10_000);

        // 0.7 * 1000 + 0.3 * 2000
        assertEquals(1300.0, tracker.getCurrentRateBytesPerSecond(), 1e-9);
        assertEquals(1500.0, tracker.getAverageRateBytesPerSecond(), 1e-9);
    }

    @Test
    void testFrequentUpdatesStillProduceSamples() {
        for (int i = 1; i <= 10; i++) {
            clock.advance(Duration.ofMillis(200));
            tracker.update(i * 200L, 10_000);
        }

        assertTrue(tracker.getCurrentRateBytesPerSecond() > 0);
    }

    @Test
    void testBackwardsUpdateIsIgnored() {
        tracker.update(500, 10_000);
        tracker.update(100, 10_000);

        assertEquals(500, tracker.getTransferredBytes());
    }

    @Test
    void testFormatting() {
        assertEquals("Unknown", ProgressTracker.formatDuration(-1));
        assertEquals("45s", ProgressTracker.formatDuration(45));
        assertEquals("3m 4s", ProgressTracker.formatDuration(184));
        assertEquals("1h 2m", ProgressTracker.formatDuration(3720));
        assertEquals("512 B/s", ProgressTracker.formatSpeed(512));
        assertEquals("1.5 KB/s", ProgressTracker.formatSpeed(1536));
        assertEquals("2.0 MB/s", ProgressTracker.formatSpeed(2 * 1024 * 1024));
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
