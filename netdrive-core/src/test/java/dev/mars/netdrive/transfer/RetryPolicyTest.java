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

import dev.mars.netdrive.core.ErrorKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    private final RetryPolicy policy = new RetryPolicy(Duration.ofSeconds(1), Duration.ofSeconds(60));

    @Test
    void testExponentialBackoffIsCapped() {
        assertEquals(Duration.ofSeconds(1), policy.delayFor(1));
        assertEquals(Duration.ofSeconds(2), policy.delayFor(2));
        assertEquals(Duration.ofSeconds(4), policy.delayFor(3));
        assertEquals(Duration.ofSeconds(32), policy.delayFor(6));
        assertEquals(Duration.ofSeconds(60), policy.delayFor(7));
        assertEquals(Duration.ofSeconds(60), policy.delayFor(500));
        assertEquals(Duration.ZERO, policy.delayFor(0));
    }

    @ParameterizedTest
    @EnumSource(value = ErrorKind.class, names = {"CONNECTION", "TIMEOUT", "PROTOCOL"})
    void testTransientKindsAreRetried(ErrorKind kind) {
        assertTrue(policy.shouldRetry(kind, 0, 3));
        assertTrue(policy.shouldRetry(kind, 2, 3));
        assertFalse(policy.shouldRetry(kind, 3, 3));
    }

    @ParameterizedTest
    @EnumSource(value = ErrorKind.class, names = {"AUTHENTICATION", "IO", "INTEGRITY", "CANCELLED", "UNSUPPORTED_PROTOCOL"})
    void testPermanentKindsAreNotRetried(ErrorKind kind) {
        assertFalse(policy.shouldRetry(kind, 0, 3));
    }

    @Test
    void testJitterStaysWithinRatioAndCap() {
        RetryPolicy jittered = new RetryPolicy(Duration.ofMillis(1000), Duration.ofMillis(5000), 0.2);
        for (int i = 0; i < 200; i++) {
            long first = jittered.delayFor(1).toMillis();
            assertTrue(first >= 800 && first <= 1200, "delay out of range: " + first);
            assertTrue(jittered.delayFor(10).toMillis() <= 5000);
        }
    }

    @Test
    void testValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(Duration.ofSeconds(-1), Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(Duration.ofSeconds(1), Duration.ofSeconds(1), 1.5));
        assertEquals(Duration.ofSeconds(1), RetryPolicy.defaults().getBaseDelay());
    }
}
