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

package dev.mars.netdrive.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parameterized tests for TransferStatus transition validation.
 * Covers every (source, target) pair.
 */
class TransferStatusTransitionTest {

    private static final EnumSet<TransferStatus> FROM_QUEUED =
            EnumSet.of(TransferStatus.IN_PROGRESS, TransferStatus.CANCELLED);

    private static final EnumSet<TransferStatus> FROM_IN_PROGRESS =
            EnumSet.of(TransferStatus.COMPLETED, TransferStatus.FAILED,
                       TransferStatus.CANCELLED, TransferStatus.PAUSED);

    private static final EnumSet<TransferStatus> FROM_PAUSED =
            EnumSet.of(TransferStatus.QUEUED, TransferStatus.CANCELLED);

    private static final EnumSet<TransferStatus> FROM_FAILED =
            EnumSet.of(TransferStatus.QUEUED, TransferStatus.CANCELLED);

    private static EnumSet<TransferStatus> validTargets(TransferStatus from) {
        return switch (from) {
            case QUEUED -> FROM_QUEUED;
            case IN_PROGRESS -> FROM_IN_PROGRESS;
            case PAUSED -> FROM_PAUSED;
            case FAILED -> FROM_FAILED;
            case COMPLETED, CANCELLED -> EnumSet.noneOf(TransferStatus.class);
        };
    }

    static Stream<Arguments> allTransferStatusPairs() {
        List<Arguments> pairs = new ArrayList<>();
        for (TransferStatus from : TransferStatus.values()) {
            Set<TransferStatus> valid = validTargets(from);
            for (TransferStatus to : TransferStatus.values()) {
                pairs.add(Arguments.of(from, to, valid.contains(to)));
            }
        }
        return pairs.stream();
    }

    static Stream<TransferStatus> allTransferStatuses() {
        return Arrays.stream(TransferStatus.values());
    }

    @ParameterizedTest(name = "{0} → {1} should be {2}")
    @MethodSource("allTransferStatusPairs")
    void canTransitionTo_coversAllPairs(TransferStatus from, TransferStatus to, boolean expected) {
        assertEquals(expected, from.canTransitionTo(to),
                () -> String.format("%s → %s should be %s", from, to, expected ? "valid" : "invalid"));
    }

    @ParameterizedTest(name = "getValidTransitions consistent for {0}")
    @MethodSource("allTransferStatuses")
    void getValidTransitions_matchesCanTransitionTo(TransferStatus from) {
        Set<TransferStatus> fromMethod = EnumSet.noneOf(TransferStatus.class);
        fromMethod.addAll(Arrays.asList(from.getValidTransitions()));

        Set<TransferStatus> fromCanTransition = EnumSet.noneOf(TransferStatus.class);
        for (TransferStatus to : TransferStatus.values()) {
            if (from.canTransitionTo(to)) {
                fromCanTransition.add(to);
            }
        }

        assertEquals(fromCanTransition, fromMethod);
    }

    @ParameterizedTest(name = "{0} → {0} self-transition should be invalid")
    @MethodSource("allTransferStatuses")
    void selfTransition_isNeverValid(TransferStatus status) {
        assertFalse(status.canTransitionTo(status));
    }

    @Test
    void completedAndCancelled_areTerminal() {
        for (TransferStatus status : new TransferStatus[]{TransferStatus.COMPLETED, TransferStatus.CANCELLED}) {
            assertTrue(status.isTerminal());
            assertTrue(status.isFinished());
            assertEquals(0, status.getValidTransitions().length);
        }
    }

    @Test
    void failed_isFinishedButNotTerminal() {
        assertFalse(TransferStatus.FAILED.isTerminal());
        assertTrue(TransferStatus.FAILED.isFinished());
        assertTrue(TransferStatus.FAILED.canTransitionTo(TransferStatus.QUEUED), "FAILED can be retried");
    }

    @Test
    void onlyDispatcherPathLeadsToInProgress() {
        for (TransferStatus status : TransferStatus.values()) {
            if (status != TransferStatus.QUEUED) {
                assertFalse(status.canTransitionTo(TransferStatus.IN_PROGRESS),
                        () -> status + " must go through QUEUED before running again");
            }
        }
    }
}
