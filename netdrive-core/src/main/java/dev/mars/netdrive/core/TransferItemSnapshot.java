package dev.mars.netdrive.core;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable read view of a {@link TransferItem}, safe to hand to UI code or to an
 * external history store.
 */
public record TransferItemSnapshot(
        @JsonProperty("id") String id,
        @JsonProperty("driveId") String driveId,
        @JsonProperty("fileName") String fileName,
        @JsonProperty("localPath") String localPath,
        @JsonProperty("remotePath") String remotePath,
        @JsonProperty("direction") TransferDirection direction,
        @JsonProperty("totalBytes") long totalBytes,
        @JsonProperty("processedBytes") long processedBytes,
        @JsonProperty("priority") TransferPriority priority,
        @JsonProperty("status") TransferStatus status,
        @JsonProperty("progress") double progress,
        @JsonProperty("errorMessage") String errorMessage,
        @JsonProperty("errorKind") ErrorKind errorKind,
        @JsonProperty("retryCount") int retryCount,
        @JsonProperty("maxRetries") int maxRetries,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("lastAttempt") Instant lastAttempt,
        @JsonProperty("nextEligible") Instant nextEligible,
        @JsonProperty("awaitingRetry") boolean awaitingRetry,
        @JsonProperty("checksum") String checksum,
        @JsonProperty("metadata") Map<String, String> metadata) {

    /**
     * Failure with no automatic retry pending; the UI shows it as needing the user.
     */
    @JsonIgnore
    public boolean isTerminalFailure() {
        return status == TransferStatus.FAILED && !awaitingRetry;
    }

    @JsonIgnore
    public double getProgressPercentage() {
        return progress * 100.0;
    }
}
