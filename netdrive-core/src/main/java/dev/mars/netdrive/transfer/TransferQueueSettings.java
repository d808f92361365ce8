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

import dev.mars.netdrive.config.NetDriveConfiguration;

/**
 * Per-queue limits.
 *
 * @param concurrentLimit   maximum items IN_PROGRESS at once
 * @param defaultMaxRetries retry budget for requests that do not set their own
 * @param maxRetainedItems  finished items kept for history before the oldest are evicted
 * @param retryPolicy       automatic retry decision and backoff
 */
public record TransferQueueSettings(int concurrentLimit, int defaultMaxRetries, int maxRetainedItems,
                                    RetryPolicy retryPolicy) {

    public TransferQueueSettings {
        if (concurrentLimit < 1) {
            throw new IllegalArgumentException("concurrentLimit must be at least 1");
        }
        if (defaultMaxRetries < 0) {
            throw new IllegalArgumentException("defaultMaxRetries cannot be negative");
        }
        if (maxRetainedItems < 0) {
            throw new IllegalArgumentException("maxRetainedItems cannot be negative");
        }
        if (retryPolicy == null) {
            throw new IllegalArgumentException("retryPolicy cannot be null");
        }
    }

    public static TransferQueueSettings from(NetDriveConfiguration configuration) {
        return new TransferQueueSettings(
                configuration.getConcurrentLimit(),
                configuration.getMaxRetries(),
                configuration.getRetainedItems(),
                new RetryPolicy(configuration.getRetryBaseDelay(), configuration.getRetryMaxDelay()));
    }
}
