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

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable request to move one file between the local filesystem and a drive.
 *
 * <p>The queue turns a request into a {@link TransferItem}. Remote paths are
 * interpreted relative to the drive's remote root unless they are already below it.</p>
 *
 * <pre>{@code
 * TransferRequest request = TransferRequest.builder()
 *     .direction(TransferDirection.UPLOAD)
 *     .localPath(Paths.get("/home/me/report.pdf"))
 *     .remotePath("/reports/report.pdf")
 *     .priority(TransferPriority.HIGH)
 *     .expectedChecksum("9f86d081884c7d65...")
 *     .build();
 * }</pre>
 */
public final class TransferRequest {

    private final TransferDirection direction;
    private final Path localPath;
    private final String remotePath;
    private final TransferPriority priority;
    private final long expectedSize;
    private final String expectedChecksum;
    private final Integer maxRetries;
    private final Map<String, String> metadata;

    private TransferRequest(Builder builder) {
        this.direction = Objects.requireNonNull(builder.direction, "direction cannot be null");
        this.localPath = Objects.requireNonNull(builder.localPath, "localPath cannot be null");
        this.remotePath = RemotePaths.normalize(Objects.requireNonNull(builder.remotePath, "remotePath cannot be null"));
        this.priority = builder.priority != null ? builder.priority : TransferPriority.NORMAL;
        this.expectedSize = builder.expectedSize;
        this.expectedChecksum = builder.expectedChecksum;
        this.maxRetries = builder.maxRetries;
        this.metadata = Map.copyOf(builder.metadata);
        if (maxRetries != null && maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries cannot be negative");
        }
    }

    public TransferDirection getDirection() { return direction; }
    public Path getLocalPath() { return localPath; }
    public String getRemotePath() { return remotePath; }
    public TransferPriority getPriority() { return priority; }

    /**
     * @return the expected size in bytes, or -1 when unknown
     */
    public long getExpectedSize() { return expectedSize; }
    public String getExpectedChecksum() { return expectedChecksum; }

    /**
     * @return the per-item retry budget, or {@code null} to use the queue default
     */
    public Integer getMaxRetries() { return maxRetries; }
    public Map<String, String> getMetadata() { return metadata; }

    public String getFileName() {
        return direction == TransferDirection.UPLOAD
                ? localPath.getFileName().toString()
                : RemotePaths.fileName(remotePath);
    }

    public static TransferRequest upload(Path localPath, String remotePath, TransferPriority priority) {
        return builder().direction(TransferDirection.UPLOAD).localPath(localPath)
                .remotePath(remotePath).priority(priority).build();
    }

    public static TransferRequest download(String remotePath, Path localPath, TransferPriority priority) {
        return builder().direction(TransferDirection.DOWNLOAD).localPath(localPath)
                .remotePath(remotePath).priority(priority).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private TransferDirection direction;
        private Path localPath;
        private String remotePath;
        private TransferPriority priority;
        private long expectedSize = -1;
        private String expectedChecksum;
        private Integer maxRetries;
        private final Map<String, String> metadata = new HashMap<>();

        public Builder direction(TransferDirection direction) { this.direction = direction; return this; }
        public Builder localPath(Path localPath) { this.localPath = localPath; return this; }
        public Builder remotePath(String remotePath) { this.remotePath = remotePath; return this; }
        public Builder priority(TransferPriority priority) { this.priority = priority; return this; }
        public Builder expectedSize(long expectedSize) { this.expectedSize = expectedSize; return this; }
        public Builder expectedChecksum(String expectedChecksum) { this.expectedChecksum = expectedChecksum; return this; }
        public Builder maxRetries(int maxRetries) { this.maxRetries = maxRetries; return this; }
        public Builder metadata(String key, String value) { this.metadata.put(key, value); return this; }

        public TransferRequest build() {
            return new TransferRequest(this);
        }
    }

    @Override
    public String toString() {
        return "TransferRequest{" + direction + " " + localPath + " <-> " + remotePath + ", priority=" + priority + '}';
    }
}
