package dev.mars.netdrive.monitoring;

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

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * OpenTelemetry metrics for the transfer queues.
 *
 * <ul>
 *   <li>netdrive.transfer.active (gauge) - transfers currently running</li>
 *   <li>netdrive.transfer.started (counter) - attempts started</li>
 *   <li>netdrive.transfer.completed (counter) - successful transfers</li>
 *   <li>netdrive.transfer.failed (counter) - failed attempts, by error kind</li>
 *   <li>netdrive.transfer.cancelled (counter) - cancelled transfers</li>
 *   <li>netdrive.transfer.retries (counter) - automatic retries scheduled</li>
 *   <li>netdrive.transfer.bytes.total (counter) - bytes moved by completed transfers</li>
 *   <li>netdrive.transfer.duration.seconds (histogram) - attempt duration</li>
 * </ul>
 *
 * <p>One instance is shared by every queue of an engine. The {@link OpenTelemetry}
 * instance is injected; pass {@link OpenTelemetry#noop()} to disable metrics.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class TransferTelemetryMetrics {

    private static final Logger logger = LoggerFactory.getLogger(TransferTelemetryMetrics.class);
    private static final String METER_NAME = "netdrive-core";

    private static final AttributeKey<String> PROTOCOL_KEY = AttributeKey.stringKey("protocol");
    private static final AttributeKey<String> DIRECTION_KEY = AttributeKey.stringKey("direction");
    private static final AttributeKey<String> ERROR_KIND_KEY = AttributeKey.stringKey("error.kind");

    private final LongCounter transfersStarted;
    private final LongCounter transfersCompleted;
    private final LongCounter transfersFailed;
    private final LongCounter transfersCancelled;
    private final LongCounter retriesScheduled;
    private final LongCounter bytesTransferred;
    private final DoubleHistogram transferDuration;

    private final AtomicLong activeTransfers = new AtomicLong(0);

    public TransferTelemetryMetrics(OpenTelemetry openTelemetry) {
        Meter meter = openTelemetry.getMeter(METER_NAME);

        transfersStarted = meter.counterBuilder("netdrive.transfer.started")
                .setDescription("Number of transfer attempts started")
                .setUnit("1")
                .build();

        transfersCompleted = meter.counterBuilder("netdrive.transfer.completed")
                .setDescription("Number of successfully completed transfers")
                .setUnit("1")
                .build();

        transfersFailed = meter.counterBuilder("netdrive.transfer.failed")
                .setDescription("Number of failed transfer attempts")
                .setUnit("1")
                .build();

        transfersCancelled = meter.counterBuilder("netdrive.transfer.cancelled")
                .setDescription("Number of cancelled transfers")
                .setUnit("1")
                .build();

        retriesScheduled = meter.counterBuilder("netdrive.transfer.retries")
                .setDescription("Number of automatic retries scheduled")
                .setUnit("1")
                .build();

        bytesTransferred = meter.counterBuilder("netdrive.transfer.bytes.total")
                .setDescription("Total bytes moved by completed transfers")
                .setUnit("By")
                .build();

        transferDuration = meter.histogramBuilder("netdrive.transfer.duration.seconds")
                .setDescription("Transfer attempt duration in seconds")
                .setUnit("s")
                .build();

        meter.gaugeBuilder("netdrive.transfer.active")
                .setDescription("Number of currently running transfers")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeTransfers.get()));

        logger.debug("TransferTelemetryMetrics initialized");
    }

    public void recordTransferStarted(String protocol, String direction) {
        transfersStarted.add(1, attributes(protocol, direction));
        activeTransfers.incrementAndGet();
    }

    public void recordTransferCompleted(String protocol, String direction, long bytes, double durationSeconds) {
        activeTransfers.decrementAndGet();
        Attributes attrs = attributes(protocol, direction);
        transfersCompleted.add(1, attrs);
        bytesTransferred.add(Math.max(0, bytes), attrs);
        transferDuration.record(durationSeconds, attrs);
    }

    public void recordTransferFailed(String protocol, String direction, String errorKind, double durationSeconds) {
        activeTransfers.decrementAndGet();
        Attributes attrs = Attributes.builder()
                .put(PROTOCOL_KEY, protocol)
                .put(DIRECTION_KEY, direction)
                .put(ERROR_KIND_KEY, errorKind != null ? errorKind : "unknown")
                .build();
        transfersFailed.add(1, attrs);
        transferDuration.record(durationSeconds, attributes(protocol, direction));
    }

    /**
     * @param wasRunning whether the item was counted as active when it was cancelled
     */
    public void recordTransferCancelled(String protocol, String direction, boolean wasRunning) {
        if (wasRunning) {
            activeTransfers.decrementAndGet();
        }
        transfersCancelled.add(1, attributes(protocol, direction));
    }

    /**
     * A running transfer stopped at a checkpoint because it was paused.
     */
    public void recordTransferPaused() {
        activeTransfers.decrementAndGet();
    }

    public void recordRetryScheduled(String protocol, String direction) {
        retriesScheduled.add(1, attributes(protocol, direction));
    }

    public long getActiveTransfers() {
        return activeTransfers.get();
    }

    private static Attributes attributes(String protocol, String direction) {
        return Attributes.builder()
                .put(PROTOCOL_KEY, protocol)
                .put(DIRECTION_KEY, direction)
                .build();
    }
}
