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

package dev.mars.netdrive.monitoring;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collection;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TransferTelemetryMetrics using the OpenTelemetry SDK's in-memory reader.
 */
class TransferTelemetryMetricsTest {

    private InMemoryMetricReader reader;
    private OpenTelemetrySdk sdk;
    private TransferTelemetryMetrics metrics;

    @BeforeEach
    void setUp() {
        reader = InMemoryMetricReader.create();
        sdk = OpenTelemetrySdk.builder()
                .setMeterProvider(SdkMeterProvider.builder().registerMetricReader(reader).build())
                .build();
        metrics = new TransferTelemetryMetrics(sdk);
    }

    @AfterEach
    void tearDown() {
        sdk.close();
    }

    private static Optional<MetricData> metric(Collection<MetricData> data, String name) {
        return data.stream().filter(m -> m.getName().equals(name)).findFirst();
    }

    private static long sum(Collection<MetricData> data, String name) {
        return metric(data, name)
                .map(m -> m.getLongSumData().getPoints().stream().mapToLong(LongPointData::getValue).sum())
                .orElse(0L);
    }

    @Test
    void testCompletedTransferIsCounted() {
        metrics.recordTransferStarted("SFTP", "UPLOAD");
        assertEquals(1, metrics.getActiveTransfers());

        metrics.recordTransferCompleted("SFTP", "UPLOAD", 4096, 0.5);

        Collection<MetricData> data = reader.collectAllMetrics();
        assertEquals(1, sum(data, "netdrive.transfer.started"));
        assertEquals(1, sum(data, "netdrive.transfer.completed"));
        assertEquals(4096, sum(data, "netdrive.transfer.bytes.total"));
        assertEquals(0, metrics.getActiveTransfers());
        MetricData duration = metric(data, "netdrive.transfer.duration.seconds").orElseThrow();
        assertEquals(1, duration.getHistogramData().getPoints().iterator().next().getCount());
    }

    @Test
    void testFailuresAreTaggedWithErrorKind() {
        metrics.recordTransferStarted("FTP", "DOWNLOAD");
        metrics.recordTransferFailed("FTP", "DOWNLOAD", "TIMEOUT", 1.0);
        metrics.recordRetryScheduled("FTP", "DOWNLOAD");
        metrics.recordTransferStarted("FTP", "DOWNLOAD");
        metrics.recordTransferFailed("FTP", "DOWNLOAD", null, 1.0);

        Collection<MetricData> data = reader.collectAllMetrics();
        MetricData failed = metric(data, "netdrive.transfer.failed").orElseThrow();
        assertEquals(2, failed.getLongSumData().getPoints().size());
        assertTrue(failed.getLongSumData().getPoints().stream()
                .anyMatch(p -> "TIMEOUT".equals(p.getAttributes().get(AttributeKey.stringKey("error.kind")))));
        assertTrue(failed.getLongSumData().getPoints().stream()
                .anyMatch(p -> "unknown".equals(p.getAttributes().get(AttributeKey.stringKey("error.kind")))));
        assertEquals(1, sum(data, "netdrive.transfer.retries"));
        assertEquals(0, metrics.getActiveTransfers());
    }

    @Test
    void testActiveGaugeTracksCancelAndPause() {
        metrics.recordTransferStarted("SMB", "UPLOAD");
        metrics.recordTransferStarted("SMB", "UPLOAD");
        metrics.recordTransferStarted("SMB", "UPLOAD");
        metrics.recordTransferCancelled("SMB", "UPLOAD", true);
        metrics.recordTransferCancelled("SMB", "UPLOAD", false);
        metrics.recordTransferPaused();

        Collection<MetricData> data = reader.collectAllMetrics();
        assertEquals(1, metrics.getActiveTransfers());
        assertEquals(2, sum(data, "netdrive.transfer.cancelled"));
        MetricData active = metric(data, "netdrive.transfer.active").orElseThrow();
        assertEquals(1, active.getLongGaugeData().getPoints().iterator().next().getValue());
    }
}
