package dev.mars.netdrive.storage;

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

import dev.mars.netdrive.core.exceptions.ChecksumMismatchException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Calculates and verifies file checksums for completed transfers.
 * SHA-256 by default; any {@link MessageDigest} algorithm name is accepted.
 */
public class ChecksumCalculator {

    public static final String DEFAULT_ALGORITHM = "SHA-256";
    private static final int BUFFER_SIZE = 8192;

    private final String algorithm;

    public ChecksumCalculator() {
        this(DEFAULT_ALGORITHM);
    }

    public ChecksumCalculator(String algorithm) {
        if (!isAlgorithmSupported(algorithm)) {
            throw new IllegalArgumentException("Unsupported checksum algorithm: " + algorithm);
        }
        this.algorithm = algorithm;
    }

    public String getAlgorithm() {
        return algorithm;
    }

    /**
     * Checksum of an entire file as lowercase hex.
     */
    public String calculate(Path filePath) throws IOException {
        MessageDigest digest = newDigest(algorithm);
        try (InputStream inputStream = Files.newInputStream(filePath)) {
            byte[] buffer = new byte[BUFFER_SIZE];
            int bytesRead;
            while ((bytesRead = inputStream.read(buffer)) != -1) {
                digest.update(buffer, 0, bytesRead);
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    /**
     * Verify the file against an expected checksum. A blank expectation always passes.
     *
     * @throws ChecksumMismatchException if the checksums differ
     */
    public void verify(Path filePath, String expectedChecksum) throws IOException, ChecksumMismatchException {
        if (expectedChecksum == null || expectedChecksum.isBlank()) {
            return;
        }
        String actual = calculate(filePath);
        if (!expectedChecksum.trim().equalsIgnoreCase(actual)) {
            throw new ChecksumMismatchException(filePath.getFileName().toString(), expectedChecksum, actual);
        }
    }

    public static boolean isAlgorithmSupported(String algorithm) {
        if (algorithm == null) {
            return false;
        }
        try {
            MessageDigest.getInstance(algorithm);
            return true;
        } catch (NoSuchAlgorithmException e) {
            return false;
        }
    }

    private static MessageDigest newDigest(String algorithm) {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Unsupported checksum algorithm: " + algorithm, e);
        }
    }
}
