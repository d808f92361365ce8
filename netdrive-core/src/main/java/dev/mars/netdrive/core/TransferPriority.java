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


/**
 * Priority of a queued transfer. Higher priority items are dispatched first;
 * within the same priority items are dispatched in FIFO order.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public enum TransferPriority {

    /** Background work such as sync catch-up. */
    LOW(1),

    /** Default for user-initiated transfers. */
    NORMAL(5),

    HIGH(8),

    CRITICAL(10);

    private final int value;

    TransferPriority(int value) {
        this.value = value;
    }

    /**
     * Numeric weight; higher values are dispatched first.
     */
    public int getValue() {
        return value;
    }

    public boolean isHigherThan(TransferPriority other) {
        return this.value > other.value;
    }

    /**
     * Parse a priority from its name, case-insensitive. Blank input yields NORMAL.
     *
     * @throws IllegalArgumentException if the value is not recognized
     */
    public static TransferPriority fromString(String value) {
        if (value == null || value.trim().isEmpty()) {
            return NORMAL;
        }
        try {
            return TransferPriority.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown transfer priority: " + value, e);
        }
    }
}
