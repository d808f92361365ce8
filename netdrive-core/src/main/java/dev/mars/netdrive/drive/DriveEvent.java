package dev.mars.netdrive.drive;

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

import dev.mars.netdrive.core.ErrorKind;

import java.time.Instant;

/**
 * Drive lifecycle notification. ERROR events carry the error kind and message;
 * SYNCED events carry the sync plan.
 */
public record DriveEvent(Type type, String driveId, String driveName, ErrorKind errorKind, String message,
                         SyncPlan syncPlan, Instant timestamp) {

    public enum Type {
        MOUNTED, UNMOUNTED, SYNCED, ERROR
    }

    public static DriveEvent mounted(String driveId, String driveName, Instant timestamp) {
        return new DriveEvent(Type.MOUNTED, driveId, driveName, null, null, null, timestamp);
    }

    public static DriveEvent unmounted(String driveId, String driveName, Instant timestamp) {
        return new DriveEvent(Type.UNMOUNTED, driveId, driveName, null, null, null, timestamp);
    }

    public static DriveEvent synced(String driveId, String driveName, SyncPlan plan, Instant timestamp) {
        return new DriveEvent(Type.SYNCED, driveId, driveName, null, null, plan, timestamp);
    }

    public static DriveEvent error(String driveId, String driveName, ErrorKind kind, String message,
                                   Instant timestamp) {
        return new DriveEvent(Type.ERROR, driveId, driveName, kind, message, null, timestamp);
    }
}
