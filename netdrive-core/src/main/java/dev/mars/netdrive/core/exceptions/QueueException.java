package dev.mars.netdrive.core.exceptions;

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
 * Exception thrown when a transfer queue operation refers to an unknown item
 * or is not allowed in the item's current state.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class QueueException extends NetDriveException {

    private final String itemId;

    public QueueException(String itemId, String message) {
        super(message);
        this.itemId = itemId;
    }

    public String getItemId() {
        return itemId;
    }

    @Override
    public String getMessage() {
        if (itemId == null) {
            return super.getMessage();
        }
        return String.format("Transfer item %s: %s", itemId, super.getMessage());
    }
}
