/* Copyright 2026 Telstra Open Source
 *
 *   Licensed under the Apache License, Version 2.0 (the "License");
 *   you may not use this file except in compliance with the License.
 *   You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *   Unless required by applicable law or agreed to in writing, software
 *   distributed under the License is distributed on an "AS IS" BASIS,
 *   WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *   See the License for the specific language governing permissions and
 *   limitations under the License.
 */

package org.polyctl.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle state of a registered controller.
 */
public enum ControllerStatus {
    INITIALIZING("initializing"),
    CONNECTED("connected"),
    DISCONNECTED("disconnected"),
    ERROR("error"),
    MAINTENANCE("maintenance");

    @JsonValue
    private final String value;

    ControllerStatus(String value) {
        this.value = value;
    }

    @Override
    public String toString() {
        return value;
    }
}
