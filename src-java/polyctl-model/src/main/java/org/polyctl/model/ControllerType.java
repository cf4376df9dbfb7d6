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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of SDN controller backend a registered controller is driven by.
 */
public enum ControllerType {
    OPENFLOW("openflow"),
    P4RUNTIME("p4runtime"),
    CUSTOM("custom");

    @JsonValue
    private final String value;

    ControllerType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Lookup by the serialized (lower case) value, enum constant names are accepted too.
     */
    @JsonCreator
    public static ControllerType fromValue(String value) {
        for (ControllerType entry : values()) {
            if (entry.value.equalsIgnoreCase(value) || entry.name().equalsIgnoreCase(value)) {
                return entry;
            }
        }
        throw new IllegalArgumentException(
                String.format("Unknown %s value \"%s\"", ControllerType.class.getSimpleName(), value));
    }

    @Override
    public String toString() {
        return value;
    }
}
