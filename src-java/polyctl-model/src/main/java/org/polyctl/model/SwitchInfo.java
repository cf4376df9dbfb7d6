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

import com.fasterxml.jackson.databind.PropertyNamingStrategies.SnakeCaseStrategy;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Switch description as reported by a backend.
 */
@Value
@Builder
@JsonNaming(SnakeCaseStrategy.class)
public class SwitchInfo {
    String switchId;
    SwitchType switchType;
    String controllerId;
    String description;
    String manufacturer;
    String hardwareVersion;
    String softwareVersion;
    @Singular
    List<Integer> ports;
    boolean connected;
    Instant lastSeen;
    @Singular("capability")
    Map<String, Object> capabilities;
}
