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
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Operational counters of a controller, refreshed by every health check.
 */
@Data
@NoArgsConstructor
@JsonNaming(SnakeCaseStrategy.class)
public class ControllerMetrics {
    private double uptimeSeconds;
    private int totalSwitches;
    private long activeFlows;
    private long packetsProcessed;
    private long eventsGenerated;
    private Instant lastActivity;
    private double responseTimeMs;
    private int errorCount;

    public ControllerMetrics(ControllerMetrics other) {
        this.uptimeSeconds = other.uptimeSeconds;
        this.totalSwitches = other.totalSwitches;
        this.activeFlows = other.activeFlows;
        this.packetsProcessed = other.packetsProcessed;
        this.eventsGenerated = other.eventsGenerated;
        this.lastActivity = other.lastActivity;
        this.responseTimeMs = other.responseTimeMs;
        this.errorCount = other.errorCount;
    }
}
