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
import lombok.NonNull;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Registration descriptor plus the runtime state of a controller.
 *
 * <p>The controller manager is the only owner of "live" instances, everything it hands out is a copy made
 * by {@link #ControllerInfo(ControllerInfo)}.
 */
@Data
@JsonNaming(SnakeCaseStrategy.class)
public class ControllerInfo {
    @NonNull
    private ControllerConfig config;
    @NonNull
    private ControllerStatus status = ControllerStatus.INITIALIZING;
    @NonNull
    private HealthStatus healthStatus = HealthStatus.UNKNOWN;

    private Instant createdAt;
    private Instant lastSeen;
    private Instant lastHealthCheck;

    private ControllerMetrics metrics = new ControllerMetrics();
    private List<String> assignedSwitches = new ArrayList<>();

    private String lastError;
    private int errorCount;

    public ControllerInfo(@NonNull ControllerConfig config, Instant createdAt) {
        this.config = config;
        this.createdAt = createdAt;
    }

    /**
     * Deep copy.
     */
    public ControllerInfo(ControllerInfo other) {
        this.config = other.config;
        this.status = other.status;
        this.healthStatus = other.healthStatus;
        this.createdAt = other.createdAt;
        this.lastSeen = other.lastSeen;
        this.lastHealthCheck = other.lastHealthCheck;
        this.metrics = new ControllerMetrics(other.metrics);
        this.assignedSwitches = new ArrayList<>(other.assignedSwitches);
        this.lastError = other.lastError;
        this.errorCount = other.errorCount;
    }

    public String getControllerId() {
        return config.getControllerId();
    }
}
