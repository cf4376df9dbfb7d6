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
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Assignment of a switch to a primary controller, its ordered backups and the controller that currently
 * serves it. The serving controller is always the primary or one of the backups.
 */
@Value
public class SwitchMapping {
    @JsonProperty("switch_id")
    String switchId;

    @JsonProperty("primary_controller")
    String primaryController;

    @JsonProperty("backup_controllers")
    List<String> backupControllers;

    @JsonProperty("current_controller")
    String currentController;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("last_updated")
    Instant lastUpdated;

    @JsonProperty("failover_count")
    int failoverCount;

    @Builder(toBuilder = true)
    @JsonCreator
    public SwitchMapping(
            @NonNull @JsonProperty("switch_id") String switchId,
            @NonNull @JsonProperty("primary_controller") String primaryController,
            @JsonProperty("backup_controllers") List<String> backupControllers,
            @JsonProperty("current_controller") String currentController,
            @JsonProperty("created_at") Instant createdAt,
            @JsonProperty("last_updated") Instant lastUpdated,
            @JsonProperty("failover_count") int failoverCount) {
        this.switchId = switchId;
        this.primaryController = primaryController;
        this.backupControllers = backupControllers == null
                ? ImmutableList.of() : ImmutableList.copyOf(backupControllers);
        this.currentController = currentController == null ? primaryController : currentController;
        if (!isMember(this.currentController)) {
            throw new IllegalArgumentException(String.format(
                    "Current controller %s of switch %s is neither primary (%s) nor backup %s",
                    this.currentController, switchId, primaryController, this.backupControllers));
        }
        if (failoverCount < 0) {
            throw new IllegalArgumentException("Failover count can't be negative: " + failoverCount);
        }
        this.createdAt = createdAt;
        this.lastUpdated = lastUpdated == null ? createdAt : lastUpdated;
        this.failoverCount = failoverCount;
    }

    /**
     * Checks whether the controller is the primary or one of the backups of this switch.
     */
    public boolean isMember(String controllerId) {
        return primaryController.equals(controllerId) || backupControllers.contains(controllerId);
    }

    public boolean isServedByPrimary() {
        return primaryController.equals(currentController);
    }

    /**
     * Produces the mapping after moving the switch to {@code target}. The failover counter grows by one.
     */
    public SwitchMapping failoverTo(String target, Instant now) {
        return toBuilder()
                .currentController(target)
                .lastUpdated(now)
                .failoverCount(failoverCount + 1)
                .build();
    }

    /**
     * Produces the mapping without {@code controllerId} among the backups.
     */
    public SwitchMapping withoutBackup(String controllerId, Instant now) {
        List<String> backups = new ArrayList<>(backupControllers);
        backups.remove(controllerId);
        return toBuilder()
                .backupControllers(backups)
                .lastUpdated(now)
                .build();
    }
}
