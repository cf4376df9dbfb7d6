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

package org.polyctl.model.result;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Machine readable reason of a failed operation.
 */
public enum ErrorCode {
    /**
     * Registration of an already known controller id.
     */
    CONTROLLER_EXISTS("Controller already exists"),

    /**
     * Request data violates declared constraints.
     */
    VALIDATION_ERROR("Invalid request data"),

    /**
     * No backend could be produced for the controller.
     */
    CONTROLLER_CREATION_FAILED("Controller creation error"),

    CONTROLLER_NOT_FOUND("Controller was not found"),

    MAPPING_NOT_FOUND("Switch mapping was not found"),

    /**
     * Failover target exists but is not healthy.
     */
    CONTROLLER_UNHEALTHY("Controller is unhealthy"),

    /**
     * None of the backups of a switch can take it over.
     */
    NO_BACKUP_AVAILABLE("No healthy backup controller available"),

    /**
     * The switch can't be routed to any registered backend.
     */
    BACKEND_NOT_AVAILABLE("No backend available for switch"),

    FLOW_INSTALL_ERROR("Flow installation error"),

    FLOW_DELETE_ERROR("Flow deletion error"),

    FLOW_STATS_ERROR("Flow stats request error"),

    PORT_STATS_ERROR("Port stats request error"),

    /**
     * Anything not covered by more specific codes.
     */
    INTERNAL_ERROR("Internal service error");

    private final String description;

    ErrorCode(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    @JsonValue
    public String getCode() {
        return name();
    }
}
