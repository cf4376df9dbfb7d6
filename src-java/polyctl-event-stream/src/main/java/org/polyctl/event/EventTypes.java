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

package org.polyctl.event;

/**
 * Event types emitted by the orchestration layer.
 */
public final class EventTypes {
    public static final String CONTROLLER_REGISTERED = "controller_registered";
    public static final String CONTROLLER_DEREGISTERED = "controller_deregistered";
    public static final String CONTROLLER_CONNECTED = "controller_connected";
    public static final String CONTROLLER_ERROR = "controller_error";
    public static final String HEALTH_STATUS_CHANGED = "health_status_changed";
    public static final String SWITCH_MAPPED = "switch_mapped";
    public static final String SWITCH_FAILOVER = "switch_failover";
    public static final String MANUAL_FAILOVER = "manual_failover";
    public static final String PACKET_IN = "packet_in";

    public static final String SOURCE_SYSTEM = "system";

    private EventTypes() {
        throw new UnsupportedOperationException();
    }
}
