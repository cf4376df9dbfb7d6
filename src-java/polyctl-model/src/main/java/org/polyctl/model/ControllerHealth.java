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
import java.util.Map;

/**
 * Snapshot produced by a single backend health check.
 */
@Value
@Builder
@JsonNaming(SnakeCaseStrategy.class)
public class ControllerHealth {
    public static final String DETAIL_CONNECTED = "connected";
    public static final String DETAIL_SWITCH_COUNT = "switch_count";
    public static final String DETAIL_PACKET_COUNT = "packet_count";
    public static final String DETAIL_FLOW_COUNT = "flow_count";
    public static final String DETAIL_EVENT_COUNT = "event_count";
    public static final String DETAIL_LAST_ACTIVITY = "last_activity";
    public static final String DETAIL_CONTROLLER_ID = "controller_id";
    public static final String DETAIL_SWITCH_TYPE = "switch_type";

    boolean healthy;
    Instant lastCheck;
    double responseTimeMs;
    int errorCount;
    String lastError;
    double uptimeSeconds;
    @Singular("detail")
    Map<String, Object> details;

    /**
     * Numeric detail value, zero when absent or not a number.
     */
    public long getDetailAsLong(String key) {
        Object value = details.get(key);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return 0;
    }
}
