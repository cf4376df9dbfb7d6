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
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Protocol neutral flow description. OpenFlow backends read the cookie and timeouts, P4Runtime backends read
 * the table and action fields.
 */
@Value
@JsonInclude(Include.NON_NULL)
public class FlowData {
    public static final int DEFAULT_PRIORITY = 1000;

    @JsonProperty("switch_id")
    String switchId;

    @JsonProperty("switch_type")
    SwitchType switchType;

    @JsonProperty("flow_id")
    String flowId;

    @JsonProperty("priority")
    int priority;

    @JsonProperty("match_fields")
    Map<String, Object> matchFields;

    @JsonProperty("actions")
    Map<String, Object> actions;

    @JsonProperty("cookie")
    Long cookie;

    @JsonProperty("idle_timeout")
    Integer idleTimeout;

    @JsonProperty("hard_timeout")
    Integer hardTimeout;

    @JsonProperty("table_name")
    String tableName;

    @JsonProperty("action_name")
    String actionName;

    @JsonProperty("action_params")
    Map<String, Object> actionParams;

    @Builder(toBuilder = true)
    @JsonCreator
    public FlowData(
            @NonNull @JsonProperty("switch_id") String switchId,
            @JsonProperty("switch_type") SwitchType switchType,
            @JsonProperty("flow_id") String flowId,
            @JsonProperty("priority") Integer priority,
            @JsonProperty("match_fields") Map<String, Object> matchFields,
            @JsonProperty("actions") Map<String, Object> actions,
            @JsonProperty("cookie") Long cookie,
            @JsonProperty("idle_timeout") Integer idleTimeout,
            @JsonProperty("hard_timeout") Integer hardTimeout,
            @JsonProperty("table_name") String tableName,
            @JsonProperty("action_name") String actionName,
            @JsonProperty("action_params") Map<String, Object> actionParams) {
        this.switchId = switchId;
        this.switchType = switchType == null ? SwitchType.UNKNOWN : switchType;
        this.flowId = flowId;
        this.priority = priority == null ? DEFAULT_PRIORITY : priority;
        this.matchFields = copy(matchFields);
        this.actions = copy(actions);
        this.cookie = cookie;
        this.idleTimeout = idleTimeout;
        this.hardTimeout = hardTimeout;
        this.tableName = tableName;
        this.actionName = actionName;
        this.actionParams = copy(actionParams);
    }

    /**
     * True when the flow carries P4 table or action hints.
     */
    public boolean hasP4Hints() {
        return tableName != null || actionName != null;
    }

    private static Map<String, Object> copy(Map<String, Object> source) {
        if (source == null) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
