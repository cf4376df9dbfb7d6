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
import com.fasterxml.jackson.annotation.JsonProperty.Access;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;

/**
 * Registration descriptor of a controller. Instances are immutable, any change requires re-registration.
 */
@Value
@JsonInclude(Include.NON_NULL)
public class ControllerConfig {
    public static final String DEFAULT_HOST = "localhost";
    public static final String DEFAULT_PROTOCOL = "http";
    public static final int DEFAULT_HEALTH_CHECK_INTERVAL = 30;
    public static final int DEFAULT_HEALTH_CHECK_TIMEOUT = 5;
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final int DEFAULT_PRIORITY = 100;

    @NotBlank
    @JsonProperty("controller_id")
    String controllerId;

    @NotNull
    @JsonProperty("controller_type")
    ControllerType controllerType;

    @JsonProperty("name")
    String name;

    @JsonProperty("description")
    String description;

    @NotBlank
    @JsonProperty("host")
    String host;

    @Min(1)
    @Max(65535)
    @JsonProperty("port")
    int port;

    @JsonProperty("protocol")
    String protocol;

    @JsonProperty("username")
    String username;

    @ToString.Exclude
    @JsonProperty(value = "password", access = Access.WRITE_ONLY)
    String password;

    @ToString.Exclude
    @JsonProperty(value = "api_key", access = Access.WRITE_ONLY)
    String apiKey;

    @Min(1)
    @JsonProperty("health_check_interval")
    int healthCheckInterval;

    @Min(1)
    @JsonProperty("health_check_timeout")
    int healthCheckTimeout;

    @Min(0)
    @JsonProperty("max_retries")
    int maxRetries;

    @JsonProperty("priority")
    int priority;

    @NotNull
    @JsonProperty("backup_controllers")
    List<@NotBlank String> backupControllers;

    @JsonProperty("metadata")
    Map<String, Object> metadata;

    @Builder(toBuilder = true)
    @JsonCreator
    public ControllerConfig(
            @JsonProperty("controller_id") String controllerId,
            @JsonProperty("controller_type") ControllerType controllerType,
            @JsonProperty("name") String name,
            @JsonProperty("description") String description,
            @JsonProperty("host") String host,
            @JsonProperty("port") Integer port,
            @JsonProperty("protocol") String protocol,
            @JsonProperty("username") String username,
            @JsonProperty("password") String password,
            @JsonProperty("api_key") String apiKey,
            @JsonProperty("health_check_interval") Integer healthCheckInterval,
            @JsonProperty("health_check_timeout") Integer healthCheckTimeout,
            @JsonProperty("max_retries") Integer maxRetries,
            @JsonProperty("priority") Integer priority,
            @JsonProperty("backup_controllers") List<String> backupControllers,
            @JsonProperty("metadata") Map<String, Object> metadata) {
        this.controllerId = StringUtils.trim(controllerId);
        this.controllerType = controllerType;
        this.name = StringUtils.isBlank(name) ? this.controllerId : name;
        this.description = description;
        this.host = host == null ? DEFAULT_HOST : host;
        this.port = port == null ? 0 : port;
        this.protocol = protocol == null ? DEFAULT_PROTOCOL : protocol;
        this.username = username;
        this.password = password;
        this.apiKey = apiKey;
        this.healthCheckInterval = healthCheckInterval == null ? DEFAULT_HEALTH_CHECK_INTERVAL : healthCheckInterval;
        this.healthCheckTimeout = healthCheckTimeout == null ? DEFAULT_HEALTH_CHECK_TIMEOUT : healthCheckTimeout;
        this.maxRetries = maxRetries == null ? DEFAULT_MAX_RETRIES : maxRetries;
        this.priority = priority == null ? DEFAULT_PRIORITY : priority;
        this.backupControllers = backupControllers == null
                ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(backupControllers));
        this.metadata = metadata == null
                ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
