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

package org.polyctl.orchestrator.controller;

import com.sabre.oss.conf4j.annotation.Configuration;
import com.sabre.oss.conf4j.annotation.Default;
import com.sabre.oss.conf4j.annotation.Description;
import com.sabre.oss.conf4j.annotation.Key;

import javax.validation.constraints.Min;

@Configuration
@Key("controller-manager")
public interface ControllerManagerConfig {
    @Key("health-check-interval-seconds")
    @Default("30")
    @Min(1)
    long getHealthCheckIntervalSeconds();

    @Key("health-check-timeout-seconds")
    @Default("5")
    @Min(1)
    @Description("A health check running longer than this is treated as failed.")
    long getHealthCheckTimeoutSeconds();

    @Key("degraded-response-time-ms")
    @Default("1000")
    @Min(0)
    @Description("Healthy controllers answering slower than this are reported as degraded.")
    double getDegradedResponseTimeMs();

    @Key("max-health-failures")
    @Default("3")
    @Min(1)
    int getMaxHealthFailures();

    @Key("health-check-threads")
    @Default("4")
    @Min(1)
    int getHealthCheckThreads();
}
