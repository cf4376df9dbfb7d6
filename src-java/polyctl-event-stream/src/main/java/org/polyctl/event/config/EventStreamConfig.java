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

package org.polyctl.event.config;

import com.sabre.oss.conf4j.annotation.Configuration;
import com.sabre.oss.conf4j.annotation.Default;
import com.sabre.oss.conf4j.annotation.Key;

import javax.validation.constraints.Min;

@Configuration
@Key("event-stream")
public interface EventStreamConfig {
    @Key("max-queue-size")
    @Default("10000")
    @Min(1)
    int getMaxQueueSize();

    @Key("max-history-size")
    @Default("1000")
    @Min(1)
    int getMaxHistorySize();

    @Key("poll-timeout-ms")
    @Default("1000")
    @Min(1)
    long getPollTimeoutMs();

    @Key("auto-deactivate-failed-subscribers")
    @Default("true")
    boolean isAutoDeactivateFailedSubscribers();

    @Key("cleanup-interval-seconds")
    @Default("300")
    @Min(1)
    long getCleanupIntervalSeconds();

    @Key("shutdown-timeout-ms")
    @Default("5000")
    @Min(0)
    long getShutdownTimeoutMs();
}
