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

import com.fasterxml.jackson.databind.PropertyNamingStrategies.SnakeCaseStrategy;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
@JsonNaming(SnakeCaseStrategy.class)
public class EventStreamStats {
    boolean running;
    double uptimeSeconds;
    int queueSize;
    int historySize;
    long totalEvents;
    Map<String, Long> eventsByType;
    Map<String, Long> eventsByController;
    Map<String, Long> eventsBySourceType;
    long droppedEvents;
    int subscriberCount;
    double eventsPerSecond;
}
