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
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unit of the event stream. Sequence numbers are unique and strictly increasing within the process.
 */
@Value
@JsonNaming(SnakeCaseStrategy.class)
public class Event {
    public static final int PRIORITY_LOW = 1;
    public static final int PRIORITY_MEDIUM = 2;
    public static final int PRIORITY_HIGH = 3;

    String eventType;
    String sourceController;
    String sourceType;
    Map<String, Object> data;
    Instant timestamp;
    long sequenceNumber;
    int priority;
    Map<String, Object> metadata;

    @Builder
    public Event(@NonNull String eventType, String sourceController, String sourceType, Map<String, Object> data,
                 @NonNull Instant timestamp, long sequenceNumber, int priority, Map<String, Object> metadata) {
        this.eventType = eventType;
        this.sourceController = sourceController;
        this.sourceType = sourceType;
        this.data = copy(data);
        this.timestamp = timestamp;
        this.sequenceNumber = sequenceNumber;
        this.priority = priority;
        this.metadata = copy(metadata);
    }

    private static Map<String, Object> copy(Map<String, Object> source) {
        // values may be null, so no ImmutableMap here
        if (source == null || source.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
