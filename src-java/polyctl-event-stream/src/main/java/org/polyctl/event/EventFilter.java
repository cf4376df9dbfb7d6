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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies.SnakeCaseStrategy;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;
import java.util.function.Predicate;

/**
 * Conjunction of optional constraints on events. An empty set matches anything.
 */
@Value
@Builder
@JsonNaming(SnakeCaseStrategy.class)
public class EventFilter {
    private static final EventFilter ANY = EventFilter.builder().build();

    @Singular
    Set<String> eventTypes;

    @Singular
    Set<String> controllerIds;

    @Singular
    Set<String> sourceTypes;

    @Builder.Default
    int minPriority = Event.PRIORITY_LOW;

    @JsonIgnore
    Predicate<Event> customFilter;

    public static EventFilter any() {
        return ANY;
    }

    /**
     * Checks the event against every constraint of the filter.
     */
    public boolean matches(Event event) {
        if (!eventTypes.isEmpty() && !eventTypes.contains(event.getEventType())) {
            return false;
        }
        if (!controllerIds.isEmpty() && !controllerIds.contains(event.getSourceController())) {
            return false;
        }
        if (!sourceTypes.isEmpty() && !sourceTypes.contains(event.getSourceType())) {
            return false;
        }
        if (event.getPriority() < minPriority) {
            return false;
        }
        return customFilter == null || customFilter.test(event);
    }
}
