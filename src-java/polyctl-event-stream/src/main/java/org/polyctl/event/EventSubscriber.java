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

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Registered consumer of the event stream.
 */
@Getter
@ToString(of = {"subscriberId", "active"})
public class EventSubscriber {
    private final String subscriberId;
    private final EventListener listener;
    private final EventFilter filter;
    private final Instant createdAt;

    @Getter(AccessLevel.NONE)
    private final AtomicLong eventCount = new AtomicLong();
    private volatile Event lastEvent;
    private volatile boolean active = true;

    EventSubscriber(@NonNull String subscriberId, @NonNull EventListener listener, EventFilter filter,
                    Instant createdAt) {
        this.subscriberId = subscriberId;
        this.listener = listener;
        this.filter = filter == null ? EventFilter.any() : filter;
        this.createdAt = createdAt;
    }

    public long getEventCount() {
        return eventCount.get();
    }

    void delivered(Event event) {
        eventCount.incrementAndGet();
        lastEvent = event;
    }

    void deactivate() {
        active = false;
    }
}
