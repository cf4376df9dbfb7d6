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

package org.polyctl.event.audit;

import org.polyctl.event.Event;
import org.polyctl.event.EventFilter;
import org.polyctl.event.EventListener;
import org.polyctl.event.EventStream;
import org.polyctl.model.utils.JsonUtils;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every received event as a single JSON line into the audit logger.
 */
public class EventAuditLogger implements EventListener {
    public static final String SUBSCRIBER_ID = "event-audit-logger";
    public static final String LOGGER_NAME = "org.polyctl.event.audit";

    private final Logger auditLog;

    public EventAuditLogger() {
        this(LoggerFactory.getLogger(LOGGER_NAME));
    }

    EventAuditLogger(Logger auditLog) {
        this.auditLog = auditLog;
    }

    /**
     * Subscribes the audit logger to the stream.
     *
     * @return {@code false} if the stream already has an audit logger
     */
    public boolean attach(EventStream stream, EventFilter filter) {
        return stream.subscribe(SUBSCRIBER_ID, this, filter);
    }

    @Override
    public void onEvent(Event event) {
        if (!auditLog.isInfoEnabled()) {
            return;
        }
        try {
            auditLog.info(JsonUtils.toJson(event));
        } catch (JsonProcessingException e) {
            auditLog.warn("Unable to serialize event #{} ({}): {}",
                    event.getSequenceNumber(), event.getEventType(), e.getMessage());
        }
    }
}
