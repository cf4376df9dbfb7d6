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

import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.polyctl.event.Event;

import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.Logger;

import java.time.Instant;

@ExtendWith(MockitoExtension.class)
public class EventAuditLoggerTest {
    @Mock
    private Logger logger;

    @Test
    public void eventIsWrittenAsJsonLine() {
        when(logger.isInfoEnabled()).thenReturn(true);
        EventAuditLogger auditLogger = new EventAuditLogger(logger);

        auditLogger.onEvent(Event.builder()
                .eventType("switch_failover")
                .sourceController("controller_manager")
                .sourceType("system")
                .data(ImmutableMap.of("switch_id", "1"))
                .timestamp(Instant.parse("2026-02-01T10:00:00Z"))
                .sequenceNumber(42)
                .priority(3)
                .build());

        ArgumentCaptor<String> line = ArgumentCaptor.forClass(String.class);
        verify(logger).info(line.capture());
        assertTrue(line.getValue().contains("\"event_type\":\"switch_failover\""));
        assertTrue(line.getValue().contains("\"sequence_number\":42"));
        assertTrue(line.getValue().contains("\"timestamp\":\"2026-02-01T10:00:00Z\""));
        assertTrue(line.getValue().contains("\"switch_id\":\"1\""));
    }

    @Test
    public void nothingWrittenWhenDisabled() {
        when(logger.isInfoEnabled()).thenReturn(false);

        new EventAuditLogger(logger).onEvent(Event.builder()
                .eventType("tick")
                .timestamp(Instant.EPOCH)
                .priority(1)
                .build());

        verify(logger, never()).info(anyString());
    }
}
