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

package org.polyctl.reporting;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.MDC;
import org.slf4j.event.Level;

import java.util.HashMap;
import java.util.Map;

public class AbstractDashboardLoggerTest {
    private final Logger logger = mock(Logger.class);
    private final TestDashboardLogger dashboardLogger = new TestDashboardLogger(logger);

    @AfterEach
    public void clearMdc() {
        MDC.clear();
    }

    @Test
    public void shouldExposeContextWhileLogging() {
        Map<String, String> seen = new HashMap<>();
        doAnswer(invocation -> {
            seen.put(AbstractDashboardLogger.CONTROLLER_ID, MDC.get(AbstractDashboardLogger.CONTROLLER_ID));
            return null;
        }).when(logger).warn("controller is down");

        dashboardLogger.invokeLogger(Level.WARN, "controller is down",
                ImmutableMap.of(AbstractDashboardLogger.CONTROLLER_ID, "of-1"));

        verify(logger).warn("controller is down");
        assertEquals("of-1", seen.get(AbstractDashboardLogger.CONTROLLER_ID));
        assertNull(MDC.get(AbstractDashboardLogger.CONTROLLER_ID));
    }

    @Test
    public void shouldRestorePreviousMdcValues() {
        MDC.put(AbstractDashboardLogger.SWITCH_ID, "outer");

        dashboardLogger.invokeLogger("failover", ImmutableMap.of(AbstractDashboardLogger.SWITCH_ID, "inner"));

        verify(logger).info("failover");
        assertEquals("outer", MDC.get(AbstractDashboardLogger.SWITCH_ID));
    }

    @Test
    public void shouldPutEventTypeIntoContext() {
        Map<String, String> context = dashboardLogger.makeContext("switch_failover");

        assertEquals("switch_failover", context.get(AbstractDashboardLogger.EVENT_TYPE));
    }

    private static class TestDashboardLogger extends AbstractDashboardLogger {
        TestDashboardLogger(Logger logger) {
            super(logger);
        }
    }
}
