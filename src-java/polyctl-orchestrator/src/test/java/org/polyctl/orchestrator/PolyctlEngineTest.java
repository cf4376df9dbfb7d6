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

package org.polyctl.orchestrator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.polyctl.backend.ControllerBackendFactory;
import org.polyctl.config.provider.ConfigurationException;
import org.polyctl.config.provider.PropertiesBasedConfigurationProvider;
import org.polyctl.event.Event;
import org.polyctl.event.EventTypes;
import org.polyctl.event.audit.EventAuditLogger;
import org.polyctl.model.ControllerConfig;
import org.polyctl.model.ControllerType;
import org.polyctl.model.FlowData;
import org.polyctl.model.SwitchType;
import org.polyctl.orchestrator.controller.ControllerManager;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Properties;
import java.util.stream.Collectors;

public class PolyctlEngineTest {
    private PolyctlEngine engine;

    @AfterEach
    public void tearDown() {
        if (engine != null) {
            engine.close();
        }
    }

    private static ControllerBackendFactory factory() {
        return new ControllerBackendFactory().register(ControllerType.OPENFLOW, FakeControllerBackend::new);
    }

    private List<String> awaitHistory(String eventType) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (true) {
            List<String> types = engine.getEventStream().recent(100).stream()
                    .map(Event::getEventType)
                    .collect(Collectors.toList());
            if (types.contains(eventType) || System.currentTimeMillis() > deadline) {
                return types;
            }
            Thread.sleep(20);
        }
    }

    @Test
    public void defaultResourceIsLoaded() throws Exception {
        engine = PolyctlEngine.create(factory());

        assertFalse(engine.getConfig().isAuditLogEnabled());
        assertEquals(SwitchType.OPENFLOW, engine.getSwitchManager().detectSwitchType("leaf-1"));
        assertFalse(engine.getControllerManager().isRunning());
    }

    @Test
    public void startedEngineStreamsControllerEvents() throws Exception {
        Properties properties = new Properties();
        properties.setProperty("engine.audit-log-enabled", "true");
        properties.setProperty("event-stream.poll-timeout-ms", "50");
        engine = new PolyctlEngine(new PropertiesBasedConfigurationProvider(properties), factory());

        engine.start();

        assertTrue(engine.getControllerManager().isRunning());
        assertTrue(engine.getEventStream().getSubscriber(EventAuditLogger.SUBSCRIBER_ID).isPresent());
        assertTrue(engine.getEventStream().getSubscriber(ControllerManager.SOURCE_ID).isPresent());

        engine.getControllerManager().register(ControllerConfig.builder()
                .controllerId("of-1")
                .controllerType(ControllerType.OPENFLOW)
                .port(6653)
                .build());
        engine.getControllerManager().mapSwitch("1", "of-1", null);

        List<String> types = awaitHistory(EventTypes.SWITCH_MAPPED);
        assertTrue(types.contains(EventTypes.CONTROLLER_REGISTERED));
        assertTrue(types.contains(EventTypes.CONTROLLER_CONNECTED));
        assertTrue(types.contains(EventTypes.SWITCH_MAPPED));

        assertTrue(engine.getSwitchManager().installFlow(FlowData.builder().switchId("1").build()).isSuccess());

        engine.stop();

        assertFalse(engine.getControllerManager().isRunning());
        assertFalse(engine.getEventStream().stats().isRunning());
    }

    @Test
    public void invalidAuditPriorityIsRejected() {
        Properties properties = new Properties();
        properties.setProperty("engine.audit-log-min-priority", "5");

        assertThrows(ConfigurationException.class,
                () -> new PolyctlEngine(new PropertiesBasedConfigurationProvider(properties), factory()));
    }
}
