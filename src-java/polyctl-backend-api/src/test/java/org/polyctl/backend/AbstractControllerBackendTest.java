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

package org.polyctl.backend;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import org.polyctl.backend.error.BackendOperationException;
import org.polyctl.model.ControllerConfig;
import org.polyctl.model.ControllerHealth;
import org.polyctl.model.ControllerType;
import org.polyctl.model.FlowData;
import org.polyctl.model.PacketData;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

public class AbstractControllerBackendTest {
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private StubBackend backend;

    @BeforeEach
    public void setUp() {
        ControllerConfig config = ControllerConfig.builder()
                .controllerId("of-1")
                .controllerType(ControllerType.OPENFLOW)
                .port(6653)
                .build();
        backend = new StubBackend(config, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    public void healthyWhenConnectedAndPingSucceeds() throws Exception {
        backend.initialize();
        backend.addSwitch("1");
        backend.installFlow(FlowData.builder().switchId("1").build());

        ControllerHealth health = backend.healthCheck();

        assertTrue(health.isHealthy());
        assertNull(health.getLastError());
        assertEquals(NOW, health.getLastCheck());
        assertEquals(0, health.getErrorCount());
        assertEquals(1, health.getDetailAsLong(ControllerHealth.DETAIL_SWITCH_COUNT));
        assertEquals(1, health.getDetailAsLong(ControllerHealth.DETAIL_FLOW_COUNT));
        assertEquals("of-1", health.getDetails().get(ControllerHealth.DETAIL_CONTROLLER_ID));
        assertEquals("openflow", health.getDetails().get(ControllerHealth.DETAIL_SWITCH_TYPE));
    }

    @Test
    public void unhealthyWhenNotConnected() {
        ControllerHealth health = backend.healthCheck();

        assertFalse(health.isHealthy());
        assertEquals(1, health.getErrorCount());
        assertEquals("Ping failed or not connected", health.getLastError());
    }

    @Test
    public void pingErrorIsReportedAndCounted() throws Exception {
        backend.initialize();
        backend.pingError = new BackendOperationException("of-1", "connection refused");

        backend.healthCheck();
        ControllerHealth health = backend.healthCheck();

        assertFalse(health.isHealthy());
        assertEquals(2, health.getErrorCount());
        assertEquals("connection refused", health.getLastError());

        backend.resetErrorCount();
        assertEquals(0, backend.getErrorCount());
    }

    @Test
    public void failingListenerDoesNotBreakDelivery() {
        PacketInListener broken = mock(PacketInListener.class);
        PacketInListener healthy = mock(PacketInListener.class);
        PacketData packet = PacketData.builder().switchId("1").build();
        doThrow(new IllegalStateException("broken")).when(broken).onPacketIn(packet);

        backend.subscribePacketIn(broken);
        backend.subscribePacketIn(healthy);
        backend.subscribePacketIn(healthy);
        backend.receive(packet);

        verify(broken).onPacketIn(packet);
        verify(healthy, times(1)).onPacketIn(packet);

        backend.unsubscribePacketIn(healthy);
        backend.receive(packet);
        verify(healthy, times(1)).onPacketIn(packet);
    }
}
