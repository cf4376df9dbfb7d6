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

import org.polyctl.backend.AbstractControllerBackend;
import org.polyctl.backend.error.BackendOperationException;
import org.polyctl.model.ControllerConfig;
import org.polyctl.model.FlowData;
import org.polyctl.model.PacketData;
import org.polyctl.model.SwitchInfo;
import org.polyctl.model.SwitchType;

import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.Uninterruptibles;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;

/**
 * Scriptable in-memory backend.
 */
public class FakeControllerBackend extends AbstractControllerBackend {
    public volatile boolean initializeResult = true;
    public volatile boolean pingResult = true;
    public volatile long pingDelayMs;
    public volatile boolean failOperations;
    public volatile SwitchType switchType = SwitchType.OPENFLOW;

    public final List<FlowData> installedFlows = new CopyOnWriteArrayList<>();
    public final List<FlowData> deletedFlows = new CopyOnWriteArrayList<>();
    public volatile int pingCount;
    public volatile int shutdownCount;

    /** When set, ping blocks on it and ignores interrupts. */
    public volatile CountDownLatch pingGate;
    /** When set, initialize counts down {@link #initializeStarted} and then blocks on it. */
    public volatile CountDownLatch initializeGate;
    public final CountDownLatch initializeStarted = new CountDownLatch(1);

    public FakeControllerBackend(ControllerConfig config) {
        super(config);
    }

    public FakeControllerBackend(ControllerConfig config, Clock clock) {
        super(config, clock);
    }

    @Override
    public boolean initialize() {
        initializeStarted.countDown();
        CountDownLatch gate = initializeGate;
        if (gate != null) {
            Uninterruptibles.awaitUninterruptibly(gate);
        }
        setConnected(initializeResult);
        return initializeResult;
    }

    @Override
    public void shutdown() {
        shutdownCount++;
        setConnected(false);
    }

    @Override
    public Map<String, Object> installFlow(FlowData flow) throws BackendOperationException {
        checkFailure("install flow");
        installedFlows.add(flow);
        incrementFlowCount();
        return ImmutableMap.of("controller_id", getControllerId(), "status", "installed");
    }

    @Override
    public Map<String, Object> deleteFlow(FlowData flow) throws BackendOperationException {
        checkFailure("delete flow");
        deletedFlows.add(flow);
        return ImmutableMap.of("controller_id", getControllerId(), "status", "deleted");
    }

    @Override
    public Map<String, Object> modifyFlow(FlowData flow) throws BackendOperationException {
        checkFailure("modify flow");
        return ImmutableMap.of("controller_id", getControllerId(), "status", "modified");
    }

    @Override
    public Map<String, Object> getFlowStats(String switchId, Integer tableId) throws BackendOperationException {
        checkFailure("get flow stats");
        return ImmutableMap.of("controller_id", getControllerId(), "flows", installedFlows.size());
    }

    @Override
    public Map<String, Object> getPortStats(String switchId, String portId) throws BackendOperationException {
        checkFailure("get port stats");
        return ImmutableMap.of("controller_id", getControllerId(), "ports", 0);
    }

    @Override
    public Map<String, Object> sendPacketOut(PacketData packet) throws BackendOperationException {
        checkFailure("send packet out");
        return ImmutableMap.of("controller_id", getControllerId());
    }

    @Override
    public Optional<SwitchInfo> getSwitchInfo(String switchId) {
        return Optional.ofNullable(switches.get(switchId));
    }

    @Override
    public List<SwitchInfo> listSwitches() throws BackendOperationException {
        checkFailure("list switches");
        return new ArrayList<>(switches.values());
    }

    @Override
    public boolean ping() {
        pingCount++;
        CountDownLatch gate = pingGate;
        if (gate != null) {
            Uninterruptibles.awaitUninterruptibly(gate);
        }
        if (pingDelayMs > 0) {
            try {
                Thread.sleep(pingDelayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return pingResult;
    }

    @Override
    public SwitchType getSwitchType() {
        return switchType;
    }

    public void addSwitch(String switchId) {
        switches.put(switchId, SwitchInfo.builder()
                .switchId(switchId)
                .switchType(switchType)
                .controllerId(getControllerId())
                .connected(true)
                .build());
    }

    public void emitPacketIn(PacketData packet) {
        notifyPacketIn(packet);
    }

    private void checkFailure(String operation) throws BackendOperationException {
        if (failOperations) {
            throw new BackendOperationException(getControllerId(), String.format("Unable to %s", operation));
        }
    }
}
