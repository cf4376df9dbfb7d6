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

import org.polyctl.backend.error.BackendOperationException;
import org.polyctl.model.ControllerHealth;
import org.polyctl.model.FlowData;
import org.polyctl.model.PacketData;
import org.polyctl.model.SwitchInfo;
import org.polyctl.model.SwitchType;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Protocol neutral contract every SDN controller backend fulfils. Implementations speak the actual switch
 * protocol, the orchestration layer only drives them through this interface.
 */
public interface ControllerBackend {
    String getControllerId();

    /**
     * Establishes the connection to the controller.
     *
     * @return {@code true} when the backend is ready to serve requests
     */
    boolean initialize() throws BackendOperationException;

    /**
     * Releases connections and resources. Must be safe to call on a backend that never initialized.
     */
    void shutdown();

    /**
     * Installs a flow rule on the switch named by {@link FlowData#getSwitchId()}.
     *
     * @param flow flow to install
     * @return backend specific description of the outcome
     * @throws BackendOperationException the switch rejected the flow or is unreachable
     */
    Map<String, Object> installFlow(FlowData flow) throws BackendOperationException;

    Map<String, Object> deleteFlow(FlowData flow) throws BackendOperationException;

    Map<String, Object> modifyFlow(FlowData flow) throws BackendOperationException;

    /**
     * Returns flow statistics of a switch.
     *
     * @param switchId switch id
     * @param tableId table to query, {@code null} means all tables
     */
    Map<String, Object> getFlowStats(String switchId, Integer tableId) throws BackendOperationException;

    /**
     * Returns port statistics of a switch.
     *
     * @param switchId switch id
     * @param portId port to query, {@code null} means all ports
     */
    Map<String, Object> getPortStats(String switchId, String portId) throws BackendOperationException;

    Map<String, Object> sendPacketOut(PacketData packet) throws BackendOperationException;

    void subscribePacketIn(PacketInListener listener);

    void unsubscribePacketIn(PacketInListener listener);

    Optional<SwitchInfo> getSwitchInfo(String switchId) throws BackendOperationException;

    List<SwitchInfo> listSwitches() throws BackendOperationException;

    /**
     * Cheap liveness check of the controller.
     */
    boolean ping() throws BackendOperationException;

    /**
     * Queries the controller and reports its state. Never throws, a failing check is reported as unhealthy.
     */
    ControllerHealth healthCheck();

    SwitchType getSwitchType();

    boolean isConnected();

    /**
     * Forgets accumulated errors, called once the controller is back in service.
     */
    void resetErrorCount();
}
