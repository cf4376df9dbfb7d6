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

package org.polyctl.orchestrator.switches;

import org.polyctl.backend.ControllerBackend;
import org.polyctl.backend.error.BackendOperationException;
import org.polyctl.model.FlowData;
import org.polyctl.model.SwitchInfo;
import org.polyctl.model.SwitchType;
import org.polyctl.model.result.ErrorCode;
import org.polyctl.model.result.OperationResult;
import org.polyctl.orchestrator.controller.ControllerManager;
import org.polyctl.orchestrator.error.BackendNotAvailableException;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Routes flow and statistics requests to the backend that drives the target switch.
 *
 * <p>The backend is taken from the controller currently serving the switch when the controller manager
 * knows the switch, otherwise from the backend registered for the detected switch type.
 */
@Slf4j
public class SwitchManager {
    private static final Pattern COLON_DPID = Pattern.compile("^([0-9a-fA-F]{2}:){7}[0-9a-fA-F]{2}$");
    private static final int MAX_HEX_DPID_LENGTH = 18;

    private final SwitchManagerConfig config;
    private final ControllerManager controllerManager;

    private final Map<SwitchType, ControllerBackend> backends = new EnumMap<>(SwitchType.class);
    private final Map<String, SwitchType> switchRegistry = new HashMap<>();
    private final Object lock = new Object();

    private volatile boolean initialized;

    public SwitchManager(SwitchManagerConfig config) {
        this(config, null);
    }

    public SwitchManager(@NonNull SwitchManagerConfig config, ControllerManager controllerManager) {
        this.config = config;
        this.controllerManager = controllerManager;
        loadStaticRegistry();
    }

    private void loadStaticRegistry() {
        String devices = config.getP4RuntimeDevices();
        if (StringUtils.isBlank(devices)) {
            return;
        }
        for (String deviceId : Splitter.on(',').trimResults().omitEmptyStrings().split(devices)) {
            switchRegistry.put(deviceId, SwitchType.P4RUNTIME);
        }
        log.info("Loaded {} P4Runtime devices into the switch registry", switchRegistry.size());
    }

    /**
     * Binds a backend to the switch type, replacing the previous one.
     */
    public void registerBackend(@NonNull SwitchType switchType, @NonNull ControllerBackend backend) {
        synchronized (lock) {
            ControllerBackend replaced = backends.put(switchType, backend);
            if (replaced != null && replaced != backend) {
                log.warn("Backend {} for {} replaced by {}",
                        replaced.getControllerId(), switchType, backend.getControllerId());
            }
        }
        log.info("Registered backend {} for {}", backend.getControllerId(), switchType);
    }

    /**
     * Removes the backend bound to the switch type.
     *
     * @return {@code false} if there was none
     */
    public boolean unregisterBackend(SwitchType switchType) {
        ControllerBackend removed;
        synchronized (lock) {
            removed = backends.remove(switchType);
        }
        if (removed != null) {
            log.info("Unregistered backend {} for {}", removed.getControllerId(), switchType);
        }
        return removed != null;
    }

    public Optional<ControllerBackend> getBackend(SwitchType switchType) {
        synchronized (lock) {
            return Optional.ofNullable(backends.get(switchType));
        }
    }

    /**
     * Records the type of a switch explicitly, it takes precedence over any detection.
     */
    public void registerSwitch(@NonNull String switchId, @NonNull SwitchType switchType) {
        synchronized (lock) {
            switchRegistry.put(switchId, switchType);
        }
        log.debug("Switch {} registered as {}", switchId, switchType);
    }

    public SwitchType detectSwitchType(String switchId) {
        return detectSwitchType(switchId, null);
    }

    /**
     * Detects the switch type. The static registry wins, then the switch id shape (decimal, hex or colon
     * separated datapath ids are OpenFlow), then P4 hints of the flow, then the configured default.
     */
    public SwitchType detectSwitchType(String switchId, FlowData flowHint) {
        if (switchId != null) {
            synchronized (lock) {
                SwitchType registered = switchRegistry.get(switchId);
                if (registered != null) {
                    return registered;
                }
            }
            if (looksLikeDatapathId(switchId)) {
                return SwitchType.OPENFLOW;
            }
        }
        if (flowHint != null && flowHint.hasP4Hints()) {
            return SwitchType.P4RUNTIME;
        }
        return config.getDefaultSwitchType();
    }

    private static boolean looksLikeDatapathId(String switchId) {
        if (!switchId.isEmpty() && StringUtils.isNumeric(switchId)) {
            return true;
        }
        if (switchId.startsWith("0x") && switchId.length() <= MAX_HEX_DPID_LENGTH) {
            return true;
        }
        return COLON_DPID.matcher(switchId).matches();
    }

    public OperationResult<Map<String, Object>> installFlow(@NonNull FlowData flow) {
        ControllerBackend backend;
        try {
            backend = resolveBackend(flow.getSwitchId(), flow);
        } catch (BackendNotAvailableException e) {
            return e.toResult();
        }
        try {
            return OperationResult.success(backend.installFlow(tag(flow, backend)));
        } catch (BackendOperationException | RuntimeException e) {
            return backendError(ErrorCode.FLOW_INSTALL_ERROR, "install flow on switch " + flow.getSwitchId(), e);
        }
    }

    public OperationResult<Map<String, Object>> deleteFlow(@NonNull FlowData flow) {
        ControllerBackend backend;
        try {
            backend = resolveBackend(flow.getSwitchId(), flow);
        } catch (BackendNotAvailableException e) {
            return e.toResult();
        }
        try {
            return OperationResult.success(backend.deleteFlow(tag(flow, backend)));
        } catch (BackendOperationException | RuntimeException e) {
            return backendError(ErrorCode.FLOW_DELETE_ERROR, "delete flow on switch " + flow.getSwitchId(), e);
        }
    }

    public OperationResult<Map<String, Object>> getFlowStats(String switchId, Integer tableId) {
        ControllerBackend backend;
        try {
            backend = resolveBackend(switchId, null);
        } catch (BackendNotAvailableException e) {
            return e.toResult();
        }
        try {
            return OperationResult.success(backend.getFlowStats(switchId, tableId));
        } catch (BackendOperationException | RuntimeException e) {
            return backendError(ErrorCode.FLOW_STATS_ERROR, "get flow stats of switch " + switchId, e);
        }
    }

    public OperationResult<Map<String, Object>> getPortStats(String switchId, String portId) {
        ControllerBackend backend;
        try {
            backend = resolveBackend(switchId, null);
        } catch (BackendNotAvailableException e) {
            return e.toResult();
        }
        try {
            return OperationResult.success(backend.getPortStats(switchId, portId));
        } catch (BackendOperationException | RuntimeException e) {
            return backendError(ErrorCode.PORT_STATS_ERROR, "get port stats of switch " + switchId, e);
        }
    }

    /**
     * Collects switches of every registered backend. A failing backend is skipped.
     */
    public SwitchListing listAllSwitches() {
        List<SwitchInfo> result = new ArrayList<>();
        for (ControllerBackend backend : snapshotBackends()) {
            try {
                result.addAll(backend.listSwitches());
            } catch (BackendOperationException | RuntimeException e) {
                log.error("Failed to list switches of {} backend {}: {}",
                        backend.getSwitchType(), backend.getControllerId(), e.getMessage());
            }
        }
        return new SwitchListing(ImmutableList.copyOf(result), result.size());
    }

    /**
     * Initializes every registered backend.
     *
     * @return {@code true} if at least one backend is ready
     */
    public boolean initialize() {
        boolean any = false;
        for (ControllerBackend backend : snapshotBackends()) {
            try {
                boolean ready = backend.initialize();
                log.info("Backend {} ({}) initialized: {}", backend.getControllerId(), backend.getSwitchType(), ready);
                any |= ready;
            } catch (BackendOperationException | RuntimeException e) {
                log.error("Failed to initialize backend {} ({}): {}",
                        backend.getControllerId(), backend.getSwitchType(), e.getMessage());
            }
        }
        initialized = any;
        return any;
    }

    public void shutdown() {
        for (ControllerBackend backend : snapshotBackends()) {
            try {
                backend.shutdown();
                log.info("Backend {} ({}) shut down", backend.getControllerId(), backend.getSwitchType());
            } catch (RuntimeException e) {
                log.error("Failed to shut down backend {} ({}): {}",
                        backend.getControllerId(), backend.getSwitchType(), e.getMessage());
            }
        }
        initialized = false;
    }

    public boolean isInitialized() {
        return initialized;
    }

    private ControllerBackend resolveBackend(String switchId, FlowData flowHint)
            throws BackendNotAvailableException {
        if (controllerManager != null && switchId != null) {
            Optional<ControllerBackend> mapped = controllerManager.getControllerForSwitch(switchId);
            if (mapped.isPresent()) {
                return mapped.get();
            }
        }
        SwitchType switchType = detectSwitchType(switchId, flowHint);
        return getBackend(switchType).orElseThrow(() -> new BackendNotAvailableException(switchId));
    }

    private List<ControllerBackend> snapshotBackends() {
        synchronized (lock) {
            return new ArrayList<>(backends.values());
        }
    }

    private static FlowData tag(FlowData flow, ControllerBackend backend) {
        return flow.toBuilder().switchType(backend.getSwitchType()).build();
    }

    private static <T> OperationResult<T> backendError(ErrorCode errorCode, String operation, Exception error) {
        log.error("Unable to {}: {}", operation, error.getMessage());
        return OperationResult.error(errorCode, error.getMessage());
    }

    /**
     * Id of the backend controller bound to each switch type.
     */
    public Map<SwitchType, String> describeBackends() {
        ImmutableMap.Builder<SwitchType, String> result = ImmutableMap.builder();
        synchronized (lock) {
            backends.forEach((type, backend) -> result.put(type, backend.getControllerId()));
        }
        return result.build();
    }
}
