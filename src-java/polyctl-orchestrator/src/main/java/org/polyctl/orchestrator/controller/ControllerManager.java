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

package org.polyctl.orchestrator.controller;

import org.polyctl.backend.ControllerBackend;
import org.polyctl.backend.ControllerBackendFactory;
import org.polyctl.backend.PacketInListener;
import org.polyctl.backend.error.BackendOperationException;
import org.polyctl.event.Event;
import org.polyctl.event.EventFilter;
import org.polyctl.event.EventStream;
import org.polyctl.event.EventTypes;
import org.polyctl.model.ControllerConfig;
import org.polyctl.model.ControllerHealth;
import org.polyctl.model.ControllerInfo;
import org.polyctl.model.ControllerMetrics;
import org.polyctl.model.ControllerStatus;
import org.polyctl.model.HealthStatus;
import org.polyctl.model.PacketData;
import org.polyctl.model.SwitchMapping;
import org.polyctl.model.error.OrchestrationException;
import org.polyctl.model.result.ErrorCode;
import org.polyctl.model.result.OperationResult;
import org.polyctl.orchestrator.controller.model.ControllerListing;
import org.polyctl.orchestrator.controller.model.ControllerManagerStats;
import org.polyctl.orchestrator.controller.model.DeregistrationResult;
import org.polyctl.orchestrator.controller.model.FailoverResult;
import org.polyctl.orchestrator.controller.model.RegistrationResult;
import org.polyctl.orchestrator.controller.model.SwitchMappingListing;
import org.polyctl.orchestrator.error.ControllerExistsException;
import org.polyctl.orchestrator.error.ControllerNotFoundException;
import org.polyctl.orchestrator.error.FailoverException;
import org.polyctl.orchestrator.error.InvalidRequestException;
import org.polyctl.orchestrator.error.MappingNotFoundException;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import javax.validation.ConstraintViolation;
import javax.validation.Validation;
import javax.validation.Validator;

/**
 * Registry and lifecycle owner of the controllers, keeper of the switch to controller mapping table and
 * driver of the health-check based failover.
 *
 * <p>The registry and the mapping table are guarded by separate monitors which are never held together.
 * Backend calls are always made outside of both.
 */
@Slf4j
public class ControllerManager {
    public static final String SOURCE_ID = "controller_manager";

    private final ControllerManagerConfig config;
    private final EventStream eventStream;
    private final ControllerBackendFactory backendFactory;
    private final ControllerDashboardLogger dashboardLogger;
    private final Clock clock;
    private final Validator validator;

    private final Map<String, ControllerEntry> controllers = new LinkedHashMap<>();
    private final Object registryLock = new Object();

    private final Map<String, SwitchMapping> mappings = new LinkedHashMap<>();
    private final Set<String> strandedSwitches = new LinkedHashSet<>();
    private final Object mappingLock = new Object();

    private final AtomicInteger failedControllers = new AtomicInteger();
    private final AtomicLong failoverCount = new AtomicLong();
    private final AtomicLong healthChecksPerformed = new AtomicLong();
    private final Instant startTime;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final ExecutorService healthCheckers;
    private ScheduledExecutorService healthScheduler;

    public ControllerManager(ControllerManagerConfig config, EventStream eventStream,
                             ControllerBackendFactory backendFactory) {
        this(config, eventStream, backendFactory,
                new ControllerDashboardLogger(LoggerFactory.getLogger(ControllerManager.class)),
                Clock.systemUTC());
    }

    public ControllerManager(@NonNull ControllerManagerConfig config, @NonNull EventStream eventStream,
                             @NonNull ControllerBackendFactory backendFactory,
                             @NonNull ControllerDashboardLogger dashboardLogger, @NonNull Clock clock) {
        this.config = config;
        this.eventStream = eventStream;
        this.backendFactory = backendFactory;
        this.dashboardLogger = dashboardLogger;
        this.clock = clock;
        this.validator = Validation.buildDefaultValidatorFactory().getValidator();
        this.startTime = clock.instant();
        this.healthCheckers = Executors.newFixedThreadPool(config.getHealthCheckThreads(),
                new ThreadFactoryBuilder().setNameFormat("controller-health-check-%d").setDaemon(true).build());
    }

    /**
     * Starts periodic health checks and subscribes the manager to the event stream.
     */
    public synchronized void start() {
        if (healthCheckers.isShutdown()) {
            throw new IllegalStateException("Controller manager can't be restarted once stopped");
        }
        if (!running.compareAndSet(false, true)) {
            log.warn("Controller manager already running");
            return;
        }

        long interval = config.getHealthCheckIntervalSeconds();
        log.info("Starting controller manager (health check interval {} s)", interval);
        healthScheduler = Executors.newSingleThreadScheduledExecutor(
                new ThreadFactoryBuilder().setNameFormat("controller-health-monitor-%d").setDaemon(true).build());
        healthScheduler.scheduleWithFixedDelay(this::healthMonitorTick, interval, interval, TimeUnit.SECONDS);

        eventStream.subscribe(SOURCE_ID, this::handleStreamEvent, EventFilter.builder()
                .eventType(EventTypes.CONTROLLER_CONNECTED)
                .eventType(EventTypes.CONTROLLER_ERROR)
                .build());
    }

    /**
     * Stops health checks and shuts every controller down.
     */
    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }

        log.info("Stopping controller manager");
        healthScheduler.shutdownNow();
        healthCheckers.shutdownNow();
        try {
            long timeout = config.getHealthCheckTimeoutSeconds();
            if (!healthScheduler.awaitTermination(timeout, TimeUnit.SECONDS)) {
                log.warn("Health monitor did not stop in {} s", timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        List<String> controllerIds;
        synchronized (registryLock) {
            controllerIds = new ArrayList<>(controllers.keySet());
        }
        for (String controllerId : controllerIds) {
            stopController(controllerId);
        }
        eventStream.unsubscribe(SOURCE_ID);
        log.info("Controller manager stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    public OperationResult<RegistrationResult> register(ControllerConfig controllerConfig) {
        return register(controllerConfig, true);
    }

    /**
     * Registers a controller and, when {@code autoStart} is set, connects it.
     */
    public OperationResult<RegistrationResult> register(ControllerConfig controllerConfig, boolean autoStart) {
        return execute("register controller", () -> registerController(controllerConfig, autoStart));
    }

    /**
     * Removes a controller together with every switch mapping it is primary or current for. Mappings that
     * only list it as a backup survive without it.
     */
    public OperationResult<DeregistrationResult> deregister(String controllerId) {
        return execute("deregister controller", () -> deregisterController(controllerId));
    }

    /**
     * Creates or overwrites the mapping of a switch. The switch is served by the primary controller right
     * away, the failover counter of an overwritten mapping is preserved.
     */
    public OperationResult<SwitchMapping> mapSwitch(String switchId, String primaryController,
                                                   List<String> backupControllers) {
        return execute("map switch", () -> mapSwitchToController(switchId, primaryController, backupControllers));
    }

    /**
     * Moves a switch to {@code targetController} or, when it is {@code null}, to the first healthy backup.
     */
    public OperationResult<FailoverResult> failover(String switchId, String targetController) {
        return execute("switch failover", () -> manualFailover(switchId, targetController));
    }

    /**
     * Moves a connected controller in or out of maintenance. Controllers in maintenance are skipped by
     * health checks.
     */
    public OperationResult<ControllerInfo> setMaintenance(String controllerId, boolean enabled) {
        return execute("set maintenance", () -> changeMaintenance(controllerId, enabled));
    }

    public ControllerListing listControllers() {
        List<ControllerInfo> infos = new ArrayList<>();
        synchronized (registryLock) {
            for (ControllerEntry entry : controllers.values()) {
                infos.add(new ControllerInfo(entry.info));
            }
        }
        Map<String, List<String>> assignments = collectAssignments();
        for (ControllerInfo info : infos) {
            info.setAssignedSwitches(assignments.getOrDefault(info.getControllerId(), new ArrayList<>()));
        }

        return ControllerListing.builder()
                .controllers(infos)
                .totalCount(infos.size())
                .healthyCount((int) infos.stream()
                        .filter(info -> info.getHealthStatus() == HealthStatus.HEALTHY).count())
                .connectedCount((int) infos.stream()
                        .filter(info -> info.getStatus() == ControllerStatus.CONNECTED).count())
                .stats(getStats())
                .build();
    }

    public SwitchMappingListing listSwitchMappings() {
        List<SwitchMapping> result;
        synchronized (mappingLock) {
            result = ImmutableList.copyOf(mappings.values());
        }
        return new SwitchMappingListing(result, result.size());
    }

    /**
     * Returns a copy of the controller state, later changes are not reflected in it.
     */
    public Optional<ControllerInfo> getControllerInfo(String controllerId) {
        ControllerInfo info;
        synchronized (registryLock) {
            ControllerEntry entry = controllers.get(controllerId);
            if (entry == null) {
                return Optional.empty();
            }
            info = new ControllerInfo(entry.info);
        }
        info.setAssignedSwitches(collectAssignments().getOrDefault(controllerId, new ArrayList<>()));
        return Optional.of(info);
    }

    public Optional<SwitchMapping> getMapping(String switchId) {
        synchronized (mappingLock) {
            return Optional.ofNullable(mappings.get(switchId));
        }
    }

    /**
     * Resolves the backend of the controller currently serving the switch.
     */
    public Optional<ControllerBackend> getControllerForSwitch(String switchId) {
        Optional<SwitchMapping> mapping = getMapping(switchId);
        if (!mapping.isPresent()) {
            return Optional.empty();
        }
        synchronized (registryLock) {
            ControllerEntry entry = controllers.get(mapping.get().getCurrentController());
            return entry == null ? Optional.empty() : Optional.of(entry.backend);
        }
    }

    /**
     * Switches left on a failed controller because none of their backups was healthy.
     */
    public Set<String> getStrandedSwitches() {
        synchronized (mappingLock) {
            return ImmutableSet.copyOf(strandedSwitches);
        }
    }

    public ControllerManagerStats getStats() {
        int total;
        int active;
        synchronized (registryLock) {
            total = controllers.size();
            active = (int) controllers.values().stream()
                    .filter(entry -> entry.info.getStatus() == ControllerStatus.CONNECTED)
                    .count();
        }
        int switches;
        synchronized (mappingLock) {
            switches = mappings.size();
        }
        return ControllerManagerStats.builder()
                .totalControllers(total)
                .activeControllers(active)
                .failedControllers(failedControllers.get())
                .totalSwitches(switches)
                .failoverCount(failoverCount.get())
                .healthChecksPerformed(healthChecksPerformed.get())
                .startTime(startTime)
                .build();
    }

    private RegistrationResult registerController(ControllerConfig controllerConfig, boolean autoStart)
            throws OrchestrationException {
        if (controllerConfig == null) {
            throw new InvalidRequestException("Controller config is required");
        }
        validate(controllerConfig);

        String controllerId = controllerConfig.getControllerId();
        synchronized (registryLock) {
            if (controllers.containsKey(controllerId)) {
                throw new ControllerExistsException(controllerId);
            }
        }

        ControllerBackend backend = backendFactory.create(controllerConfig);
        ControllerEntry entry = new ControllerEntry(backend, new ControllerInfo(controllerConfig, clock.instant()));
        synchronized (registryLock) {
            if (controllers.containsKey(controllerId)) {
                throw new ControllerExistsException(controllerId);
            }
            controllers.put(controllerId, entry);
        }

        dashboardLogger.onRegistered(controllerConfig);
        eventStream.publish(EventTypes.CONTROLLER_REGISTERED, SOURCE_ID, EventTypes.SOURCE_SYSTEM, ImmutableMap.of(
                "controller_id", controllerId,
                "controller_type", controllerConfig.getControllerType().getValue(),
                "auto_start", autoStart));

        if (autoStart) {
            startController(controllerId);
        }

        ControllerInfo snapshot = getControllerInfo(controllerId)
                .orElseThrow(() -> new ControllerNotFoundException(controllerId));
        return new RegistrationResult(controllerId, RegistrationResult.STATUS_REGISTERED, autoStart, snapshot);
    }

    private void validate(ControllerConfig controllerConfig) throws InvalidRequestException {
        Set<ConstraintViolation<ControllerConfig>> violations = validator.validate(controllerConfig);
        if (!violations.isEmpty()) {
            String details = violations.stream()
                    .map(entry -> entry.getPropertyPath() + " " + entry.getMessage())
                    .sorted()
                    .collect(Collectors.joining(", "));
            throw new InvalidRequestException("Invalid controller config: " + details);
        }
    }

    private DeregistrationResult deregisterController(String controllerId) throws OrchestrationException {
        ControllerEntry entry;
        ControllerStatus status;
        synchronized (registryLock) {
            entry = controllers.remove(controllerId);
            if (entry == null) {
                throw new ControllerNotFoundException(controllerId);
            }
            status = entry.info.getStatus();
        }

        // An INITIALIZING controller is shut down by the start routine once it sees the entry is gone.
        if (status == ControllerStatus.CONNECTED || status == ControllerStatus.MAINTENANCE) {
            stopEntry(entry);
        }
        removeControllerMappings(controllerId);

        dashboardLogger.onDeregistered(controllerId);
        eventStream.publish(EventTypes.CONTROLLER_DEREGISTERED, SOURCE_ID, EventTypes.SOURCE_SYSTEM,
                ImmutableMap.of("controller_id", controllerId));
        return new DeregistrationResult(controllerId, DeregistrationResult.STATUS_DEREGISTERED);
    }

    private void removeControllerMappings(String controllerId) {
        Instant now = clock.instant();
        List<String> removed = new ArrayList<>();
        synchronized (mappingLock) {
            for (SwitchMapping mapping : new ArrayList<>(mappings.values())) {
                String switchId = mapping.getSwitchId();
                if (controllerId.equals(mapping.getPrimaryController())
                        || controllerId.equals(mapping.getCurrentController())) {
                    mappings.remove(switchId);
                    strandedSwitches.remove(switchId);
                    removed.add(switchId);
                } else if (mapping.getBackupControllers().contains(controllerId)) {
                    mappings.put(switchId, mapping.withoutBackup(controllerId, now));
                }
            }
        }
        for (String switchId : removed) {
            log.info("Removed mapping of switch {} with controller {}", switchId, controllerId);
        }
    }

    private SwitchMapping mapSwitchToController(String switchId, String primaryController,
                                                List<String> backupControllers) throws OrchestrationException {
        if (StringUtils.isBlank(switchId)) {
            throw new InvalidRequestException("Switch id is required");
        }
        if (StringUtils.isBlank(primaryController)) {
            throw new InvalidRequestException("Primary controller is required");
        }
        List<String> backups = backupControllers == null ? Collections.emptyList() : backupControllers;
        if (backups.contains(primaryController)) {
            throw new InvalidRequestException(String.format(
                    "Primary controller %s can't be a backup of switch %s", primaryController, switchId));
        }
        if (new HashSet<>(backups).size() != backups.size()) {
            throw new InvalidRequestException(String.format(
                    "Duplicate backup controllers %s for switch %s", backups, switchId));
        }

        synchronized (registryLock) {
            if (!controllers.containsKey(primaryController)) {
                throw new ControllerNotFoundException(primaryController);
            }
            for (String backup : backups) {
                if (!controllers.containsKey(backup)) {
                    throw new ControllerNotFoundException(backup);
                }
            }
        }

        Instant now = clock.instant();
        SwitchMapping mapping;
        SwitchMapping previous;
        synchronized (mappingLock) {
            previous = mappings.get(switchId);
            mapping = SwitchMapping.builder()
                    .switchId(switchId)
                    .primaryController(primaryController)
                    .backupControllers(backups)
                    .currentController(primaryController)
                    .createdAt(now)
                    .lastUpdated(now)
                    .failoverCount(previous == null ? 0 : previous.getFailoverCount())
                    .build();
            mappings.put(switchId, mapping);
            strandedSwitches.remove(switchId);
        }

        // A controller deregistered after the check above must not stay referenced by the new mapping.
        Set<String> missing = findUnregistered(mapping);
        if (!missing.isEmpty()) {
            rollbackMapping(mapping, previous);
            throw new ControllerNotFoundException(missing.iterator().next());
        }

        log.info("Switch {} mapped to controller {} (backups {})", switchId, primaryController, backups);
        eventStream.publish(EventTypes.SWITCH_MAPPED, SOURCE_ID, EventTypes.SOURCE_SYSTEM, ImmutableMap.of(
                "switch_id", switchId,
                "primary_controller", primaryController,
                "backup_controllers", ImmutableList.copyOf(backups)));
        return mapping;
    }

    private Set<String> findUnregistered(SwitchMapping mapping) {
        Set<String> missing = new LinkedHashSet<>();
        synchronized (registryLock) {
            if (!controllers.containsKey(mapping.getPrimaryController())) {
                missing.add(mapping.getPrimaryController());
            }
            if (!controllers.containsKey(mapping.getCurrentController())) {
                missing.add(mapping.getCurrentController());
            }
            for (String backup : mapping.getBackupControllers()) {
                if (!controllers.containsKey(backup)) {
                    missing.add(backup);
                }
            }
        }
        return missing;
    }

    /**
     * Puts the replaced mapping back, cleaned of controllers deregistered in the meantime.
     */
    private void rollbackMapping(SwitchMapping rejected, SwitchMapping previous) {
        SwitchMapping restored = previous;
        if (previous != null) {
            Instant now = clock.instant();
            for (String controllerId : findUnregistered(previous)) {
                if (restored == null) {
                    break;
                }
                if (controllerId.equals(restored.getPrimaryController())
                        || controllerId.equals(restored.getCurrentController())) {
                    restored = null;
                } else {
                    restored = restored.withoutBackup(controllerId, now);
                }
            }
        }

        String switchId = rejected.getSwitchId();
        synchronized (mappingLock) {
            if (mappings.get(switchId) != rejected) {
                return;
            }
            if (restored == null) {
                mappings.remove(switchId);
            } else {
                mappings.put(switchId, restored);
            }
        }
        log.warn("Mapping of switch {} rolled back, a controller was deregistered concurrently", switchId);
    }

    private FailoverResult manualFailover(String switchId, String targetController) throws OrchestrationException {
        SwitchMapping mapping = getMapping(switchId).orElseThrow(() -> new MappingNotFoundException(switchId));

        String target;
        if (targetController != null) {
            HealthStatus targetHealth;
            synchronized (registryLock) {
                ControllerEntry entry = controllers.get(targetController);
                if (entry == null) {
                    throw new ControllerNotFoundException(targetController);
                }
                targetHealth = entry.info.getHealthStatus();
            }
            if (!mapping.isMember(targetController)) {
                throw new InvalidRequestException(String.format(
                        "Controller %s is neither primary nor backup of switch %s", targetController, switchId));
            }
            if (targetController.equals(mapping.getCurrentController())) {
                throw new InvalidRequestException(String.format(
                        "Switch %s is already served by controller %s", switchId, targetController));
            }
            if (targetHealth != HealthStatus.HEALTHY) {
                throw new FailoverException(ErrorCode.CONTROLLER_UNHEALTHY, String.format(
                        "Target controller %s is not healthy (%s)", targetController, targetHealth));
            }
            target = targetController;
        } else {
            target = findHealthyBackup(mapping, mapping.getCurrentController())
                    .orElseThrow(() -> new FailoverException(ErrorCode.NO_BACKUP_AVAILABLE,
                            String.format("No healthy backup controller available for switch %s", switchId)));
        }

        SwitchMapping updated;
        String oldController;
        synchronized (mappingLock) {
            SwitchMapping latest = mappings.get(switchId);
            if (latest == null) {
                throw new MappingNotFoundException(switchId);
            }
            if (!latest.isMember(target) || target.equals(latest.getCurrentController())) {
                throw new InvalidRequestException(String.format(
                        "Mapping of switch %s has changed concurrently", switchId));
            }
            oldController = latest.getCurrentController();
            updated = latest.failoverTo(target, clock.instant());
            mappings.put(switchId, updated);
            strandedSwitches.remove(switchId);
        }
        failoverCount.incrementAndGet();

        dashboardLogger.onFailover(switchId, oldController, target, updated.getFailoverCount(), true);
        eventStream.publish(EventTypes.MANUAL_FAILOVER, SOURCE_ID, EventTypes.SOURCE_SYSTEM, ImmutableMap.of(
                "switch_id", switchId,
                "old_controller", oldController,
                "new_controller", target,
                "failover_count", updated.getFailoverCount(),
                "manual", true), Event.PRIORITY_HIGH);
        return new FailoverResult(switchId, oldController, target, updated.getFailoverCount());
    }

    private ControllerInfo changeMaintenance(String controllerId, boolean enabled) throws OrchestrationException {
        ControllerStatus from = enabled ? ControllerStatus.CONNECTED : ControllerStatus.MAINTENANCE;
        ControllerStatus to = enabled ? ControllerStatus.MAINTENANCE : ControllerStatus.CONNECTED;
        boolean changed = false;
        synchronized (registryLock) {
            ControllerEntry entry = controllers.get(controllerId);
            if (entry == null) {
                throw new ControllerNotFoundException(controllerId);
            }
            ControllerStatus current = entry.info.getStatus();
            if (current == from) {
                entry.info.setStatus(to);
                changed = true;
            } else if (current != to) {
                throw new InvalidRequestException(String.format(
                        "Controller %s in status %s can't %s maintenance", controllerId, current,
                        enabled ? "enter" : "leave"));
            }
        }
        if (changed) {
            dashboardLogger.onStatusChange(controllerId, to, null);
        }
        return getControllerInfo(controllerId).orElseThrow(() -> new ControllerNotFoundException(controllerId));
    }

    /**
     * Connects the controller backend. Failures are recorded in the controller state, never thrown.
     *
     * @return {@code true} if the controller is connected
     */
    @VisibleForTesting
    boolean startController(String controllerId) {
        ControllerEntry entry;
        synchronized (registryLock) {
            entry = controllers.get(controllerId);
            if (entry == null) {
                return false;
            }
            entry.info.setStatus(ControllerStatus.INITIALIZING);
        }

        boolean connected;
        String error = null;
        try {
            connected = entry.backend.initialize();
            if (!connected) {
                error = "Failed to initialize";
            }
        } catch (BackendOperationException | RuntimeException e) {
            log.error("Error starting controller {}: {}", controllerId, e.getMessage(), e);
            connected = false;
            error = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        }

        if (connected) {
            entry.backend.subscribePacketIn(entry.packetInListener);
            entry.backend.resetErrorCount();
        } else {
            failedControllers.incrementAndGet();
        }

        boolean stale;
        synchronized (registryLock) {
            stale = controllers.get(controllerId) != entry;
            if (!stale) {
                if (connected) {
                    entry.info.setStatus(ControllerStatus.CONNECTED);
                    entry.info.setLastSeen(clock.instant());
                } else {
                    entry.info.setStatus(ControllerStatus.ERROR);
                    entry.info.setLastError(error);
                }
            }
        }
        if (stale) {
            log.warn("Controller {} was deregistered while starting, shutting its backend down", controllerId);
            stopEntry(entry);
            return false;
        }

        if (connected) {
            dashboardLogger.onStatusChange(controllerId, ControllerStatus.CONNECTED, null);
            eventStream.publish(EventTypes.CONTROLLER_CONNECTED, controllerId, sourceType(entry),
                    ImmutableMap.of("controller_id", controllerId));
        } else {
            dashboardLogger.onStatusChange(controllerId, ControllerStatus.ERROR, error);
            eventStream.publish(EventTypes.CONTROLLER_ERROR, controllerId, sourceType(entry), ImmutableMap.of(
                    "controller_id", controllerId,
                    "error", error), Event.PRIORITY_MEDIUM);
        }
        return connected;
    }

    @VisibleForTesting
    void stopController(String controllerId) {
        ControllerEntry entry;
        synchronized (registryLock) {
            entry = controllers.get(controllerId);
        }
        if (entry != null) {
            stopEntry(entry);
        }
    }

    private void stopEntry(ControllerEntry entry) {
        String controllerId = entry.getControllerId();
        entry.backend.unsubscribePacketIn(entry.packetInListener);
        try {
            entry.backend.shutdown();
        } catch (RuntimeException e) {
            log.error("Error stopping controller {}: {}", controllerId, e.getMessage(), e);
        }

        synchronized (registryLock) {
            entry.info.setStatus(ControllerStatus.DISCONNECTED);
        }
        dashboardLogger.onStatusChange(controllerId, ControllerStatus.DISCONNECTED, null);
    }

    private void healthMonitorTick() {
        try {
            performHealthChecks();
        } catch (RuntimeException e) {
            log.error("Error in health monitor: {}", e.getMessage(), e);
        }
    }

    /**
     * Checks every controller not in maintenance, in parallel, each check bounded by the health check timeout
     * counted from its submission. A controller whose previous check is still running gets no new check and
     * the check counts as failed, so a hung backend holds at most one pool thread.
     */
    @VisibleForTesting
    void performHealthChecks() {
        List<ControllerEntry> targets = new ArrayList<>();
        synchronized (registryLock) {
            for (ControllerEntry entry : controllers.values()) {
                if (entry.info.getStatus() != ControllerStatus.MAINTENANCE) {
                    targets.add(entry);
                }
            }
        }

        long timeout = config.getHealthCheckTimeoutSeconds();
        Map<ControllerEntry, HealthCheckTask> checks = new LinkedHashMap<>();
        for (ControllerEntry entry : targets) {
            if (!entry.checkInFlight.compareAndSet(false, true)) {
                checks.put(entry, null);
                continue;
            }
            HealthCheckTask task = new HealthCheckTask(entry, System.nanoTime() + TimeUnit.SECONDS.toNanos(timeout));
            try {
                task.future = healthCheckers.submit(task);
            } catch (RejectedExecutionException e) {
                entry.checkInFlight.set(false);
                log.warn("Health check of controller {} rejected: {}", entry.getControllerId(), e.getMessage());
                continue;
            }
            checks.put(entry, task);
        }

        for (Map.Entry<ControllerEntry, HealthCheckTask> item : checks.entrySet()) {
            ControllerEntry entry = item.getKey();
            HealthCheckTask task = item.getValue();
            ControllerHealth health;
            if (task == null) {
                health = failedHealth(String.format(
                        "Previous health check of controller %s is still running", entry.getControllerId()));
            } else {
                try {
                    long remaining = Math.max(0, task.deadline - System.nanoTime());
                    health = task.future.get(remaining, TimeUnit.NANOSECONDS);
                } catch (TimeoutException e) {
                    task.abandon();
                    health = failedHealth(String.format("Health check timed out after %d s", timeout));
                } catch (ExecutionException e) {
                    health = failedHealth(String.valueOf(e.getCause()));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
            applyHealth(entry.getControllerId(), entry, health);
            healthChecksPerformed.incrementAndGet();
        }
    }

    private ControllerHealth failedHealth(String error) {
        return ControllerHealth.builder()
                .healthy(false)
                .lastCheck(clock.instant())
                .lastError(error)
                .build();
    }

    private void applyHealth(String controllerId, ControllerEntry entry, ControllerHealth health) {
        Instant now = clock.instant();
        HealthStatus previous;
        HealthStatus current;
        boolean failed;
        synchronized (registryLock) {
            if (controllers.get(controllerId) != entry
                    || entry.info.getStatus() == ControllerStatus.MAINTENANCE) {
                return;
            }
            ControllerInfo info = entry.info;
            previous = info.getHealthStatus();
            info.setLastHealthCheck(now);
            if (health.isHealthy()) {
                current = health.getResponseTimeMs() > config.getDegradedResponseTimeMs()
                        ? HealthStatus.DEGRADED : HealthStatus.HEALTHY;
                info.setErrorCount(0);
                info.setLastSeen(now);
                failed = false;
            } else {
                current = HealthStatus.UNHEALTHY;
                info.setErrorCount(info.getErrorCount() + 1);
                info.setLastError(health.getLastError());
                failed = info.getErrorCount() >= config.getMaxHealthFailures();
            }
            info.setHealthStatus(current);
            updateMetrics(info, health);
        }

        if (previous != current) {
            dashboardLogger.onHealthChange(controllerId, previous, current);
            Map<String, Object> data = new HashMap<>();
            data.put("controller_id", controllerId);
            data.put("old_status", previous.toString());
            data.put("new_status", current.toString());
            data.put("error", health.getLastError());
            eventStream.publish(EventTypes.HEALTH_STATUS_CHANGED, controllerId, sourceType(entry), data,
                    current == HealthStatus.UNHEALTHY ? Event.PRIORITY_MEDIUM : Event.PRIORITY_LOW);
        }
        if (failed) {
            handleControllerFailure(controllerId);
        }
    }

    private static void updateMetrics(ControllerInfo info, ControllerHealth health) {
        ControllerMetrics metrics = info.getMetrics();
        metrics.setResponseTimeMs(health.getResponseTimeMs());
        metrics.setUptimeSeconds(health.getUptimeSeconds());
        metrics.setErrorCount(info.getErrorCount());
        if (health.getDetails() != null && !health.getDetails().isEmpty()) {
            metrics.setTotalSwitches((int) health.getDetailAsLong(ControllerHealth.DETAIL_SWITCH_COUNT));
            metrics.setActiveFlows(health.getDetailAsLong(ControllerHealth.DETAIL_FLOW_COUNT));
            metrics.setPacketsProcessed(health.getDetailAsLong(ControllerHealth.DETAIL_PACKET_COUNT));
            metrics.setEventsGenerated(health.getDetailAsLong(ControllerHealth.DETAIL_EVENT_COUNT));
        }
        if (health.isHealthy()) {
            metrics.setLastActivity(health.getLastCheck());
        }
    }

    /**
     * Moves every switch currently served by the failed controller to its first healthy backup.
     */
    @VisibleForTesting
    void handleControllerFailure(String failedController) {
        log.warn("Controller {} has failed, initiating failover", failedController);

        List<SwitchMapping> affected = new ArrayList<>();
        synchronized (mappingLock) {
            for (SwitchMapping mapping : mappings.values()) {
                if (failedController.equals(mapping.getCurrentController())) {
                    affected.add(mapping);
                }
            }
        }

        for (SwitchMapping mapping : affected) {
            String switchId = mapping.getSwitchId();
            Optional<String> backup = findHealthyBackup(mapping, failedController);
            if (!backup.isPresent()) {
                synchronized (mappingLock) {
                    if (mappings.containsKey(switchId)) {
                        strandedSwitches.add(switchId);
                    }
                }
                dashboardLogger.onFailoverImpossible(switchId, failedController);
                continue;
            }

            String target = backup.get();
            SwitchMapping updated;
            synchronized (mappingLock) {
                SwitchMapping latest = mappings.get(switchId);
                if (latest == null || !failedController.equals(latest.getCurrentController())
                        || !latest.isMember(target)) {
                    continue;
                }
                updated = latest.failoverTo(target, clock.instant());
                mappings.put(switchId, updated);
                strandedSwitches.remove(switchId);
            }
            failoverCount.incrementAndGet();

            dashboardLogger.onFailover(switchId, failedController, target, updated.getFailoverCount(), false);
            eventStream.publish(EventTypes.SWITCH_FAILOVER, SOURCE_ID, EventTypes.SOURCE_SYSTEM, ImmutableMap.of(
                    "switch_id", switchId,
                    "failed_controller", failedController,
                    "new_controller", target,
                    "failover_count", updated.getFailoverCount()), Event.PRIORITY_HIGH);
        }
    }

    private Optional<String> findHealthyBackup(SwitchMapping mapping, String excluded) {
        synchronized (registryLock) {
            for (String backup : mapping.getBackupControllers()) {
                if (backup.equals(excluded)) {
                    continue;
                }
                ControllerEntry entry = controllers.get(backup);
                if (entry != null && entry.info.getHealthStatus() == HealthStatus.HEALTHY) {
                    return Optional.of(backup);
                }
            }
        }
        return Optional.empty();
    }

    private Map<String, List<String>> collectAssignments() {
        Map<String, List<String>> result = new HashMap<>();
        synchronized (mappingLock) {
            for (SwitchMapping mapping : mappings.values()) {
                result.computeIfAbsent(mapping.getCurrentController(), key -> new ArrayList<>())
                        .add(mapping.getSwitchId());
            }
        }
        return result;
    }

    private void handleStreamEvent(Event event) {
        log.debug("Controller {} lifecycle event {} (#{})",
                event.getSourceController(), event.getEventType(), event.getSequenceNumber());
    }

    private void handlePacketIn(String controllerId, PacketData packet) {
        Map<String, Object> data = new HashMap<>();
        data.put("switch_id", packet.getSwitchId());
        data.put("controller_id", controllerId);
        data.put("packet_size", packet.getPayload() == null ? 0 : packet.getPayload().length);
        data.put("metadata", packet.getMetadata());
        String sourceType = packet.getSwitchType() == null ? null : packet.getSwitchType().getValue();
        eventStream.publish(EventTypes.PACKET_IN, controllerId, sourceType, data);
    }

    private static String sourceType(ControllerEntry entry) {
        return entry.info.getConfig().getControllerType().getValue();
    }

    private <T> OperationResult<T> execute(String operation, Operation<T> action) {
        try {
            return OperationResult.success(action.run());
        } catch (OrchestrationException e) {
            log.warn("Unable to {}: {}", operation, e.getMessage());
            return e.toResult();
        } catch (RuntimeException e) {
            log.error("Unable to {}: {}", operation, e.getMessage(), e);
            return OperationResult.error(ErrorCode.INTERNAL_ERROR, e.getMessage());
        }
    }

    private interface Operation<T> {
        T run() throws OrchestrationException;
    }

    private final class ControllerEntry {
        private final ControllerBackend backend;
        private final ControllerInfo info;
        private final PacketInListener packetInListener;
        private final AtomicBoolean checkInFlight = new AtomicBoolean(false);

        private ControllerEntry(ControllerBackend backend, ControllerInfo info) {
            this.backend = backend;
            this.info = info;
            String controllerId = info.getControllerId();
            this.packetInListener = packet -> handlePacketIn(controllerId, packet);
        }

        private String getControllerId() {
            return info.getControllerId();
        }
    }

    /**
     * One health check of a controller. Clears the controller's in-flight flag when the backend call returns,
     * or when the check is abandoned before it had started.
     */
    private static final class HealthCheckTask implements Callable<ControllerHealth> {
        private final ControllerEntry entry;
        private final long deadline;
        private final AtomicBoolean started = new AtomicBoolean(false);
        private Future<ControllerHealth> future;

        private HealthCheckTask(ControllerEntry entry, long deadline) {
            this.entry = entry;
            this.deadline = deadline;
        }

        @Override
        public ControllerHealth call() {
            if (!started.compareAndSet(false, true)) {
                return null;
            }
            try {
                return entry.backend.healthCheck();
            } finally {
                entry.checkInFlight.set(false);
            }
        }

        private void abandon() {
            future.cancel(true);
            if (started.compareAndSet(false, true)) {
                entry.checkInFlight.set(false);
            }
        }
    }
}
