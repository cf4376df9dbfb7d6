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
import org.polyctl.model.ControllerConfig;
import org.polyctl.model.ControllerHealth;
import org.polyctl.model.PacketData;
import org.polyctl.model.SwitchInfo;
import org.polyctl.model.SwitchType;

import com.google.common.annotations.VisibleForTesting;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Shared part of backend implementations: connection flag, packet-in fan-out, activity counters and the
 * health check algorithm built on top of {@link #ping()}.
 */
@Slf4j
public abstract class AbstractControllerBackend implements ControllerBackend {
    @Getter
    protected final ControllerConfig config;
    protected final Clock clock;

    protected final Map<String, SwitchInfo> switches = new ConcurrentHashMap<>();
    private final List<PacketInListener> packetInListeners = new CopyOnWriteArrayList<>();

    private volatile boolean connected;
    private final Instant startTime;
    private volatile Instant lastActivity;

    private final AtomicLong packetCount = new AtomicLong();
    private final AtomicLong flowCount = new AtomicLong();
    private final AtomicLong eventCount = new AtomicLong();

    private final AtomicInteger errorCount = new AtomicInteger();
    private volatile String lastError;

    protected AbstractControllerBackend(ControllerConfig config) {
        this(config, Clock.systemUTC());
    }

    protected AbstractControllerBackend(ControllerConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.startTime = clock.instant();
        this.lastActivity = startTime;
    }

    @Override
    public String getControllerId() {
        return config.getControllerId();
    }

    @Override
    public SwitchType getSwitchType() {
        return SwitchType.UNKNOWN;
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    protected void setConnected(boolean connected) {
        this.connected = connected;
    }

    @Override
    public void subscribePacketIn(PacketInListener listener) {
        if (!packetInListeners.contains(listener)) {
            packetInListeners.add(listener);
        }
    }

    @Override
    public void unsubscribePacketIn(PacketInListener listener) {
        packetInListeners.remove(listener);
    }

    /**
     * Delivers a packet-in to every listener. A failing listener does not stop delivery to the others.
     */
    protected void notifyPacketIn(PacketData packet) {
        packetCount.incrementAndGet();
        lastActivity = clock.instant();

        for (PacketInListener listener : packetInListeners) {
            try {
                listener.onPacketIn(packet);
            } catch (RuntimeException e) {
                log.error("Packet-in listener {} of controller {} has failed", listener, getControllerId(), e);
            }
        }
    }

    protected void updateActivity() {
        lastActivity = clock.instant();
        eventCount.incrementAndGet();
    }

    protected void incrementFlowCount() {
        flowCount.incrementAndGet();
        updateActivity();
    }

    @Override
    public final ControllerHealth healthCheck() {
        Instant start = clock.instant();
        boolean healthy;
        String error = null;
        try {
            boolean alive = ping();
            healthy = alive && connected;
            if (!healthy) {
                error = "Ping failed or not connected";
            }
        } catch (BackendOperationException | RuntimeException e) {
            log.error("Health check of controller {} has failed: {}", getControllerId(), e.getMessage());
            healthy = false;
            error = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        }

        Instant now = clock.instant();
        int errors;
        if (healthy) {
            lastError = null;
            errors = errorCount.get();
        } else {
            lastError = error;
            errors = errorCount.incrementAndGet();
        }

        return ControllerHealth.builder()
                .healthy(healthy)
                .lastCheck(now)
                .responseTimeMs(Duration.between(start, now).toNanos() / 1_000_000.0)
                .errorCount(errors)
                .lastError(error)
                .uptimeSeconds(Duration.between(startTime, now).toMillis() / 1000.0)
                .detail(ControllerHealth.DETAIL_CONNECTED, connected)
                .detail(ControllerHealth.DETAIL_SWITCH_COUNT, switches.size())
                .detail(ControllerHealth.DETAIL_PACKET_COUNT, packetCount.get())
                .detail(ControllerHealth.DETAIL_FLOW_COUNT, flowCount.get())
                .detail(ControllerHealth.DETAIL_EVENT_COUNT, eventCount.get())
                .detail(ControllerHealth.DETAIL_LAST_ACTIVITY, lastActivity.toString())
                .detail(ControllerHealth.DETAIL_CONTROLLER_ID, getControllerId())
                .detail(ControllerHealth.DETAIL_SWITCH_TYPE, getSwitchType().getValue())
                .build();
    }

    @Override
    public void resetErrorCount() {
        errorCount.set(0);
        lastError = null;
    }

    @VisibleForTesting
    int getErrorCount() {
        return errorCount.get();
    }

    protected String getLastError() {
        return lastError;
    }
}
