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

import org.polyctl.backend.ControllerBackendFactory;
import org.polyctl.config.provider.ConfigurationProvider;
import org.polyctl.config.provider.PropertiesBasedConfigurationProvider;
import org.polyctl.event.EventFilter;
import org.polyctl.event.EventStream;
import org.polyctl.event.audit.EventAuditLogger;
import org.polyctl.event.config.EventStreamConfig;
import org.polyctl.orchestrator.controller.ControllerManager;
import org.polyctl.orchestrator.controller.ControllerManagerConfig;
import org.polyctl.orchestrator.switches.SwitchManager;
import org.polyctl.orchestrator.switches.SwitchManagerConfig;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * Wires the event stream, the controller manager and the switch manager together and drives their
 * lifecycle.
 */
@Slf4j
@Getter
public class PolyctlEngine implements AutoCloseable {
    public static final String DEFAULT_CONFIG_RESOURCE = "polyctl.properties";

    private final PolyctlConfig config;
    private final EventStream eventStream;
    private final ControllerManager controllerManager;
    private final SwitchManager switchManager;

    public PolyctlEngine(ConfigurationProvider configurationProvider, ControllerBackendFactory backendFactory) {
        this.config = configurationProvider.getConfiguration(PolyctlConfig.class);
        this.eventStream = new EventStream(configurationProvider.getConfiguration(EventStreamConfig.class));
        this.controllerManager = new ControllerManager(
                configurationProvider.getConfiguration(ControllerManagerConfig.class), eventStream, backendFactory);
        this.switchManager = new SwitchManager(
                configurationProvider.getConfiguration(SwitchManagerConfig.class), controllerManager);
    }

    /**
     * Builds the engine from the {@value #DEFAULT_CONFIG_RESOURCE} classpath resource.
     */
    public static PolyctlEngine create(ControllerBackendFactory backendFactory) throws IOException {
        return new PolyctlEngine(new PropertiesBasedConfigurationProvider(DEFAULT_CONFIG_RESOURCE), backendFactory);
    }

    public void start() {
        log.info("Starting polyctl engine");
        eventStream.start();
        if (config.isAuditLogEnabled()) {
            boolean attached = new EventAuditLogger().attach(eventStream, EventFilter.builder()
                    .minPriority(config.getAuditLogMinPriority())
                    .build());
            if (!attached) {
                log.warn("Event audit logger is already attached");
            }
        }
        controllerManager.start();
    }

    public void stop() {
        log.info("Stopping polyctl engine");
        controllerManager.stop();
        switchManager.shutdown();
        eventStream.stop();
    }

    @Override
    public void close() {
        stop();
    }
}
