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

import org.polyctl.model.ControllerConfig;
import org.polyctl.model.ControllerStatus;
import org.polyctl.model.HealthStatus;
import org.polyctl.reporting.AbstractDashboardLogger;

import org.slf4j.Logger;
import org.slf4j.event.Level;

import java.util.Map;

public class ControllerDashboardLogger extends AbstractDashboardLogger {
    public ControllerDashboardLogger(Logger logger) {
        super(logger);
    }

    public void onRegistered(ControllerConfig config) {
        Map<String, String> context = makeContext("polyctl-controller-registered", config.getControllerId());
        context.put("controller_type", config.getControllerType().getValue());
        invokeLogger(String.format("Controller %s (%s) registered at %s:%d", config.getControllerId(),
                config.getControllerType(), config.getHost(), config.getPort()), context);
    }

    public void onDeregistered(String controllerId) {
        invokeLogger(String.format("Controller %s deregistered", controllerId),
                makeContext("polyctl-controller-deregistered", controllerId));
    }

    /**
     * Log controller lifecycle status change.
     */
    public void onStatusChange(String controllerId, ControllerStatus status, String error) {
        Map<String, String> context = makeContext("polyctl-controller-status", controllerId);
        context.put("status", status.toString());
        if (error == null) {
            invokeLogger(String.format("Controller %s is %s", controllerId, status), context);
        } else {
            invokeLogger(Level.ERROR, String.format("Controller %s is %s: %s", controllerId, status, error), context);
        }
    }

    /**
     * Log health status transition.
     */
    public void onHealthChange(String controllerId, HealthStatus from, HealthStatus to) {
        Map<String, String> context = makeContext("polyctl-controller-health", controllerId);
        context.put("health_status", to.toString());
        Level level = to == HealthStatus.UNHEALTHY ? Level.WARN : Level.INFO;
        invokeLogger(level, String.format("Controller %s health %s ==> %s", controllerId, from, to), context);
    }

    /**
     * Log switch takeover by another controller.
     */
    public void onFailover(String switchId, String from, String to, int failoverCount, boolean manual) {
        Map<String, String> context = makeContext(manual ? "polyctl-manual-failover" : "polyctl-switch-failover", to);
        context.put(SWITCH_ID, switchId);
        context.put("failover_count", String.valueOf(failoverCount));
        invokeLogger(Level.WARN, String.format("Switch %s failover %s ==> %s (failover #%d)",
                switchId, from, to, failoverCount), context);
    }

    public void onFailoverImpossible(String switchId, String failedController) {
        Map<String, String> context = makeContext("polyctl-switch-stranded", failedController);
        context.put(SWITCH_ID, switchId);
        invokeLogger(Level.ERROR, String.format("No healthy backup controller available for switch %s, "
                + "it stays on failed controller %s", switchId, failedController), context);
    }

    private Map<String, String> makeContext(String eventType, String controllerId) {
        Map<String, String> context = makeContext(eventType);
        context.put(CONTROLLER_ID, controllerId);
        return context;
    }
}
