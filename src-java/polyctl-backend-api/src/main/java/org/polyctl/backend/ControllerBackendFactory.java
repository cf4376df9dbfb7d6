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

import org.polyctl.backend.error.BackendCreationException;
import org.polyctl.model.ControllerConfig;
import org.polyctl.model.ControllerType;

import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Builds backend instances for controller registrations, one constructor per {@link ControllerType}.
 */
@Slf4j
public class ControllerBackendFactory {
    private final Map<ControllerType, Function<ControllerConfig, ? extends ControllerBackend>> constructors =
            new EnumMap<>(ControllerType.class);

    /**
     * Binds a constructor to the controller type, replacing the previous binding if any.
     */
    public synchronized ControllerBackendFactory register(
            ControllerType type, Function<ControllerConfig, ? extends ControllerBackend> constructor) {
        Function<ControllerConfig, ? extends ControllerBackend> replaced = constructors.put(type, constructor);
        if (replaced != null) {
            log.info("Backend constructor for controller type {} has been replaced", type);
        }
        return this;
    }

    public synchronized boolean supports(ControllerType type) {
        return constructors.containsKey(type);
    }

    /**
     * Produces a backend for the controller.
     *
     * @throws BackendCreationException no constructor for the type, or the constructor has failed
     */
    public ControllerBackend create(ControllerConfig config) throws BackendCreationException {
        Function<ControllerConfig, ? extends ControllerBackend> constructor;
        synchronized (this) {
            constructor = constructors.get(config.getControllerType());
        }
        if (constructor == null) {
            throw new BackendCreationException(String.format(
                    "Unsupported controller type %s of controller %s",
                    config.getControllerType(), config.getControllerId()));
        }

        ControllerBackend backend;
        try {
            backend = constructor.apply(config);
        } catch (RuntimeException e) {
            throw new BackendCreationException(String.format(
                    "Unable to create backend for controller %s: %s", config.getControllerId(), e.getMessage()), e);
        }
        if (backend == null) {
            throw new BackendCreationException(
                    "Backend constructor returned nothing for controller " + config.getControllerId());
        }
        return backend;
    }
}
