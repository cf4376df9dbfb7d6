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
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.polyctl.backend.error.BackendCreationException;
import org.polyctl.model.ControllerConfig;
import org.polyctl.model.ControllerType;
import org.polyctl.model.result.ErrorCode;

import org.junit.jupiter.api.Test;

import java.time.Clock;

public class ControllerBackendFactoryTest {
    private static ControllerConfig config(ControllerType type) {
        return ControllerConfig.builder()
                .controllerId("c-1")
                .controllerType(type)
                .port(8080)
                .build();
    }

    @Test
    public void createsBackendForRegisteredType() throws Exception {
        ControllerBackendFactory factory = new ControllerBackendFactory()
                .register(ControllerType.OPENFLOW, cfg -> new StubBackend(cfg, Clock.systemUTC()));

        ControllerConfig config = config(ControllerType.OPENFLOW);
        ControllerBackend backend = factory.create(config);

        assertEquals("c-1", backend.getControllerId());
        assertSame(config, ((AbstractControllerBackend) backend).getConfig());
        assertTrue(factory.supports(ControllerType.OPENFLOW));
        assertFalse(factory.supports(ControllerType.P4RUNTIME));
    }

    @Test
    public void unknownTypeFails() {
        ControllerBackendFactory factory = new ControllerBackendFactory();

        BackendCreationException error = assertThrows(BackendCreationException.class,
                () -> factory.create(config(ControllerType.CUSTOM)));
        assertEquals(ErrorCode.CONTROLLER_CREATION_FAILED, error.getErrorCode());
    }

    @Test
    public void constructorFailureIsWrapped() {
        ControllerBackendFactory factory = new ControllerBackendFactory()
                .register(ControllerType.P4RUNTIME, cfg -> {
                    throw new IllegalArgumentException("no device id");
                });

        BackendCreationException error = assertThrows(BackendCreationException.class,
                () -> factory.create(config(ControllerType.P4RUNTIME)));
        assertTrue(error.getMessage().contains("no device id"));
    }
}
