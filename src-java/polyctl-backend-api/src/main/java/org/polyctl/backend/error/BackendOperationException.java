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

package org.polyctl.backend.error;

import lombok.Getter;

/**
 * A backend failed to carry out a switch or controller operation.
 */
@Getter
public class BackendOperationException extends Exception {
    private final String controllerId;

    public BackendOperationException(String controllerId, String message) {
        super(message);
        this.controllerId = controllerId;
    }

    public BackendOperationException(String controllerId, String message, Throwable cause) {
        super(message, cause);
        this.controllerId = controllerId;
    }
}
