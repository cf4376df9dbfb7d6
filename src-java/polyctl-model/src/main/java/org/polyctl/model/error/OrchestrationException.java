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

package org.polyctl.model.error;

import org.polyctl.model.result.ErrorCode;
import org.polyctl.model.result.OperationResult;

import lombok.Getter;

/**
 * Base of the failures raised inside the orchestration layer. Each carries the {@link ErrorCode} it is
 * reported with once converted into an {@link OperationResult}.
 */
@Getter
public class OrchestrationException extends Exception {
    private final ErrorCode errorCode;

    public OrchestrationException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public OrchestrationException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public <T> OperationResult<T> toResult() {
        return OperationResult.error(errorCode, getMessage());
    }
}
