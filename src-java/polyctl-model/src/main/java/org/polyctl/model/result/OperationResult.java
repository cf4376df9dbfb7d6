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

package org.polyctl.model.result;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;

import java.util.Optional;

/**
 * Either a payload of a successful operation or an error code with a human readable message. Public
 * operations of the orchestration layer never throw, they report failures through this type.
 *
 * @param <T> payload type
 */
@ToString
@EqualsAndHashCode
@JsonInclude(Include.NON_NULL)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class OperationResult<T> {
    @JsonProperty("data")
    private final T payload;
    private final ErrorCode errorCode;
    private final String errorMessage;

    public static <T> OperationResult<T> success(@NonNull T payload) {
        return new OperationResult<>(payload, null, null);
    }

    public static <T> OperationResult<T> error(@NonNull ErrorCode errorCode, String errorMessage) {
        return new OperationResult<>(null, errorCode, errorMessage);
    }

    /**
     * Re-types a failed result, used to pass an error through a call chain.
     */
    public <R> OperationResult<R> castError() {
        if (isSuccess()) {
            throw new IllegalStateException("Can't cast successful result " + this);
        }
        return new OperationResult<>(null, errorCode, errorMessage);
    }

    @JsonProperty("success")
    public boolean isSuccess() {
        return errorCode == null;
    }

    /**
     * Payload of a successful result.
     *
     * @throws IllegalStateException if the result is an error
     */
    @JsonIgnore
    public T getPayload() {
        if (!isSuccess()) {
            throw new IllegalStateException(String.format("No payload in failed result %s: %s",
                    errorCode, errorMessage));
        }
        return payload;
    }

    @JsonIgnore
    public Optional<T> asOptional() {
        return Optional.ofNullable(payload);
    }

    @JsonProperty("error_code")
    public ErrorCode getErrorCode() {
        return errorCode;
    }

    @JsonProperty("error")
    public String getErrorMessage() {
        return errorMessage;
    }
}
