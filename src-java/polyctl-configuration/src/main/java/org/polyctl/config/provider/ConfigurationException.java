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

package org.polyctl.config.provider;

import static java.util.stream.Collectors.joining;

import java.util.Collections;
import java.util.Set;
import javax.validation.ConstraintViolation;

/**
 * Indicates that a configuration can't be built or doesn't satisfy its constraints.
 */
public class ConfigurationException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final transient Set<? extends ConstraintViolation<?>> errors;

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.errors = Collections.emptySet();
    }

    public ConfigurationException(String message, Set<? extends ConstraintViolation<?>> errors) {
        super(message + ": " + errors.stream()
                .map(e -> e.getPropertyPath() + " " + e.getMessage())
                .sorted()
                .collect(joining(", ")));
        this.errors = errors;
    }

    public Set<? extends ConstraintViolation<?>> getErrors() {
        return errors;
    }
}
