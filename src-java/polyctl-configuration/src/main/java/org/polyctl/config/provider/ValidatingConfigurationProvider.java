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

import static java.lang.String.format;

import com.sabre.oss.conf4j.factory.ConfigurationFactory;
import com.sabre.oss.conf4j.source.ConfigurationSource;
import lombok.extern.slf4j.Slf4j;

import java.util.Set;
import javax.validation.ConstraintViolation;
import javax.validation.Validation;
import javax.validation.Validator;
import javax.validation.ValidatorFactory;

/**
 * {@link ConfigurationProvider} which checks the produced configuration against its bean validation constraints.
 */
@Slf4j
public class ValidatingConfigurationProvider implements ConfigurationProvider {
    private final ConfigurationSource source;
    private final ConfigurationFactory factory;
    private final Validator validator;

    public ValidatingConfigurationProvider(ConfigurationSource source, ConfigurationFactory factory) {
        this.source = source;
        this.factory = factory;

        ValidatorFactory validatorFactory = Validation.buildDefaultValidatorFactory();
        this.validator = validatorFactory.getValidator();
    }

    @Override
    public <T> T getConfiguration(Class<T> configurationType) {
        T instance = factory.createConfiguration(configurationType, source);

        Set<ConstraintViolation<T>> errors = validator.validate(instance);
        if (!errors.isEmpty()) {
            String message = format("Invalid configuration %s", configurationType.getSimpleName());
            log.error("{} ({} violations)", message, errors.size());
            throw new ConfigurationException(message, errors);
        }

        return instance;
    }
}
