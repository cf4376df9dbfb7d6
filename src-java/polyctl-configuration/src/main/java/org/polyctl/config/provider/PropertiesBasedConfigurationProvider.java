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

import com.sabre.oss.conf4j.factory.jdkproxy.JdkProxyStaticConfigurationFactory;
import com.sabre.oss.conf4j.source.PropertiesConfigurationSource;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Validating {@link ConfigurationProvider} backed by a properties object or a classpath properties resource.
 *
 * @see Properties
 * @see PropertiesConfigurationSource
 * @see JdkProxyStaticConfigurationFactory
 */
public class PropertiesBasedConfigurationProvider extends ValidatingConfigurationProvider {
    public PropertiesBasedConfigurationProvider() {
        this(new Properties());
    }

    public PropertiesBasedConfigurationProvider(Properties properties) {
        super(new PropertiesConfigurationSource(properties), new JdkProxyStaticConfigurationFactory());
    }

    public PropertiesBasedConfigurationProvider(String propertiesResource) throws IOException {
        this(loadResource(propertiesResource));
    }

    private static Properties loadResource(String propertiesResource) throws IOException {
        Properties properties = new Properties();
        try (InputStream stream = PropertiesBasedConfigurationProvider.class.getClassLoader()
                .getResourceAsStream(propertiesResource)) {
            if (stream == null) {
                throw new FileNotFoundException(
                        String.format("Properties resource \"%s\" is not on the classpath", propertiesResource));
            }
            properties.load(stream);
        }
        return properties;
    }
}
