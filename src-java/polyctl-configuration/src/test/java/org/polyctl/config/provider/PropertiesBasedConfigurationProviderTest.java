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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.polyctl.config.converter.EnumLowerCaseConverter;

import com.sabre.oss.conf4j.annotation.Configuration;
import com.sabre.oss.conf4j.annotation.Converter;
import com.sabre.oss.conf4j.annotation.Default;
import com.sabre.oss.conf4j.annotation.Key;
import org.junit.jupiter.api.Test;

import java.io.FileNotFoundException;
import java.util.Properties;

public class PropertiesBasedConfigurationProviderTest {
    @Test
    public void shouldReadValuesFromClasspathResource() throws Exception {
        PropertiesBasedConfigurationProvider provider =
                new PropertiesBasedConfigurationProvider("provider-test.properties");

        SampleConfig config = provider.getConfiguration(SampleConfig.class);

        assertEquals("edge-controller", config.getName());
        assertEquals(Mode.STANDBY, config.getMode());
    }

    @Test
    public void shouldApplyDefaultsForEmptyProperties() {
        SampleConfig config = new PropertiesBasedConfigurationProvider(new Properties())
                .getConfiguration(SampleConfig.class);

        assertEquals("unnamed", config.getName());
        assertEquals(Mode.ACTIVE, config.getMode());
    }

    @Test
    public void shouldFailOnMissingResource() {
        assertThrows(FileNotFoundException.class,
                () -> new PropertiesBasedConfigurationProvider("missing-resource.properties"));
    }

    public enum Mode {
        ACTIVE, STANDBY
    }

    @Configuration
    @Key("sample")
    public interface SampleConfig {
        @Key("name")
        @Default("unnamed")
        String getName();

        @Key("mode")
        @Default("active")
        @Converter(EnumLowerCaseConverter.class)
        Mode getMode();
    }
}
