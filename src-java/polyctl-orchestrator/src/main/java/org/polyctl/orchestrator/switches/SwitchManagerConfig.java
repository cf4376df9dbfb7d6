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

package org.polyctl.orchestrator.switches;

import org.polyctl.config.converter.EnumLowerCaseConverter;
import org.polyctl.model.SwitchType;

import com.sabre.oss.conf4j.annotation.Configuration;
import com.sabre.oss.conf4j.annotation.Converter;
import com.sabre.oss.conf4j.annotation.Default;
import com.sabre.oss.conf4j.annotation.Description;
import com.sabre.oss.conf4j.annotation.Key;

@Configuration
@Key("switch-manager")
public interface SwitchManagerConfig {
    @Key("default-switch-type")
    @Default("openflow")
    @Converter(EnumLowerCaseConverter.class)
    @Description("Switch type assumed when neither the registry nor the switch id tell it.")
    SwitchType getDefaultSwitchType();

    @Key("p4runtime.devices")
    @Default("")
    @Description("Comma separated ids of P4Runtime devices.")
    String getP4RuntimeDevices();
}
