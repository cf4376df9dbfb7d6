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

package org.polyctl.orchestrator;

import com.sabre.oss.conf4j.annotation.Configuration;
import com.sabre.oss.conf4j.annotation.Default;
import com.sabre.oss.conf4j.annotation.Key;

import javax.validation.constraints.Max;
import javax.validation.constraints.Min;

@Configuration
@Key("engine")
public interface PolyctlConfig {
    @Key("audit-log-enabled")
    @Default("false")
    boolean isAuditLogEnabled();

    @Key("audit-log-min-priority")
    @Default("1")
    @Min(1)
    @Max(3)
    int getAuditLogMinPriority();
}
