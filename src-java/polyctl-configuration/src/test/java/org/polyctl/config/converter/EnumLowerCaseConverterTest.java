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

package org.polyctl.config.converter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class EnumLowerCaseConverterTest {
    private enum Protocol {
        OPENFLOW, P4RUNTIME
    }

    private final EnumLowerCaseConverter converter = new EnumLowerCaseConverter();

    @Test
    public void toStringTest() {
        assertEquals("openflow", converter.toString(Protocol.class, Protocol.OPENFLOW, null));
        assertEquals("p4runtime", converter.toString(Protocol.class, Protocol.P4RUNTIME, null));
        assertNull(converter.toString(Protocol.class, null, null));
    }

    @Test
    public void fromValidStringTest() {
        assertEquals(Protocol.OPENFLOW, converter.fromString(Protocol.class, "openflow", null));
        assertEquals(Protocol.OPENFLOW, converter.fromString(Protocol.class, "OpenFlow", null));
        assertEquals(Protocol.P4RUNTIME, converter.fromString(Protocol.class, " p4runtime ", null));
        assertNull(converter.fromString(Protocol.class, null, null));
    }

    @Test
    public void fromInvalidStringTest() {
        assertThrows(IllegalArgumentException.class, () -> converter.fromString(Protocol.class, "netconf", null));
    }
}
