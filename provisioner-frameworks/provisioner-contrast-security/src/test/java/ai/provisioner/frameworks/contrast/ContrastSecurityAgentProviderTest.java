/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ai.provisioner.frameworks.contrast;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.provisioner.api.runtime.ComponentRegistry;
import ai.provisioner.api.runtime.FrameworkComponent;
import ai.provisioner.api.runtime.FrameworkComponentProvider;
import ai.provisioner.api.runtime.ProvisioningContext;
import ai.provisioner.impl.cloudfoundry.VcapServiceBindings;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;

class ContrastSecurityAgentProviderTest {

    @Test
    void testLookupComponent() {
        ComponentRegistry registry = new ComponentRegistry();
        FrameworkComponentProvider provider =
                registry.lookupComponent(ContrastSecurityAgentProvisioner.COMPONENT_ID);
        assertInstanceOf(ContrastSecurityAgentProvider.class, provider);
        assertThrows(IllegalArgumentException.class, () -> registry.lookupComponent("unknown"));
    }

    @Test
    void testCreateComponents() {
        ProvisioningContext context =
                ProvisioningContext.builder()
                        .applicationRoot(Path.of("app"))
                        .serviceBindings(VcapServiceBindings.parse(null))
                        .build();
        List<FrameworkComponent> components = new ComponentRegistry().createComponents(context);
        assertEquals(1, components.size());
        assertEquals("contrast-security-agent", components.get(0).getId());
        assertTrue(components.get(0) instanceof ContrastSecurityAgentProvisioner);
    }
}
