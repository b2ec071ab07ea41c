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
package ai.provisioner.impl.deploy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import ai.provisioner.api.model.ResolvedArtifact;
import ai.provisioner.api.model.ResolvedVersion;
import ai.provisioner.api.runtime.ArtifactInstallException;
import ai.provisioner.api.runtime.ComponentConfiguration;
import ai.provisioner.api.runtime.FrameworkComponent;
import ai.provisioner.api.runtime.VersionResolver;
import ai.provisioner.impl.config.ComponentConfigurationLoader;
import java.net.URI;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ProvisioningLifecycleTest {

    private static final ResolvedArtifact ARTIFACT =
            new ResolvedArtifact(
                    ResolvedVersion.parse("3.4.3_000"),
                    URI.create("https://repo.example.com/java-agent-3.4.3.jar"));

    private static FrameworkComponent component(String id, boolean detected) {
        FrameworkComponent component = mock(FrameworkComponent.class);
        when(component.getId()).thenReturn(id);
        when(component.detect()).thenReturn(detected);
        when(component.identifier(any())).thenCallRealMethod();
        return component;
    }

    @Test
    void testOnlyDetectedComponentsAreProvisioned() throws Exception {
        FrameworkComponent applies = component("contrast-security-agent", true);
        FrameworkComponent skipped = component("other-agent", false);
        VersionResolver resolver = mock(VersionResolver.class);
        when(resolver.resolve(any())).thenReturn(ARTIFACT);
        ComponentConfigurationLoader loader = mock(ComponentConfigurationLoader.class);
        when(loader.load("contrast-security-agent"))
                .thenReturn(new ComponentConfiguration("contrast-security-agent", Map.of()));

        ProvisioningLifecycle lifecycle =
                new ProvisioningLifecycle(List.of(applies, skipped), loader, resolver);
        List<ProvisioningLifecycle.DetectedComponent> detected = lifecycle.detect();

        assertEquals(1, detected.size());
        assertSame(applies, detected.get(0).component());
        assertEquals("contrast-security-agent=3.4.3_000", detected.get(0).identifier());
        verify(loader, never()).load("other-agent");

        lifecycle.compile(detected);
        lifecycle.release(detected);

        verify(applies).compile(ARTIFACT);
        verify(applies).release(ARTIFACT);
        verify(skipped, never()).compile(any());
        verify(skipped, never()).release(any());
        verify(resolver, times(1)).resolve(any());
    }

    @Test
    void testCompileFailurePropagates() throws Exception {
        FrameworkComponent applies = component("contrast-security-agent", true);
        ArtifactInstallException failure = new ArtifactInstallException(ARTIFACT.uri(), 503);
        doThrow(failure).when(applies).compile(ARTIFACT);

        ProvisioningLifecycle lifecycle =
                new ProvisioningLifecycle(
                        List.of(applies),
                        mock(ComponentConfigurationLoader.class),
                        configuration -> ARTIFACT);

        ArtifactInstallException error =
                assertThrows(
                        ArtifactInstallException.class,
                        () -> lifecycle.compile(lifecycle.detect()));
        assertSame(failure, error);
    }
}
