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

import ai.provisioner.api.model.ResolvedArtifact;
import ai.provisioner.api.runtime.FrameworkComponent;
import ai.provisioner.api.runtime.VersionResolver;
import ai.provisioner.impl.config.ComponentConfigurationLoader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Drives components through detect, compile and release. The version of a component is
 * resolved once, right after a positive detection, and the same artifact is handed to the
 * following phases. Components that are not detected never see compile or release.
 */
@Slf4j
public class ProvisioningLifecycle {

    private final List<FrameworkComponent> components;
    private final ComponentConfigurationLoader configurationLoader;
    private final VersionResolver versionResolver;

    public ProvisioningLifecycle(
            List<FrameworkComponent> components,
            ComponentConfigurationLoader configurationLoader,
            VersionResolver versionResolver) {
        this.components = List.copyOf(components);
        this.configurationLoader = configurationLoader;
        this.versionResolver = versionResolver;
    }

    public record DetectedComponent(FrameworkComponent component, ResolvedArtifact artifact) {

        public String identifier() {
            return component.identifier(artifact.version());
        }
    }

    public List<DetectedComponent> detect() {
        List<DetectedComponent> detected = new ArrayList<>();
        for (FrameworkComponent component : components) {
            if (!component.detect()) {
                log.debug("Component {} does not apply", component.getId());
                continue;
            }
            ResolvedArtifact artifact =
                    versionResolver.resolve(configurationLoader.load(component.getId()));
            DetectedComponent result = new DetectedComponent(component, artifact);
            log.info("Detected {}", result.identifier());
            detected.add(result);
        }
        return detected;
    }

    public void compile(List<DetectedComponent> detected) throws IOException {
        for (DetectedComponent d : detected) {
            log.info("Compiling {}", d.identifier());
            d.component().compile(d.artifact());
        }
    }

    public void release(List<DetectedComponent> detected) {
        for (DetectedComponent d : detected) {
            log.info("Releasing {}", d.identifier());
            d.component().release(d.artifact());
        }
    }
}
