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
package ai.provisioner.api.runtime;

import ai.provisioner.api.model.ApplicationDetails;
import ai.provisioner.api.model.EnvironmentVariables;
import ai.provisioner.api.model.JavaOpts;
import java.nio.file.Path;
import lombok.Builder;
import lombok.Getter;

/**
 * Everything a component needs during a provisioning run. The orchestrator owns the {@link
 * JavaOpts} and the {@link EnvironmentVariables}, components only append to them.
 */
@Builder
@Getter
public class ProvisioningContext {

    private final Path applicationRoot;

    @Builder.Default
    private final ApplicationDetails applicationDetails = ApplicationDetails.UNKNOWN;

    private final ServiceBindings serviceBindings;

    private final ArtifactInstaller artifactInstaller;

    private final PathQualifier pathQualifier;

    @Builder.Default private final JavaOpts javaOpts = new JavaOpts();

    @Builder.Default
    private final EnvironmentVariables environmentVariables = new EnvironmentVariables();

    private final ProvisionerLogger logger;
}
