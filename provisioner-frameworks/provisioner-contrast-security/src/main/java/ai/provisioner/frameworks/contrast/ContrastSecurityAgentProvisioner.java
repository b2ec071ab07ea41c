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

import ai.provisioner.api.model.CredentialSet;
import ai.provisioner.api.model.EnvironmentVariable;
import ai.provisioner.api.model.EnvironmentVariables;
import ai.provisioner.api.model.JavaOpts;
import ai.provisioner.api.model.ResolvedArtifact;
import ai.provisioner.api.model.ResolvedVersion;
import ai.provisioner.api.runtime.ProvisioningContext;
import ai.provisioner.api.util.ConfigurationUtils;
import ai.provisioner.impl.common.VersionedDependencyComponent;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Installs the Contrast Security Java agent when exactly one {@code contrast-security} service
 * is bound, and configures it through {@code CONTRAST__} environment variables.
 */
public class ContrastSecurityAgentProvisioner extends VersionedDependencyComponent {

    public static final String COMPONENT_ID = "contrast-security-agent";

    static final Pattern FILTER = Pattern.compile("contrast-security");

    private final ContrastEnvironmentBuilder environmentBuilder;

    public ContrastSecurityAgentProvisioner(ProvisioningContext context) {
        this(context, new ContrastEnvironmentBuilder());
    }

    ContrastSecurityAgentProvisioner(
            ProvisioningContext context, ContrastEnvironmentBuilder environmentBuilder) {
        super(context);
        this.environmentBuilder = environmentBuilder;
    }

    @Override
    public String getId() {
        return COMPONENT_ID;
    }

    @Override
    protected boolean supports() {
        return context.getServiceBindings().oneService(FILTER, ContrastCredentials.REQUIRED_KEYS);
    }

    @Override
    protected String jarName(ResolvedVersion version) {
        return VersionSelector.jarName(version);
    }

    @Override
    public void release(ResolvedArtifact artifact) {
        CredentialSet credentialSet =
                context.getServiceBindings()
                        .findService(FILTER, ContrastCredentials.REQUIRED_KEYS)
                        .orElseThrow(
                                () ->
                                        new IllegalStateException(
                                                "Expected exactly one bound service matching "
                                                        + FILTER));
        if (logger.isDebugEnabled()) {
            logger.debug(
                    "Contrast Security credentials "
                            + ConfigurationUtils.redactSecrets(credentialSet.asMap()));
        }
        ContrastCredentials credentials = ContrastCredentials.from(credentialSet);

        JavaOpts javaOpts = context.getJavaOpts();
        javaOpts.addJavaAgent(
                qualifyPath(getSandbox().resolve(jarName(artifact.version()))));

        List<EnvironmentVariable> variables =
                environmentBuilder.build(
                        credentials,
                        javaOpts,
                        context.getApplicationDetails().applicationNameOrDefault());
        EnvironmentVariables environmentVariables = context.getEnvironmentVariables();
        variables.forEach(environmentVariables::add);
        logger.log("Configured " + variables.size() + " Contrast Security environment variables");
    }
}
