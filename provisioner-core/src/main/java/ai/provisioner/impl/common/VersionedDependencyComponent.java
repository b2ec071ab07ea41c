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
package ai.provisioner.impl.common;

import ai.provisioner.api.model.ResolvedArtifact;
import ai.provisioner.api.model.ResolvedVersion;
import ai.provisioner.api.runtime.FrameworkComponent;
import ai.provisioner.api.runtime.ProvisionerLogger;
import ai.provisioner.api.runtime.ProvisioningContext;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Base class for components that install a single versioned jar into their sandbox, {@code
 * <application root>/.java-buildpack/<component_id>}.
 */
public abstract class VersionedDependencyComponent implements FrameworkComponent {

    public static final String SANDBOX_ROOT = ".java-buildpack";

    protected final ProvisioningContext context;
    protected final ProvisionerLogger logger;

    protected VersionedDependencyComponent(ProvisioningContext context) {
        this.context = Objects.requireNonNull(context);
        this.logger =
                context.getLogger() != null
                        ? context.getLogger()
                        : Slf4jProvisionerLogger.forClass(getClass());
    }

    @Override
    public boolean detect() {
        return supports();
    }

    @Override
    public void compile(ResolvedArtifact artifact) throws IOException {
        downloadJar(artifact);
    }

    /** Whether the component applies to the application. Must not have side effects. */
    protected abstract boolean supports();

    /** The name of the installed jar for the given version. */
    protected abstract String jarName(ResolvedVersion version);

    protected Path downloadJar(ResolvedArtifact artifact) throws IOException {
        String jarName = jarName(artifact.version());
        logger.log("Downloading " + getId() + " " + artifact.version() + " from " + artifact.uri());
        try {
            return context.getArtifactInstaller().install(artifact.uri(), jarName, getSandbox());
        } catch (IOException e) {
            logger.error("Cannot install " + getId() + " " + artifact.version() + ": " + e);
            throw e;
        }
    }

    public Path getSandbox() {
        return context.getApplicationRoot()
                .resolve(SANDBOX_ROOT)
                .resolve(getId().replace('-', '_'));
    }

    protected String qualifyPath(Path path) {
        return context.getPathQualifier().qualify(path);
    }
}
