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
package ai.provisioner.runtime;

import ai.provisioner.api.model.JavaOpts;
import ai.provisioner.api.runtime.ComponentRegistry;
import ai.provisioner.api.runtime.ProvisioningContext;
import ai.provisioner.impl.cloudfoundry.VcapApplication;
import ai.provisioner.impl.cloudfoundry.VcapServiceBindings;
import ai.provisioner.impl.common.Slf4jProvisionerLogger;
import ai.provisioner.impl.config.ComponentConfigurationLoader;
import ai.provisioner.impl.deploy.ProvisioningLifecycle;
import ai.provisioner.impl.http.HttpClientFacade;
import ai.provisioner.impl.install.CachingArtifactInstaller;
import ai.provisioner.impl.install.DropletPathQualifier;
import ai.provisioner.impl.repository.RepositoryIndexVersionResolver;
import java.io.PrintStream;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;

/**
 * Common entry point of the {@code detect}, {@code compile} and {@code release} commands. The
 * first argument is the application directory, the optional second one the download cache.
 * Bindings and application details are read from {@code VCAP_SERVICES} and {@code
 * VCAP_APPLICATION}, the JVM options configured so far from {@code JAVA_OPTS}.
 */
@Slf4j
public abstract class ProvisionerStarter extends RuntimeStarter {

    public static final String JAVA_OPTS_ENV = "JAVA_OPTS";

    static MainErrorHandler mainErrorHandler =
            error -> {
                log.error("Unexpected error", error);
                System.exit(-1);
            };

    public interface MainErrorHandler {
        void handleError(Throwable error);
    }

    private final ComponentRegistry componentRegistry;
    protected final PrintStream out;

    protected ProvisionerStarter(ComponentRegistry componentRegistry, PrintStream out) {
        this.componentRegistry = componentRegistry;
        this.out = out;
    }

    static void runMain(ProvisionerStarter starter, String... args) {
        try {
            starter.start(args);
        } catch (Throwable error) {
            mainErrorHandler.handleError(error);
        }
    }

    @Override
    public void start(String... args) throws Exception {
        final Path applicationRoot = getDirectoryFromArgs(args, 0, "application directory");
        final Path cacheDirectory = getOptionalPathFromArgs(args, 1);

        HttpClientFacade httpClient = new HttpClientFacade();
        try (CachingArtifactInstaller installer =
                new CachingArtifactInstaller(cacheDirectory, httpClient)) {
            ProvisioningContext context =
                    ProvisioningContext.builder()
                            .applicationRoot(applicationRoot)
                            .applicationDetails(
                                    VcapApplication.parse(
                                            getEnv(VcapApplication.VCAP_APPLICATION_ENV)))
                            .serviceBindings(
                                    VcapServiceBindings.parse(
                                            getEnv(VcapServiceBindings.VCAP_SERVICES_ENV)))
                            .artifactInstaller(installer)
                            .pathQualifier(new DropletPathQualifier(applicationRoot))
                            .javaOpts(JavaOpts.parse(getEnv(JAVA_OPTS_ENV)))
                            .logger(Slf4jProvisionerLogger.forClass(getClass()))
                            .build();
            ProvisioningLifecycle lifecycle =
                    new ProvisioningLifecycle(
                            componentRegistry.createComponents(context),
                            new ComponentConfigurationLoader(
                                    this::getEnv, ProvisionerStarter.class.getClassLoader()),
                            new RepositoryIndexVersionResolver(httpClient));
            run(lifecycle, context);
        }
    }

    protected abstract void run(ProvisioningLifecycle lifecycle, ProvisioningContext context)
            throws Exception;
}
