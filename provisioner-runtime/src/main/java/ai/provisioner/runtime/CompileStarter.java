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

import ai.provisioner.api.runtime.ComponentRegistry;
import ai.provisioner.api.runtime.ProvisioningContext;
import ai.provisioner.impl.deploy.ProvisioningLifecycle;
import java.io.IOException;
import java.io.PrintStream;

/** Installs the artifacts of the applicable components into the application directory. */
public class CompileStarter extends ProvisionerStarter {

    public CompileStarter(ComponentRegistry componentRegistry, PrintStream out) {
        super(componentRegistry, out);
    }

    public static void main(String... args) {
        runMain(new CompileStarter(new ComponentRegistry(), System.out), args);
    }

    @Override
    protected void run(ProvisioningLifecycle lifecycle, ProvisioningContext context)
            throws IOException {
        lifecycle.compile(lifecycle.detect());
    }
}
