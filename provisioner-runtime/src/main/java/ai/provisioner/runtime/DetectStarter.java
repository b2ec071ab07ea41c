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
import java.io.PrintStream;
import java.util.List;
import lombok.Getter;

/** Prints one {@code <id>=<version>} line per applicable component. */
public class DetectStarter extends ProvisionerStarter {

    @Getter private boolean detected;

    public DetectStarter(ComponentRegistry componentRegistry, PrintStream out) {
        super(componentRegistry, out);
    }

    public static void main(String... args) {
        DetectStarter starter = new DetectStarter(new ComponentRegistry(), System.out);
        runMain(starter, args);
        System.exit(starter.isDetected() ? 0 : 1);
    }

    @Override
    protected void run(ProvisioningLifecycle lifecycle, ProvisioningContext context) {
        List<ProvisioningLifecycle.DetectedComponent> components = lifecycle.detect();
        components.forEach(c -> out.println(c.identifier()));
        detected = !components.isEmpty();
    }
}
