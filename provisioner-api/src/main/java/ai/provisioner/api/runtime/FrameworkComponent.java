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

import ai.provisioner.api.model.ResolvedArtifact;
import ai.provisioner.api.model.ResolvedVersion;
import java.io.IOException;

/**
 * A unit that contributes to the staging of an application. The orchestrator drives every
 * component through three phases:
 *
 * <ol>
 *   <li>{@link #detect()} decides whether the component applies, without side effects
 *   <li>{@link #compile(ResolvedArtifact)} installs the artifact
 *   <li>{@link #release(ResolvedArtifact)} contributes JVM options and environment variables
 * </ol>
 *
 * The later phases are only invoked after a positive detection, and receive the artifact that
 * was resolved for the run.
 */
public interface FrameworkComponent {

    /** Identifier of the component, for instance {@code contrast-security-agent}. */
    String getId();

    boolean detect();

    void compile(ResolvedArtifact artifact) throws IOException;

    void release(ResolvedArtifact artifact);

    /** The detection signal reported to the orchestrator, {@code <id>=<version>}. */
    default String identifier(ResolvedVersion version) {
        return getId() + "=" + version;
    }
}
