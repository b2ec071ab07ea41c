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

/** Maps the configured version range of a component to a concrete downloadable artifact. */
public interface VersionResolver {

    /**
     * @param configuration the configuration of the component
     * @return the selected version and its download location
     * @throws IllegalArgumentException if the configured version is malformed
     * @throws IllegalStateException if no published version matches
     */
    ResolvedArtifact resolve(ComponentConfiguration configuration);
}
