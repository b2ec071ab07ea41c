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

import ai.provisioner.api.model.ResolvedVersion;

/**
 * Selects the file name of the agent jar. Releases before {@code 3.4.3} were published as
 * {@code contrast-engine-<version>.jar}, later ones as {@code java-agent-<version>.jar}. Only
 * {@code major.minor.micro} ends up in the name.
 */
public final class VersionSelector {

    public static final ResolvedVersion INFLECTION_VERSION = new ResolvedVersion(3, 4, 3);

    static final String LEGACY_PREFIX = "contrast-engine-";
    static final String CURRENT_PREFIX = "java-agent-";

    private VersionSelector() {}

    public static String jarName(ResolvedVersion version) {
        String prefix = version.isBefore(INFLECTION_VERSION) ? LEGACY_PREFIX : CURRENT_PREFIX;
        return prefix + version.shortVersion() + ".jar";
    }
}
