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

import ai.provisioner.api.util.ConfigurationUtils;
import java.util.Map;

/**
 * Configuration of a single component, such as the version range to install and the root of
 * the repository publishing it.
 */
public record ComponentConfiguration(String componentId, Map<String, Object> configuration) {

    public static final String VERSION = "version";
    public static final String REPOSITORY_ROOT = "repository_root";

    public ComponentConfiguration {
        configuration = configuration == null ? Map.of() : Map.copyOf(configuration);
    }

    public String version() {
        return ConfigurationUtils.requiredNonEmptyField(
                configuration, VERSION, () -> "configuration of " + componentId);
    }

    public String repositoryRoot() {
        return ConfigurationUtils.requiredNonEmptyField(
                configuration, REPOSITORY_ROOT, () -> "configuration of " + componentId);
    }
}
