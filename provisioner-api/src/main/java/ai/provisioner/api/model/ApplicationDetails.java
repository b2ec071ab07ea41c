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
package ai.provisioner.api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Identity of the application being staged, as described by the platform. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ApplicationDetails(
        @JsonProperty("application_name") String applicationName,
        @JsonProperty("application_id") String applicationId,
        @JsonProperty("application_uris") List<String> applicationUris) {

    public static final ApplicationDetails UNKNOWN = new ApplicationDetails(null, null, List.of());

    public static final String DEFAULT_APPLICATION_NAME = "ROOT";

    /** The application name, or {@value #DEFAULT_APPLICATION_NAME} when none is set. */
    public String applicationNameOrDefault() {
        if (applicationName == null || applicationName.isEmpty()) {
            return DEFAULT_APPLICATION_NAME;
        }
        return applicationName;
    }
}
