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
package ai.provisioner.impl.cloudfoundry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/** One entry of {@code VCAP_SERVICES}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BoundService(
        String name, String label, List<String> tags, Map<String, Object> credentials) {

    public BoundService {
        tags = tags == null ? List.of() : tags;
        credentials = credentials == null ? Map.of() : credentials;
    }

    boolean matches(Pattern filter) {
        if (name != null && filter.matcher(name).find()) {
            return true;
        }
        if (label != null && filter.matcher(label).find()) {
            return true;
        }
        return tags.stream().anyMatch(tag -> tag != null && filter.matcher(tag).find());
    }

    boolean hasCredentials(String... requiredCredentials) {
        for (String key : requiredCredentials) {
            if (!credentials.containsKey(key)) {
                return false;
            }
        }
        return true;
    }
}
