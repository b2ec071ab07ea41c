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

import ai.provisioner.api.model.CredentialSet;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Lookup of the services bound to the application. A service matches a filter when the filter
 * is found in its name, its label or one of its tags, and its credentials contain every
 * required key.
 */
public interface ServiceBindings {

    /**
     * Returns the credentials of the only matching service.
     *
     * @param filter matched against name, label and tags
     * @param requiredCredentials keys that must be present in the credentials
     * @return the credentials, or empty unless exactly one service matches
     */
    Optional<CredentialSet> findService(Pattern filter, String... requiredCredentials);

    int countMatchingServices(Pattern filter, String... requiredCredentials);

    default boolean oneService(Pattern filter, String... requiredCredentials) {
        return countMatchingServices(filter, requiredCredentials) == 1;
    }
}
