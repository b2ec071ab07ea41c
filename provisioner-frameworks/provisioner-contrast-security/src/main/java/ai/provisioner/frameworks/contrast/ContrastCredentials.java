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

import ai.provisioner.api.model.CredentialSet;
import ai.provisioner.api.util.ConfigurationUtils;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Credentials of a Contrast Security service binding. The well known fields are typed, every
 * entry whose key starts with {@value #PASSTHROUGH_PREFIX} is kept as is in {@link
 * #passthrough()} so the service broker can introduce new agent settings.
 *
 * @param apiKey {@code api_key}
 * @param serviceKey {@code service_key}
 * @param teamserverUrl {@code teamserver_url}
 * @param username {@code username}
 * @param proxyHost {@code proxy_host}, null when not bound
 * @param proxyPort {@code proxy_port}, null when not bound
 * @param proxyUser {@code proxy_user}, null when not bound
 * @param proxyPass {@code proxy_pass}, null when not bound
 * @param passthrough the {@value #PASSTHROUGH_PREFIX} entries, in binding order
 */
public record ContrastCredentials(
        String apiKey,
        String serviceKey,
        String teamserverUrl,
        String username,
        String proxyHost,
        String proxyPort,
        String proxyUser,
        String proxyPass,
        Map<String, String> passthrough) {

    public static final String API_KEY = "api_key";
    public static final String SERVICE_KEY = "service_key";
    public static final String TEAMSERVER_URL = "teamserver_url";
    public static final String USERNAME = "username";
    public static final String PROXY_HOST = "proxy_host";
    public static final String PROXY_PORT = "proxy_port";
    public static final String PROXY_USER = "proxy_user";
    public static final String PROXY_PASS = "proxy_pass";

    public static final String PASSTHROUGH_PREFIX = "CONTRAST__";

    static final String[] REQUIRED_KEYS = {API_KEY, SERVICE_KEY, TEAMSERVER_URL, USERNAME};

    public ContrastCredentials {
        passthrough =
                passthrough == null
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(passthrough));
    }

    public static ContrastCredentials from(CredentialSet credentials) {
        Map<String, String> passthrough = new LinkedHashMap<>();
        credentials
                .withPrefix(PASSTHROUGH_PREFIX)
                .forEach(
                        (key, value) ->
                                passthrough.put(key, value == null ? "" : value.toString()));
        return new ContrastCredentials(
                required(credentials, API_KEY),
                required(credentials, SERVICE_KEY),
                required(credentials, TEAMSERVER_URL),
                required(credentials, USERNAME),
                credentials.getString(PROXY_HOST),
                credentials.getString(PROXY_PORT),
                credentials.getString(PROXY_USER),
                credentials.getString(PROXY_PASS),
                passthrough);
    }

    /** A required key bound to null is rendered as an empty string, like passthrough values. */
    private static String required(CredentialSet credentials, String key) {
        if (!credentials.containsKey(key)) {
            throw new IllegalArgumentException(
                    "Missing required field '" + key + "' in Contrast Security credentials");
        }
        String value = credentials.getString(key);
        return value == null ? "" : value;
    }

    @Override
    public String toString() {
        return "ContrastCredentials{teamserverUrl="
                + teamserverUrl
                + ", username="
                + username
                + ", proxyHost="
                + proxyHost
                + ", proxyPort="
                + proxyPort
                + ", passthrough="
                + ConfigurationUtils.redactSecrets(passthrough)
                + '}';
    }
}
