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

import ai.provisioner.api.model.EnvironmentVariable;
import ai.provisioner.api.model.JavaOpts;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Derives the {@code CONTRAST__} environment variables that configure the agent at process
 * start.
 *
 * <p>Variables are produced in three passes:
 *
 * <ol>
 *   <li>every {@code CONTRAST__} credential, verbatim
 *   <li>the named settings of {@link #NAMED_SETTINGS}, then the application name
 *   <li>the proxy settings of {@link #PROXY_SETTINGS} that are bound with a non empty value
 * </ol>
 *
 * A later pass replaces the value an earlier one wrote for the same variable, the variable
 * keeps its original position. No variable appears twice in the result. When the JVM options
 * already name the application, {@value #APPLICATION_NAME} is left out even if a credential
 * carries it.
 */
public class ContrastEnvironmentBuilder {

    public static final String API_KEY = "CONTRAST__API__API_KEY";
    public static final String SERVICE_KEY = "CONTRAST__API__SERVICE_KEY";
    public static final String URL = "CONTRAST__API__URL";
    public static final String USER_NAME = "CONTRAST__API__USER_NAME";
    public static final String WORKING_DIR = "CONTRAST__AGENT__CONTRAST_WORKING_DIR";
    public static final String APPLICATION_NAME = "CONTRAST__APPLICATION__NAME";
    public static final String PROXY_HOST = "CONTRAST__API__PROXY__HOST";
    public static final String PROXY_PORT = "CONTRAST__API__PROXY__PORT";
    public static final String PROXY_USER = "CONTRAST__API__PROXY__USER";
    public static final String PROXY_PASS = "CONTRAST__API__PROXY__PASS";

    static final String URL_SUFFIX = "/Contrast";

    // expanded by the shell of the application container, not here
    static final String WORKING_DIR_VALUE = "$TMPDIR";

    static final List<String> APPLICATION_NAME_PROPERTIES =
            List.of("contrast.override.appname", "contrast.application.name");

    record Setting(String variable, Function<ContrastCredentials, String> value) {}

    static final List<Setting> NAMED_SETTINGS =
            List.of(
                    new Setting(API_KEY, ContrastCredentials::apiKey),
                    new Setting(SERVICE_KEY, ContrastCredentials::serviceKey),
                    new Setting(URL, c -> c.teamserverUrl() + URL_SUFFIX),
                    new Setting(USER_NAME, ContrastCredentials::username),
                    new Setting(WORKING_DIR, c -> WORKING_DIR_VALUE));

    static final List<Setting> PROXY_SETTINGS =
            List.of(
                    new Setting(PROXY_HOST, ContrastCredentials::proxyHost),
                    new Setting(PROXY_PORT, ContrastCredentials::proxyPort),
                    new Setting(PROXY_USER, ContrastCredentials::proxyUser),
                    new Setting(PROXY_PASS, ContrastCredentials::proxyPass));

    /**
     * @param credentials the bound credentials
     * @param existingJavaOpts the JVM options already configured for the application
     * @param applicationName the name reported to Contrast, unless the JVM options already set
     *     one
     * @return the variables, in order, each name at most once
     */
    public List<EnvironmentVariable> build(
            ContrastCredentials credentials, JavaOpts existingJavaOpts, String applicationName) {
        Map<String, String> variables = new LinkedHashMap<>(credentials.passthrough());

        for (Setting setting : NAMED_SETTINGS) {
            variables.put(setting.variable(), setting.value().apply(credentials));
        }
        if (isApplicationNameOverridden(existingJavaOpts)) {
            variables.remove(APPLICATION_NAME);
        } else {
            variables.put(APPLICATION_NAME, applicationName);
        }

        for (Setting setting : PROXY_SETTINGS) {
            String value = setting.value().apply(credentials);
            if (value != null && !value.isEmpty()) {
                variables.put(setting.variable(), value);
            }
        }

        return variables.entrySet().stream()
                .map(e -> new EnvironmentVariable(e.getKey(), e.getValue()))
                .collect(Collectors.toList());
    }

    static boolean isApplicationNameOverridden(JavaOpts javaOpts) {
        return APPLICATION_NAME_PROPERTIES.stream().anyMatch(javaOpts::containsSystemProperty);
    }
}
