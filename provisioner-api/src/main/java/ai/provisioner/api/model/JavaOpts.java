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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** The ordered options passed to the JVM of the application. */
public class JavaOpts {

    private static final String SYSTEM_PROPERTY_PREFIX = "-D";

    private final List<String> options = new ArrayList<>();

    public JavaOpts() {}

    public JavaOpts(List<String> options) {
        this.options.addAll(options);
    }

    /**
     * Parses the value of a {@code JAVA_OPTS} style variable. Options are separated by
     * whitespace, quoting is not supported.
     */
    public static JavaOpts parse(String javaOpts) {
        JavaOpts result = new JavaOpts();
        if (javaOpts == null || javaOpts.isBlank()) {
            return result;
        }
        for (String option : javaOpts.trim().split("\\s+")) {
            result.addPreformattedOptions(option);
        }
        return result;
    }

    public JavaOpts addPreformattedOptions(String option) {
        options.add(option);
        return this;
    }

    public JavaOpts addSystemProperty(String key, Object value) {
        options.add(SYSTEM_PROPERTY_PREFIX + key + "=" + value);
        return this;
    }

    public JavaOpts addJavaAgent(String qualifiedPath) {
        options.add("-javaagent:" + qualifiedPath);
        return this;
    }

    /**
     * Checks whether a system property with the given name is already set. Only the property
     * name is compared, so a property whose value happens to contain the name does not match.
     * Preformatted entries holding several options are split on whitespace.
     */
    public boolean containsSystemProperty(String name) {
        String exact = SYSTEM_PROPERTY_PREFIX + name;
        String assignment = exact + "=";
        for (String option : options) {
            for (String token : option.trim().split("\\s+")) {
                if (token.equals(exact) || token.startsWith(assignment)) {
                    return true;
                }
            }
        }
        return false;
    }

    public boolean contains(String option) {
        return options.contains(option);
    }

    public List<String> asList() {
        return Collections.unmodifiableList(options);
    }

    /** The value of a {@code JAVA_OPTS} variable holding these options. */
    public String asEnvVar() {
        return String.join(" ", options);
    }

    public int size() {
        return options.size();
    }

    @Override
    public String toString() {
        return asEnvVar();
    }
}
