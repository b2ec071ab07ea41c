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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Environment variables that are set on the application process at start. Entries keep their
 * insertion order.
 */
public class EnvironmentVariables {

    private final Map<String, String> variables = new LinkedHashMap<>();

    public EnvironmentVariables add(String name, String value) {
        variables.put(name, value);
        return this;
    }

    public EnvironmentVariables add(EnvironmentVariable variable) {
        return add(variable.name(), variable.value());
    }

    public String get(String name) {
        return variables.get(name);
    }

    public boolean containsKey(String name) {
        return variables.containsKey(name);
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(variables);
    }

    /** Entries in the {@code NAME=value} form. */
    public List<String> asList() {
        List<String> result = new ArrayList<>(variables.size());
        variables.forEach((name, value) -> result.add(name + "=" + value));
        return result;
    }

    public int size() {
        return variables.size();
    }

    @Override
    public String toString() {
        return String.join(" ", asList());
    }
}
