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
package ai.provisioner.api.util;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/** Utility class for reading loosely typed configuration and credential maps. */
public class ConfigurationUtils {

    private static final String REDACTED = "<REDACTED>";

    public static String requiredNonEmptyField(
            Map<String, Object> configuration, String name, Supplier<String> definition) {
        Object value = configuration.get(name);
        if (value == null || value.toString().isEmpty()) {
            throw new IllegalArgumentException(
                    "Missing required field '" + name + "' in " + definition.get());
        }
        return value.toString();
    }

    /**
     * Merges two configuration maps. Nested maps are merged recursively, any other value of the
     * override replaces the base one.
     */
    public static Map<String, Object> merge(
            Map<String, Object> base, Map<String, Object> override) {
        Map<String, Object> result = new LinkedHashMap<>(base);
        override.forEach(
                (key, value) -> {
                    Object current = result.get(key);
                    if (current instanceof Map currentMap && value instanceof Map valueMap) {
                        result.put(key, merge(currentMap, valueMap));
                    } else {
                        result.put(key, value);
                    }
                });
        return result;
    }

    /**
     * Remove all the secrets from a credentials or configuration object. This method is used to
     * avoid logging secrets
     *
     * @param object
     * @return the object without secrets
     */
    public static Object redactSecrets(Object object) {
        if (object == null) {
            return null;
        }

        if (object instanceof List list) {
            List<Object> other = new ArrayList<>(list.size());
            list.forEach(o -> other.add(redactSecrets(o)));
            return other;
        }

        if (object instanceof Map map) {
            Map<Object, Object> other = new LinkedHashMap<>();
            map.forEach(
                    (k, v) -> {
                        String keyLowercase = (String.valueOf(k)).toLowerCase();
                        if (keyLowercase.contains("password")
                                || keyLowercase.contains("pass")
                                || keyLowercase.contains("secret")
                                || keyLowercase.contains("api_key")
                                || keyLowercase.contains("service_key")
                                || keyLowercase.contains("token")) {
                            other.put(k, REDACTED);
                        } else {
                            other.put(k, redactSecrets(v));
                        }
                    });
            return other;
        }

        return object;
    }
}
