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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only view of the {@code credentials} object of a single bound service. Keys keep the
 * order in which the binding declared them. Values are strings or scalars (numbers, booleans)
 * and may be null.
 */
public final class CredentialSet {

    private static final CredentialSet EMPTY = new CredentialSet(Map.of());

    private final Map<String, Object> values;

    private CredentialSet(Map<String, Object> values) {
        this.values = values;
    }

    public static CredentialSet of(Map<String, ?> credentials) {
        if (credentials == null || credentials.isEmpty()) {
            return EMPTY;
        }
        // LinkedHashMap because Map.copyOf rejects null values and loses ordering
        return new CredentialSet(Collections.unmodifiableMap(new LinkedHashMap<>(credentials)));
    }

    public static CredentialSet empty() {
        return EMPTY;
    }

    public Object get(String key) {
        return values.get(key);
    }

    /**
     * Returns the value of the key as a string.
     *
     * @param key the credential key
     * @return the stringified value, or null if the key is missing or maps to null
     */
    public String getString(String key) {
        Object value = values.get(key);
        return value == null ? null : value.toString();
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    /**
     * Selects the entries whose key starts with the given prefix. The match is case-sensitive.
     *
     * @param prefix the key prefix
     * @return an ordered, unmodifiable map of the matching entries
     */
    public Map<String, Object> withPrefix(String prefix) {
        Map<String, Object> result = new LinkedHashMap<>();
        values.forEach(
                (key, value) -> {
                    if (key.startsWith(prefix)) {
                        result.put(key, value);
                    }
                });
        return Collections.unmodifiableMap(result);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CredentialSet that)) {
            return false;
        }
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "CredentialSet{keys=" + values.keySet() + '}';
    }
}
