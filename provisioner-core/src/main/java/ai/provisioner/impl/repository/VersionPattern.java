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
package ai.provisioner.impl.repository;

import ai.provisioner.api.model.ResolvedVersion;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A version range as written in a component configuration. A trailing {@code +} matches any
 * value for that component and the following ones: {@code 3.+} matches every 3.x.y release,
 * {@code +} matches everything. Without a wildcard the pattern names one exact version.
 */
public final class VersionPattern {

    private static final String WILDCARD = "+";

    private final String pattern;
    private final List<Integer> fixed;
    private final ResolvedVersion exact;

    private VersionPattern(String pattern, List<Integer> fixed, ResolvedVersion exact) {
        this.pattern = pattern;
        this.fixed = fixed;
        this.exact = exact;
    }

    public static VersionPattern parse(String pattern) {
        Objects.requireNonNull(pattern, "pattern");
        String trimmed = pattern.trim();
        if (!trimmed.endsWith(WILDCARD)) {
            return new VersionPattern(trimmed, List.of(), ResolvedVersion.parse(trimmed));
        }
        String prefix = trimmed.substring(0, trimmed.length() - 1);
        List<Integer> fixed = new ArrayList<>();
        if (!prefix.isEmpty()) {
            if (!prefix.endsWith(".")) {
                throw new IllegalArgumentException("Invalid version pattern '" + pattern + "'");
            }
            String[] parts = prefix.substring(0, prefix.length() - 1).split("\\.");
            if (parts.length > 2) {
                throw new IllegalArgumentException("Invalid version pattern '" + pattern + "'");
            }
            for (String part : parts) {
                if (part.contains(WILDCARD)) {
                    throw new IllegalArgumentException(
                            "Wildcard only allowed in the last position: '" + pattern + "'");
                }
                try {
                    fixed.add(Integer.parseInt(part));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException(
                            "Invalid version pattern '" + pattern + "'", e);
                }
            }
        }
        return new VersionPattern(trimmed, List.copyOf(fixed), null);
    }

    public boolean matches(ResolvedVersion version) {
        if (exact != null) {
            return exact.compareTo(version) == 0
                    && (exact.qualifier() == null
                            || exact.qualifier().equals(version.qualifier()));
        }
        int[] components = {version.major(), version.minor(), version.micro()};
        for (int i = 0; i < fixed.size(); i++) {
            if (components[i] != fixed.get(i)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return pattern;
    }
}
