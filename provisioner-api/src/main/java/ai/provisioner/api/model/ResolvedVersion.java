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

import java.util.Comparator;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A concrete three component version, optionally followed by a qualifier, as published in an
 * artifact repository index. For example {@code 3.4.2}, {@code 3.4.2_756} or {@code
 * 6.10.0-RC1}.
 *
 * <p>Ordering only looks at the numeric components, the qualifier is ignored.
 */
public record ResolvedVersion(int major, int minor, int micro, String qualifier)
        implements Comparable<ResolvedVersion> {

    private static final Pattern VERSION =
            Pattern.compile("^(\\d+)\\.(\\d+)\\.(\\d+)(?:[_\\-.](.+))?$");

    private static final Comparator<ResolvedVersion> NUMERIC_ORDER =
            Comparator.comparingInt(ResolvedVersion::major)
                    .thenComparingInt(ResolvedVersion::minor)
                    .thenComparingInt(ResolvedVersion::micro);

    public ResolvedVersion {
        if (major < 0 || minor < 0 || micro < 0) {
            throw new IllegalArgumentException(
                    "Invalid version " + major + "." + minor + "." + micro);
        }
    }

    public ResolvedVersion(int major, int minor, int micro) {
        this(major, minor, micro, null);
    }

    public static ResolvedVersion parse(String version) {
        Objects.requireNonNull(version, "version");
        Matcher matcher = VERSION.matcher(version.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid version '" + version + "'");
        }
        return new ResolvedVersion(
                Integer.parseInt(matcher.group(1)),
                Integer.parseInt(matcher.group(2)),
                Integer.parseInt(matcher.group(3)),
                matcher.group(4));
    }

    public boolean isBefore(ResolvedVersion other) {
        return compareTo(other) < 0;
    }

    /** The {@code major.minor.micro} form, without the qualifier. */
    public String shortVersion() {
        return major + "." + minor + "." + micro;
    }

    @Override
    public int compareTo(ResolvedVersion other) {
        return NUMERIC_ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return qualifier == null ? shortVersion() : shortVersion() + "_" + qualifier;
    }
}
