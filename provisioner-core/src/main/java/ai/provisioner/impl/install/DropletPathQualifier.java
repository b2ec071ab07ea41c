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
package ai.provisioner.impl.install;

import ai.provisioner.api.runtime.PathQualifier;
import java.nio.file.Path;

/**
 * Qualifies paths relative to {@code $PWD}, the directory the application is started from.
 * Paths outside of the application root are returned as absolute paths.
 */
public class DropletPathQualifier implements PathQualifier {

    private static final String PWD = "$PWD";

    private final Path applicationRoot;

    public DropletPathQualifier(Path applicationRoot) {
        this.applicationRoot = applicationRoot.toAbsolutePath().normalize();
    }

    @Override
    public String qualify(Path path) {
        Path absolute = path.toAbsolutePath().normalize();
        if (!absolute.startsWith(applicationRoot)) {
            return absolute.toString();
        }
        Path relative = applicationRoot.relativize(absolute);
        if (relative.toString().isEmpty()) {
            return PWD;
        }
        return PWD + "/" + relative.toString().replace('\\', '/');
    }
}
