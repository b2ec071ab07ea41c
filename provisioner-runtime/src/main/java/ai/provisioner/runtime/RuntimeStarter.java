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
package ai.provisioner.runtime;

import java.nio.file.Files;
import java.nio.file.Path;

public abstract class RuntimeStarter {

    public abstract void start(String... args) throws Exception;

    protected Path getDirectoryFromArgs(String[] args, int index, String description) {
        if (args.length <= index) {
            throw new IllegalArgumentException("Missing argument: " + description);
        }
        final Path path = Path.of(args[index]);
        if (!Files.isDirectory(path)) {
            throw new IllegalArgumentException("Directory " + path + " does not exist");
        }
        return path;
    }

    protected Path getOptionalPathFromArgs(String[] args, int index) {
        if (args.length <= index || args[index].isBlank()) {
            return null;
        }
        return Path.of(args[index]);
    }

    protected String getEnv(String key) {
        return System.getenv(key);
    }
}
