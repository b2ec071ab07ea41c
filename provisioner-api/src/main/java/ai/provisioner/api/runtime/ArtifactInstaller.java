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
package ai.provisioner.api.runtime;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;

/** Downloads an artifact and places it in an installation directory. */
public interface ArtifactInstaller extends AutoCloseable {

    /**
     * @param uri where to download the artifact from
     * @param fileName the name of the installed file
     * @param targetDirectory the directory receiving the file, created if missing
     * @return the path of the installed file
     * @throws IOException if the download or the copy fails
     */
    Path install(URI uri, String fileName, Path targetDirectory) throws IOException;

    @Override
    default void close() {}
}
