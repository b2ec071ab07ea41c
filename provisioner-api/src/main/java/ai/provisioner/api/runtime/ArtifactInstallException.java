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
import lombok.Getter;

@Getter
public class ArtifactInstallException extends IOException {
    private final URI uri;
    private final int statusCode;

    public ArtifactInstallException(URI uri, int statusCode) {
        super("Failed to download " + uri + ", status code " + statusCode);
        this.uri = uri;
        this.statusCode = statusCode;
    }

    public ArtifactInstallException(URI uri, Throwable cause) {
        super("Failed to download " + uri + ": " + cause, cause);
        this.uri = uri;
        this.statusCode = -1;
    }
}
