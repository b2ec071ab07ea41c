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

import ai.provisioner.api.runtime.ArtifactInstaller;
import ai.provisioner.impl.http.HttpClientFacade;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import lombok.extern.slf4j.Slf4j;

/**
 * Downloads artifacts into a cache directory shared across staging runs, then copies them into
 * the installation directory. Without a cache directory the artifact is downloaded straight to
 * its destination.
 */
@Slf4j
public class CachingArtifactInstaller implements ArtifactInstaller {

    static final String CACHED_SUFFIX = ".cached";

    private final Path cacheDirectory;
    private final HttpClientFacade httpClient;

    public CachingArtifactInstaller(Path cacheDirectory, HttpClientFacade httpClient) {
        this.cacheDirectory = cacheDirectory;
        this.httpClient = httpClient;
    }

    @Override
    public Path install(URI uri, String fileName, Path targetDirectory) throws IOException {
        Files.createDirectories(targetDirectory);
        final Path target = targetDirectory.resolve(fileName);
        if (cacheDirectory == null) {
            log.info("Downloading {} to {}", uri, target);
            Path partial = Files.createTempFile(targetDirectory, fileName, ".partial");
            try {
                Files.delete(partial);
                httpClient.download(uri, partial);
                Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
            } finally {
                Files.deleteIfExists(partial);
            }
            return target;
        }

        final Path cached = cachedFile(uri);
        if (Files.isRegularFile(cached)) {
            log.info("Using cached copy of {}", uri);
        } else {
            download(uri, cached);
        }
        log.info("Copying {} to {}", cached, target);
        Files.copy(cached, target, StandardCopyOption.REPLACE_EXISTING);
        return target;
    }

    Path cachedFile(URI uri) {
        return cacheDirectory.resolve(
                URLEncoder.encode(uri.toString(), StandardCharsets.UTF_8) + CACHED_SUFFIX);
    }

    private void download(URI uri, Path cached) throws IOException {
        Files.createDirectories(cacheDirectory);
        Path partial = Files.createTempFile(cacheDirectory, "download", ".partial");
        try {
            Files.delete(partial);
            log.info("Downloading {}", uri);
            long start = System.currentTimeMillis();
            httpClient.download(uri, partial);
            Files.move(partial, cached, StandardCopyOption.REPLACE_EXISTING);
            log.info(
                    "Downloaded {} ({} bytes) in {} ms",
                    uri,
                    Files.size(cached),
                    System.currentTimeMillis() - start);
        } finally {
            Files.deleteIfExists(partial);
        }
    }

    @Override
    public void close() {
        httpClient.close();
    }
}
