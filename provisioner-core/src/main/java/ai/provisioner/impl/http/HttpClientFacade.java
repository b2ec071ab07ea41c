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
package ai.provisioner.impl.http;

import ai.provisioner.api.runtime.ArtifactInstallException;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import lombok.extern.slf4j.Slf4j;

/**
 * Fetches repository indexes and artifacts. Besides http and https, {@code file:} URIs are
 * read straight from the local filesystem. Failures are not retried.
 */
@Slf4j
public class HttpClientFacade implements AutoCloseable {

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration REQUEST_TIMEOUT = Duration.ofMinutes(5);

    private ExecutorService executorService;
    private HttpClient httpClient;

    public synchronized HttpClient getHttpClient() {
        if (httpClient == null) {
            executorService = Executors.newCachedThreadPool();
            httpClient =
                    HttpClient.newBuilder()
                            .executor(executorService)
                            .connectTimeout(CONNECT_TIMEOUT)
                            .followRedirects(HttpClient.Redirect.ALWAYS)
                            .build();
        }
        return httpClient;
    }

    public String getString(URI uri) throws IOException {
        try (InputStream in = openStream(uri)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    public void download(URI uri, Path destination) throws IOException {
        if (isFile(uri)) {
            Files.copy(Path.of(uri), destination);
            return;
        }
        send(uri, HttpResponse.BodyHandlers.ofFile(destination));
    }

    public InputStream openStream(URI uri) throws IOException {
        if (isFile(uri)) {
            return Files.newInputStream(Path.of(uri));
        }
        return send(uri, HttpResponse.BodyHandlers.ofInputStream()).body();
    }

    private <T> HttpResponse<T> send(URI uri, HttpResponse.BodyHandler<T> bodyHandler)
            throws IOException {
        HttpRequest request = HttpRequest.newBuilder(uri).timeout(REQUEST_TIMEOUT).GET().build();
        try {
            log.debug("sending request: {}", request);
            final HttpResponse<T> response = getHttpClient().send(request, bodyHandler);
            log.debug("received response: {}", response);
            final int status = response.statusCode();
            if (status >= 200 && status < 300) {
                return response;
            }
            if (response.body() instanceof Closeable body) {
                body.close();
            }
            throw new ArtifactInstallException(uri, status);
        } catch (InterruptedException error) {
            Thread.currentThread().interrupt();
            throw new ArtifactInstallException(uri, error);
        }
    }

    private static boolean isFile(URI uri) {
        return "file".equalsIgnoreCase(uri.getScheme());
    }

    @Override
    public void close() {
        if (executorService != null) {
            executorService.shutdownNow();
        }
    }
}
