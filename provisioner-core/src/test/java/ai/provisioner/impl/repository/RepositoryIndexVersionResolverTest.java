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

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.ok;
import static com.github.tomakehurst.wiremock.client.WireMock.stubFor;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ai.provisioner.api.model.ResolvedArtifact;
import ai.provisioner.api.runtime.ArtifactInstallException;
import ai.provisioner.api.runtime.ComponentConfiguration;
import ai.provisioner.impl.http.HttpClientFacade;
import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import java.io.UncheckedIOException;
import java.net.URI;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

@WireMockTest
class RepositoryIndexVersionResolverTest {

    private static final String INDEX =
            """
            ---
            3.4.2_756: https://repo.example.com/contrast-engine-3.4.2.jar
            3.4.3_000: https://repo.example.com/java-agent-3.4.3.jar
            3.10.1_001: https://repo.example.com/java-agent-3.10.1.jar
            6.0.0_100: https://repo.example.com/java-agent-6.0.0.jar
            not-a-version: https://repo.example.com/broken.jar
            """;

    private HttpClientFacade httpClient;
    private RepositoryIndexVersionResolver resolver;

    @BeforeEach
    void setup() {
        httpClient = new HttpClientFacade();
        resolver = new RepositoryIndexVersionResolver(httpClient);
    }

    @AfterEach
    void cleanup() {
        httpClient.close();
    }

    private static ComponentConfiguration configuration(String version, String root) {
        return new ComponentConfiguration(
                "contrast-security-agent",
                Map.of(
                        ComponentConfiguration.VERSION,
                        version,
                        ComponentConfiguration.REPOSITORY_ROOT,
                        root));
    }

    @Test
    void testResolveHighestMatching(WireMockRuntimeInfo info) {
        stubFor(get("/contrast/index.yml").willReturn(ok(INDEX)));
        String root = info.getHttpBaseUrl() + "/contrast";

        ResolvedArtifact artifact = resolver.resolve(configuration("3.+", root));
        assertEquals("3.10.1_001", artifact.version().toString());
        assertEquals(URI.create("https://repo.example.com/java-agent-3.10.1.jar"), artifact.uri());

        assertEquals("6.0.0_100", resolver.resolve(configuration("+", root)).version().toString());
        assertEquals(
                "3.4.2_756", resolver.resolve(configuration("3.4.2", root)).version().toString());
    }

    @Test
    void testNoMatchingVersion(WireMockRuntimeInfo info) {
        stubFor(get("/contrast/index.yml").willReturn(ok(INDEX)));
        String root = info.getHttpBaseUrl() + "/contrast/";
        assertThrows(IllegalStateException.class, () -> resolver.resolve(configuration("7.+", root)));
    }

    @Test
    void testMalformedPattern(WireMockRuntimeInfo info) {
        assertThrows(
                IllegalArgumentException.class,
                () -> resolver.resolve(configuration("3.+.1", info.getHttpBaseUrl())));
    }

    @Test
    void testMissingIndex(WireMockRuntimeInfo info) {
        stubFor(get("/missing/index.yml").willReturn(aResponse().withStatus(404)));
        UncheckedIOException error =
                assertThrows(
                        UncheckedIOException.class,
                        () ->
                                resolver.resolve(
                                        configuration("+", info.getHttpBaseUrl() + "/missing")));
        ArtifactInstallException cause = (ArtifactInstallException) error.getCause();
        assertEquals(404, cause.getStatusCode());
    }

    @Test
    void testIndexUri() {
        assertEquals(
                URI.create("https://repo.example.com/a/index.yml"),
                RepositoryIndexVersionResolver.indexUri("https://repo.example.com/a"));
        assertEquals(
                URI.create("https://repo.example.com/a/index.yml"),
                RepositoryIndexVersionResolver.indexUri("https://repo.example.com/a/"));
    }
}
