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

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.ok;
import static com.github.tomakehurst.wiremock.client.WireMock.stubFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.verify;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.provisioner.api.runtime.ArtifactInstallException;
import ai.provisioner.api.runtime.ComponentRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@WireMockTest
class ProvisionerStarterTest {

    private static final byte[] JAR = "agent".getBytes(StandardCharsets.UTF_8);

    private static final String VCAP_SERVICES =
            """
            {
              "contrast-security": [
                {
                  "name": "contrast",
                  "label": "contrast-security",
                  "credentials": {
                    "api_key": "k1",
                    "service_key": "s1",
                    "teamserver_url": "https://h",
                    "username": "u1",
                    "proxy_host": "ph",
                    "CONTRAST__INVENTORY__LIBRARY_DIRS": "/lib/dir"
                  }
                }
              ]
            }
            """;

    @TempDir Path tempDir;

    private final Map<String, String> env = new HashMap<>();
    private final ByteArrayOutputStream output = new ByteArrayOutputStream();
    private Path applicationRoot;

    @BeforeEach
    void setup(WireMockRuntimeInfo info) throws Exception {
        applicationRoot = Files.createDirectories(tempDir.resolve("app"));
        String base = info.getHttpBaseUrl();
        stubFor(
                get("/contrast-security/index.yml")
                        .willReturn(
                                ok(
                                        """
                                        ---
                                        3.4.2_756: %s/agents/contrast-engine-3.4.2.jar
                                        6.5.0_100: %s/agents/java-agent-6.5.0.jar
                                        """
                                                .formatted(base, base))));
        stubFor(get("/agents/java-agent-6.5.0.jar").willReturn(aResponse().withBody(JAR)));
        env.put("JBP_DEFAULT_REPOSITORY_ROOT", base);
    }

    private PrintStream out() {
        return new PrintStream(output, true, StandardCharsets.UTF_8);
    }

    private String output() {
        return output.toString(StandardCharsets.UTF_8);
    }

    private DetectStarter detectStarter() {
        return new DetectStarter(new ComponentRegistry(), out()) {
            @Override
            protected String getEnv(String key) {
                return env.get(key);
            }
        };
    }

    private CompileStarter compileStarter() {
        return new CompileStarter(new ComponentRegistry(), out()) {
            @Override
            protected String getEnv(String key) {
                return env.get(key);
            }
        };
    }

    private ReleaseStarter releaseStarter() {
        return new ReleaseStarter(new ComponentRegistry(), out()) {
            @Override
            protected String getEnv(String key) {
                return env.get(key);
            }
        };
    }

    @Test
    void testDetect() throws Exception {
        env.put("VCAP_SERVICES", VCAP_SERVICES);
        DetectStarter starter = detectStarter();
        starter.start(applicationRoot.toString());

        assertTrue(starter.isDetected());
        assertEquals("contrast-security-agent=6.5.0_100", output().trim());
    }

    @Test
    void testDetectWithoutBinding() throws Exception {
        DetectStarter starter = detectStarter();
        starter.start(applicationRoot.toString());

        assertFalse(starter.isDetected());
        assertEquals("", output());
        verify(0, getRequestedFor(urlEqualTo("/contrast-security/index.yml")));
    }

    @Test
    void testVersionOverride() throws Exception {
        env.put("VCAP_SERVICES", VCAP_SERVICES);
        env.put("JBP_CONFIG_CONTRAST_SECURITY_AGENT", "{version: 3.+}");
        detectStarter().start(applicationRoot.toString());

        assertEquals("contrast-security-agent=3.4.2_756", output().trim());
    }

    @Test
    void testCompile() throws Exception {
        env.put("VCAP_SERVICES", VCAP_SERVICES);
        Path cache = tempDir.resolve("cache");
        compileStarter().start(applicationRoot.toString(), cache.toString());

        Path jar =
                applicationRoot
                        .resolve(".java-buildpack")
                        .resolve("contrast_security_agent")
                        .resolve("java-agent-6.5.0.jar");
        assertArrayEquals(JAR, Files.readAllBytes(jar));
        try (var cached = Files.list(cache)) {
            assertEquals(1, cached.count());
        }
    }

    @Test
    void testCompileDownloadFailure() {
        env.put("VCAP_SERVICES", VCAP_SERVICES);
        env.put("JBP_CONFIG_CONTRAST_SECURITY_AGENT", "{version: 3.4.+}");
        stubFor(get("/agents/contrast-engine-3.4.2.jar").willReturn(aResponse().withStatus(404)));

        ArtifactInstallException error =
                assertThrows(
                        ArtifactInstallException.class,
                        () -> compileStarter().start(applicationRoot.toString()));
        assertEquals(404, error.getStatusCode());
    }

    @Test
    void testRelease() throws Exception {
        env.put("VCAP_SERVICES", VCAP_SERVICES);
        env.put("VCAP_APPLICATION", "{\"application_name\": \"petclinic\"}");
        env.put("JAVA_OPTS", "-Xmx512m");
        releaseStarter().start(applicationRoot.toString());

        ReleaseDescriptor descriptor =
                new ObjectMapper(new YAMLFactory()).readValue(output(), ReleaseDescriptor.class);
        assertEquals(
                List.of(
                        "-Xmx512m",
                        "-javaagent:$PWD/.java-buildpack/contrast_security_agent/java-agent-6.5.0.jar"),
                descriptor.javaOpts());
        Map<String, String> variables = descriptor.environmentVariables();
        assertEquals("/lib/dir", variables.get("CONTRAST__INVENTORY__LIBRARY_DIRS"));
        assertEquals("https://h/Contrast", variables.get("CONTRAST__API__URL"));
        assertEquals("petclinic", variables.get("CONTRAST__APPLICATION__NAME"));
        assertEquals("$TMPDIR", variables.get("CONTRAST__AGENT__CONTRAST_WORKING_DIR"));
        assertEquals("ph", variables.get("CONTRAST__API__PROXY__HOST"));
        assertFalse(variables.containsKey("CONTRAST__API__PROXY__PORT"));
    }

    @Test
    void testReleaseWithoutBinding() throws Exception {
        env.put("JAVA_OPTS", "-Xmx512m");
        releaseStarter().start(applicationRoot.toString());

        ReleaseDescriptor descriptor =
                new ObjectMapper(new YAMLFactory()).readValue(output(), ReleaseDescriptor.class);
        assertEquals(List.of("-Xmx512m"), descriptor.javaOpts());
        assertTrue(descriptor.environmentVariables().isEmpty());
    }

    @Test
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> detectStarter().start());
        assertThrows(
                IllegalArgumentException.class,
                () -> detectStarter().start(tempDir.resolve("missing").toString()));
    }

    @Test
    void testErrorHandler() {
        ProvisionerStarter.MainErrorHandler previous = ProvisionerStarter.mainErrorHandler;
        Throwable[] handled = new Throwable[1];
        ProvisionerStarter.mainErrorHandler = error -> handled[0] = error;
        try {
            ProvisionerStarter.runMain(detectStarter());
        } finally {
            ProvisionerStarter.mainErrorHandler = previous;
        }
        assertTrue(handled[0] instanceof IllegalArgumentException);
    }
}
