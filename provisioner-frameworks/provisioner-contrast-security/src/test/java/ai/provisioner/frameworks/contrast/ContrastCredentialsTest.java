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
package ai.provisioner.frameworks.contrast;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.provisioner.api.model.CredentialSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ContrastCredentialsTest {

    @Test
    void testFrom() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("api_key", "k1");
        values.put("service_key", "s1");
        values.put("teamserver_url", "https://h");
        values.put("username", "u1");
        values.put("proxy_port", 8080);
        values.put("CONTRAST__B", "b");
        values.put("CONTRAST__A", null);
        values.put("CONTRAST__API__API_KEY", "raw");

        ContrastCredentials credentials = ContrastCredentials.from(CredentialSet.of(values));

        assertEquals("k1", credentials.apiKey());
        assertEquals("s1", credentials.serviceKey());
        assertEquals("https://h", credentials.teamserverUrl());
        assertEquals("u1", credentials.username());
        assertEquals("8080", credentials.proxyPort());
        assertNull(credentials.proxyHost());
        assertEquals(
                List.of("CONTRAST__B", "CONTRAST__A", "CONTRAST__API__API_KEY"),
                List.copyOf(credentials.passthrough().keySet()));
        assertEquals("", credentials.passthrough().get("CONTRAST__A"));
    }

    @Test
    void testNullRequiredValue() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("api_key", "k1");
        values.put("service_key", "s1");
        values.put("teamserver_url", "https://h");
        values.put("username", null);

        assertEquals("", ContrastCredentials.from(CredentialSet.of(values)).username());
    }

    @Test
    void testMissingRequiredKey() {
        IllegalArgumentException error =
                assertThrows(
                        IllegalArgumentException.class,
                        () ->
                                ContrastCredentials.from(
                                        CredentialSet.of(
                                                Map.of(
                                                        "api_key", "k1",
                                                        "service_key", "s1",
                                                        "teamserver_url", "https://h"))));
        assertTrue(error.getMessage().contains("'username'"));
    }

    @Test
    void testToStringRedactsSecrets() {
        ContrastCredentials credentials =
                new ContrastCredentials(
                        "the-api-key",
                        "the-service-key",
                        "https://h",
                        "u1",
                        null,
                        null,
                        "proxy-user",
                        "proxy-secret",
                        Map.of("CONTRAST__API__TOKEN", "the-token"));
        String text = credentials.toString();
        assertFalse(text.contains("the-api-key"));
        assertFalse(text.contains("the-service-key"));
        assertFalse(text.contains("proxy-secret"));
        assertFalse(text.contains("the-token"));
        assertTrue(text.contains("https://h"));
    }
}
