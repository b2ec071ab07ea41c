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

import ai.provisioner.api.model.ResolvedArtifact;
import ai.provisioner.api.model.ResolvedVersion;
import ai.provisioner.api.runtime.ComponentConfiguration;
import ai.provisioner.api.runtime.VersionResolver;
import ai.provisioner.impl.http.HttpClientFacade;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolves versions against the {@code index.yml} published at the root of an artifact
 * repository. The index maps every published version to the URI of its artifact:
 *
 * <pre>
 * ---
 * 3.4.2_756: https://repository.example.com/contrast-engine-3.4.2.jar
 * 3.4.3_000: https://repository.example.com/java-agent-3.4.3.jar
 * </pre>
 *
 * The highest version matching the configured {@link VersionPattern} wins.
 */
@Slf4j
public class RepositoryIndexVersionResolver implements VersionResolver {

    public static final String INDEX_FILE = "index.yml";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private static final Comparator<ResolvedVersion> HIGHEST_FIRST =
            Comparator.<ResolvedVersion>naturalOrder()
                    .thenComparing(
                            ResolvedVersion::qualifier,
                            Comparator.nullsFirst(Comparator.naturalOrder()));

    private final HttpClientFacade httpClient;

    public RepositoryIndexVersionResolver(HttpClientFacade httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public ResolvedArtifact resolve(ComponentConfiguration configuration) {
        VersionPattern pattern = VersionPattern.parse(configuration.version());
        URI indexUri = indexUri(configuration.repositoryRoot());
        Map<ResolvedVersion, String> index = readIndex(indexUri);

        ResolvedVersion selected =
                index.keySet().stream()
                        .filter(pattern::matches)
                        .max(HIGHEST_FIRST)
                        .orElseThrow(
                                () ->
                                        new IllegalStateException(
                                                "No version matching "
                                                        + pattern
                                                        + " found in "
                                                        + indexUri));
        log.info(
                "Resolved {} {} to version {}",
                configuration.componentId(),
                pattern,
                selected);
        return new ResolvedArtifact(selected, URI.create(index.get(selected)));
    }

    static URI indexUri(String repositoryRoot) {
        String root = repositoryRoot.endsWith("/") ? repositoryRoot : repositoryRoot + "/";
        return URI.create(root + INDEX_FILE);
    }

    private Map<ResolvedVersion, String> readIndex(URI indexUri) {
        final Map<String, Object> raw;
        try {
            raw = YAML_MAPPER.readValue(httpClient.getString(indexUri), new TypeReference<>() {});
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read repository index " + indexUri, e);
        }
        Map<ResolvedVersion, String> result = new LinkedHashMap<>();
        if (raw == null) {
            return result;
        }
        raw.forEach(
                (version, uri) -> {
                    try {
                        result.put(ResolvedVersion.parse(version), String.valueOf(uri));
                    } catch (IllegalArgumentException e) {
                        log.warn("Ignoring entry {} of {}: {}", version, indexUri, e.getMessage());
                    }
                });
        return result;
    }
}
