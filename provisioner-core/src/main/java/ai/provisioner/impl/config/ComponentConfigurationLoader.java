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
package ai.provisioner.impl.config;

import ai.provisioner.api.runtime.ComponentConfiguration;
import ai.provisioner.api.util.ConfigurationUtils;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;

/**
 * Loads the configuration of a component. Defaults come from the classpath resource {@code
 * config/<component_id>.yml}, the environment variable {@code JBP_CONFIG_<COMPONENT_ID>} can
 * override them with an inline YAML document such as {@code {version: 3.+}}.
 *
 * <p>The {@value #DEFAULT_REPOSITORY_ROOT_PLACEHOLDER} placeholder in string values is replaced
 * by {@code JBP_DEFAULT_REPOSITORY_ROOT}, or {@value #DEFAULT_REPOSITORY_ROOT}.
 */
@Slf4j
public class ComponentConfigurationLoader {

    public static final String CONFIG_ENV_PREFIX = "JBP_CONFIG_";
    public static final String DEFAULT_REPOSITORY_ROOT_ENV = "JBP_DEFAULT_REPOSITORY_ROOT";
    public static final String DEFAULT_REPOSITORY_ROOT = "https://java-buildpack.cloudfoundry.org";
    public static final String DEFAULT_REPOSITORY_ROOT_PLACEHOLDER = "{default.repository.root}";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private final Function<String, String> environment;
    private final ClassLoader classLoader;

    public ComponentConfigurationLoader() {
        this(System::getenv, ComponentConfigurationLoader.class.getClassLoader());
    }

    public ComponentConfigurationLoader(
            Function<String, String> environment, ClassLoader classLoader) {
        this.environment = environment;
        this.classLoader = classLoader;
    }

    public ComponentConfiguration load(String componentId) {
        String name = componentId.replace('-', '_');
        Map<String, Object> configuration = readDefaults(name);

        String overrideEnv = CONFIG_ENV_PREFIX + name.toUpperCase(Locale.ROOT);
        String override = environment.apply(overrideEnv);
        if (override != null && !override.isBlank()) {
            log.info("Applying configuration override from {}", overrideEnv);
            configuration = ConfigurationUtils.merge(configuration, parse(override, overrideEnv));
        }

        String repositoryRoot = environment.apply(DEFAULT_REPOSITORY_ROOT_ENV);
        if (repositoryRoot == null || repositoryRoot.isBlank()) {
            repositoryRoot = DEFAULT_REPOSITORY_ROOT;
        }
        return new ComponentConfiguration(
                componentId, resolvePlaceholders(configuration, repositoryRoot));
    }

    private Map<String, Object> readDefaults(String name) {
        String resource = "config/" + name + ".yml";
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                log.warn("No default configuration {} found on the classpath", resource);
                return Map.of();
            }
            Map<String, Object> result = YAML_MAPPER.readValue(in, new TypeReference<>() {});
            return result == null ? Map.of() : result;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + resource, e);
        }
    }

    private static Map<String, Object> parse(String yaml, String source) {
        try {
            Map<String, Object> result = YAML_MAPPER.readValue(yaml, new TypeReference<>() {});
            return result == null ? Map.of() : result;
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot parse " + source + ": " + yaml, e);
        }
    }

    private static Map<String, Object> resolvePlaceholders(
            Map<String, Object> configuration, String repositoryRoot) {
        Map<String, Object> result = new LinkedHashMap<>();
        configuration.forEach(
                (key, value) -> {
                    if (value instanceof String s) {
                        result.put(
                                key,
                                s.replace(DEFAULT_REPOSITORY_ROOT_PLACEHOLDER, repositoryRoot));
                    } else if (value instanceof Map map) {
                        result.put(key, resolvePlaceholders(map, repositoryRoot));
                    } else {
                        result.put(key, value);
                    }
                });
        return result;
    }
}
