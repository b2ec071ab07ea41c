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
package ai.provisioner.impl.cloudfoundry;

import ai.provisioner.api.model.CredentialSet;
import ai.provisioner.api.runtime.ServiceBindings;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/** {@link ServiceBindings} backed by the {@code VCAP_SERVICES} document. */
@Slf4j
public class VcapServiceBindings implements ServiceBindings {

    public static final String VCAP_SERVICES_ENV = "VCAP_SERVICES";

    private static final ObjectMapper MAPPER =
            new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final List<BoundService> services;

    public VcapServiceBindings(List<BoundService> services) {
        this.services = List.copyOf(services);
    }

    /**
     * Parses a {@code VCAP_SERVICES} document, a JSON object mapping each service label to the
     * list of bound instances.
     *
     * @param vcapServices the document, null or blank when nothing is bound
     * @return the bindings
     */
    public static VcapServiceBindings parse(String vcapServices) {
        if (vcapServices == null || vcapServices.isBlank()) {
            return new VcapServiceBindings(List.of());
        }
        try {
            Map<String, List<BoundService>> byLabel =
                    MAPPER.readValue(vcapServices, new TypeReference<>() {});
            List<BoundService> all = new ArrayList<>();
            byLabel.values().forEach(all::addAll);
            log.debug("Found {} bound services", all.size());
            return new VcapServiceBindings(all);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot parse " + VCAP_SERVICES_ENV, e);
        }
    }

    @Override
    public Optional<CredentialSet> findService(Pattern filter, String... requiredCredentials) {
        List<BoundService> matching = matching(filter, requiredCredentials);
        if (matching.size() != 1) {
            return Optional.empty();
        }
        return Optional.of(CredentialSet.of(matching.get(0).credentials()));
    }

    @Override
    public int countMatchingServices(Pattern filter, String... requiredCredentials) {
        return matching(filter, requiredCredentials).size();
    }

    public List<BoundService> getServices() {
        return services;
    }

    private List<BoundService> matching(Pattern filter, String... requiredCredentials) {
        return services.stream()
                .filter(s -> s.matches(filter))
                .filter(s -> s.hasCredentials(requiredCredentials))
                .collect(Collectors.toList());
    }
}
