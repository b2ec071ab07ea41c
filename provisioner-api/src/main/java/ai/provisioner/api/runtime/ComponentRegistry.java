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

import java.util.List;
import java.util.ServiceLoader;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class ComponentRegistry {

    public List<FrameworkComponentProvider> lookupAvailableComponents() {
        ServiceLoader<FrameworkComponentProvider> loader =
                ServiceLoader.load(FrameworkComponentProvider.class);
        return loader.stream().map(p -> p.get()).collect(Collectors.toList());
    }

    public FrameworkComponentProvider lookupComponent(String componentId) {
        log.info("Looking for an implementation of component {}", componentId);
        ServiceLoader<FrameworkComponentProvider> loader =
                ServiceLoader.load(FrameworkComponentProvider.class);
        ServiceLoader.Provider<FrameworkComponentProvider> provider =
                loader.stream()
                        .filter(p -> componentId.equals(p.get().getComponentId()))
                        .findFirst()
                        .orElseThrow(
                                () ->
                                        new IllegalArgumentException(
                                                "No FrameworkComponentProvider found for component "
                                                        + componentId));
        return provider.get();
    }

    public List<FrameworkComponent> createComponents(ProvisioningContext context) {
        return lookupAvailableComponents().stream()
                .map(p -> p.createComponent(context))
                .collect(Collectors.toList());
    }
}
