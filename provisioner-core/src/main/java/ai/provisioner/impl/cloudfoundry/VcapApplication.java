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

import ai.provisioner.api.model.ApplicationDetails;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/** Reads the {@code VCAP_APPLICATION} document. */
public class VcapApplication {

    public static final String VCAP_APPLICATION_ENV = "VCAP_APPLICATION";

    private static final ObjectMapper MAPPER =
            new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public static ApplicationDetails parse(String vcapApplication) {
        if (vcapApplication == null || vcapApplication.isBlank()) {
            return ApplicationDetails.UNKNOWN;
        }
        try {
            return MAPPER.readValue(vcapApplication, ApplicationDetails.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot parse " + VCAP_APPLICATION_ENV, e);
        }
    }
}
