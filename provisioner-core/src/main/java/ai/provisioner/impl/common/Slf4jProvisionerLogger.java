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
package ai.provisioner.impl.common;

import ai.provisioner.api.runtime.ProvisionerLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Slf4jProvisionerLogger implements ProvisionerLogger {

    private final org.slf4j.Logger log;

    public Slf4jProvisionerLogger(Logger log) {
        this.log = log;
    }

    public static ProvisionerLogger forClass(Class<?> clazz) {
        return new Slf4jProvisionerLogger(LoggerFactory.getLogger(clazz));
    }

    @Override
    public void log(Object message) {
        if (message != null) {
            log.info(message.toString());
        }
    }

    @Override
    public void error(Object message) {
        if (message != null) {
            log.error(message.toString());
        }
    }

    @Override
    public boolean isDebugEnabled() {
        return log.isDebugEnabled();
    }

    @Override
    public void debug(Object message) {
        if (message != null) {
            log.debug(message.toString());
        }
    }
}
